package com.txt2tex.ast;

import java.util.List;

public record AxDef(
    int line,
    int column,
    List<String> genericParams,
    List<Declaration> declarations,
    List<List<Expr>> predicates
) implements DocumentItem {
    @Override
    public String type() {
        return "AxDef";
    }
}
