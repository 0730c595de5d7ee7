package com.txt2tex.ast;

import java.util.List;

public record Declaration(
    int line,
    int column,
    List<String> names,
    Expr typeExpr
) implements Node {
    @Override
    public String type() {
        return "Declaration";
    }
}
