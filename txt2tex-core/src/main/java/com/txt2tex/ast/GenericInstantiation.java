package com.txt2tex.ast;

import java.util.List;

public record GenericInstantiation(
    int line,
    int column,
    Expr base,
    List<Expr> typeParams
) implements Expr {
    @Override
    public String type() {
        return "GenericInstantiation";
    }
}
