package com.txt2tex.ast;

public record Conditional(
    int line,
    int column,
    Expr condition,
    Expr thenExpr,
    Expr elseExpr
) implements Expr {
    @Override
    public String type() {
        return "Conditional";
    }
}
