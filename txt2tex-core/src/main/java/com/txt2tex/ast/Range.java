package com.txt2tex.ast;

public record Range(
    int line,
    int column,
    Expr start,
    Expr end
) implements Expr {
    @Override
    public String type() {
        return "Range";
    }
}
