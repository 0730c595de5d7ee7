package com.txt2tex.ast;

public record Subscript(
    int line,
    int column,
    Expr base,
    Expr index
) implements Expr {
    @Override
    public String type() {
        return "Subscript";
    }
}
