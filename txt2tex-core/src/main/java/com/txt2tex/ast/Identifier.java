package com.txt2tex.ast;

public record Identifier(
    int line,
    int column,
    String name
) implements Expr {
    @Override
    public String type() {
        return "Identifier";
    }
}
