package com.txt2tex.ast;

public record InfruleLine(
    int line,
    int column,
    Expr expression,
    String label
) implements Node {
    @Override
    public String type() {
        return "InfruleLine";
    }
}
