package com.txt2tex.ast;

public record Superscript(
    int line,
    int column,
    Expr base,
    Expr exponent
) implements Expr {
    @Override
    public String type() {
        return "Superscript";
    }
}
