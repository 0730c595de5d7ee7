package com.txt2tex.ast;

public record ArgueStep(
    int line,
    int column,
    String connective,
    Expr expression,
    String justification
) implements Node {
    @Override
    public String type() {
        return "ArgueStep";
    }
}
