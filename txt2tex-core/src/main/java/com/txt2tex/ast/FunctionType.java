package com.txt2tex.ast;

public record FunctionType(
    int line,
    int column,
    String arrow,
    Expr domain,
    Expr range
) implements Expr {
    @Override
    public String type() {
        return "FunctionType";
    }
}
