package com.txt2tex.ast;

public record RelationalImage(
    int line,
    int column,
    Expr relation,
    Expr set
) implements Expr {
    @Override
    public String type() {
        return "RelationalImage";
    }
}
