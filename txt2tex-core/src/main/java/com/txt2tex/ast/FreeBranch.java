package com.txt2tex.ast;

/**
 * Constructor of a free type; {@code parameters} is null for a constant.
 */
public record FreeBranch(
    int line,
    int column,
    String name,
    Expr parameters
) implements Node {
    @Override
    public String type() {
        return "FreeBranch";
    }
}
