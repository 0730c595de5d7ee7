package com.txt2tex.ast;

/**
 * One {@code expression if guard} line of a {@link GuardedCases}.
 */
public record GuardedBranch(
    int line,
    int column,
    Expr expression,
    Expr guard
) implements Expr {
    @Override
    public String type() {
        return "GuardedBranch";
    }
}
