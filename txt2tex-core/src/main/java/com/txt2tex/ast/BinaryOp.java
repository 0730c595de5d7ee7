package com.txt2tex.ast;

/**
 * Infix operator application. {@code explicitParens} is true when the source
 * wrapped this operation in parentheses, whether or not precedence required it.
 * {@code lineBreakAfter} is true when a backslash continuation adjoins the operator.
 */
public record BinaryOp(
    int line,
    int column,
    String operator,
    Expr left,
    Expr right,
    boolean explicitParens,
    boolean lineBreakAfter
) implements Expr {
    public BinaryOp withExplicitParens() {
        return new BinaryOp(line, column, operator, left, right, true, lineBreakAfter);
    }

    @Override
    public String type() {
        return "BinaryOp";
    }
}
