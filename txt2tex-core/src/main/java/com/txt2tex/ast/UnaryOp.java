package com.txt2tex.ast;

/**
 * Prefix ({@code lnot - # dom ran inv id bigcup bigcap}) or postfix ({@code ~ + *}) operator.
 * The operator spelling tells the two apart: no spelling is used in both positions.
 */
public record UnaryOp(
    int line,
    int column,
    String operator,
    Expr operand
) implements Expr {
    @Override
    public String type() {
        return "UnaryOp";
    }
}
