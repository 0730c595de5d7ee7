package com.txt2tex.ast;

/**
 * Numeric literal; the digits are kept as written.
 */
public record NumberLiteral(
    int line,
    int column,
    String value
) implements Expr {
    @Override
    public String type() {
        return "NumberLiteral";
    }
}
