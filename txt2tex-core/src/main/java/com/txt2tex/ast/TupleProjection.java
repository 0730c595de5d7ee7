package com.txt2tex.ast;

/**
 * {@code base.1} or {@code base.field}. Exactly one of {@code index} and
 * {@code field} is non-null.
 */
public record TupleProjection(
    int line,
    int column,
    Expr base,
    Integer index,
    String field
) implements Expr {
    public boolean named() {
        return field != null;
    }

    @Override
    public String type() {
        return "TupleProjection";
    }
}
