package com.txt2tex.ast;

import java.util.List;

/**
 * {@code { x : T | predicate . expression }}. Domain, predicate and expression are each optional.
 */
public record SetComprehension(
    int line,
    int column,
    List<String> variables,
    Tuple tuplePattern,
    Expr domain,
    Expr predicate,
    Expr expression
) implements Expr {
    @Override
    public String type() {
        return "SetComprehension";
    }
}
