package com.txt2tex.ast;

import java.util.List;

/**
 * Application, either {@code f(a, b)} or juxtaposed {@code f a}. Juxtaposition is curried:
 * {@code f x y} nests as {@code (f x) y}.
 */
public record FunctionApp(
    int line,
    int column,
    Expr function,
    List<Expr> args
) implements Expr {
    @Override
    public String type() {
        return "FunctionApp";
    }
}
