package com.txt2tex.ast;

import java.util.List;

/**
 * {@code forall}, {@code exists}, {@code exists1} or {@code mu}.
 *
 * <p>{@code body} is always present: it holds the constraint when a bullet
 * expression follows, otherwise the whole predicate. {@code expression} is the
 * part after the bullet ({@code . e}), such as the value of a {@code mu}.
 * {@code tuplePattern} is set when the variables were bound as {@code (x, y)}.
 */
public record Quantifier(
    int line,
    int column,
    String kind,
    List<String> variables,
    Tuple tuplePattern,
    Expr domain,
    Expr body,
    Expr expression,
    boolean lineBreakAfterPipe
) implements Expr {
    @Override
    public String type() {
        return "Quantifier";
    }
}
