package com.txt2tex.ast;

import java.util.List;

/**
 * A boxed schema. {@code name} is null for an anonymous schema; predicates are grouped
 * by blank lines or {@code also}.
 */
public record Schema(
    int line,
    int column,
    String name,
    List<String> genericParams,
    List<Declaration> declarations,
    List<List<Expr>> predicates
) implements DocumentItem {
    @Override
    public String type() {
        return "Schema";
    }
}
