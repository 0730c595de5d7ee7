package com.txt2tex.ast;

import java.util.List;

public record Abbreviation(
    int line,
    int column,
    String name,
    List<String> genericParams,
    Expr expression
) implements DocumentItem {
    @Override
    public String type() {
        return "Abbreviation";
    }
}
