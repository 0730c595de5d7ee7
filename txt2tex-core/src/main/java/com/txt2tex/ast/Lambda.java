package com.txt2tex.ast;

import java.util.List;

public record Lambda(
    int line,
    int column,
    List<String> variables,
    Expr domain,
    Expr body
) implements Expr {
    @Override
    public String type() {
        return "Lambda";
    }
}
