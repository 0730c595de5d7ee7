package com.txt2tex.ast;

import java.util.List;

public record BagLiteral(
    int line,
    int column,
    List<Expr> elements
) implements Expr {
    @Override
    public String type() {
        return "BagLiteral";
    }
}
