package com.txt2tex.ast;

import java.util.List;

public record SyntaxDefinition(
    int line,
    int column,
    String name,
    List<FreeBranch> branches
) implements Node {
    @Override
    public String type() {
        return "SyntaxDefinition";
    }
}
