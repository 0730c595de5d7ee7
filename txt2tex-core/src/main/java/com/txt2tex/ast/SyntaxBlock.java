package com.txt2tex.ast;

import java.util.List;

public record SyntaxBlock(
    int line,
    int column,
    List<List<SyntaxDefinition>> groups
) implements DocumentItem {
    @Override
    public String type() {
        return "SyntaxBlock";
    }
}
