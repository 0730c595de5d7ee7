package com.txt2tex.ast;

import java.util.List;

public record FreeType(
    int line,
    int column,
    String name,
    List<FreeBranch> branches
) implements DocumentItem {
    @Override
    public String type() {
        return "FreeType";
    }
}
