package com.txt2tex.ast;

import java.util.List;

public record Zed(
    int line,
    int column,
    List<DocumentItem> items
) implements DocumentItem {
    @Override
    public String type() {
        return "Zed";
    }
}
