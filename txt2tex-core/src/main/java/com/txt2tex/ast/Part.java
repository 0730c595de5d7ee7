package com.txt2tex.ast;

import java.util.List;

public record Part(
    int line,
    int column,
    String label,
    List<DocumentItem> items
) implements DocumentItem {
    @Override
    public String type() {
        return "Part";
    }
}
