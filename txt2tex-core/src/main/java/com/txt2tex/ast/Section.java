package com.txt2tex.ast;

import java.util.List;

public record Section(
    int line,
    int column,
    String title,
    List<DocumentItem> items
) implements DocumentItem {
    @Override
    public String type() {
        return "Section";
    }
}
