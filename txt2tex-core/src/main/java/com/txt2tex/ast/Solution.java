package com.txt2tex.ast;

import java.util.List;

public record Solution(
    int line,
    int column,
    String number,
    List<DocumentItem> items
) implements DocumentItem {
    @Override
    public String type() {
        return "Solution";
    }
}
