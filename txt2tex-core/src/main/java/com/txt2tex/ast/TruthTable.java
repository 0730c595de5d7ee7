package com.txt2tex.ast;

import java.util.List;

public record TruthTable(
    int line,
    int column,
    List<String> headers,
    List<List<String>> rows
) implements DocumentItem {
    @Override
    public String type() {
        return "TruthTable";
    }
}
