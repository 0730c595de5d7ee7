package com.txt2tex.ast;

import java.util.List;

public record GivenType(
    int line,
    int column,
    List<String> names
) implements DocumentItem {
    @Override
    public String type() {
        return "GivenType";
    }
}
