package com.txt2tex.ast;

import java.util.List;

public record InfruleBlock(
    int line,
    int column,
    List<InfruleLine> premises,
    InfruleLine conclusion
) implements DocumentItem {
    @Override
    public String type() {
        return "InfruleBlock";
    }
}
