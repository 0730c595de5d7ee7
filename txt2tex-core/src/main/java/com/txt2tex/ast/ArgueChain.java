package com.txt2tex.ast;

import java.util.List;

/**
 * Calculational chain opened by {@code ARGUE:} or {@code EQUIV:}; {@code keyword} records which.
 */
public record ArgueChain(
    int line,
    int column,
    String keyword,
    List<ArgueStep> steps
) implements DocumentItem {
    @Override
    public String type() {
        return "ArgueChain";
    }
}
