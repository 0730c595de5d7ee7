package com.txt2tex.ast;

/**
 * Table of contents request. {@code depth} is empty, {@code full} or a level number.
 */
public record Contents(
    int line,
    int column,
    String depth
) implements DocumentItem {
    @Override
    public String type() {
        return "Contents";
    }
}
