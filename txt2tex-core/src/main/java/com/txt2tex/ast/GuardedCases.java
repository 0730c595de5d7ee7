package com.txt2tex.ast;

import java.util.List;

public record GuardedCases(
    int line,
    int column,
    List<GuardedBranch> branches
) implements Expr {
    @Override
    public String type() {
        return "GuardedCases";
    }
}
