package com.psminifier.ast;

public enum FunctionKind {
    FUNCTION("function"),
    FILTER("filter"),
    WORKFLOW("workflow");

    private final String keyword;

    FunctionKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
