package com.psminifier.ast;

public enum LoopKind {
    FOR_EACH,
    FOR,
    WHILE,
    DO_WHILE,
    DO_UNTIL
}
