package com.psminifier.ast;

/**
 * Raised when a tree breaks a structural invariant that cannot be papered over with raw text.
 */
public class MalformedSyntaxTreeException extends IllegalArgumentException {

    public MalformedSyntaxTreeException(String message) {
        super(message);
    }
}
