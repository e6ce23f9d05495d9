package com.psminifier.compress;

/**
 * A fatal problem in the tree being compressed. Nothing is emitted for the invocation that raised it.
 */
public class CompressionException extends RuntimeException {

    public CompressionException(String message) {
        super(message);
    }
}
