package com.psminifier;

import com.psminifier.compress.CompressionSession;

import java.nio.file.Path;

/**
 * Options for one {@link Minifier#compress} invocation.
 *
 * @param name              variable the result is bound to, unless {@code anonymous}; may be null
 * @param anonymous         emit the result without a binding even when {@code name} is set
 * @param gzip              wrap the result in a self-decoding GZip/Base64 script block
 * @param dotSource         prefix the result with {@code . } so it runs in the caller's scope
 * @param noBlock           keep the Base64 payload on a single line; requires {@code gzip}
 * @param firstVariableName first generated short variable name
 * @param outputPath        file to write; when null the text is returned
 * @param passThru          ask the command line to print each written path; {@link Minifier#compress}
 *                          returns {@link MinifyResult.Written} for file output either way
 * @param maxDepth          syntax tree nesting limit
 */
public record MinifierOptions(String name, boolean anonymous, boolean gzip, boolean dotSource, boolean noBlock,
                              String firstVariableName, Path outputPath, boolean passThru, int maxDepth) {

    public static final String DEFAULT_FIRST_VARIABLE_NAME = "a";

    public MinifierOptions {
        if (noBlock && !gzip) {
            throw new IllegalArgumentException("noBlock can only be used together with gzip");
        }
        if (firstVariableName == null) {
            firstVariableName = DEFAULT_FIRST_VARIABLE_NAME;
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
    }

    public static MinifierOptions defaults() {
        return new MinifierOptions(null, false, false, false, false,
                DEFAULT_FIRST_VARIABLE_NAME, null, false, CompressionSession.DEFAULT_MAX_DEPTH);
    }

    public MinifierOptions withName(String name) {
        return new MinifierOptions(name, anonymous, gzip, dotSource, noBlock, firstVariableName, outputPath, passThru, maxDepth);
    }

    public MinifierOptions withAnonymous(boolean anonymous) {
        return new MinifierOptions(name, anonymous, gzip, dotSource, noBlock, firstVariableName, outputPath, passThru, maxDepth);
    }

    public MinifierOptions withGzip(boolean gzip) {
        return new MinifierOptions(name, anonymous, gzip, dotSource, noBlock, firstVariableName, outputPath, passThru, maxDepth);
    }

    public MinifierOptions withDotSource(boolean dotSource) {
        return new MinifierOptions(name, anonymous, gzip, dotSource, noBlock, firstVariableName, outputPath, passThru, maxDepth);
    }

    public MinifierOptions withNoBlock(boolean noBlock) {
        return new MinifierOptions(name, anonymous, gzip, dotSource, noBlock, firstVariableName, outputPath, passThru, maxDepth);
    }

    public MinifierOptions withFirstVariableName(String firstVariableName) {
        return new MinifierOptions(name, anonymous, gzip, dotSource, noBlock, firstVariableName, outputPath, passThru, maxDepth);
    }

    public MinifierOptions withOutputPath(Path outputPath) {
        return new MinifierOptions(name, anonymous, gzip, dotSource, noBlock, firstVariableName, outputPath, passThru, maxDepth);
    }

    public MinifierOptions withPassThru(boolean passThru) {
        return new MinifierOptions(name, anonymous, gzip, dotSource, noBlock, firstVariableName, outputPath, passThru, maxDepth);
    }

    public MinifierOptions withMaxDepth(int maxDepth) {
        return new MinifierOptions(name, anonymous, gzip, dotSource, noBlock, firstVariableName, outputPath, passThru, maxDepth);
    }
}
