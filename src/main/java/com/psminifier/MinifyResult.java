package com.psminifier;

import java.nio.file.Path;

/**
 * Outcome of one minification: the script text itself, or the file it was written to.
 */
public sealed interface MinifyResult {

    record Script(String text) implements MinifyResult {
    }

    record Written(Path path, long bytes) implements MinifyResult {
    }
}
