package com.psminifier.batch;

import com.psminifier.ast.ScriptBody;
import com.psminifier.ast.SyntaxTreeReader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Supplies the parsed syntax tree of a script file.
 */
@FunctionalInterface
public interface SyntaxTreeSource {

    String TREE_SUFFIX = ".ast.json";

    ScriptBody load(Path script) throws IOException;

    /**
     * Reads the tree the host parser exported next to the script, {@code <script>.ast.json}.
     */
    static SyntaxTreeSource siblingJson() {
        SyntaxTreeReader reader = new SyntaxTreeReader();
        return script -> {
            Path tree = treeFileOf(script);
            if (!Files.isRegularFile(tree)) {
                throw new NoSuchFileException(tree.toString(), null, "no exported syntax tree for " + script.getFileName());
            }
            return reader.read(tree);
        };
    }

    static Path treeFileOf(Path script) {
        return script.resolveSibling(script.getFileName() + TREE_SUFFIX);
    }
}
