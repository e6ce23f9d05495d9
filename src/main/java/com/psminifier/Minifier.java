package com.psminifier;

import com.psminifier.ast.ScriptBody;
import com.psminifier.compress.AliasProvider;
import com.psminifier.compress.AliasTable;
import com.psminifier.compress.CompressionSession;
import com.psminifier.output.OutputEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Minifies one PowerShell syntax tree. Instances hold no per-invocation state and may be shared
 * between threads; every call opens its own {@link CompressionSession}.
 */
public class Minifier {

    private static final Logger log = LoggerFactory.getLogger(Minifier.class);

    private final AliasProvider aliases;

    public Minifier() {
        this(AliasTable.defaults());
    }

    public Minifier(AliasProvider aliases) {
        this.aliases = aliases;
    }

    /**
     * Compresses {@code tree}, encodes it according to {@code options} and either returns the text
     * or writes it to {@link MinifierOptions#outputPath()}.
     *
     * @throws IOException when the output file cannot be written; no partial file is left behind
     */
    public MinifyResult compress(ScriptBody tree, MinifierOptions options) throws IOException {
        CompressionSession session = CompressionSession.open(tree, options.firstVariableName(), aliases,
                options.maxDepth());
        String minified = session.compress(tree);
        log.debug("Compressed {} chars to {} chars, {} variables renamed",
                tree.text().length(), minified.length(), session.variables().renames().size());

        String encoded = new OutputEncoder(options.gzip(), options.noBlock(), options.dotSource(),
                options.name(), options.anonymous()).encode(minified);

        if (options.outputPath() == null) {
            return new MinifyResult.Script(encoded);
        }
        byte[] bytes = encoded.getBytes(StandardCharsets.UTF_8);
        write(options.outputPath(), bytes);
        log.debug("Wrote {} bytes to {}", bytes.length, options.outputPath());
        return new MinifyResult.Written(options.outputPath(), bytes.length);
    }

    /**
     * Compresses {@code tree} without any output encoding.
     */
    public String minify(ScriptBody tree, String firstVariableName) {
        return CompressionSession.open(tree, firstVariableName, aliases, CompressionSession.DEFAULT_MAX_DEPTH)
                .compress(tree);
    }

    private static void write(Path target, byte[] bytes) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path directory = absolute.getParent();
        if (directory != null) {
            Files.createDirectories(directory);
        }
        Path temp = Files.createTempFile(directory, absolute.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, bytes);
            Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
