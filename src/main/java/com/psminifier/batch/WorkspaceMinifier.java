package com.psminifier.batch;

import com.psminifier.Minifier;
import com.psminifier.MinifierOptions;
import com.psminifier.MinifyResult;
import com.psminifier.ast.ScriptBody;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Locale;

/**
 * Minifies every {@code *.ps1} script directly inside a directory, writing each one next to its
 * source as {@code <name>.min.ps1}, or {@code <name>.min.gzip.ps1} for compressed output.
 * <p>
 * Already minified scripts ({@code *.min*.ps1}) are skipped. A script that fails is recorded in
 * the summary and the remaining scripts are still processed.
 */
public class WorkspaceMinifier {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceMinifier.class);

    private final Minifier minifier;
    private final SyntaxTreeSource trees;

    public WorkspaceMinifier(Minifier minifier, SyntaxTreeSource trees) {
        this.minifier = minifier;
        this.trees = trees;
    }

    /**
     * @param include file-name globs to keep; every script when empty
     * @param exclude file-name globs to drop, applied after {@code include}
     */
    public MinifySummary minify(Path directory, MinifierOptions options,
                                List<String> include, List<String> exclude) throws IOException {
        FileSystem fs = directory.getFileSystem();
        MutableList<PathMatcher> includes = Lists.mutable.withAll(include).collect(glob -> fs.getPathMatcher("glob:" + glob));
        MutableList<PathMatcher> excludes = Lists.mutable.withAll(exclude).collect(glob -> fs.getPathMatcher("glob:" + glob));

        MutableList<Path> scripts = Lists.mutable.empty();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(directory, "*.ps1")) {
            for (Path script : entries) {
                Path name = script.getFileName();
                if (!Files.isRegularFile(script) || isMinified(name)) {
                    continue;
                }
                if (!includes.isEmpty() && includes.noneSatisfy(matcher -> matcher.matches(name))) {
                    continue;
                }
                if (excludes.anySatisfy(matcher -> matcher.matches(name))) {
                    continue;
                }
                scripts.add(script);
            }
        }
        scripts.sortThisBy(Path::toString);
        log.debug("Found {} scripts to minify in {}", scripts.size(), directory);

        MutableList<MinifySummary.FileOutcome> outcomes = scripts.collect(script -> minifyOne(script, options));
        long original = outcomes.reject(MinifySummary.FileOutcome::failed).sumOfLong(MinifySummary.FileOutcome::originalSize);
        long minified = outcomes.reject(MinifySummary.FileOutcome::failed).sumOfLong(MinifySummary.FileOutcome::minifiedSize);
        return new MinifySummary(outcomes.toImmutable(), original, minified);
    }

    public static Path outputFileOf(Path script, boolean gzip) {
        String name = script.getFileName().toString();
        String base = name.substring(0, name.length() - ".ps1".length());
        return script.resolveSibling(base + (gzip ? ".min.gzip.ps1" : ".min.ps1"));
    }

    static boolean isMinified(Path fileName) {
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return name.contains(".min") && name.endsWith(".ps1");
    }

    private MinifySummary.FileOutcome minifyOne(Path script, MinifierOptions options) {
        Path output = outputFileOf(script, options.gzip());
        try {
            long originalSize = Files.size(script);
            ScriptBody tree = trees.load(script);
            MinifyResult result = minifier.compress(tree, options.withOutputPath(output));
            long minifiedSize = ((MinifyResult.Written) result).bytes();
            log.info("Minified {} -> {} ({} -> {} bytes)", script.getFileName(), output.getFileName(),
                    originalSize, minifiedSize);
            return MinifySummary.FileOutcome.minified(script, output, originalSize, minifiedSize);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to minify {}: {}", script, e.getMessage());
            return MinifySummary.FileOutcome.failed(script, e.getMessage() != null ? e.getMessage() : e.toString());
        }
    }
}
