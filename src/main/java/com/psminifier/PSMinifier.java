package com.psminifier;

import com.psminifier.ast.ScriptBody;
import com.psminifier.ast.SyntaxTreeReader;
import com.psminifier.batch.MinifySummary;
import com.psminifier.batch.SyntaxTreeSource;
import com.psminifier.batch.WorkspaceMinifier;
import com.psminifier.compress.AliasProvider;
import com.psminifier.compress.AliasTable;
import com.psminifier.compress.CompressionSession;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(name = "psminifier", mixinStandardHelpOptions = true, version = "1.0",
         description = "Minify PowerShell scripts from their exported syntax trees")
public class PSMinifier implements Callable<Integer> {
    @Parameters(index = "0", description = "A script (.ps1 with a sibling .ast.json), a syntax tree (.json), or a directory of scripts")
    private Path input;

    @Option(names = {"-i", "--include"}, split = ";", description = "File-name globs to minify, ';'-separated (directory mode)")
    private List<String> include = new ArrayList<>();

    @Option(names = {"-x", "--exclude"}, split = ";", description = "File-name globs to skip, ';'-separated (directory mode)")
    private List<String> exclude = new ArrayList<>();

    @Option(names = {"-z", "--gzip"}, description = "Emit a self-decoding GZip/Base64 script block")
    private boolean gzip = false;

    @Option(names = "--no-block", description = "Keep the Base64 payload on one line (requires --gzip)")
    private boolean noBlock = false;

    @Option(names = "--dot-source", description = "Dot-source the result so it runs in the caller's scope")
    private boolean dotSource = false;

    @Option(names = {"-n", "--name"}, description = "Bind the result to this variable")
    private String name;

    @Option(names = "--anonymous", description = "Do not bind the result, even when --name is given")
    private boolean anonymous = false;

    @Option(names = "--first-variable-name", defaultValue = MinifierOptions.DEFAULT_FIRST_VARIABLE_NAME,
            description = "First generated variable name (default: ${DEFAULT-VALUE})")
    private String firstVariableName;

    @Option(names = "--alias-table", description = "JSON alias table to use instead of the built-in one")
    private Path aliasTable;

    @Option(names = {"-o", "--output"}, description = "Write the minified script here instead of stdout (single file)")
    private Path output;

    @Option(names = "--pass-thru", description = "Print the path of each written file")
    private boolean passThru = false;

    private final PrintWriter out;
    private final PrintWriter err;

    public PSMinifier() {
        this(new PrintWriter(System.out, true), new PrintWriter(System.err, true));
    }

    PSMinifier(PrintWriter out, PrintWriter err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PSMinifier()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            AliasProvider aliases = aliasTable != null ? AliasTable.load(aliasTable) : AliasTable.defaults();
            Minifier minifier = new Minifier(aliases);
            MinifierOptions options = new MinifierOptions(name, anonymous, gzip, dotSource, noBlock,
                    firstVariableName, null, passThru, CompressionSession.DEFAULT_MAX_DEPTH);

            if (Files.isDirectory(input)) {
                return minifyDirectory(minifier, options);
            }
            return minifyFile(minifier, options.withOutputPath(output));
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private int minifyDirectory(Minifier minifier, MinifierOptions options) throws Exception {
        MinifySummary summary = new WorkspaceMinifier(minifier, SyntaxTreeSource.siblingJson())
                .minify(input, options, include, exclude);
        for (MinifySummary.FileOutcome file : summary.files()) {
            if (file.failed()) {
                err.println("Error: " + file.source().getFileName() + ": " + file.error());
            } else if (passThru) {
                out.println(file.output());
            }
        }
        out.printf(Locale.ROOT, "OriginalSize=%d MinifiedSize=%d MinifiedPercent=%.4f%n",
                summary.originalSize(), summary.minifiedSize(), summary.minifiedPercent());
        return summary.hasFailures() ? 1 : 0;
    }

    private int minifyFile(Minifier minifier, MinifierOptions options) throws Exception {
        ScriptBody tree = input.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")
                ? new SyntaxTreeReader().read(input)
                : SyntaxTreeSource.siblingJson().load(input);
        MinifyResult result = minifier.compress(tree, options);
        if (result instanceof MinifyResult.Script script) {
            out.println(script.text());
        } else if (result instanceof MinifyResult.Written written && passThru) {
            out.println(written.path());
        }
        return 0;
    }
}
