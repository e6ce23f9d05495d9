package com.psminifier.batch;

import com.psminifier.Minifier;
import com.psminifier.MinifierOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class WorkspaceMinifierTest {

    private static final String ASSIGNMENT_SOURCE = "$message = 'hello'\n";
    private static final String ASSIGNMENT_TREE = """
            {"type": "ScriptBlock", "text": "$message = 'hello'\\n", "end": [
              {"type": "Assignment", "text": "$message = 'hello'", "operator": "=",
               "left": {"type": "Variable", "text": "$message", "name": "message"},
               "right": {"type": "CommandExpression", "text": "'hello'",
                         "expression": {"type": "Constant", "text": "'hello'"}}}
            ]}
            """;

    private final WorkspaceMinifier workspace = new WorkspaceMinifier(new Minifier(), SyntaxTreeSource.siblingJson());

    private static Path script(Path dir, String name) throws IOException {
        Path script = dir.resolve(name);
        Files.writeString(script, ASSIGNMENT_SOURCE);
        Files.writeString(SyntaxTreeSource.treeFileOf(script), ASSIGNMENT_TREE);
        return script;
    }

    @Test
    public void testMinifiesEveryScript(@TempDir Path dir) throws IOException {
        script(dir, "one.ps1");
        script(dir, "two.ps1");
        script(dir, "one.min.ps1");
        Files.createDirectories(dir.resolve("sub"));
        script(dir.resolve("sub"), "deep.ps1");

        MinifySummary summary = workspace.minify(dir, MinifierOptions.defaults(), List.of(), List.of());

        assertEquals(2, summary.files().size());
        assertFalse(summary.hasFailures());
        assertEquals("$a='hello'", Files.readString(dir.resolve("one.min.ps1")));
        assertEquals("$a='hello'", Files.readString(dir.resolve("two.min.ps1")));
        assertFalse(Files.exists(dir.resolve("sub").resolve("deep.min.ps1")));
        assertEquals(2L * ASSIGNMENT_SOURCE.length(), summary.originalSize());
        assertEquals(2L * "$a='hello'".length(), summary.minifiedSize());
        assertEquals((double) summary.minifiedSize() / summary.originalSize(), summary.minifiedPercent(), 1e-9);
    }

    @Test
    public void testIncludeAndExclude(@TempDir Path dir) throws IOException {
        script(dir, "Build.ps1");
        script(dir, "Build.Tests.ps1");
        script(dir, "Deploy.ps1");

        MinifySummary summary = workspace.minify(dir, MinifierOptions.defaults(),
                List.of("Build*"), List.of("*.Tests.ps1"));

        assertEquals(1, summary.files().size());
        assertEquals(dir.resolve("Build.ps1"), summary.files().getFirst().source());
    }

    @Test
    public void testGzipOutputName(@TempDir Path dir) throws IOException {
        script(dir, "tool.ps1");

        MinifySummary summary = workspace.minify(dir, MinifierOptions.defaults().withGzip(true), List.of(), List.of());

        Path output = dir.resolve("tool.min.gzip.ps1");
        assertEquals(output, summary.files().getFirst().output());
        assertTrue(Files.readString(output).startsWith("([ScriptBlock]::Create("));
    }

    @Test
    public void testFailureDoesNotStopOtherScripts(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("broken.ps1"), "$x =");
        script(dir, "fine.ps1");

        MinifySummary summary = workspace.minify(dir, MinifierOptions.defaults(), List.of(), List.of());

        assertTrue(summary.hasFailures());
        assertEquals(1, summary.failures().size());
        assertEquals(dir.resolve("broken.ps1"), summary.failures().getFirst().source());
        assertTrue(Files.exists(dir.resolve("fine.min.ps1")));
        assertEquals(ASSIGNMENT_SOURCE.length(), summary.originalSize());
    }

    @Test
    public void testEmptyWorkspace(@TempDir Path dir) throws IOException {
        MinifySummary summary = workspace.minify(dir, MinifierOptions.defaults(), List.of(), List.of());

        assertTrue(summary.files().isEmpty());
        assertEquals(0, summary.minifiedPercent());
    }

    @Test
    public void testOutputFileNames() {
        Path script = Path.of("dir", "Module.ps1");

        assertEquals(Path.of("dir", "Module.min.ps1"), WorkspaceMinifier.outputFileOf(script, false));
        assertEquals(Path.of("dir", "Module.min.gzip.ps1"), WorkspaceMinifier.outputFileOf(script, true));
        assertTrue(WorkspaceMinifier.isMinified(Path.of("Module.min.gzip.ps1")));
        assertFalse(WorkspaceMinifier.isMinified(Path.of("Admin.ps1")));
    }
}
