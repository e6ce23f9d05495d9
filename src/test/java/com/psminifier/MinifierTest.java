package com.psminifier;

import com.psminifier.ast.Expression;
import com.psminifier.ast.LoopKind;
import com.psminifier.ast.ScriptBody;
import com.psminifier.ast.Statement;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import static com.psminifier.ast.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

public class MinifierTest {

    private final Minifier minifier = new Minifier();

    private String text(ScriptBody tree, MinifierOptions options) throws IOException {
        MinifyResult result = minifier.compress(tree, options);
        assertTrue(result instanceof MinifyResult.Script);
        return ((MinifyResult.Script) result).text();
    }

    /**
     * A small but realistic script: parameters, a loop, a pipeline and string interpolation.
     */
    private static ScriptBody sampleScript() {
        Expression.ExpandableString message = new Expression.ExpandableString("\"Found $count files\"",
                Lists.mutable.with(new Expression.NestedExpression(variable("count"), 7, 6)));
        Statement.Loop loop = new Statement.Loop(
                "foreach ($file in $files) {\n    $count = $count + 1\n}", LoopKind.FOR_EACH, null,
                variable("file"), null, value(variable("files")), null,
                block(assign(variable("count"), "=", binary(variable("count"), "+", number("1")))));
        MutableList<Statement> statements = Lists.mutable.with(
                assign("files", new Expression.Paren("(Get-ChildItem -Path .)",
                        command("Get-ChildItem", new Expression.CommandParameter("-Path", "Path", null), bareword(".")))),
                assign("count", number("0")),
                loop,
                command("Write-Output", message));
        String source = "$files = (Get-ChildItem -Path .)\n"
                + "$count = 0\n"
                + loop.text() + "\n"
                + "Write-Output \"Found $count files\"\n";
        return ScriptBody.of(source, statements);
    }

    @Test
    public void testSampleScript() throws IOException {
        String result = text(sampleScript(), MinifierOptions.defaults());

        assertEquals("$a=(dir -Path .);$b=0;foreach($file in $a){$b=$b+1};echo \"Found $b files\"", result);
    }

    @Test
    public void testMinifiedIsNeverLonger() throws IOException {
        ScriptBody tree = sampleScript();

        assertTrue(text(tree, MinifierOptions.defaults()).length() <= tree.text().length());
    }

    @Test
    public void testSemanticCorpus() {
        assertEquals("$a=0", minifier.minify(script(assign("x", number("0"))), "a"));
        assertEquals("$MyVar", minifier.minify(script(expression(variable("MyVar"))), "a"));
        assertEquals("echo \"Hello\"", minifier.minify(script(command("Write-Output", string("\"Hello\""))), "a"));

        Expression.ExpandableString foo = new Expression.ExpandableString("\"$Foo bar\"",
                Lists.mutable.with(new Expression.NestedExpression(variable("Foo"), 1, 4)));
        assertEquals("\"$Foo bar\"", minifier.minify(script(expression(foo)), "a"));
    }

    @Test
    public void testTryCatchFinallyAndHashtablesHaveNoNewlines() {
        Expression.Hashtable table = new Expression.Hashtable("@{\n    Id = 1\n    Name = 'n'\n}", false,
                Lists.mutable.with(
                        new Expression.KeyValue(bareword("Id"), value(number("1"))),
                        new Expression.KeyValue(bareword("Name"), value(string("'n'")))));
        Expression.Convert ordered = new Expression.Convert("[Ordered]" + table.text(), "Ordered", table);
        Statement.TryCatchFinally statement = new Statement.TryCatchFinally(
                "try {\n    $h = " + ordered.text() + "\n} catch {\n    throw $_\n} finally {\n    'done'\n}",
                block(assign("h", ordered)),
                Lists.mutable.with(new Statement.CatchClause(Lists.mutable.empty(),
                        block(new Statement.Flow("throw $_", "throw", value(variable("_")), null)))),
                block(expression(string("'done'"))));

        String result = minifier.minify(script(statement), "a");

        assertEquals("try{$a=[Ordered]@{Id=1;Name='n'}}catch{throw $_}finally{'done'}", result);
        assertFalse(result.contains("\n"));
    }

    @Test
    public void testCustomFirstVariableName() throws IOException {
        ScriptBody tree = script(assign("count", number("1")), assign("total", number("2")));

        assertEquals("$x=1;$y=2", text(tree, MinifierOptions.defaults().withFirstVariableName("x")));
    }

    @Test
    public void testGzipIsShorterForRepetitiveScripts() throws IOException {
        MutableList<Statement> statements = Lists.mutable.empty();
        for (int i = 0; i < 40; i++) {
            statements.add(command("Write-Output", string("\"Processing the next item in the queue\"")));
        }
        ScriptBody tree = ScriptBody.of(statements.collect(Statement::text).makeString("\n"), statements);

        String plain = text(tree, MinifierOptions.defaults());
        String gzipped = text(tree, MinifierOptions.defaults().withGzip(true));

        assertTrue(plain.length() >= 200);
        assertTrue(gzipped.length() < plain.length());
    }

    @Test
    public void testNoBlockRequiresGzip() {
        assertThrows(IllegalArgumentException.class, () -> MinifierOptions.defaults().withNoBlock(true));
        assertTrue(MinifierOptions.defaults().withGzip(true).withNoBlock(true).noBlock());
    }

    @Test
    public void testBindingName() throws IOException {
        ScriptBody tree = script(assign("x", number("0")));

        assertEquals("$Init={$a=0}", text(tree, MinifierOptions.defaults().withName("Init")));
        assertEquals("$a=0", text(tree, MinifierOptions.defaults().withName("Init").withAnonymous(true)));
        assertEquals(". {$a=0}", text(tree, MinifierOptions.defaults().withDotSource(true)));
    }

    @Test
    public void testWritesOutputFile(@TempDir Path dir) throws IOException {
        Path output = dir.resolve("nested").resolve("script.min.ps1");
        MinifyResult result = minifier.compress(script(command("Write-Output", string("'ü'"))),
                MinifierOptions.defaults().withOutputPath(output));

        assertEquals(new MinifyResult.Written(output, "echo 'ü'".getBytes(StandardCharsets.UTF_8).length), result);
        byte[] bytes = Files.readAllBytes(output);
        assertEquals("echo 'ü'", new String(bytes, StandardCharsets.UTF_8));
        assertNotEquals((byte) 0xEF, bytes[0]);
    }

    @Test
    public void testPassThruDoesNotChangeTheResult(@TempDir Path dir) throws IOException {
        Path output = dir.resolve("script.min.ps1");
        ScriptBody tree = script(assign("x", number("1")));

        MinifyResult quiet = minifier.compress(tree, MinifierOptions.defaults().withOutputPath(output));
        MinifyResult loud = minifier.compress(tree, MinifierOptions.defaults().withOutputPath(output).withPassThru(true));

        assertEquals(new MinifyResult.Written(output, 4), quiet);
        assertEquals(quiet, loud);
    }

    @Test
    public void testFailedWriteLeavesNoFile(@TempDir Path dir) throws IOException {
        Path output = dir.resolve("taken.ps1");
        Files.createDirectories(output);
        Files.writeString(output.resolve("keep.txt"), "x");

        assertThrows(IOException.class, () -> minifier.compress(script(assign("x", number("0"))),
                MinifierOptions.defaults().withOutputPath(output)));
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(List.of(output), files.toList());
        }
    }

    @Test
    public void testConcurrentInvocationsAreIndependent() throws Exception {
        ScriptBody tree = sampleScript();
        String expected = minifier.minify(tree, "a");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            MutableList<Callable<String>> tasks = Lists.mutable.empty();
            for (int i = 0; i < 64; i++) {
                tasks.add(() -> minifier.minify(tree, "a"));
            }
            for (Future<String> future : pool.invokeAll(tasks)) {
                assertEquals(expected, future.get());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
