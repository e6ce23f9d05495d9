package com.psminifier.compress;

import com.psminifier.ast.Expression;
import com.psminifier.ast.ScriptBody;
import com.psminifier.ast.Statement;
import org.junit.jupiter.api.Test;
import org.eclipse.collections.impl.factory.Lists;

import static com.psminifier.ast.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

public class ExpressionCompressorTest {

    private static String compress(Statement... statements) {
        ScriptBody tree = script(statements);
        return CompressionSession.open(tree, "a", AliasTable.defaults(), CompressionSession.DEFAULT_MAX_DEPTH)
                .compress(tree);
    }

    private static String compress(Expression expression) {
        return compress(expression(expression));
    }

    @Test
    public void testBinarySpacing() {
        assertEquals("$x -eq 1", compress(binary(variable("x"), "-eq", number("1"))));
        assertEquals("2*3", compress(binary(number("2"), "*", number("3"))));
        assertEquals("'a'+'b'", compress(binary(string("'a'"), "+", string("'b'"))));
    }

    @Test
    public void testNegativeOperandKeepsSpace() {
        Expression.Unary negative = new Expression.Unary("-1", "-", number("1"), false);

        assertEquals("1 - -1", compress(binary(number("1"), "-", negative)));
    }

    @Test
    public void testUnaryOperators() {
        assertEquals("!$x", compress(new Expression.Unary("!$x", "!", variable("x"), false)));
        assertEquals("-not 1", compress(new Expression.Unary("-not 1", "-not", number("1"), false)));
        assertEquals("-not$x", compress(new Expression.Unary("-not $x", "-not", variable("x"), false)));
        assertEquals("$i++", compress(new Expression.Unary("$i++", "++", variable("i"), true)));
    }

    @Test
    public void testStaticMethodCall() {
        Expression.Member pow = new Expression.Member("[Math]::Pow(2, 3)", new Expression.TypeLiteral("[Math]", "Math"),
                bareword("Pow"), true, true, Lists.mutable.with(number("2"), number("3")));

        assertEquals("[Math]::Pow(2,3)", compress(pow));
    }

    @Test
    public void testMemberNameIsNotAliased() {
        Expression.Member member = new Expression.Member("$obj.Where", variable("obj"), bareword("Where"),
                false, false, Lists.mutable.empty());

        assertEquals("$obj.Where", compress(member));
    }

    @Test
    public void testMethodArgumentsAreRenamed() {
        Expression.Member call = new Expression.Member("$list.Add($item)", variable("list"), bareword("Add"),
                true, false, Lists.mutable.with(variable("item")));

        assertEquals("$a=1;$b=2;$a.Add($b)",
                compress(assign("list", number("1")), assign("item", number("2")), expression(call)));
    }

    @Test
    public void testExpandableStringSplicesRenamedVariables() {
        Expression.ExpandableString greeting = new Expression.ExpandableString("\"Hello $name, $name!\"",
                Lists.mutable.with(
                        new Expression.NestedExpression(variable("name"), 14, 5),
                        new Expression.NestedExpression(variable("name"), 7, 5)));

        assertEquals("$a='World';\"Hello $a, $a!\"", compress(assign("name", string("'World'")), expression(greeting)));
    }

    @Test
    public void testUninitializedVariableInStringIsUnchanged() {
        Expression.ExpandableString text = new Expression.ExpandableString("\"$Foo bar\"",
                Lists.mutable.with(new Expression.NestedExpression(variable("Foo"), 1, 4)));

        assertEquals("\"$Foo bar\"", compress(text));
    }

    @Test
    public void testStringSplicingRecoversFromBadOffsets() {
        Expression.ExpandableString shifted = new Expression.ExpandableString("\"x=$x\"",
                Lists.mutable.with(new Expression.NestedExpression(variable("x"), 0, 2)));
        Expression.ExpandableString missing = new Expression.ExpandableString("\"x=$x\"",
                Lists.mutable.with(new Expression.NestedExpression(variable("gone"), 3, 5)));

        assertEquals("$a=1;$b=2;\"x=$a\";\"x=$x\"", compress(
                assign("x", number("1")), assign("gone", number("2")), expression(shifted), expression(missing)));
    }

    @Test
    public void testEscapedVariableInStringIsNotSpliced() {
        Expression.ExpandableString text = new Expression.ExpandableString("\"`$x is $x, ``$x\"",
                Lists.mutable.with(
                        new Expression.NestedExpression(variable("x"), -1, 2),
                        new Expression.NestedExpression(variable("x"), -1, 2)));

        assertEquals("$a=1;\"`$x is $a, ``$a\"", compress(assign("x", number("1")), expression(text)));
    }

    @Test
    public void testStringContentsAreNeverRewritten() {
        Expression.ExpandableString text = new Expression.ExpandableString("\"  Write-Output   $x  \"",
                Lists.mutable.empty());

        assertEquals("\"  Write-Output   $x  \"", compress(assign("x", number("1")), expression(text)).substring(5));
    }

    @Test
    public void testIndexUsesRenamedVariables() {
        Expression.ArrayExpression list = new Expression.ArrayExpression("@(1, 2)", Lists.mutable.with(
                value(new Expression.ArrayLiteral("1, 2", Lists.mutable.with(number("1"), number("2"))))));
        Expression.Index index = new Expression.Index("$list[$i]", variable("list"), variable("i"));

        assertEquals("$a=@(1,2);$b=0;$a[$b]",
                compress(assign("list", list), assign("i", number("0")), expression(index)));
    }

    @Test
    public void testSplattedAndBracedVariables() {
        Expression.Hashtable parameters = new Expression.Hashtable("@{ Path = 'x' }", false, Lists.mutable.with(
                new Expression.KeyValue(bareword("Path"), value(string("'x'")))));
        Expression.Variable splat = new Expression.Variable("@params", "params", true);
        Expression.Variable braced = new Expression.Variable("${my var}", "my var", false);

        assertEquals("$a=@{Path='x'};dir @a;$b=1;${b}", compress(
                assign("params", parameters),
                command("Get-ChildItem", splat),
                assign(braced, "=", number("1")),
                expression(braced)));
    }

    @Test
    public void testSubExpressionAndArrayExpression() {
        Expression.SubExpression sub = new Expression.SubExpression("$(1; 2)",
                Lists.mutable.with(expression(number("1")), expression(number("2"))));
        Expression.ArrayExpression array = new Expression.ArrayExpression("@( 'a' )",
                Lists.mutable.with(expression(string("'a'"))));

        assertEquals("$(1;2)", compress(sub));
        assertEquals("@('a')", compress(array));
    }

    @Test
    public void testConvertAndTypeLiteral() {
        Expression.Convert cast = new Expression.Convert("[ int ] $x", " int ", variable("x"));
        Expression.TypeLiteral type = new Expression.TypeLiteral("[System.Text.StringBuilder]",
                "[ System.Text.StringBuilder ]");

        assertEquals("[int]$x", compress(cast));
        assertEquals("[System.Text.StringBuilder]", compress(type));
    }

    @Test
    public void testOrderedHashtable() {
        Expression.Hashtable table = new Expression.Hashtable("@{\n  Name = 'x'\n  Count = 2\n}", true,
                Lists.mutable.with(
                        new Expression.KeyValue(bareword("Name"), value(string("'x'"))),
                        new Expression.KeyValue(bareword("Count"), value(number("2")))));
        Expression.Convert ordered = new Expression.Convert("[ordered]" + table.text(), "ordered", table);

        String result = compress(ordered);
        assertEquals("[ordered]@{Name='x';Count=2}", result);
        assertFalse(result.contains("\n"));
    }

    @Test
    public void testCommandParameterWithArgument() {
        Expression.CommandParameter parameter = new Expression.CommandParameter("-Path:$p", "-Path", variable("p"));

        assertEquals("$a=1;dir -Path:$a", compress(assign("p", number("1")), command("Get-ChildItem", parameter)));
    }

    @Test
    public void testArrayLiteralElementsStayLiteral() {
        Expression.ArrayLiteral list = new Expression.ArrayLiteral("Write-Output, 2",
                Lists.mutable.with(bareword("Write-Output"), number("2")));

        assertEquals("Write-Output,2", compress(list));
    }

    @Test
    public void testOpaqueExpressionIsEmittedRaw() {
        assertEquals("$using:x", compress(new Expression.Opaque("$using:x")));
    }
}
