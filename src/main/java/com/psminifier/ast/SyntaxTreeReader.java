package com.psminifier.ast;

import com.psminifier.json.JsonDocumentParser;
import com.psminifier.json.JsonValue;
import com.psminifier.json.JsonValue.JsonObject;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Decodes the host parser's JSON export of a script into the syntax-tree model.
 * <p>
 * Every node is an object with a {@code type} discriminator and its source {@code text}.
 * Unknown types become {@code Opaque} nodes so their text survives untouched.
 */
public class SyntaxTreeReader {

    private static final ImmutableSet<String> EXPRESSION_TYPES = Sets.immutable.of(
            "Binary", "Unary", "Member", "ExpandableString", "Index", "Variable", "ScriptBlock",
            "Paren", "ArrayExpression", "SubExpression", "Convert", "TypeLiteral", "Hashtable",
            "Constant", "ArrayLiteral", "CommandParameter");

    private final JsonDocumentParser jsonParser = new JsonDocumentParser();

    public ScriptBody read(InputStream input) throws IOException {
        return readRoot(jsonParser.parse(input));
    }

    public ScriptBody read(Path path) throws IOException {
        return readRoot(jsonParser.parse(path));
    }

    private ScriptBody readRoot(JsonValue root) throws IOException {
        if (!(root instanceof JsonObject object)) {
            throw new IOException("Syntax tree root must be a JSON object");
        }
        try {
            // a bare ScriptBlock expression wrapper is accepted as well as the body itself
            JsonObject wrapped = object.object("body");
            JsonObject body = wrapped != null ? wrapped : object;
            return scriptBody(body);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    ScriptBody scriptBody(JsonObject node) {
        ScriptBody.ParamBlock paramBlock = null;
        JsonObject param = node.object("paramBlock");
        if (param != null) {
            paramBlock = new ScriptBody.ParamBlock(text(param), strings(param, "attributes"),
                    param.array("parameters").collect(p -> parameter(asObject(p))));
        }
        return new ScriptBody(text(node),
                strings(node, "usings"),
                paramBlock,
                statements(node, "dynamicParam"),
                statements(node, "begin"),
                statements(node, "process"),
                statements(node, "end"));
    }

    private ScriptBody.Parameter parameter(JsonObject node) {
        String name = node.string("name");
        if (name == null) {
            throw missing(node, "name");
        }
        if (name.startsWith("$")) {
            name = name.substring(1);
        }
        return new ScriptBody.Parameter(text(node), strings(node, "attributes"), name,
                optionalExpression(node, "default"));
    }

    Statement statement(JsonObject node) {
        String type = type(node);
        String text = text(node);
        return switch (type) {
            case "If" -> new Statement.If(text,
                    node.array("clauses").collect(c -> {
                        JsonObject clause = asObject(c);
                        return new Statement.IfClause(requiredStatement(clause, "condition"), statements(clause, "body"));
                    }),
                    node.has("else") ? statements(node, "else") : null);
            case "ForEach" -> loop(node, LoopKind.FOR_EACH);
            case "For" -> loop(node, LoopKind.FOR);
            case "While" -> loop(node, LoopKind.WHILE);
            case "DoWhile" -> loop(node, LoopKind.DO_WHILE);
            case "DoUntil" -> loop(node, LoopKind.DO_UNTIL);
            case "Assignment" -> assignment(node);
            case "Pipeline" -> new Statement.Pipeline(text, statements(node, "elements"));
            case "Command" -> new Statement.Command(text,
                    node.string("invocationOperator"),
                    expressions(node, "elements"),
                    node.array("redirections").collect(r -> {
                        JsonObject redirection = asObject(r);
                        String operator = redirection.string("operator");
                        if (operator == null) {
                            throw missing(redirection, "operator");
                        }
                        return new Statement.Redirection(operator, optionalExpression(redirection, "target"));
                    }));
            case "CommandExpression" -> new Statement.CommandExpression(text, optionalExpression(node, "expression"));
            case "Try" -> new Statement.TryCatchFinally(text,
                    statements(node, "body"),
                    node.array("catches").collect(c -> {
                        JsonObject clause = asObject(c);
                        return new Statement.CatchClause(strings(clause, "types"), statements(clause, "body"));
                    }),
                    node.has("finally") ? statements(node, "finally") : null);
            case "FunctionDefinition" -> new Statement.FunctionDefinition(text,
                    functionKind(node),
                    required(node, "name"),
                    node.has("parameters") ? node.array("parameters").collect(p -> parameter(asObject(p))) : null,
                    scriptBody(requiredObject(node, "body")));
            case "Switch" -> new Statement.Switch(text,
                    node.string("label"),
                    strings(node, "flags"),
                    requiredStatement(node, "condition"),
                    node.array("clauses").collect(c -> {
                        JsonObject clause = asObject(c);
                        return new Statement.SwitchClause(expression(requiredObject(clause, "condition")),
                                statements(clause, "body"));
                    }),
                    node.has("default") ? statements(node, "default") : null);
            case "Flow" -> new Statement.Flow(text,
                    required(node, "keyword").toLowerCase(Locale.ROOT),
                    node.has("pipeline") ? statement(requiredObject(node, "pipeline")) : null,
                    optionalExpression(node, "label"));
            default -> EXPRESSION_TYPES.contains(type)
                    // an expression where a statement belongs is still a valid command expression
                    ? new Statement.CommandExpression(text, expression(node))
                    : new Statement.Opaque(text);
        };
    }

    private Statement.Loop loop(JsonObject node, LoopKind kind) {
        return new Statement.Loop(text(node),
                kind,
                node.string("label"),
                kind == LoopKind.FOR_EACH ? expression(requiredObject(node, "variable")) : null,
                optionalStatement(node, "initializer"),
                kind == LoopKind.FOR ? optionalStatement(node, "condition") : requiredStatement(node, "condition"),
                optionalStatement(node, "iterator"),
                statements(node, "body"));
    }

    private Statement.Assignment assignment(JsonObject node) {
        JsonObject right = node.object("right");
        if (right == null) {
            throw new MalformedSyntaxTreeException("Assignment '" + text(node) + "' has no right-hand side");
        }
        if (EXPRESSION_TYPES.contains(type(right))) {
            throw new MalformedSyntaxTreeException("Assignment '" + text(node)
                    + "' has an expression of type " + type(right) + " where a statement is required");
        }
        return new Statement.Assignment(text(node),
                expression(requiredObject(node, "left")),
                required(node, "operator"),
                statement(right));
    }

    Expression expression(JsonObject node) {
        String type = type(node);
        String text = text(node);
        return switch (type) {
            case "Binary" -> new Expression.Binary(text,
                    expression(requiredObject(node, "left")),
                    required(node, "operator"),
                    expression(requiredObject(node, "right")));
            case "Unary" -> new Expression.Unary(text,
                    required(node, "operator"),
                    expression(requiredObject(node, "operand")),
                    node.bool("postfix"));
            case "Member" -> new Expression.Member(text,
                    expression(requiredObject(node, "target")),
                    expression(requiredObject(node, "member")),
                    node.bool("invoke"),
                    node.bool("static"),
                    expressions(node, "arguments"));
            case "ExpandableString" -> new Expression.ExpandableString(text,
                    node.array("nested").collect(n -> {
                        JsonObject nested = asObject(n);
                        Expression inner = expression(requiredObject(nested, "expression"));
                        return new Expression.NestedExpression(inner,
                                nested.integer("offset", -1),
                                nested.integer("length", inner.text().length()));
                    }));
            case "Index" -> new Expression.Index(text,
                    expression(requiredObject(node, "target")),
                    expression(requiredObject(node, "index")));
            case "Variable" -> new Expression.Variable(text, required(node, "name"), node.bool("splatted"));
            case "ScriptBlock" -> new Expression.ScriptBlockExpression(text, scriptBody(requiredObject(node, "body")));
            case "Paren" -> new Expression.Paren(text, requiredStatement(node, "pipeline"));
            case "ArrayExpression" -> new Expression.ArrayExpression(text, statements(node, "statements"));
            case "SubExpression" -> new Expression.SubExpression(text, statements(node, "statements"));
            case "Convert" -> new Expression.Convert(text,
                    required(node, "typeName"),
                    expression(requiredObject(node, "child")));
            case "TypeLiteral" -> new Expression.TypeLiteral(text, required(node, "typeName"));
            case "Hashtable" -> new Expression.Hashtable(text,
                    node.bool("ordered"),
                    node.array("pairs").collect(p -> {
                        JsonObject pair = asObject(p);
                        return new Expression.KeyValue(expression(requiredObject(pair, "key")),
                                requiredStatement(pair, "value"));
                    }));
            case "Constant" -> new Expression.Constant(text, node.bool("bareword"));
            case "ArrayLiteral" -> new Expression.ArrayLiteral(text, expressions(node, "elements"));
            case "CommandParameter" -> new Expression.CommandParameter(text,
                    required(node, "name"),
                    optionalExpression(node, "argument"));
            default -> new Expression.Opaque(text);
        };
    }

    private MutableList<Statement> statements(JsonObject node, String key) {
        return node.array(key).collect(s -> statement(asObject(s)));
    }

    private MutableList<Expression> expressions(JsonObject node, String key) {
        return node.array(key).collect(e -> expression(asObject(e)));
    }

    private Statement requiredStatement(JsonObject node, String key) {
        return statement(requiredObject(node, key));
    }

    private Statement optionalStatement(JsonObject node, String key) {
        JsonObject child = node.object(key);
        return child != null ? statement(child) : null;
    }

    private Expression optionalExpression(JsonObject node, String key) {
        JsonObject child = node.object(key);
        return child != null ? expression(child) : null;
    }

    private MutableList<String> strings(JsonObject node, String key) {
        MutableList<String> result = Lists.mutable.empty();
        for (JsonValue value : node.array(key)) {
            if (!(value instanceof JsonValue.JsonString s)) {
                throw malformed("Expected string elements in '" + key + "' of " + describe(node));
            }
            result.add(s.value());
        }
        return result;
    }

    private FunctionKind functionKind(JsonObject node) {
        String kind = node.string("kind");
        if (kind == null) {
            return FunctionKind.FUNCTION;
        }
        try {
            return FunctionKind.valueOf(kind.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw malformed("Unknown function kind '" + kind + "' in " + describe(node));
        }
    }

    private String type(JsonObject node) {
        String type = node.string("type");
        return type != null ? type : "";
    }

    private String text(JsonObject node) {
        String text = node.string("text");
        if (text == null) {
            throw missing(node, "text");
        }
        return text;
    }

    private String required(JsonObject node, String key) {
        String value = node.string(key);
        if (value == null) {
            throw missing(node, key);
        }
        return value;
    }

    private JsonObject requiredObject(JsonObject node, String key) {
        JsonObject child = node.object(key);
        if (child == null) {
            throw missing(node, key);
        }
        return child;
    }

    private JsonObject asObject(JsonValue value) {
        if (value instanceof JsonObject object) {
            return object;
        }
        throw malformed("Expected a JSON object but found " + value.getClass().getSimpleName());
    }

    private UncheckedIOException missing(JsonObject node, String key) {
        return malformed("Missing '" + key + "' in " + describe(node));
    }

    private UncheckedIOException malformed(String message) {
        return new UncheckedIOException(new IOException(message));
    }

    private String describe(JsonObject node) {
        String type = node.string("type");
        return type != null ? type + " node" : "node";
    }
}
