package com.psminifier.ast;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * The body of a script, function or script block: using statements, an optional
 * {@code param(...)} block and the four named blocks.
 */
public record ScriptBody(String text,
                         MutableList<String> usings,
                         ParamBlock paramBlock,
                         MutableList<Statement> dynamicParam,
                         MutableList<Statement> begin,
                         MutableList<Statement> process,
                         MutableList<Statement> end) implements SyntaxNode {

    public static ScriptBody of(String text, MutableList<Statement> statements) {
        return new ScriptBody(text, Lists.mutable.empty(), null,
                Lists.mutable.empty(), Lists.mutable.empty(), Lists.mutable.empty(), statements);
    }

    public record ParamBlock(String text, MutableList<String> attributes, MutableList<Parameter> parameters) {}

    public record Parameter(String text, MutableList<String> attributes, String name, Expression defaultValue) {}
}
