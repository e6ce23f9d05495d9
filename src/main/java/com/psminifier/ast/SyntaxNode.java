package com.psminifier.ast;

/**
 * A node of the syntax tree produced by the host parser.
 */
public sealed interface SyntaxNode permits Statement, Expression, ScriptBody {

    // original source extent
    String text();
}
