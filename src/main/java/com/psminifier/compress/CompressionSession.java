package com.psminifier.compress;

import com.psminifier.ast.ScriptBody;
import com.psminifier.ast.SyntaxNode;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * State for compressing one tree. Not thread-safe; concurrent compressions each open their own.
 */
public class CompressionSession {

    public static final int DEFAULT_MAX_DEPTH = 1000;

    private static final Pattern VARIABLE_REFERENCE = Pattern.compile("[$@]\\{?(\\w+)(?::(\\w+))?");
    private static final ImmutableSet<String> SCOPES =
            Sets.immutable.of("script", "global", "local", "private", "using");

    private final VariableAllocator variables;
    private final AliasResolver aliases;
    private final int maxDepth;
    private final StatementCompressor statements;
    private int depth;

    public CompressionSession(VariableAllocator variables, AliasResolver aliases, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Maximum depth must be positive: " + maxDepth);
        }
        this.variables = variables;
        this.aliases = aliases;
        this.maxDepth = maxDepth;
        this.statements = new StatementCompressor(this);
    }

    public static CompressionSession open(ScriptBody tree, String firstVariableName,
                                          AliasProvider aliasProvider, int maxDepth) {
        VariableAllocator variables = new VariableAllocator(firstVariableName,
                variableNamesIn(tree.text()), scopedNamesIn(tree.text()));
        return new CompressionSession(variables, new AliasResolver(aliasProvider), maxDepth);
    }

    public String compress(ScriptBody tree) {
        return statements.compressBody(tree);
    }

    public StatementCompressor statements() {
        return statements;
    }

    public VariableAllocator variables() {
        return variables;
    }

    public AliasResolver aliases() {
        return aliases;
    }

    void enter(SyntaxNode node) {
        if (depth >= maxDepth) {
            throw new CompressionException("Syntax tree nesting exceeds " + maxDepth
                    + " levels at '" + Tokens.abbreviate(node.text()) + "'");
        }
        depth++;
    }

    void exit() {
        depth--;
    }

    static MutableSet<String> variableNamesIn(String source) {
        MutableSet<String> names = Sets.mutable.empty();
        Matcher matcher = VARIABLE_REFERENCE.matcher(source);
        while (matcher.find()) {
            names.add(matcher.group(1));
            if (matcher.group(2) != null) {
                names.add(matcher.group(2));
            }
        }
        return names;
    }

    // $script:count and $count can be the same variable
    static MutableSet<String> scopedNamesIn(String source) {
        MutableSet<String> names = Sets.mutable.empty();
        Matcher matcher = VARIABLE_REFERENCE.matcher(source);
        while (matcher.find()) {
            if (matcher.group(2) != null && SCOPES.contains(matcher.group(1).toLowerCase(Locale.ROOT))) {
                names.add(matcher.group(2));
            }
        }
        return names;
    }
}
