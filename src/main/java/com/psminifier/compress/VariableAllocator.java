package com.psminifier.compress;

import org.eclipse.collections.api.map.MapIterable;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.api.stack.MutableStack;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;
import org.eclipse.collections.impl.factory.Stacks;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Hands out short variable names and owns the rename table for one compression session.
 * <p>
 * Names are compared case-insensitively, like PowerShell does. Short names are generated by
 * {@link #next(String)} and never collide with a name already spelled in the source.
 */
public class VariableAllocator {

    private static final Pattern WORD = Pattern.compile("\\w+");

    // automatic and preference variables change behavior when renamed
    private static final ImmutableSet<String> RESERVED = Sets.immutable.of(
            "_", "$", "?", "^", "args", "consolefilename", "enabledexperimentalfeatures", "error", "event",
            "eventargs", "eventsubscriber", "executioncontext", "false", "foreach", "home", "host", "input",
            "iscoreclr", "islinux", "ismacos", "iswindows", "lastexitcode", "matches", "myinvocation",
            "nestedpromptlevel", "null", "ofs", "pid", "profile", "psboundparameters", "pscmdlet",
            "pscommandpath", "psculture", "psdebugcontext", "psedition", "pshome", "psitem", "psscriptroot",
            "pssenderinfo", "psuiculture", "psversiontable", "pwd", "sender", "shellid", "stacktrace",
            "switch", "this", "true",
            "confirmpreference", "debugpreference", "erroractionpreference", "errorview",
            "formatenumerationlimit", "informationpreference", "maximumhistorycount", "outputencoding",
            "progresspreference", "psdefaultparametervalues", "psemailserver", "psmoduleautoloadingpreference",
            "psnativecommandargumentpassing", "psnativecommanduseerroractionpreference",
            "pssessionapplicationname", "pssessionconfigurationname", "pssessionoption", "psstyle",
            "transcript", "verbosepreference", "warningpreference", "whatifpreference");

    private final MutableMap<String, String> renames = Maps.mutable.empty();
    private final MutableSet<String> taken;
    private final MutableSet<String> pinned;
    private final MutableStack<MutableSet<String>> scopes = Stacks.mutable.empty();
    private String counter;

    public VariableAllocator(String firstVariableName, Iterable<String> namesInSource) {
        this(firstVariableName, namesInSource, Sets.mutable.empty());
    }

    /**
     * @param pinnedNames names that are also reached through a scope qualifier ({@code $script:x}),
     *                    which must keep their spelling everywhere
     */
    public VariableAllocator(String firstVariableName, Iterable<String> namesInSource, Iterable<String> pinnedNames) {
        if (firstVariableName == null || !WORD.matcher(firstVariableName).matches()) {
            throw new IllegalArgumentException("First variable name must be a non-empty word: " + firstVariableName);
        }
        this.counter = firstVariableName;
        this.taken = Sets.mutable.empty();
        for (String name : namesInSource) {
            taken.add(key(name));
        }
        this.pinned = Sets.mutable.empty();
        for (String name : pinnedNames) {
            pinned.add(key(name));
        }
    }

    /**
     * Increments a name as a base-26 numeral over {@code a..z}: {@code a -> b}, {@code z -> aa},
     * {@code az -> ba}. Any other last character is bumped to its successor ({@code v1 -> v2},
     * {@code A -> B}); a character with no word-character successor rolls over like {@code z}.
     * When the carry runs off the front, an {@code a} is appended.
     */
    public static String next(String current) {
        char[] chars = current.toCharArray();
        for (int i = chars.length - 1; i >= 0; i--) {
            char c = chars[i];
            if (c != 'z' && isWordChar((char) (c + 1))) {
                chars[i]++;
                return new String(chars);
            }
            chars[i] = 'a';
        }
        return new String(chars) + 'a';
    }

    private static boolean isWordChar(char c) {
        return WORD.matcher(String.valueOf(c)).matches();
    }

    // the counter only advances for names seen for the first time
    public String assign(String originalName) {
        String key = key(originalName);
        String existing = renames.get(key);
        if (existing != null) {
            return existing;
        }
        while (taken.contains(key(counter)) || RESERVED.contains(key(counter))) {
            counter = next(counter);
        }
        String shortName = counter;
        renames.put(key, shortName);
        counter = next(counter);
        return shortName;
    }

    public Optional<String> lookup(String name) {
        String key = key(name);
        if (isShadowed(key)) {
            return Optional.empty();
        }
        return Optional.ofNullable(renames.get(key));
    }

    /**
     * True for plain variables that may be renamed: no scope or drive qualifier, not an automatic
     * or preference variable, not reached elsewhere through a scope qualifier, and not a parameter
     * of an enclosing body.
     */
    public boolean isRenamable(String name) {
        String key = key(name);
        return !key.isEmpty() && key.indexOf(':') < 0 && !RESERVED.contains(key) && !pinned.contains(key)
                && !isShadowed(key);
    }

    public void enterScope(Iterable<String> parameterNames) {
        MutableSet<String> scope = Sets.mutable.empty();
        for (String name : parameterNames) {
            scope.add(key(name));
        }
        scopes.push(scope);
    }

    public void exitScope() {
        scopes.pop();
    }

    public MapIterable<String, String> renames() {
        return renames.asUnmodifiable();
    }

    private boolean isShadowed(String key) {
        return scopes.anySatisfy(scope -> scope.contains(key));
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
