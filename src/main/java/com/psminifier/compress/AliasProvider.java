package com.psminifier.compress;

import java.util.List;
import java.util.Optional;

/**
 * Knows which commands exist in the target environment and which aliases point at them.
 */
public interface AliasProvider {

    /**
     * Resolves a command or alias name to the canonical command it runs, following alias chains.
     *
     * @param name command or alias name, in any case
     * @return the canonical command name, or empty when the name is unknown
     */
    Optional<String> resolveCommand(String name);

    List<String> aliasesOf(String canonicalName);
}
