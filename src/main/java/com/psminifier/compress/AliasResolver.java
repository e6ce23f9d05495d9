package com.psminifier.compress;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;

/**
 * Replaces bareword command names with their shortest alias.
 * <p>
 * Aliases of equal length are ordered lexicographically so the choice does not depend on the
 * provider's iteration order. Lookups are cached for the lifetime of the resolver, which is one
 * compression session.
 */
public class AliasResolver {

    private static final Logger log = LoggerFactory.getLogger(AliasResolver.class);

    static final Comparator<String> SHORTEST_FIRST =
            Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder());

    private final AliasProvider provider;
    private final MutableMap<String, MutableList<String>> cache = Maps.mutable.empty();

    public AliasResolver(AliasProvider provider) {
        this.provider = provider;
    }

    public String resolve(String bareword) {
        try {
            Optional<String> canonical = provider.resolveCommand(bareword);
            if (canonical.isEmpty()) {
                return bareword;
            }
            MutableList<String> aliases = cache.getIfAbsentPut(canonical.get().toLowerCase(Locale.ROOT),
                    () -> Lists.mutable.withAll(provider.aliasesOf(canonical.get())).sortThis(SHORTEST_FIRST));
            if (aliases.isEmpty()) {
                return bareword;
            }
            String shortest = aliases.getFirst();
            return shortest.length() < bareword.length() ? shortest : bareword;
        } catch (RuntimeException e) {
            log.debug("Alias lookup failed for '{}', keeping it: {}", bareword, e.getMessage());
            return bareword;
        }
    }
}
