package com.psminifier.compress;

import com.psminifier.json.JsonDocumentParser;
import com.psminifier.json.JsonValue;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.Sets;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * An {@link AliasProvider} backed by a JSON object mapping canonical command names to their aliases:
 * <pre>{"Write-Output": ["echo", "write"], "ForEach-Object": ["%", "foreach"]}</pre>
 * An alias may itself name another alias; lookups follow the chain.
 */
public class AliasTable implements AliasProvider {

    private static final String DEFAULT_RESOURCE = "default-aliases.json";

    private final MutableMap<String, String> commands = Maps.mutable.empty();
    private final MutableMap<String, String> definitions = Maps.mutable.empty();
    private final MutableMap<String, MutableList<String>> aliasesByCommand = Maps.mutable.empty();

    public AliasTable(Map<String, ? extends List<String>> aliases) {
        aliases.forEach((command, names) -> {
            commands.put(key(command), command);
            MutableList<String> bound = aliasesByCommand.getIfAbsentPut(key(command), Lists.mutable::empty);
            for (String alias : names) {
                definitions.put(key(alias), command);
                bound.add(alias);
            }
        });
    }

    public static AliasTable defaults() {
        try (InputStream input = AliasTable.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("Missing alias resource " + DEFAULT_RESOURCE);
            }
            return fromJson(new JsonDocumentParser().parse(input));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read alias resource " + DEFAULT_RESOURCE, e);
        }
    }

    public static AliasTable load(Path path) throws IOException {
        return fromJson(new JsonDocumentParser().parse(path));
    }

    private static AliasTable fromJson(JsonValue document) throws IOException {
        if (!(document instanceof JsonValue.JsonObject object)) {
            throw new IOException("Alias table must be a JSON object of command name to alias array");
        }
        MutableMap<String, MutableList<String>> aliases = Maps.mutable.empty();
        for (var entry : object.fields().keyValuesView()) {
            if (!(entry.getTwo() instanceof JsonValue.JsonArray array)) {
                throw new IOException("Aliases of " + entry.getOne() + " must be an array");
            }
            MutableList<String> names = Lists.mutable.empty();
            for (JsonValue value : array.elements()) {
                if (!(value instanceof JsonValue.JsonString name)) {
                    throw new IOException("Alias of " + entry.getOne() + " must be a string");
                }
                names.add(name.value());
            }
            aliases.put(entry.getOne(), names);
        }
        return new AliasTable(aliases);
    }

    @Override
    public Optional<String> resolveCommand(String name) {
        String current = key(name);
        MutableSet<String> seen = Sets.mutable.empty();
        while (definitions.containsKey(current) && seen.add(current)) {
            current = key(definitions.get(current));
        }
        return Optional.ofNullable(commands.get(current));
    }

    @Override
    public List<String> aliasesOf(String canonicalName) {
        MutableList<String> aliases = aliasesByCommand.get(key(canonicalName));
        return aliases != null ? aliases.asUnmodifiable() : List.of();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
