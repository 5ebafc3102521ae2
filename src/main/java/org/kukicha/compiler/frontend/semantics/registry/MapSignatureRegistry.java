package org.kukicha.compiler.frontend.semantics.registry;

import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * An immutable in-memory {@link SignatureRegistry}.
 */
public final class MapSignatureRegistry implements SignatureRegistry {

    private final Map<String, Integer> returnCounts;

    /**
     * @param returnCounts Qualified function name to return count. Counts must not be negative.
     */
    public MapSignatureRegistry(Map<String, Integer> returnCounts) {
        returnCounts.forEach((name, count) -> {
            if (count == null || count < 0) {
                throw new IllegalArgumentException("Invalid return count for '" + name + "': " + count);
            }
        });
        this.returnCounts = Map.copyOf(returnCounts);
    }

    @Override
    public OptionalInt lookup(String qualifiedName) {
        Integer count = returnCounts.get(qualifiedName);
        return count == null ? OptionalInt.empty() : OptionalInt.of(count);
    }

    public int size() {
        return returnCounts.size();
    }

    /**
     * @return A registry containing the entries of both, with {@code overrides} winning on conflicts.
     */
    public MapSignatureRegistry withOverrides(MapSignatureRegistry overrides) {
        Map<String, Integer> merged = new HashMap<>(returnCounts);
        merged.putAll(overrides.returnCounts);
        return new MapSignatureRegistry(merged);
    }
}
