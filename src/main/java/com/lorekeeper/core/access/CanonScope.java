package com.lorekeeper.core.access;

import java.util.List;

/**
 * Capability-scoped read view over Canon: a key-prefix allowlist handed to an agent at
 * dispatch time. An empty allowlist means every key is visible.
 */
public record CanonScope(List<String> prefixes) {

    public CanonScope {
        prefixes = prefixes == null ? List.of() : List.copyOf(prefixes);
    }

    public static CanonScope unrestricted() {
        return new CanonScope(List.of());
    }

    public static CanonScope of(String... prefixes) {
        return new CanonScope(List.of(prefixes));
    }

    public boolean permits(String key) {
        if (key == null) return false;
        if (prefixes.isEmpty()) return true;
        for (String prefix : prefixes) {
            if (key.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
