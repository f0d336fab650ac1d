package com.lorekeeper.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * One version of a Canon key. Versions are never deleted; a newer version supersedes.
 *
 * @param key            canon key, namespaced by convention ("facts/boiling-point")
 * @param value          the verified payload
 * @param confidence     confidence in [0,1]
 * @param lastUpdatedBy  agent id that installed this version
 * @param version        strictly increasing per key, first version is 1
 * @param updatedAt      install time
 * @param sourceEntryIds buffer entry ids promoted into this version (empty for direct writes)
 */
public record CanonEntry(
    String key,
    String value,
    double confidence,
    String lastUpdatedBy,
    long version,
    Instant updatedAt,
    List<String> sourceEntryIds
) implements Serializable {

    public CanonEntry {
        sourceEntryIds = sourceEntryIds == null ? List.of() : List.copyOf(sourceEntryIds);
    }

    public boolean promotedFrom(String bufferEntryId) {
        return sourceEntryIds.contains(bufferEntryId);
    }
}
