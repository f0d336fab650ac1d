package com.lorekeeper.core.model;

import java.util.List;

/**
 * A request to install a new Canon version.
 *
 * @param key             canon key
 * @param value           payload to install
 * @param confidence      confidence in [0,1]
 * @param expectedVersion version the writer observed (0 = absent); {@code null} supersedes whatever is current
 * @param sourceEntryIds  buffer entries this write promotes
 */
public record CanonWrite(
    String key,
    String value,
    double confidence,
    Long expectedVersion,
    List<String> sourceEntryIds
) {

    public CanonWrite {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Canon key must not be blank");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be within [0,1]: " + confidence);
        }
        sourceEntryIds = sourceEntryIds == null ? List.of() : List.copyOf(sourceEntryIds);
    }

    public static CanonWrite direct(String key, String value, double confidence) {
        return new CanonWrite(key, value, confidence, null, List.of());
    }

    public boolean isConditional() {
        return expectedVersion != null;
    }
}
