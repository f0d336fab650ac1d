package com.lorekeeper.core.memory;

import com.lorekeeper.core.model.BufferEntry;

import java.util.List;

/**
 * Buffer read result. Every entry in it is unverified and must be presented as tentative.
 */
public record TentativeBuffer(List<BufferEntry> entries) {

    public static final String LABEL = "TENTATIVE";

    public TentativeBuffer {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }
}
