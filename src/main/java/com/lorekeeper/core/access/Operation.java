package com.lorekeeper.core.access;

/**
 * Verbs checked by the arbiter. WRITE covers appends and version installs;
 * UPDATE covers status transitions on existing records.
 */
public enum Operation {
    READ,
    WRITE,
    UPDATE
}
