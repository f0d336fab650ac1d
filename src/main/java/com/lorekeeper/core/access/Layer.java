package com.lorekeeper.core.access;

public enum Layer {
    CANON,
    BUFFER,
    SCRATCH,
    TASK_MEMORY,
    DISPUTE
}
