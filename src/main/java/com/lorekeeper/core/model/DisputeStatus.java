package com.lorekeeper.core.model;

public enum DisputeStatus {
    OPEN,
    RESOLVED
}
