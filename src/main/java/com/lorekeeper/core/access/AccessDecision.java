package com.lorekeeper.core.access;

public enum AccessDecision {
    ALLOW,
    DENY
}
