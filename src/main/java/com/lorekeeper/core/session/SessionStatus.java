package com.lorekeeper.core.session;

public enum SessionStatus {
    OPEN,
    CLOSING,
    CLOSED
}
