package com.lorekeeper.core.error;

/**
 * A conditional Canon write observed a version that is no longer current.
 */
public class CanonVersionConflictException extends LorekeeperException {

    private final String key;
    private final long expectedVersion;
    private final long actualVersion;

    public CanonVersionConflictException(String key, long expectedVersion, long actualVersion) {
        super("Canon key '" + key + "' is at version " + actualVersion + ", expected " + expectedVersion);
        this.key = key;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getKey() {
        return key;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
