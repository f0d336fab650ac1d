package com.lorekeeper.core.error;

/**
 * A dispatch would exceed the maximum recursion depth. Raised before any inference call.
 */
public class DepthExceededException extends LorekeeperException {

    private final int requestedDepth;
    private final int maxDepth;

    public DepthExceededException(int requestedDepth, int maxDepth) {
        super("Dispatch depth " + requestedDepth + " exceeds the maximum of " + maxDepth);
        this.requestedDepth = requestedDepth;
        this.maxDepth = maxDepth;
    }

    public int getRequestedDepth() {
        return requestedDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
