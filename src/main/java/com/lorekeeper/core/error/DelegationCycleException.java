package com.lorekeeper.core.error;

/**
 * A dispatch would hand an ancestor's own assignment back to the same role.
 */
public class DelegationCycleException extends LorekeeperException {
    public DelegationCycleException(String message) {
        super(message);
    }
}
