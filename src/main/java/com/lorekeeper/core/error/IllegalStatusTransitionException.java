package com.lorekeeper.core.error;

public class IllegalStatusTransitionException extends LorekeeperException {
    public IllegalStatusTransitionException(String message) {
        super(message);
    }
}
