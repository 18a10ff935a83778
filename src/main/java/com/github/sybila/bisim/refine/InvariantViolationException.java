package com.github.sybila.bisim.refine;

/**
 * Partition refinement reached an impossible state (overlapping blocks, a lost state, or more
 * passes than there are states). Always a bug, never recoverable.
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }

}
