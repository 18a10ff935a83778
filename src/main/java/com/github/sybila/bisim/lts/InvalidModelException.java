package com.github.sybila.bisim.lts;

/**
 * Thrown when a transition system is structurally inconsistent: no states, an initial state
 * outside of the state set, or a transition referring to an undeclared state or action.
 */
public class InvalidModelException extends Exception {

    public InvalidModelException(String message) {
        super(message);
    }

}
