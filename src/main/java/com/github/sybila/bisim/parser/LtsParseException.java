package com.github.sybila.bisim.parser;

import org.jetbrains.annotations.NotNull;

/**
 * A model description that cannot produce a transition system.
 */
public class LtsParseException extends Exception {

    public enum Kind {
        /** Not a single line of the input is a valid transition. */
        NO_VALID_TRANSITIONS,
        /** The transitions were read, but do not form a valid system. */
        INVALID_MODEL
    }

    @NotNull
    private final Kind kind;

    public LtsParseException(@NotNull Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LtsParseException(@NotNull Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    @NotNull
    public Kind getKind() {
        return kind;
    }
}
