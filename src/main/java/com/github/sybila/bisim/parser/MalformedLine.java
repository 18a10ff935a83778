package com.github.sybila.bisim.parser;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A skipped input line which is not a (source, action, target) triplet.
 */
public final class MalformedLine {

    private final int lineNumber;

    @NotNull
    private final String text;

    public MalformedLine(int lineNumber, @NotNull String text) {
        this.lineNumber = lineNumber;
        this.text = text;
    }

    /**
     * One-based line number.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    @NotNull
    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MalformedLine)) return false;
        MalformedLine that = (MalformedLine) o;
        return lineNumber == that.lineNumber && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lineNumber, text);
    }

    @Override
    public String toString() {
        return "line " + lineNumber + ": " + text;
    }
}
