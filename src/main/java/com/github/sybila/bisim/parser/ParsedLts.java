package com.github.sybila.bisim.parser;

import com.github.sybila.bisim.lts.ExplicitTransitionSystem;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;

/**
 * A loaded transition system and the lines which were skipped while loading it.
 */
public final class ParsedLts {

    @NotNull
    private final ExplicitTransitionSystem<String, String> system;

    @NotNull
    private final List<MalformedLine> malformedLines;

    ParsedLts(@NotNull ExplicitTransitionSystem<String, String> system, @NotNull List<MalformedLine> malformedLines) {
        this.system = system;
        this.malformedLines = Collections.unmodifiableList(malformedLines);
    }

    @NotNull
    public ExplicitTransitionSystem<String, String> getSystem() {
        return system;
    }

    @NotNull
    public List<MalformedLine> getMalformedLines() {
        return malformedLines;
    }

    public boolean hasWarnings() {
        return !malformedLines.isEmpty();
    }
}
