package com.github.sybila.bisim;

import com.github.sybila.bisim.check.BisimilarityResult;
import com.github.sybila.bisim.check.Side;
import kotlin.Pair;
import org.jetbrains.annotations.NotNull;

import java.io.PrintStream;
import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Prints "Bisimilar" or "Not bisimilar", optionally followed by the equivalence classes.
 */
public class ConsoleReporter implements ResultReporter {

    public static final String BISIMILAR = "Bisimilar";
    public static final String NOT_BISIMILAR = "Not bisimilar";

    @NotNull
    private final PrintStream out;

    private final boolean printPartition;

    public ConsoleReporter(@NotNull PrintStream out, boolean printPartition) {
        this.out = out;
        this.printPartition = printPartition;
    }

    @Override
    public <S> void report(@NotNull BisimilarityResult<S> result) {
        out.println(result.isBisimilar() ? BISIMILAR : NOT_BISIMILAR);
        if (!printPartition) return;
        List<Set<Pair<Side, S>>> classes = result.getPartition();
        out.println("Classes (" + classes.size() + "):");
        for (int i = 0; i < classes.size(); i++) {
            out.println("  " + i + ": " + render(classes.get(i)));
        }
        out.println("Left initial class: " + render(result.getLeftClass()));
        out.println("Right initial class: " + render(result.getRightClass()));
    }

    @NotNull
    private static <S> String render(@NotNull Set<Pair<Side, S>> states) {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        for (Pair<Side, S> state : states) {
            joiner.add((state.getFirst() == Side.LEFT ? "1:" : "2:") + state.getSecond());
        }
        return joiner.toString();
    }
}
