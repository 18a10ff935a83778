package com.github.sybila.bisim.check;

import kotlin.Pair;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Set;

/**
 * Verdict of one comparison together with the final partition of the combined system.
 *
 * @param <S> State type of the compared systems.
 */
public final class BisimilarityResult<S> {

    private final boolean bisimilar;

    @NotNull
    private final List<Set<Pair<Side, S>>> partition;

    @NotNull
    private final Set<Pair<Side, S>> leftClass;

    @NotNull
    private final Set<Pair<Side, S>> rightClass;

    BisimilarityResult(
            boolean bisimilar,
            @NotNull List<Set<Pair<Side, S>>> partition,
            @NotNull Set<Pair<Side, S>> leftClass,
            @NotNull Set<Pair<Side, S>> rightClass) {
        this.bisimilar = bisimilar;
        this.partition = partition;
        this.leftClass = leftClass;
        this.rightClass = rightClass;
    }

    public boolean isBisimilar() {
        return bisimilar;
    }

    /**
     * Bisimulation classes of the combined system, ordered by block id.
     */
    @NotNull
    public List<Set<Pair<Side, S>>> getPartition() {
        return partition;
    }

    /**
     * The class of the left initial state.
     */
    @NotNull
    public Set<Pair<Side, S>> getLeftClass() {
        return leftClass;
    }

    /**
     * The class of the right initial state. Equal to {@link #getLeftClass()} iff bisimilar.
     */
    @NotNull
    public Set<Pair<Side, S>> getRightClass() {
        return rightClass;
    }

    @Override
    public String toString() {
        return "BisimilarityResult{bisimilar=" + bisimilar + ", classes=" + partition.size() + "}";
    }
}
