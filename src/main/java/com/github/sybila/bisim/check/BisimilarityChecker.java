package com.github.sybila.bisim.check;

import com.github.sybila.bisim.lts.ExplicitTransitionSystem;
import com.github.sybila.bisim.lts.InvalidModelException;
import com.github.sybila.bisim.lts.Transition;
import com.github.sybila.bisim.lts.TransitionSystem;
import com.github.sybila.bisim.refine.Partition;
import com.github.sybila.bisim.refine.PartitionRefiner;
import kotlin.Pair;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides strong bisimilarity of two transition systems. Both systems are put side by side in
 * one combined system (states tagged with their {@link Side}, shared alphabet, no transitions
 * between the two halves), the combined system is refined once, and the initial states are
 * bisimilar iff they end up in the same block.
 *
 * The checker holds no state; concurrent checks never share a partition.
 */
public class BisimilarityChecker {

    private static final Logger LOGGER = LoggerFactory.getLogger(BisimilarityChecker.class);

    public <S, A> boolean areBisimilar(@NotNull TransitionSystem<S, A> left, @NotNull TransitionSystem<S, A> right) {
        return check(left, right).isBisimilar();
    }

    @NotNull
    public <S, A> BisimilarityResult<S> check(@NotNull TransitionSystem<S, A> left, @NotNull TransitionSystem<S, A> right) {
        TransitionSystem<Pair<Side, S>, A> combined = combine(left, right);
        Pair<Side, S> leftInitial = new Pair<>(Side.LEFT, left.getInitialState());
        Pair<Side, S> rightInitial = new Pair<>(Side.RIGHT, right.getInitialState());

        Partition<Pair<Side, S>> partition = PartitionRefiner.refine(combined);
        int leftBlock = partition.blockOf(leftInitial);
        int rightBlock = partition.blockOf(rightInitial);
        boolean bisimilar = leftBlock == rightBlock;
        LOGGER.debug("{} classes over {} combined states, initial states in blocks {} and {}",
                partition.size(), combined.getStates().size(), leftBlock, rightBlock);
        return new BisimilarityResult<>(bisimilar, partition.classes(),
                partition.block(leftBlock), partition.block(rightBlock));
    }

    /**
     * Disjoint union of the two systems. The initial state of the union is the left initial state;
     * it carries no meaning for the comparison.
     */
    @NotNull
    static <S, A> TransitionSystem<Pair<Side, S>, A> combine(@NotNull TransitionSystem<S, A> left, @NotNull TransitionSystem<S, A> right) {
        ExplicitTransitionSystem.Builder<Pair<Side, S>, A> builder = ExplicitTransitionSystem.builder();
        append(builder, Side.LEFT, left);
        append(builder, Side.RIGHT, right);
        builder.setInitialState(new Pair<>(Side.LEFT, left.getInitialState()));
        try {
            return builder.build();
        } catch (InvalidModelException e) {
            // Both halves are valid systems, so their union is one too.
            throw new IllegalStateException("Union of two valid systems is invalid", e);
        }
    }

    private static <S, A> void append(
            @NotNull ExplicitTransitionSystem.Builder<Pair<Side, S>, A> builder,
            @NotNull Side side,
            @NotNull TransitionSystem<S, A> system) {
        for (S state : system.getStates()) {
            builder.addState(new Pair<>(side, state));
        }
        for (A action : system.getActions()) {
            builder.addAction(action);
        }
        for (Transition<S, A> t : system.getTransitions()) {
            builder.addTransition(new Pair<>(side, t.getSource()), t.getAction(), new Pair<>(side, t.getTarget()));
        }
    }
}
