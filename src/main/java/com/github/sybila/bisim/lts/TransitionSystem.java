package com.github.sybila.bisim.lts;

import org.jetbrains.annotations.NotNull;

import java.util.Set;

/**
 * A finite labelled transition system. Implementations are immutable.
 *
 * @param <S> State type.
 * @param <A> Action (label) type.
 */
public interface TransitionSystem<S, A> {

    /**
     * Return all states of this system in declaration order. Never empty.
     */
    @NotNull
    Set<S> getStates();

    /**
     * Return the action alphabet in declaration order.
     */
    @NotNull
    Set<A> getActions();

    @NotNull
    Set<Transition<S, A>> getTransitions();

    @NotNull
    S getInitialState();

    /**
     * Return the states reachable from source in one step labelled with action.
     */
    @NotNull
    Set<S> successors(@NotNull S source, @NotNull A action);

    /**
     * Return the actions which label at least one outgoing transition of source.
     */
    @NotNull
    Set<A> enabledActions(@NotNull S source);

}
