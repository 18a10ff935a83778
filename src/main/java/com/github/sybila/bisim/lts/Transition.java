package com.github.sybila.bisim.lts;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * One labelled step (source, action, target). Immutable.
 */
public final class Transition<S, A> {

    @NotNull
    private final S source;

    @NotNull
    private final A action;

    @NotNull
    private final S target;

    public Transition(@NotNull S source, @NotNull A action, @NotNull S target) {
        this.source = Objects.requireNonNull(source, "source");
        this.action = Objects.requireNonNull(action, "action");
        this.target = Objects.requireNonNull(target, "target");
    }

    @NotNull
    public S getSource() {
        return source;
    }

    @NotNull
    public A getAction() {
        return action;
    }

    @NotNull
    public S getTarget() {
        return target;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transition)) return false;
        Transition<?, ?> that = (Transition<?, ?>) o;
        return source.equals(that.source) && action.equals(that.action) && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, action, target);
    }

    @Override
    public String toString() {
        return source + " -" + action + "-> " + target;
    }
}
