package com.github.sybila.bisim.lts;

import kotlin.Pair;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.*;

public class ExplicitTransitionSystem<S, A> implements TransitionSystem<S, A> {

    @NotNull
    private final Set<S> states;

    @NotNull
    private final Set<A> actions;

    @NotNull
    private final Set<Transition<S, A>> transitions;

    @NotNull
    private final S initialState;

    @NotNull
    private final Map<Pair<S, A>, Set<S>> successors;

    @NotNull
    private final Map<S, Set<A>> enabled;


    /**
     * Create a validated transition system. The given collections are copied, their iteration
     * order is preserved.
     *
     * @throws InvalidModelException if the state set is empty, the initial state is not a state,
     * or some transition refers to an undeclared state or action.
     */
    public ExplicitTransitionSystem(
            @NotNull Collection<S> states,
            @NotNull Collection<A> actions,
            @NotNull Collection<Transition<S, A>> transitions,
            @NotNull S initialState) throws InvalidModelException {
        if (states.isEmpty()) {
            throw new InvalidModelException("Transition system has no states");
        }
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(states));
        this.actions = Collections.unmodifiableSet(new LinkedHashSet<>(actions));
        if (!this.states.contains(initialState)) {
            throw new InvalidModelException("Initial state " + initialState + " is not a declared state");
        }
        this.initialState = initialState;

        Set<Transition<S, A>> checked = new LinkedHashSet<>(transitions.size());
        Map<Pair<S, A>, Set<S>> successors = new HashMap<>();
        Map<S, Set<A>> enabled = new HashMap<>();
        for (Transition<S, A> t : transitions) {
            if (!this.states.contains(t.getSource())) {
                throw new InvalidModelException("Transition " + t + " leaves undeclared state " + t.getSource());
            }
            if (!this.states.contains(t.getTarget())) {
                throw new InvalidModelException("Transition " + t + " enters undeclared state " + t.getTarget());
            }
            if (!this.actions.contains(t.getAction())) {
                throw new InvalidModelException("Transition " + t + " uses undeclared action " + t.getAction());
            }
            if (checked.add(t)) {
                successors.computeIfAbsent(new Pair<>(t.getSource(), t.getAction()), k -> new LinkedHashSet<>())
                        .add(t.getTarget());
                enabled.computeIfAbsent(t.getSource(), k -> new LinkedHashSet<>()).add(t.getAction());
            }
        }
        this.transitions = Collections.unmodifiableSet(checked);
        this.successors = freeze(successors);
        this.enabled = freeze(enabled);
    }

    @NotNull
    public static <S, A> Builder<S, A> builder() {
        return new Builder<>();
    }

    @NotNull
    @Override
    public Set<S> getStates() {
        return states;
    }

    @NotNull
    @Override
    public Set<A> getActions() {
        return actions;
    }

    @NotNull
    @Override
    public Set<Transition<S, A>> getTransitions() {
        return transitions;
    }

    @NotNull
    @Override
    public S getInitialState() {
        return initialState;
    }

    @NotNull
    @Override
    public Set<S> successors(@NotNull S source, @NotNull A action) {
        Set<S> result = successors.get(new Pair<>(source, action));
        if (result == null) return Collections.emptySet();
        return result;
    }

    @NotNull
    @Override
    public Set<A> enabledActions(@NotNull S source) {
        Set<A> result = enabled.get(source);
        if (result == null) return Collections.emptySet();
        return result;
    }

    /**
     * Human readable dump of the whole system, one transition per line.
     */
    @NotNull
    public String describe() {
        StringBuilder out = new StringBuilder();
        out.append("States: ").append(states).append('\n');
        out.append("Actions: ").append(actions).append('\n');
        out.append("Initial: ").append(initialState).append('\n');
        out.append("Transitions:");
        for (Transition<S, A> t : transitions) {
            out.append("\n  ").append(t);
        }
        return out.toString();
    }

    @Override
    public String toString() {
        return "ExplicitTransitionSystem{states=" + states.size() +
                ", actions=" + actions.size() +
                ", transitions=" + transitions.size() +
                ", initial=" + initialState + "}";
    }

    private static <K, V> Map<K, Set<V>> freeze(Map<K, Set<V>> values) {
        Map<K, Set<V>> result = new HashMap<>(values.size());
        for (Map.Entry<K, Set<V>> entry : values.entrySet()) {
            result.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue()));
        }
        return result;
    }

    /**
     * Collects states, actions and transitions incrementally. Endpoints and actions of added
     * transitions are declared implicitly. Unless set explicitly, the initial state is the first
     * declared state.
     */
    public static final class Builder<S, A> {

        @NotNull
        private final Set<S> states = new LinkedHashSet<>();

        @NotNull
        private final Set<A> actions = new LinkedHashSet<>();

        @NotNull
        private final List<Transition<S, A>> transitions = new ArrayList<>();

        @Nullable
        private S initialState;

        private Builder() {}

        @NotNull
        public Builder<S, A> addState(@NotNull S state) {
            states.add(state);
            return this;
        }

        @NotNull
        public Builder<S, A> addAction(@NotNull A action) {
            actions.add(action);
            return this;
        }

        @NotNull
        public Builder<S, A> addTransition(@NotNull S source, @NotNull A action, @NotNull S target) {
            states.add(source);
            states.add(target);
            actions.add(action);
            transitions.add(new Transition<>(source, action, target));
            return this;
        }

        @NotNull
        public Builder<S, A> setInitialState(@NotNull S initialState) {
            this.initialState = initialState;
            return this;
        }

        @NotNull
        public ExplicitTransitionSystem<S, A> build() throws InvalidModelException {
            if (states.isEmpty()) {
                throw new InvalidModelException("Transition system has no states");
            }
            S initial = initialState != null ? initialState : states.iterator().next();
            return new ExplicitTransitionSystem<>(states, actions, transitions, initial);
        }
    }
}
