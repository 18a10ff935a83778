package com.github.sybila.bisim.refine;

import com.github.sybila.bisim.lts.TransitionSystem;
import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * Integer view of a transition system. States and actions are numbered in declaration order.
 * Every state stores only its enabled actions and their successors, so the index grows with the
 * number of transitions, not with states times actions. Signatures under a changing partition
 * only need the current state to block lookup.
 *
 * @param <S> State type.
 * @param <A> Action type.
 */
public final class TransitionIndex<S, A> {

    private static final int[] NONE = new int[0];

    @NotNull
    private final List<S> states;

    @NotNull
    private final Map<S, Integer> stateIds;

    @NotNull
    private final List<A> actions;

    @NotNull
    private final Map<A, Integer> actionIds;

    /**
     * enabled[state] holds the sorted ids of the actions with at least one successor from state.
     */
    @NotNull
    private final int[][] enabled;

    /**
     * successors[state][k] holds the sorted, distinct target ids of action enabled[state][k].
     */
    @NotNull
    private final int[][][] successors;

    private final int transitionCount;

    public TransitionIndex(@NotNull TransitionSystem<S, A> model) {
        this.states = new ArrayList<>(model.getStates());
        this.actions = new ArrayList<>(model.getActions());
        this.stateIds = numbered(states);
        this.actionIds = numbered(actions);

        this.enabled = new int[states.size()][];
        this.successors = new int[states.size()][][];
        int count = 0;
        for (int s = 0; s < states.size(); s++) {
            S source = states.get(s);
            Set<A> labels = model.enabledActions(source);
            int[] labelIds = new int[labels.size()];
            int k = 0;
            for (A label : labels) {
                labelIds[k++] = actionIds.get(label);
            }
            Arrays.sort(labelIds);
            int[][] targets = new int[labelIds.length][];
            for (k = 0; k < labelIds.length; k++) {
                Set<S> next = model.successors(source, actions.get(labelIds[k]));
                int[] ids = new int[next.size()];
                int i = 0;
                for (S target : next) {
                    ids[i++] = stateIds.get(target);
                }
                Arrays.sort(ids);
                targets[k] = ids;
                count += ids.length;
            }
            enabled[s] = labelIds;
            successors[s] = targets;
        }
        this.transitionCount = count;
    }

    public int stateCount() {
        return states.size();
    }

    public int actionCount() {
        return actions.size();
    }

    public int transitionCount() {
        return transitionCount;
    }

    @NotNull
    public S state(int id) {
        return states.get(id);
    }

    @NotNull
    public A action(int id) {
        return actions.get(id);
    }

    public int stateId(@NotNull S state) {
        Integer id = stateIds.get(state);
        if (id == null) throw new IllegalArgumentException("Unknown state " + state);
        return id;
    }

    public int actionId(@NotNull A action) {
        Integer id = actionIds.get(action);
        if (id == null) throw new IllegalArgumentException("Unknown action " + action);
        return id;
    }

    /**
     * The trivial partition: one block holding every state.
     */
    @NotNull
    public Partition<S> initialPartition() {
        return new Partition<>(states, stateIds);
    }

    @NotNull
    public Set<S> successors(@NotNull S state, @NotNull A action) {
        int[] targets = targets(stateId(state), actionId(action));
        Set<S> result = new LinkedHashSet<>(targets.length);
        for (int t : targets) {
            result.add(states.get(t));
        }
        return result;
    }

    /**
     * Return the ids of the blocks of the partition which state can enter via action.
     */
    @NotNull
    public Set<Integer> signature(@NotNull S state, @NotNull A action, @NotNull Partition<S> partition) {
        int[] blocks = signature(stateId(state), actionId(action), partition.blockMap());
        Set<Integer> result = new TreeSet<>();
        for (int b : blocks) {
            result.add(b);
        }
        return result;
    }

    /**
     * Sorted, distinct block ids reachable from state via action, where blockOf maps state ids
     * to block ids.
     */
    @NotNull
    int[] signature(int state, int action, @NotNull int[] blockOf) {
        int[] targets = targets(state, action);
        if (targets.length == 0) return NONE;
        int[] blocks = new int[targets.length];
        for (int i = 0; i < targets.length; i++) {
            blocks[i] = blockOf[targets[i]];
        }
        Arrays.sort(blocks);
        int distinct = 1;
        for (int i = 1; i < blocks.length; i++) {
            if (blocks[i] != blocks[distinct - 1]) {
                blocks[distinct++] = blocks[i];
            }
        }
        return distinct == blocks.length ? blocks : Arrays.copyOf(blocks, distinct);
    }

    /**
     * Sorted ids of the actions enabled in state.
     */
    @NotNull
    int[] enabledActions(int state) {
        return enabled[state];
    }

    @NotNull
    private int[] targets(int state, int action) {
        int k = Arrays.binarySearch(enabled[state], action);
        if (k < 0) return NONE;
        return successors[state][k];
    }

    private static <T> Map<T, Integer> numbered(List<T> items) {
        Map<T, Integer> result = new HashMap<>(items.size() * 2);
        for (int i = 0; i < items.size(); i++) {
            result.put(items.get(i), i);
        }
        return result;
    }
}
