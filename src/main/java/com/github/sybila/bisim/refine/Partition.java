package com.github.sybila.bisim.refine;

import org.jetbrains.annotations.NotNull;

import java.util.*;

/**
 * Partition of the states of one transition system into disjoint, non-empty blocks.
 *
 * The state to block map is kept apart from the block contents so that a split only has to
 * rewrite the entries of the states which move into the new block. Blocks are identified by
 * their index; a split never renumbers existing blocks.
 *
 * Only the refiner of this package mutates a partition. Outside of it, a partition is read-only.
 */
public final class Partition<S> {

    @NotNull
    private final List<S> states;

    @NotNull
    private final Map<S, Integer> stateIds;

    /**
     * Block id of every state id.
     */
    @NotNull
    private final int[] blockOf;

    /**
     * Member state ids of every block, sorted ascending.
     */
    @NotNull
    private final List<int[]> blocks = new ArrayList<>();

    Partition(@NotNull List<S> states, @NotNull Map<S, Integer> stateIds) {
        this.states = states;
        this.stateIds = stateIds;
        this.blockOf = new int[states.size()];
        int[] all = new int[states.size()];
        for (int i = 0; i < all.length; i++) {
            all[i] = i;
        }
        blocks.add(all);
    }

    /**
     * Number of blocks.
     */
    public int size() {
        return blocks.size();
    }

    public int blockOf(@NotNull S state) {
        Integer id = stateIds.get(state);
        if (id == null) throw new IllegalArgumentException("Unknown state " + state);
        return blockOf[id];
    }

    public boolean sameBlock(@NotNull S a, @NotNull S b) {
        return blockOf(a) == blockOf(b);
    }

    @NotNull
    public Set<S> block(int block) {
        if (block < 0 || block >= blocks.size()) {
            throw new IndexOutOfBoundsException("No block " + block + " in a partition of " + blocks.size());
        }
        int[] members = blocks.get(block);
        Set<S> result = new LinkedHashSet<>(members.length);
        for (int m : members) {
            result.add(states.get(m));
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * All blocks as state sets, ordered by block id.
     */
    @NotNull
    public List<Set<S>> classes() {
        List<Set<S>> result = new ArrayList<>(blocks.size());
        for (int b = 0; b < blocks.size(); b++) {
            result.add(block(b));
        }
        return Collections.unmodifiableList(result);
    }

    @NotNull
    int[] members(int block) {
        return blocks.get(block);
    }

    @NotNull
    int[] blockMap() {
        return blockOf;
    }

    @NotNull
    int[] snapshot() {
        return blockOf.clone();
    }

    /**
     * Replace the contents of block with keep and put move into a fresh block.
     *
     * @return id of the fresh block
     */
    int split(int block, @NotNull int[] keep, @NotNull int[] move) {
        int id = blocks.size();
        blocks.set(block, keep);
        blocks.add(move);
        for (int m : move) {
            blockOf[m] = id;
        }
        return id;
    }

    /**
     * Verify that every state sits in exactly one non-empty block and that the state to block
     * map agrees with the block contents.
     *
     * @throws InvariantViolationException if it does not
     */
    void checkInvariant() {
        boolean[] seen = new boolean[states.size()];
        int total = 0;
        for (int b = 0; b < blocks.size(); b++) {
            int[] members = blocks.get(b);
            if (members.length == 0) {
                throw new InvariantViolationException("Block " + b + " is empty");
            }
            for (int m : members) {
                if (seen[m]) {
                    throw new InvariantViolationException("State " + states.get(m) + " is in more than one block");
                }
                if (blockOf[m] != b) {
                    throw new InvariantViolationException("State " + states.get(m) + " is in block " + b +
                            " but mapped to block " + blockOf[m]);
                }
                seen[m] = true;
                total += 1;
            }
        }
        if (total != states.size()) {
            for (int i = 0; i < seen.length; i++) {
                if (!seen[i]) {
                    throw new InvariantViolationException("State " + states.get(i) + " is in no block");
                }
            }
        }
    }

    @Override
    public String toString() {
        return classes().toString();
    }
}
