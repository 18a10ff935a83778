package com.github.sybila.bisim.refine;

import com.github.sybila.bisim.lts.TransitionSystem;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Kanellakis-Smolka partition refinement. Starting from the single block of all states, blocks
 * are split by the signatures of their members until a full pass over all (block, action) pairs
 * changes nothing. The result is the coarsest partition that is a strong bisimulation.
 *
 * Every call of {@link #execute()} works on a fresh partition, so one refiner may be executed
 * repeatedly. A refiner is not meant to be shared between threads.
 */
public class PartitionRefiner<S, A> {

    private static final Logger LOGGER = LoggerFactory.getLogger(PartitionRefiner.class);

    @NotNull
    private final TransitionIndex<S, A> index;

    /**
     * Upper bound on the number of passes; a partition of n states splits at most n - 1 times.
     */
    private final int maxPasses;

    public PartitionRefiner(@NotNull TransitionSystem<S, A> model) {
        this.index = new TransitionIndex<>(model);
        this.maxPasses = index.stateCount();
    }

    PartitionRefiner(@NotNull TransitionSystem<S, A> model, int maxPasses) {
        this.index = new TransitionIndex<>(model);
        this.maxPasses = maxPasses;
    }

    /**
     * Compute the bisimulation classes of the given system.
     */
    @NotNull
    public static <S, A> Partition<S> refine(@NotNull TransitionSystem<S, A> model) {
        return new PartitionRefiner<>(model).execute();
    }

    @NotNull
    public TransitionIndex<S, A> getIndex() {
        return index;
    }

    @NotNull
    public Partition<S> execute() {
        final Partition<S> partition = index.initialPartition();
        final int stateCount = index.stateCount();
        LOGGER.debug("Refining {} states, {} actions, {} transitions",
                stateCount, index.actionCount(), index.transitionCount());
        int passes = 0;
        boolean changed = true;
        while (changed) {
            passes += 1;
            if (passes > maxPasses) {
                throw new InvariantViolationException("Refinement of " + stateCount +
                        " states did not stabilise after " + maxPasses + " passes");
            }
            changed = pass(partition);
            partition.checkInvariant();
            LOGGER.debug("Pass {} finished with {} blocks", passes, partition.size());
        }
        LOGGER.debug("Stable after {} passes: {} blocks", passes, partition.size());
        return partition;
    }

    /**
     * True if no block of the partition can be split by any action.
     */
    public boolean isStable(@NotNull Partition<S> partition) {
        final int[] blockOf = partition.blockMap();
        for (int b = 0; b < partition.size(); b++) {
            int[] members = partition.members(b);
            if (members.length < 2) continue;
            for (int a : enabledActions(members)) {
                int[] reference = index.signature(members[0], a, blockOf);
                for (int i = 1; i < members.length; i++) {
                    if (!Arrays.equals(reference, index.signature(members[i], a, blockOf))) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    /**
     * One pass over the blocks present when the pass starts. Signatures are evaluated against the
     * block map as it was at the start of the pass. A block that splits is not examined again in
     * the same pass. Actions which no member enables give every member the empty signature and
     * are skipped.
     */
    private boolean pass(@NotNull Partition<S> partition) {
        final int[] snapshot = partition.snapshot();
        final int blockCount = partition.size();
        boolean changed = false;
        for (int b = 0; b < blockCount; b++) {
            final int[] members = partition.members(b);
            if (members.length < 2) continue;
            for (int a : enabledActions(members)) {
                if (split(partition, b, a, snapshot)) {
                    changed = true;
                    break;
                }
            }
        }
        return changed;
    }

    /**
     * Sorted, distinct ids of the actions enabled by at least one of the given states.
     */
    @NotNull
    private int[] enabledActions(@NotNull int[] members) {
        int total = 0;
        for (int m : members) {
            total += index.enabledActions(m).length;
        }
        if (total == 0) return new int[0];
        int[] result = new int[total];
        int i = 0;
        for (int m : members) {
            int[] enabled = index.enabledActions(m);
            System.arraycopy(enabled, 0, result, i, enabled.length);
            i += enabled.length;
        }
        Arrays.sort(result);
        int distinct = 1;
        for (i = 1; i < result.length; i++) {
            if (result[i] != result[distinct - 1]) {
                result[distinct++] = result[i];
            }
        }
        return Arrays.copyOf(result, distinct);
    }

    /**
     * Split block by action. The representative is the member with the smallest state id; members
     * with the same signature stay, the others move to a new block.
     */
    private boolean split(@NotNull Partition<S> partition, int block, int action, @NotNull int[] blockOf) {
        final int[] members = partition.members(block);
        if (members.length < 2) return false;
        final int[] reference = index.signature(members[0], action, blockOf);
        final int[] keep = new int[members.length];
        final int[] move = new int[members.length];
        int kept = 0;
        int moved = 0;
        for (int m : members) {
            if (Arrays.equals(reference, index.signature(m, action, blockOf))) {
                keep[kept++] = m;
            } else {
                move[moved++] = m;
            }
        }
        if (moved == 0) return false;
        int fresh = partition.split(block, Arrays.copyOf(keep, kept), Arrays.copyOf(move, moved));
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Block {} split by {}: {} stay, {} move to block {}",
                    block, index.action(action), kept, moved, fresh);
        }
        return true;
    }
}
