package com.github.sybila.bisim.refine;

import com.github.sybila.bisim.Models;
import com.github.sybila.bisim.lts.ExplicitTransitionSystem;
import com.github.sybila.bisim.lts.InvalidModelException;
import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;

final class TransitionIndexTest {

    private final ExplicitTransitionSystem<String, String> lts = Models.of(
            "x a y",
            "x a z",
            "y b x",
            "z b z");

    @Test
    void testNumbering() {
        TransitionIndex<String, String> index = new TransitionIndex<>(lts);
        assertThat(index.stateCount()).isEqualTo(3);
        assertThat(index.actionCount()).isEqualTo(2);
        assertThat(index.transitionCount()).isEqualTo(4);
        assertThat(index.stateId("x")).isEqualTo(0);
        assertThat(index.state(2)).isEqualTo("z");
        assertThat(index.actionId("b")).isEqualTo(1);
        assertThat(index.action(0)).isEqualTo("a");
    }

    @Test
    void testSuccessors() {
        TransitionIndex<String, String> index = new TransitionIndex<>(lts);
        assertThat(index.successors("x", "a")).containsExactly("y", "z");
        assertThat(index.successors("x", "b")).isEmpty();
        assertThat(index.successors("z", "b")).containsExactly("z");
    }

    @Test
    void testSignatureFollowsPartition() {
        TransitionIndex<String, String> index = new TransitionIndex<>(lts);
        Partition<String> partition = index.initialPartition();
        assertThat(index.signature("x", "a", partition)).containsExactly(0);
        assertThat(index.signature("y", "a", partition)).isEmpty();

        // move z into its own block
        partition.split(0, new int[] { 0, 1 }, new int[] { 2 });
        assertThat(index.signature("x", "a", partition)).containsExactly(0, 1);
        assertThat(index.signature("y", "b", partition)).containsExactly(0);
        assertThat(index.signature("z", "b", partition)).containsExactly(1);
    }

    @Test
    void testUnknownStateOrAction() {
        TransitionIndex<String, String> index = new TransitionIndex<>(lts);
        assertThatThrownBy(() -> index.successors("w", "a")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> index.successors("x", "c")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testManyLabelsStaySparse() {
        // states times actions is far beyond the int range
        ExplicitTransitionSystem.Builder<String, String> builder = ExplicitTransitionSystem.builder();
        for (int i = 0; i < 33_000; i++) {
            builder.addTransition("s" + i, "a" + i, "t" + i);
        }
        for (int i = 0; i < 33_000; i++) {
            builder.addState("u" + i);
        }
        ExplicitTransitionSystem<String, String> wide;
        try {
            wide = builder.build();
        } catch (InvalidModelException e) {
            throw new AssertionError(e);
        }
        TransitionIndex<String, String> index = new TransitionIndex<>(wide);
        assertThat((long) index.stateCount() * index.actionCount()).isGreaterThan(Integer.MAX_VALUE);
        assertThat(index.transitionCount()).isEqualTo(33_000);
        assertThat(index.successors("s32999", "a32999")).containsExactly("t32999");
        assertThat(index.successors("s32999", "a0")).isEmpty();
        assertThat(index.successors("u32999", "a32999")).isEmpty();
        assertThat(index.enabledActions(index.stateId("s17"))).containsExactly(index.actionId("a17"));
        assertThat(index.enabledActions(index.stateId("t17"))).isEmpty();

        Partition<String> partition = index.initialPartition();
        assertThat(index.signature("s32999", "a32999", partition)).containsExactly(0);
        assertThat(index.signature("u32999", "a32999", partition)).isEmpty();
    }

    @Test
    void testEnabledActionsAreSorted() {
        TransitionIndex<String, String> index = new TransitionIndex<>(Models.of(
                "p b q",
                "q a p",
                "q b p"));
        assertThat(index.enabledActions(index.stateId("p"))).containsExactly(0);
        assertThat(index.enabledActions(index.stateId("q"))).containsExactly(0, 1);
    }

    @Test
    void testNoActions() {
        TransitionIndex<String, String> index = new TransitionIndex<>(Models.deadlock("s"));
        assertThat(index.stateCount()).isEqualTo(1);
        assertThat(index.actionCount()).isZero();
        assertThat(index.transitionCount()).isZero();
    }
}
