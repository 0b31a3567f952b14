package com.lead.discovery.merge;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the compensating merge transaction.
 */
class MergeTransactionTest {

    @Test
    void successfulTransaction_noCompensationsRun() {
        List<String> log = new ArrayList<>();

        try (MergeTransaction tx = new MergeTransaction()) {
            tx.execute("reassign", () -> log.add("op1"), () -> log.add("undo1"));
            tx.execute("delete source", () -> log.add("op2"), () -> log.add("undo2"));
            tx.markSuccess();
        }

        assertEquals(List.of("op1", "op2"), log);
    }

    @Test
    void failedStep_undoesEarlierStepsInReverse() {
        List<String> log = new ArrayList<>();

        assertThrows(IllegalStateException.class, () -> {
            try (MergeTransaction tx = new MergeTransaction()) {
                tx.execute("reassign", () -> log.add("op1"), () -> log.add("undo1"));
                tx.execute("union fields", () -> log.add("op2"), () -> log.add("undo2"));
                tx.execute("delete source", () -> {
                    throw new IllegalStateException("store down");
                }, () -> log.add("undo3"));
            }
        });

        assertEquals(List.of("op1", "op2", "undo2", "undo1"), log);
    }

    @Test
    void closedWithoutSuccess_rollsBack() {
        List<String> log = new ArrayList<>();

        MergeTransaction tx = new MergeTransaction();
        tx.execute("reassign", () -> log.add("op1"), () -> log.add("undo1"));
        tx.close();

        assertEquals(List.of("op1", "undo1"), log);
        assertFalse(tx.isSuccess());
    }

    @Test
    void failingCompensation_doesNotStopTheOthers() {
        List<String> log = new ArrayList<>();

        MergeTransaction tx = new MergeTransaction();
        tx.execute("step1", () -> log.add("op1"), () -> log.add("undo1"));
        tx.execute("step2", () -> log.add("op2"), () -> {
            throw new RuntimeException("undo failed");
        });
        tx.close();

        assertEquals(List.of("op1", "op2", "undo1"), log);
    }

    @Test
    void executeNoCompensation_registersNothing() {
        MergeTransaction tx = new MergeTransaction();
        tx.executeNoCompensation("audit", () -> { });

        assertEquals(0, tx.pendingCompensations());
        tx.markSuccess();
        tx.close();
    }

    @Test
    void executeAfterClose_throws() {
        MergeTransaction tx = new MergeTransaction();
        tx.markSuccess();
        tx.close();

        assertThrows(IllegalStateException.class, () -> tx.execute("late", () -> { }, () -> { }));
    }
}
