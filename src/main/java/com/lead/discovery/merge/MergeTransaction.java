package com.lead.discovery.merge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Compensating transaction for profile merges. Each step registers its undo; if a step
 * fails, or the transaction is closed without {@link #markSuccess()}, the undos run in
 * reverse order so no identifier is left pointing at a half-merged profile.
 *
 * <pre>
 * try (MergeTransaction tx = new MergeTransaction()) {
 *     tx.execute("reassign identifiers", () -> assign(ids, target), () -> assign(ids, source));
 *     tx.execute("delete source", () -> delete(source), () -> restore(source));
 *     tx.markSuccess();
 * }
 * </pre>
 */
public class MergeTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MergeTransaction.class);

    private final Deque<CompensatingAction> compensationStack = new ArrayDeque<>();
    private boolean success = false;
    private boolean closed = false;

    /**
     * Runs {@code operation} and registers {@code compensation} for it. On failure every
     * previously registered compensation runs and the exception is rethrown.
     */
    public void execute(String description, Runnable operation, Runnable compensation) {
        ensureOpen();
        try {
            log.debug("merge.step description={}", description);
            operation.run();
            compensationStack.push(new CompensatingAction(description, compensation));
        } catch (RuntimeException e) {
            log.warn("merge.step.failed description={} error={}", description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    /**
     * Runs an append-only step (audit) that has nothing to undo.
     */
    public void executeNoCompensation(String description, Runnable operation) {
        ensureOpen();
        try {
            log.debug("merge.step description={} compensated=false", description);
            operation.run();
        } catch (RuntimeException e) {
            log.warn("merge.step.failed description={} error={}", description, e.getMessage());
            runCompensations();
            throw e;
        }
    }

    public void markSuccess() {
        this.success = true;
    }

    public boolean isSuccess() {
        return success;
    }

    int pendingCompensations() {
        return compensationStack.size();
    }

    @Override
    public void close() {
        if (!closed && !success) {
            log.warn("merge.transaction.rollback steps={}", compensationStack.size());
            runCompensations();
        }
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Transaction is already closed");
        }
    }

    private void runCompensations() {
        while (!compensationStack.isEmpty()) {
            CompensatingAction action = compensationStack.pop();
            try {
                log.debug("merge.compensate description={}", action.description());
                action.compensation().run();
            } catch (RuntimeException e) {
                // best effort, keep unwinding the remaining steps
                log.error("merge.compensate.failed description={} error={}", action.description(), e.getMessage());
            }
        }
    }

    private record CompensatingAction(String description, Runnable compensation) {
    }
}
