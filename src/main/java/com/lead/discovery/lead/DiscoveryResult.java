package com.lead.discovery.lead;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one discovery batch. Failed or timed-out directory calls and listings that could
 * not become leads are reported in {@code errors}; they never fail the batch.
 *
 * @param batchId       correlation id of the run
 * @param leadIds       ids of the leads created, in discovery order
 * @param errors        one message per failed task or listing
 * @param tasksSubmitted directory calls submitted
 * @param tasksFailed   directory calls that failed or timed out
 * @param duration      wall-clock time of the run
 */
public record DiscoveryResult(
        String batchId,
        List<String> leadIds,
        List<String> errors,
        int tasksSubmitted,
        int tasksFailed,
        Duration duration
) {
    public DiscoveryResult {
        leadIds = List.copyOf(leadIds);
        errors = List.copyOf(errors);
    }

    public int leadCount() {
        return leadIds.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
