package com.lead.discovery.alert;

import com.lead.discovery.core.model.Alert;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * System of record for alerts.
 */
public interface AlertRepository {

    Alert save(Alert alert);

    Optional<Alert> findById(String id);

    /**
     * Alerts passing the filter, newest first, at most {@link AlertFilter#getLimit()}.
     */
    List<Alert> find(AlertFilter filter);

    List<Alert> findCreatedSince(Instant since);

    /**
     * Deletes ACTIONED and DISMISSED alerts created before the cutoff.
     *
     * @return number deleted
     */
    int deleteResolvedBefore(Instant cutoff);

    long count();
}
