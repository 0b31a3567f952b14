package com.lead.discovery.alert;

import com.lead.discovery.core.model.Alert;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory {@link AlertRepository}.
 */
public class InMemoryAlertRepository implements AlertRepository {

    private static final Comparator<Alert> NEWEST_FIRST =
            Comparator.comparing(Alert::getCreatedAt).reversed().thenComparing(Alert::getId);

    private final ConcurrentMap<String, Alert> alerts = new ConcurrentHashMap<>();

    @Override
    public Alert save(Alert alert) {
        alerts.put(alert.getId(), copy(alert));
        return alert;
    }

    @Override
    public Optional<Alert> findById(String id) {
        return Optional.ofNullable(alerts.get(id)).map(InMemoryAlertRepository::copy);
    }

    @Override
    public List<Alert> find(AlertFilter filter) {
        return alerts.values().stream()
                .filter(filter::test)
                .sorted(NEWEST_FIRST)
                .limit(filter.getLimit())
                .map(InMemoryAlertRepository::copy)
                .toList();
    }

    @Override
    public List<Alert> findCreatedSince(Instant since) {
        return alerts.values().stream()
                .filter(a -> a.getCreatedAt().isAfter(since))
                .sorted(NEWEST_FIRST)
                .map(InMemoryAlertRepository::copy)
                .toList();
    }

    @Override
    public int deleteResolvedBefore(Instant cutoff) {
        int before = alerts.size();
        alerts.values().removeIf(a -> a.getStatus().isTerminal() && a.getCreatedAt().isBefore(cutoff));
        return before - alerts.size();
    }

    @Override
    public long count() {
        return alerts.size();
    }

    private static Alert copy(Alert alert) {
        return Alert.builder(alert).build();
    }
}
