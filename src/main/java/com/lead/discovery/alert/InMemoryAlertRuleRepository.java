package com.lead.discovery.alert;

import com.lead.discovery.core.model.AlertRule;
import com.lead.discovery.core.model.AlertType;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryAlertRuleRepository implements AlertRuleRepository {

    private static final Comparator<AlertRule> OLDEST_FIRST =
            Comparator.comparing(AlertRule::getCreatedAt).thenComparing(AlertRule::getId);

    private final ConcurrentMap<String, AlertRule> rules = new ConcurrentHashMap<>();

    @Override
    public AlertRule save(AlertRule rule) {
        rules.put(rule.getId(), rule);
        return rule;
    }

    @Override
    public Optional<AlertRule> findById(String id) {
        return Optional.ofNullable(rules.get(id));
    }

    @Override
    public List<AlertRule> findActiveByType(AlertType type) {
        return rules.values().stream()
                .filter(r -> r.isActive() && r.getRuleType() == type)
                .sorted(OLDEST_FIRST)
                .toList();
    }

    @Override
    public List<AlertRule> findAll() {
        return rules.values().stream().sorted(OLDEST_FIRST).toList();
    }

    @Override
    public boolean delete(String id) {
        return rules.remove(id) != null;
    }
}
