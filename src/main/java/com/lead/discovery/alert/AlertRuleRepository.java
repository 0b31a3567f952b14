package com.lead.discovery.alert;

import com.lead.discovery.core.model.AlertRule;
import com.lead.discovery.core.model.AlertType;

import java.util.List;
import java.util.Optional;

/**
 * Alert rules are configuration, so only an in-memory implementation exists.
 */
public interface AlertRuleRepository {

    AlertRule save(AlertRule rule);

    Optional<AlertRule> findById(String id);

    List<AlertRule> findActiveByType(AlertType type);

    List<AlertRule> findAll();

    boolean delete(String id);
}
