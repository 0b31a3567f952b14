package com.lead.discovery.alert;

import com.lead.discovery.core.model.Alert;
import com.lead.discovery.core.model.AlertChannel;
import com.lead.discovery.core.model.AlertRule;

/**
 * Delivers alerts over an external channel such as email or a webhook.
 * Implementations live outside the engine and are registered on the dispatcher.
 */
public interface AlertNotifier {

    AlertChannel channel();

    /**
     * Sends the alert to the rule's recipients or webhook. Failures are reported by throwing;
     * the dispatcher logs them and carries on.
     */
    void send(AlertRule rule, Alert alert);
}
