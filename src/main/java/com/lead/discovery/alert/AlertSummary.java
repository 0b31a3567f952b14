package com.lead.discovery.alert;

import com.lead.discovery.core.model.AlertType;

import java.time.Instant;
import java.util.Map;

/**
 * Alert counts over a window ending now.
 *
 * @param since         start of the window
 * @param total         alerts created in the window
 * @param newCount      still NEW
 * @param readCount     READ
 * @param actionedCount ACTIONED
 * @param dismissedCount DISMISSED
 * @param urgentCount   URGENT priority
 * @param highCount     HIGH priority
 * @param byType        counts per alert type, largest first
 */
public record AlertSummary(
        Instant since,
        long total,
        long newCount,
        long readCount,
        long actionedCount,
        long dismissedCount,
        long urgentCount,
        long highCount,
        Map<AlertType, Long> byType
) {
}
