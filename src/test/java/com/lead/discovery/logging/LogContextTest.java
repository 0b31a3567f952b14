package com.lead.discovery.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forMerge should set correlation and both profile ids")
    void forMergeSetsMDC() {
        try (LogContext ctx = LogContext.forMerge("corr-1", "p-source", "p-target")) {
            assertEquals("corr-1", MDC.get("correlationId"));
            assertEquals("p-source", MDC.get("sourceProfileId"));
            assertEquals("p-target", MDC.get("targetProfileId"));
            assertEquals("merge", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forMatching should set leadId and operation")
    void forMatchingSetsMDC() {
        try (LogContext ctx = LogContext.forMatching("corr-2", "lead-1")) {
            assertEquals("lead-1", MDC.get("leadId"));
            assertEquals("match", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forAlert should default a missing lead to none")
    void forAlertWithoutLead() {
        try (LogContext ctx = LogContext.forAlert("high_score_match", null)) {
            assertEquals("none", MDC.get("leadId"));
            assertEquals("high_score_match", MDC.get("alertType"));
        }
    }

    @Test
    @DisplayName("Keys should be removed on close")
    void keysRemovedOnClose() {
        try (LogContext ctx = LogContext.forDiscovery("batch-1").with("directory", "chamber")) {
            assertEquals("batch-1", MDC.get("batchId"));
            assertEquals("chamber", MDC.get("directory"));
        }
        assertNull(MDC.get("batchId"));
        assertNull(MDC.get("directory"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("Keys set outside the context should survive close")
    void unrelatedKeysSurvive() {
        MDC.put("requestId", "r-1");
        try (LogContext ctx = LogContext.forRanking("corr-3", "svc-1")) {
            assertEquals("svc-1", MDC.get("serviceId"));
        }
        assertEquals("r-1", MDC.get("requestId"));
    }

    @Test
    @DisplayName("Correlation ids should be unique")
    void correlationIdsUnique() {
        assertNotEquals(LogContext.generateCorrelationId(), LogContext.generateCorrelationId());
    }
}
