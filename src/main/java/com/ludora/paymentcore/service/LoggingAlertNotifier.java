package com.ludora.paymentcore.service;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Default notifier: one ERROR line with the alert type in MDC, for log-based alerting rules.
 */
@Component
@Slf4j
public class LoggingAlertNotifier implements AlertNotifier {

    static final String MDC_ALERT_TYPE = "alert_type";

    @Override
    public void alert(AlertType type, String message, Map<String, Object> context) {
        MDC.put(MDC_ALERT_TYPE, type.name());
        try {
            log.error("[ALERT] type={}, message={}, context={}", type, message, context);
        } finally {
            MDC.remove(MDC_ALERT_TYPE);
        }
    }
}
