package in.warmguard.application.monitoring;

import in.warmguard.application.health.EscalationListener;
import in.warmguard.domain.health.Escalation;
import in.warmguard.domain.health.HealthScoreBreakdown;
import in.warmguard.domain.monitoring.Alert;
import in.warmguard.domain.monitoring.AlertLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Alert notification service.
 *
 * Logs alerts through SLF4J at a level matching their severity. Registered as the
 * health engine's escalation listener so every escalation reaches operators as a
 * CRITICAL alert.
 */
public final class AlertService implements EscalationListener {
    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    public static final String HEALTH_ESCALATION = "HEALTH_ESCALATION";
    public static final String ACCOUNTS_SUSPENDED = "ACCOUNTS_SUSPENDED";

    /**
     * Send alert to configured channels.
     */
    public void sendAlert(Alert alert) {
        switch (alert.getLevel()) {
            case CRITICAL -> log.error("[ALERT-CRITICAL] {} - {}", alert.getAlertType(), describe(alert));
            case WARNING -> log.warn("[ALERT-WARNING] {} - {}", alert.getAlertType(), describe(alert));
            case INFO -> log.info("[ALERT-INFO] {} - {}", alert.getAlertType(), describe(alert));
        }

        if (!alert.getDetails().isEmpty()) {
            log.info("[ALERT-DETAILS] {}", alert.getDetails());
        }
    }

    @Override
    public void onEscalation(Escalation escalation) {
        HealthScoreBreakdown b = escalation.breakdown();
        sendAlert(Alert.builder()
            .alertType(HEALTH_ESCALATION)
            .level(AlertLevel.CRITICAL)
            .accountId(escalation.accountId())
            .message(String.format("Account %d health critically low (%d/100). Manual review required.",
                escalation.accountId(), escalation.healthScore()))
            .timestamp(escalation.createdAt())
            .detail("reason", escalation.reason())
            .detail("loginSuccessRate", b.loginSuccessRate())
            .detail("postSuccessRate", b.postSuccessRate())
            .detail("engagementNaturalnessScore", b.engagementNaturalnessScore())
            .detail("freezeRiskScore", b.freezeRiskScore())
            .build());
    }

    /**
     * Send WARNING level alert.
     */
    public void sendWarningAlert(String alertType, String message) {
        sendAlert(Alert.builder()
            .alertType(alertType)
            .level(AlertLevel.WARNING)
            .message(message)
            .build());
    }

    private static String describe(Alert alert) {
        return alert.getAccountId() == null
            ? alert.getMessage()
            : "account=" + alert.getAccountId() + " " + alert.getMessage();
    }
}
