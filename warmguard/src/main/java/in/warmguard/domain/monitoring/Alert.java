package in.warmguard.domain.monitoring;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator-facing notification raised by the safety core.
 */
public class Alert {
    private final String alertType;
    private final AlertLevel level;
    private final Long accountId;
    private final String message;
    private final Instant timestamp;
    private final Map<String, Object> details;

    private Alert(Builder builder) {
        this.alertType = builder.alertType;
        this.level = builder.level;
        this.accountId = builder.accountId;
        this.message = builder.message;
        this.timestamp = builder.timestamp;
        this.details = new LinkedHashMap<>(builder.details);
    }

    public String getAlertType() {
        return alertType;
    }

    public AlertLevel getLevel() {
        return level;
    }

    /**
     * Account the alert concerns, null for fleet-wide alerts.
     */
    public Long getAccountId() {
        return accountId;
    }

    public String getMessage() {
        return message;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getDetails() {
        return new LinkedHashMap<>(details);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String alertType;
        private AlertLevel level;
        private Long accountId;
        private String message;
        private Instant timestamp = Instant.now();
        private final Map<String, Object> details = new LinkedHashMap<>();

        public Builder alertType(String alertType) {
            this.alertType = alertType;
            return this;
        }

        public Builder level(AlertLevel level) {
            this.level = level;
            return this;
        }

        public Builder accountId(long accountId) {
            this.accountId = accountId;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder detail(String key, Object value) {
            this.details.put(key, value);
            return this;
        }

        public Alert build() {
            if (alertType == null || level == null || message == null) {
                throw new IllegalStateException("alertType, level, and message are required");
            }
            return new Alert(this);
        }
    }

    @Override
    public String toString() {
        return accountId == null
            ? String.format("[%s] %s: %s (%s)", level, alertType, message, timestamp)
            : String.format("[%s] %s account=%d: %s (%s)", level, alertType, accountId, message, timestamp);
    }
}
