package in.warmguard.domain.health;

import java.time.Instant;
import java.util.Locale;

/**
 * A suspected platform freeze observed for an account.
 *
 * {@code confidence} is 0-100; detectors that could not estimate it store 0.
 */
public record FreezeDetection(
    Long id,
    long accountId,
    FreezeType freezeType,
    int confidence,
    Instant detectedAt
) {
    public enum FreezeType {
        IP_BLOCK,
        DEVICE_BLOCK,
        ACCOUNT_FREEZE,
        UNKNOWN;

        public String dbValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static FreezeType fromDbValue(String value) {
            return FreezeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public static FreezeDetection of(long accountId, FreezeType type, int confidence, Instant detectedAt) {
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be within 0-100: " + confidence);
        }
        return new FreezeDetection(null, accountId, type, confidence, detectedAt);
    }
}
