package in.warmguard.infrastructure.session;

import in.warmguard.application.port.output.AutomationContext;

import java.time.Instant;

/**
 * Pool entry: one live automation context owned by one account.
 */
public final class ManagedSession {

    private final long accountId;
    private final AutomationContext context;
    private final Instant createdAt;
    private volatile Instant lastUsedAt;

    ManagedSession(long accountId, AutomationContext context, Instant createdAt) {
        this.accountId = accountId;
        this.context = context;
        this.createdAt = createdAt;
        this.lastUsedAt = createdAt;
    }

    public long accountId() {
        return accountId;
    }

    public AutomationContext context() {
        return context;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastUsedAt() {
        return lastUsedAt;
    }

    void touch(Instant now) {
        this.lastUsedAt = now;
    }

    boolean idleSince(Instant threshold) {
        return lastUsedAt.isBefore(threshold);
    }
}
