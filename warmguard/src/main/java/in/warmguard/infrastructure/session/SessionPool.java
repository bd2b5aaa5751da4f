package in.warmguard.infrastructure.session;

import in.warmguard.application.health.AccountLocks;
import in.warmguard.application.port.output.AutomationContext;
import in.warmguard.application.port.output.AutomationEngine;
import in.warmguard.application.port.output.SessionStateStore;
import in.warmguard.config.SafetyConfig.PoolSettings;
import in.warmguard.domain.session.ContextOptions;
import in.warmguard.domain.session.ProxyConfig;
import in.warmguard.domain.session.SessionCreationException;
import in.warmguard.domain.session.SessionPersistenceException;
import in.warmguard.domain.session.SessionStatus;
import in.warmguard.infrastructure.metrics.SafetyMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded pool of automation sessions shared by many accounts.
 *
 * At most one session per account and at most {@code maxConcurrent} sessions overall,
 * counting sessions still being created. When full, the least recently used session is
 * persisted and closed to make room. The engine starts lazily with the first session and
 * stops when an idle sweep leaves the pool empty.
 *
 * Lock order: account lock, then the capacity lock, then the engine lock.
 */
public final class SessionPool {
    private static final Logger log = LoggerFactory.getLogger(SessionPool.class);

    static final String EVICTED = "EVICTED";
    static final String IDLE = "IDLE";
    static final String RELEASED = "RELEASED";
    static final String DELETED = "DELETED";

    private final AutomationEngine engine;
    private final SessionStateStore stateStore;
    private final int maxConcurrent;
    private final Duration idleTimeout;
    private final SafetyMetrics metrics;
    private final Clock clock;

    private final Map<Long, ManagedSession> sessions = new ConcurrentHashMap<>();
    private final AccountLocks accountLocks = new AccountLocks();

    private final ReentrantLock capacityLock = new ReentrantLock();
    private final Condition slotFreed = capacityLock.newCondition();
    private int reserved;  // guarded by capacityLock

    private final Object engineLock = new Object();

    public SessionPool(
            AutomationEngine engine,
            SessionStateStore stateStore,
            PoolSettings settings,
            SafetyMetrics metrics,
            Clock clock) {
        this.engine = engine;
        this.stateStore = stateStore;
        this.maxConcurrent = settings.maxConcurrent();
        this.idleTimeout = settings.idleTimeout();
        this.metrics = metrics;
        this.clock = clock;
    }

    // ========================================================================
    // Acquire / save / release
    // ========================================================================

    public AutomationContext acquireContext(long accountId) {
        return acquireContext(accountId, null);
    }

    /**
     * Return the account's live context, or open one restoring its persisted state.
     *
     * @param proxy optional proxy, used only when a new context is opened
     * @throws SessionCreationException when the engine cannot open a context
     */
    public AutomationContext acquireContext(long accountId, ProxyConfig proxy) {
        return accountLocks.withLock(accountId, () -> {
            ManagedSession existing = sessions.get(accountId);
            if (existing != null) {
                existing.touch(clock.instant());
                metrics.recordSessionAcquired(true);
                return existing.context();
            }

            reserveSlot();
            try {
                AutomationContext context = openContext(accountId, proxy);
                ManagedSession session = new ManagedSession(accountId, context, clock.instant());
                capacityLock.lock();
                try {
                    sessions.put(accountId, session);
                    reserved--;
                } finally {
                    capacityLock.unlock();
                }
                metrics.recordSessionAcquired(false);
                metrics.setActiveSessions(sessions.size());
                log.info("[POOL] Opened session for account {} ({}/{})", accountId, sessions.size(), maxConcurrent);
                return context;
            } catch (RuntimeException e) {
                releaseReservation();
                metrics.recordSessionCreationFailure();
                if (e instanceof SessionCreationException) {
                    throw e;
                }
                throw new SessionCreationException(accountId, "Failed to open automation context: " + e.getMessage(), e);
            }
        });
    }

    private AutomationContext openContext(long accountId, ProxyConfig proxy) {
        ensureEngine();
        String storageState = stateStore.load(accountId).orElse(null);
        if (storageState != null) {
            log.debug("[POOL] Restoring persisted state for account {}", accountId);
        }
        return engine.newContext(new ContextOptions(accountId, proxy, storageState));
    }

    /**
     * Persist the account's session state without closing it. No-op when the account has no session.
     *
     * @throws SessionPersistenceException when the state cannot be exported or stored
     */
    public void saveSession(long accountId) {
        accountLocks.run(accountId, () -> {
            ManagedSession session = sessions.get(accountId);
            if (session == null) {
                return;
            }
            try {
                stateStore.save(accountId, session.context().storageState());
            } catch (SessionPersistenceException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new SessionPersistenceException(accountId, "Failed to export session state: " + e.getMessage(), e);
            }
        });
    }

    /**
     * Persist, close and remove the account's session. No-op when absent.
     * Persist and close failures are logged; the slot is always freed.
     */
    public void releaseContext(long accountId) {
        accountLocks.run(accountId, () -> {
            ManagedSession session = sessions.get(accountId);
            if (session != null) {
                release(session, RELEASED);
            }
        });
    }

    /**
     * Release the account's session and drop its persisted state.
     */
    public void deleteSession(long accountId) {
        accountLocks.run(accountId, () -> {
            ManagedSession session = sessions.get(accountId);
            if (session != null) {
                release(session, DELETED);
            }
            stateStore.delete(accountId);
        });
    }

    /**
     * Check whether the account's session is still logged in.
     *
     * Uses the live context when there is one; otherwise opens one from persisted state
     * and releases it afterwards. Without live or persisted state the account needs a login.
     * A failing check reports {@link SessionStatus#EXPIRED}.
     */
    public SessionStatus checkSessionHealth(long accountId) {
        return accountLocks.withLock(accountId, () -> {
            boolean live = sessions.containsKey(accountId);
            if (!live && !stateStore.exists(accountId)) {
                log.info("[POOL] No session for account {}, login required", accountId);
                return SessionStatus.NEEDS_LOGIN;
            }
            try {
                SessionStatus status = acquireContext(accountId).isLoggedIn() ? SessionStatus.ACTIVE : SessionStatus.EXPIRED;
                log.info("[POOL] Session health for account {}: {}", accountId, status);
                return status;
            } catch (RuntimeException e) {
                log.warn("[POOL] Session health check failed for account {}: {}", accountId, e.getMessage());
                return SessionStatus.EXPIRED;
            } finally {
                if (!live) {
                    releaseContext(accountId);
                }
            }
        });
    }

    public boolean hasPersistedSession(long accountId) {
        return stateStore.exists(accountId);
    }

    public Set<Long> activeAccountIds() {
        return Set.copyOf(sessions.keySet());
    }

    public int size() {
        return sessions.size();
    }

    // ========================================================================
    // Maintenance
    // ========================================================================

    /**
     * Release sessions unused for longer than the idle timeout, measured at sweep start.
     * Stops the engine when the pool ends up empty.
     *
     * @return number of sessions released
     */
    public int reclaimIdle() {
        Instant threshold = clock.instant().minus(idleTimeout);
        List<ManagedSession> candidates = new ArrayList<>();
        for (ManagedSession session : sessions.values()) {
            if (session.idleSince(threshold)) {
                candidates.add(session);
            }
        }

        int reclaimed = 0;
        for (ManagedSession candidate : candidates) {
            boolean released = accountLocks.withLock(candidate.accountId(), () -> {
                // Re-check: the account may have been used or released since the scan.
                if (sessions.get(candidate.accountId()) != candidate || !candidate.idleSince(threshold)) {
                    return false;
                }
                release(candidate, IDLE);
                return true;
            });
            if (released) {
                reclaimed++;
            }
        }

        if (reclaimed > 0) {
            log.info("[POOL] Reclaimed {} idle session(s), {} remaining", reclaimed, sessions.size());
        }
        stopEngineIfEmpty();
        return reclaimed;
    }

    /**
     * Release every session in parallel, waiting at most {@code timeout}, then stop the engine.
     */
    public void shutdownAll(Duration timeout) {
        List<Long> accountIds = new ArrayList<>(sessions.keySet());
        log.info("[POOL] Shutting down {} session(s)", accountIds.size());

        if (!accountIds.isEmpty()) {
            ExecutorService executor = Executors.newFixedThreadPool(accountIds.size(), r -> {
                Thread t = new Thread(r, "session-pool-shutdown");
                t.setDaemon(true);
                return t;
            });
            List<Callable<Void>> jobs = new ArrayList<>();
            for (Long accountId : accountIds) {
                jobs.add(() -> {
                    releaseContext(accountId);
                    return null;
                });
            }
            try {
                List<Future<Void>> results = executor.invokeAll(jobs, timeout.toMillis(), TimeUnit.MILLISECONDS);
                long unfinished = results.stream().filter(Future::isCancelled).count();
                if (unfinished > 0) {
                    log.warn("[POOL] {} session(s) did not release within {}", unfinished, timeout);
                }
            } catch (InterruptedException e) {
                log.warn("[POOL] Interrupted while releasing sessions");
                Thread.currentThread().interrupt();
            } finally {
                executor.shutdownNow();
            }
        }

        synchronized (engineLock) {
            shutdownEngine();
        }
        log.info("[POOL] Shutdown complete");
    }

    // ========================================================================
    // Internals
    // ========================================================================

    /**
     * Claim a slot for a session about to be created, evicting the least recently used
     * session while the pool is full. Waits only when every slot belongs to a session
     * still being created.
     */
    private void reserveSlot() {
        while (true) {
            ManagedSession victim;
            capacityLock.lock();
            try {
                while (true) {
                    if (sessions.size() + reserved < maxConcurrent) {
                        reserved++;
                        return;
                    }
                    victim = leastRecentlyUsed();
                    if (victim != null) {
                        break;
                    }
                    slotFreed.awaitUninterruptibly();
                }
            } finally {
                capacityLock.unlock();
            }
            evict(victim);
        }
    }

    private ManagedSession leastRecentlyUsed() {
        return sessions.values().stream()
            .min(Comparator.comparing(ManagedSession::lastUsedAt))
            .orElse(null);
    }

    private void evict(ManagedSession victim) {
        accountLocks.run(victim.accountId(), () -> {
            if (sessions.get(victim.accountId()) == victim) {
                log.info("[POOL] At capacity ({}), evicting least recently used session of account {}",
                    maxConcurrent, victim.accountId());
                release(victim, EVICTED);
            }
        });
    }

    /**
     * Persist then close {@code session} and free its slot. Caller holds the account lock.
     */
    private void release(ManagedSession session, String cause) {
        long accountId = session.accountId();
        try {
            stateStore.save(accountId, session.context().storageState());
        } catch (RuntimeException e) {
            log.warn("[POOL] Failed to persist session state for account {}: {}", accountId, e.getMessage());
        }
        try {
            session.context().close();
        } catch (RuntimeException e) {
            log.warn("[POOL] Failed to close session for account {}: {}", accountId, e.getMessage());
        }

        capacityLock.lock();
        try {
            sessions.remove(accountId, session);
            slotFreed.signalAll();
        } finally {
            capacityLock.unlock();
        }
        metrics.recordSessionReleased(cause);
        metrics.setActiveSessions(sessions.size());
        log.debug("[POOL] Released session for account {} ({})", accountId, cause);
    }

    private void releaseReservation() {
        capacityLock.lock();
        try {
            reserved--;
            slotFreed.signalAll();
        } finally {
            capacityLock.unlock();
        }
    }

    private void ensureEngine() {
        synchronized (engineLock) {
            if (!engine.isRunning()) {
                log.info("[POOL] Launching automation engine");
                engine.start();
            }
        }
    }

    private void stopEngineIfEmpty() {
        capacityLock.lock();
        try {
            if (sessions.isEmpty() && reserved == 0) {
                synchronized (engineLock) {
                    shutdownEngine();
                }
            }
        } finally {
            capacityLock.unlock();
        }
    }

    private void shutdownEngine() {
        if (!engine.isRunning()) {
            return;
        }
        try {
            engine.shutdown();
            log.info("[POOL] Automation engine stopped");
        } catch (RuntimeException e) {
            log.warn("[POOL] Failed to stop automation engine: {}", e.getMessage());
        }
    }
}
