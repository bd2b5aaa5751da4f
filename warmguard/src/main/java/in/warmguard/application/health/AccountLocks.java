package in.warmguard.application.health;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per account id.
 *
 * Every read-modify-write of an account's health record runs under its lock, so
 * gate reservations, score updates and counter resets for the same account never
 * interleave. Different accounts proceed in parallel.
 */
public final class AccountLocks {

    private final ConcurrentHashMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(long accountId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(accountId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void run(long accountId, Runnable action) {
        withLock(accountId, () -> {
            action.run();
            return null;
        });
    }
}
