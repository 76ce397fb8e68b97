package me.internalizable.proxyfleet.manager.process;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One exclusive lock per instance name.
 *
 * <p>Everything that changes an instance's process or files runs under its
 * lock, so concurrent requests for one instance serialize while requests for
 * different instances run in parallel. Locks are reentrant: an update that
 * holds the lock may restart the daemon, which takes it again.</p>
 */
public class InstanceLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Run an action while holding an instance's lock.
     *
     * @param name instance name
     * @param action the action
     * @param <T> result type
     * @return the action's result
     */
    public <T> T withLock(@Nonnull String name, @Nonnull Supplier<T> action) {
        Objects.requireNonNull(action, "action");
        ReentrantLock lock = lockFor(name);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run an action without result while holding an instance's lock.
     *
     * @param name instance name
     * @param action the action
     */
    public void runLocked(@Nonnull String name, @Nonnull Runnable action) {
        Objects.requireNonNull(action, "action");
        withLock(name, () -> {
            action.run();
            return null;
        });
    }

    @Nonnull
    private ReentrantLock lockFor(String name) {
        Objects.requireNonNull(name, "name");
        return locks.computeIfAbsent(name, k -> new ReentrantLock());
    }
}
