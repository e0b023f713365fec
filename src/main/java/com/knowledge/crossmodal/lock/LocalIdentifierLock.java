package com.knowledge.crossmodal.lock;

import com.knowledge.crossmodal.error.OperationTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process identifier lock backed by one {@link ReentrantLock} per key.
 * Suitable for single-JVM deployments. This is the default lock implementation.
 */
public class LocalIdentifierLock implements IdentifierLock {
    private static final Logger log = LoggerFactory.getLogger(LocalIdentifierLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalIdentifierLock() {
        this(LockConfig.defaults());
    }

    public LocalIdentifierLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public void lock(String key) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        try {
            boolean acquired = lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new OperationTimeoutException(key,
                        "Failed to acquire lock for '" + key + "' within " + config.timeoutMs() + "ms");
            }
            log.trace("lock.acquired key={}", key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationTimeoutException(key, "Interrupted while acquiring lock for '" + key + "'", e);
        }
    }

    @Override
    public void unlock(String key) {
        ReentrantLock lock = locks.get(key);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.trace("lock.released key={}", key);
        }
    }

    @Override
    public LockHandle lockAll(Collection<String> keys) {
        Deque<String> held = new ArrayDeque<>();
        try {
            for (String key : new TreeSet<>(keys)) {
                lock(key);
                held.push(key);
            }
        } catch (RuntimeException e) {
            releaseAll(held);
            throw e;
        }
        return () -> releaseAll(held);
    }

    private void releaseAll(Deque<String> held) {
        while (!held.isEmpty()) {
            unlock(held.pop());
        }
    }

    /**
     * Whether any thread currently holds the lock for the key.
     */
    public boolean isLocked(String key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isLocked();
    }
}
