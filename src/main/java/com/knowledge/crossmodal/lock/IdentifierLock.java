package com.knowledge.crossmodal.lock;

import java.util.Collection;

/**
 * Per-identifier mutual exclusion. Operations on different identifiers never contend;
 * there is no global lock.
 */
public interface IdentifierLock {

    /**
     * Acquires the lock for one identifier, waiting at most the configured timeout.
     *
     * @throws com.knowledge.crossmodal.error.OperationTimeoutException if the lock was not acquired in time
     */
    void lock(String key);

    /**
     * Releases the lock held by the current thread, if any.
     */
    void unlock(String key);

    /**
     * Acquires every key in ascending order and returns a handle that releases them in reverse.
     * The fixed order keeps two callers locking overlapping key sets from deadlocking.
     * If one key times out, keys already taken are released before the exception propagates.
     */
    LockHandle lockAll(Collection<String> keys);

    /**
     * Locks held by one {@link #lockAll} call.
     */
    interface LockHandle extends AutoCloseable {
        @Override
        void close();
    }
}
