package com.knowledge.crossmodal.store;

import com.knowledge.crossmodal.lock.LockConfig;

/**
 * Configuration of the cross-modal store.
 */
public class StoreOptions {

    private final LockConfig lockConfig;
    private final RetryPolicy retryPolicy;

    private StoreOptions(Builder builder) {
        this.lockConfig = builder.lockConfig;
        this.retryPolicy = builder.retryPolicy;
    }

    public LockConfig getLockConfig() {
        return lockConfig;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public static StoreOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private LockConfig lockConfig = LockConfig.defaults();
        private RetryPolicy retryPolicy = RetryPolicy.defaults();

        public Builder lockConfig(LockConfig lockConfig) {
            this.lockConfig = lockConfig;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public StoreOptions build() {
            if (lockConfig == null || retryPolicy == null) {
                throw new IllegalArgumentException("lockConfig and retryPolicy are required");
            }
            return new StoreOptions(this);
        }
    }

    @Override
    public String toString() {
        return "StoreOptions{lockConfig=" + lockConfig + ", retryPolicy=" + retryPolicy + '}';
    }
}
