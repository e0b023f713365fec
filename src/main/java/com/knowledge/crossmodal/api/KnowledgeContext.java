package com.knowledge.crossmodal.api;

import com.knowledge.crossmodal.audit.AuditRepository;
import com.knowledge.crossmodal.audit.AuditService;
import com.knowledge.crossmodal.audit.InMemoryAuditRepository;
import com.knowledge.crossmodal.audit.MergeLedger;
import com.knowledge.crossmodal.lock.IdentifierLock;
import com.knowledge.crossmodal.lock.LocalIdentifierLock;
import com.knowledge.crossmodal.lock.LockConfig;
import com.knowledge.crossmodal.metrics.MetricsService;
import com.knowledge.crossmodal.metrics.NoOpMetricsService;
import com.knowledge.crossmodal.tracing.NoOpTracingService;
import com.knowledge.crossmodal.tracing.TracingService;

import java.time.Clock;

/**
 * Shared collaborators handed to every service of one knowledge base: audit trail, merge
 * ledger, identifier locks, metrics, tracing and clock. Services never reach for globals;
 * whatever they share comes through this context.
 */
public final class KnowledgeContext {

    private final AuditService auditService;
    private final MergeLedger mergeLedger;
    private final IdentifierLock lock;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final Clock clock;

    private KnowledgeContext(Builder builder) {
        this.auditService = builder.auditService != null
                ? builder.auditService
                : new AuditService(builder.auditRepository != null ? builder.auditRepository : new InMemoryAuditRepository());
        this.mergeLedger = builder.mergeLedger != null ? builder.mergeLedger : new MergeLedger();
        this.lock = builder.lock != null ? builder.lock
                : new LocalIdentifierLock(builder.lockConfig != null ? builder.lockConfig : LockConfig.defaults());
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    }

    public static KnowledgeContext defaults() {
        return builder().build();
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public MergeLedger getMergeLedger() {
        return mergeLedger;
    }

    public IdentifierLock getLock() {
        return lock;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public TracingService getTracingService() {
        return tracingService;
    }

    public Clock getClock() {
        return clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private AuditService auditService;
        private AuditRepository auditRepository;
        private MergeLedger mergeLedger;
        private IdentifierLock lock;
        private LockConfig lockConfig;
        private MetricsService metricsService;
        private TracingService tracingService;
        private Clock clock;

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        /**
         * Repository for the default audit service. Ignored when an audit service is set.
         */
        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder mergeLedger(MergeLedger mergeLedger) {
            this.mergeLedger = mergeLedger;
            return this;
        }

        public Builder lock(IdentifierLock lock) {
            this.lock = lock;
            return this;
        }

        /**
         * Timeout of the default lock. Ignored when a lock is set.
         */
        public Builder lockConfig(LockConfig lockConfig) {
            this.lockConfig = lockConfig;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public KnowledgeContext build() {
            return new KnowledgeContext(this);
        }
    }
}
