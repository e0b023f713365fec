package com.knowledge.crossmodal.core.model;

import com.knowledge.crossmodal.aggregation.AuditTrail;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * An assertion between an entity and another entity or a literal.
 * Immutable snapshot; the aggregation service replaces it under the claim's identifier lock.
 * The posterior is absent until evidence has been aggregated and is only ever set
 * together with the audit trail that produced it.
 */
public final class Claim {
    private final String id;
    private final ClaimKey key;
    private final List<EvidenceItem> evidence;
    private final List<DependencyDeclaration> dependencyDeclarations;
    private final Double posterior;
    private final AuditTrail auditTrail;
    private final ClaimStatus status;
    private final String mergedInto;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Claim(Builder builder) {
        this.id = builder.id != null ? builder.id : "c-" + UUID.randomUUID();
        this.key = builder.key;
        this.evidence = List.copyOf(builder.evidence);
        this.dependencyDeclarations = List.copyOf(builder.dependencyDeclarations);
        this.posterior = builder.auditTrail != null ? builder.auditTrail.posterior() : null;
        this.auditTrail = builder.auditTrail;
        this.status = builder.status != null ? builder.status : ClaimStatus.ACTIVE;
        this.mergedInto = builder.mergedInto;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public ClaimKey getKey() {
        return key;
    }

    public List<EvidenceItem> getEvidence() {
        return evidence;
    }

    public List<DependencyDeclaration> getDependencyDeclarations() {
        return dependencyDeclarations;
    }

    public OptionalDouble getPosterior() {
        return posterior != null ? OptionalDouble.of(posterior) : OptionalDouble.empty();
    }

    public Optional<AuditTrail> getAuditTrail() {
        return Optional.ofNullable(auditTrail);
    }

    public String getMethodVersion() {
        return auditTrail != null ? auditTrail.methodVersion() : null;
    }

    public ClaimStatus getStatus() {
        return status;
    }

    public String getMergedInto() {
        return mergedInto;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean isActive() {
        return status == ClaimStatus.ACTIVE;
    }

    public boolean hasEvidence(String evidenceId) {
        return evidence.stream().anyMatch(e -> e.evidenceId().equals(evidenceId));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(id, ((Claim) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Claim{" +
                "id='" + id + '\'' +
                ", key=" + key +
                ", evidence=" + evidence.size() +
                ", posterior=" + posterior +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Claim claim) {
        return new Builder()
                .id(claim.id)
                .key(claim.key)
                .evidence(claim.evidence)
                .dependencyDeclarations(claim.dependencyDeclarations)
                .auditTrail(claim.auditTrail)
                .status(claim.status)
                .mergedInto(claim.mergedInto)
                .createdAt(claim.createdAt)
                .updatedAt(claim.updatedAt);
    }

    public static class Builder {
        private String id;
        private ClaimKey key;
        private final List<EvidenceItem> evidence = new ArrayList<>();
        private final List<DependencyDeclaration> dependencyDeclarations = new ArrayList<>();
        private AuditTrail auditTrail;
        private ClaimStatus status;
        private String mergedInto;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder key(ClaimKey key) {
            this.key = key;
            return this;
        }

        public Builder evidence(List<EvidenceItem> items) {
            this.evidence.clear();
            this.evidence.addAll(items);
            return this;
        }

        public Builder addEvidence(EvidenceItem item) {
            this.evidence.add(item);
            return this;
        }

        public Builder dependencyDeclarations(List<DependencyDeclaration> declarations) {
            this.dependencyDeclarations.clear();
            this.dependencyDeclarations.addAll(declarations);
            return this;
        }

        public Builder addDependencyDeclaration(DependencyDeclaration declaration) {
            this.dependencyDeclarations.add(declaration);
            return this;
        }

        public Builder auditTrail(AuditTrail auditTrail) {
            this.auditTrail = auditTrail;
            return this;
        }

        public Builder status(ClaimStatus status) {
            this.status = status;
            return this;
        }

        public Builder mergedInto(String mergedInto) {
            this.mergedInto = mergedInto;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Claim build() {
            Objects.requireNonNull(key, "key is required");
            if (auditTrail != null && evidence.isEmpty()) {
                throw new IllegalStateException("a claim without evidence cannot carry a confidence");
            }
            return new Claim(this);
        }
    }
}
