package com.knowledge.crossmodal.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Canonical, deduplicated real-world referent.
 * Immutable snapshot: every mutation produces a new instance through {@link #builder(Entity)}
 * and replaces the previous one in the registry under the entity's identifier lock.
 */
public final class Entity {
    private final String id;
    private final String canonicalName;
    private final String normalizedName;
    private final String typeLabel;
    private final Map<String, MentionLink> mentionLinks;
    private final double identityConfidence;
    private final EntityStatus status;
    private final int conflictChecksPassed;
    private final String mergedInto;
    private final Instant createdAt;
    private final Instant updatedAt;

    private Entity(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.canonicalName = builder.canonicalName;
        this.normalizedName = builder.normalizedName;
        this.typeLabel = builder.typeLabel;
        this.mentionLinks = Collections.unmodifiableMap(new LinkedHashMap<>(builder.mentionLinks));
        this.identityConfidence = builder.identityConfidence;
        this.status = builder.status != null ? builder.status : EntityStatus.PROVISIONAL;
        this.conflictChecksPassed = builder.conflictChecksPassed;
        this.mergedInto = builder.mergedInto;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
    }

    public String getId() {
        return id;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public String getTypeLabel() {
        return typeLabel;
    }

    public Map<String, MentionLink> getMentionLinks() {
        return mentionLinks;
    }

    public Set<String> getMentionIds() {
        return mentionLinks.keySet();
    }

    public boolean ownsMention(String mentionId) {
        return mentionLinks.containsKey(mentionId);
    }

    public double getIdentityConfidence() {
        return identityConfidence;
    }

    public EntityStatus getStatus() {
        return status;
    }

    public int getConflictChecksPassed() {
        return conflictChecksPassed;
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

    public boolean isRetired() {
        return status == EntityStatus.RETIRED;
    }

    public boolean isStable() {
        return status == EntityStatus.STABLE;
    }

    /**
     * Orders entities by age: older first, then lexicographically smaller identifier.
     * The first element of this ordering survives a merge.
     */
    public static int compareByAge(Entity a, Entity b) {
        int byCreation = a.createdAt.compareTo(b.createdAt);
        return byCreation != 0 ? byCreation : a.id.compareTo(b.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return Objects.equals(id, entity.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", canonicalName='" + canonicalName + '\'' +
                ", typeLabel='" + typeLabel + '\'' +
                ", status=" + status +
                ", mentions=" + mentionLinks.size() +
                ", identityConfidence=" + identityConfidence +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Entity entity) {
        return new Builder()
                .id(entity.id)
                .canonicalName(entity.canonicalName)
                .normalizedName(entity.normalizedName)
                .typeLabel(entity.typeLabel)
                .mentionLinks(entity.mentionLinks)
                .identityConfidence(entity.identityConfidence)
                .status(entity.status)
                .conflictChecksPassed(entity.conflictChecksPassed)
                .mergedInto(entity.mergedInto)
                .createdAt(entity.createdAt)
                .updatedAt(entity.updatedAt);
    }

    public static class Builder {
        private String id;
        private String canonicalName;
        private String normalizedName;
        private String typeLabel;
        private final Map<String, MentionLink> mentionLinks = new LinkedHashMap<>();
        private double identityConfidence;
        private EntityStatus status;
        private int conflictChecksPassed;
        private String mergedInto;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder canonicalName(String canonicalName) {
            this.canonicalName = canonicalName;
            return this;
        }

        public Builder normalizedName(String normalizedName) {
            this.normalizedName = normalizedName;
            return this;
        }

        public Builder typeLabel(String typeLabel) {
            this.typeLabel = typeLabel;
            return this;
        }

        public Builder mentionLinks(Map<String, MentionLink> links) {
            this.mentionLinks.clear();
            this.mentionLinks.putAll(links);
            return this;
        }

        public Builder link(String mentionId, MentionLink link) {
            this.mentionLinks.put(mentionId, link);
            return this;
        }

        public Builder unlink(String mentionId) {
            this.mentionLinks.remove(mentionId);
            return this;
        }

        public Builder identityConfidence(double identityConfidence) {
            this.identityConfidence = identityConfidence;
            return this;
        }

        public Builder status(EntityStatus status) {
            this.status = status;
            return this;
        }

        public Builder conflictChecksPassed(int conflictChecksPassed) {
            this.conflictChecksPassed = conflictChecksPassed;
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

        public Entity build() {
            Objects.requireNonNull(canonicalName, "canonicalName is required");
            if (identityConfidence < 0.0 || identityConfidence > 1.0) {
                throw new IllegalArgumentException("identityConfidence must be between 0.0 and 1.0");
            }
            return new Entity(this);
        }
    }
}
