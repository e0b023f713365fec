package com.knowledge.crossmodal.aggregation;

import com.knowledge.crossmodal.core.model.Claim;
import com.knowledge.crossmodal.core.model.ClaimKey;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Claim snapshots by id plus the index of active claims by triple. Writers must hold the
 * claim lock; reads are lock-free.
 */
public class ClaimRegistry {

    private final Map<String, Claim> claims = new ConcurrentHashMap<>();
    private final Map<ClaimKey, String> activeByKey = new ConcurrentHashMap<>();

    public Optional<Claim> find(String claimId) {
        return Optional.ofNullable(claims.get(claimId));
    }

    public Optional<Claim> findActive(ClaimKey key) {
        String id = activeByKey.get(key);
        return id != null ? find(id) : Optional.empty();
    }

    /**
     * Stores the snapshot and keeps the triple index in line with its key and status.
     */
    void put(Claim claim) {
        Claim previous = claims.put(claim.getId(), claim);
        if (previous != null && !previous.getKey().equals(claim.getKey())) {
            activeByKey.remove(previous.getKey(), claim.getId());
        }
        if (claim.isActive()) {
            activeByKey.put(claim.getKey(), claim.getId());
        } else {
            activeByKey.remove(claim.getKey(), claim.getId());
        }
    }

    /**
     * Active claims whose subject or object is the entity, ordered by id.
     */
    public List<Claim> activeReferencing(String entityId) {
        return claims.values().stream()
                .filter(Claim::isActive)
                .filter(c -> c.getKey().references(entityId))
                .sorted(Comparator.comparing(Claim::getId))
                .collect(Collectors.toList());
    }

    /**
     * Active claims whose subject is the entity, ordered by id.
     */
    public List<Claim> activeWithSubject(String entityId) {
        return claims.values().stream()
                .filter(Claim::isActive)
                .filter(c -> c.getKey().subjectId().equals(entityId))
                .sorted(Comparator.comparing(Claim::getId))
                .collect(Collectors.toList());
    }

    /**
     * Every claim, retired included, ordered by id.
     */
    public List<Claim> all() {
        List<Claim> all = new ArrayList<>(claims.values());
        all.sort(Comparator.comparing(Claim::getId));
        return all;
    }

    public int size() {
        return claims.size();
    }
}
