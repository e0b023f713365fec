package com.knowledge.crossmodal.audit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Default audit storage. Keeps the trail in memory with a per-record index,
 * since most lookups ask for the history of one entity or claim.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final List<AuditEntry> entries = new ArrayList<>();
    private final Map<String, List<AuditEntry>> byRecord = new ConcurrentHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void save(AuditEntry entry) {
        lock.writeLock().lock();
        try {
            entries.add(entry);
            byRecord.computeIfAbsent(entry.recordId(), k -> new ArrayList<>()).add(entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<AuditEntry> findAll() {
        return filter(e -> true);
    }

    @Override
    public List<AuditEntry> findByRecordId(String recordId) {
        lock.readLock().lock();
        try {
            return List.copyOf(byRecord.getOrDefault(recordId, List.of()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return filter(e -> e.action() == action);
    }

    @Override
    public List<AuditEntry> findByCorrelationId(String correlationId) {
        return filter(e -> correlationId.equals(e.correlationId()));
    }

    @Override
    public List<AuditEntry> findRecent(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        lock.readLock().lock();
        try {
            int from = Math.max(0, entries.size() - limit);
            return List.copyOf(entries.subList(from, entries.size()));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int count() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<AuditEntry> filter(Predicate<AuditEntry> predicate) {
        lock.readLock().lock();
        try {
            return entries.stream().filter(predicate).collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }
}
