package com.knowledge.crossmodal.store;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Versioned in-memory sink. This is the default sink for every modality.
 */
public class InMemoryProjectionSink<P> implements ProjectionSink<P> {

    private final Modality modality;
    private final Map<String, NavigableMap<Long, P>> versions = new ConcurrentHashMap<>();

    public InMemoryProjectionSink(Modality modality) {
        this.modality = modality;
    }

    @Override
    public Modality modality() {
        return modality;
    }

    @Override
    public void stage(String recordId, long version, P projection) {
        versions.computeIfAbsent(recordId, k -> new ConcurrentSkipListMap<>()).put(version, projection);
    }

    @Override
    public void discard(String recordId, long version) {
        NavigableMap<Long, P> byVersion = versions.get(recordId);
        if (byVersion != null) {
            byVersion.remove(version);
        }
    }

    @Override
    public void prune(String recordId, long keepVersion) {
        NavigableMap<Long, P> byVersion = versions.get(recordId);
        if (byVersion != null) {
            byVersion.headMap(keepVersion, false).clear();
        }
    }

    @Override
    public Optional<P> read(String recordId, long version) {
        NavigableMap<Long, P> byVersion = versions.get(recordId);
        return byVersion == null ? Optional.empty() : Optional.ofNullable(byVersion.get(version));
    }

    /**
     * Number of versions currently held for the record.
     */
    public int versionCount(String recordId) {
        NavigableMap<Long, P> byVersion = versions.get(recordId);
        return byVersion == null ? 0 : byVersion.size();
    }
}
