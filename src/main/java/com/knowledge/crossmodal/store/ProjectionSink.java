package com.knowledge.crossmodal.store;

import java.util.Optional;

/**
 * Physical store of one modality. Versions are staged first and only become
 * authoritative when the store flips its version pointer; a staged version that is
 * never published is discarded.
 */
public interface ProjectionSink<P> {

    Modality modality();

    /**
     * Writes a version without publishing it. Must be idempotent per (recordId, version).
     */
    void stage(String recordId, long version, P projection);

    /**
     * Removes a staged version that will not be published.
     */
    void discard(String recordId, long version);

    /**
     * Drops every version older than {@code keepVersion}.
     */
    void prune(String recordId, long keepVersion);

    Optional<P> read(String recordId, long version);
}
