package com.knowledge.crossmodal.identity;

/**
 * Notified after identity changes are applied. Callbacks run on the calling thread,
 * after the identity locks are released. A listener that throws fails the originating
 * call; the identity change itself stays applied and listeners are re-notified when the
 * same mention is resolved again.
 */
public interface IdentityChangeListener {

    /**
     * An entity was created or its mentions, confidence or status changed.
     */
    default void onEntityChanged(String entityId) {
    }

    /**
     * {@code retiredEntityId} was merged into {@code survivorId}.
     */
    default void onMerge(String retiredEntityId, String survivorId) {
    }

    /**
     * Mentions of {@code sourceEntityId} were detached into {@code newEntityId}.
     */
    default void onSplit(String sourceEntityId, String newEntityId) {
    }
}
