package com.knowledge.crossmodal.identity;

import com.knowledge.crossmodal.core.model.Entity;
import com.knowledge.crossmodal.core.model.Mention;
import com.knowledge.crossmodal.similarity.CandidateProfile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Id-indexed storage for entities and mentions. Entities reference mentions and
 * mentions reference their owner by identifier only.
 * Reads are lock-free; writers hold the identity service's locks for the ids they replace.
 */
public class EntityRegistry {

    private final ConcurrentMap<String, Entity> entities = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Mention> mentions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> normalizedForms = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> mentionOwners = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> blockIndex = new ConcurrentHashMap<>();

    public Optional<Entity> findEntity(String entityId) {
        return Optional.ofNullable(entities.get(entityId));
    }

    public Optional<Mention> findMention(String mentionId) {
        return Optional.ofNullable(mentions.get(mentionId));
    }

    public Optional<String> findOwner(String mentionId) {
        return Optional.ofNullable(mentionOwners.get(mentionId));
    }

    public Optional<String> normalizedForm(String mentionId) {
        return Optional.ofNullable(normalizedForms.get(mentionId));
    }

    /**
     * All entities, oldest first.
     */
    public List<Entity> allEntities() {
        List<Entity> all = new ArrayList<>(entities.values());
        all.sort(Entity::compareByAge);
        return all;
    }

    public List<Mention> mentionsOf(Entity entity) {
        return entity.getMentionIds().stream()
                .map(mentions::get)
                .filter(m -> m != null)
                .collect(Collectors.toList());
    }

    public int entityCount() {
        return entities.size();
    }

    public int mentionCount() {
        return mentions.size();
    }

    void putMention(Mention mention, String normalizedText) {
        mentions.put(mention.id(), mention);
        normalizedForms.put(mention.id(), normalizedText);
    }

    void putEntity(Entity entity) {
        entities.put(entity.getId(), entity);
        for (String mentionId : entity.getMentionIds()) {
            mentionOwners.put(mentionId, entity.getId());
        }
    }

    void index(String entityId, Collection<String> blockingKeys) {
        for (String key : blockingKeys) {
            blockIndex.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(entityId);
        }
    }

    /**
     * Non-retired entities sharing a blocking key, oldest first.
     */
    List<Entity> blockCandidates(Collection<String> blockingKeys) {
        Set<String> ids = new LinkedHashSet<>();
        for (String key : blockingKeys) {
            ids.addAll(blockIndex.getOrDefault(key, Set.of()));
        }
        return ids.stream()
                .map(entities::get)
                .filter(e -> e != null && !e.isRetired())
                .sorted(Entity::compareByAge)
                .collect(Collectors.toList());
    }

    /**
     * Non-retired entities of the same type (any type when the label is unknown), oldest first.
     */
    List<Entity> typeCandidates(String typeLabel) {
        return entities.values().stream()
                .filter(e -> !e.isRetired())
                .filter(e -> typeLabel == null || e.getTypeLabel() == null
                        || e.getTypeLabel().toUpperCase(Locale.ROOT).equals(typeLabel.toUpperCase(Locale.ROOT))
                        || "UNKNOWN".equalsIgnoreCase(typeLabel))
                .sorted(Comparator.comparing(Entity::getCreatedAt).thenComparing(Entity::getId))
                .collect(Collectors.toList());
    }

    CandidateProfile profile(Entity entity) {
        Set<String> forms = new LinkedHashSet<>();
        if (entity.getNormalizedName() != null) {
            forms.add(entity.getNormalizedName());
        }
        List<String> contexts = new ArrayList<>();
        for (String mentionId : entity.getMentionIds()) {
            String form = normalizedForms.get(mentionId);
            if (form != null) {
                forms.add(form);
            }
            Mention mention = mentions.get(mentionId);
            if (mention != null && !mention.context().isBlank()) {
                contexts.add(mention.context());
            }
        }
        return new CandidateProfile(entity.getId(), entity.getTypeLabel(), forms, contexts);
    }
}
