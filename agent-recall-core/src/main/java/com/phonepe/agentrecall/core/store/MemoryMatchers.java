package com.phonepe.agentrecall.core.store;

import com.phonepe.agentrecall.core.model.MemoryObject;
import com.phonepe.agentrecall.core.model.MemoryStatus;
import com.phonepe.agentrecall.core.model.Namespace;
import com.phonepe.agentrecall.core.utils.SimilarityUtils;
import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * Filtering and similarity rules shared by the bundled {@link MemoryStore} implementations
 */
@UtilityClass
public class MemoryMatchers {

    public static boolean inNamespace(MemoryObject memory, Namespace namespace) {
        return Objects.equals(memory.getNamespace().key(), namespace.key());
    }

    /**
     * A TTL of zero means expired right away. No TTL and no expiry timestamp means the memory never expires.
     */
    public static boolean isExpired(MemoryObject memory, Instant now) {
        if (memory.getExpiresAt() != null && !memory.getExpiresAt().isAfter(now)) {
            return true;
        }
        final var ttl = memory.getTtlSeconds();
        if (ttl == null) {
            return false;
        }
        if (ttl == 0L) {
            return true;
        }
        if (memory.getCreatedAt() == null) {
            return false;
        }
        return !now.isBefore(memory.getCreatedAt().plusSeconds(ttl));
    }

    public static boolean matchesListOptions(MemoryObject memory, ListMemoryOptions options, Instant now) {
        if (options.getStatus() != null && memory.getStatus() != options.getStatus()) {
            return false;
        }
        return options.isIncludeExpired() || !isExpired(memory, now);
    }

    public static boolean matchesQuery(MemoryObject memory, MemoryQuery query, Instant now) {
        if (!inNamespace(memory, query.getNamespace()) || memory.getStatus() != MemoryStatus.ACTIVE) {
            return false;
        }
        if (isExpired(memory, now)) {
            return false;
        }
        if (query.getTags() != null && !query.getTags().isEmpty()
                && !memory.getTags().containsAll(query.getTags())) {
            return false;
        }
        if (query.getSourceTypes() != null && !query.getSourceTypes().isEmpty()
                && (memory.getSource() == null || !query.getSourceTypes().contains(memory.getSource().getType()))) {
            return false;
        }
        if (query.getMinImportance() != null && memory.getImportance() < query.getMinImportance()) {
            return false;
        }
        return query.getSessionId() == null
                || query.isIncludeCrossSession()
                || query.getSessionId().equals(memory.getSessionId());
    }

    /**
     * Cosine similarity of embeddings when both sides have one, word level overlap with the content otherwise
     */
    public static double similarity(MemoryObject memory, MemoryQuery query) {
        if (query.getQueryEmbedding() != null && memory.getEmbedding() != null) {
            return SimilarityUtils.cosineSimilarity(query.getQueryEmbedding(), memory.getEmbedding());
        }
        return SimilarityUtils.textSimilarity(query.getQuery(), memory.getContent());
    }

    public static Comparator<MemoryObject> byCreatedAt(SortOrder order) {
        final Comparator<MemoryObject> ascending = Comparator.comparing(MemoryObject::getCreatedAt,
                                                                        Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(MemoryObject::getMemoryId);
        return order == SortOrder.ASC ? ascending : ascending.reversed();
    }
}
