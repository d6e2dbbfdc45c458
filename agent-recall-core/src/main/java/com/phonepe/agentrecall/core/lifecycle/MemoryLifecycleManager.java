package com.phonepe.agentrecall.core.lifecycle;

import com.google.common.base.Strings;
import com.google.common.util.concurrent.Striped;
import com.phonepe.agentrecall.core.config.AgentRecallConfig;
import com.phonepe.agentrecall.core.errors.ErrorType;
import com.phonepe.agentrecall.core.errors.MemoryLifecycleException;
import com.phonepe.agentrecall.core.events.AuditWriteFailedEvent;
import com.phonepe.agentrecall.core.events.EventBus;
import com.phonepe.agentrecall.core.events.MemoryMutatedEvent;
import com.phonepe.agentrecall.core.model.CreateMemoryInput;
import com.phonepe.agentrecall.core.model.EditMemoryInput;
import com.phonepe.agentrecall.core.model.ExpireMemoriesResult;
import com.phonepe.agentrecall.core.model.IngestionMetadata;
import com.phonepe.agentrecall.core.model.MemoryObject;
import com.phonepe.agentrecall.core.model.MemorySource;
import com.phonepe.agentrecall.core.model.MemoryStatus;
import com.phonepe.agentrecall.core.model.MemoryVersion;
import com.phonepe.agentrecall.core.model.MergeMemoriesResult;
import com.phonepe.agentrecall.core.model.MergeOptions;
import com.phonepe.agentrecall.core.model.Namespace;
import com.phonepe.agentrecall.core.model.ProvenanceAction;
import com.phonepe.agentrecall.core.model.ProvenanceEntry;
import com.phonepe.agentrecall.core.model.SourceType;
import com.phonepe.agentrecall.core.store.AuditAction;
import com.phonepe.agentrecall.core.store.AuditEntry;
import com.phonepe.agentrecall.core.store.ListMemoryOptions;
import com.phonepe.agentrecall.core.store.ListOptions;
import com.phonepe.agentrecall.core.store.MemoryMatchers;
import com.phonepe.agentrecall.core.store.MemoryStore;
import com.phonepe.agentrecall.core.store.ResourceType;
import com.phonepe.agentrecall.core.store.SortOrder;
import com.phonepe.agentrecall.core.validation.DefaultMemoryValidator;
import com.phonepe.agentrecall.core.validation.MemoryValidationInput;
import com.phonepe.agentrecall.core.validation.MemoryValidator;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import java.util.function.ToDoubleFunction;

/**
 * The only component that mutates memories.
 * <p>
 * Every operation checks its preconditions, writes the new state to the store, appends exactly one provenance entry
 * and records a best-effort audit entry. Mutations of the same memory are serialized and always re-read the memory
 * after the lock is taken, so concurrent callers never lose each other's updates.
 */
@Slf4j
public class MemoryLifecycleManager {
    public static final String SYSTEM_ACTOR = "system";
    public static final String DEFAULT_SESSION = "default";

    private static final int LOCK_STRIPES = 64;

    private final MemoryStore store;
    private final MemoryValidator validator;
    private final EventBus eventBus;
    private final Clock clock;
    private final int expiryBatchSize;
    private final Striped<Lock> locks = Striped.lock(LOCK_STRIPES);

    @Builder
    public MemoryLifecycleManager(@NonNull MemoryStore store,
                                  AgentRecallConfig config,
                                  MemoryValidator validator,
                                  EventBus eventBus,
                                  Clock clock) {
        final var effectiveConfig = Objects.requireNonNullElse(config, AgentRecallConfig.DEFAULT);
        this.store = store;
        this.validator = Objects.requireNonNullElseGet(
                validator, () -> new DefaultMemoryValidator(effectiveConfig.getValidation()));
        this.eventBus = Objects.requireNonNullElseGet(eventBus, EventBus::new);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.expiryBatchSize = effectiveConfig.getExpiryBatchSize();
    }

    /**
     * Validates the content and stores a new memory, in the quarantine partition if the validator flagged it
     *
     * @throws MemoryLifecycleException with {@link ErrorType#VALIDATION_REJECTED} if the content is not accepted
     */
    public MemoryObject create(@NonNull CreateMemoryInput input) {
        checkScore(null, "importance", input.getImportance());
        checkScore(null, "task_criticality", input.getTaskCriticality());
        final var verdict = validator.validate(MemoryValidationInput.builder()
                                                       .content(input.getContent())
                                                       .sourceType(input.getSourceType())
                                                       .sourceId(input.getSourceIdentifier())
                                                       .declaredContentType(input.getContentType())
                                                       .build());
        if (!verdict.isAccepted()) {
            log.warn("Rejected memory from {}: {}", input.getSourceIdentifier(), verdict.getRejectionReason());
            throw MemoryLifecycleException.rejected(verdict.getRejectionReason());
        }
        final var now = clock.instant();
        final var quarantined = verdict.isQuarantined();
        final var reason = "Created from " + input.getSourceType().name().toLowerCase(Locale.ROOT)
                + (quarantined
                   ? " and quarantined (%d%% confidence)".formatted(Math.round(verdict.getConfidenceScore() * 100))
                   : "");
        final var memory = MemoryObject.builder()
                .memoryId(UUID.randomUUID().toString())
                .namespace(input.getNamespace())
                .content(verdict.getNormalizedContent())
                .contentType(Objects.requireNonNullElse(input.getContentType(), verdict.getNormalizedContentType()))
                .source(MemorySource.builder()
                                .type(input.getSourceType())
                                .identifier(input.getSourceIdentifier())
                                .timestamp(now)
                                .metadata(Objects.requireNonNullElse(input.getSourceMetadata(), Map.of()))
                                .build())
                .ingestion(IngestionMetadata.builder()
                                   .sourceType(verdict.getSourceType())
                                   .sourceId(verdict.getSourceId())
                                   .ingestionTimestamp(now)
                                   .confidenceScore(verdict.getConfidenceScore())
                                   .detectedFormat(verdict.getDetectedFormat())
                                   .anomalyFlags(verdict.getAnomalyFlags())
                                   .quarantined(quarantined)
                                   .validationNotes(verdict.getValidationNotes())
                                   .build())
                .provenanceEntry(ProvenanceEntry.builder()
                                         .action(ProvenanceAction.CREATED)
                                         .actorId(input.getSourceIdentifier())
                                         .timestamp(now)
                                         .reason(reason)
                                         .version(1)
                                         .build())
                .tags(Objects.requireNonNullElse(input.getTags(), List.of()))
                .importance(Objects.requireNonNullElse(input.getImportance(), 0.5))
                .taskCriticality(Objects.requireNonNullElse(input.getTaskCriticality(), 0.5))
                .embedding(input.getEmbedding())
                .createdAt(now)
                .ttlSeconds(input.getTtlSeconds())
                .expiresAt(input.getExpiresAt())
                .version(1)
                .status(quarantined ? MemoryStatus.QUARANTINED : MemoryStatus.ACTIVE)
                .sessionId(input.getSessionId())
                .build();
        if (quarantined) {
            store.saveQuarantinedMemory(memory);
        }
        else {
            store.saveMemory(memory);
        }
        log.info("Created memory {} in {} ({}, confidence {})",
                 memory.getMemoryId(), memory.getNamespace().key(), memory.getStatus(), verdict.getConfidenceScore());
        audit(memory, AuditAction.CREATE, input.getSourceIdentifier(),
              Map.of("quarantined", quarantined, "confidence_score", verdict.getConfidenceScore()));
        publish(memory, ProvenanceAction.CREATED, input.getSourceIdentifier());
        return memory;
    }

    /**
     * Applies the supplied fields, snapshotting the previous state and bumping the version
     */
    public MemoryObject edit(@NonNull String memoryId,
                             @NonNull EditMemoryInput updates,
                             @NonNull String actorId,
                             String reason) {
        if (updates.isEmpty()) {
            throw MemoryLifecycleException.invalidArgument(memoryId, "No fields to update for memory " + memoryId);
        }
        checkScore(memoryId, "importance", updates.getImportance());
        checkScore(memoryId, "task_criticality", updates.getTaskCriticality());
        return locked(memoryId, () -> {
            final var located = locate(memoryId);
            final var current = located.getMemory();
            if (current.isDeleted()) {
                throw MemoryLifecycleException.deletedMemory("edit", memoryId);
            }
            final var now = clock.instant();
            final var changeReason = Strings.isNullOrEmpty(reason) ? "Memory edited" : reason;
            final var newVersion = current.getVersion() + 1;
            final var builder = current.toBuilder()
                    .previousVersion(current.snapshot(now, actorId, changeReason))
                    .version(newVersion)
                    .provenanceEntry(ProvenanceEntry.builder()
                                             .action(ProvenanceAction.EDITED)
                                             .actorId(actorId)
                                             .timestamp(now)
                                             .reason(changeReason)
                                             .version(newVersion)
                                             .previousContent(current.getContent())
                                             .build());
            if (updates.getContent() != null) {
                builder.content(updates.getContent());
            }
            if (updates.getContentType() != null) {
                builder.contentType(updates.getContentType());
            }
            if (updates.getTags() != null) {
                builder.clearTags().tags(updates.getTags());
            }
            if (updates.getImportance() != null) {
                builder.importance(updates.getImportance());
            }
            if (updates.getTaskCriticality() != null) {
                builder.taskCriticality(updates.getTaskCriticality());
            }
            if (updates.getEmbedding() != null) {
                builder.embedding(updates.getEmbedding());
            }
            final var updated = persist(located, builder.build());
            log.info("Edited memory {} to version {}", memoryId, newVersion);
            audit(updated, AuditAction.UPDATE, actorId, Map.of("action_type", "edit", "version", newVersion));
            publish(updated, ProvenanceAction.EDITED, actorId);
            return updated;
        });
    }

    /**
     * Soft delete. Content is retained for audit and the memory can never be changed again.
     */
    public MemoryObject delete(@NonNull String memoryId, @NonNull String actorId, String reason) {
        return locked(memoryId, () -> {
            final var located = locate(memoryId);
            final var updated = persist(located, softDeleted(located.getMemory(),
                                                             ProvenanceAction.DELETED,
                                                             actorId,
                                                             reason));
            log.info("Deleted memory {}", memoryId);
            audit(updated, AuditAction.DELETE, actorId, Map.of("reason", Strings.nullToEmpty(reason)));
            publish(updated, ProvenanceAction.DELETED, actorId);
            return updated;
        });
    }

    /**
     * Moves an active memory to the quarantine partition. Re-running after an interrupted move completes it. When a
     * copy exists in both partitions the one with the newer provenance is authoritative.
     */
    public MemoryObject quarantine(@NonNull String memoryId, @NonNull String actorId, String reason) {
        return locked(memoryId, () -> {
            final var primary = store.getMemory(memoryId);
            final var quarantined = store.getQuarantinedMemory(memoryId);
            if (primary.isPresent() && quarantined.isPresent()) {
                final var newer = newerCopy(primary.get(), quarantined.get());
                if (newer.isDeleted()) {
                    throw MemoryLifecycleException.deletedMemory("quarantine", memoryId);
                }
                if (newer == quarantined.get()) {
                    log.warn("Memory {} found in both partitions, completing interrupted quarantine", memoryId);
                    store.removeMemory(memoryId);
                    return newer;
                }
                log.warn("Memory {} found in both partitions, dropping stale quarantined copy", memoryId);
            }
            else if (quarantined.isPresent()) {
                if (quarantined.get().isDeleted()) {
                    throw MemoryLifecycleException.deletedMemory("quarantine", memoryId);
                }
                throw MemoryLifecycleException.alreadyQuarantined(memoryId);
            }
            final var current = primary.orElseThrow(() -> MemoryLifecycleException.notFound(memoryId));
            if (current.isDeleted()) {
                throw MemoryLifecycleException.deletedMemory("quarantine", memoryId);
            }
            if (current.isQuarantined()) {
                throw MemoryLifecycleException.alreadyQuarantined(memoryId);
            }
            final var now = clock.instant();
            final var updated = current.toBuilder()
                    .status(MemoryStatus.QUARANTINED)
                    .ingestion(ingestionOf(current).withQuarantined(true))
                    .provenanceEntry(ProvenanceEntry.builder()
                                             .action(ProvenanceAction.QUARANTINED)
                                             .actorId(actorId)
                                             .timestamp(now)
                                             .reason(reason)
                                             .version(current.getVersion())
                                             .build())
                    .build();
            store.saveQuarantinedMemory(updated);
            store.removeMemory(memoryId);
            log.info("Quarantined memory {}: {}", memoryId, reason);
            audit(updated, AuditAction.UPDATE, actorId,
                  Map.of("action_type", "quarantine", "reason", Strings.nullToEmpty(reason)));
            publish(updated, ProvenanceAction.QUARANTINED, actorId);
            return updated;
        });
    }

    /**
     * Moves a quarantined memory back to the primary partition as active. Re-running after an interrupted move
     * completes it. A stale primary copy left by an interrupted quarantine is overwritten.
     */
    public MemoryObject promoteQuarantined(@NonNull String memoryId, @NonNull String actorId) {
        return locked(memoryId, () -> {
            final var held = store.getQuarantinedMemory(memoryId)
                    .orElseThrow(() -> MemoryLifecycleException.quarantinedNotFound(memoryId));
            final var primary = store.getMemory(memoryId);
            if (primary.isPresent() && newerCopy(primary.get(), held) == primary.get()) {
                if (primary.get().isDeleted()) {
                    throw MemoryLifecycleException.deletedMemory("promote", memoryId);
                }
                log.warn("Memory {} found in both partitions, completing interrupted promotion", memoryId);
                store.deleteQuarantinedMemory(memoryId);
                return primary.get();
            }
            if (held.isDeleted()) {
                throw MemoryLifecycleException.deletedMemory("promote", memoryId);
            }
            final var now = clock.instant();
            final var promoted = held.toBuilder()
                    .status(MemoryStatus.ACTIVE)
                    .ingestion(ingestionOf(held).withQuarantined(false))
                    .provenanceEntry(ProvenanceEntry.builder()
                                             .action(ProvenanceAction.MODIFIED)
                                             .actorId(actorId)
                                             .timestamp(now)
                                             .reason("Promoted from quarantine")
                                             .version(held.getVersion())
                                             .build())
                    .build();
            store.saveMemory(promoted);
            store.deleteQuarantinedMemory(memoryId);
            log.info("Promoted memory {} out of quarantine", memoryId);
            audit(promoted, AuditAction.UPDATE, actorId, Map.of("action_type", "promote"));
            publish(promoted, ProvenanceAction.MODIFIED, actorId);
            return promoted;
        });
    }

    /**
     * Creates a new memory from two or more active sources in one namespace and soft deletes the sources.
     *
     * @throws MemoryLifecycleException with {@link ErrorType#PARTIAL_FAILURE} if a source could not be retired after
     *                                  the merged memory was created. The merged memory id is carried in the exception.
     */
    public MergeMemoriesResult merge(@NonNull List<String> memoryIds,
                                     @NonNull String mergedContent,
                                     @NonNull String actorId,
                                     MergeOptions options) {
        final var ids = List.copyOf(new LinkedHashSet<>(memoryIds));
        if (ids.size() < 2) {
            throw MemoryLifecycleException.invalidArgument(null, "At least 2 distinct memories are required to merge");
        }
        final var effectiveOptions = Objects.requireNonNullElse(options, MergeOptions.DEFAULT);
        checkScore(null, "importance", effectiveOptions.getImportance());
        checkScore(null, "task_criticality", effectiveOptions.getTaskCriticality());
        return lockedAll(ids, () -> {
            final var sources = new ArrayList<MemoryObject>(ids.size());
            for (final var id : ids) {
                final var source = store.getMemory(id).orElseThrow(() -> MemoryLifecycleException.notFound(id));
                if (source.isDeleted()) {
                    throw MemoryLifecycleException.deletedMemory("merge", id);
                }
                if (!sources.isEmpty() && !sources.get(0).getNamespace().key().equals(source.getNamespace().key())) {
                    throw MemoryLifecycleException.namespaceMismatch(id);
                }
                sources.add(source);
            }
            final var now = clock.instant();
            final List<String> tags = effectiveOptions.getTags() != null
                             ? effectiveOptions.getTags()
                             : List.copyOf(sources.stream()
                                                   .flatMap(source -> source.getTags().stream())
                                                   .collect(LinkedHashSet::new, LinkedHashSet::add,
                                                            LinkedHashSet::addAll));
            final var created = create(CreateMemoryInput.builder()
                                               .namespace(sources.get(0).getNamespace())
                                               .content(mergedContent)
                                               .contentType("text")
                                               .sourceType(SourceType.SYSTEM)
                                               .sourceIdentifier(actorId)
                                               .sourceMetadata(Map.of("mergedFrom", ids,
                                                                      "mergeTimestamp", now.toString()))
                                               .tags(tags)
                                               .importance(Objects.requireNonNullElseGet(
                                                       effectiveOptions.getImportance(),
                                                       () -> mean(sources, MemoryObject::getImportance)))
                                               .taskCriticality(Objects.requireNonNullElseGet(
                                                       effectiveOptions.getTaskCriticality(),
                                                       () -> mean(sources, MemoryObject::getTaskCriticality)))
                                               .build());
            final var mergedId = created.getMemoryId();
            final var merged = persist(new Located(created, created.isQuarantined()),
                                       created.toBuilder()
                                               .provenanceEntry(ProvenanceEntry.builder()
                                                                        .action(ProvenanceAction.MERGED)
                                                                        .actorId(actorId)
                                                                        .timestamp(now)
                                                                        .reason("Merged from %d memories"
                                                                                        .formatted(ids.size()))
                                                                        .version(created.getVersion())
                                                                        .mergedFrom(ids)
                                                                        .build())
                                               .build());
            for (final var source : sources) {
                try {
                    store.updateMemory(softDeleted(source,
                                                   ProvenanceAction.DELETED,
                                                   actorId,
                                                   "Merged into " + mergedId));
                }
                catch (RuntimeException e) {
                    log.error("Merge into {} stopped while retiring {}", mergedId, source.getMemoryId(), e);
                    throw new MemoryLifecycleException(ErrorType.PARTIAL_FAILURE,
                                                       mergedId,
                                                       ("Merged memory %s was created but source %s could not be "
                                                               + "deleted").formatted(mergedId, source.getMemoryId()),
                                                       e);
                }
                publish(source.getMemoryId(), source.getNamespace(), ProvenanceAction.DELETED, actorId,
                          source.getVersion(), MemoryStatus.DELETED);
            }
            log.info("Merged {} into {}", ids, mergedId);
            audit(merged, AuditAction.UPDATE, actorId, Map.of("action_type", "merge", "merged_from", ids));
            publish(merged, ProvenanceAction.MERGED, actorId);
            return new MergeMemoriesResult(merged, ids);
        });
    }

    /**
     * Restores the content and scoring attributes of an earlier version. The current state is kept in history and
     * the version number keeps increasing.
     */
    public MemoryObject rollback(@NonNull String memoryId, int targetVersion, @NonNull String actorId) {
        return locked(memoryId, () -> {
            final var located = locate(memoryId);
            final var current = located.getMemory();
            if (current.isDeleted()) {
                throw MemoryLifecycleException.deletedMemory("rollback", memoryId);
            }
            if (current.getPreviousVersions().isEmpty()) {
                throw MemoryLifecycleException.noHistory(memoryId);
            }
            final var target = current.getPreviousVersions()
                    .stream()
                    .filter(version -> version.getVersion() == targetVersion)
                    .findFirst()
                    .orElseThrow(() -> MemoryLifecycleException.versionNotFound(
                            memoryId, targetVersion, availableVersions(current.getPreviousVersions())));
            final var now = clock.instant();
            final var reason = "Rolled back to version " + targetVersion;
            final var newVersion = current.getVersion() + 1;
            final var updated = persist(located, current.toBuilder()
                    .previousVersion(current.snapshot(now, actorId, reason))
                    .content(target.getContent())
                    .contentType(target.getContentType())
                    .clearTags()
                    .tags(Objects.requireNonNullElse(target.getTags(), List.of()))
                    .importance(target.getImportance())
                    .taskCriticality(target.getTaskCriticality())
                    .version(newVersion)
                    .provenanceEntry(ProvenanceEntry.builder()
                                             .action(ProvenanceAction.ROLLED_BACK)
                                             .actorId(actorId)
                                             .timestamp(now)
                                             .reason(reason)
                                             .version(newVersion)
                                             .previousContent(current.getContent())
                                             .build())
                    .build());
            log.info("Rolled back memory {} to version {} as version {}", memoryId, targetVersion, newVersion);
            audit(updated, AuditAction.UPDATE, actorId,
                  Map.of("action_type", "rollback", "target_version", targetVersion, "version", newVersion));
            publish(updated, ProvenanceAction.ROLLED_BACK, actorId);
            return updated;
        });
    }

    /**
     * Soft deletes every active memory in the namespace whose TTL or expiry timestamp has passed. The namespace is
     * swept in pages so that large namespaces are never loaded at once.
     */
    public ExpireMemoriesResult expire(@NonNull Namespace namespace) {
        final var expiredIds = new ArrayList<String>();
        int offset = 0;
        while (true) {
            final var batch = store.listMemories(namespace, ListMemoryOptions.builder()
                    .status(MemoryStatus.ACTIVE)
                    .includeExpired(true)
                    .limit(expiryBatchSize)
                    .offset(offset)
                    .order(SortOrder.ASC)
                    .build());
            for (final var candidate : batch) {
                if (!MemoryMatchers.isExpired(candidate, clock.instant())) {
                    offset++;
                    continue;
                }
                final var expired = expireOne(candidate.getMemoryId());
                if (expired) {
                    expiredIds.add(candidate.getMemoryId());
                }
                else {
                    offset++;
                }
            }
            if (batch.size() < expiryBatchSize) {
                break;
            }
        }
        if (!expiredIds.isEmpty()) {
            log.info("Expired {} memories in {}", expiredIds.size(), namespace.key());
            auditSafely(AuditEntry.builder()
                                .namespace(namespace)
                                .action(AuditAction.DELETE)
                                .resourceType(ResourceType.MEMORY)
                                .resourceId("batch:" + expiredIds.size())
                                .actorId(SYSTEM_ACTOR)
                                .timestamp(clock.instant())
                                .metadata(Map.of("action_type", "expire",
                                                 "expired_count", expiredIds.size(),
                                                 "expired_ids", List.copyOf(expiredIds)))
                                .build(),
                        null);
        }
        return ExpireMemoriesResult.of(expiredIds);
    }

    /**
     * Records that a memory was surfaced. Accesses from a session other than the one the memory was created in count
     * as cross-session recalls.
     */
    public MemoryObject recordAccess(@NonNull String memoryId,
                                     String checkpointId,
                                     @NonNull String actorId,
                                     String sessionId) {
        return locked(memoryId, () -> {
            final var located = locate(memoryId);
            final var current = located.getMemory();
            if (current.isDeleted()) {
                throw MemoryLifecycleException.deletedMemory("access", memoryId);
            }
            final var now = clock.instant();
            final var builder = current.toBuilder()
                    .lastAccessedAt(now)
                    .provenanceEntry(ProvenanceEntry.builder()
                                             .action(ProvenanceAction.ACCESSED)
                                             .actorId(actorId)
                                             .timestamp(now)
                                             .checkpointId(checkpointId)
                                             .version(current.getVersion())
                                             .build());
            if (checkpointId != null && !current.getCheckpointRefs().contains(checkpointId)) {
                builder.checkpointRef(checkpointId);
            }
            final var origin = Objects.requireNonNullElse(current.getSessionId(), DEFAULT_SESSION);
            if (sessionId != null && !sessionId.equals(origin)) {
                if (!current.getAccessedInSessions().contains(sessionId)) {
                    builder.accessedInSession(sessionId);
                }
                builder.crossSessionRecallCount(current.getCrossSessionRecallCount() + 1);
            }
            final var updated = persist(located, builder.build());
            log.debug("Recorded access to memory {} from session {}", memoryId, sessionId);
            audit(updated, AuditAction.READ, actorId,
                  Map.of("checkpoint_id", Strings.nullToEmpty(checkpointId),
                         "session_id", Strings.nullToEmpty(sessionId)));
            publish(updated, ProvenanceAction.ACCESSED, actorId);
            return updated;
        });
    }

    /**
     * Records that a checkpoint cites the memory
     */
    public MemoryObject linkToCheckpoint(@NonNull String memoryId,
                                         @NonNull String checkpointId,
                                         @NonNull String actorId) {
        return locked(memoryId, () -> {
            final var located = locate(memoryId);
            final var current = located.getMemory();
            if (current.isDeleted()) {
                throw MemoryLifecycleException.deletedMemory("cite", memoryId);
            }
            final var builder = current.toBuilder()
                    .provenanceEntry(ProvenanceEntry.builder()
                                             .action(ProvenanceAction.CITED)
                                             .actorId(actorId)
                                             .timestamp(clock.instant())
                                             .checkpointId(checkpointId)
                                             .version(current.getVersion())
                                             .build());
            if (!current.getCheckpointRefs().contains(checkpointId)) {
                builder.checkpointRef(checkpointId);
            }
            final var updated = persist(located, builder.build());
            audit(updated, AuditAction.UPDATE, actorId, Map.of("action_type", "cite", "checkpoint_id", checkpointId));
            publish(updated, ProvenanceAction.CITED, actorId);
            return updated;
        });
    }

    /**
     * Marks the memory as no longer valid. The next expiry sweep retires it.
     */
    public MemoryObject invalidate(@NonNull String memoryId, @NonNull String actorId, String reason) {
        return locked(memoryId, () -> {
            final var located = locate(memoryId);
            final var current = located.getMemory();
            if (current.isDeleted()) {
                throw MemoryLifecycleException.deletedMemory("invalidate", memoryId);
            }
            final var updated = persist(located, current.toBuilder()
                    .ttlSeconds(0L)
                    .provenanceEntry(ProvenanceEntry.builder()
                                             .action(ProvenanceAction.INVALIDATED)
                                             .actorId(actorId)
                                             .timestamp(clock.instant())
                                             .reason(reason)
                                             .version(current.getVersion())
                                             .build())
                    .build());
            log.info("Invalidated memory {}: {}", memoryId, reason);
            audit(updated, AuditAction.UPDATE, actorId,
                  Map.of("action_type", "invalidate", "reason", Strings.nullToEmpty(reason)));
            publish(updated, ProvenanceAction.INVALIDATED, actorId);
            return updated;
        });
    }

    public Optional<MemoryObject> getMemory(@NonNull String memoryId) {
        return store.getMemory(memoryId);
    }

    public Optional<MemoryObject> getQuarantinedMemory(@NonNull String memoryId) {
        return store.getQuarantinedMemory(memoryId);
    }

    public List<MemoryObject> listMemories(@NonNull Namespace namespace, ListMemoryOptions options) {
        return store.listMemories(namespace,
                                  Objects.requireNonNullElseGet(options, () -> ListMemoryOptions.builder().build()));
    }

    public List<MemoryObject> listQuarantinedMemories(@NonNull Namespace namespace, ListOptions options) {
        return store.listQuarantinedMemories(namespace, Objects.requireNonNullElseGet(options, ListOptions::defaults));
    }

    /**
     * Memories from either partition, in the order requested. Unknown ids are skipped.
     */
    public List<MemoryObject> getMemoriesByIds(@NonNull Collection<String> memoryIds) {
        return memoryIds.stream()
                .map(id -> store.getMemory(id).or(() -> store.getQuarantinedMemory(id)))
                .flatMap(Optional::stream)
                .toList();
    }

    /**
     * Full provenance trail of a memory, from whichever partition holds it
     */
    public List<ProvenanceEntry> memoryAuditLog(@NonNull String memoryId) {
        return locate(memoryId).getMemory().getProvenance();
    }

    private boolean expireOne(String memoryId) {
        return locked(memoryId, () -> {
            final var current = store.getMemory(memoryId).orElse(null);
            if (current == null
                    || current.getStatus() != MemoryStatus.ACTIVE
                    || !MemoryMatchers.isExpired(current, clock.instant())) {
                return false;
            }
            final var updated = softDeleted(current, ProvenanceAction.EXPIRED, SYSTEM_ACTOR, "TTL expired");
            store.updateMemory(updated);
            log.debug("Expired memory {}", memoryId);
            publish(updated, ProvenanceAction.EXPIRED, SYSTEM_ACTOR);
            return true;
        });
    }

    private MemoryObject softDeleted(MemoryObject current, ProvenanceAction action, String actorId, String reason) {
        if (current.isDeleted()) {
            throw MemoryLifecycleException.alreadyDeleted(current.getMemoryId());
        }
        return current.toBuilder()
                .status(MemoryStatus.DELETED)
                .provenanceEntry(ProvenanceEntry.builder()
                                         .action(action)
                                         .actorId(actorId)
                                         .timestamp(clock.instant())
                                         .reason(reason)
                                         .version(current.getVersion())
                                         .build())
                .build();
    }

    private Located locate(String memoryId) {
        final var primary = store.getMemory(memoryId);
        final var quarantined = store.getQuarantinedMemory(memoryId);
        if (primary.isPresent() && quarantined.isPresent()) {
            final var newer = newerCopy(primary.get(), quarantined.get());
            return new Located(newer, newer == quarantined.get());
        }
        if (primary.isPresent()) {
            return new Located(primary.get(), false);
        }
        return quarantined.map(memory -> new Located(memory, true))
                .orElseThrow(() -> MemoryLifecycleException.notFound(memoryId));
    }

    /**
     * Picks the copy carrying the longer provenance trail, then the later last entry. Ties go to the quarantined copy.
     */
    private static MemoryObject newerCopy(MemoryObject primary, MemoryObject quarantined) {
        final var primaryEntries = primary.getProvenance().size();
        final var quarantinedEntries = quarantined.getProvenance().size();
        if (primaryEntries != quarantinedEntries) {
            return primaryEntries > quarantinedEntries ? primary : quarantined;
        }
        final var primaryLast = lastEntryAt(primary);
        final var quarantinedLast = lastEntryAt(quarantined);
        return primaryLast != null && (quarantinedLast == null || primaryLast.isAfter(quarantinedLast))
               ? primary
               : quarantined;
    }

    private static Instant lastEntryAt(MemoryObject memory) {
        final var provenance = memory.getProvenance();
        return provenance.isEmpty() ? null : provenance.get(provenance.size() - 1).getTimestamp();
    }

    private MemoryObject persist(Located located, MemoryObject updated) {
        if (located.isQuarantinePartition()) {
            store.saveQuarantinedMemory(updated);
        }
        else {
            store.updateMemory(updated);
        }
        return updated;
    }

    private <T> T locked(String memoryId, Supplier<T> action) {
        final var lock = locks.get(memoryId);
        lock.lock();
        try {
            return action.get();
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Takes the stripes of all ids in Guava's stable stripe order so that concurrent multi-id operations cannot
     * deadlock
     */
    private <T> T lockedAll(List<String> memoryIds, Supplier<T> action) {
        final var acquired = new ArrayList<Lock>();
        try {
            for (final var lock : locks.bulkGet(memoryIds)) {
                lock.lock();
                acquired.add(lock);
            }
            return action.get();
        }
        finally {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                acquired.get(i).unlock();
            }
        }
    }

    private void audit(MemoryObject memory, AuditAction action, String actorId, Map<String, Object> metadata) {
        auditSafely(AuditEntry.builder()
                            .namespace(memory.getNamespace())
                            .action(action)
                            .resourceType(ResourceType.MEMORY)
                            .resourceId(memory.getMemoryId())
                            .actorId(actorId)
                            .timestamp(clock.instant())
                            .metadata(metadata)
                            .build(),
                    memory.getMemoryId());
    }

    private void auditSafely(AuditEntry entry, String memoryId) {
        try {
            store.logAudit(entry);
        }
        catch (RuntimeException e) {
            log.warn("Audit write for {} {} failed: {}", entry.getAction(), entry.getResourceId(), e.getMessage());
            eventBus.notify(new AuditWriteFailedEvent(entry.getNamespace().key(),
                                                      memoryId,
                                                      clock.instant(),
                                                      entry.getAction(),
                                                      entry.getResourceId(),
                                                      e.getMessage()));
        }
    }

    private void publish(MemoryObject memory, ProvenanceAction action, String actorId) {
        publish(memory.getMemoryId(), memory.getNamespace(), action, actorId, memory.getVersion(),
                  memory.getStatus());
    }

    private void publish(String memoryId,
                           Namespace namespace,
                           ProvenanceAction action,
                           String actorId,
                           int version,
                           MemoryStatus status) {
        eventBus.notify(new MemoryMutatedEvent(namespace.key(), memoryId, clock.instant(), action, actorId,
                                               version, status));
    }

    private static IngestionMetadata ingestionOf(MemoryObject memory) {
        return Objects.requireNonNullElseGet(memory.getIngestion(), () -> IngestionMetadata.builder().build());
    }

    private static void checkScore(String memoryId, String name, Double value) {
        if (value != null && (value < 0 || value > 1 || value.isNaN())) {
            throw MemoryLifecycleException.invalidArgument(memoryId, "%s must be between 0 and 1, got %s"
                    .formatted(name, value));
        }
    }

    private static double mean(List<MemoryObject> memories, ToDoubleFunction<MemoryObject> f) {
        return memories.stream().mapToDouble(f).average().orElse(0.5);
    }

    private static List<Integer> availableVersions(List<MemoryVersion> versions) {
        return versions.stream().map(MemoryVersion::getVersion).toList();
    }

    @Value
    private static class Located {
        MemoryObject memory;
        boolean quarantinePartition;
    }
}
