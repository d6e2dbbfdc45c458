package com.phonepe.agentrecall.core.recall;

import com.google.common.base.Stopwatch;
import com.phonepe.agentrecall.core.config.AgentRecallConfig;
import com.phonepe.agentrecall.core.events.AuditWriteFailedEvent;
import com.phonepe.agentrecall.core.events.EventBus;
import com.phonepe.agentrecall.core.events.RecallFailedEvent;
import com.phonepe.agentrecall.core.freshness.StalenessEvaluator;
import com.phonepe.agentrecall.core.freshness.StalenessMetrics;
import com.phonepe.agentrecall.core.lifecycle.MemoryLifecycleManager;
import com.phonepe.agentrecall.core.model.MemoryObject;
import com.phonepe.agentrecall.core.ranking.RankingEngine;
import com.phonepe.agentrecall.core.ranking.ScoredMemory;
import com.phonepe.agentrecall.core.store.AuditAction;
import com.phonepe.agentrecall.core.store.AuditEntry;
import com.phonepe.agentrecall.core.store.MemoryCandidate;
import com.phonepe.agentrecall.core.store.MemoryQuery;
import com.phonepe.agentrecall.core.store.MemoryStore;
import com.phonepe.agentrecall.core.store.MemoryStoreException;
import com.phonepe.agentrecall.core.store.ResourceType;
import com.phonepe.agentrecall.core.store.StoreErrorCode;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs ranked searches. Never throws for backend or filtering problems; those come back as {@link RecallFailure}s
 * alongside an empty or partial result list.
 */
@Slf4j
public class MemoryRetriever {
    public static final String RETRIEVER_ACTOR = "memory-retriever";

    private final MemoryStore store;
    private final MemoryLifecycleManager lifecycleManager;
    private final RankingEngine rankingEngine;
    private final StalenessEvaluator stalenessEvaluator;
    private final EventBus eventBus;
    private final Clock clock;
    private final int defaultLimit;
    private final Duration searchTimeout;
    private final ExecutorService executorService;

    /**
     * @param lifecycleManager Needed only for queries that record access
     * @param executorService  Runs store searches when a search timeout is configured
     */
    @Builder
    public MemoryRetriever(@NonNull MemoryStore store,
                           MemoryLifecycleManager lifecycleManager,
                           AgentRecallConfig config,
                           EventBus eventBus,
                           Clock clock,
                           ExecutorService executorService) {
        final var effectiveConfig = Objects.requireNonNullElse(config, AgentRecallConfig.DEFAULT);
        this.store = store;
        this.lifecycleManager = lifecycleManager;
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        this.rankingEngine = new RankingEngine(effectiveConfig.getRankingWeights(), this.clock);
        this.stalenessEvaluator = new StalenessEvaluator(effectiveConfig.getSlo().getFreshness(), this.clock);
        this.eventBus = Objects.requireNonNullElseGet(eventBus, EventBus::new);
        this.defaultLimit = effectiveConfig.getDefaultSearchLimit();
        this.searchTimeout = effectiveConfig.getSearchTimeout();
        this.executorService = searchTimeout == null
                               ? executorService
                               : Objects.requireNonNullElseGet(executorService, Executors::newCachedThreadPool);
    }

    public MemorySearchResponse search(@NonNull MemoryQuery query) {
        return search(query, null);
    }

    /**
     * @param statistics Accumulator to record the outcome in, may be null
     */
    public MemorySearchResponse search(@NonNull MemoryQuery query, RecallStatistics statistics) {
        final var stopwatch = Stopwatch.createStarted();
        final var response = execute(query, stopwatch);
        response.getFailures()
                .forEach(failure -> eventBus.notify(new RecallFailedEvent(query.getNamespace().key(),
                                                                          clock.instant(),
                                                                          failure)));
        auditSearch(query, response);
        if (statistics != null) {
            statistics.record(response);
        }
        return response;
    }

    private MemorySearchResponse execute(MemoryQuery query, Stopwatch stopwatch) {
        final List<MemoryCandidate> candidates;
        try {
            candidates = fetch(query);
        }
        catch (MemoryStoreException e) {
            log.error("Memory search in {} failed with {}", query.getNamespace().key(), e.getErrorCode(), e);
            return failed(query, stopwatch, switch (e.getErrorCode()) {
                case QUOTA_EXCEEDED -> RecallFailureReason.QUOTA_EXCEEDED;
                case NAMESPACE_NOT_FOUND -> RecallFailureReason.NAMESPACE_NOT_FOUND;
                case TIMEOUT -> RecallFailureReason.TIMEOUT;
                case STORAGE_ERROR -> RecallFailureReason.STORAGE_ERROR;
            });
        }
        catch (TimeoutException e) {
            log.error("Memory search in {} timed out after {}", query.getNamespace().key(), searchTimeout);
            return failed(query, stopwatch, RecallFailureReason.TIMEOUT);
        }
        catch (RuntimeException e) {
            log.error("Memory search in {} failed", query.getNamespace().key(), e);
            return failed(query, stopwatch, RecallFailureReason.STORAGE_ERROR);
        }

        final var failures = new ArrayList<RecallFailure>();
        final var totalCandidates = candidates.size();
        if (totalCandidates == 0) {
            failures.add(failure(query, namespaceExists(query)
                                        ? RecallFailureReason.NO_MATCHES
                                        : RecallFailureReason.NAMESPACE_NOT_FOUND, 0));
            return MemorySearchResponse.builder()
                    .failures(failures)
                    .crossSessionAttempted(query.isIncludeCrossSession())
                    .queryTimeMs(stopwatch.elapsed(TimeUnit.MILLISECONDS))
                    .build();
        }

        int relevanceFiltered = 0;
        int staleFiltered = 0;
        final var minSimilarity = query.getMinSemanticSimilarity();
        final var filterByRelevance = minSimilarity != null && query.hasSemanticSignal();
        final var survivors = new ArrayList<ScoredMemory>();
        final Map<String, StalenessMetrics> staleness = new HashMap<>();
        for (final var candidate : candidates) {
            if (filterByRelevance && candidate.getSemanticSimilarity() < minSimilarity) {
                relevanceFiltered++;
                continue;
            }
            final var memory = candidate.getMemory();
            final var metrics = stalenessEvaluator.evaluate(memory);
            final var tooOld = query.getMaxAgeSeconds() != null
                    && metrics.getAgeHours() * 3600 > query.getMaxAgeSeconds();
            if (tooOld || (query.isExcludeStale() && metrics.isStale())) {
                staleFiltered++;
                continue;
            }
            staleness.put(memory.getMemoryId(), metrics);
            survivors.add(rankingEngine.score(memory, candidate.getSemanticSimilarity(), query.getRankingWeights()));
        }
        if (survivors.isEmpty()) {
            if (staleFiltered > 0) {
                failures.add(failure(query, RecallFailureReason.ALL_STALE, staleFiltered));
            }
            if (relevanceFiltered > 0) {
                failures.add(failure(query, RecallFailureReason.BELOW_RELEVANCE_THRESHOLD, relevanceFiltered));
            }
        }
        if (query.getQueryEmbedding() != null
                && query.getQueryEmbedding().length > 0
                && candidates.stream().noneMatch(candidate -> candidate.getMemory().getEmbedding() != null)) {
            failures.add(failure(query, RecallFailureReason.EMBEDDING_UNAVAILABLE, null));
        }

        final var limit = query.getLimit() != null && query.getLimit() > 0 ? query.getLimit() : defaultLimit;
        final var ranked = RankingEngine.rank(survivors).stream().limit(limit).toList();
        final var currentSession = currentSession(query);
        final var results = ranked.stream()
                .map(scored -> toResult(scored,
                                        staleness.get(scored.getMemory().getMemoryId()),
                                        currentSession,
                                        query.isIncludeContent()))
                .toList();
        final var crossSessionSuccess = query.isIncludeCrossSession()
                && results.stream().anyMatch(MemoryResult::isCrossSession);
        if (query.isIncludeCrossSession() && !crossSessionSuccess) {
            failures.add(failure(query, RecallFailureReason.CROSS_SESSION_UNAVAILABLE, null));
        }
        if (query.isRecordAccess()) {
            recordAccess(results, currentSession);
        }
        return MemorySearchResponse.builder()
                .results(results)
                .failures(failures)
                .totalCandidates(totalCandidates)
                .staleFiltered(staleFiltered)
                .relevanceFiltered(relevanceFiltered)
                .crossSessionAttempted(query.isIncludeCrossSession())
                .crossSessionSuccess(crossSessionSuccess)
                .queryTimeMs(stopwatch.elapsed(TimeUnit.MILLISECONDS))
                .build();
    }

    private List<MemoryCandidate> fetch(MemoryQuery query) throws TimeoutException {
        if (searchTimeout == null) {
            return store.searchMemories(query);
        }
        final var future = CompletableFuture.supplyAsync(() -> store.searchMemories(query), executorService);
        try {
            return future.get(searchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MemoryStoreException(StoreErrorCode.TIMEOUT,
                                           "Interrupted while waiting for memory search", e);
        }
        catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new MemoryStoreException(StoreErrorCode.STORAGE_ERROR,
                                           "Memory search failed", e.getCause());
        }
    }

    private MemoryResult toResult(ScoredMemory scored,
                                  StalenessMetrics metrics,
                                  String currentSession,
                                  boolean includeContent) {
        final var memory = scored.getMemory();
        return MemoryResult.builder()
                .memoryId(memory.getMemoryId())
                .content(includeContent ? memory.getContent() : null)
                .contentType(memory.getContentType())
                .score(scored.getScore())
                .scoreComponents(scored.getComponents())
                .semanticSimilarity(scored.getSemanticSimilarity())
                .stalenessScore(metrics.getStalenessScore())
                .stale(metrics.isStale())
                .ageDays(metrics.getAgeDays())
                .ageHours(metrics.getAgeHours())
                .staleReason(metrics.getStaleReason())
                .timeUntilStaleHours(metrics.getTimeUntilStaleHours())
                .sessionId(memory.getSessionId())
                .crossSession(isCrossSession(memory, currentSession))
                .tags(memory.getTags())
                .source(memory.getSource())
                .provenance(memory.getProvenance())
                .build();
    }

    private void recordAccess(List<MemoryResult> results, String currentSession) {
        if (lifecycleManager == null) {
            log.warn("Access tracking requested but no lifecycle manager is configured");
            return;
        }
        for (final var result : results) {
            try {
                lifecycleManager.recordAccess(result.getMemoryId(), null, RETRIEVER_ACTOR, currentSession);
            }
            catch (RuntimeException e) {
                log.warn("Could not record access to memory {}: {}", result.getMemoryId(), e.getMessage());
            }
        }
    }

    private void auditSearch(MemoryQuery query, MemorySearchResponse response) {
        final var entry = AuditEntry.builder()
                .namespace(query.getNamespace())
                .action(AuditAction.SEARCH)
                .resourceType(ResourceType.MEMORY)
                .resourceId("search")
                .actorId(RETRIEVER_ACTOR)
                .timestamp(clock.instant())
                .metadataEntry("query", Objects.requireNonNullElse(query.getQuery(), ""))
                .metadataEntry("result_count", response.getResults().size())
                .metadataEntry("failure_count", response.getFailures().size())
                .build();
        try {
            store.logAudit(entry);
        }
        catch (RuntimeException e) {
            log.warn("Audit write for search in {} failed: {}", query.getNamespace().key(), e.getMessage());
            eventBus.notify(new AuditWriteFailedEvent(query.getNamespace().key(),
                                                      null,
                                                      clock.instant(),
                                                      AuditAction.SEARCH,
                                                      entry.getResourceId(),
                                                      e.getMessage()));
        }
    }

    private boolean namespaceExists(MemoryQuery query) {
        try {
            return store.namespaceExists(query.getNamespace());
        }
        catch (RuntimeException e) {
            log.warn("Could not check namespace {}: {}", query.getNamespace().key(), e.getMessage());
            return true;
        }
    }

    private MemorySearchResponse failed(MemoryQuery query, Stopwatch stopwatch, RecallFailureReason reason) {
        return MemorySearchResponse.builder()
                .failure(failure(query, reason, null))
                .crossSessionAttempted(query.isIncludeCrossSession())
                .queryTimeMs(stopwatch.elapsed(TimeUnit.MILLISECONDS))
                .build();
    }

    private RecallFailure failure(MemoryQuery query, RecallFailureReason reason, Integer filteredCount) {
        log.debug("Recall failure {} for query '{}' in {}", reason, query.getQuery(), query.getNamespace().key());
        return RecallFailure.of(reason,
                                query.getQuery(),
                                query.getNamespace().key(),
                                currentSession(query),
                                filteredCount,
                                clock.instant());
    }

    private static String currentSession(MemoryQuery query) {
        return query.getCurrentSessionId() != null ? query.getCurrentSessionId() : query.getSessionId();
    }

    private static boolean isCrossSession(MemoryObject memory, String currentSession) {
        return currentSession != null
                && !currentSession.equals(Objects.requireNonNullElse(memory.getSessionId(),
                                                                     MemoryLifecycleManager.DEFAULT_SESSION));
    }
}
