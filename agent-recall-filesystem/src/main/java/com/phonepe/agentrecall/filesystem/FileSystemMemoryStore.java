/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.agentrecall.filesystem;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Strings;
import com.phonepe.agentrecall.core.model.MemoryObject;
import com.phonepe.agentrecall.core.model.Namespace;
import com.phonepe.agentrecall.core.store.AuditEntry;
import com.phonepe.agentrecall.core.store.ListMemoryOptions;
import com.phonepe.agentrecall.core.store.ListOptions;
import com.phonepe.agentrecall.core.store.MemoryCandidate;
import com.phonepe.agentrecall.core.store.MemoryMatchers;
import com.phonepe.agentrecall.core.store.MemoryQuery;
import com.phonepe.agentrecall.core.store.MemoryStore;
import com.phonepe.agentrecall.core.store.MemoryStoreException;
import com.phonepe.agentrecall.core.store.SortOrder;
import com.phonepe.agentrecall.core.store.StoreErrorCode;
import com.phonepe.agentrecall.core.utils.JsonUtils;
import com.phonepe.agentrecall.filesystem.utils.FileUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.StampedLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Stores memories as JSON files: one file per memory under {@code memories/} and {@code quarantine/}, and an append
 * only {@code audit/audit.jsonl}. Everything is loaded into memory on start and reads are served from the cache.
 * This is meant for local and single process use.
 */
@Slf4j
public class FileSystemMemoryStore implements MemoryStore {
    private static final String MEMORIES_DIR = "memories";
    private static final String QUARANTINE_DIR = "quarantine";
    private static final String AUDIT_DIR = "audit";
    private static final String AUDIT_FILE = "audit.jsonl";
    private static final String EXTENSION = ".json";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path memoriesRoot;
    private final Path quarantineRoot;
    private final Path auditFile;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Map<String, MemoryObject> memories = new ConcurrentHashMap<>();
    private final Map<String, MemoryObject> quarantined = new ConcurrentHashMap<>();
    private final List<AuditEntry> auditLog = new ArrayList<>();
    private final StampedLock lock = new StampedLock();

    @Builder
    public FileSystemMemoryStore(@NonNull String baseDir, ObjectMapper mapper, Clock clock) {
        final var root = FileUtils.ensurePath(baseDir, true);
        this.memoriesRoot = FileUtils.ensurePath(root.resolve(MEMORIES_DIR).toString(), true);
        this.quarantineRoot = FileUtils.ensurePath(root.resolve(QUARANTINE_DIR).toString(), true);
        this.auditFile = FileUtils.ensurePath(root.resolve(AUDIT_DIR).toString(), true).resolve(AUDIT_FILE);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.clock = Objects.requireNonNullElseGet(clock, Clock::systemUTC);
        loadMemories(memoriesRoot, memories);
        loadMemories(quarantineRoot, quarantined);
        loadAuditLog();
        log.info("Loaded {} memories, {} quarantined memories and {} audit entries from {}",
                 memories.size(), quarantined.size(), auditLog.size(), root);
    }

    @Override
    public void saveMemory(MemoryObject memory) {
        write(memoriesRoot, memories, memory);
    }

    @Override
    public Optional<MemoryObject> getMemory(String memoryId) {
        return Optional.ofNullable(memories.get(memoryId));
    }

    @Override
    public void updateMemory(MemoryObject memory) {
        write(memoriesRoot, memories, memory);
    }

    @Override
    public void removeMemory(String memoryId) {
        remove(memoriesRoot, memories, memoryId);
    }

    @Override
    public List<MemoryObject> listMemories(Namespace namespace, ListMemoryOptions options) {
        final var now = clock.instant();
        return memories.values()
                .stream()
                .filter(memory -> MemoryMatchers.inNamespace(memory, namespace))
                .filter(memory -> MemoryMatchers.matchesListOptions(memory, options, now))
                .sorted(MemoryMatchers.byCreatedAt(options.getOrder()))
                .skip(options.getOffset())
                .limit(options.getLimit())
                .toList();
    }

    @Override
    public List<MemoryCandidate> searchMemories(MemoryQuery query) {
        final var now = clock.instant();
        return memories.values()
                .stream()
                .filter(memory -> MemoryMatchers.matchesQuery(memory, query, now))
                .map(memory -> MemoryCandidate.of(memory, MemoryMatchers.similarity(memory, query)))
                .toList();
    }

    @Override
    public void saveQuarantinedMemory(MemoryObject memory) {
        write(quarantineRoot, quarantined, memory);
    }

    @Override
    public Optional<MemoryObject> getQuarantinedMemory(String memoryId) {
        return Optional.ofNullable(quarantined.get(memoryId));
    }

    @Override
    public List<MemoryObject> listQuarantinedMemories(Namespace namespace, ListOptions options) {
        return quarantined.values()
                .stream()
                .filter(memory -> MemoryMatchers.inNamespace(memory, namespace))
                .sorted(MemoryMatchers.byCreatedAt(options.getOrder()))
                .skip(options.getOffset())
                .limit(options.getLimit())
                .toList();
    }

    @Override
    public void deleteQuarantinedMemory(String memoryId) {
        remove(quarantineRoot, quarantined, memoryId);
    }

    @Override
    public void logAudit(AuditEntry entry) {
        final var stored = entry.toBuilder()
                .id(Strings.isNullOrEmpty(entry.getId()) ? UUID.randomUUID().toString() : entry.getId())
                .timestamp(Objects.requireNonNullElseGet(entry.getTimestamp(), clock::instant))
                .build();
        final var line = serialize(stored) + "\n";
        writeLocked(() -> {
            FileUtils.append(auditFile, line.getBytes(StandardCharsets.UTF_8));
            auditLog.add(stored);
            return null;
        });
    }

    @Override
    public List<AuditEntry> getAuditLog(Namespace namespace, ListOptions options) {
        final Comparator<AuditEntry> ascending = Comparator.comparing(AuditEntry::getTimestamp);
        final var stamp = lock.readLock();
        try {
            return auditLog.stream()
                    .filter(entry -> entry.getNamespace().key().equals(namespace.key()))
                    .sorted(options.getOrder() == SortOrder.ASC ? ascending : ascending.reversed())
                    .skip(options.getOffset())
                    .limit(options.getLimit())
                    .toList();
        }
        finally {
            lock.unlockRead(stamp);
        }
    }

    private void write(Path root, Map<String, MemoryObject> cache, MemoryObject memory) {
        final var file = fileFor(root, memory.getMemoryId());
        final var data = serialize(memory).getBytes(StandardCharsets.UTF_8);
        writeLocked(() -> {
            FileUtils.replace(file, data);
            cache.put(memory.getMemoryId(), memory);
            return null;
        });
    }

    private void remove(Path root, Map<String, MemoryObject> cache, String memoryId) {
        final var file = fileFor(root, memoryId);
        writeLocked(() -> {
            FileUtils.delete(file);
            cache.remove(memoryId);
            return null;
        });
    }

    private <T> T writeLocked(Supplier<T> action) {
        final var stamp = lock.writeLock();
        try {
            return action.get();
        }
        catch (MemoryStoreException e) {
            throw e;
        }
        catch (Exception e) {
            log.error("Write to {} failed: {}", memoriesRoot.getParent(), e.getMessage());
            throw new MemoryStoreException(StoreErrorCode.STORAGE_ERROR, "Write failed: " + e.getMessage(), e);
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    private String serialize(Object value) {
        try {
            return mapper.writeValueAsString(value);
        }
        catch (IOException e) {
            throw new MemoryStoreException(StoreErrorCode.STORAGE_ERROR,
                                           "Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static Path fileFor(Path root, String memoryId) {
        if (!SAFE_ID.matcher(memoryId).matches()) {
            throw new MemoryStoreException(StoreErrorCode.STORAGE_ERROR, "Unsupported memory id: " + memoryId);
        }
        return root.resolve(memoryId + EXTENSION);
    }

    private void loadMemories(Path root, Map<String, MemoryObject> cache) {
        try (final var paths = Files.list(root)) {
            paths.filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                    .forEach(path -> {
                        try {
                            final var memory = mapper.readValue(path.toFile(), MemoryObject.class);
                            cache.put(memory.getMemoryId(), memory);
                        }
                        catch (Exception e) {
                            log.error("Failed to load memory from path: {}", path, e);
                        }
                    });
        }
        catch (IOException e) {
            throw new MemoryStoreException(StoreErrorCode.STORAGE_ERROR, "Could not list " + root, e);
        }
    }

    private void loadAuditLog() {
        if (!Files.exists(auditFile)) {
            return;
        }
        try (final var lines = Files.lines(auditFile, StandardCharsets.UTF_8)) {
            lines.filter(line -> !line.isBlank())
                    .forEach(line -> {
                        try {
                            auditLog.add(mapper.readValue(line, AuditEntry.class));
                        }
                        catch (Exception e) {
                            log.error("Skipping unreadable audit line in {}", auditFile, e);
                        }
                    });
        }
        catch (IOException e) {
            throw new MemoryStoreException(StoreErrorCode.STORAGE_ERROR, "Could not read " + auditFile, e);
        }
    }
}
