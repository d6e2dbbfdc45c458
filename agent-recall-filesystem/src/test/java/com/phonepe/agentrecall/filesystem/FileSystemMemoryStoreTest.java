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

import com.phonepe.agentrecall.core.lifecycle.MemoryLifecycleManager;
import com.phonepe.agentrecall.core.model.CreateMemoryInput;
import com.phonepe.agentrecall.core.model.EditMemoryInput;
import com.phonepe.agentrecall.core.model.MemoryObject;
import com.phonepe.agentrecall.core.model.MemoryStatus;
import com.phonepe.agentrecall.core.model.Namespace;
import com.phonepe.agentrecall.core.model.SourceType;
import com.phonepe.agentrecall.core.store.AuditAction;
import com.phonepe.agentrecall.core.store.AuditEntry;
import com.phonepe.agentrecall.core.store.ListMemoryOptions;
import com.phonepe.agentrecall.core.store.ListOptions;
import com.phonepe.agentrecall.core.store.MemoryQuery;
import com.phonepe.agentrecall.core.store.MemoryStoreException;
import com.phonepe.agentrecall.core.store.ResourceType;
import com.phonepe.agentrecall.core.store.StoreErrorCode;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemMemoryStoreTest {
    private static final Namespace NAMESPACE = Namespace.of("acme", "support", "triage-agent");
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    @Test
    void testSaveAndReload() {
        final var store = store();
        final var memory = memory(NOW, "refund", "policy");
        store.saveMemory(memory);
        assertTrue(Files.exists(tempDir.resolve("memories").resolve(memory.getMemoryId() + ".json")));

        final var reloaded = store().getMemory(memory.getMemoryId()).orElseThrow();
        assertEquals(memory.getContent(), reloaded.getContent());
        assertEquals(memory.getTags(), reloaded.getTags());
        assertEquals(memory.getCreatedAt(), reloaded.getCreatedAt());
        assertEquals(memory.getNamespace(), reloaded.getNamespace());
        assertEquals(MemoryStatus.ACTIVE, reloaded.getStatus());
    }

    @Test
    void testListAndSearch() {
        final var store = store();
        final var older = memory(NOW.minus(Duration.ofHours(2)), "refund");
        final var newer = memory(NOW.minus(Duration.ofHours(1)), "refund", "escalation");
        store.saveMemory(older);
        store.saveMemory(newer);
        store.saveMemory(memory(NOW, "refund").withTtlSeconds(0L));

        assertEquals(List.of(newer.getMemoryId(), older.getMemoryId()),
                     store.listMemories(NAMESPACE, ListMemoryOptions.active())
                             .stream()
                             .map(MemoryObject::getMemoryId)
                             .toList());
        final var candidates = store.searchMemories(MemoryQuery.builder()
                                                            .namespace(NAMESPACE)
                                                            .tags(List.of("escalation"))
                                                            .build());
        assertEquals(1, candidates.size());
        assertEquals(newer.getMemoryId(), candidates.get(0).getMemory().getMemoryId());
    }

    @Test
    void testQuarantinePartition() {
        final var store = store();
        final var memory = memory(NOW).withStatus(MemoryStatus.QUARANTINED);
        store.saveQuarantinedMemory(memory);
        assertTrue(store.getMemory(memory.getMemoryId()).isEmpty());

        final var reopened = store();
        assertTrue(reopened.getQuarantinedMemory(memory.getMemoryId()).isPresent());
        assertEquals(1, reopened.listQuarantinedMemories(NAMESPACE, ListOptions.defaults()).size());
        assertTrue(reopened.namespaceExists(NAMESPACE));

        reopened.deleteQuarantinedMemory(memory.getMemoryId());
        assertFalse(Files.exists(tempDir.resolve("quarantine").resolve(memory.getMemoryId() + ".json")));
        assertTrue(store().getQuarantinedMemory(memory.getMemoryId()).isEmpty());
    }

    @Test
    void testAuditLogPersisted() {
        final var store = store();
        store.logAudit(AuditEntry.builder()
                               .namespace(NAMESPACE)
                               .action(AuditAction.CREATE)
                               .resourceType(ResourceType.MEMORY)
                               .resourceId("m1")
                               .actorId("agent")
                               .build());
        store.logAudit(AuditEntry.builder()
                               .namespace(NAMESPACE)
                               .action(AuditAction.DELETE)
                               .resourceType(ResourceType.MEMORY)
                               .resourceId("m1")
                               .actorId("agent")
                               .timestamp(NOW.plusSeconds(5))
                               .build());

        final var entries = store().getAuditLog(NAMESPACE, ListOptions.defaults());
        assertEquals(2, entries.size());
        assertEquals(AuditAction.DELETE, entries.get(0).getAction());
        assertEquals(NOW, entries.get(1).getTimestamp());
        assertFalse(entries.get(1).getId().isEmpty());
    }

    @Test
    @SneakyThrows
    void testUnreadableFilesSkipped() {
        final var store = store();
        final var memory = memory(NOW);
        store.saveMemory(memory);
        Files.writeString(tempDir.resolve("memories").resolve("broken.json"), "{not json", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("audit").resolve("audit.jsonl"), "garbage\n",
                          StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);

        final var reopened = store();
        assertEquals(1, reopened.listMemories(NAMESPACE, ListMemoryOptions.active()).size());
        assertTrue(reopened.getAuditLog(NAMESPACE, ListOptions.defaults()).isEmpty());
    }

    @Test
    void testUnsafeIdRejected() {
        final var store = store();
        final var error = assertThrows(MemoryStoreException.class,
                                       () -> store.saveMemory(memory(NOW).withMemoryId("../outside")));
        assertEquals(StoreErrorCode.STORAGE_ERROR, error.getErrorCode());
    }

    @Test
    @SneakyThrows
    void testWriteFailureReported() {
        final var store = store();
        final var memoriesDir = tempDir.resolve("memories");
        try (final var paths = Files.walk(memoriesDir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        }
        final var memory = memory(NOW);
        final var error = assertThrows(MemoryStoreException.class, () -> store.saveMemory(memory));
        assertEquals(StoreErrorCode.STORAGE_ERROR, error.getErrorCode());
        assertTrue(store.getMemory(memory.getMemoryId()).isEmpty());
    }

    @Test
    void testLifecycleSurvivesRestart() {
        final var manager = MemoryLifecycleManager.builder()
                .store(store())
                .clock(CLOCK)
                .build();
        final var created = manager.create(CreateMemoryInput.builder()
                                                   .namespace(NAMESPACE)
                                                   .content("Refunds are processed within five business days.")
                                                   .sourceType(SourceType.USER_INPUT)
                                                   .sourceIdentifier("user-42")
                                                   .tags(List.of("refund"))
                                                   .build());
        manager.edit(created.getMemoryId(),
                     EditMemoryInput.builder()
                             .content("Refunds are processed within seven business days.")
                             .build(),
                     "agent",
                     "Policy update");

        final var reopened = MemoryLifecycleManager.builder()
                .store(store())
                .clock(CLOCK)
                .build();
        final var memory = reopened.getMemory(created.getMemoryId()).orElseThrow();
        assertEquals(2, memory.getVersion());
        assertEquals("Refunds are processed within seven business days.", memory.getContent());
        assertEquals(1, memory.getPreviousVersions().size());
        assertEquals("Refunds are processed within five business days.",
                     memory.getPreviousVersions().get(0).getContent());
        assertEquals(2, reopened.memoryAuditLog(created.getMemoryId()).size());

        final var rolledBack = reopened.rollback(created.getMemoryId(), 1, "agent");
        assertEquals("Refunds are processed within five business days.", rolledBack.getContent());
        assertEquals(3, store().getMemory(created.getMemoryId()).orElseThrow().getVersion());
    }

    private FileSystemMemoryStore store() {
        return FileSystemMemoryStore.builder()
                .baseDir(tempDir.toString())
                .clock(CLOCK)
                .build();
    }

    private static MemoryObject memory(Instant createdAt, String... tags) {
        return MemoryObject.builder()
                .memoryId(UUID.randomUUID().toString())
                .namespace(NAMESPACE)
                .content("Customer prefers email over phone for follow ups")
                .contentType("text")
                .tags(List.of(tags))
                .importance(0.5)
                .taskCriticality(0.5)
                .createdAt(createdAt)
                .build();
    }
}
