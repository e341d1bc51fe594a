package com.gateflow.core.persistence;

import com.gateflow.core.PipelineFixtures;
import com.gateflow.core.model.Gate;
import com.gateflow.core.model.PipelineState;
import com.gateflow.core.model.PipelineStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileStateStoreTest {

    @TempDir
    Path directory;

    private FileStateStore store;

    @BeforeEach
    void setUp() {
        store = new FileStateStore(directory, StateCodec.objectMapper());
    }

    @Test
    @DisplayName("a pipeline state survives a write/read cycle intact")
    void writeAndRead() {
        var state = PipelineState.started(PipelineFixtures.loginRequest(), Instant.parse("2026-03-01T10:00:00Z"))
                .withDataPreparationSelected(false, Instant.parse("2026-03-01T10:00:01Z"))
                .withGateCompleted(Gate.TEST_CASE_DESIGN, Instant.parse("2026-03-01T10:00:05Z"));

        store.write("docsearch-login-pipeline", state);

        PipelineState read = store.read("docsearch-login-pipeline", PipelineState.class).orElseThrow();
        assertEquals(state, read);
        assertEquals(PipelineStatus.IN_PROGRESS, read.status());
        assertEquals(List.of(1), read.completedGates());
    }

    @Test
    void missingKeyReadsEmpty() {
        assertTrue(store.read("nothing-here", Map.class).isEmpty());
        assertFalse(store.exists("nothing-here"));
    }

    @Test
    void writeReplacesPreviousRecordAndLeavesNoTempFiles() throws Exception {
        store.write("k", Map.of("v", 1));
        store.write("k", Map.of("v", 2));

        assertEquals(2, store.read("k", Map.class).orElseThrow().get("v"));
        try (var files = Files.list(directory)) {
            assertEquals(List.of("k.json"), files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    void listKeysFiltersBySuffixAndSorts() {
        store.write("b-feature-pipeline", Map.of());
        store.write("a-feature-pipeline", Map.of());
        store.write("a-feature-audit", Map.of());

        assertEquals(List.of("a-feature-pipeline", "b-feature-pipeline"), store.listKeys(StateKeys.PIPELINE_SUFFIX));
        assertEquals(3, store.listKeys(null).size());
    }

    @Test
    void listKeysOnMissingDirectoryIsEmpty() {
        var absent = new FileStateStore(directory.resolve("absent"), StateCodec.objectMapper());
        assertTrue(absent.listKeys(StateKeys.PIPELINE_SUFFIX).isEmpty());
    }

    @Test
    void deleteRemovesRecordAndIgnoresMissing() {
        store.write("k", Map.of());
        store.delete("k");
        store.delete("k");
        assertFalse(store.exists("k"));
    }

    @Test
    void corruptRecordFailsTheRead() throws Exception {
        Files.writeString(directory.resolve("broken.json"), "{not json");

        var e = assertThrows(StateStoreException.class, () -> store.read("broken", Map.class));
        assertEquals("broken", e.getKey());
    }

    @Test
    void keysThatEscapeTheDirectoryAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> store.write("../escape", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> store.read("a/b", Map.class));
    }

    @Test
    void unwritableDirectoryFailsTheWrite() throws Exception {
        Path file = directory.resolve("not-a-dir");
        Files.writeString(file, "x");
        var blocked = new FileStateStore(file, StateCodec.objectMapper());

        assertThrows(StateStoreException.class, () -> blocked.write("k", Map.of()));
    }
}
