/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.dqchecker.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JsonFileExecutionArchive}.
 */
class JsonFileExecutionArchiveTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void archive_shouldWriteExecutionFile() throws Exception {
        // Given - archive directory does not exist yet
        Path directory = tempDir.resolve("executions");
        JsonFileExecutionArchive archive = new JsonFileExecutionArchive(directory);
        ArchivedExecution execution = ArchivedExecution.builder()
                .runId("run-42")
                .scope("suite:core")
                .timestamp(Instant.parse("2026-10-17T08:00:00Z"))
                .status(ExecutionStatus.COMPLETED)
                .summary(new ExecutionCounts(2, 1, 1, 0))
                .hasFailures(true)
                .generatedSpec("checks for orders:\n")
                .scanResults(objectMapper.valueToTree(Map.of("checks", List.of(Map.of("name", "a", "outcome", "pass")))))
                .scanLogs("scan finished")
                .build();

        // When
        StepVerifier.create(archive.archive(execution)).verifyComplete();

        // Then
        Path file = directory.resolve("execution_run-42.json");
        assertThat(file).isEqualTo(archive.pathFor("run-42")).exists();
        JsonNode json = objectMapper.readTree(Files.readString(file));
        assertThat(json.get("runId").asText()).isEqualTo("run-42");
        assertThat(json.get("status").asText()).isEqualTo("completed");
        assertThat(json.get("timestamp").asText()).isEqualTo("2026-10-17T08:00:00Z");
        assertThat(json.path("summary").get("failed").asInt()).isEqualTo(1);
        assertThat(json.path("scanResults").path("checks").get(0).get("outcome").asText()).isEqualTo("pass");
    }

    @Test
    void archive_shouldSignalErrorWhenDirectoryCannotBeCreated() throws Exception {
        // Given - a regular file where the directory should be
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");
        JsonFileExecutionArchive archive = new JsonFileExecutionArchive(blocker.resolve("executions"));

        // When & Then
        StepVerifier.create(archive.archive(ArchivedExecution.builder().runId("run-1").build()))
                .expectError(UncheckedIOException.class)
                .verify();
    }

    @Test
    void archive_shouldRejectRunIdsLeavingTheDirectory() throws Exception {
        // Given
        Path directory = tempDir.resolve("executions");
        Files.createDirectories(directory.resolve("execution_"));
        JsonFileExecutionArchive archive = new JsonFileExecutionArchive(directory);
        ArchivedExecution execution = ArchivedExecution.builder()
                .runId("/../../escaped")
                .status(ExecutionStatus.FAILED)
                .build();

        // When & Then
        StepVerifier.create(archive.archive(execution))
                .expectError(IllegalArgumentException.class)
                .verify();
        assertThat(tempDir.resolve("escaped.json")).doesNotExist();
        assertThatThrownBy(() -> archive.pathFor("a/b")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> archive.pathFor("..")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> archive.pathFor("a\\b")).isInstanceOf(IllegalArgumentException.class);
        assertThat(archive.pathFor("nightly-2026.10.17_1").getParent()).isEqualTo(directory);
    }
}
