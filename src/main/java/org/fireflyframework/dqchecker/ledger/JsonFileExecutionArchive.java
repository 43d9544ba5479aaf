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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Writes each finished attempt to {@code execution_<runId>.json} in a directory.
 */
@Slf4j
public class JsonFileExecutionArchive implements ExecutionArchive {

    private static final Pattern SAFE_RUN_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonFileExecutionArchive(Path directory) {
        this.directory = directory;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Mono<Void> archive(ArchivedExecution execution) {
        return Mono.fromCallable(() -> write(execution))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(path -> log.info("Archived attempt {} to {}", execution.getRunId(), path))
                .then();
    }

    /**
     * Resolves the archive file of a run.
     *
     * @param runId the run id; letters, digits, {@code .}, {@code _} and {@code -} only
     * @return the file inside the archive directory
     * @throws IllegalArgumentException if the run id could leave the archive directory
     */
    public Path pathFor(String runId) {
        if (runId == null || !SAFE_RUN_ID.matcher(runId).matches() || runId.contains("..")) {
            throw new IllegalArgumentException("Run id cannot be used as an archive file name: " + runId);
        }
        return directory.resolve("execution_" + runId + ".json");
    }

    private Path write(ArchivedExecution execution) {
        Path target = pathFor(execution.getRunId());
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(target.toFile(), execution);
            return target;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to archive attempt " + execution.getRunId() + " to " + target, e);
        }
    }
}
