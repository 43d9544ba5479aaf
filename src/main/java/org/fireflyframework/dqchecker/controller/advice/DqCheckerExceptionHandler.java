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

package org.fireflyframework.dqchecker.controller.advice;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dqchecker.check.CheckValidationException;
import org.fireflyframework.dqchecker.compiler.SpecCompilationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for DQ checker controllers.
 *
 * <p>Translates check and compilation errors into HTTP responses carrying the
 * itemised problems.</p>
 */
@Slf4j
@RestControllerAdvice(basePackages = "org.fireflyframework.dqchecker.controller")
public class DqCheckerExceptionHandler {

    @ExceptionHandler(CheckValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(CheckValidationException ex) {
        log.warn("Check validation failed: {}", ex.getMessage());
        List<String> errors = ex.getErrors().stream().map(Object::toString).toList();
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", ex.getMessage(), errors);
    }

    @ExceptionHandler(SpecCompilationException.class)
    public ResponseEntity<Map<String, Object>> handleCompilationException(SpecCompilationException ex) {
        log.error("Spec compilation failed for check {}: {}", ex.getCheckId(), ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "Compilation Failed", ex.getMessage(), List.of());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid DQ checker request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage(), List.of());
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String error,
                                                               String message, List<String> errors) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        body.put("errors", errors);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
