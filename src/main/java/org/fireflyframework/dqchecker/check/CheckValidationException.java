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

package org.fireflyframework.dqchecker.check;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a caller demands a valid check and validation found violations.
 */
public class CheckValidationException extends RuntimeException {

    private final Long checkId;
    private final List<ValidationError> errors;

    public CheckValidationException(Long checkId, List<ValidationError> errors) {
        super("Check " + checkId + " failed validation: "
                + errors.stream().map(ValidationError::toString).collect(Collectors.joining("; ")));
        this.checkId = checkId;
        this.errors = List.copyOf(errors);
    }

    public Long getCheckId() {
        return checkId;
    }

    public List<ValidationError> getErrors() {
        return errors;
    }
}
