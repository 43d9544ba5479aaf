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
import java.util.Optional;

/**
 * Outcome of validating one {@link Check}: either a {@link ValidCheck} or the full
 * list of violations.
 */
public final class CheckValidation {

    private final Check check;
    private final ValidCheck validCheck;
    private final List<ValidationError> errors;

    private CheckValidation(Check check, ValidCheck validCheck, List<ValidationError> errors) {
        this.check = check;
        this.validCheck = validCheck;
        this.errors = errors;
    }

    static CheckValidation valid(Check check) {
        return new CheckValidation(check, new ValidCheck(check), List.of());
    }

    static CheckValidation invalid(Check check, List<ValidationError> errors) {
        return new CheckValidation(check, null, List.copyOf(errors));
    }

    public boolean isValid() {
        return validCheck != null;
    }

    public Check getCheck() {
        return check;
    }

    public Optional<ValidCheck> getValidCheck() {
        return Optional.ofNullable(validCheck);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    /**
     * Returns the valid check or throws with every collected violation.
     *
     * @return the valid check
     * @throws CheckValidationException if the check is invalid
     */
    public ValidCheck orElseThrow() {
        if (validCheck == null) {
            throw new CheckValidationException(check.getId(), errors);
        }
        return validCheck;
    }
}
