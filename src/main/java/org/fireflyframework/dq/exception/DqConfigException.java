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

package org.fireflyframework.dq.exception;

import java.util.List;

/**
 * Base type for all configuration and compilation failures.
 *
 * <p>Every instance carries its {@link DqErrorType} and the identifiers that
 * caused it, so callers can report diagnostics without parsing messages.</p>
 */
public class DqConfigException extends RuntimeException {

    private final DqErrorType errorType;
    private final List<String> identifiers;

    public DqConfigException(DqErrorType errorType, String message, String... identifiers) {
        super(message);
        this.errorType = errorType;
        this.identifiers = List.of(identifiers);
    }

    public DqConfigException(DqErrorType errorType, String message, Throwable cause, String... identifiers) {
        super(message, cause);
        this.errorType = errorType;
        this.identifiers = List.of(identifiers);
    }

    public DqErrorType getErrorType() {
        return errorType;
    }

    /**
     * Returns the identifiers involved in the failure, most specific last.
     *
     * @return immutable list of identifiers
     */
    public List<String> getIdentifiers() {
        return identifiers;
    }
}
