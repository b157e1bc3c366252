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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Raised when one or more rule bindings of an invocation failed to compile.
 *
 * <p>Holds the failure of every binding that was attempted, keyed by rule binding ID.</p>
 */
public class DqCompilationException extends RuntimeException {

    private final Map<String, DqConfigException> failures;

    public DqCompilationException(Map<String, DqConfigException> failures) {
        super(buildMessage(failures));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public Map<String, DqConfigException> getFailures() {
        return failures;
    }

    /**
     * Returns one human-readable line per failed binding.
     *
     * @return error lines in failure order
     */
    public List<String> getErrors() {
        return failures.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue().getMessage())
                .toList();
    }

    private static String buildMessage(Map<String, DqConfigException> failures) {
        return failures.size() + " rule binding(s) failed to compile: "
                + failures.entrySet().stream()
                .map(entry -> entry.getKey() + " (" + entry.getValue().getErrorType() + ")")
                .collect(Collectors.joining(", "));
    }
}
