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

package org.fireflyframework.dq.event;

import lombok.Data;
import org.fireflyframework.dq.definition.CompiledRuleBinding;
import org.fireflyframework.dq.exception.DqCompilationException;
import org.fireflyframework.dq.exception.DqConfigException;
import org.fireflyframework.dq.service.CompilationResult;

import java.time.Instant;
import java.util.List;

/**
 * Event published by the {@link org.fireflyframework.dq.service.DqCompilationService}
 * after every compilation invocation, successful or not.
 */
@Data
public class DqCompilationEvent {

    private final String invocationId;
    private final boolean successful;
    private final List<String> compiledRuleBindingIds;
    private final List<String> errors;
    private final Instant timestamp;

    private DqCompilationEvent(String invocationId, boolean successful, List<String> compiledRuleBindingIds,
                               List<String> errors) {
        this.invocationId = invocationId;
        this.successful = successful;
        this.compiledRuleBindingIds = compiledRuleBindingIds;
        this.errors = errors;
        this.timestamp = Instant.now();
    }

    public static DqCompilationEvent succeeded(CompilationResult result) {
        List<String> ids = result.getCompiledBindings().stream()
                .map(CompiledRuleBinding::getRuleBindingId)
                .toList();
        return new DqCompilationEvent(result.getInvocationId(), true, ids, List.of());
    }

    public static DqCompilationEvent failed(String invocationId, DqCompilationException failure) {
        return new DqCompilationEvent(invocationId, false, List.of(), failure.getErrors());
    }

    public static DqCompilationEvent failed(String invocationId, DqConfigException failure) {
        return new DqCompilationEvent(invocationId, false, List.of(),
                List.of(failure.getErrorType() + ": " + failure.getMessage()));
    }
}
