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

package org.fireflyframework.dq.service;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;

/**
 * Input of one compilation invocation.
 *
 * <p>An empty {@code ruleBindingIds} list selects every loaded rule binding. A
 * {@code null} environment falls back to the configured default environment, a
 * {@code null} invocation id to a random UUID.</p>
 */
@Data
@Builder
public class CompilationRequest {

    @Singular
    private final List<String> ruleBindingIds;

    private final String environment;
    private final String invocationId;

    public static CompilationRequest all() {
        return CompilationRequest.builder().build();
    }
}
