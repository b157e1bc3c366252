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
import org.fireflyframework.dq.definition.CompiledRuleBinding;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Output of a successful compilation invocation.
 */
@Data
@Builder
public class CompilationResult {

    private final String invocationId;
    private final String environment;

    @Singular
    private final List<CompiledRuleBinding> compiledBindings;

    /**
     * Validation query of every compiled binding, keyed by rule binding id in id order.
     */
    @Singular("ruleBindingSqlEntry")
    private final Map<String, String> ruleBindingSql;

    /**
     * UNION ALL summary query over all compiled bindings, {@code null} when no
     * rule binding was selected.
     */
    private final String summarySql;

    private final Instant timestamp;
}
