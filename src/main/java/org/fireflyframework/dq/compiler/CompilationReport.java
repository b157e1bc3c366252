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

package org.fireflyframework.dq.compiler;

import lombok.Builder;
import lombok.Data;
import org.fireflyframework.dq.definition.CompiledRuleBinding;
import org.fireflyframework.dq.exception.DqCompilationException;
import org.fireflyframework.dq.exception.DqConfigException;

import java.util.List;
import java.util.Map;

/**
 * Outcome of compiling a batch of rule bindings with {@link RuleBindingCompiler#compileAll}.
 */
@Data
@Builder
public class CompilationReport {

    private final List<CompiledRuleBinding> compiledBindings;
    private final Map<String, DqConfigException> failures;
    private final CompilationStrategy strategy;

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    /**
     * Returns the compiled bindings when every binding compiled.
     *
     * @return compiled bindings sorted by rule binding id
     * @throws DqCompilationException if any binding failed
     */
    public List<CompiledRuleBinding> orThrow() {
        if (!failures.isEmpty()) {
            throw new DqCompilationException(failures);
        }
        return compiledBindings;
    }
}
