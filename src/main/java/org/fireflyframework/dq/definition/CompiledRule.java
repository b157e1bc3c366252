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

package org.fireflyframework.dq.definition;

import lombok.Builder;
import lombok.Data;

/**
 * A rule rendered for one rule binding: the concrete SQL expression or statement
 * with every placeholder substituted.
 */
@Data
@Builder
public class CompiledRule {

    private final String ruleId;
    private final RuleType ruleType;
    private final String dimension;
    private final String sql;

    public boolean isComplex() {
        return ruleType.isComplex();
    }
}
