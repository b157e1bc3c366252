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
import lombok.Singular;

import java.util.List;
import java.util.Map;

/**
 * Self-contained, immutable result of compiling one {@link RuleBinding}.
 *
 * <p>Everything the SQL generator needs is flattened into this record: the
 * environment-resolved entity, the validated column, the row filter expression,
 * each rule's concrete SQL, the binding metadata and the content hash
 * ({@code configsHashsum}) computed over those semantic fields.</p>
 */
@Data
@Builder(toBuilder = true)
public class CompiledRuleBinding {

    private final String ruleBindingId;
    private final Entity entity;
    private final String columnId;
    private final String columnName;
    private final String rowFilterId;
    private final String rowFilterSql;

    @Singular
    private final List<CompiledRule> rules;

    @Singular("metadataEntry")
    private final Map<String, Object> metadata;

    private final String incrementalTimeFilterColumnId;
    private final String incrementalTimeFilterColumnName;
    private final String environment;
    private final String configsHashsum;

    public String getTableId() {
        return entity.getTableId();
    }

    public boolean isIncremental() {
        return incrementalTimeFilterColumnName != null;
    }
}
