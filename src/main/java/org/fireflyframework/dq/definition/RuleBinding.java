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
 * Combines one entity column and one row filter with the rules to run against them.
 *
 * <p>The entity is addressed either by {@code entityId} or by {@code entityUri};
 * once a URI has been resolved the binding is rebuilt with {@link #withEntityId(String)}.</p>
 */
@Data
@Builder(toBuilder = true)
public class RuleBinding {

    private final String id;
    private final String entityId;
    private final String entityUri;
    private final String columnId;
    private final String rowFilterId;

    @Singular
    private final List<RuleReference> ruleReferences;

    @Singular("metadataEntry")
    private final Map<String, Object> metadata;

    private final String incrementalTimeFilterColumnId;
    private final boolean incremental;

    public RuleBinding withEntityId(String resolvedEntityId) {
        return toBuilder().entityId(resolvedEntityId).build();
    }
}
