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

package org.fireflyframework.dq.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * One compiled rule binding as returned by the compile endpoint.
 */
@Data
@Builder
@Schema(description = "A compiled rule binding with its content hash and validation SQL")
public class CompiledBindingSummary {

    @Schema(description = "Rule binding ID", example = "T1_DQ_1_VALUE_NOT_NULL")
    private final String ruleBindingId;

    @Schema(description = "Fully-qualified validated table", example = "my-project.dq_test.contact_details")
    private final String tableId;

    @Schema(description = "Validated column ID", example = "VALUE")
    private final String columnId;

    @Schema(description = "Row filter ID", example = "NONE")
    private final String rowFilterId;

    @Schema(description = "Bound rule IDs in binding order", example = "[\"NOT_NULL_SIMPLE\"]")
    private final List<String> ruleIds;

    @Schema(description = "Whether validation is restricted to rows newer than the high watermark", example = "false")
    private final boolean incremental;

    @Schema(description = "SHA-256 content hash of the compiled binding")
    private final String configsHashsum;

    @Schema(description = "Validation query of the rule binding")
    private final String sql;
}
