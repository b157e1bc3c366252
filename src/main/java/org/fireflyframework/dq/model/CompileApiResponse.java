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

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for the compile endpoint.
 */
@Data
@Builder
@Schema(description = "Result of compiling data quality rule bindings")
public class CompileApiResponse {

    @Schema(description = "Invocation ID embedded in the summary rows")
    private final String invocationId;

    @Schema(description = "Environment the entities were resolved for", example = "test")
    private final String environment;

    @Schema(description = "Compiled rule bindings in rule binding ID order")
    private final List<CompiledBindingSummary> ruleBindings;

    @Schema(description = "UNION ALL summary query over all compiled rule bindings")
    private final String summarySql;

    @Schema(description = "When the compilation finished")
    private final Instant timestamp;
}
