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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for the compile endpoint.
 *
 * <p><b>Example Request:</b></p>
 * <pre>{@code
 * {
 *   "ruleBindingIds": ["T1_DQ_1_VALUE_NOT_NULL", "T2_DQ_1_EMAIL"],
 *   "environment": "test"
 * }
 * }</pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Rule bindings to compile and the target environment")
public class CompileApiRequest {

    @Schema(description = "Rule binding IDs to compile; empty compiles all", example = "[\"T1_DQ_1_VALUE_NOT_NULL\"]")
    private List<String> ruleBindingIds;

    @Schema(description = "Target environment for entity overrides", example = "test")
    private String environment;

    @Schema(description = "Invocation ID embedded in the summary rows; generated when absent",
            example = "0f6a4f8e-2b39-4c7e-9d1a-5c2f3b8e7a10")
    private String invocationId;
}
