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

package org.fireflyframework.dq.sql;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.time.Instant;
import java.util.Map;

/**
 * Per-invocation inputs of SQL rendering that are not part of any compiled binding.
 */
@Data
@Builder
public class RenderContext {

    private final String invocationId;

    /**
     * Fully-qualified summary table read for high watermarks, {@code null} when
     * only {@link #highWatermarks} or the epoch are used.
     */
    private final String dqSummaryTable;

    @Builder.Default
    private final boolean progressWatermark = true;

    /**
     * High watermarks already looked up, keyed by rule binding id.
     */
    @Singular
    private final Map<String, Instant> highWatermarks;
}
