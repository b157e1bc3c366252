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

package org.fireflyframework.dq.integration;

import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Reads the latest recorded execution timestamp of a rule binding from previous
 * summary results.
 *
 * <p>When no provider is configured, incremental bindings read the watermark
 * inside the generated SQL from the configured summary table instead.</p>
 */
public interface HighWatermarkProvider {

    /**
     * Finds the high watermark of a rule binding.
     *
     * @param ruleBindingId the rule binding id
     * @param tableId       the validated table id
     * @param columnId      the validated column id
     * @return the max execution timestamp of rows flagged as progress watermark,
     *         or an empty Mono when the binding has never run
     */
    Mono<Instant> findHighWatermark(String ruleBindingId, String tableId, String columnId);
}
