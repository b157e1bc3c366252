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

package org.fireflyframework.dq.resiliency;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.bulkhead.operator.BulkheadOperator;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry that manages per-collaborator Resilience4j instances.
 *
 * <p>Each collaborator (table metadata lookup, watermark lookup, metadata
 * registry, summary execution) gets its own circuit breaker and bulkhead so a
 * failing warehouse endpoint cannot starve the others. Collaborators without
 * explicit configuration use the default configuration.</p>
 *
 * <p>Decoration is applied in order: bulkhead, circuit breaker, timeout. Calls
 * are never retried.</p>
 */
@Slf4j
public class CollaboratorResiliencyRegistry {

    public static final String TABLE_METADATA = "table-metadata";
    public static final String HIGH_WATERMARK = "high-watermark";
    public static final String METADATA_REGISTRY = "metadata-registry";
    public static final String SUMMARY_EXECUTOR = "summary-executor";

    private final CollaboratorResiliencyConfig defaultConfig;
    private final Map<String, CollaboratorResiliencyConfig> collaboratorConfigs;
    private final Map<String, CollaboratorResiliencyInstances> collaboratorInstances = new ConcurrentHashMap<>();

    public CollaboratorResiliencyRegistry(CollaboratorResiliencyConfig defaultConfig,
                                          Map<String, CollaboratorResiliencyConfig> collaboratorConfigs) {
        this.defaultConfig = defaultConfig;
        this.collaboratorConfigs = Map.copyOf(collaboratorConfigs);

        this.collaboratorConfigs.forEach((name, config) ->
                log.info("Registered resilience configuration for collaborator '{}': "
                                + "circuitBreaker={}, bulkhead={}, timeoutMs={}",
                        name, config.isCircuitBreakerEnabled(), config.isBulkheadEnabled(), config.getTimeoutMs()));
    }

    /**
     * Decorates a collaborator call with its resiliency patterns.
     *
     * @param collaboratorName the collaborator name
     * @param operation        the reactive call to decorate
     * @param <T>              the return type
     * @return the decorated call
     */
    public <T> Mono<T> decorate(String collaboratorName, Mono<T> operation) {
        CollaboratorResiliencyInstances instances =
                collaboratorInstances.computeIfAbsent(collaboratorName, this::createInstances);

        Mono<T> decorated = operation;
        if (instances.bulkhead() != null) {
            decorated = decorated.transformDeferred(BulkheadOperator.of(instances.bulkhead()));
        }
        if (instances.circuitBreaker() != null) {
            decorated = decorated.transformDeferred(CircuitBreakerOperator.of(instances.circuitBreaker()));
        }
        return decorated.timeout(Duration.ofMillis(instances.timeoutMs()));
    }

    public boolean hasCollaboratorConfig(String collaboratorName) {
        return collaboratorConfigs.containsKey(collaboratorName);
    }

    /**
     * Returns the circuit breaker guarding a collaborator, creating it if needed.
     *
     * @param collaboratorName the collaborator name
     * @return the circuit breaker, or {@code null} when disabled for it
     */
    public CircuitBreaker getCircuitBreaker(String collaboratorName) {
        return collaboratorInstances.computeIfAbsent(collaboratorName, this::createInstances).circuitBreaker();
    }

    private CollaboratorResiliencyInstances createInstances(String collaboratorName) {
        CollaboratorResiliencyConfig config = collaboratorConfigs.getOrDefault(collaboratorName, defaultConfig);
        if (!collaboratorConfigs.containsKey(collaboratorName)) {
            log.debug("No collaborator-specific config for '{}', using defaults", collaboratorName);
        }

        CircuitBreaker circuitBreaker = null;
        if (config.isCircuitBreakerEnabled()) {
            CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                    .failureRateThreshold(config.getCircuitBreakerFailureRateThreshold())
                    .slidingWindowSize(config.getCircuitBreakerSlidingWindowSize())
                    .waitDurationInOpenState(Duration.ofMillis(config.getCircuitBreakerWaitDurationInOpenStateMs()))
                    .build();
            circuitBreaker = CircuitBreaker.of(collaboratorName, cbConfig);
        }

        Bulkhead bulkhead = null;
        if (config.isBulkheadEnabled()) {
            BulkheadConfig bhConfig = BulkheadConfig.custom()
                    .maxConcurrentCalls(config.getBulkheadMaxConcurrentCalls())
                    .build();
            bulkhead = Bulkhead.of(collaboratorName, bhConfig);
        }

        return new CollaboratorResiliencyInstances(circuitBreaker, bulkhead, config.getTimeoutMs());
    }

    private record CollaboratorResiliencyInstances(
            CircuitBreaker circuitBreaker,
            Bulkhead bulkhead,
            long timeoutMs
    ) {}
}
