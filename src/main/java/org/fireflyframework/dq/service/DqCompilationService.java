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

package org.fireflyframework.dq.service;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dq.compiler.CanonicalJson;
import org.fireflyframework.dq.compiler.CompilationReport;
import org.fireflyframework.dq.compiler.CompilationStrategy;
import org.fireflyframework.dq.compiler.RuleBindingCompiler;
import org.fireflyframework.dq.config.DqCompilerProperties;
import org.fireflyframework.dq.definition.CompiledRuleBinding;
import org.fireflyframework.dq.definition.EntityUri;
import org.fireflyframework.dq.definition.MetadataRegistryDefaults;
import org.fireflyframework.dq.definition.RuleBinding;
import org.fireflyframework.dq.event.DqCompilationEvent;
import org.fireflyframework.dq.exception.DqCompilationException;
import org.fireflyframework.dq.exception.DqConfigException;
import org.fireflyframework.dq.integration.DqSummaryExecutor;
import org.fireflyframework.dq.integration.HighWatermarkProvider;
import org.fireflyframework.dq.registry.ConfigKind;
import org.fireflyframework.dq.registry.ConfigRegistry;
import org.fireflyframework.dq.resiliency.CollaboratorResiliencyRegistry;
import org.fireflyframework.dq.resolve.EntityUriResolver;
import org.fireflyframework.dq.sql.RenderContext;
import org.fireflyframework.dq.sql.SqlGenerator;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs one data quality compilation invocation end to end.
 *
 * <p>Each invocation loads a fresh {@link ConfigRegistry}, resolves the entity
 * URIs of the selected rule bindings, compiles them, looks up the high
 * watermarks of incremental bindings and renders the per-binding and summary
 * SQL. A {@link DqCompilationEvent} is published after every invocation when an
 * {@link ApplicationEventPublisher} is available.</p>
 */
@Slf4j
public class DqCompilationService {

    private final Supplier<ConfigRegistry> registrySupplier;
    private final RuleBindingCompiler compiler;
    private final SqlGenerator sqlGenerator;
    private final EntityUriResolver entityUriResolver;
    private final HighWatermarkProvider highWatermarkProvider;
    private final DqSummaryExecutor summaryExecutor;
    private final CollaboratorResiliencyRegistry resiliencyRegistry;
    private final DqCompilerProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Creates the service.
     *
     * @param registrySupplier      loads a new registry for every invocation
     * @param compiler              the rule binding compiler
     * @param sqlGenerator          the SQL generator
     * @param entityUriResolver     resolves {@code entity_uri} bindings
     * @param highWatermarkProvider watermark lookup, or {@code null} to read it inside the generated SQL
     * @param summaryExecutor       summary execution, or {@code null} when only compiling
     * @param resiliencyRegistry    decorates collaborator calls
     * @param properties            the compiler properties
     * @param eventPublisher        the event publisher, or {@code null} to disable event publishing
     */
    public DqCompilationService(Supplier<ConfigRegistry> registrySupplier,
                                RuleBindingCompiler compiler,
                                SqlGenerator sqlGenerator,
                                EntityUriResolver entityUriResolver,
                                HighWatermarkProvider highWatermarkProvider,
                                DqSummaryExecutor summaryExecutor,
                                CollaboratorResiliencyRegistry resiliencyRegistry,
                                DqCompilerProperties properties,
                                ApplicationEventPublisher eventPublisher) {
        this.registrySupplier = registrySupplier;
        this.compiler = compiler;
        this.sqlGenerator = sqlGenerator;
        this.entityUriResolver = entityUriResolver;
        this.highWatermarkProvider = highWatermarkProvider;
        this.summaryExecutor = summaryExecutor;
        this.resiliencyRegistry = resiliencyRegistry;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Compiles the requested rule bindings into SQL.
     *
     * @param request the invocation request
     * @return the compilation result; errors with {@link DqCompilationException} when any
     *         binding failed, or with a {@link DqConfigException} when the configs cannot be loaded
     *         or a requested rule binding does not exist
     */
    public Mono<CompilationResult> compile(CompilationRequest request) {
        String invocationId = request.getInvocationId() != null
                ? request.getInvocationId()
                : UUID.randomUUID().toString();
        String environment = request.getEnvironment() != null
                ? request.getEnvironment()
                : properties.getEnvironment();

        return Mono.fromCallable(registrySupplier::get)
                .flatMap(registry -> {
                    List<RuleBinding> selected = selectBindings(registry, request.getRuleBindingIds());
                    log.info("Starting invocation '{}' for {} rule binding(s), environment={}",
                            invocationId, selected.size(), environment);
                    Map<String, DqConfigException> failures = new TreeMap<>();
                    return resolveEntityUris(registry, selected, failures)
                            .map(resolved -> compileBindings(registry, resolved, environment, failures))
                            .flatMap(compiled -> lookupHighWatermarks(compiled)
                                    .map(watermarks -> render(invocationId, environment, compiled, watermarks)));
                })
                .doOnNext(result -> {
                    log.info("Invocation '{}' compiled {} rule binding(s)",
                            invocationId, result.getCompiledBindings().size());
                    publishEvent(DqCompilationEvent.succeeded(result));
                })
                .doOnError(DqCompilationException.class, e -> {
                    log.error("Invocation '{}' failed: {}", invocationId, e.getMessage());
                    publishEvent(DqCompilationEvent.failed(invocationId, e));
                })
                .doOnError(DqConfigException.class, e -> {
                    log.error("Invocation '{}' failed before compilation: {}", invocationId, e.getMessage());
                    publishEvent(DqCompilationEvent.failed(invocationId, e));
                });
    }

    /**
     * Compiles the requested rule bindings and submits the summary query for execution.
     *
     * @param request the invocation request
     * @return the compilation result with the summary rows returned by the executor
     */
    public Mono<ExecutionResult> execute(CompilationRequest request) {
        if (summaryExecutor == null) {
            return Mono.error(new IllegalStateException("No DqSummaryExecutor is configured"));
        }
        return compile(request)
                .flatMap(result -> {
                    if (result.getSummarySql() == null) {
                        return Mono.just(ExecutionResult.builder()
                                .compilation(result)
                                .summaryRows(List.of())
                                .build());
                    }
                    log.info("Submitting summary query of invocation '{}'", result.getInvocationId());
                    Mono<List<Map<String, Object>>> summaryRows = Mono.defer(() ->
                            summaryExecutor.execute(result.getInvocationId(), result.getSummarySql()));
                    return resiliencyRegistry.decorate(CollaboratorResiliencyRegistry.SUMMARY_EXECUTOR, summaryRows)
                            .defaultIfEmpty(List.of())
                            .doOnNext(this::logSummaryRows)
                            .map(rows -> ExecutionResult.builder()
                                    .compilation(result)
                                    .summaryRows(rows)
                                    .build());
                });
    }

    /**
     * Lists the ids of every loaded rule binding.
     *
     * @return sorted rule binding ids
     */
    public Mono<List<String>> listRuleBindingIds() {
        return Mono.fromCallable(() -> registrySupplier.get().listIds(ConfigKind.RULE_BINDING));
    }

    private List<RuleBinding> selectBindings(ConfigRegistry registry, List<String> requestedIds) {
        List<String> ids = requestedIds == null || requestedIds.isEmpty()
                ? registry.listIds(ConfigKind.RULE_BINDING)
                : requestedIds.stream().distinct().sorted().toList();
        return ids.stream()
                .map(registry::getRuleBinding)
                .toList();
    }

    private Mono<List<RuleBinding>> resolveEntityUris(ConfigRegistry registry, List<RuleBinding> bindings,
                                                      Map<String, DqConfigException> failures) {
        MetadataRegistryDefaults defaults = properties.getMetadataDefaults().toMetadataRegistryDefaults()
                .mergedWith(registry.getMetadataDefaults());

        return Flux.fromIterable(bindings)
                .concatMap(binding -> {
                    if (binding.getEntityUri() == null || binding.getEntityId() != null) {
                        return Mono.just(binding);
                    }
                    return resolveEntityUri(registry, binding, defaults)
                            .onErrorResume(DqConfigException.class, e -> {
                                log.warn("Rule binding '{}' failed to resolve entity_uri '{}': {}",
                                        binding.getId(), binding.getEntityUri(), e.getMessage());
                                failures.put(binding.getId(), e);
                                return Mono.empty();
                            });
                })
                .collectList();
    }

    private Mono<RuleBinding> resolveEntityUri(ConfigRegistry registry, RuleBinding binding,
                                               MetadataRegistryDefaults defaults) {
        return Mono.fromCallable(() -> EntityUri.parse(binding.getEntityUri(), defaults))
                .flatMap(entityUri -> {
                    String entityId = entityUri.getDbPrimaryKey();
                    if (registry.contains(ConfigKind.ENTITY, entityId)) {
                        return Mono.just(binding.withEntityId(entityId));
                    }
                    return entityUriResolver.resolve(entityUri)
                            .map(entity -> {
                                registry.registerEntity(entity);
                                return binding.withEntityId(entity.getId());
                            });
                });
    }

    private List<CompiledRuleBinding> compileBindings(ConfigRegistry registry, List<RuleBinding> bindings,
                                                      String environment, Map<String, DqConfigException> failures) {
        CompilationStrategy strategy = properties.getStrategy();
        if (strategy == CompilationStrategy.FAIL_FAST && !failures.isEmpty()) {
            throw new DqCompilationException(failures);
        }
        CompilationReport report = compiler.compileAll(registry, bindings, environment, strategy);
        failures.putAll(report.getFailures());
        if (!failures.isEmpty()) {
            throw new DqCompilationException(failures);
        }
        return report.getCompiledBindings();
    }

    private Mono<Map<String, Instant>> lookupHighWatermarks(List<CompiledRuleBinding> compiled) {
        if (highWatermarkProvider == null) {
            return Mono.just(Map.of());
        }
        return Flux.fromIterable(compiled)
                .filter(CompiledRuleBinding::isIncremental)
                .concatMap(binding -> resiliencyRegistry.decorate(CollaboratorResiliencyRegistry.HIGH_WATERMARK,
                                Mono.defer(() -> highWatermarkProvider.findHighWatermark(
                                        binding.getRuleBindingId(), binding.getTableId(), binding.getColumnName())))
                        .doOnNext(watermark -> log.debug("High watermark of rule binding '{}' is {}",
                                binding.getRuleBindingId(), watermark))
                        .map(watermark -> Map.entry(binding.getRuleBindingId(), watermark)))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }

    private CompilationResult render(String invocationId, String environment, List<CompiledRuleBinding> compiled,
                                     Map<String, Instant> watermarks) {
        RenderContext context = RenderContext.builder()
                .invocationId(invocationId)
                .dqSummaryTable(properties.getDqSummaryTable())
                .progressWatermark(properties.isProgressWatermark())
                .highWatermarks(watermarks)
                .build();

        CompilationResult.CompilationResultBuilder result = CompilationResult.builder()
                .invocationId(invocationId)
                .environment(environment)
                .compiledBindings(compiled)
                .timestamp(Instant.now());
        for (CompiledRuleBinding binding : compiled) {
            result.ruleBindingSqlEntry(binding.getRuleBindingId(), sqlGenerator.renderRuleBinding(binding, context));
        }
        if (compiled.isEmpty()) {
            log.warn("Invocation '{}' selected no rule bindings, no summary query rendered", invocationId);
        } else {
            result.summarySql(sqlGenerator.renderSummary(compiled, context));
        }
        return result.build();
    }

    private void logSummaryRows(List<Map<String, Object>> rows) {
        if (!properties.isSummaryToLog()) {
            return;
        }
        for (Map<String, Object> row : rows) {
            log.info("{}", CanonicalJson.write(row));
        }
    }

    private void publishEvent(DqCompilationEvent event) {
        if (eventPublisher != null) {
            eventPublisher.publishEvent(event);
        }
    }
}
