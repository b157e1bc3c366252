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

package org.fireflyframework.dq.compiler;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dq.definition.Column;
import org.fireflyframework.dq.definition.CompiledRule;
import org.fireflyframework.dq.definition.CompiledRuleBinding;
import org.fireflyframework.dq.definition.Entity;
import org.fireflyframework.dq.definition.Rule;
import org.fireflyframework.dq.definition.RuleBinding;
import org.fireflyframework.dq.definition.RuleReference;
import org.fireflyframework.dq.exception.ColumnNotInEntityException;
import org.fireflyframework.dq.exception.DqConfigException;
import org.fireflyframework.dq.exception.InvalidDefinitionException;
import org.fireflyframework.dq.registry.ConfigKind;
import org.fireflyframework.dq.registry.ConfigRegistry;
import org.fireflyframework.dq.resolve.EntityResolver;
import org.fireflyframework.dq.resolve.RowFilterResolver;
import org.fireflyframework.dq.rules.RuleTemplateEngine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles rule bindings into self-contained {@link CompiledRuleBinding}s.
 *
 * <p>Compiling a binding resolves its entity for the target environment, its
 * validated column, its row filter and every bound rule, then computes the
 * content hash of the result. Compilation of one binding is all-or-nothing;
 * a batch collects failures per binding according to its
 * {@link CompilationStrategy}.</p>
 */
@Slf4j
public class RuleBindingCompiler {

    private final EntityResolver entityResolver;
    private final RowFilterResolver rowFilterResolver;
    private final RuleTemplateEngine ruleTemplateEngine;
    private final ConfigsHasher configsHasher;

    public RuleBindingCompiler() {
        this(new EntityResolver(), new RowFilterResolver(), new RuleTemplateEngine(), new ConfigsHasher());
    }

    public RuleBindingCompiler(EntityResolver entityResolver,
                               RowFilterResolver rowFilterResolver,
                               RuleTemplateEngine ruleTemplateEngine,
                               ConfigsHasher configsHasher) {
        this.entityResolver = entityResolver;
        this.rowFilterResolver = rowFilterResolver;
        this.ruleTemplateEngine = ruleTemplateEngine;
        this.configsHasher = configsHasher;
    }

    /**
     * Compiles one rule binding.
     *
     * @param registry    the registry of the current invocation
     * @param binding     the binding; an {@code entity_uri} binding must already point at its resolved entity
     * @param environment the target environment, may be {@code null}
     * @return the compiled binding with its content hash
     * @throws DqConfigException if any reference of the binding cannot be resolved
     */
    public CompiledRuleBinding compile(ConfigRegistry registry, RuleBinding binding, String environment) {
        String bindingId = binding.getId();
        if (binding.getEntityId() == null) {
            throw new InvalidDefinitionException(ConfigKind.RULE_BINDING, bindingId,
                    "entity_uri '" + binding.getEntityUri() + "' has not been resolved to an entity.");
        }

        Entity entity = entityResolver.resolve(registry, binding.getEntityId(), environment);
        Column column = requireColumn(bindingId, entity, binding.getColumnId());
        String rowFilterSql = rowFilterResolver.resolve(registry, binding.getRowFilterId());
        Column timeFilterColumn = resolveTimeFilterColumn(binding, entity);

        List<CompiledRule> rules = new ArrayList<>();
        for (RuleReference reference : binding.getRuleReferences()) {
            Rule rule = registry.getRule(reference.getRuleId());
            rules.add(ruleTemplateEngine.render(rule, column.getName(), reference.getArguments(), bindingId));
        }

        CompiledRuleBinding compiled = CompiledRuleBinding.builder()
                .ruleBindingId(bindingId)
                .entity(entity)
                .columnId(column.getId())
                .columnName(column.getName())
                .rowFilterId(binding.getRowFilterId())
                .rowFilterSql(rowFilterSql)
                .rules(rules)
                .metadata(binding.getMetadata())
                .incrementalTimeFilterColumnId(timeFilterColumn != null ? timeFilterColumn.getId() : null)
                .incrementalTimeFilterColumnName(timeFilterColumn != null ? timeFilterColumn.getName() : null)
                .environment(environment)
                .build();

        String hashsum = configsHasher.hash(compiled);
        log.debug("Compiled rule binding '{}' against table '{}' with {} rule(s), configs_hashsum={}",
                bindingId, entity.getTableId(), rules.size(), hashsum);
        return compiled.toBuilder().configsHashsum(hashsum).build();
    }

    /**
     * Compiles a batch of rule bindings in rule binding id order.
     *
     * @param registry    the registry of the current invocation
     * @param bindings    the bindings to compile
     * @param environment the target environment, may be {@code null}
     * @param strategy    whether to stop at the first failure
     * @return the compiled bindings and the failures keyed by rule binding id
     */
    public CompilationReport compileAll(ConfigRegistry registry, List<RuleBinding> bindings, String environment,
                                        CompilationStrategy strategy) {
        List<CompiledRuleBinding> compiled = new ArrayList<>();
        Map<String, DqConfigException> failures = new LinkedHashMap<>();

        List<RuleBinding> ordered = bindings.stream()
                .sorted(Comparator.comparing(RuleBinding::getId))
                .toList();
        for (RuleBinding binding : ordered) {
            try {
                compiled.add(compile(registry, binding, environment));
            } catch (DqConfigException e) {
                log.warn("Rule binding '{}' failed to compile: {}", binding.getId(), e.getMessage());
                failures.put(binding.getId(), e);
                if (strategy == CompilationStrategy.FAIL_FAST) {
                    break;
                }
            }
        }

        return CompilationReport.builder()
                .compiledBindings(List.copyOf(compiled))
                .failures(failures)
                .strategy(strategy)
                .build();
    }

    private Column resolveTimeFilterColumn(RuleBinding binding, Entity entity) {
        String columnId = binding.getIncrementalTimeFilterColumnId();
        if (columnId == null && binding.isIncremental()) {
            columnId = entity.getIncrementalTimeFilterColumnId();
            if (columnId == null) {
                throw new InvalidDefinitionException(ConfigKind.RULE_BINDING, binding.getId(),
                        "is incremental but neither the rule binding nor entity '" + entity.getId()
                                + "' defines 'incremental_time_filter_column_id'.");
            }
        }
        return columnId != null ? requireColumn(binding.getId(), entity, columnId) : null;
    }

    private static Column requireColumn(String bindingId, Entity entity, String columnId) {
        return entity.findColumn(columnId)
                .orElseThrow(() -> new ColumnNotInEntityException(bindingId, entity.getId(), columnId));
    }
}
