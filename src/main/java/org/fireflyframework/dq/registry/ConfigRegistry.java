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

package org.fireflyframework.dq.registry;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dq.definition.Column;
import org.fireflyframework.dq.definition.Entity;
import org.fireflyframework.dq.definition.EnvironmentOverride;
import org.fireflyframework.dq.definition.MetadataRegistryDefaults;
import org.fireflyframework.dq.definition.RowFilter;
import org.fireflyframework.dq.definition.Rule;
import org.fireflyframework.dq.definition.RuleBinding;
import org.fireflyframework.dq.exception.ConflictingDefinitionException;
import org.fireflyframework.dq.exception.DuplicateIdentifierException;
import org.fireflyframework.dq.exception.UnknownEntityException;
import org.fireflyframework.dq.exception.UnknownRowFilterException;
import org.fireflyframework.dq.exception.UnresolvedReferenceException;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Registry of every definition loaded for one compilation pass.
 *
 * <p>A registry is built once per invocation and passed explicitly to every
 * resolver; it is never shared between invocations. Identifiers are
 * case-sensitive and unique per {@link ConfigKind}.</p>
 *
 * <p>Registering an identifier twice fails with
 * {@link DuplicateIdentifierException} when both definitions are equal and with
 * {@link ConflictingDefinitionException} when they differ.</p>
 */
@Slf4j
public class ConfigRegistry {

    private final Map<ConfigKind, Map<String, Object>> definitions = new EnumMap<>(ConfigKind.class);
    private MetadataRegistryDefaults metadataDefaults = MetadataRegistryDefaults.empty();

    public ConfigRegistry() {
        for (ConfigKind kind : ConfigKind.values()) {
            definitions.put(kind, new LinkedHashMap<>());
        }
    }

    /**
     * Registers a definition.
     *
     * @param kind       the definition kind
     * @param identifier the identifier, unique within {@code kind}
     * @param definition the parsed definition
     */
    public void register(ConfigKind kind, String identifier, Object definition) {
        Map<String, Object> byId = definitions.get(kind);
        Object existing = byId.get(identifier);
        if (existing != null) {
            if (existing.equals(definition)) {
                throw new DuplicateIdentifierException(kind, identifier);
            }
            throw new ConflictingDefinitionException(kind, identifier);
        }
        byId.put(identifier, definition);
        log.debug("Registered {} '{}'", kind.getDisplayName(), identifier);
    }

    /**
     * Resolves a definition by identifier.
     *
     * @param kind       the definition kind
     * @param identifier the identifier
     * @param type       the expected definition type
     * @param <T>        the definition type
     * @return the definition
     * @throws UnresolvedReferenceException if nothing is registered under the identifier
     */
    public <T> T resolve(ConfigKind kind, String identifier, Class<T> type) {
        Object definition = definitions.get(kind).get(identifier);
        if (definition == null) {
            throw new UnresolvedReferenceException(kind, identifier);
        }
        return type.cast(definition);
    }

    public boolean contains(ConfigKind kind, String identifier) {
        return definitions.get(kind).containsKey(identifier);
    }

    /**
     * Returns the identifiers registered for a kind, sorted.
     *
     * @param kind the definition kind
     * @return sorted identifiers
     */
    public List<String> listIds(ConfigKind kind) {
        return definitions.get(kind).keySet().stream().sorted().toList();
    }

    public void registerEntity(Entity entity) {
        register(ConfigKind.ENTITY, entity.getId(), entity);
        for (Column column : entity.getColumns().values()) {
            register(ConfigKind.COLUMN, columnKey(entity.getId(), column.getId()), column);
        }
    }

    public void registerRowFilter(RowFilter rowFilter) {
        register(ConfigKind.ROW_FILTER, rowFilter.getId(), rowFilter);
    }

    public void registerRule(Rule rule) {
        register(ConfigKind.RULE, rule.getId(), rule);
    }

    public void registerRuleBinding(RuleBinding ruleBinding) {
        register(ConfigKind.RULE_BINDING, ruleBinding.getId(), ruleBinding);
    }

    public Entity getEntity(String entityId) {
        Object entity = definitions.get(ConfigKind.ENTITY).get(entityId);
        if (entity == null) {
            throw new UnknownEntityException(entityId);
        }
        return (Entity) entity;
    }

    public RowFilter getRowFilter(String rowFilterId) {
        Object rowFilter = definitions.get(ConfigKind.ROW_FILTER).get(rowFilterId);
        if (rowFilter == null) {
            throw new UnknownRowFilterException(rowFilterId);
        }
        return (RowFilter) rowFilter;
    }

    public Rule getRule(String ruleId) {
        return resolve(ConfigKind.RULE, ruleId, Rule.class);
    }

    public RuleBinding getRuleBinding(String ruleBindingId) {
        return resolve(ConfigKind.RULE_BINDING, ruleBindingId, RuleBinding.class);
    }

    public MetadataRegistryDefaults getMetadataDefaults() {
        return metadataDefaults;
    }

    public void setMetadataDefaults(MetadataRegistryDefaults metadataDefaults) {
        this.metadataDefaults = metadataDefaults != null ? metadataDefaults : MetadataRegistryDefaults.empty();
    }

    /**
     * Returns every environment name declared by any entity override, lower-cased.
     *
     * @return the known environment names
     */
    public Set<String> knownEnvironments() {
        return definitions.get(ConfigKind.ENTITY).values().stream()
                .map(Entity.class::cast)
                .flatMap(entity -> entity.getEnvironmentOverrides().stream())
                .map(EnvironmentOverride::getEnvironment)
                .map(environment -> environment.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(TreeSet::new));
    }

    static String columnKey(String entityId, String columnId) {
        return entityId + "." + columnId;
    }
}
