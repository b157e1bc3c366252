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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fireflyframework.dq.definition.Column;
import org.fireflyframework.dq.definition.ColumnDataType;
import org.fireflyframework.dq.definition.Entity;
import org.fireflyframework.dq.definition.EnvironmentOverride;
import org.fireflyframework.dq.definition.MetadataRegistryDefaults;
import org.fireflyframework.dq.definition.RowFilter;
import org.fireflyframework.dq.definition.Rule;
import org.fireflyframework.dq.definition.RuleBinding;
import org.fireflyframework.dq.definition.RuleReference;
import org.fireflyframework.dq.definition.RuleType;
import org.fireflyframework.dq.definition.SourceDatabase;
import org.fireflyframework.dq.exception.InvalidDefinitionException;
import org.fireflyframework.dq.exception.UnknownRuleTypeException;
import org.fireflyframework.dq.rules.PlaceholderTemplate;

import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns the YAML tree of a single definition into its typed model.
 *
 * <p>Every structural problem is reported as an {@link InvalidDefinitionException}
 * naming the offending definition; unsupported rule types are reported as
 * {@link UnknownRuleTypeException}.</p>
 */
public class DefinitionParser {

    private static final List<String> FORBIDDEN_SQL_TOKENS = List.of(";", "--", "/*");

    private final ObjectMapper objectMapper;

    public DefinitionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Entity parseEntity(String entityId, JsonNode node) {
        requireObject(ConfigKind.ENTITY, entityId, node);

        String sourceName = requireText(ConfigKind.ENTITY, entityId, node, "source_database");
        SourceDatabase sourceDatabase = SourceDatabase.from(sourceName)
                .orElseThrow(() -> new InvalidDefinitionException(ConfigKind.ENTITY, entityId,
                        "unsupported source_database '" + sourceName + "'"));

        Entity.EntityBuilder builder = Entity.builder()
                .id(entityId)
                .sourceDatabase(sourceDatabase)
                .tableName(requireText(ConfigKind.ENTITY, entityId, node, "table_name"))
                .databaseName(requireOneOf(entityId, node, "dataset_name", "database_name"))
                .instanceName(requireOneOf(entityId, node, "project_name", "instance_name"))
                .incrementalTimeFilterColumnId(optionalText(node, "incremental_time_filter_column_id"))
                .dataplexLake(optionalText(node, "lake_name"))
                .dataplexZone(optionalText(node, "zone_name"))
                .dataplexAssetId(optionalText(node, "asset_name"));

        JsonNode columns = node.get("columns");
        if (columns == null || !columns.isObject() || columns.isEmpty()) {
            throw new InvalidDefinitionException(ConfigKind.ENTITY, entityId, "must define non-empty value: 'columns'.");
        }
        Iterator<Map.Entry<String, JsonNode>> columnFields = columns.fields();
        while (columnFields.hasNext()) {
            Map.Entry<String, JsonNode> field = columnFields.next();
            builder.column(field.getKey(), parseColumn(entityId, field.getKey(), field.getValue()));
        }

        JsonNode overrides = node.get("environment_override");
        if (overrides != null && !overrides.isNull()) {
            requireObject(ConfigKind.ENTITY, entityId, overrides);
            Iterator<Map.Entry<String, JsonNode>> overrideFields = overrides.fields();
            while (overrideFields.hasNext()) {
                Map.Entry<String, JsonNode> field = overrideFields.next();
                builder.environmentOverride(parseEnvironmentOverride(entityId, field.getKey(), field.getValue()));
            }
        }
        return builder.build();
    }

    public RowFilter parseRowFilter(String rowFilterId, JsonNode node) {
        requireObject(ConfigKind.ROW_FILTER, rowFilterId, node);
        return RowFilter.builder()
                .id(rowFilterId)
                .filterSqlExpr(requireText(ConfigKind.ROW_FILTER, rowFilterId, node, "filter_sql_expr"))
                .build();
    }

    /**
     * Parses a rule and validates its parameters against its rule type.
     *
     * @param ruleId          the rule identifier
     * @param node            the rule YAML tree
     * @param ruleDimensions  allowed dimensions, empty to allow any
     * @return the parsed rule
     */
    public Rule parseRule(String ruleId, JsonNode node, Set<String> ruleDimensions) {
        requireObject(ConfigKind.RULE, ruleId, node);

        String ruleTypeName = requireText(ConfigKind.RULE, ruleId, node, "rule_type");
        RuleType ruleType = RuleType.from(ruleTypeName)
                .orElseThrow(() -> new UnknownRuleTypeException(ruleId, ruleTypeName));

        String dimension = optionalText(node, "dimension");
        if (dimension != null && !ruleDimensions.isEmpty()
                && !ruleDimensions.contains(dimension.toLowerCase(Locale.ROOT))) {
            throw new InvalidDefinitionException(ConfigKind.RULE, ruleId,
                    "dimension '" + dimension + "' is not one of rule_dimensions " + ruleDimensions);
        }

        Rule.RuleBuilder builder = Rule.builder()
                .id(ruleId)
                .ruleType(ruleType)
                .dimension(dimension);

        JsonNode params = node.get("params");
        if (params != null && !params.isNull()) {
            requireObject(ConfigKind.RULE, ruleId, params);
            Iterator<Map.Entry<String, JsonNode>> paramFields = params.fields();
            while (paramFields.hasNext()) {
                Map.Entry<String, JsonNode> field = paramFields.next();
                if (Rule.PARAM_CUSTOM_SQL_ARGUMENTS.equals(field.getKey())) {
                    builder.customSqlArguments(parseArgumentNames(ruleId, field.getValue()));
                } else if (field.getValue().isValueNode() && !field.getValue().isNull()) {
                    builder.param(field.getKey(), field.getValue().asText());
                } else {
                    throw new InvalidDefinitionException(ConfigKind.RULE, ruleId,
                            "parameter '" + field.getKey() + "' must be a scalar value");
                }
            }
        }

        Rule rule = builder.build();
        validateRuleParams(rule);
        return rule;
    }

    public RuleBinding parseRuleBinding(String ruleBindingId, JsonNode node) {
        requireObject(ConfigKind.RULE_BINDING, ruleBindingId, node);

        String entityId = optionalText(node, "entity_id");
        String entityUri = optionalText(node, "entity_uri");
        if ((entityId == null) == (entityUri == null)) {
            throw new InvalidDefinitionException(ConfigKind.RULE_BINDING, ruleBindingId,
                    "must define exactly one key from: [entity_id, entity_uri].");
        }

        RuleBinding.RuleBindingBuilder builder = RuleBinding.builder()
                .id(ruleBindingId)
                .entityId(entityId)
                .entityUri(entityUri)
                .columnId(requireText(ConfigKind.RULE_BINDING, ruleBindingId, node, "column_id"))
                .rowFilterId(requireText(ConfigKind.RULE_BINDING, ruleBindingId, node, "row_filter_id"))
                .incrementalTimeFilterColumnId(optionalText(node, "incremental_time_filter_column_id"))
                .incremental(node.path("incremental").asBoolean(false));

        JsonNode ruleIds = node.get("rule_ids");
        if (ruleIds == null || !ruleIds.isArray() || ruleIds.isEmpty()) {
            throw new InvalidDefinitionException(ConfigKind.RULE_BINDING, ruleBindingId,
                    "'rule_ids' must be a non-empty list.");
        }
        for (JsonNode ruleIdNode : ruleIds) {
            builder.ruleReference(parseRuleReference(ruleBindingId, ruleIdNode));
        }

        JsonNode metadata = node.get("metadata");
        if (metadata != null && !metadata.isNull()) {
            requireObject(ConfigKind.RULE_BINDING, ruleBindingId, metadata);
            Map<String, Object> values = objectMapper.convertValue(metadata, new TypeReference<Map<String, Object>>() {});
            builder.metadata(new TreeMap<>(values));
        }
        return builder.build();
    }

    public MetadataRegistryDefaults parseMetadataDefaults(JsonNode node) {
        JsonNode dataplex = node.path("dataplex");
        if (!dataplex.isObject()) {
            throw new InvalidDefinitionException(ConfigKind.METADATA_REGISTRY_DEFAULTS, "dataplex",
                    "must define a 'dataplex' mapping.");
        }
        return MetadataRegistryDefaults.builder()
                .projects(optionalText(dataplex, "projects"))
                .locations(optionalText(dataplex, "locations"))
                .lakes(optionalText(dataplex, "lakes"))
                .zones(optionalText(dataplex, "zones"))
                .build();
    }

    private Column parseColumn(String entityId, String columnId, JsonNode node) {
        String scopedId = entityId + "." + columnId;
        requireObject(ConfigKind.COLUMN, scopedId, node);
        String dataTypeName = requireText(ConfigKind.COLUMN, scopedId, node, "data_type");
        ColumnDataType dataType = ColumnDataType.from(dataTypeName)
                .orElseThrow(() -> new InvalidDefinitionException(ConfigKind.COLUMN, scopedId,
                        "unsupported data_type '" + dataTypeName + "'"));
        return Column.builder()
                .id(columnId)
                .name(requireText(ConfigKind.COLUMN, scopedId, node, "name"))
                .description(optionalText(node, "description"))
                .dataType(dataType)
                .build();
    }

    private EnvironmentOverride parseEnvironmentOverride(String entityId, String key, JsonNode node) {
        requireObject(ConfigKind.ENTITY, entityId, node);
        JsonNode override = node.path("override");
        if (!override.isObject()) {
            throw new InvalidDefinitionException(ConfigKind.ENTITY, entityId,
                    "environment_override '" + key + "' must define an 'override' mapping.");
        }
        String environment = optionalText(node, "environment");
        return EnvironmentOverride.builder()
                .key(key)
                .environment(environment != null ? environment : key)
                .instanceName(firstText(override, "project_name", "instance_name"))
                .databaseName(firstText(override, "dataset_name", "database_name"))
                .tableName(optionalText(override, "table_name"))
                .build();
    }

    private RuleReference parseRuleReference(String ruleBindingId, JsonNode node) {
        if (node.isTextual() && !node.asText().isBlank()) {
            return RuleReference.builder().ruleId(node.asText()).build();
        }
        if (node.isObject() && node.size() == 1) {
            Map.Entry<String, JsonNode> entry = node.fields().next();
            RuleReference.RuleReferenceBuilder builder = RuleReference.builder().ruleId(entry.getKey());
            JsonNode arguments = entry.getValue();
            if (arguments != null && !arguments.isNull()) {
                if (!arguments.isObject()) {
                    throw new InvalidDefinitionException(ConfigKind.RULE_BINDING, ruleBindingId,
                            "arguments of rule '" + entry.getKey() + "' must be a mapping.");
                }
                Iterator<Map.Entry<String, JsonNode>> argumentFields = arguments.fields();
                while (argumentFields.hasNext()) {
                    Map.Entry<String, JsonNode> argument = argumentFields.next();
                    if (!argument.getValue().isValueNode() || argument.getValue().isNull()) {
                        throw new InvalidDefinitionException(ConfigKind.RULE_BINDING, ruleBindingId,
                                "argument '" + argument.getKey() + "' of rule '" + entry.getKey()
                                        + "' must be a scalar value.");
                    }
                    builder.argument(argument.getKey(), argument.getValue().asText());
                }
            }
            return builder.build();
        }
        throw new InvalidDefinitionException(ConfigKind.RULE_BINDING, ruleBindingId,
                "each 'rule_ids' entry must be a rule ID or a single-key mapping of rule ID to arguments.");
    }

    private List<String> parseArgumentNames(String ruleId, JsonNode node) {
        if (!node.isArray()) {
            throw new InvalidDefinitionException(ConfigKind.RULE, ruleId, "'custom_sql_arguments' must be a list.");
        }
        List<String> names = objectMapper.convertValue(node, new TypeReference<List<String>>() {});
        if (names.contains("column")) {
            throw new InvalidDefinitionException(ConfigKind.RULE, ruleId,
                    "'column' is reserved and cannot be declared in 'custom_sql_arguments'.");
        }
        return names;
    }

    private void validateRuleParams(Rule rule) {
        switch (rule.getRuleType()) {
            case NOT_NULL, NOT_BLANK -> {
                // no parameters
            }
            case REGEX -> {
                String pattern = requireParam(rule, Rule.PARAM_PATTERN);
                if (pattern.contains("'") || pattern.contains(";")) {
                    throw new InvalidDefinitionException(ConfigKind.RULE, rule.getId(),
                            "'pattern' must not contain quotes or statement terminators.");
                }
            }
            case CUSTOM_SQL_EXPR -> {
                String expression = requireParam(rule, Rule.PARAM_CUSTOM_SQL_EXPR);
                rejectTokens(rule, expression, FORBIDDEN_SQL_TOKENS);
                requireDeclaredPlaceholders(rule, expression);
            }
            case CUSTOM_SQL_STATEMENT -> {
                String statement = requireParam(rule, Rule.PARAM_CUSTOM_SQL_STATEMENT);
                rejectTokens(rule, statement, List.of(";"));
                requireDeclaredPlaceholders(rule, statement);
            }
        }
    }

    private String requireParam(Rule rule, String name) {
        String value = rule.getParam(name);
        if (value == null || value.isBlank()) {
            throw new InvalidDefinitionException(ConfigKind.RULE, rule.getId(),
                    rule.getRuleType() + " rule must define non-empty params value: '" + name + "'.");
        }
        return value;
    }

    private void rejectTokens(Rule rule, String sql, List<String> tokens) {
        for (String token : tokens) {
            if (sql.contains(token)) {
                throw new InvalidDefinitionException(ConfigKind.RULE, rule.getId(),
                        "custom SQL must not contain '" + token + "'.");
            }
        }
    }

    private void requireDeclaredPlaceholders(Rule rule, String template) {
        for (String placeholder : PlaceholderTemplate.placeholders(template)) {
            if (!"column".equals(placeholder) && !rule.getCustomSqlArguments().contains(placeholder)) {
                throw new InvalidDefinitionException(ConfigKind.RULE, rule.getId(),
                        "placeholder '$" + placeholder + "' is not declared in 'custom_sql_arguments'.");
            }
        }
    }

    private static void requireObject(ConfigKind kind, String id, JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidDefinitionException(kind, id, "definition must be a mapping.");
        }
    }

    private static String requireText(ConfigKind kind, String id, JsonNode node, String field) {
        String value = optionalText(node, field);
        if (value == null) {
            throw new InvalidDefinitionException(kind, id, "must define non-empty value: '" + field + "'.");
        }
        return value;
    }

    private static String requireOneOf(String entityId, JsonNode node, String preferred, String alias) {
        String value = firstText(node, preferred, alias);
        if (value == null) {
            throw new InvalidDefinitionException(ConfigKind.ENTITY, entityId,
                    "must define non-empty value: '" + preferred + "' or '" + alias + "'.");
        }
        return value;
    }

    private static String firstText(JsonNode node, String preferred, String alias) {
        String value = optionalText(node, preferred);
        return value != null ? value : optionalText(node, alias);
    }

    private static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
