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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.fireflyframework.dq.definition.ColumnDataType;
import org.fireflyframework.dq.definition.Entity;
import org.fireflyframework.dq.definition.Rule;
import org.fireflyframework.dq.definition.RuleBinding;
import org.fireflyframework.dq.definition.SourceDatabase;
import org.fireflyframework.dq.exception.InvalidDefinitionException;
import org.fireflyframework.dq.exception.UnknownRuleTypeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DefinitionParser}.
 */
class DefinitionParserTest {

    private ObjectMapper yamlMapper;
    private DefinitionParser parser;

    @BeforeEach
    void setUp() {
        yamlMapper = new ObjectMapper(new YAMLFactory());
        parser = new DefinitionParser(yamlMapper);
    }

    @Test
    void parseEntity_shouldAcceptBackwardsCompatibleAliases() throws Exception {
        // Given
        JsonNode node = yaml("source_database: bigquery\n"
                + "table_name: contact_details\n"
                + "database_name: dq_test\n"
                + "instance_name: my-project\n"
                + "columns:\n"
                + "  VALUE: {name: value, data_type: string}\n");

        // When
        Entity entity = parser.parseEntity("TEST_TABLE", node);

        // Then
        assertThat(entity.getSourceDatabase()).isEqualTo(SourceDatabase.BIGQUERY);
        assertThat(entity.getProjectName()).isEqualTo("my-project");
        assertThat(entity.getDatasetName()).isEqualTo("dq_test");
        assertThat(entity.findColumn("VALUE"))
                .hasValueSatisfying(column -> assertThat(column.getDataType()).isEqualTo(ColumnDataType.STRING));
    }

    @Test
    void parseEntity_shouldRejectUnsupportedSourceDatabase() throws Exception {
        JsonNode node = yaml("source_database: POSTGRES\ntable_name: t\ndataset_name: d\nproject_name: p\n"
                + "columns:\n  VALUE: {name: value, data_type: STRING}\n");

        assertThatThrownBy(() -> parser.parseEntity("TEST_TABLE", node))
                .isInstanceOf(InvalidDefinitionException.class)
                .hasMessageContaining("POSTGRES");
    }

    @Test
    void parseEntity_shouldRequireColumns() throws Exception {
        JsonNode node = yaml("source_database: BIGQUERY\ntable_name: t\ndataset_name: d\nproject_name: p\n");

        assertThatThrownBy(() -> parser.parseEntity("TEST_TABLE", node))
                .isInstanceOf(InvalidDefinitionException.class)
                .hasMessageContaining("columns");
    }

    @Test
    void parseRule_shouldRejectUnknownRuleType() throws Exception {
        assertThatThrownBy(() -> parser.parseRule("R", yaml("rule_type: NOT_EMPTY\n"), Set.of()))
                .isInstanceOf(UnknownRuleTypeException.class)
                .hasMessageContaining("NOT_EMPTY");
    }

    @Test
    void parseRule_shouldRequirePatternForRegex() throws Exception {
        assertThatThrownBy(() -> parser.parseRule("R", yaml("rule_type: REGEX\n"), Set.of()))
                .isInstanceOf(InvalidDefinitionException.class)
                .hasMessageContaining("pattern");
    }

    @Test
    void parseRule_shouldRejectUndeclaredPlaceholder() throws Exception {
        JsonNode node = yaml("rule_type: CUSTOM_SQL_STATEMENT\n"
                + "params:\n"
                + "  custom_sql_statement: select * from data group by $column_names\n");

        assertThatThrownBy(() -> parser.parseRule("R", node, Set.of()))
                .isInstanceOf(InvalidDefinitionException.class)
                .hasMessageContaining("$column_names");
    }

    @Test
    void parseRule_shouldRejectStatementTerminatorInCustomSql() throws Exception {
        JsonNode node = yaml("rule_type: CUSTOM_SQL_EXPR\n"
                + "params:\n"
                + "  custom_sql_expr: \"$column > 0; DROP TABLE t\"\n");

        assertThatThrownBy(() -> parser.parseRule("R", node, Set.of()))
                .isInstanceOf(InvalidDefinitionException.class);
    }

    @Test
    void parseRule_shouldRejectDimensionOutsideDeclaredDimensions() throws Exception {
        JsonNode node = yaml("rule_type: NOT_NULL\ndimension: timeliness\n");

        assertThatThrownBy(() -> parser.parseRule("R", node, Set.of("completeness", "validity")))
                .isInstanceOf(InvalidDefinitionException.class)
                .hasMessageContaining("timeliness");
        assertThat(parser.parseRule("R", yaml("rule_type: NOT_NULL\ndimension: Completeness\n"),
                Set.of("completeness")).getDimension()).isEqualTo("Completeness");
    }

    @Test
    void parseRule_shouldCollectDeclaredArguments() throws Exception {
        JsonNode node = yaml("rule_type: CUSTOM_SQL_STATEMENT\n"
                + "params:\n"
                + "  custom_sql_arguments: [column_names]\n"
                + "  custom_sql_statement: select $column_names from data\n");

        Rule rule = parser.parseRule("R", node, Set.of());

        assertThat(rule.getCustomSqlArguments()).containsExactly("column_names");
        assertThat(rule.getParams()).doesNotContainKey(Rule.PARAM_CUSTOM_SQL_ARGUMENTS);
    }

    @Test
    void parseRuleBinding_shouldRequireExactlyOneEntityReference() throws Exception {
        JsonNode both = yaml("entity_id: TEST_TABLE\n"
                + "entity_uri: bigquery://projects/p/datasets/d/tables/t\n"
                + "column_id: VALUE\nrow_filter_id: NONE\nrule_ids: [NOT_NULL_SIMPLE]\n");
        JsonNode neither = yaml("column_id: VALUE\nrow_filter_id: NONE\nrule_ids: [NOT_NULL_SIMPLE]\n");

        assertThatThrownBy(() -> parser.parseRuleBinding("T1", both)).isInstanceOf(InvalidDefinitionException.class);
        assertThatThrownBy(() -> parser.parseRuleBinding("T1", neither)).isInstanceOf(InvalidDefinitionException.class);
    }

    @Test
    void parseRuleBinding_shouldRejectRuleIdsThatAreNotAList() throws Exception {
        JsonNode node = yaml("entity_id: TEST_TABLE\ncolumn_id: VALUE\nrow_filter_id: NONE\nrule_ids: NOT_NULL_SIMPLE\n");

        assertThatThrownBy(() -> parser.parseRuleBinding("T1", node))
                .isInstanceOf(InvalidDefinitionException.class)
                .hasMessageContaining("rule_ids");
    }

    @Test
    void parseRuleBinding_shouldReadIncrementalSettings() throws Exception {
        JsonNode node = yaml("entity_id: TEST_TABLE\ncolumn_id: VALUE\nrow_filter_id: NONE\n"
                + "incremental: true\nrule_ids: [NOT_NULL_SIMPLE]\n");

        RuleBinding binding = parser.parseRuleBinding("T1", node);

        assertThat(binding.isIncremental()).isTrue();
        assertThat(binding.getIncrementalTimeFilterColumnId()).isNull();
    }

    private JsonNode yaml(String content) throws Exception {
        return yamlMapper.readTree(content);
    }
}
