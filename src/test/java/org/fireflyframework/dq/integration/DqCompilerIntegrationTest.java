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

import org.fireflyframework.dq.compiler.RuleBindingCompiler;
import org.fireflyframework.dq.config.DqCompilerProperties;
import org.fireflyframework.dq.definition.CompiledRuleBinding;
import org.fireflyframework.dq.registry.ConfigRegistry;
import org.fireflyframework.dq.registry.ConfigsLoader;
import org.fireflyframework.dq.resiliency.CollaboratorResiliencyConfig;
import org.fireflyframework.dq.resiliency.CollaboratorResiliencyRegistry;
import org.fireflyframework.dq.resolve.EntityUriResolver;
import org.fireflyframework.dq.service.CompilationRequest;
import org.fireflyframework.dq.service.CompilationResult;
import org.fireflyframework.dq.service.DqCompilationService;
import org.fireflyframework.dq.sql.SqlGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end test compiling the YAML fixtures from disk into validation and
 * summary SQL without any external collaborator.
 */
class DqCompilerIntegrationTest {

    private static final String RULES = "rule_dimensions:\n"
            + "  - completeness\n"
            + "  - validity\n"
            + "rules:\n"
            + "  NOT_NULL_SIMPLE:\n"
            + "    rule_type: NOT_NULL\n"
            + "    dimension: completeness\n"
            + "  REGEX_VALID_EMAIL:\n"
            + "    rule_type: REGEX\n"
            + "    dimension: validity\n"
            + "    params:\n"
            + "      pattern: ^[^@]+[@]{1}[^@]+$\n";

    private static final String RULES_PERMUTED = "rules:\n"
            + "  REGEX_VALID_EMAIL:\n"
            + "    params:\n"
            + "      pattern: ^[^@]+[@]{1}[^@]+$\n"
            + "    dimension: validity\n"
            + "    rule_type: REGEX\n"
            + "  NOT_NULL_SIMPLE:\n"
            + "    dimension: completeness\n"
            + "    rule_type: NOT_NULL\n"
            + "rule_dimensions:\n"
            + "  - validity\n"
            + "  - completeness\n";

    private static final String ENTITIES = "entities:\n"
            + "  CONTACTS:\n"
            + "    source_database: BIGQUERY\n"
            + "    project_name: my-project\n"
            + "    dataset_name: dq_test\n"
            + "    table_name: contact_details\n"
            + "    columns:\n"
            + "      VALUE:\n"
            + "        name: value\n"
            + "        data_type: STRING\n"
            + "      CONTACT_TYPE:\n"
            + "        name: contact_type\n"
            + "        data_type: STRING\n";

    private static final String ENTITIES_PERMUTED = "entities:\n"
            + "  CONTACTS:\n"
            + "    columns:\n"
            + "      CONTACT_TYPE:\n"
            + "        data_type: STRING\n"
            + "        name: contact_type\n"
            + "      VALUE:\n"
            + "        data_type: STRING\n"
            + "        name: value\n"
            + "    table_name: contact_details\n"
            + "    dataset_name: dq_test\n"
            + "    project_name: my-project\n"
            + "    source_database: BIGQUERY\n";

    private static final String ROW_FILTERS = "row_filters:\n"
            + "  NONE:\n"
            + "    filter_sql_expr: 'True'\n"
            + "  EMAIL_ONLY:\n"
            + "    filter_sql_expr: contact_type = 'email'\n";

    private static final String ROW_FILTERS_PERMUTED = "row_filters:\n"
            + "  EMAIL_ONLY:\n"
            + "    filter_sql_expr: contact_type = 'email'\n"
            + "  NONE:\n"
            + "    filter_sql_expr: 'True'\n";

    private static final String BINDINGS = "rule_bindings:\n"
            + "  VALUE_NOT_NULL:\n"
            + "    entity_id: CONTACTS\n"
            + "    column_id: VALUE\n"
            + "    row_filter_id: NONE\n"
            + "    rule_ids:\n"
            + "      - NOT_NULL_SIMPLE\n"
            + "  VALUE_EMAIL:\n"
            + "    entity_id: CONTACTS\n"
            + "    column_id: VALUE\n"
            + "    row_filter_id: EMAIL_ONLY\n"
            + "    rule_ids:\n"
            + "      - NOT_NULL_SIMPLE\n"
            + "      - REGEX_VALID_EMAIL\n"
            + "    metadata:\n"
            + "      brand: one\n"
            + "      team: two\n";

    private static final String BINDINGS_PERMUTED = "rule_bindings:\n"
            + "  VALUE_EMAIL:\n"
            + "    metadata:\n"
            + "      team: two\n"
            + "      brand: one\n"
            + "    rule_ids:\n"
            + "      - NOT_NULL_SIMPLE\n"
            + "      - REGEX_VALID_EMAIL\n"
            + "    row_filter_id: EMAIL_ONLY\n"
            + "    column_id: VALUE\n"
            + "    entity_id: CONTACTS\n"
            + "  VALUE_NOT_NULL:\n"
            + "    rule_ids:\n"
            + "      - NOT_NULL_SIMPLE\n"
            + "    row_filter_id: NONE\n"
            + "    column_id: VALUE\n"
            + "    entity_id: CONTACTS\n";

    private ConfigsLoader loader;
    private DqCompilationService service;

    @BeforeEach
    void setUp() throws Exception {
        Path configsPath = Path.of(DqCompilerIntegrationTest.class.getResource("/configs").toURI());
        loader = new ConfigsLoader();
        service = service(() -> loader.load(configsPath));
    }

    private DqCompilationService service(Supplier<ConfigRegistry> registrySupplier) {
        DqCompilerProperties properties = new DqCompilerProperties();
        properties.setDqSummaryTable("my-project.dq_summary.dq_summary");
        CollaboratorResiliencyRegistry resiliencyRegistry =
                new CollaboratorResiliencyRegistry(new CollaboratorResiliencyConfig(), Map.of());

        return new DqCompilationService(
                registrySupplier,
                new RuleBindingCompiler(),
                new SqlGenerator(),
                new EntityUriResolver(null, null, resiliencyRegistry),
                null,
                null,
                resiliencyRegistry,
                properties,
                null);
    }

    private CompilationResult compile(String invocationId, String environment) {
        return service.compile(CompilationRequest.builder()
                        .invocationId(invocationId)
                        .environment(environment)
                        .build())
                .block();
    }

    @Test
    void compile_shouldRenderSummaryOverEveryBinding() {
        // When
        CompilationResult result = compile("inv-1", null);

        // Then
        assertThat(result).isNotNull();
        String summary = result.getSummarySql();
        assertThat(summary.split("UNION ALL\nSELECT\n    'inv-1' AS invocation_id,", -1)).hasSize(4);
        assertThat(summary)
                .contains("'T1_DQ_1_VALUE_NOT_NULL' AS rule_binding_id")
                .contains("'T2_DQ_1_EMAIL' AS rule_binding_id")
                .contains("'T3_DQ_1_EMAIL_DUPLICATE' AS rule_binding_id")
                .contains("'T4_DQ_1_VALUE_NOT_NULL_INCREMENTAL' AS rule_binding_id")
                .contains("custom_sql_statement_validation_errors")
                .contains("high_watermark_filter");
    }

    @Test
    void compile_shouldBeDeterministicAcrossInvocations() {
        CompilationResult first = compile("inv-1", null);
        CompilationResult second = compile("inv-1", null);

        assertThat(first.getRuleBindingSql()).isEqualTo(second.getRuleBindingSql());
        assertThat(first.getSummarySql()).isEqualTo(second.getSummarySql());
    }

    @Test
    void compile_shouldKeepHashsumsOfUnchangedBindingsStableAcrossEnvironments() {
        // Given
        List<String> base = hashsums(compile("inv-1", null));
        List<String> again = hashsums(compile("inv-2", null));
        List<String> test = hashsums(compile("inv-3", "test"));

        // Then
        assertThat(again).isEqualTo(base);
        assertThat(test).doesNotContainAnyElementsOf(base);
    }

    @Test
    void compile_shouldKeepHashsumsStable_whenDocumentsBindingsAndKeysAreReordered() {
        // Given
        Map<String, String> original = new LinkedHashMap<>();
        original.put("rules.yml", RULES);
        original.put("entities.yml", ENTITIES);
        original.put("row-filters.yml", ROW_FILTERS);
        original.put("bindings.yml", BINDINGS);

        Map<String, String> permuted = new LinkedHashMap<>();
        permuted.put("bindings.yml", BINDINGS_PERMUTED);
        permuted.put("row-filters.yml", ROW_FILTERS_PERMUTED);
        permuted.put("entities.yml", ENTITIES_PERMUTED);
        permuted.put("rules.yml", RULES_PERMUTED);

        // When
        CompilationResult first = service(() -> loader.loadYaml(original))
                .compile(CompilationRequest.builder().invocationId("inv-1").build())
                .block();
        CompilationResult second = service(() -> loader.loadYaml(permuted))
                .compile(CompilationRequest.builder().invocationId("inv-1").build())
                .block();
        CompilationResult single = service(() -> loader.loadYaml(permuted))
                .compile(CompilationRequest.builder().invocationId("inv-1").ruleBindingId("VALUE_EMAIL").build())
                .block();

        // Then
        Map<String, String> firstHashsums = hashsumsById(first);
        assertThat(firstHashsums).containsOnlyKeys("VALUE_EMAIL", "VALUE_NOT_NULL");
        assertThat(firstHashsums.get("VALUE_EMAIL")).isNotEqualTo(firstHashsums.get("VALUE_NOT_NULL"));
        assertThat(hashsumsById(second)).isEqualTo(firstHashsums);
        assertThat(hashsumsById(single).get("VALUE_EMAIL")).isEqualTo(firstHashsums.get("VALUE_EMAIL"));
    }

    private static Map<String, String> hashsumsById(CompilationResult result) {
        assertThat(result).isNotNull();
        Map<String, String> hashsums = new TreeMap<>();
        result.getCompiledBindings().forEach(binding ->
                hashsums.put(binding.getRuleBindingId(), binding.getConfigsHashsum()));
        return hashsums;
    }

    private static List<String> hashsums(CompilationResult result) {
        return result.getCompiledBindings().stream().map(CompiledRuleBinding::getConfigsHashsum).toList();
    }
}
