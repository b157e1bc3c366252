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

import org.fireflyframework.dq.definition.CompiledRule;
import org.fireflyframework.dq.definition.CompiledRuleBinding;
import org.fireflyframework.dq.definition.RuleBinding;
import org.fireflyframework.dq.definition.RuleReference;
import org.fireflyframework.dq.exception.ColumnNotInEntityException;
import org.fireflyframework.dq.exception.DqCompilationException;
import org.fireflyframework.dq.exception.InvalidDefinitionException;
import org.fireflyframework.dq.exception.MissingArgumentException;
import org.fireflyframework.dq.exception.UnknownRowFilterException;
import org.fireflyframework.dq.registry.ConfigRegistry;
import org.fireflyframework.dq.registry.ConfigsLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuleBindingCompiler}.
 */
class RuleBindingCompilerTest {

    private ConfigRegistry registry;
    private RuleBindingCompiler compiler;

    @BeforeEach
    void setUp() throws Exception {
        registry = new ConfigsLoader().load(Path.of(RuleBindingCompilerTest.class.getResource("/configs").toURI()));
        compiler = new RuleBindingCompiler();
    }

    @Test
    void compile_shouldRenderEveryBoundRule() {
        // When
        CompiledRuleBinding compiled = compiler.compile(registry, registry.getRuleBinding("T2_DQ_1_EMAIL"), null);

        // Then
        assertThat(compiled.getTableId()).isEqualTo("my-project.dq_test.contact_details");
        assertThat(compiled.getColumnId()).isEqualTo("VALUE");
        assertThat(compiled.getColumnName()).isEqualTo("value");
        assertThat(compiled.getRowFilterSql()).isEqualTo("contact_type = 'email'");
        assertThat(compiled.getRules()).extracting(CompiledRule::getSql).containsExactly(
                "value IS NOT NULL",
                "REGEXP_CONTAINS(CAST(value AS STRING), '^[^@]+[@]{1}[^@]+$')",
                "LENGTH( value ) <= 30");
        assertThat(compiled.getMetadata()).containsEntry("brand", "one").containsEntry("team", "two");
        assertThat(compiled.getConfigsHashsum()).matches("[0-9a-f]{64}");
        assertThat(compiled.isIncremental()).isFalse();
    }

    @Test
    void compile_shouldSubstituteCustomStatementArguments() {
        CompiledRuleBinding compiled =
                compiler.compile(registry, registry.getRuleBinding("T3_DQ_1_EMAIL_DUPLICATE"), null);

        CompiledRule duplicates = compiled.getRules().get(0);
        assertThat(duplicates.isComplex()).isTrue();
        assertThat(duplicates.getSql())
                .contains("group by contact_type,value")
                .contains("using (contact_type,value)")
                .doesNotContain("$");
    }

    @Test
    void compile_shouldResolveEntityForEnvironment() {
        CompiledRuleBinding compiled =
                compiler.compile(registry, registry.getRuleBinding("T1_DQ_1_VALUE_NOT_NULL"), "test");

        assertThat(compiled.getTableId()).isEqualTo("my-project-test.dq_test_override.contact_details_test");
        assertThat(compiled.getEnvironment()).isEqualTo("test");
    }

    @Test
    void compile_shouldResolveIncrementalTimeFilterColumn() {
        CompiledRuleBinding compiled =
                compiler.compile(registry, registry.getRuleBinding("T4_DQ_1_VALUE_NOT_NULL_INCREMENTAL"), null);

        assertThat(compiled.isIncremental()).isTrue();
        assertThat(compiled.getIncrementalTimeFilterColumnId()).isEqualTo("TS");
        assertThat(compiled.getIncrementalTimeFilterColumnName()).isEqualTo("ts");
    }

    @Test
    void compile_shouldUseEntityTimeFilterColumn_whenBindingIsFlaggedIncremental() {
        // Given
        RuleBinding binding = binding("T5").incremental(true).build();

        // When
        CompiledRuleBinding compiled = compiler.compile(registry, binding, null);

        // Then
        assertThat(compiled.getIncrementalTimeFilterColumnName()).isEqualTo("ts");
    }

    @Test
    void compile_shouldFailForUnknownRowFilter() {
        RuleBinding binding = binding("T5").rowFilterId("MISSING").build();

        assertThatThrownBy(() -> compiler.compile(registry, binding, null))
                .isInstanceOf(UnknownRowFilterException.class)
                .hasMessageContaining("MISSING");
    }

    @Test
    void compile_shouldFailForColumnNotDeclaredInEntity() {
        RuleBinding binding = binding("T5").columnId("EMAIL").build();

        assertThatThrownBy(() -> compiler.compile(registry, binding, null))
                .isInstanceOf(ColumnNotInEntityException.class)
                .hasMessage("Rule Binding ID 'T5': column ID 'EMAIL' is not declared in entity 'TEST_TABLE'.");
    }

    @Test
    void compile_shouldFailForMissingCustomSqlArgument() {
        RuleBinding binding = RuleBinding.builder()
                .id("T5")
                .entityId("TEST_TABLE")
                .columnId("VALUE")
                .rowFilterId("NONE")
                .ruleReference(RuleReference.builder().ruleId("NO_DUPLICATES_IN_COLUMN_GROUPS").build())
                .build();

        assertThatThrownBy(() -> compiler.compile(registry, binding, null))
                .isInstanceOf(MissingArgumentException.class)
                .hasMessageContaining("column_names");
    }

    @Test
    void compile_shouldFailForUnresolvedEntityUri() {
        RuleBinding binding = binding("T5").entityId(null)
                .entityUri("bigquery://projects/p/datasets/d/tables/t")
                .build();

        assertThatThrownBy(() -> compiler.compile(registry, binding, null))
                .isInstanceOf(InvalidDefinitionException.class)
                .hasMessageContaining("has not been resolved");
    }

    @Test
    void compile_shouldProduceIdenticalOutputForIdenticalInput() {
        RuleBinding binding = registry.getRuleBinding("T2_DQ_1_EMAIL");

        assertThat(compiler.compile(registry, binding, null)).isEqualTo(compiler.compile(registry, binding, null));
    }

    @Test
    void compileAll_shouldCollectEveryFailure_whenCollectingAll() {
        // Given
        List<RuleBinding> bindings = List.of(
                binding("C_BAD").columnId("EMAIL").build(),
                binding("B_GOOD").build(),
                binding("A_BAD").rowFilterId("MISSING").build());

        // When
        CompilationReport report = compiler.compileAll(registry, bindings, null, CompilationStrategy.COLLECT_ALL);

        // Then
        assertThat(report.isSuccessful()).isFalse();
        assertThat(report.getFailures().keySet()).containsExactly("A_BAD", "C_BAD");
        assertThat(report.getCompiledBindings()).extracting(CompiledRuleBinding::getRuleBindingId)
                .containsExactly("B_GOOD");
        assertThatThrownBy(report::orThrow)
                .isInstanceOf(DqCompilationException.class)
                .hasMessageContaining("2 rule binding(s) failed to compile");
    }

    @Test
    void compileAll_shouldStopAtFirstFailure_whenFailingFast() {
        List<RuleBinding> bindings = List.of(
                binding("C_BAD").columnId("EMAIL").build(),
                binding("B_GOOD").build(),
                binding("A_BAD").rowFilterId("MISSING").build());

        CompilationReport report = compiler.compileAll(registry, bindings, null, CompilationStrategy.FAIL_FAST);

        assertThat(report.getFailures().keySet()).containsExactly("A_BAD");
        assertThat(report.getCompiledBindings()).isEmpty();
    }

    @Test
    void compileAll_shouldOrderCompiledBindingsById() {
        List<RuleBinding> bindings = List.of(binding("T9").build(), binding("T5").build());

        CompilationReport report = compiler.compileAll(registry, bindings, null, CompilationStrategy.FAIL_FAST);

        assertThat(report.orThrow()).extracting(CompiledRuleBinding::getRuleBindingId).containsExactly("T5", "T9");
    }

    private static RuleBinding.RuleBindingBuilder binding(String id) {
        return RuleBinding.builder()
                .id(id)
                .entityId("TEST_TABLE")
                .columnId("VALUE")
                .rowFilterId("NONE")
                .ruleReference(RuleReference.builder().ruleId("NOT_NULL_SIMPLE").build());
    }
}
