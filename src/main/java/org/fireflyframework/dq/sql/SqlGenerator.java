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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dq.compiler.CanonicalJson;
import org.fireflyframework.dq.definition.CompiledRule;
import org.fireflyframework.dq.definition.CompiledRuleBinding;
import org.fireflyframework.dq.definition.Entity;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders compiled rule bindings into BigQuery validation SQL.
 *
 * <p>{@link #renderRuleBinding} produces one query per binding returning a row
 * per validated record and rule; {@link #renderSummary} aggregates the queries of
 * all requested bindings into one row per binding and rule.</p>
 *
 * <p>Simple rules emit {@code simple_rule_row_is_valid} and a {@code NULL}
 * {@code complex_rule_validation_errors_count}; complex rules emit the failure
 * count of their statement on every validated row and a {@code NULL} validity
 * flag. The summary uses the count when it is not {@code NULL} and otherwise
 * counts the validity flags.</p>
 */
@Slf4j
public class SqlGenerator {

    static final String GROUP_BY_COLUMNS = "1,2,3,4,5,6,7,8,9,10,11,12,13,14,15,16,17";

    /**
     * Renders the validation query of one compiled binding.
     *
     * @param binding the compiled binding
     * @param context the invocation context
     * @return the validation query
     */
    public String renderRuleBinding(CompiledRuleBinding binding, RenderContext context) {
        StringBuilder sql = new StringBuilder("WITH\n");
        if (binding.isIncremental()) {
            sql.append(renderHighWatermarkFilter(binding, context));
        }
        sql.append(renderData(binding))
                .append(renderLastModified(binding.getEntity()))
                .append("validation_results AS (\n")
                .append(binding.getRules().stream()
                        .map(rule -> renderRule(binding, rule))
                        .collect(Collectors.joining("\n    UNION ALL\n")))
                .append("\n),\n")
                .append(renderAllValidationResults(binding, context))
                .append("SELECT\n  *\nFROM\n  all_validation_results\n");
        return sql.toString();
    }

    /**
     * Renders the summary query over all given bindings, in rule binding id order.
     *
     * @param bindings the compiled bindings, at least one
     * @param context  the invocation context
     * @return the summary query
     */
    public String renderSummary(List<CompiledRuleBinding> bindings, RenderContext context) {
        if (bindings.isEmpty()) {
            throw new IllegalArgumentException("At least one compiled rule binding is required to render a summary");
        }
        String summary = bindings.stream()
                .sorted(Comparator.comparing(CompiledRuleBinding::getRuleBindingId))
                .map(binding -> renderSummarySelect(binding, context))
                .collect(Collectors.joining("UNION ALL\n"));
        log.debug("Rendered summary query for {} rule binding(s), invocation '{}'",
                bindings.size(), context.getInvocationId());
        return summary;
    }

    private String renderSummarySelect(CompiledRuleBinding binding, RenderContext context) {
        return "SELECT\n"
                + "    " + SqlLiterals.string(context.getInvocationId()) + " AS invocation_id,\n"
                + "    execution_ts,\n"
                + "    rule_binding_id,\n"
                + "    rule_id,\n"
                + "    table_id,\n"
                + "    column_id,\n"
                + "    dimension,\n"
                + "    metadata_json_string,\n"
                + "    configs_hashsum,\n"
                + "    dataplex_lake,\n"
                + "    dataplex_zone,\n"
                + "    dataplex_asset_id,\n"
                + "    dq_run_id,\n"
                + "    progress_watermark,\n"
                + "    rows_validated,\n"
                + "    complex_rule_validation_errors_count,\n"
                + "    last_modified,\n"
                + "    CASE WHEN complex_rule_validation_errors_count IS NOT NULL\n"
                + "      THEN rows_validated - complex_rule_validation_errors_count\n"
                + "      ELSE COUNTIF(simple_rule_row_is_valid IS TRUE)\n"
                + "    END AS success_count,\n"
                + "    CASE WHEN complex_rule_validation_errors_count IS NOT NULL\n"
                + "      THEN (rows_validated - complex_rule_validation_errors_count) / rows_validated\n"
                + "      ELSE COUNTIF(simple_rule_row_is_valid IS TRUE) / rows_validated\n"
                + "    END AS success_percentage,\n"
                + "    CASE WHEN complex_rule_validation_errors_count IS NOT NULL\n"
                + "      THEN complex_rule_validation_errors_count\n"
                + "      ELSE COUNTIF(simple_rule_row_is_valid IS FALSE)\n"
                + "    END AS failed_count,\n"
                + "    CASE WHEN complex_rule_validation_errors_count IS NOT NULL\n"
                + "      THEN complex_rule_validation_errors_count / rows_validated\n"
                + "      ELSE COUNTIF(simple_rule_row_is_valid IS FALSE) / rows_validated\n"
                + "    END AS failed_percentage,\n"
                + "    COUNTIF(column_value IS NULL) AS null_count,\n"
                + "    COUNTIF(column_value IS NULL) / rows_validated AS null_percentage\n"
                + "FROM (\n"
                + renderRuleBinding(binding, context)
                + ")\n"
                + "GROUP BY\n"
                + "    " + GROUP_BY_COLUMNS + "\n";
    }

    private String renderHighWatermarkFilter(CompiledRuleBinding binding, RenderContext context) {
        Instant known = context.getHighWatermarks().get(binding.getRuleBindingId());
        StringBuilder cte = new StringBuilder("high_watermark_filter AS (\n    SELECT\n");
        if (known != null) {
            cte.append("        ").append(SqlLiterals.timestamp(known)).append(" AS high_watermark\n");
        } else if (context.getDqSummaryTable() != null) {
            cte.append("        IFNULL(MAX(execution_ts), ").append(SqlLiterals.EPOCH_TIMESTAMP)
                    .append(") AS high_watermark\n")
                    .append("    FROM ").append(SqlLiterals.table(context.getDqSummaryTable())).append('\n')
                    .append("    WHERE table_id = ").append(SqlLiterals.string(binding.getTableId())).append('\n')
                    .append("      AND column_id = ").append(SqlLiterals.string(binding.getColumnName())).append('\n')
                    .append("      AND rule_binding_id = ").append(SqlLiterals.string(binding.getRuleBindingId()))
                    .append('\n')
                    .append("      AND progress_watermark IS TRUE\n");
        } else {
            cte.append("        ").append(SqlLiterals.EPOCH_TIMESTAMP).append(" AS high_watermark\n");
        }
        return cte.append("),\n").toString();
    }

    private String renderData(CompiledRuleBinding binding) {
        StringBuilder cte = new StringBuilder("data AS (\n")
                .append("    SELECT\n")
                .append("      *,\n")
                .append("      COUNT(1) OVER () AS num_rows_validated\n")
                .append("    FROM\n")
                .append("      ").append(SqlLiterals.table(binding.getTableId())).append(" d\n");
        if (binding.isIncremental()) {
            cte.append("      ,high_watermark_filter\n")
                    .append("    WHERE\n")
                    .append("      CAST(d.").append(binding.getIncrementalTimeFilterColumnName())
                    .append(" AS TIMESTAMP)\n")
                    .append("          > high_watermark_filter.high_watermark\n")
                    .append("    AND\n")
                    .append("      (").append(binding.getRowFilterSql()).append(")\n");
        } else {
            cte.append("    WHERE\n")
                    .append("      ").append(binding.getRowFilterSql()).append('\n');
        }
        return cte.append("),\n").toString();
    }

    private String renderLastModified(Entity entity) {
        return "last_mod AS (\n"
                + "    SELECT\n"
                + "        project_id || '.' || dataset_id || '.' || table_id AS table_id,\n"
                + "        TIMESTAMP_MILLIS(last_modified_time) AS last_modified\n"
                + "    FROM " + SqlLiterals.table(entity.getProjectName() + "." + entity.getDatasetName() + ".__TABLES__")
                + "\n"
                + "),\n";
    }

    private String renderRule(CompiledRuleBinding binding, CompiledRule rule) {
        StringBuilder select = new StringBuilder("    SELECT\n")
                .append("      CURRENT_TIMESTAMP() AS execution_ts,\n")
                .append("      ").append(SqlLiterals.string(binding.getRuleBindingId())).append(" AS rule_binding_id,\n")
                .append("      ").append(SqlLiterals.string(rule.getRuleId())).append(" AS rule_id,\n")
                .append("      ").append(SqlLiterals.string(binding.getTableId())).append(" AS table_id,\n")
                .append("      ").append(SqlLiterals.string(binding.getColumnName())).append(" AS column_id,\n")
                .append("      data.").append(binding.getColumnName()).append(" AS column_value,\n")
                .append("      ").append(SqlLiterals.string(rule.getDimension())).append(" AS dimension,\n")
                .append("      num_rows_validated AS num_rows_validated,\n");
        if (rule.isComplex()) {
            select.append("      CAST(NULL AS BOOLEAN) AS simple_rule_row_is_valid,\n")
                    .append("      custom_sql_statement_validation_errors.complex_rule_validation_errors_count")
                    .append(" AS complex_rule_validation_errors_count\n")
                    .append("    FROM\n")
                    .append("      data,\n")
                    .append("      (\n")
                    .append("        SELECT COUNT(*) AS complex_rule_validation_errors_count\n")
                    .append("        FROM (\n")
                    .append(rule.getSql()).append('\n')
                    .append("        )\n")
                    .append("      ) custom_sql_statement_validation_errors");
        } else {
            select.append("      CASE\n")
                    .append("        WHEN ").append(rule.getSql()).append(" THEN TRUE\n")
                    .append("      ELSE\n")
                    .append("        FALSE\n")
                    .append("      END AS simple_rule_row_is_valid,\n")
                    .append("      CAST(NULL AS INT64) AS complex_rule_validation_errors_count\n")
                    .append("    FROM\n")
                    .append("      data");
        }
        return select.toString();
    }

    private String renderAllValidationResults(CompiledRuleBinding binding, RenderContext context) {
        Entity entity = binding.getEntity();
        String progressWatermark = SqlLiterals.bool(context.isProgressWatermark());
        return "all_validation_results AS (\n"
                + "  SELECT\n"
                + "    r.execution_ts AS execution_ts,\n"
                + "    r.rule_binding_id AS rule_binding_id,\n"
                + "    r.rule_id AS rule_id,\n"
                + "    r.table_id AS table_id,\n"
                + "    r.column_id AS column_id,\n"
                + "    CAST(r.dimension AS STRING) AS dimension,\n"
                + "    r.simple_rule_row_is_valid AS simple_rule_row_is_valid,\n"
                + "    r.complex_rule_validation_errors_count AS complex_rule_validation_errors_count,\n"
                + "    r.column_value AS column_value,\n"
                + "    r.num_rows_validated AS rows_validated,\n"
                + "    last_mod.last_modified AS last_modified,\n"
                + "    " + SqlLiterals.string(CanonicalJson.write(binding.getMetadata())) + " AS metadata_json_string,\n"
                + "    " + SqlLiterals.string(binding.getConfigsHashsum()) + " AS configs_hashsum,\n"
                + "    " + SqlLiterals.string(entity.getDataplexLake()) + " AS dataplex_lake,\n"
                + "    " + SqlLiterals.string(entity.getDataplexZone()) + " AS dataplex_zone,\n"
                + "    " + SqlLiterals.string(entity.getDataplexAssetId()) + " AS dataplex_asset_id,\n"
                + "    CONCAT(r.rule_binding_id, '_', r.rule_id, '_', CAST(r.execution_ts AS STRING), '_', "
                + "CAST(" + progressWatermark + " AS STRING)) AS dq_run_id,\n"
                + "    " + progressWatermark + " AS progress_watermark\n"
                + "  FROM\n"
                + "    validation_results r\n"
                + "  LEFT JOIN last_mod USING(table_id)\n"
                + ")\n";
    }
}
