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

package org.fireflyframework.dq.rules;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dq.definition.CompiledRule;
import org.fireflyframework.dq.definition.Rule;
import org.fireflyframework.dq.definition.RuleType;
import org.fireflyframework.dq.exception.MissingArgumentException;

import java.util.HashMap;
import java.util.Map;

/**
 * Renders a {@link Rule} into the concrete SQL it contributes to a rule binding.
 *
 * <p>Simple rules render to a boolean expression over the validated column.
 * {@link RuleType#CUSTOM_SQL_STATEMENT} renders to a full statement over the
 * {@code data} relation whose rows are the validation failures.</p>
 */
@Slf4j
public class RuleTemplateEngine {

    static final String COLUMN_PLACEHOLDER = "column";

    /**
     * Renders a rule for one binding.
     *
     * @param rule          the rule definition
     * @param columnName    the physical name of the validated column
     * @param arguments     custom SQL arguments supplied by the binding
     * @param ruleBindingId the binding being compiled, for diagnostics
     * @return the compiled rule
     * @throws MissingArgumentException if a declared custom SQL argument is not supplied
     */
    public CompiledRule render(Rule rule, String columnName, Map<String, String> arguments, String ruleBindingId) {
        String sql = switch (rule.getRuleType()) {
            case NOT_NULL -> columnName + " IS NOT NULL";
            case NOT_BLANK -> "TRIM(" + columnName + ") != ''";
            case REGEX -> "REGEXP_CONTAINS(CAST(" + columnName + " AS STRING), '"
                    + rule.getParam(Rule.PARAM_PATTERN) + "')";
            case CUSTOM_SQL_EXPR -> PlaceholderTemplate.substitute(
                    rule.getParam(Rule.PARAM_CUSTOM_SQL_EXPR),
                    bindArguments(rule, columnName, arguments, ruleBindingId));
            case CUSTOM_SQL_STATEMENT -> PlaceholderTemplate.substitute(
                    rule.getParam(Rule.PARAM_CUSTOM_SQL_STATEMENT),
                    bindArguments(rule, columnName, arguments, ruleBindingId));
        };

        log.debug("Rendered rule '{}' for rule binding '{}': {}", rule.getId(), ruleBindingId, sql);
        return CompiledRule.builder()
                .ruleId(rule.getId())
                .ruleType(rule.getRuleType())
                .dimension(rule.getDimension())
                .sql(sql)
                .build();
    }

    private Map<String, String> bindArguments(Rule rule, String columnName, Map<String, String> arguments,
                                              String ruleBindingId) {
        Map<String, String> values = new HashMap<>();
        for (String argument : rule.getCustomSqlArguments()) {
            String value = arguments.get(argument);
            if (value == null) {
                throw new MissingArgumentException(ruleBindingId, rule.getId(), argument);
            }
            values.put(argument, value);
        }
        for (String supplied : arguments.keySet()) {
            if (!values.containsKey(supplied)) {
                log.warn("Rule binding '{}' supplies argument '{}' that rule '{}' does not declare",
                        ruleBindingId, supplied, rule.getId());
            }
        }
        values.put(COLUMN_PLACEHOLDER, columnName);
        return values;
    }
}
