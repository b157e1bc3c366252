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

package org.fireflyframework.dq.definition;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.util.List;
import java.util.Map;

/**
 * A reusable validation rule.
 *
 * <p>{@code params} holds the scalar rule parameters ({@code pattern},
 * {@code custom_sql_expr}, {@code custom_sql_statement}); the argument names a
 * custom SQL rule expects every binding to supply are kept separately in
 * {@code customSqlArguments}.</p>
 */
@Data
@Builder
public class Rule {

    public static final String PARAM_PATTERN = "pattern";
    public static final String PARAM_CUSTOM_SQL_EXPR = "custom_sql_expr";
    public static final String PARAM_CUSTOM_SQL_STATEMENT = "custom_sql_statement";
    public static final String PARAM_CUSTOM_SQL_ARGUMENTS = "custom_sql_arguments";

    private final String id;
    private final RuleType ruleType;
    private final String dimension;

    @Singular
    private final Map<String, String> params;

    @Singular
    private final List<String> customSqlArguments;

    public String getParam(String name) {
        return params.get(name);
    }
}
