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

import java.util.Arrays;
import java.util.Optional;

/**
 * Supported rule types.
 *
 * <p>All types except {@link #CUSTOM_SQL_STATEMENT} are <em>simple</em>: they
 * produce one boolean per validated row. A custom SQL statement is
 * <em>complex</em>: it selects the failing rows of the {@code data} relation and
 * is aggregated into a single failure count.</p>
 */
public enum RuleType {

    NOT_NULL,
    NOT_BLANK,
    REGEX,
    CUSTOM_SQL_EXPR,
    CUSTOM_SQL_STATEMENT;

    public boolean isComplex() {
        return this == CUSTOM_SQL_STATEMENT;
    }

    public static Optional<RuleType> from(String value) {
        return Arrays.stream(values())
                .filter(type -> type.name().equals(value))
                .findFirst();
    }
}
