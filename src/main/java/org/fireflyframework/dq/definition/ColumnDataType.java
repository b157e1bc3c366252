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
import java.util.Locale;
import java.util.Optional;

/**
 * Declared data types of entity columns.
 */
public enum ColumnDataType {

    STRING,
    INTEGER,
    INT64,
    FLOAT,
    FLOAT64,
    NUMERIC,
    BIGNUMERIC,
    BOOLEAN,
    BOOL,
    BYTES,
    DATE,
    DATETIME,
    TIME,
    TIMESTAMP,
    GEOGRAPHY,
    JSON,
    RECORD,
    STRUCT,
    ARRAY;

    /**
     * Looks up a data type by name, ignoring case.
     *
     * @param value the declared type name
     * @return the matching type, or empty if the name is not supported
     */
    public static Optional<ColumnDataType> from(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.name().equals(normalized))
                .findFirst();
    }
}
