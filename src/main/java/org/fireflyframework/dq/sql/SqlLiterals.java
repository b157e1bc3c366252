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

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * BigQuery literal rendering.
 */
public final class SqlLiterals {

    static final String EPOCH_TIMESTAMP = "TIMESTAMP(\"1970-01-01 00:00:00\")";

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss.SSSSSS").withZone(ZoneOffset.UTC);

    private SqlLiterals() {
    }

    /**
     * Renders a quoted string literal, or a typed {@code NULL} for {@code null}.
     *
     * @param value the value
     * @return the literal
     */
    public static String string(String value) {
        if (value == null) {
            return "CAST(NULL AS STRING)";
        }
        StringBuilder literal = new StringBuilder(value.length() + 2).append('\'');
        for (char c : value.toCharArray()) {
            switch (c) {
                case '\\' -> literal.append("\\\\");
                case '\'' -> literal.append("\\'");
                case '\n' -> literal.append("\\n");
                case '\r' -> literal.append("\\r");
                case '\t' -> literal.append("\\t");
                default -> literal.append(c);
            }
        }
        return literal.append('\'').toString();
    }

    public static String timestamp(Instant instant) {
        return "TIMESTAMP(\"" + TIMESTAMP_FORMAT.format(instant) + "+00\")";
    }

    public static String bool(boolean value) {
        return value ? "TRUE" : "FALSE";
    }

    public static String table(String tableId) {
        return "`" + tableId + "`";
    }
}
