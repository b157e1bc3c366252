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
 * Source system an {@link Entity} lives in.
 *
 * <ul>
 *   <li>{@link #BIGQUERY} - a warehouse-native table</li>
 *   <li>{@link #DATAPLEX} - a lake-managed table registered in a lake zone</li>
 * </ul>
 */
public enum SourceDatabase {

    BIGQUERY,
    DATAPLEX;

    public static Optional<SourceDatabase> from(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(source -> source.name().equals(normalized))
                .findFirst();
    }
}
