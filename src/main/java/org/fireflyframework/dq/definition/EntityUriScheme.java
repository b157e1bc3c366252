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

import java.util.List;

/**
 * Schemes accepted in an entity URI, with the path keys each one allows and requires.
 */
public enum EntityUriScheme {

    DATAPLEX("dataplex",
            List.of("projects", "locations", "lakes", "zones", "entities"),
            List.of("projects", "locations", "lakes", "zones", "entities")),
    BIGQUERY("bigquery",
            List.of("projects", "datasets", "tables", "locations", "lakes", "zones"),
            List.of("projects", "datasets", "tables"));

    private final String prefix;
    private final List<String> allowedKeys;
    private final List<String> requiredKeys;

    EntityUriScheme(String prefix, List<String> allowedKeys, List<String> requiredKeys) {
        this.prefix = prefix;
        this.allowedKeys = allowedKeys;
        this.requiredKeys = requiredKeys;
    }

    public String getPrefix() {
        return prefix;
    }

    public List<String> getAllowedKeys() {
        return allowedKeys;
    }

    public List<String> getRequiredKeys() {
        return requiredKeys;
    }

    public SourceDatabase getSourceDatabase() {
        return this == DATAPLEX ? SourceDatabase.DATAPLEX : SourceDatabase.BIGQUERY;
    }
}
