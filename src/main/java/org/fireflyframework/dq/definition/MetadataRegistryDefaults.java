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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default Dataplex coordinates used to complete entity URIs that omit them.
 */
@Data
@Builder
public class MetadataRegistryDefaults {

    private final String projects;
    private final String locations;
    private final String lakes;
    private final String zones;

    public static MetadataRegistryDefaults empty() {
        return MetadataRegistryDefaults.builder().build();
    }

    /**
     * Returns a copy where every non-null field of {@code overrides} replaces the
     * corresponding field of this instance.
     *
     * @param overrides the defaults taking precedence, may be {@code null}
     * @return the merged defaults
     */
    public MetadataRegistryDefaults mergedWith(MetadataRegistryDefaults overrides) {
        if (overrides == null) {
            return this;
        }
        return MetadataRegistryDefaults.builder()
                .projects(overrides.getProjects() != null ? overrides.getProjects() : projects)
                .locations(overrides.getLocations() != null ? overrides.getLocations() : locations)
                .lakes(overrides.getLakes() != null ? overrides.getLakes() : lakes)
                .zones(overrides.getZones() != null ? overrides.getZones() : zones)
                .build();
    }

    public Map<String, String> asConfigs() {
        Map<String, String> configs = new LinkedHashMap<>();
        putIfPresent(configs, "projects", projects);
        putIfPresent(configs, "locations", locations);
        putIfPresent(configs, "lakes", lakes);
        putIfPresent(configs, "zones", zones);
        return configs;
    }

    private static void putIfPresent(Map<String, String> configs, String key, String value) {
        if (value != null && !value.isBlank()) {
            configs.put(key, value);
        }
    }
}
