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
import org.fireflyframework.dq.exception.InvalidEntityUriException;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured address of an entity, e.g.
 * {@code dataplex://projects/p/locations/l/lakes/k/zones/z/entities/e} or
 * {@code bigquery://projects/p/datasets/d/tables/t}.
 *
 * <p>The path is a sequence of {@code key/value} pairs. Keys missing from a
 * {@code dataplex://} path are taken from {@link MetadataRegistryDefaults}; keys
 * present in the path always win over the defaults. {@code bigquery://} URIs only
 * carry the keys written in their path.</p>
 */
@Data
@Builder
public class EntityUri {

    private static final List<String> UNSUPPORTED_SCHEMES = List.of("local", "gs");
    private static final List<String> SPECIAL_CHARACTERS = List.of("@", "#", "?", ":");

    private final String uri;
    private final EntityUriScheme scheme;
    private final Map<String, String> configs;

    public String getConfig(String key) {
        return configs.get(key);
    }

    /**
     * Returns the entity identifier within its scheme: the {@code entities} value
     * for Dataplex, the full {@code projects/.../datasets/.../tables/...} path for BigQuery.
     *
     * @return the entity identifier
     */
    public String getEntityId() {
        if (scheme == EntityUriScheme.DATAPLEX) {
            return configs.get("entities");
        }
        return "projects/" + configs.get("projects")
                + "/datasets/" + configs.get("datasets")
                + "/tables/" + configs.get("tables");
    }

    /**
     * Returns the canonical key under which the resolved entity is registered.
     *
     * @return the primary key of the entity
     */
    public String getDbPrimaryKey() {
        if (scheme == EntityUriScheme.DATAPLEX) {
            return "projects/" + configs.get("projects")
                    + "/locations/" + configs.get("locations")
                    + "/lakes/" + configs.get("lakes")
                    + "/zones/" + configs.get("zones")
                    + "/entities/" + configs.get("entities");
        }
        return getEntityId();
    }

    public String getBigQueryTableId() {
        return configs.get("projects") + "." + configs.get("datasets") + "." + configs.get("tables");
    }

    public static EntityUri parse(String uri) {
        return parse(uri, MetadataRegistryDefaults.empty());
    }

    /**
     * Parses and validates an entity URI.
     *
     * @param uri      the URI string
     * @param defaults defaults filling keys the URI omits
     * @return the parsed URI
     * @throws InvalidEntityUriException if the scheme is unknown or unsupported, a key
     *                                   is not allowed, or a required key is missing
     */
    public static EntityUri parse(String uri, MetadataRegistryDefaults defaults) {
        if (uri == null || uri.isBlank()) {
            throw new InvalidEntityUriException(String.valueOf(uri), "entity_uri must not be empty");
        }
        int separator = uri.indexOf("://");
        if (separator < 0) {
            throw new InvalidEntityUriException(uri, "missing scheme");
        }
        EntityUriScheme scheme = parseScheme(uri, uri.substring(0, separator));
        String path = uri.substring(separator + 3);

        for (String character : SPECIAL_CHARACTERS) {
            if (path.contains(character)) {
                throw new InvalidEntityUriException(uri, "special characters [@, #, ?, :] are not allowed");
            }
        }

        Map<String, String> pathConfigs = parsePath(uri, scheme, path);

        Map<String, String> merged = new LinkedHashMap<>();
        Map<String, String> defaultConfigs = defaults != null && scheme == EntityUriScheme.DATAPLEX
                ? defaults.asConfigs()
                : Map.of();
        for (String key : scheme.getAllowedKeys()) {
            String value = pathConfigs.containsKey(key) ? pathConfigs.get(key) : defaultConfigs.get(key);
            if (value != null) {
                merged.put(key, value);
            }
        }

        for (String key : scheme.getRequiredKeys()) {
            String value = merged.get(key);
            if (value == null || value.isBlank()) {
                throw new InvalidEntityUriException(uri, "required argument '" + key + "' is missing");
            }
        }

        String leaf = scheme == EntityUriScheme.DATAPLEX ? merged.get("entities") : merged.get("tables");
        if (leaf.endsWith("*")) {
            throw new InvalidEntityUriException(uri, "wildcard filter '" + leaf + "' is not supported");
        }

        return EntityUri.builder()
                .uri(uri)
                .scheme(scheme)
                .configs(Collections.unmodifiableMap(merged))
                .build();
    }

    private static EntityUriScheme parseScheme(String uri, String prefix) {
        if (UNSUPPORTED_SCHEMES.contains(prefix)) {
            throw new InvalidEntityUriException(uri, "scheme '" + prefix + "://' is not supported");
        }
        return Arrays.stream(EntityUriScheme.values())
                .filter(scheme -> scheme.getPrefix().equals(prefix))
                .findFirst()
                .orElseThrow(() -> new InvalidEntityUriException(uri, "scheme '" + prefix + "://' is invalid"));
    }

    private static Map<String, String> parsePath(String uri, EntityUriScheme scheme, String path) {
        Map<String, String> pathConfigs = new LinkedHashMap<>();
        if (path.isEmpty()) {
            return pathConfigs;
        }
        String[] segments = path.split("/", -1);
        for (int i = 0; i < segments.length; i += 2) {
            String key = segments[i];
            if (!scheme.getAllowedKeys().contains(key)) {
                throw new InvalidEntityUriException(uri, "unknown key '" + key + "' for scheme '"
                        + scheme.getPrefix() + "://'");
            }
            String value = i + 1 < segments.length ? segments[i + 1] : "";
            if (value.isEmpty()) {
                throw new InvalidEntityUriException(uri, "required argument '" + key + "' is missing");
            }
            pathConfigs.put(key, value);
        }
        return pathConfigs;
    }
}
