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

package org.fireflyframework.dq.registry;

/**
 * Kinds of definitions held by the {@link ConfigRegistry}. Identifiers are
 * unique per kind; column identifiers are scoped to their entity.
 */
public enum ConfigKind {

    ENTITY("entities", "Entity"),
    COLUMN("columns", "Column"),
    ROW_FILTER("row_filters", "Row Filter"),
    RULE("rules", "Rule"),
    RULE_BINDING("rule_bindings", "Rule Binding"),
    METADATA_REGISTRY_DEFAULTS("metadata_registry_defaults", "Metadata Registry Defaults");

    private final String configKey;
    private final String displayName;

    ConfigKind(String configKey, String displayName) {
        this.configKey = configKey;
        this.displayName = displayName;
    }

    /**
     * Returns the top-level YAML key under which definitions of this kind are declared.
     *
     * @return the YAML key
     */
    public String getConfigKey() {
        return configKey;
    }

    public String getDisplayName() {
        return displayName;
    }
}
