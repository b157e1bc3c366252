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
import java.util.Optional;

/**
 * A table that rule bindings validate.
 *
 * <p>{@code instanceName} and {@code databaseName} are the project and dataset
 * of a BigQuery table; {@link #getProjectName()} and {@link #getDatasetName()}
 * expose them under their warehouse-native names. Entities resolved from a
 * Dataplex zone also carry the lake, zone and asset they were registered under.</p>
 */
@Data
@Builder(toBuilder = true)
public class Entity {

    private final String id;
    private final SourceDatabase sourceDatabase;
    private final String instanceName;
    private final String databaseName;
    private final String tableName;

    @Singular
    private final Map<String, Column> columns;

    @Singular
    private final List<EnvironmentOverride> environmentOverrides;

    private final String incrementalTimeFilterColumnId;
    private final String dataplexLake;
    private final String dataplexZone;
    private final String dataplexAssetId;

    /**
     * Returns the fully-qualified table reference {@code instance.database.table}.
     *
     * @return the table id used in generated SQL and in the summary output
     */
    public String getTableId() {
        return instanceName + "." + databaseName + "." + tableName;
    }

    public String getProjectName() {
        return instanceName;
    }

    public String getDatasetName() {
        return databaseName;
    }

    public Optional<Column> findColumn(String columnId) {
        return Optional.ofNullable(columns.get(columnId));
    }

    public Optional<EnvironmentOverride> findOverride(String environment) {
        return environmentOverrides.stream()
                .filter(override -> override.matches(environment))
                .findFirst();
    }

    /**
     * Returns a copy of this entity with the non-null addressing fields of the
     * override applied. Columns and all other fields are kept.
     *
     * @param override the environment override to overlay
     * @return a new entity
     */
    public Entity applyOverride(EnvironmentOverride override) {
        return toBuilder()
                .instanceName(override.getInstanceName() != null ? override.getInstanceName() : instanceName)
                .databaseName(override.getDatabaseName() != null ? override.getDatabaseName() : databaseName)
                .tableName(override.getTableName() != null ? override.getTableName() : tableName)
                .build();
    }
}
