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

package org.fireflyframework.dq.resolve;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dq.definition.Column;
import org.fireflyframework.dq.definition.ColumnDataType;
import org.fireflyframework.dq.definition.Entity;
import org.fireflyframework.dq.definition.EntityUri;
import org.fireflyframework.dq.definition.SourceDatabase;
import org.fireflyframework.dq.exception.InvalidDefinitionException;
import org.fireflyframework.dq.exception.InvalidEntityUriException;
import org.fireflyframework.dq.exception.UnknownEntityException;
import org.fireflyframework.dq.integration.DataplexEntity;
import org.fireflyframework.dq.integration.DataplexSchemaField;
import org.fireflyframework.dq.integration.MetadataRegistryClient;
import org.fireflyframework.dq.integration.TableMetadataProvider;
import org.fireflyframework.dq.registry.ConfigKind;
import org.fireflyframework.dq.resiliency.CollaboratorResiliencyRegistry;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves entity URIs to entities through the external metadata collaborators.
 *
 * <p>{@code bigquery://} URIs address the table directly and only need its
 * schema from the {@link TableMetadataProvider}. {@code dataplex://} URIs go
 * through the {@link MetadataRegistryClient}, whose entity carries the data path
 * of the backing table. Resolved entities are identified by the URI's
 * {@link EntityUri#getDbPrimaryKey() db primary key}.</p>
 */
@Slf4j
public class EntityUriResolver {

    private static final String DATA_PATH_PREFIX = "projects/";

    private final TableMetadataProvider tableMetadataProvider;
    private final MetadataRegistryClient metadataRegistryClient;
    private final CollaboratorResiliencyRegistry resiliencyRegistry;

    public EntityUriResolver(TableMetadataProvider tableMetadataProvider,
                             MetadataRegistryClient metadataRegistryClient,
                             CollaboratorResiliencyRegistry resiliencyRegistry) {
        this.tableMetadataProvider = tableMetadataProvider;
        this.metadataRegistryClient = metadataRegistryClient;
        this.resiliencyRegistry = resiliencyRegistry;
    }

    /**
     * Resolves a parsed entity URI.
     *
     * @param entityUri the parsed URI
     * @return the resolved entity
     */
    public Mono<Entity> resolve(EntityUri entityUri) {
        log.info("Resolving entity_uri '{}'", entityUri.getUri());
        return switch (entityUri.getScheme()) {
            case BIGQUERY -> resolveBigQuery(entityUri);
            case DATAPLEX -> resolveDataplex(entityUri);
        };
    }

    private Mono<Entity> resolveBigQuery(EntityUri entityUri) {
        if (tableMetadataProvider == null) {
            return Mono.error(new InvalidEntityUriException(entityUri.getUri(),
                    "no table metadata provider is configured to resolve bigquery:// URIs"));
        }
        String tableId = entityUri.getBigQueryTableId();
        return resiliencyRegistry.decorate(CollaboratorResiliencyRegistry.TABLE_METADATA,
                        Mono.defer(() -> tableMetadataProvider.getTableMetadata(tableId)))
                .switchIfEmpty(Mono.error(() -> new UnknownEntityException(entityUri.getDbPrimaryKey())))
                .map(metadata -> Entity.builder()
                        .id(entityUri.getDbPrimaryKey())
                        .sourceDatabase(SourceDatabase.BIGQUERY)
                        .instanceName(entityUri.getConfig("projects"))
                        .databaseName(entityUri.getConfig("datasets"))
                        .tableName(entityUri.getConfig("tables"))
                        .columns(indexColumns(entityUri.getDbPrimaryKey(), metadata.getColumns()))
                        .dataplexLake(entityUri.getConfig("lakes"))
                        .dataplexZone(entityUri.getConfig("zones"))
                        .build());
    }

    private Mono<Entity> resolveDataplex(EntityUri entityUri) {
        if (metadataRegistryClient == null) {
            return Mono.error(new InvalidEntityUriException(entityUri.getUri(),
                    "no metadata registry client is configured to resolve dataplex:// URIs"));
        }
        return resiliencyRegistry.decorate(CollaboratorResiliencyRegistry.METADATA_REGISTRY,
                        Mono.defer(() -> metadataRegistryClient.getEntity(
                                entityUri.getConfig("projects"),
                                entityUri.getConfig("locations"),
                                entityUri.getConfig("lakes"),
                                entityUri.getConfig("zones"),
                                entityUri.getEntityId())))
                .switchIfEmpty(Mono.error(() -> new UnknownEntityException(entityUri.getDbPrimaryKey())))
                .map(dataplexEntity -> toEntity(entityUri, dataplexEntity));
    }

    private Entity toEntity(EntityUri entityUri, DataplexEntity dataplexEntity) {
        String dataPath = dataplexEntity.getDataPath();
        String[] segments = dataPath != null && dataPath.startsWith(DATA_PATH_PREFIX)
                ? dataPath.split("/")
                : new String[0];
        if (segments.length != 6 || !"datasets".equals(segments[2]) || !"tables".equals(segments[4])) {
            throw new InvalidEntityUriException(entityUri.getUri(),
                    "entity data path '" + dataPath + "' is not a BigQuery table path");
        }

        Map<String, Column> columns = new LinkedHashMap<>();
        String entityId = entityUri.getDbPrimaryKey();
        for (DataplexSchemaField field : dataplexEntity.getFields()) {
            String columnId = field.getName().toUpperCase(Locale.ROOT);
            ColumnDataType dataType = ColumnDataType.from(field.getDataType())
                    .orElseThrow(() -> new InvalidDefinitionException(ConfigKind.COLUMN, entityId + "." + columnId,
                            "unsupported data_type '" + field.getDataType() + "'"));
            Column column = Column.builder()
                    .id(columnId)
                    .name(field.getName())
                    .dataType(dataType)
                    .build();
            putUnique(entityId, columns, column);
        }

        return Entity.builder()
                .id(entityId)
                .sourceDatabase(SourceDatabase.DATAPLEX)
                .instanceName(segments[1])
                .databaseName(segments[3])
                .tableName(segments[5])
                .columns(columns)
                .dataplexLake(dataplexEntity.getLake())
                .dataplexZone(dataplexEntity.getZone())
                .dataplexAssetId(dataplexEntity.getAsset())
                .build();
    }

    private static Map<String, Column> indexColumns(String entityId, Collection<Column> columns) {
        Map<String, Column> indexed = new LinkedHashMap<>();
        columns.forEach(column -> putUnique(entityId, indexed, column));
        return indexed;
    }

    private static void putUnique(String entityId, Map<String, Column> columns, Column column) {
        if (columns.putIfAbsent(column.getId(), column) != null) {
            throw new InvalidDefinitionException(ConfigKind.ENTITY, entityId,
                    "column '" + column.getId() + "' is declared more than once");
        }
    }
}
