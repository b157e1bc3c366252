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

import org.fireflyframework.dq.definition.Column;
import org.fireflyframework.dq.definition.ColumnDataType;
import org.fireflyframework.dq.definition.EntityUri;
import org.fireflyframework.dq.definition.MetadataRegistryDefaults;
import org.fireflyframework.dq.definition.SourceDatabase;
import org.fireflyframework.dq.exception.InvalidDefinitionException;
import org.fireflyframework.dq.exception.InvalidEntityUriException;
import org.fireflyframework.dq.exception.UnknownEntityException;
import org.fireflyframework.dq.integration.DataplexEntity;
import org.fireflyframework.dq.integration.DataplexSchemaField;
import org.fireflyframework.dq.integration.MetadataRegistryClient;
import org.fireflyframework.dq.integration.TableMetadata;
import org.fireflyframework.dq.integration.TableMetadataProvider;
import org.fireflyframework.dq.resiliency.CollaboratorResiliencyConfig;
import org.fireflyframework.dq.resiliency.CollaboratorResiliencyRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link EntityUriResolver}.
 */
@ExtendWith(MockitoExtension.class)
class EntityUriResolverTest {

    private static final String BIGQUERY_URI = "bigquery://projects/my-project/datasets/dq_test/tables/contact_details";
    private static final String DATAPLEX_URI = "dataplex://zones/my-zone/entities/contact_details";
    private static final String ENTITY_NAME =
            "projects/my-project/locations/us-central1/lakes/my-lake/zones/my-zone/entities/contact_details";
    private static final MetadataRegistryDefaults DEFAULTS = MetadataRegistryDefaults.builder()
            .projects("my-project")
            .locations("us-central1")
            .lakes("my-lake")
            .build();

    @Mock
    private TableMetadataProvider tableMetadataProvider;

    @Mock
    private MetadataRegistryClient metadataRegistryClient;

    private CollaboratorResiliencyRegistry resiliencyRegistry;
    private EntityUriResolver resolver;

    @BeforeEach
    void setUp() {
        resiliencyRegistry = new CollaboratorResiliencyRegistry(new CollaboratorResiliencyConfig(), Map.of());
        resolver = new EntityUriResolver(tableMetadataProvider, metadataRegistryClient, resiliencyRegistry);
    }

    private DataplexEntity.DataplexEntityBuilder dataplexEntity() {
        return DataplexEntity.builder()
                .name(ENTITY_NAME)
                .id("contact_details")
                .asset("contact-details-asset")
                .dataPath("projects/my-project/datasets/dq_test/tables/contact_details")
                .field(DataplexSchemaField.builder().name("value").dataType("STRING").mode("NULLABLE").build())
                .field(DataplexSchemaField.builder().name("ts").dataType("TIMESTAMP").mode("NULLABLE").build());
    }

    @Test
    void resolve_shouldBuildEntityFromTableMetadata() {
        // Given
        when(tableMetadataProvider.getTableMetadata("my-project.dq_test.contact_details"))
                .thenReturn(Mono.just(TableMetadata.builder()
                        .tableId("my-project.dq_test.contact_details")
                        .column(Column.builder().id("VALUE").name("value").dataType(ColumnDataType.STRING).build())
                        .build()));

        // When & Then
        StepVerifier.create(resolver.resolve(EntityUri.parse(BIGQUERY_URI)))
                .assertNext(entity -> {
                    assertThat(entity.getId()).isEqualTo("projects/my-project/datasets/dq_test/tables/contact_details");
                    assertThat(entity.getSourceDatabase()).isEqualTo(SourceDatabase.BIGQUERY);
                    assertThat(entity.getTableId()).isEqualTo("my-project.dq_test.contact_details");
                    assertThat(entity.getColumns()).containsOnlyKeys("VALUE");
                })
                .verifyComplete();
    }

    @Test
    void resolve_shouldLeaveDataplexCoordinatesUnset_forBigQueryUriWithRegistryDefaults() {
        // Given
        MetadataRegistryDefaults defaults = DEFAULTS.mergedWith(MetadataRegistryDefaults.builder()
                .zones("my-zone")
                .build());
        when(tableMetadataProvider.getTableMetadata("my-project.dq_test.contact_details"))
                .thenReturn(Mono.just(TableMetadata.builder()
                        .tableId("my-project.dq_test.contact_details")
                        .column(Column.builder().id("VALUE").name("value").dataType(ColumnDataType.STRING).build())
                        .build()));

        // When & Then
        StepVerifier.create(resolver.resolve(EntityUri.parse(BIGQUERY_URI, defaults)))
                .assertNext(entity -> {
                    assertThat(entity.getDataplexLake()).isNull();
                    assertThat(entity.getDataplexZone()).isNull();
                    assertThat(entity.getDataplexAssetId()).isNull();
                })
                .verifyComplete();
    }

    @Test
    void resolve_shouldFailWithUnknownEntity_whenTableIsNotFound() {
        when(tableMetadataProvider.getTableMetadata("my-project.dq_test.contact_details")).thenReturn(Mono.empty());

        StepVerifier.create(resolver.resolve(EntityUri.parse(BIGQUERY_URI)))
                .expectError(UnknownEntityException.class)
                .verify();
    }

    @Test
    void resolve_shouldFail_whenNoTableMetadataProviderIsConfigured() {
        EntityUriResolver withoutProvider = new EntityUriResolver(null, metadataRegistryClient, resiliencyRegistry);

        StepVerifier.create(withoutProvider.resolve(EntityUri.parse(BIGQUERY_URI)))
                .expectError(InvalidEntityUriException.class)
                .verify();
    }

    @Test
    void resolve_shouldBuildEntityFromDataplexEntity() {
        // Given
        when(metadataRegistryClient.getEntity("my-project", "us-central1", "my-lake", "my-zone", "contact_details"))
                .thenReturn(Mono.just(dataplexEntity().build()));

        // When & Then
        StepVerifier.create(resolver.resolve(EntityUri.parse(DATAPLEX_URI, DEFAULTS)))
                .assertNext(entity -> {
                    assertThat(entity.getId()).isEqualTo(ENTITY_NAME);
                    assertThat(entity.getSourceDatabase()).isEqualTo(SourceDatabase.DATAPLEX);
                    assertThat(entity.getTableId()).isEqualTo("my-project.dq_test.contact_details");
                    assertThat(entity.getColumns().keySet()).containsExactly("VALUE", "TS");
                    assertThat(entity.getDataplexLake()).isEqualTo("my-lake");
                    assertThat(entity.getDataplexZone()).isEqualTo("my-zone");
                    assertThat(entity.getDataplexAssetId()).isEqualTo("contact-details-asset");
                })
                .verifyComplete();
    }

    @Test
    void resolve_shouldRejectDataplexEntityNotBackedByTable() {
        when(metadataRegistryClient.getEntity("my-project", "us-central1", "my-lake", "my-zone", "contact_details"))
                .thenReturn(Mono.just(dataplexEntity().dataPath("gs://bucket/contact_details").build()));

        StepVerifier.create(resolver.resolve(EntityUri.parse(DATAPLEX_URI, DEFAULTS)))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(InvalidEntityUriException.class)
                        .hasMessageContaining("gs://bucket/contact_details"))
                .verify();
    }

    @Test
    void resolve_shouldRejectMalformedDataplexEntityName() {
        when(metadataRegistryClient.getEntity("my-project", "us-central1", "my-lake", "my-zone", "contact_details"))
                .thenReturn(Mono.just(dataplexEntity().name("zones/my-zone").build()));

        StepVerifier.create(resolver.resolve(EntityUri.parse(DATAPLEX_URI, DEFAULTS)))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(InvalidEntityUriException.class);
                    assertThat(((InvalidEntityUriException) error).getIdentifiers()).containsExactly("zones/my-zone");
                })
                .verify();
    }

    @Test
    void resolve_shouldRejectUnsupportedColumnType() {
        when(metadataRegistryClient.getEntity("my-project", "us-central1", "my-lake", "my-zone", "contact_details"))
                .thenReturn(Mono.just(dataplexEntity()
                        .field(DataplexSchemaField.builder().name("payload").dataType("INTERVAL").build())
                        .build()));

        StepVerifier.create(resolver.resolve(EntityUri.parse(DATAPLEX_URI, DEFAULTS)))
                .expectError(InvalidDefinitionException.class)
                .verify();
    }
}
