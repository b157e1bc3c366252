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
import org.fireflyframework.dq.definition.Entity;
import org.fireflyframework.dq.definition.SourceDatabase;
import org.fireflyframework.dq.exception.UnknownEntityException;
import org.fireflyframework.dq.exception.UnknownEnvironmentException;
import org.fireflyframework.dq.registry.ConfigRegistry;
import org.fireflyframework.dq.registry.ConfigsLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EntityResolver}.
 */
class EntityResolverTest {

    private ConfigRegistry registry;
    private EntityResolver resolver;

    @BeforeEach
    void setUp() throws Exception {
        registry = new ConfigsLoader().load(Path.of(EntityResolverTest.class.getResource("/configs").toURI()));
        resolver = new EntityResolver();
    }

    @Test
    void resolve_shouldReturnBaseEntity_whenNoEnvironmentIsGiven() {
        Entity entity = resolver.resolve(registry, "TEST_TABLE", null);

        assertThat(entity.getTableId()).isEqualTo("my-project.dq_test.contact_details");
    }

    @Test
    void resolve_shouldApplyMatchingOverride() {
        // When
        Entity entity = resolver.resolve(registry, "TEST_TABLE", "test");

        // Then
        assertThat(entity.getTableId()).isEqualTo("my-project-test.dq_test_override.contact_details_test");
        assertThat(entity.getColumns()).containsKeys("ROW_ID", "CONTACT_TYPE", "VALUE", "TS");
    }

    @Test
    void resolve_shouldMatchEnvironmentIgnoringCase() {
        Entity entity = resolver.resolve(registry, "TEST_TABLE", "TEST");

        assertThat(entity.getDatasetName()).isEqualTo("dq_test_override");
    }

    @Test
    void resolve_shouldFailForEnvironmentNoEntityDeclares() {
        assertThatThrownBy(() -> resolver.resolve(registry, "TEST_TABLE", "prod"))
                .isInstanceOf(UnknownEnvironmentException.class)
                .hasMessageContaining("prod");
    }

    @Test
    void resolve_shouldFallBackToBaseEntity_whenEntityHasNoOverrideForKnownEnvironment() {
        // Given
        registry.registerEntity(Entity.builder()
                .id("OTHER_TABLE")
                .sourceDatabase(SourceDatabase.BIGQUERY)
                .instanceName("my-project")
                .databaseName("dq_test")
                .tableName("other")
                .column("ID", Column.builder().id("ID").name("id").dataType(ColumnDataType.STRING).build())
                .build());

        // When
        Entity entity = resolver.resolve(registry, "OTHER_TABLE", "test");

        // Then
        assertThat(entity.getTableId()).isEqualTo("my-project.dq_test.other");
    }

    @Test
    void resolve_shouldFailForUnknownEntity() {
        assertThatThrownBy(() -> resolver.resolve(registry, "MISSING", null))
                .isInstanceOf(UnknownEntityException.class);
    }
}
