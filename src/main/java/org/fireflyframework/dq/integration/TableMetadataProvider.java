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

package org.fireflyframework.dq.integration;

import reactor.core.publisher.Mono;

/**
 * Looks up the schema of a warehouse table.
 *
 * <p>Used to resolve {@code bigquery://} entity URIs, whose columns are not
 * declared in configuration.</p>
 */
public interface TableMetadataProvider {

    /**
     * Fetches the metadata of a table.
     *
     * @param tableId fully-qualified table id {@code project.dataset.table}
     * @return the table metadata, or an empty Mono if the table does not exist
     */
    Mono<TableMetadata> getTableMetadata(String tableId);
}
