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
 * Client of the lake/zone metadata registry that maps Dataplex entities to the
 * warehouse tables backing them.
 */
public interface MetadataRegistryClient {

    /**
     * Fetches a Dataplex entity with its schema.
     *
     * @param projectId  the project id
     * @param locationId the location id
     * @param lakeId     the lake id
     * @param zoneId     the zone id
     * @param entityId   the entity id within the zone
     * @return the entity, or an empty Mono if it is not registered
     */
    Mono<DataplexEntity> getEntity(String projectId, String locationId, String lakeId, String zoneId,
                                   String entityId);
}
