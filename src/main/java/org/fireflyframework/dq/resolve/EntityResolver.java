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
import org.fireflyframework.dq.definition.Entity;
import org.fireflyframework.dq.exception.UnknownEntityException;
import org.fireflyframework.dq.exception.UnknownEnvironmentException;
import org.fireflyframework.dq.registry.ConfigRegistry;

import java.util.Locale;

/**
 * Resolves an entity identifier to its table reference and schema for a target
 * environment.
 */
@Slf4j
public class EntityResolver {

    /**
     * Resolves an entity, overlaying the addressing fields of its environment
     * override when one matches {@code environment}.
     *
     * <p>An environment that no loaded entity declares fails with
     * {@link UnknownEnvironmentException}. An entity that has no override for a
     * declared environment resolves to its base definition.</p>
     *
     * @param registry    the registry of the current invocation
     * @param entityId    the entity id
     * @param environment the target environment, {@code null} or blank for the base definition
     * @return the resolved entity
     * @throws UnknownEntityException      if the entity is not registered
     * @throws UnknownEnvironmentException if the environment is not declared anywhere
     */
    public Entity resolve(ConfigRegistry registry, String entityId, String environment) {
        Entity entity = registry.getEntity(entityId);
        if (environment == null || environment.isBlank()) {
            return entity;
        }
        if (!registry.knownEnvironments().contains(environment.toLowerCase(Locale.ROOT))) {
            throw new UnknownEnvironmentException(environment);
        }
        return entity.findOverride(environment)
                .map(override -> {
                    log.debug("Applying environment override '{}' to entity '{}'", override.getKey(), entityId);
                    return entity.applyOverride(override);
                })
                .orElse(entity);
    }
}
