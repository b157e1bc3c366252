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

/**
 * Addressing fields that replace an entity's base fields when compiling for a
 * given environment. A {@code null} field means "keep the base value".
 */
@Data
@Builder
public class EnvironmentOverride {

    private final String key;
    private final String environment;
    private final String instanceName;
    private final String databaseName;
    private final String tableName;

    public boolean matches(String environmentName) {
        return environment != null && environment.equalsIgnoreCase(environmentName);
    }
}
