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

import org.fireflyframework.dq.exception.UnknownRowFilterException;
import org.fireflyframework.dq.registry.ConfigRegistry;

/**
 * Resolves a row filter identifier to the SQL expression inlined in the
 * {@code WHERE} clause of the validated data.
 */
public class RowFilterResolver {

    /**
     * @param registry    the registry of the current invocation
     * @param rowFilterId the row filter id
     * @return the filter expression, verbatim
     * @throws UnknownRowFilterException if the row filter is not registered
     */
    public String resolve(ConfigRegistry registry, String rowFilterId) {
        return registry.getRowFilter(rowFilterId).getFilterSqlExpr();
    }
}
