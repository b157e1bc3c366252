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

import org.fireflyframework.dq.definition.RowFilter;
import org.fireflyframework.dq.exception.UnknownRowFilterException;
import org.fireflyframework.dq.registry.ConfigRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RowFilterResolver}.
 */
class RowFilterResolverTest {

    private final RowFilterResolver resolver = new RowFilterResolver();

    @Test
    void resolve_shouldReturnExpressionVerbatim() {
        ConfigRegistry registry = new ConfigRegistry();
        registry.registerRowFilter(RowFilter.builder().id("DATA_TYPE_EMAIL").filterSqlExpr("contact_type = 'email'").build());

        assertThat(resolver.resolve(registry, "DATA_TYPE_EMAIL")).isEqualTo("contact_type = 'email'");
    }

    @Test
    void resolve_shouldFailForUnknownRowFilter() {
        assertThatThrownBy(() -> resolver.resolve(new ConfigRegistry(), "NONE"))
                .isInstanceOf(UnknownRowFilterException.class)
                .hasMessageContaining("NONE");
    }
}
