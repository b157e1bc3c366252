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

package org.fireflyframework.dq.controller.advice;

import org.fireflyframework.dq.exception.ColumnNotInEntityException;
import org.fireflyframework.dq.exception.DqCompilationException;
import org.fireflyframework.dq.exception.DqConfigException;
import org.fireflyframework.dq.exception.UnknownRowFilterException;
import org.fireflyframework.dq.exception.UnknownRuleTypeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DqExceptionHandler}.
 */
class DqExceptionHandlerTest {

    private DqExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new DqExceptionHandler();
    }

    @Test
    void handleCompilationException_shouldReturn400WithOneErrorPerBinding() {
        // Given
        Map<String, DqConfigException> failures = new LinkedHashMap<>();
        failures.put("T1", new UnknownRowFilterException("MISSING"));
        failures.put("T2", new ColumnNotInEntityException("T2", "TEST_TABLE", "EMAIL"));

        // When
        ResponseEntity<Map<String, Object>> response =
                handler.handleCompilationException(new DqCompilationException(failures));

        // Then
        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().get("status")).isEqualTo(400);
        assertThat(response.getBody().get("error")).isEqualTo("Compilation Failed");

        @SuppressWarnings("unchecked")
        List<String> errors = (List<String>) response.getBody().get("errors");
        assertThat(errors).containsExactly(
                "T1: Row Filter ID 'MISSING' not found in 'row_filters' configs.",
                "T2: Rule Binding ID 'T2': column ID 'EMAIL' is not declared in entity 'TEST_TABLE'.");
    }

    @Test
    void handleConfigException_shouldIncludeErrorType() {
        ResponseEntity<Map<String, Object>> response =
                handler.handleConfigException(new UnknownRuleTypeException("R1", "NOT_EMPTY"));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().get("error")).isEqualTo("Invalid Configuration");
        assertThat(response.getBody().get("message")).isEqualTo("Rule ID 'R1' has unsupported rule_type 'NOT_EMPTY'.");
        assertThat(response.getBody()).containsKey("timestamp");

        @SuppressWarnings("unchecked")
        List<String> errors = (List<String>) response.getBody().get("errors");
        assertThat(errors).singleElement().asString().startsWith("UNKNOWN_RULE_TYPE: ");
    }
}
