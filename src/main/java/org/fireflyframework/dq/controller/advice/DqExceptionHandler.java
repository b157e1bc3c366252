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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dq.exception.DqCompilationException;
import org.fireflyframework.dq.exception.DqConfigException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for data quality controllers.
 *
 * <p>Translates configuration and compilation failures into 400 responses
 * listing every offending definition.</p>
 */
@Slf4j
@RestControllerAdvice(basePackages = "org.fireflyframework.dq.controller")
public class DqExceptionHandler {

    @ExceptionHandler(DqCompilationException.class)
    public ResponseEntity<Map<String, Object>> handleCompilationException(DqCompilationException ex) {
        log.warn("Data quality compilation failed: {}", ex.getMessage());
        return badRequest("Compilation Failed", ex.getMessage(), ex.getErrors());
    }

    @ExceptionHandler(DqConfigException.class)
    public ResponseEntity<Map<String, Object>> handleConfigException(DqConfigException ex) {
        log.warn("Invalid data quality configs ({}): {}", ex.getErrorType(), ex.getMessage());
        return badRequest("Invalid Configuration", ex.getMessage(), List.of(ex.getErrorType() + ": " + ex.getMessage()));
    }

    private ResponseEntity<Map<String, Object>> badRequest(String error, String message, List<String> errors) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", 400);
        body.put("error", error);
        body.put("message", message);
        body.put("errors", errors);
        body.put("timestamp", Instant.now().toString());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }
}
