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

package org.fireflyframework.dq.exception;

import org.fireflyframework.dq.registry.ConfigKind;

/**
 * Raised when a single definition is malformed: a required field is missing,
 * a value has the wrong shape, or a template references undeclared placeholders.
 */
public class InvalidDefinitionException extends DqConfigException {

    public InvalidDefinitionException(ConfigKind kind, String identifier, String reason) {
        super(DqErrorType.INVALID_DEFINITION,
                String.format("%s ID '%s': %s", kind.getDisplayName(), identifier, reason),
                identifier);
    }

    /**
     * Raised when a whole configuration document cannot be read.
     *
     * @param source the document location
     * @param reason what is wrong with it
     * @param cause  the underlying parse failure
     */
    public InvalidDefinitionException(String source, String reason, Throwable cause) {
        super(DqErrorType.INVALID_DEFINITION,
                String.format("Configs file '%s': %s", source, reason),
                cause,
                source);
    }
}
