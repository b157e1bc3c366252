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
 * Raised when the same definition is registered twice under one identifier.
 */
public class DuplicateIdentifierException extends DqConfigException {

    public DuplicateIdentifierException(ConfigKind kind, String identifier) {
        super(DqErrorType.DUPLICATE_IDENTIFIER,
                String.format("%s ID '%s' is defined more than once.", kind.getDisplayName(), identifier),
                identifier);
    }
}
