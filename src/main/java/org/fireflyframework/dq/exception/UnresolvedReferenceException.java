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
 * Raised when a referenced identifier does not exist in the registry.
 */
public class UnresolvedReferenceException extends DqConfigException {

    public UnresolvedReferenceException(ConfigKind kind, String identifier) {
        this(DqErrorType.UNRESOLVED_REFERENCE, kind, identifier);
    }

    protected UnresolvedReferenceException(DqErrorType errorType, ConfigKind kind, String identifier) {
        super(errorType,
                String.format("%s ID '%s' not found in '%s' configs.",
                        kind.getDisplayName(), identifier, kind.getConfigKey()),
                identifier);
    }
}
