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

/**
 * Raised when a rule binding does not supply a custom SQL argument declared by one of its rules.
 */
public class MissingArgumentException extends DqConfigException {

    public MissingArgumentException(String ruleBindingId, String ruleId, String argument) {
        super(DqErrorType.MISSING_ARGUMENT,
                String.format("Rule Binding ID '%s' must supply argument '%s' for rule ID '%s'.",
                        ruleBindingId, argument, ruleId),
                ruleBindingId, ruleId, argument);
    }
}
