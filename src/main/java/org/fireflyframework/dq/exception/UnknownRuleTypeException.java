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
 * Raised when a rule declares a {@code rule_type} outside the supported set.
 */
public class UnknownRuleTypeException extends DqConfigException {

    public UnknownRuleTypeException(String ruleId, String ruleType) {
        super(DqErrorType.UNKNOWN_RULE_TYPE,
                String.format("Rule ID '%s' has unsupported rule_type '%s'.", ruleId, ruleType),
                ruleId, ruleType);
    }
}
