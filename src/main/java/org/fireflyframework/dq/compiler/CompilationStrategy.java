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

package org.fireflyframework.dq.compiler;

/**
 * Strategy for compiling a batch of rule bindings.
 *
 * <ul>
 *   <li>{@link #FAIL_FAST} - Stop at the first rule binding that fails to compile</li>
 *   <li>{@link #COLLECT_ALL} - Compile every rule binding and collect all failures</li>
 * </ul>
 */
public enum CompilationStrategy {

    FAIL_FAST,
    COLLECT_ALL
}
