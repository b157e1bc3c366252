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

package org.fireflyframework.dq.rules;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code $name} placeholder handling for custom SQL rule templates.
 *
 * <p>A placeholder name is the longest identifier following the {@code $}, so
 * {@code $column_names} is never mistaken for {@code $column}. Substitution is
 * plain text replacement; values are not escaped and any text outside the
 * replaced tokens is kept as written.</p>
 */
public final class PlaceholderTemplate {

    private static final Pattern PLACEHOLDER =
            Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)");

    private PlaceholderTemplate() {}

    /**
     * Returns the placeholder names used in a template, in order of first appearance.
     *
     * @param template the template text
     * @return the placeholder names
     */
    public static Set<String> placeholders(String template) {
        Set<String> names = new LinkedHashSet<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    /**
     * Replaces every placeholder that has a value. Placeholders without a value
     * are left untouched.
     *
     * @param template the template text
     * @param values   placeholder values by name
     * @return the rendered text
     */
    public static String substitute(String template, Map<String, String> values) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            String replacement = value != null ? value : matcher.group();
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }
}
