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

package org.fireflyframework.automation.core.template;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitutes patient placeholders such as {@code {firstName}} in message text.
 *
 * <p>Rendering is a single left-to-right pass: each placeholder is resolved once and
 * substituted values are never scanned again. Unknown placeholders, and known ones
 * with no data in the context, are left as literal text.
 *
 * <p>The context uses the snake_case keys of the patient context map
 * ({@code first_name}, {@code last_visit_date}, ...).
 */
public class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z]+)}");

    private static final String FULL_NAME = "full_name";

    private static final Map<String, String> VARIABLES = Map.ofEntries(
            Map.entry("firstName", "first_name"),
            Map.entry("lastName", "last_name"),
            Map.entry("fullName", FULL_NAME),
            Map.entry("email", "email"),
            Map.entry("phone", "phone"),
            Map.entry("lastVisit", "last_visit_date"),
            Map.entry("totalVisits", "total_visits"),
            // Norwegian aliases
            Map.entry("fornavn", "first_name"),
            Map.entry("etternavn", "last_name"),
            Map.entry("fulltNavn", FULL_NAME),
            Map.entry("epost", "email"),
            Map.entry("telefon", "phone"));

    public String render(String template, Map<String, Object> context) {
        if (template == null || template.isEmpty()) {
            return template;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder(template.length());
        while (matcher.find()) {
            String value = resolve(matcher.group(1), context);
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public boolean isKnownVariable(String name) {
        return VARIABLES.containsKey(name);
    }

    private String resolve(String variable, Map<String, Object> context) {
        String key = VARIABLES.get(variable);
        if (key == null || context == null) {
            return null;
        }
        if (FULL_NAME.equals(key) && !context.containsKey(FULL_NAME)) {
            return fullName(context);
        }
        Object value = context.get(key);
        return value != null ? value.toString() : null;
    }

    private static String fullName(Map<String, Object> context) {
        Object first = context.get("first_name");
        Object last = context.get("last_name");
        String full = ((first != null ? first.toString() : "") + " " + (last != null ? last.toString() : "")).trim();
        return full.isEmpty() ? null : full;
    }
}
