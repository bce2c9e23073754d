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

package org.fireflyframework.automation.workflow.condition;

import org.fireflyframework.automation.workflow.model.ConditionClause;
import org.fireflyframework.automation.workflow.model.ConditionLogic;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates workflow conditions against a patient context.
 *
 * <p>Clauses form groups: a clause with {@code OR} logic starts a new group, every
 * other clause is AND-ed into the current one, and the groups are OR-ed. AND therefore
 * binds tighter than OR. An empty clause list is satisfied.
 *
 * <p>Evaluation fails closed. A field missing from the context makes the clause false
 * for every operator, {@code is_empty} included, and so does a value whose type cannot
 * be compared.
 */
public class ConditionEvaluator {

    public boolean evaluate(List<ConditionClause> clauses, Map<String, Object> context) {
        if (clauses == null || clauses.isEmpty()) {
            return true;
        }
        boolean group = true;
        for (int i = 0; i < clauses.size(); i++) {
            ConditionClause clause = clauses.get(i);
            if (i > 0 && clause.logic() == ConditionLogic.OR) {
                if (group) {
                    return true;
                }
                group = true;
            }
            if (group) {
                group = evaluateClause(clause, context);
            }
        }
        return group;
    }

    public boolean evaluateClause(ConditionClause clause, Map<String, Object> context) {
        Objects.requireNonNull(clause.operator(), () -> "Condition on '" + clause.field() + "' has no operator");
        Optional<Object> resolved = resolve(context, clause.field());
        if (resolved.isEmpty()) {
            return false;
        }
        Object actual = resolved.get();
        Object expected = clause.value();
        return switch (clause.operator()) {
            case EQUALS -> expected != null && looselyEquals(actual, expected);
            case NOT_EQUALS -> expected != null && !looselyEquals(actual, expected);
            case GREATER_THAN -> compare(actual, expected).map(c -> c > 0).orElse(false);
            case LESS_THAN -> compare(actual, expected).map(c -> c < 0).orElse(false);
            case CONTAINS -> expected != null && isContainer(actual) && contains(actual, expected);
            case NOT_CONTAINS -> expected != null && isContainer(actual) && !contains(actual, expected);
            case IS_EMPTY -> isEmpty(actual);
            case IS_NOT_EMPTY -> !isEmpty(actual);
            case IN -> expected != null && asList(expected).stream().anyMatch(e -> looselyEquals(actual, e));
            case NOT_IN -> expected != null && asList(expected).stream().noneMatch(e -> looselyEquals(actual, e));
        };
    }

    /**
     * Resolves a dotted path such as {@code event.appointment_type} through nested maps.
     * A path that leads through a missing key or a non-map value, or that ends on a
     * {@code null}, resolves to empty.
     */
    public static Optional<Object> resolve(Map<String, Object> context, String path) {
        if (context == null || path == null || path.isBlank()) {
            return Optional.empty();
        }
        if (context.containsKey(path)) {
            return Optional.ofNullable(context.get(path));
        }
        Object current = context;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(part)) {
                return Optional.empty();
            }
            current = map.get(part);
        }
        return Optional.ofNullable(current);
    }

    private static boolean looselyEquals(Object actual, Object expected) {
        if (actual == null || expected == null) {
            return false;
        }
        Optional<BigDecimal> a = asNumber(actual);
        Optional<BigDecimal> b = asNumber(expected);
        if (a.isPresent() && b.isPresent()) {
            return a.get().compareTo(b.get()) == 0;
        }
        if (actual instanceof Boolean || expected instanceof Boolean) {
            return actual.toString().equalsIgnoreCase(expected.toString());
        }
        return actual.toString().equals(expected.toString());
    }

    private static Optional<Integer> compare(Object actual, Object expected) {
        if (expected == null) {
            return Optional.empty();
        }
        Optional<BigDecimal> a = asNumber(actual);
        Optional<BigDecimal> b = asNumber(expected);
        if (a.isPresent() && b.isPresent()) {
            return Optional.of(a.get().compareTo(b.get()));
        }
        Optional<LocalDate> da = asDate(actual);
        Optional<LocalDate> db = asDate(expected);
        if (da.isPresent() && db.isPresent()) {
            return Optional.of(da.get().compareTo(db.get()));
        }
        return Optional.empty();
    }

    private static boolean isContainer(Object value) {
        return value instanceof CharSequence || value instanceof Collection<?>;
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual instanceof Collection<?> collection) {
            return collection.stream().anyMatch(item -> looselyEquals(item, expected));
        }
        return actual.toString().toLowerCase(Locale.ROOT).contains(expected.toString().toLowerCase(Locale.ROOT));
    }

    private static boolean isEmpty(Object value) {
        if (value instanceof CharSequence cs) {
            return cs.toString().isBlank();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }

    private static List<?> asList(Object value) {
        if (value instanceof Collection<?> collection) {
            return List.copyOf(collection);
        }
        return List.of(value);
    }

    private static Optional<BigDecimal> asNumber(Object value) {
        if (value instanceof BigDecimal bd) {
            return Optional.of(bd);
        }
        if (value instanceof Number || value instanceof CharSequence) {
            String text = value.toString().trim();
            if (text.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(new BigDecimal(text));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> asDate(Object value) {
        if (value instanceof LocalDate date) {
            return Optional.of(date);
        }
        if (value instanceof TemporalAccessor temporal) {
            try {
                return Optional.of(LocalDate.from(temporal));
            } catch (RuntimeException e) {
                return Optional.empty();
            }
        }
        if (value instanceof CharSequence cs) {
            String text = cs.toString().trim();
            try {
                return Optional.of(LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
