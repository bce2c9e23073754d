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

package org.fireflyframework.automation.integration;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Snapshot of a patient as seen by the automation engine. Owned by the host
 * application; the engine reads it and asks the {@link PatientRepository} to change it.
 */
public record Patient(
        String id,
        String organizationId,
        String firstName,
        String lastName,
        String email,
        String phone,
        String status,
        String lifecycleStage,
        LocalDate lastVisitDate,
        LocalDate dateOfBirth,
        Integer totalVisits,
        Set<String> tags,
        Map<String, Object> attributes
) {
    public Patient {
        tags = tags != null ? Collections.unmodifiableSet(new LinkedHashSet<>(tags)) : Set.of();
        attributes = attributes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
    }

    public static Patient of(String id, String organizationId, String firstName, String lastName) {
        return new Patient(id, organizationId, firstName, lastName, null, null, "ACTIVE", null,
                null, null, 0, Set.of(), Map.of());
    }

    public String fullName() {
        String first = firstName != null ? firstName : "";
        String last = lastName != null ? lastName : "";
        String full = (first + " " + last).trim();
        return full.isEmpty() ? null : full;
    }

    public Patient withContact(String newEmail, String newPhone) {
        return new Patient(id, organizationId, firstName, lastName, newEmail, newPhone, status, lifecycleStage,
                lastVisitDate, dateOfBirth, totalVisits, tags, attributes);
    }

    public Patient withStatus(String newStatus) {
        return new Patient(id, organizationId, firstName, lastName, email, phone, newStatus, lifecycleStage,
                lastVisitDate, dateOfBirth, totalVisits, tags, attributes);
    }

    public Patient withLifecycleStage(String newStage) {
        return new Patient(id, organizationId, firstName, lastName, email, phone, status, newStage,
                lastVisitDate, dateOfBirth, totalVisits, tags, attributes);
    }

    public Patient withVisits(LocalDate newLastVisitDate, Integer newTotalVisits) {
        return new Patient(id, organizationId, firstName, lastName, email, phone, status, lifecycleStage,
                newLastVisitDate, dateOfBirth, newTotalVisits, tags, attributes);
    }

    public Patient withDateOfBirth(LocalDate newDateOfBirth) {
        return new Patient(id, organizationId, firstName, lastName, email, phone, status, lifecycleStage,
                lastVisitDate, newDateOfBirth, totalVisits, tags, attributes);
    }

    public Patient withTag(String tag) {
        Set<String> merged = new LinkedHashSet<>(tags);
        merged.add(tag);
        return new Patient(id, organizationId, firstName, lastName, email, phone, status, lifecycleStage,
                lastVisitDate, dateOfBirth, totalVisits, merged, attributes);
    }

    public Patient withAttribute(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(attributes);
        merged.put(key, value);
        return new Patient(id, organizationId, firstName, lastName, email, phone, status, lifecycleStage,
                lastVisitDate, dateOfBirth, totalVisits, tags, merged);
    }

    /**
     * Flattens the patient into the snake_case map used for condition evaluation and
     * template rendering. Unset fields are omitted, so conditions on them fail closed.
     * Free-form attributes are included first and never shadow the named fields.
     */
    public Map<String, Object> toContextMap() {
        Map<String, Object> ctx = new LinkedHashMap<>(attributes);
        putIfPresent(ctx, "id", id);
        putIfPresent(ctx, "organization_id", organizationId);
        putIfPresent(ctx, "first_name", firstName);
        putIfPresent(ctx, "last_name", lastName);
        putIfPresent(ctx, "full_name", fullName());
        putIfPresent(ctx, "email", email);
        putIfPresent(ctx, "phone", phone);
        putIfPresent(ctx, "status", status);
        putIfPresent(ctx, "lifecycle_stage", lifecycleStage);
        putIfPresent(ctx, "last_visit_date", lastVisitDate);
        putIfPresent(ctx, "date_of_birth", dateOfBirth);
        putIfPresent(ctx, "total_visits", totalVisits);
        ctx.put("tags", tags);
        return ctx;
    }

    private static void putIfPresent(Map<String, Object> ctx, String key, Object value) {
        if (value != null) {
            ctx.put(key, value);
        } else {
            ctx.remove(key);
        }
    }
}
