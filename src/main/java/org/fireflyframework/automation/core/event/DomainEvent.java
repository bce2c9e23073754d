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

package org.fireflyframework.automation.core.event;

import org.fireflyframework.automation.workflow.model.TriggerType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A domain event published by the host application.
 *
 * @param eventId   unique per event; redelivery with the same id never produces a second run
 * @param patientId the patient concerned, or {@code null} for organization-wide events
 */
public record DomainEvent(
        String eventId,
        String organizationId,
        TriggerType type,
        String patientId,
        Map<String, Object> payload,
        Instant occurredAt
) implements Occurrence {

    public DomainEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(organizationId, "organizationId");
        Objects.requireNonNull(type, "type");
        if (!type.isEventBased()) {
            throw new IllegalArgumentException("Trigger type " + type + " is not an event trigger");
        }
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
        occurredAt = occurredAt != null ? occurredAt : Instant.now();
    }

    public static DomainEvent of(String organizationId, TriggerType type, String patientId,
                                 Map<String, Object> payload) {
        return new DomainEvent(UUID.randomUUID().toString(), organizationId, type, patientId, payload, Instant.now());
    }

    @Override
    public String occurrenceKey(TriggerType triggerType) {
        return "event:" + eventId;
    }
}
