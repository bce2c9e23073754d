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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.integration.Appointment;
import org.fireflyframework.automation.workflow.engine.AutomationEngine;
import org.fireflyframework.automation.workflow.engine.TriggerSummary;
import org.fireflyframework.automation.workflow.model.TriggerType;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for host applications publishing domain events.
 *
 * <p>Besides {@link #publish(DomainEvent)}, the gateway translates the raw state changes
 * a host application observes (an appointment changing status, a patient moving between
 * lifecycle stages) into the corresponding trigger events. Changes that map to no trigger
 * complete empty.
 */
@Slf4j
public class DomainEventGateway {

    private final AutomationEngine engine;

    public DomainEventGateway(AutomationEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public Mono<TriggerSummary> publish(DomainEvent event) {
        log.info("[event-gateway] Routing event '{}' organizationId={} patientId={}",
                event.type(), event.organizationId(), event.patientId());
        return engine.triggerWorkflow(event);
    }

    public Mono<TriggerSummary> patientCreated(String organizationId, String patientId, Map<String, Object> payload) {
        return publish(DomainEvent.of(organizationId, TriggerType.PATIENT_CREATED, patientId, payload));
    }

    /**
     * Publishes the trigger event for an appointment status change, if any.
     *
     * @param previousStatus the status before the change, {@code null} for a new appointment
     */
    public Mono<TriggerSummary> appointmentStatusChanged(String organizationId, String patientId,
                                                         String appointmentId, String appointmentType,
                                                         String previousStatus, String newStatus) {
        Optional<TriggerType> trigger = appointmentTrigger(previousStatus, newStatus);
        if (trigger.isEmpty()) {
            log.debug("[event-gateway] No trigger for appointment status change {} -> {}", previousStatus, newStatus);
            return Mono.empty();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("appointment_id", appointmentId);
        payload.put("appointment_type", appointmentType);
        payload.put("previous_status", previousStatus);
        payload.put("new_status", newStatus);
        return publish(DomainEvent.of(organizationId, trigger.get(), patientId, payload));
    }

    /**
     * Publishes the APPOINTMENT_SCHEDULED occurrence that reminds a patient of an upcoming
     * appointment. The payload carries {@code reminder = true} so workflows can tell it from
     * the booking itself, and the event id is derived from the appointment so a repeated
     * reminder for the same appointment never runs a workflow twice.
     */
    public Mono<TriggerSummary> appointmentReminder(Appointment appointment, Instant occurredAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("appointment_id", appointment.id());
        payload.put("appointment_type", appointment.appointmentType());
        payload.put("appointment_date", appointment.date().toString());
        if (appointment.time() != null) {
            payload.put("appointment_time", appointment.time().toString());
        }
        payload.put("reminder", true);
        return publish(new DomainEvent("reminder:" + appointment.id(), appointment.organizationId(),
                TriggerType.APPOINTMENT_SCHEDULED, appointment.patientId(), payload, occurredAt));
    }

    public Mono<TriggerSummary> lifecycleChanged(String organizationId, String patientId,
                                                 String previousStage, String newStage) {
        if (Objects.equals(previousStage, newStage)) {
            return Mono.empty();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("previous_lifecycle", previousStage);
        payload.put("new_lifecycle", newStage);
        return publish(DomainEvent.of(organizationId, TriggerType.LIFECYCLE_CHANGE, patientId, payload));
    }

    public Mono<TriggerSummary> customEvent(String organizationId, String patientId, String eventType,
                                            Map<String, Object> payload) {
        Map<String, Object> data = new LinkedHashMap<>(payload != null ? payload : Map.of());
        data.put("event_type", eventType);
        return publish(DomainEvent.of(organizationId, TriggerType.CUSTOM, patientId, data));
    }

    /**
     * Maps an appointment status transition to its trigger. Scheduling counts only for a
     * new appointment or one being re-booked after cancellation.
     */
    public static Optional<TriggerType> appointmentTrigger(String previousStatus, String newStatus) {
        if (newStatus == null || newStatus.equalsIgnoreCase(previousStatus)) {
            return Optional.empty();
        }
        String previous = previousStatus != null ? previousStatus.toUpperCase(Locale.ROOT) : null;
        return switch (newStatus.toUpperCase(Locale.ROOT)) {
            case "SCHEDULED", "CONFIRMED" -> previous == null || previous.equals("CANCELLED")
                    ? Optional.of(TriggerType.APPOINTMENT_SCHEDULED) : Optional.empty();
            case "COMPLETED" -> Optional.of(TriggerType.APPOINTMENT_COMPLETED);
            case "NO_SHOW" -> Optional.of(TriggerType.APPOINTMENT_MISSED);
            case "CANCELLED" -> Optional.of(TriggerType.APPOINTMENT_CANCELLED);
            default -> Optional.empty();
        };
    }
}
