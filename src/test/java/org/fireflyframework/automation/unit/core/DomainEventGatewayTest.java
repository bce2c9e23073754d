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

package org.fireflyframework.automation.unit.core;

import org.fireflyframework.automation.core.event.DomainEvent;
import org.fireflyframework.automation.core.event.DomainEventGateway;
import org.fireflyframework.automation.integration.Appointment;
import org.fireflyframework.automation.workflow.engine.AutomationEngine;
import org.fireflyframework.automation.workflow.engine.TriggerSummary;
import org.fireflyframework.automation.workflow.model.TriggerType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DomainEventGatewayTest {

    @Mock
    private AutomationEngine engine;

    @Test
    void appointmentTrigger_mapsStatusTransitions() {
        assertThat(DomainEventGateway.appointmentTrigger(null, "SCHEDULED")).contains(TriggerType.APPOINTMENT_SCHEDULED);
        assertThat(DomainEventGateway.appointmentTrigger("CANCELLED", "confirmed"))
                .contains(TriggerType.APPOINTMENT_SCHEDULED);
        assertThat(DomainEventGateway.appointmentTrigger("SCHEDULED", "CONFIRMED")).isEmpty();
        assertThat(DomainEventGateway.appointmentTrigger("CONFIRMED", "COMPLETED"))
                .contains(TriggerType.APPOINTMENT_COMPLETED);
        assertThat(DomainEventGateway.appointmentTrigger("CONFIRMED", "NO_SHOW"))
                .contains(TriggerType.APPOINTMENT_MISSED);
        assertThat(DomainEventGateway.appointmentTrigger("SCHEDULED", "CANCELLED"))
                .contains(TriggerType.APPOINTMENT_CANCELLED);
        assertThat(DomainEventGateway.appointmentTrigger("NO_SHOW", "no_show")).isEmpty();
        assertThat(DomainEventGateway.appointmentTrigger("SCHEDULED", "ARRIVED")).isEmpty();
        assertThat(DomainEventGateway.appointmentTrigger("SCHEDULED", null)).isEmpty();
    }

    @Test
    void appointmentStatusChanged_publishesEventWithAppointmentPayload() {
        when(engine.triggerWorkflow(any())).thenReturn(Mono.just(new TriggerSummary("event:x", List.of())));
        var gateway = new DomainEventGateway(engine);

        StepVerifier.create(gateway.appointmentStatusChanged("org-1", "p-1", "appt-9", "Physio", "CONFIRMED", "NO_SHOW"))
                .expectNextCount(1)
                .verifyComplete();

        var captor = ArgumentCaptor.forClass(DomainEvent.class);
        verify(engine).triggerWorkflow(captor.capture());
        DomainEvent event = captor.getValue();
        assertThat(event.type()).isEqualTo(TriggerType.APPOINTMENT_MISSED);
        assertThat(event.organizationId()).isEqualTo("org-1");
        assertThat(event.patientId()).isEqualTo("p-1");
        assertThat(event.payload()).containsEntry("appointment_id", "appt-9")
                .containsEntry("appointment_type", "Physio")
                .containsEntry("new_status", "NO_SHOW");
    }

    @Test
    void unmappedChanges_completeEmptyWithoutTouchingTheEngine() {
        var gateway = new DomainEventGateway(engine);

        StepVerifier.create(gateway.appointmentStatusChanged("org-1", "p-1", "appt-9", null, "SCHEDULED", "ARRIVED"))
                .verifyComplete();
        StepVerifier.create(gateway.lifecycleChanged("org-1", "p-1", "ACTIVE", "ACTIVE"))
                .verifyComplete();

        verifyNoInteractions(engine);
    }

    @Test
    void customEvent_carriesEventType() {
        when(engine.triggerWorkflow(any())).thenReturn(Mono.just(new TriggerSummary("event:x", List.of())));
        var gateway = new DomainEventGateway(engine);

        gateway.customEvent("org-1", "p-1", "review_left", Map.of("stars", 5)).block();

        var captor = ArgumentCaptor.forClass(DomainEvent.class);
        verify(engine).triggerWorkflow(captor.capture());
        assertThat(captor.getValue().type()).isEqualTo(TriggerType.CUSTOM);
        assertThat(captor.getValue().payload()).containsEntry("event_type", "review_left").containsEntry("stars", 5);
    }

    @Test
    void appointmentReminder_publishesScheduledEventFlaggedAsReminder() {
        when(engine.triggerWorkflow(any())).thenReturn(Mono.just(new TriggerSummary("event:x", List.of())));
        var gateway = new DomainEventGateway(engine);
        Instant now = Instant.parse("2026-03-10T09:00:00Z");

        gateway.appointmentReminder(Appointment.scheduled("appt-7", "org-1", "p-1", "Physio",
                LocalDate.of(2026, 3, 11), LocalTime.of(14, 30)), now).block();

        var captor = ArgumentCaptor.forClass(DomainEvent.class);
        verify(engine).triggerWorkflow(captor.capture());
        DomainEvent event = captor.getValue();
        assertThat(event.eventId()).isEqualTo("reminder:appt-7");
        assertThat(event.type()).isEqualTo(TriggerType.APPOINTMENT_SCHEDULED);
        assertThat(event.occurredAt()).isEqualTo(now);
        assertThat(event.payload()).containsEntry("reminder", true)
                .containsEntry("appointment_date", "2026-03-11")
                .containsEntry("appointment_time", "14:30")
                .containsEntry("appointment_type", "Physio");
    }
}
