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

import org.fireflyframework.automation.core.event.AppointmentReminderPublisher;
import org.fireflyframework.automation.core.event.AppointmentReminderPublisher.ReminderSummary;
import org.fireflyframework.automation.core.event.DomainEventGateway;
import org.fireflyframework.automation.integration.Appointment;
import org.fireflyframework.automation.integration.InMemoryAppointmentCalendar;
import org.fireflyframework.automation.workflow.engine.TriggerSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AppointmentReminderPublisherTest {

    private static final Instant NOW = Instant.parse("2026-03-10T09:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    @Mock
    private DomainEventGateway gateway;

    private InMemoryAppointmentCalendar calendar;
    private AppointmentReminderPublisher publisher;

    @BeforeEach
    void setUp() {
        calendar = new InMemoryAppointmentCalendar();
        publisher = new AppointmentReminderPublisher(gateway, calendar, Clock.fixed(NOW, ZoneOffset.UTC), 2);
    }

    private Appointment save(String id, LocalDate date) {
        return calendar.save(Appointment.scheduled(id, "org-1", "p-" + id, "Physio", date, null)).block();
    }

    @Test
    void failedReminder_staysEligibleWhileOthersGoOut() {
        save("a", TODAY);
        save("b", TODAY.plusDays(2));
        when(gateway.appointmentReminder(argThat(a -> a != null && a.id().equals("a")), eq(NOW)))
                .thenReturn(Mono.error(new IllegalStateException("patient store unavailable")));
        when(gateway.appointmentReminder(argThat(a -> a != null && a.id().equals("b")), eq(NOW)))
                .thenReturn(Mono.just(new TriggerSummary("event:reminder:b", List.of())));

        StepVerifier.create(publisher.publishReminders(TODAY))
                .expectNext(new ReminderSummary(2, 1))
                .verifyComplete();

        assertThat(calendar.findById("a").block().reminderSent()).isFalse();
        assertThat(calendar.findById("b").block().reminderSent()).isTrue();
    }

    @Test
    void appointmentsOutsideTheWindow_areNotReminded() {
        save("past", TODAY.minusDays(1));
        save("later", TODAY.plusDays(3));

        StepVerifier.create(publisher.publishReminders(TODAY))
                .expectNext(new ReminderSummary(0, 0))
                .verifyComplete();

        verify(gateway, never()).appointmentReminder(any(), any());
    }

    @Test
    void negativeWindow_isRejected() {
        assertThatThrownBy(() -> new AppointmentReminderPublisher(gateway, calendar, Clock.systemUTC(), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
