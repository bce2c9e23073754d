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
import org.fireflyframework.automation.integration.AppointmentCalendar;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Publishes reminder occurrences for appointments coming up within the reminder window.
 *
 * <p>An appointment is flagged as reminded only after its occurrence was processed, so a
 * failure leaves it eligible for the next pass. A failure for one appointment is logged
 * and the others still go out.
 */
@Slf4j
public class AppointmentReminderPublisher {

    /** Outcome of one reminder pass. */
    public record ReminderSummary(long checked, long sent) {
    }

    private final DomainEventGateway gateway;
    private final AppointmentCalendar calendar;
    private final Clock clock;
    private final int windowDays;

    /**
     * @param windowDays how many days past today still count as upcoming
     */
    public AppointmentReminderPublisher(DomainEventGateway gateway, AppointmentCalendar calendar, Clock clock,
                                        int windowDays) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.calendar = Objects.requireNonNull(calendar, "calendar");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (windowDays < 0) {
            throw new IllegalArgumentException("windowDays must not be negative, got: " + windowDays);
        }
        this.windowDays = windowDays;
    }

    public Mono<ReminderSummary> publishReminders(LocalDate today) {
        return calendar.findAwaitingReminder(today, today.plusDays(windowDays))
                .concatMap(appointment -> remind(appointment)
                        .thenReturn(true)
                        .onErrorResume(e -> {
                            log.error("[reminders] reminder failed appointmentId={}: {}",
                                    appointment.id(), e.getMessage(), e);
                            return Mono.just(false);
                        }))
                .reduce(new ReminderSummary(0, 0), (summary, sent) ->
                        new ReminderSummary(summary.checked() + 1, summary.sent() + (sent ? 1 : 0)))
                .doOnNext(summary -> log.info("[reminders] appointments checked={} reminded={}",
                        summary.checked(), summary.sent()));
    }

    private Mono<Void> remind(Appointment appointment) {
        return gateway.appointmentReminder(appointment, clock.instant())
                .then(calendar.markReminderSent(appointment.id()));
    }
}
