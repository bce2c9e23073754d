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

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryAppointmentCalendar implements AppointmentCalendar {

    private final Map<String, Appointment> store = new ConcurrentHashMap<>();

    public Mono<Appointment> save(Appointment appointment) {
        return Mono.fromCallable(() -> {
            store.put(appointment.id(), appointment);
            return appointment;
        });
    }

    public Mono<Appointment> findById(String appointmentId) {
        return Mono.justOrEmpty(store.get(appointmentId));
    }

    @Override
    public Flux<Appointment> findAwaitingReminder(LocalDate from, LocalDate to) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(store.values()))
                .filter(a -> a.isScheduled() && !a.reminderSent())
                .filter(a -> !a.date().isBefore(from) && !a.date().isAfter(to))
                .sort(Comparator.comparing(Appointment::date).thenComparing(Appointment::id)));
    }

    @Override
    public Mono<Void> markReminderSent(String appointmentId) {
        return Mono.fromRunnable(() -> store.computeIfPresent(appointmentId, (id, a) -> a.withReminderSent()));
    }
}
