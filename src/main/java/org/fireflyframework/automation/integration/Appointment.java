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
import java.time.LocalTime;
import java.util.Objects;

/**
 * A booked appointment as seen by the reminder job.
 *
 * @param time           start time, {@code null} when only the date is known
 * @param status         host status, for example {@code SCHEDULED} or {@code CANCELLED}
 * @param reminderSent   set once a reminder occurrence has been published
 */
public record Appointment(
        String id,
        String organizationId,
        String patientId,
        String appointmentType,
        LocalDate date,
        LocalTime time,
        String status,
        boolean reminderSent
) {

    public static final String SCHEDULED = "SCHEDULED";

    public Appointment {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(organizationId, "organizationId");
        Objects.requireNonNull(date, "date");
    }

    public static Appointment scheduled(String id, String organizationId, String patientId,
                                        String appointmentType, LocalDate date, LocalTime time) {
        return new Appointment(id, organizationId, patientId, appointmentType, date, time, SCHEDULED, false);
    }

    public boolean isScheduled() {
        return SCHEDULED.equalsIgnoreCase(status);
    }

    public Appointment withReminderSent() {
        return new Appointment(id, organizationId, patientId, appointmentType, date, time, status, true);
    }
}
