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

package org.fireflyframework.automation.workflow.model;

/**
 * What starts a workflow. Event triggers react to a single domain event; time
 * triggers are evaluated once per day against the organization's patients.
 */
public enum TriggerType {
    PATIENT_CREATED(Family.EVENT),
    APPOINTMENT_SCHEDULED(Family.EVENT),
    APPOINTMENT_COMPLETED(Family.EVENT),
    APPOINTMENT_MISSED(Family.EVENT),
    APPOINTMENT_CANCELLED(Family.EVENT),
    LIFECYCLE_CHANGE(Family.EVENT),
    CUSTOM(Family.EVENT),
    DAYS_SINCE_VISIT(Family.TIME),
    BIRTHDAY(Family.TIME);

    public enum Family {
        EVENT,
        TIME
    }

    private final Family family;

    TriggerType(Family family) {
        this.family = family;
    }

    public Family family() {
        return family;
    }

    public boolean isTimeBased() {
        return family == Family.TIME;
    }

    public boolean isEventBased() {
        return family == Family.EVENT;
    }

    public boolean isAppointmentTrigger() {
        return this == APPOINTMENT_SCHEDULED || this == APPOINTMENT_COMPLETED
                || this == APPOINTMENT_MISSED || this == APPOINTMENT_CANCELLED;
    }
}
