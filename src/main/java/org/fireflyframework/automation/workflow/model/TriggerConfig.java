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

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Trigger-specific filters and parameters. Every field is optional; unset fields
 * fall back to the engine defaults.
 *
 * @param appointmentType restricts appointment triggers to one appointment type
 * @param fromStage       LIFECYCLE_CHANGE: required previous stage
 * @param toStage         LIFECYCLE_CHANGE: required new stage
 * @param eventType       CUSTOM: the custom event name to match
 * @param days            DAYS_SINCE_VISIT: days after the last visit
 * @param daysBefore      BIRTHDAY: how many days ahead of the birthday to fire
 * @param excludeStatuses time triggers: patient statuses never considered
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriggerConfig(
        String appointmentType,
        String fromStage,
        String toStage,
        String eventType,
        Integer days,
        Integer daysBefore,
        List<String> excludeStatuses
) {
    public TriggerConfig {
        excludeStatuses = excludeStatuses != null ? List.copyOf(excludeStatuses) : null;
    }

    public static TriggerConfig empty() {
        return new TriggerConfig(null, null, null, null, null, null, null);
    }

    public static TriggerConfig daysSinceVisit(int days) {
        return new TriggerConfig(null, null, null, null, days, null, null);
    }

    public static TriggerConfig birthday(int daysBefore) {
        return new TriggerConfig(null, null, null, null, null, daysBefore, null);
    }

    public static TriggerConfig lifecycleChange(String fromStage, String toStage) {
        return new TriggerConfig(null, fromStage, toStage, null, null, null, null);
    }

    public static TriggerConfig appointmentType(String appointmentType) {
        return new TriggerConfig(appointmentType, null, null, null, null, null, null);
    }

    public static TriggerConfig customEvent(String eventType) {
        return new TriggerConfig(null, null, null, eventType, null, null, null);
    }

    public int daysOr(int fallback) {
        return days != null ? days : fallback;
    }

    public int daysBeforeOr(int fallback) {
        return daysBefore != null ? daysBefore : fallback;
    }

    public List<String> excludeStatusesOr(List<String> fallback) {
        return excludeStatuses != null ? excludeStatuses : fallback;
    }

    public TriggerConfig withExcludeStatuses(List<String> statuses) {
        return new TriggerConfig(appointmentType, fromStage, toStage, eventType, days, daysBefore, statuses);
    }
}
