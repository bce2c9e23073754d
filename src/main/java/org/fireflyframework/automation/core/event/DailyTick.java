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

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;

/**
 * The once-per-day evaluation of time triggers for one organization.
 */
public record DailyTick(String organizationId, LocalDate asOfDate) implements Occurrence {

    public DailyTick {
        Objects.requireNonNull(organizationId, "organizationId");
        Objects.requireNonNull(asOfDate, "asOfDate");
    }

    @Override
    public String occurrenceKey(TriggerType triggerType) {
        return "tick:" + triggerType + ":" + asOfDate;
    }

    @Override
    public Map<String, Object> payload() {
        return Map.of("as_of_date", asOfDate.toString());
    }
}
