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

import java.util.Map;

/**
 * Something that can start workflows: a domain event or the daily time tick.
 */
public sealed interface Occurrence permits DomainEvent, DailyTick {

    String organizationId();

    /**
     * Identifies this occurrence for one workflow trigger. At most one execution record
     * exists per workflow, patient and occurrence key.
     */
    String occurrenceKey(TriggerType triggerType);

    /** Data exposed to conditions under {@code event.*}. */
    Map<String, Object> payload();
}
