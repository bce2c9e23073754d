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

package org.fireflyframework.automation.workflow.execution;

import org.fireflyframework.automation.core.model.ScheduledActionStatus;
import org.fireflyframework.automation.workflow.model.ActionSpec;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * An action deferred by its {@code delayHours}, waiting in the scheduled-action store
 * until {@link #dueAt()}.
 */
public record ScheduledAction(
        String id,
        String executionId,
        String workflowId,
        String organizationId,
        String patientId,
        int actionIndex,
        ActionSpec action,
        Map<String, Object> triggerData,
        ScheduledActionStatus status,
        Instant dueAt,
        Instant createdAt,
        Instant processedAt,
        String errorMessage
) {
    public ScheduledAction {
        triggerData = triggerData != null ? Collections.unmodifiableMap(new LinkedHashMap<>(triggerData)) : Map.of();
    }

    public static ScheduledAction pending(String executionId, String workflowId, String organizationId,
                                          String patientId, int actionIndex, ActionSpec action,
                                          Map<String, Object> triggerData, Instant dueAt, Instant now) {
        return new ScheduledAction(UUID.randomUUID().toString(), executionId, workflowId, organizationId,
                patientId, actionIndex, action, triggerData, ScheduledActionStatus.PENDING, dueAt, now, null, null);
    }

    public ScheduledAction withStatus(ScheduledActionStatus newStatus, Instant at, String error) {
        return new ScheduledAction(id, executionId, workflowId, organizationId, patientId, actionIndex, action,
                triggerData, newStatus, dueAt, createdAt, at, error);
    }

    public boolean isDue(Instant now) {
        return status == ScheduledActionStatus.PENDING && !dueAt.isAfter(now);
    }
}
