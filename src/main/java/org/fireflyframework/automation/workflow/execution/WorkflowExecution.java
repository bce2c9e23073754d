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

import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.workflow.action.ActionResult;
import org.fireflyframework.automation.workflow.model.TriggerType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Durable record of one workflow run for one patient and one occurrence.
 *
 * <p>Lifecycle: {@code PENDING -> RUNNING -> COMPLETED | FAILED}, or {@code PENDING -> FAILED}.
 * Records may also be created directly as {@code SKIPPED} (run limit reached) or
 * {@code FAILED} (conditions could not be evaluated). A run whose actions partially
 * failed is still {@code COMPLETED}; the failures are in {@link #actionResults()}.
 */
public record WorkflowExecution(
        String id,
        String workflowId,
        String organizationId,
        String patientId,
        String occurrenceKey,
        TriggerType triggerType,
        Map<String, Object> triggerSnapshot,
        ExecutionStatus status,
        List<ActionResult> actionResults,
        int totalSteps,
        String errorMessage,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt
) {
    public WorkflowExecution {
        triggerSnapshot = triggerSnapshot != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(triggerSnapshot)) : Map.of();
        actionResults = actionResults != null ? List.copyOf(actionResults) : List.of();
    }

    public static WorkflowExecution pending(String workflowId, String organizationId, String patientId,
                                            String occurrenceKey, TriggerType triggerType,
                                            Map<String, Object> triggerSnapshot, int totalSteps, Instant now) {
        return new WorkflowExecution(UUID.randomUUID().toString(), workflowId, organizationId, patientId,
                occurrenceKey, triggerType, triggerSnapshot, ExecutionStatus.PENDING, List.of(), totalSteps,
                null, now, null, null);
    }

    public static WorkflowExecution failed(String workflowId, String organizationId, String patientId,
                                           String occurrenceKey, TriggerType triggerType,
                                           Map<String, Object> triggerSnapshot, int totalSteps,
                                           String errorMessage, Instant now) {
        return new WorkflowExecution(UUID.randomUUID().toString(), workflowId, organizationId, patientId,
                occurrenceKey, triggerType, triggerSnapshot, ExecutionStatus.FAILED, List.of(), totalSteps,
                errorMessage, now, null, now);
    }

    public WorkflowExecution skip(String reason) {
        return new WorkflowExecution(id, workflowId, organizationId, patientId, occurrenceKey, triggerType,
                triggerSnapshot, ExecutionStatus.SKIPPED, List.of(), totalSteps, reason, createdAt, null, createdAt);
    }

    public WorkflowExecution start(Instant now) {
        return new WorkflowExecution(id, workflowId, organizationId, patientId, occurrenceKey, triggerType,
                triggerSnapshot, ExecutionStatus.RUNNING, actionResults, totalSteps, errorMessage, createdAt, now, null);
    }

    public WorkflowExecution complete(List<ActionResult> results, Instant now) {
        return new WorkflowExecution(id, workflowId, organizationId, patientId, occurrenceKey, triggerType,
                triggerSnapshot, ExecutionStatus.COMPLETED, results, totalSteps, errorMessage, createdAt, startedAt, now);
    }

    public WorkflowExecution fail(String error, Instant now) {
        return new WorkflowExecution(id, workflowId, organizationId, patientId, occurrenceKey, triggerType,
                triggerSnapshot, ExecutionStatus.FAILED, actionResults, totalSteps, error, createdAt, startedAt, now);
    }

    public long actionsCompleted() {
        return actionResults.stream().filter(ActionResult::success).count();
    }

    public long actionsFailed() {
        return actionResults.stream().filter(r -> !r.success()).count();
    }

    public Instant lastActivity() {
        if (completedAt != null) {
            return completedAt;
        }
        return startedAt != null ? startedAt : createdAt;
    }
}
