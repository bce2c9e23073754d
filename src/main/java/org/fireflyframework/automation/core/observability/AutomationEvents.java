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

package org.fireflyframework.automation.core.observability;

import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.workflow.action.ActionResult;

import java.time.Instant;

public interface AutomationEvents {
    // Runs
    default void onExecutionStarted(String workflowName, String executionId, String patientId) {}
    default void onActionCompleted(String workflowName, String executionId, ActionResult result) {}
    default void onExecutionCompleted(String workflowName, String executionId, ExecutionStatus status, long durationMs) {}
    default void onExecutionSkipped(String workflowName, String executionId, String patientId, String reason) {}
    default void onConditionsNotMet(String workflowName, String patientId) {}
    default void onWorkflowError(String workflowName, Throwable error) {}

    // Delayed actions
    default void onActionScheduled(String workflowName, String executionId, String scheduledActionId, Instant dueAt) {}
    default void onScheduledActionProcessed(String workflowId, String scheduledActionId, boolean success) {}

    // Recovery
    default void onExecutionRecovered(String workflowId, String executionId, ExecutionStatus previousStatus) {}
}
