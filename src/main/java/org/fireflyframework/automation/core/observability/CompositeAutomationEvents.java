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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.workflow.action.ActionResult;

import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

@Slf4j
public class CompositeAutomationEvents implements AutomationEvents {
    private final List<AutomationEvents> delegates;

    public CompositeAutomationEvents(List<AutomationEvents> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    private void safeForEach(Consumer<AutomationEvents> action) {
        for (var d : delegates) {
            try { action.accept(d); }
            catch (Exception e) { log.warn("[composite-events] Delegate {} failed: {}", d.getClass().getSimpleName(), e.getMessage()); }
        }
    }

    @Override public void onExecutionStarted(String workflowName, String executionId, String patientId) { safeForEach(d -> d.onExecutionStarted(workflowName, executionId, patientId)); }
    @Override public void onActionCompleted(String workflowName, String executionId, ActionResult result) { safeForEach(d -> d.onActionCompleted(workflowName, executionId, result)); }
    @Override public void onExecutionCompleted(String workflowName, String executionId, ExecutionStatus status, long durationMs) { safeForEach(d -> d.onExecutionCompleted(workflowName, executionId, status, durationMs)); }
    @Override public void onExecutionSkipped(String workflowName, String executionId, String patientId, String reason) { safeForEach(d -> d.onExecutionSkipped(workflowName, executionId, patientId, reason)); }
    @Override public void onConditionsNotMet(String workflowName, String patientId) { safeForEach(d -> d.onConditionsNotMet(workflowName, patientId)); }
    @Override public void onWorkflowError(String workflowName, Throwable error) { safeForEach(d -> d.onWorkflowError(workflowName, error)); }
    @Override public void onActionScheduled(String workflowName, String executionId, String scheduledActionId, Instant dueAt) { safeForEach(d -> d.onActionScheduled(workflowName, executionId, scheduledActionId, dueAt)); }
    @Override public void onScheduledActionProcessed(String workflowId, String scheduledActionId, boolean success) { safeForEach(d -> d.onScheduledActionProcessed(workflowId, scheduledActionId, success)); }
    @Override public void onExecutionRecovered(String workflowId, String executionId, ExecutionStatus previousStatus) { safeForEach(d -> d.onExecutionRecovered(workflowId, executionId, previousStatus)); }

    public List<AutomationEvents> getDelegates() {
        return delegates;
    }
}
