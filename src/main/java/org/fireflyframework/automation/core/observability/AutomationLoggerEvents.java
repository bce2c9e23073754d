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
import java.util.Locale;

@Slf4j
public class AutomationLoggerEvents implements AutomationEvents {
    @Override
    public void onExecutionStarted(String workflowName, String executionId, String patientId) {
        log.info("[automation] execution.started workflow={} executionId={} patientId={}", workflowName, executionId, patientId);
    }
    @Override
    public void onActionCompleted(String workflowName, String executionId, ActionResult result) {
        if (result.success()) {
            log.info("[automation] action.{} workflow={} executionId={} index={} type={} sideEffectId={}",
                    result.status().name().toLowerCase(Locale.ROOT), workflowName, executionId, result.index(), result.type(), result.sideEffectId());
        } else {
            log.warn("[automation] action.failed workflow={} executionId={} index={} type={} error={}",
                    workflowName, executionId, result.index(), result.type(), result.error());
        }
    }
    @Override
    public void onExecutionCompleted(String workflowName, String executionId, ExecutionStatus status, long durationMs) {
        log.info("[automation] execution.completed workflow={} executionId={} status={} durationMs={}", workflowName, executionId, status, durationMs);
    }
    @Override
    public void onExecutionSkipped(String workflowName, String executionId, String patientId, String reason) {
        log.info("[automation] execution.skipped workflow={} executionId={} patientId={} reason={}", workflowName, executionId, patientId, reason);
    }
    @Override
    public void onConditionsNotMet(String workflowName, String patientId) {
        log.debug("[automation] conditions.not-met workflow={} patientId={}", workflowName, patientId);
    }
    @Override
    public void onWorkflowError(String workflowName, Throwable error) {
        log.error("[automation] workflow.error workflow={} error={}", workflowName, error.getMessage(), error);
    }
    @Override
    public void onActionScheduled(String workflowName, String executionId, String scheduledActionId, Instant dueAt) {
        log.info("[automation] action.scheduled workflow={} executionId={} scheduledActionId={} dueAt={}", workflowName, executionId, scheduledActionId, dueAt);
    }
    @Override
    public void onScheduledActionProcessed(String workflowId, String scheduledActionId, boolean success) {
        log.info("[automation] scheduled-action.processed workflowId={} scheduledActionId={} success={}", workflowId, scheduledActionId, success);
    }
    @Override
    public void onExecutionRecovered(String workflowId, String executionId, ExecutionStatus previousStatus) {
        log.warn("[recovery] execution.interrupted workflowId={} executionId={} previousStatus={}", workflowId, executionId, previousStatus);
    }
}
