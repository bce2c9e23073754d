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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.workflow.action.ActionResult;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

public class AutomationMetrics implements AutomationEvents {
    private static final String PREFIX = "firefly.automation";
    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public AutomationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onExecutionStarted(String workflowName, String executionId, String patientId) {
        counter("executions.started", "workflow", workflowName).increment();
    }

    @Override
    public void onExecutionCompleted(String workflowName, String executionId, ExecutionStatus status, long durationMs) {
        counter("executions.completed", "workflow", workflowName, "status", status.name()).increment();
        timer("executions.duration", "workflow", workflowName).record(Duration.ofMillis(durationMs));
    }

    @Override
    public void onExecutionSkipped(String workflowName, String executionId, String patientId, String reason) {
        counter("executions.completed", "workflow", workflowName, "status", ExecutionStatus.SKIPPED.name()).increment();
    }

    @Override
    public void onActionCompleted(String workflowName, String executionId, ActionResult result) {
        counter("actions.completed", "workflow", workflowName, "type", result.type().name(),
                "status", result.status().name()).increment();
    }

    @Override
    public void onWorkflowError(String workflowName, Throwable error) {
        counter("workflow.errors", "workflow", workflowName).increment();
    }

    @Override
    public void onActionScheduled(String workflowName, String executionId, String scheduledActionId, Instant dueAt) {
        counter("actions.scheduled", "workflow", workflowName).increment();
    }

    @Override
    public void onScheduledActionProcessed(String workflowId, String scheduledActionId, boolean success) {
        counter("scheduled-actions.processed", "success", String.valueOf(success)).increment();
    }

    @Override
    public void onExecutionRecovered(String workflowId, String executionId, ExecutionStatus previousStatus) {
        counter("executions.recovered", "previousStatus", previousStatus.name()).increment();
    }

    private Counter counter(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }

    private Timer timer(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return timers.computeIfAbsent(key, k -> Timer.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }
}
