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

package org.fireflyframework.automation.workflow.engine;

import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.workflow.execution.WorkflowExecution;

import java.util.List;

/**
 * The execution records produced by one occurrence across all matching workflows.
 * Workflows whose trigger or conditions did not match leave no record.
 */
public record TriggerSummary(String occurrence, List<WorkflowExecution> executions) {

    public TriggerSummary {
        executions = List.copyOf(executions);
    }

    public long count(ExecutionStatus status) {
        return executions.stream().filter(e -> e.status() == status).count();
    }

    public long completed() {
        return count(ExecutionStatus.COMPLETED);
    }

    public long skipped() {
        return count(ExecutionStatus.SKIPPED);
    }

    public long failed() {
        return count(ExecutionStatus.FAILED);
    }
}
