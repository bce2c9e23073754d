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

package org.fireflyframework.automation.core.exception;

/**
 * Raised by an execution store when a record already exists for the same
 * workflow, patient and occurrence.
 */
public final class DuplicateExecutionException extends AutomationException {
    private final String workflowId;
    private final String patientId;
    private final String occurrenceKey;

    public DuplicateExecutionException(String workflowId, String patientId, String occurrenceKey) {
        super("Execution already recorded for workflow '" + workflowId + "', patient '" + patientId
                + "', occurrence '" + occurrenceKey + "'", "AUTOMATION_DUPLICATE_EXECUTION");
        this.workflowId = workflowId;
        this.patientId = patientId;
        this.occurrenceKey = occurrenceKey;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getPatientId() {
        return patientId;
    }

    public String getOccurrenceKey() {
        return occurrenceKey;
    }
}
