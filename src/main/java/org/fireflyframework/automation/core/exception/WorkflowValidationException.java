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

import org.fireflyframework.automation.core.validation.ValidationIssue;

import java.util.List;
import java.util.stream.Collectors;

public final class WorkflowValidationException extends AutomationException {
    private final List<ValidationIssue> issues;

    public WorkflowValidationException(List<ValidationIssue> issues) {
        super("Workflow validation failed: " + issues.stream()
                        .map(i -> i.message() + " (" + i.location() + ")")
                        .collect(Collectors.joining("; ")),
                "AUTOMATION_WORKFLOW_INVALID");
        this.issues = List.copyOf(issues);
    }

    public WorkflowValidationException(String location, String message, Throwable cause) {
        super("Workflow validation failed: " + message + " (" + location + ")",
                "AUTOMATION_WORKFLOW_INVALID", cause);
        this.issues = List.of(new ValidationIssue(ValidationIssue.Severity.ERROR, message, location));
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }
}
