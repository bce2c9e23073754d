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

package org.fireflyframework.automation.workflow.action;

import java.time.LocalDate;
import java.util.Map;

/**
 * Per-run data shared by the actions of one execution.
 *
 * @param executionId {@code null} during a dry run
 * @param today       the date due dates are computed from
 * @param context     the patient context used for template rendering
 */
public record RunContext(
        String workflowId,
        String workflowName,
        String organizationId,
        String executionId,
        LocalDate today,
        Map<String, Object> context
) {
    public RunContext {
        context = context != null ? context : Map.of();
    }
}
