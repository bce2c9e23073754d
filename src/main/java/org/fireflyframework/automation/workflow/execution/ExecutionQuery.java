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

/**
 * Paging request for execution history.
 *
 * @param page   1-based page number; values below 1 are read as 1
 * @param limit  page size; {@code null} or non-positive means the configured default
 * @param status optional status filter
 */
public record ExecutionQuery(int page, Integer limit, ExecutionStatus status) {

    public static ExecutionQuery firstPage() {
        return new ExecutionQuery(1, null, null);
    }

    public static ExecutionQuery of(int page, int limit) {
        return new ExecutionQuery(page, limit, null);
    }

    public ExecutionQuery withStatus(ExecutionStatus newStatus) {
        return new ExecutionQuery(page, limit, newStatus);
    }
}
