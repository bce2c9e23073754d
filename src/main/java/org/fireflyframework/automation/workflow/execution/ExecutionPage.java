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

import java.util.List;

public record ExecutionPage(List<WorkflowExecution> items, int page, int limit, long total, int pages) {

    public ExecutionPage {
        items = List.copyOf(items);
    }

    public static ExecutionPage of(List<WorkflowExecution> all, int page, int limit) {
        int from = (int) Math.min((long) (page - 1) * limit, all.size());
        int to = Math.min(from + limit, all.size());
        int pages = (int) Math.ceil(all.size() / (double) limit);
        return new ExecutionPage(all.subList(from, to), page, limit, all.size(), pages);
    }
}
