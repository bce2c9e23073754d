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

package org.fireflyframework.automation.workflow.service;

import org.fireflyframework.automation.workflow.model.TriggerType;

/**
 * Filters and paging for listing an organization's workflows.
 *
 * @param active      only active or only inactive workflows; {@code null} for both
 * @param triggerType only workflows with this trigger; {@code null} for all
 */
public record WorkflowQuery(Boolean active, TriggerType triggerType, int page, int limit) {

    public static WorkflowQuery all() {
        return new WorkflowQuery(null, null, 1, 50);
    }

    public WorkflowQuery withActive(Boolean newActive) {
        return new WorkflowQuery(newActive, triggerType, page, limit);
    }

    public WorkflowQuery withTriggerType(TriggerType newTriggerType) {
        return new WorkflowQuery(active, newTriggerType, page, limit);
    }

    public WorkflowQuery withPage(int newPage, int newLimit) {
        return new WorkflowQuery(active, triggerType, newPage, newLimit);
    }
}
