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

import java.util.List;

/**
 * Values used when an action leaves an optional field unset.
 */
public record ActionDefaults(
        int followUpDueInDays,
        int taskDueInDays,
        String priority,
        List<String> staffRoles
) {
    public static final String FOLLOW_UP_TYPE = "CUSTOM";
    public static final String TASK_TYPE = "TASK";
    public static final String FOLLOW_UP_REASON = "Automated follow-up";
    public static final String TASK_DESCRIPTION = "Automated task";
    public static final String WORKFLOW_TRIGGER_RULE = "Workflow automation";
    public static final String STAFF_TRIGGER_RULE = "Staff notification";

    public ActionDefaults {
        staffRoles = List.copyOf(staffRoles);
    }

    public static ActionDefaults standard() {
        return new ActionDefaults(7, 1, "MEDIUM", List.of("ADMIN", "PRACTITIONER"));
    }
}
