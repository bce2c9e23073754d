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

import org.fireflyframework.automation.core.template.TemplateRenderer;
import org.fireflyframework.automation.integration.FollowUpRequest;
import org.fireflyframework.automation.integration.FollowUpStore;
import org.fireflyframework.automation.integration.Patient;
import org.fireflyframework.automation.workflow.model.ActionSpec;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.fireflyframework.automation.workflow.action.Payloads.orDefault;
import static org.fireflyframework.automation.workflow.action.Payloads.put;
import static org.fireflyframework.automation.workflow.action.Payloads.string;

/**
 * CREATE_FOLLOW_UP and CREATE_TASK: both land in the follow-up list, marked as
 * auto-generated with the rule that produced them.
 */
public class FollowUpActionHandler implements ActionHandler {

    private final FollowUpStore followUpStore;
    private final TemplateRenderer renderer;
    private final ActionDefaults defaults;

    public FollowUpActionHandler(FollowUpStore followUpStore, TemplateRenderer renderer, ActionDefaults defaults) {
        this.followUpStore = followUpStore;
        this.renderer = renderer;
        this.defaults = defaults;
    }

    @Override
    public Map<String, Object> render(ActionSpec action, Patient patient, RunContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (action instanceof ActionSpec.CreateFollowUp followUp) {
            int due = followUp.dueInDays() != null ? followUp.dueInDays() : defaults.followUpDueInDays();
            payload.put("follow_up_type", orDefault(followUp.followUpType(), ActionDefaults.FOLLOW_UP_TYPE));
            payload.put("reason", renderer.render(orDefault(followUp.reason(), ActionDefaults.FOLLOW_UP_REASON),
                    context.context()));
            payload.put("priority", orDefault(followUp.priority(), defaults.priority()));
            payload.put("due_date", context.today().plusDays(due).toString());
            put(payload, "assigned_to", followUp.assignedTo());
            payload.put("trigger_rule", orDefault(followUp.triggerRule(), ActionDefaults.WORKFLOW_TRIGGER_RULE));
        } else if (action instanceof ActionSpec.CreateTask task) {
            int due = task.dueInDays() != null ? task.dueInDays() : defaults.taskDueInDays();
            payload.put("follow_up_type", orDefault(task.taskType(), ActionDefaults.TASK_TYPE));
            payload.put("reason", renderer.render(orDefault(task.description(), ActionDefaults.TASK_DESCRIPTION),
                    context.context()));
            payload.put("priority", orDefault(task.priority(), defaults.priority()));
            payload.put("due_date", context.today().plusDays(due).toString());
            put(payload, "assigned_to", task.assignedTo());
            payload.put("trigger_rule", orDefault(task.triggerRule(), ActionDefaults.WORKFLOW_TRIGGER_RULE));
        } else {
            throw ActionHandler.unsupported(this, action);
        }
        return payload;
    }

    @Override
    public Mono<String> apply(ActionSpec action, Map<String, Object> payload, Patient patient, RunContext context) {
        FollowUpRequest request = new FollowUpRequest(
                context.organizationId(),
                patient.id(),
                string(payload, "follow_up_type"),
                string(payload, "reason"),
                string(payload, "priority"),
                LocalDate.parse(string(payload, "due_date")),
                string(payload, "assigned_to"),
                true,
                string(payload, "trigger_rule"),
                context.workflowId());
        return followUpStore.createFollowUp(request);
    }
}
