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

package org.fireflyframework.automation.workflow.builder;

import org.fireflyframework.automation.workflow.model.ActionSpec;
import org.fireflyframework.automation.workflow.model.ConditionClause;
import org.fireflyframework.automation.workflow.model.ConditionLogic;
import org.fireflyframework.automation.workflow.model.ConditionOperator;
import org.fireflyframework.automation.workflow.model.TriggerConfig;
import org.fireflyframework.automation.workflow.model.TriggerType;
import org.fireflyframework.automation.workflow.model.Workflow;

import java.util.ArrayList;
import java.util.List;

public class WorkflowBuilder {

    private final String name;
    private String id;
    private String organizationId;
    private String description = "";
    private TriggerType triggerType;
    private TriggerConfig triggerConfig = TriggerConfig.empty();
    private boolean active = true;
    private int maxRunsPerPatient = Workflow.DEFAULT_MAX_RUNS_PER_PATIENT;
    private String createdBy;
    private final List<ConditionClause> conditions = new ArrayList<>();
    private final List<ActionSpec> actions = new ArrayList<>();

    public WorkflowBuilder(String name) {
        this.name = name;
    }

    public WorkflowBuilder id(String id) {
        this.id = id;
        return this;
    }

    public WorkflowBuilder organization(String organizationId) {
        this.organizationId = organizationId;
        return this;
    }

    public WorkflowBuilder description(String description) {
        this.description = description;
        return this;
    }

    public WorkflowBuilder trigger(TriggerType triggerType) {
        this.triggerType = triggerType;
        return this;
    }

    public WorkflowBuilder trigger(TriggerType triggerType, TriggerConfig config) {
        this.triggerType = triggerType;
        this.triggerConfig = config != null ? config : TriggerConfig.empty();
        return this;
    }

    public WorkflowBuilder active(boolean active) {
        this.active = active;
        return this;
    }

    public WorkflowBuilder maxRunsPerPatient(int maxRunsPerPatient) {
        this.maxRunsPerPatient = maxRunsPerPatient;
        return this;
    }

    public WorkflowBuilder createdBy(String createdBy) {
        this.createdBy = createdBy;
        return this;
    }

    /** AND-ed into the current condition group. */
    public WorkflowBuilder when(String field, ConditionOperator operator, Object value) {
        conditions.add(new ConditionClause(field, operator, value, ConditionLogic.AND));
        return this;
    }

    /** Opens a new OR group. */
    public WorkflowBuilder orWhen(String field, ConditionOperator operator, Object value) {
        conditions.add(new ConditionClause(field, operator, value, ConditionLogic.OR));
        return this;
    }

    public WorkflowBuilder action(ActionSpec action) {
        actions.add(action);
        return this;
    }

    public WorkflowBuilder sendSms(String template) {
        return action(new ActionSpec.SendSms(template));
    }

    public WorkflowBuilder sendEmail(String subject, String body) {
        return action(new ActionSpec.SendEmail(subject, body));
    }

    public WorkflowBuilder createFollowUp(String reason, int dueInDays) {
        return action(new ActionSpec.CreateFollowUp(reason, dueInDays));
    }

    public WorkflowBuilder createTask(String description, int dueInDays) {
        return action(new ActionSpec.CreateTask(description, dueInDays));
    }

    public WorkflowBuilder updateStatus(String status) {
        return action(new ActionSpec.UpdateStatus(status));
    }

    public WorkflowBuilder updateLifecycle(String stage) {
        return action(new ActionSpec.UpdateLifecycle(stage));
    }

    public WorkflowBuilder addTag(String tag) {
        return action(new ActionSpec.AddTag(tag));
    }

    public WorkflowBuilder notifyStaff(String message, String... roles) {
        return action(new ActionSpec.NotifyStaff(message, roles.length == 0 ? null : List.of(roles)));
    }

    public Workflow build() {
        return new Workflow(id, organizationId, name, description, triggerType, triggerConfig,
                List.copyOf(conditions), List.copyOf(actions), active, maxRunsPerPatient,
                createdBy, null, null);
    }
}
