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

package org.fireflyframework.automation.workflow.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.fireflyframework.automation.workflow.builder.WorkflowBuilder;

import java.time.Instant;
import java.util.List;

/**
 * An organization's automation rule: one trigger, an ordered list of conditions and
 * an ordered list of actions. List order of {@code actions} is execution order.
 *
 * <p>{@code maxRunsPerPatient} bounds how many times the workflow may run for one
 * patient; {@code 0} means unlimited. Unset values default to {@code active = true}
 * and {@code maxRunsPerPatient = 1}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Workflow(
        String id,
        String organizationId,
        String name,
        String description,
        TriggerType triggerType,
        TriggerConfig triggerConfig,
        List<ConditionClause> conditions,
        List<ActionSpec> actions,
        @JsonAlias("is_active") Boolean active,
        Integer maxRunsPerPatient,
        String createdBy,
        Instant createdAt,
        Instant updatedAt
) {
    public static final int DEFAULT_MAX_RUNS_PER_PATIENT = 1;

    public Workflow {
        triggerConfig = triggerConfig != null ? triggerConfig : TriggerConfig.empty();
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
        actions = actions != null ? List.copyOf(actions) : List.of();
        active = active != null ? active : Boolean.TRUE;
        maxRunsPerPatient = maxRunsPerPatient != null ? maxRunsPerPatient : DEFAULT_MAX_RUNS_PER_PATIENT;
    }

    public static WorkflowBuilder builder(String name) {
        return new WorkflowBuilder(name);
    }

    @JsonIgnore
    public boolean isUnlimited() {
        return maxRunsPerPatient == 0;
    }

    public Workflow withId(String newId) {
        return new Workflow(newId, organizationId, name, description, triggerType, triggerConfig,
                conditions, actions, active, maxRunsPerPatient, createdBy, createdAt, updatedAt);
    }

    public Workflow withActive(boolean newActive, Instant now) {
        return new Workflow(id, organizationId, name, description, triggerType, triggerConfig,
                conditions, actions, newActive, maxRunsPerPatient, createdBy, createdAt, now);
    }

    public Workflow withAudit(String newCreatedBy, Instant newCreatedAt, Instant newUpdatedAt) {
        return new Workflow(id, organizationId, name, description, triggerType, triggerConfig,
                conditions, actions, active, maxRunsPerPatient, newCreatedBy, newCreatedAt, newUpdatedAt);
    }

    public Workflow withOrganization(String newOrganizationId) {
        return new Workflow(id, newOrganizationId, name, description, triggerType, triggerConfig,
                conditions, actions, active, maxRunsPerPatient, createdBy, createdAt, updatedAt);
    }
}
