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

package org.fireflyframework.automation.unit.workflow;

import org.fireflyframework.automation.core.exception.WorkflowValidationException;
import org.fireflyframework.automation.core.validation.ValidationIssue;
import org.fireflyframework.automation.workflow.model.ActionSpec;
import org.fireflyframework.automation.workflow.model.ConditionLogic;
import org.fireflyframework.automation.workflow.model.ConditionOperator;
import org.fireflyframework.automation.workflow.model.TriggerType;
import org.fireflyframework.automation.workflow.model.Workflow;
import org.fireflyframework.automation.workflow.service.WorkflowDefinitionCodec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class WorkflowDefinitionCodecTest {

    private final WorkflowDefinitionCodec codec = new WorkflowDefinitionCodec();

    @Test
    void readsSnakeCaseDefinition() {
        String json = """
                {
                  "organization_id": "org-1",
                  "name": "Missed appointment",
                  "trigger_type": "APPOINTMENT_MISSED",
                  "trigger_config": { "appointment_type": "Physio" },
                  "conditions": [
                    { "field": "status", "operator": "equals", "value": "ACTIVE" },
                    { "field": "tags", "operator": "contains", "value": "vip", "logic": "or" }
                  ],
                  "actions": [
                    { "type": "SEND_SMS", "template": "Hei {fornavn}" },
                    { "type": "ADD_TAG", "tag": "missed", "delay_hours": 24 }
                  ],
                  "is_active": false,
                  "max_runs_per_patient": 0
                }
                """;

        Workflow wf = codec.read(json);

        assertThat(wf.triggerType()).isEqualTo(TriggerType.APPOINTMENT_MISSED);
        assertThat(wf.triggerConfig().appointmentType()).isEqualTo("Physio");
        assertThat(wf.conditions()).hasSize(2);
        assertThat(wf.conditions().get(0).operator()).isEqualTo(ConditionOperator.EQUALS);
        assertThat(wf.conditions().get(1).logic()).isEqualTo(ConditionLogic.OR);
        assertThat(wf.actions()).containsExactly(
                new ActionSpec.SendSms("Hei {fornavn}"),
                new ActionSpec.AddTag("missed", 24));
        assertThat(wf.active()).isFalse();
        assertThat(wf.isUnlimited()).isTrue();
    }

    @Test
    void unsetFields_takeDefaults() {
        Workflow wf = codec.read("""
                { "organization_id": "org-1", "name": "Welcome", "trigger_type": "PATIENT_CREATED" }
                """);

        assertThat(wf.active()).isTrue();
        assertThat(wf.maxRunsPerPatient()).isEqualTo(1);
        assertThat(wf.actions()).isEmpty();
    }

    @Test
    void writtenJson_readsBackToTheSameWorkflow() {
        Workflow wf = Workflow.builder("Birthday").id("wf-1").organization("org-1")
                .trigger(TriggerType.BIRTHDAY)
                .when("status", ConditionOperator.IN, List.of("ACTIVE", "NEW"))
                .sendEmail("Gratulerer", "Hei {fornavn}")
                .notifyStaff("Birthday for {fullName}", "RECEPTION")
                .build();

        String json = codec.write(wf);

        assertThat(json).contains("\"trigger_type\":\"BIRTHDAY\"", "\"type\":\"SEND_EMAIL\"", "\"operator\":\"in\"");
        assertThat(codec.read(json)).isEqualTo(wf);
    }

    @Test
    void unknownTriggerType_isAValidationError() {
        assertThatThrownBy(() -> codec.read("""
                { "name": "x", "trigger_type": "FULL_MOON" }
                """))
                .isInstanceOf(WorkflowValidationException.class)
                .satisfies(e -> assertThat(((WorkflowValidationException) e).getIssues())
                        .extracting(ValidationIssue::location)
                        .containsExactly("workflow.trigger_type"));
    }

    @Test
    void unknownActionTypeAndOperator_areValidationErrors() {
        assertThatThrownBy(() -> codec.read("""
                { "name": "x", "trigger_type": "CUSTOM", "actions": [ { "type": "SEND_FAX" } ] }
                """))
                .isInstanceOf(WorkflowValidationException.class)
                .satisfies(e -> assertThat(((WorkflowValidationException) e).getIssues().get(0).location())
                        .startsWith("workflow.actions"));

        assertThatThrownBy(() -> codec.read("""
                { "name": "x", "trigger_type": "CUSTOM",
                  "conditions": [ { "field": "age", "operator": "between", "value": 3 } ] }
                """))
                .isInstanceOf(WorkflowValidationException.class)
                .satisfies(e -> assertThat(((WorkflowValidationException) e).getIssues().get(0).location())
                        .startsWith("workflow.conditions[0]"));
    }

    @Test
    void malformedJson_isAValidationError() {
        assertThatThrownBy(() -> codec.read("{ \"name\": "))
                .isInstanceOf(WorkflowValidationException.class)
                .hasMessageContaining("Malformed JSON");
    }
}
