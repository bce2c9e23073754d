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

package org.fireflyframework.automation.unit.core;

import org.fireflyframework.automation.core.exception.WorkflowValidationException;
import org.fireflyframework.automation.core.template.TemplateRenderer;
import org.fireflyframework.automation.core.validation.ValidationIssue;
import org.fireflyframework.automation.core.validation.ValidationIssue.Severity;
import org.fireflyframework.automation.core.validation.WorkflowValidator;
import org.fireflyframework.automation.workflow.model.ActionSpec;
import org.fireflyframework.automation.workflow.model.ConditionOperator;
import org.fireflyframework.automation.workflow.model.TriggerConfig;
import org.fireflyframework.automation.workflow.model.TriggerType;
import org.fireflyframework.automation.workflow.model.Workflow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class WorkflowValidatorTest {

    private final WorkflowValidator validator = new WorkflowValidator(new TemplateRenderer());

    private static List<ValidationIssue> errors(List<ValidationIssue> issues) {
        return issues.stream().filter(i -> i.severity() == Severity.ERROR).toList();
    }

    @Test
    void validWorkflow_hasNoErrors() {
        Workflow wf = Workflow.builder("Recall").organization("org-1")
                .trigger(TriggerType.DAYS_SINCE_VISIT, TriggerConfig.daysSinceVisit(42))
                .when("total_visits", ConditionOperator.GREATER_THAN, 1)
                .sendSms("Hei {fornavn}, det er {lastVisit} siden sist")
                .createFollowUp("Call {fullName}", 3)
                .build();

        assertThat(validator.validate(wf)).isEmpty();
        assertThatCode(() -> validator.validateAndThrow(validator.validate(wf))).doesNotThrowAnyException();
    }

    @Test
    void missingBasics_areErrors() {
        Workflow wf = Workflow.builder("").sendSms("Hi").build();

        assertThat(errors(validator.validate(wf))).extracting(ValidationIssue::message)
                .contains("Workflow name is required", "Organization is required", "Trigger type is required");
    }

    @Test
    void triggerParameters_areChecked() {
        Workflow custom = Workflow.builder("Custom").organization("org-1").trigger(TriggerType.CUSTOM)
                .sendSms("Hi").build();
        Workflow badDays = Workflow.builder("Recall").organization("org-1")
                .trigger(TriggerType.DAYS_SINCE_VISIT, TriggerConfig.daysSinceVisit(0)).sendSms("Hi").build();
        Workflow badBirthday = Workflow.builder("Birthday").organization("org-1")
                .trigger(TriggerType.BIRTHDAY, TriggerConfig.birthday(-1)).sendSms("Hi").build();

        assertThat(errors(validator.validate(custom))).extracting(ValidationIssue::message)
                .containsExactly("CUSTOM trigger requires event_type");
        assertThat(errors(validator.validate(badDays))).hasSize(1);
        assertThat(errors(validator.validate(badBirthday))).hasSize(1);
    }

    @Test
    void negativeMaxRuns_isAnError() {
        Workflow wf = Workflow.builder("Welcome").organization("org-1").trigger(TriggerType.PATIENT_CREATED)
                .maxRunsPerPatient(-1).sendSms("Hi").build();

        assertThat(errors(validator.validate(wf))).extracting(ValidationIssue::location)
                .containsExactly("workflow.Welcome.max_runs_per_patient");
    }

    @Test
    void actionRequiredFields_areChecked() {
        Workflow wf = Workflow.builder("Broken").organization("org-1").trigger(TriggerType.PATIENT_CREATED)
                .action(new ActionSpec.SendSms(null))
                .action(new ActionSpec.SendEmail("Subject only", null))
                .action(new ActionSpec.UpdateStatus(" "))
                .action(new ActionSpec.AddTag(null))
                .action(new ActionSpec.CreateTask("Call", -2))
                .action(new ActionSpec.SendSms("Later", null, -1))
                .build();

        assertThat(errors(validator.validate(wf))).extracting(ValidationIssue::location).containsExactly(
                "workflow.Broken.actions[0].template",
                "workflow.Broken.actions[1]",
                "workflow.Broken.actions[2].value",
                "workflow.Broken.actions[3].tag",
                "workflow.Broken.actions[4].due_in_days",
                "workflow.Broken.actions[5].delay_hours");
    }

    @Test
    void conditionShape_isChecked() {
        Workflow wf = Workflow.builder("Conditions").organization("org-1").trigger(TriggerType.PATIENT_CREATED)
                .when("", ConditionOperator.EQUALS, "x")
                .when("status", ConditionOperator.EQUALS, null)
                .when("status", ConditionOperator.IN, "ACTIVE")
                .when("tags", ConditionOperator.IS_EMPTY, "ignored")
                .sendSms("Hi")
                .build();

        List<ValidationIssue> issues = validator.validate(wf);
        assertThat(errors(issues)).extracting(ValidationIssue::message)
                .containsExactly("Condition field is required", "equals requires a value");
        assertThat(issues).filteredOn(i -> i.severity() == Severity.WARNING).extracting(ValidationIssue::message)
                .containsExactly("in expects a list value", "is_empty ignores its value");
    }

    @Test
    void unknownPlaceholdersAndEmptyWorkflows_areWarnings() {
        Workflow wf = Workflow.builder("Typos").organization("org-1").trigger(TriggerType.PATIENT_CREATED)
                .sendSms("Hi {firstname}").build();
        Workflow empty = Workflow.builder("Empty").organization("org-1").trigger(TriggerType.PATIENT_CREATED).build();

        assertThat(validator.validate(wf)).singleElement()
                .satisfies(i -> assertThat(i.severity()).isEqualTo(Severity.WARNING));
        assertThat(validator.validate(empty)).extracting(ValidationIssue::message)
                .containsExactly("Workflow has no actions");
    }

    @Test
    void validateAndThrow_carriesTheErrors() {
        Workflow wf = Workflow.builder("Custom").organization("org-1").trigger(TriggerType.CUSTOM)
                .sendSms("Hi").build();

        assertThatThrownBy(() -> validator.validateAndThrow(validator.validate(wf)))
                .isInstanceOf(WorkflowValidationException.class)
                .satisfies(e -> assertThat(((WorkflowValidationException) e).getIssues()).hasSize(1))
                .hasMessageContaining("CUSTOM trigger requires event_type");
    }
}
