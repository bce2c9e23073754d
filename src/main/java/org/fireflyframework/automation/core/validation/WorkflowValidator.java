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

package org.fireflyframework.automation.core.validation;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.core.exception.WorkflowValidationException;
import org.fireflyframework.automation.core.template.TemplateRenderer;
import org.fireflyframework.automation.core.validation.ValidationIssue.Severity;
import org.fireflyframework.automation.workflow.model.ActionSpec;
import org.fireflyframework.automation.workflow.model.ConditionClause;
import org.fireflyframework.automation.workflow.model.TriggerConfig;
import org.fireflyframework.automation.workflow.model.TriggerType;
import org.fireflyframework.automation.workflow.model.Workflow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates workflow definitions when they are saved or dry-run, so configuration
 * errors surface to the author instead of at trigger time. Produces a list of
 * {@link ValidationIssue}s; {@link #validateAndThrow(List)} aborts on ERROR issues.
 */
@Slf4j
public class WorkflowValidator {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z]+)}");

    private final TemplateRenderer templateRenderer;

    public WorkflowValidator(TemplateRenderer templateRenderer) {
        this.templateRenderer = templateRenderer;
    }

    public List<ValidationIssue> validate(Workflow workflow) {
        List<ValidationIssue> issues = new ArrayList<>();
        String loc = "workflow." + (workflow.id() != null ? workflow.id() : workflow.name());

        if (isBlank(workflow.name())) {
            issues.add(new ValidationIssue(Severity.ERROR, "Workflow name is required", loc + ".name"));
        }
        if (isBlank(workflow.organizationId())) {
            issues.add(new ValidationIssue(Severity.ERROR, "Organization is required", loc + ".organization_id"));
        }
        if (workflow.triggerType() == null) {
            issues.add(new ValidationIssue(Severity.ERROR, "Trigger type is required", loc + ".trigger_type"));
        } else {
            validateTrigger(workflow.triggerType(), workflow.triggerConfig(), loc + ".trigger_config", issues);
        }
        if (workflow.maxRunsPerPatient() < 0) {
            issues.add(new ValidationIssue(Severity.ERROR,
                    "max_runs_per_patient must be 0 (unlimited) or positive, got " + workflow.maxRunsPerPatient(),
                    loc + ".max_runs_per_patient"));
        }

        for (int i = 0; i < workflow.conditions().size(); i++) {
            validateCondition(workflow.conditions().get(i), loc + ".conditions[" + i + "]", issues);
        }

        if (workflow.actions().isEmpty()) {
            issues.add(new ValidationIssue(Severity.WARNING, "Workflow has no actions", loc + ".actions"));
        }
        for (int i = 0; i < workflow.actions().size(); i++) {
            ActionSpec action = workflow.actions().get(i);
            String aLoc = loc + ".actions[" + i + "]";
            if (action == null) {
                issues.add(new ValidationIssue(Severity.ERROR, "Action is empty", aLoc));
                continue;
            }
            validateAction(action, aLoc, issues);
        }
        return issues;
    }

    /**
     * Logs every issue and throws a {@link WorkflowValidationException} if any has ERROR severity.
     */
    public void validateAndThrow(List<ValidationIssue> issues) {
        for (ValidationIssue issue : issues) {
            switch (issue.severity()) {
                case WARNING -> log.warn("[validation] {} at {}", issue.message(), issue.location());
                case INFO -> log.info("[validation] {} at {}", issue.message(), issue.location());
                case ERROR -> log.error("[validation] {} at {}", issue.message(), issue.location());
            }
        }
        List<ValidationIssue> errors = issues.stream()
                .filter(i -> i.severity() == Severity.ERROR)
                .toList();
        if (!errors.isEmpty()) {
            throw new WorkflowValidationException(errors);
        }
    }

    private void validateTrigger(TriggerType type, TriggerConfig config, String loc, List<ValidationIssue> issues) {
        switch (type) {
            case CUSTOM -> {
                if (isBlank(config.eventType())) {
                    issues.add(new ValidationIssue(Severity.ERROR, "CUSTOM trigger requires event_type", loc));
                }
            }
            case DAYS_SINCE_VISIT -> {
                if (config.days() != null && config.days() <= 0) {
                    issues.add(new ValidationIssue(Severity.ERROR,
                            "days must be positive, got " + config.days(), loc + ".days"));
                }
            }
            case BIRTHDAY -> {
                if (config.daysBefore() != null && config.daysBefore() < 0) {
                    issues.add(new ValidationIssue(Severity.ERROR,
                            "days_before must not be negative, got " + config.daysBefore(), loc + ".days_before"));
                }
            }
            case LIFECYCLE_CHANGE -> {
                if (!isBlank(config.fromStage()) && config.fromStage().equals(config.toStage())) {
                    issues.add(new ValidationIssue(Severity.WARNING,
                            "from_stage equals to_stage; the trigger can never fire", loc));
                }
            }
            default -> {
                // no trigger-specific parameters
            }
        }
        if (type.isEventBased() && config.excludeStatuses() != null) {
            issues.add(new ValidationIssue(Severity.INFO,
                    "exclude_statuses only applies to time triggers", loc + ".exclude_statuses"));
        }
    }

    private void validateCondition(ConditionClause clause, String loc, List<ValidationIssue> issues) {
        if (clause == null) {
            issues.add(new ValidationIssue(Severity.ERROR, "Condition is empty", loc));
            return;
        }
        if (isBlank(clause.field())) {
            issues.add(new ValidationIssue(Severity.ERROR, "Condition field is required", loc + ".field"));
        }
        if (clause.operator() == null) {
            issues.add(new ValidationIssue(Severity.ERROR, "Condition operator is required", loc + ".operator"));
            return;
        }
        switch (clause.operator()) {
            case IN, NOT_IN -> {
                if (!(clause.value() instanceof Collection<?>)) {
                    issues.add(new ValidationIssue(Severity.WARNING,
                            clause.operator().wireName() + " expects a list value", loc + ".value"));
                }
            }
            case IS_EMPTY, IS_NOT_EMPTY -> {
                if (clause.value() != null) {
                    issues.add(new ValidationIssue(Severity.WARNING,
                            clause.operator().wireName() + " ignores its value", loc + ".value"));
                }
            }
            default -> {
                if (clause.value() == null) {
                    issues.add(new ValidationIssue(Severity.ERROR,
                            clause.operator().wireName() + " requires a value", loc + ".value"));
                }
            }
        }
    }

    private void validateAction(ActionSpec action, String loc, List<ValidationIssue> issues) {
        if (action.delayHours() != null && action.delayHours() < 0) {
            issues.add(new ValidationIssue(Severity.ERROR,
                    "delay_hours must not be negative, got " + action.delayHours(), loc + ".delay_hours"));
        }
        if (action instanceof ActionSpec.SendSms sms) {
            if (isBlank(sms.template()) && isBlank(sms.templateId())) {
                issues.add(new ValidationIssue(Severity.ERROR, "SEND_SMS requires a template", loc + ".template"));
            }
            checkPlaceholders(sms.template(), loc + ".template", issues);
        } else if (action instanceof ActionSpec.SendEmail email) {
            if (isBlank(email.templateId()) && (isBlank(email.subject()) || isBlank(email.body()))) {
                issues.add(new ValidationIssue(Severity.ERROR, "SEND_EMAIL requires a subject and a body", loc));
            }
            checkPlaceholders(email.subject(), loc + ".subject", issues);
            checkPlaceholders(email.body(), loc + ".body", issues);
        } else if (action instanceof ActionSpec.CreateFollowUp followUp) {
            checkDueDays(followUp.dueInDays(), loc, issues);
            checkPlaceholders(followUp.reason(), loc + ".reason", issues);
        } else if (action instanceof ActionSpec.CreateTask task) {
            checkDueDays(task.dueInDays(), loc, issues);
            checkPlaceholders(task.description(), loc + ".description", issues);
        } else if (action instanceof ActionSpec.UpdateStatus status) {
            requireValue(status.value(), "UPDATE_STATUS", loc, issues);
        } else if (action instanceof ActionSpec.UpdateLifecycle lifecycle) {
            requireValue(lifecycle.value(), "UPDATE_LIFECYCLE", loc, issues);
        } else if (action instanceof ActionSpec.AddTag tag) {
            if (isBlank(tag.tag())) {
                issues.add(new ValidationIssue(Severity.ERROR, "ADD_TAG requires a tag", loc + ".tag"));
            }
        } else if (action instanceof ActionSpec.NotifyStaff notify) {
            if (isBlank(notify.message())) {
                issues.add(new ValidationIssue(Severity.WARNING,
                        "NOTIFY_STAFF has no message; a generic one is used", loc + ".message"));
            }
            checkPlaceholders(notify.message(), loc + ".message", issues);
        }
    }

    private static void requireValue(String value, String kind, String loc, List<ValidationIssue> issues) {
        if (isBlank(value)) {
            issues.add(new ValidationIssue(Severity.ERROR, kind + " requires a value", loc + ".value"));
        }
    }

    private static void checkDueDays(Integer dueInDays, String loc, List<ValidationIssue> issues) {
        if (dueInDays != null && dueInDays < 0) {
            issues.add(new ValidationIssue(Severity.ERROR,
                    "due_in_days must not be negative, got " + dueInDays, loc + ".due_in_days"));
        }
    }

    private void checkPlaceholders(String text, String loc, List<ValidationIssue> issues) {
        if (text == null) {
            return;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        while (matcher.find()) {
            if (!templateRenderer.isKnownVariable(matcher.group(1))) {
                issues.add(new ValidationIssue(Severity.WARNING,
                        "Unknown placeholder " + matcher.group() + " is sent as literal text", loc));
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
