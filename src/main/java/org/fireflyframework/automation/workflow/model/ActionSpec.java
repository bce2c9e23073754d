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
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * A single side-effecting step of a workflow. The set of kinds is closed; the JSON
 * form carries the kind in a {@code type} property.
 *
 * <p>Every kind accepts an optional {@code delayHours}. A positive delay defers the
 * action to the scheduled-action store instead of running it inline.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ActionSpec.SendSms.class, name = "SEND_SMS"),
        @JsonSubTypes.Type(value = ActionSpec.SendEmail.class, name = "SEND_EMAIL"),
        @JsonSubTypes.Type(value = ActionSpec.CreateFollowUp.class, name = "CREATE_FOLLOW_UP"),
        @JsonSubTypes.Type(value = ActionSpec.CreateTask.class, name = "CREATE_TASK"),
        @JsonSubTypes.Type(value = ActionSpec.UpdateStatus.class, name = "UPDATE_STATUS"),
        @JsonSubTypes.Type(value = ActionSpec.UpdateLifecycle.class, name = "UPDATE_LIFECYCLE"),
        @JsonSubTypes.Type(value = ActionSpec.NotifyStaff.class, name = "NOTIFY_STAFF"),
        @JsonSubTypes.Type(value = ActionSpec.AddTag.class, name = "ADD_TAG")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface ActionSpec {

    ActionType type();

    Integer delayHours();

    @JsonIgnore
    default int delayHoursOrZero() {
        return delayHours() != null ? delayHours() : 0;
    }

    @JsonIgnore
    default boolean isDelayed() {
        return delayHoursOrZero() > 0;
    }

    record SendSms(String template, String templateId, Integer delayHours) implements ActionSpec {
        public SendSms(String template) {
            this(template, null, null);
        }

        @Override
        public ActionType type() {
            return ActionType.SEND_SMS;
        }
    }

    record SendEmail(String subject, String body, String templateId, Integer delayHours) implements ActionSpec {
        public SendEmail(String subject, String body) {
            this(subject, body, null, null);
        }

        @Override
        public ActionType type() {
            return ActionType.SEND_EMAIL;
        }
    }

    record CreateFollowUp(String followUpType, String reason, String priority, Integer dueInDays,
                          String assignedTo, String triggerRule, Integer delayHours) implements ActionSpec {
        public CreateFollowUp(String reason, Integer dueInDays) {
            this(null, reason, null, dueInDays, null, null, null);
        }

        @Override
        public ActionType type() {
            return ActionType.CREATE_FOLLOW_UP;
        }
    }

    record CreateTask(String taskType, String description, String priority, Integer dueInDays,
                      String assignedTo, String triggerRule, Integer delayHours) implements ActionSpec {
        public CreateTask(String description, Integer dueInDays) {
            this(null, description, null, dueInDays, null, null, null);
        }

        @Override
        public ActionType type() {
            return ActionType.CREATE_TASK;
        }
    }

    record UpdateStatus(String value, Integer delayHours) implements ActionSpec {
        public UpdateStatus(String value) {
            this(value, null);
        }

        @Override
        public ActionType type() {
            return ActionType.UPDATE_STATUS;
        }
    }

    record UpdateLifecycle(String value, Integer delayHours) implements ActionSpec {
        public UpdateLifecycle(String value) {
            this(value, null);
        }

        @Override
        public ActionType type() {
            return ActionType.UPDATE_LIFECYCLE;
        }
    }

    record NotifyStaff(String message, List<String> staffIds, List<String> roles, String priority,
                       Integer delayHours) implements ActionSpec {
        public NotifyStaff {
            staffIds = staffIds != null ? List.copyOf(staffIds) : null;
            roles = roles != null ? List.copyOf(roles) : null;
        }

        public NotifyStaff(String message, List<String> roles) {
            this(message, null, roles, null, null);
        }

        @Override
        public ActionType type() {
            return ActionType.NOTIFY_STAFF;
        }
    }

    record AddTag(@JsonAlias("value") String tag, Integer delayHours) implements ActionSpec {
        public AddTag(String tag) {
            this(tag, null);
        }

        @Override
        public ActionType type() {
            return ActionType.ADD_TAG;
        }
    }
}
