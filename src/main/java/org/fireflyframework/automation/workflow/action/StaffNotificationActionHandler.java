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
import org.fireflyframework.automation.integration.StaffAudience;
import org.fireflyframework.automation.integration.StaffDirectory;
import org.fireflyframework.automation.workflow.model.ActionSpec;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.fireflyframework.automation.workflow.action.Payloads.orDefault;
import static org.fireflyframework.automation.workflow.action.Payloads.put;
import static org.fireflyframework.automation.workflow.action.Payloads.string;

/**
 * NOTIFY_STAFF: resolves the audience through the {@link StaffDirectory} and creates one
 * follow-up per staff member, due today.
 */
public class StaffNotificationActionHandler implements ActionHandler {

    private final StaffDirectory staffDirectory;
    private final FollowUpStore followUpStore;
    private final TemplateRenderer renderer;
    private final ActionDefaults defaults;

    public StaffNotificationActionHandler(StaffDirectory staffDirectory, FollowUpStore followUpStore,
                                          TemplateRenderer renderer, ActionDefaults defaults) {
        this.staffDirectory = staffDirectory;
        this.followUpStore = followUpStore;
        this.renderer = renderer;
        this.defaults = defaults;
    }

    @Override
    public Map<String, Object> render(ActionSpec action, Patient patient, RunContext context) {
        if (!(action instanceof ActionSpec.NotifyStaff notify)) {
            throw ActionHandler.unsupported(this, action);
        }
        List<String> staffIds = notify.staffIds() != null ? notify.staffIds() : List.of();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", renderer.render(
                orDefault(notify.message(), "Workflow '" + context.workflowName() + "' needs attention"),
                context.context()));
        if (!staffIds.isEmpty()) {
            payload.put("staff_ids", staffIds);
        } else {
            payload.put("roles", notify.roles() != null && !notify.roles().isEmpty()
                    ? notify.roles() : defaults.staffRoles());
        }
        payload.put("priority", orDefault(notify.priority(), defaults.priority()));
        payload.put("due_date", context.today().toString());
        if (patient != null) {
            payload.put("patient_id", patient.id());
            put(payload, "patient_name", patient.fullName());
        }
        payload.put("trigger_rule", ActionDefaults.STAFF_TRIGGER_RULE);
        return payload;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Mono<String> apply(ActionSpec action, Map<String, Object> payload, Patient patient, RunContext context) {
        StaffAudience audience = new StaffAudience(
                (List<String>) payload.get("staff_ids"), (List<String>) payload.get("roles"));
        LocalDate dueDate = LocalDate.parse(string(payload, "due_date"));
        return staffDirectory.resolveStaff(context.organizationId(), audience)
                .flatMap(staff -> {
                    if (staff.isEmpty()) {
                        return Mono.error(new IllegalStateException("No staff members matched " + audience));
                    }
                    return Flux.fromIterable(staff)
                            .concatMap(staffId -> followUpStore.createFollowUp(new FollowUpRequest(
                                    context.organizationId(),
                                    patient != null ? patient.id() : null,
                                    "STAFF_NOTIFICATION",
                                    string(payload, "message"),
                                    string(payload, "priority"),
                                    dueDate,
                                    staffId,
                                    true,
                                    string(payload, "trigger_rule"),
                                    context.workflowId())))
                            .collectList()
                            .map(ids -> String.join(",", ids));
                });
    }
}
