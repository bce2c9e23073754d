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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.integration.Patient;
import org.fireflyframework.automation.workflow.model.ActionSpec;
import org.fireflyframework.automation.workflow.model.ActionType;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Runs a single action and reports the outcome as an {@link ActionResult}.
 *
 * <p>The returned publisher never signals an error: exceptions, collaborator rejections
 * and timeouts all become a failed result, so one bad action cannot stop the ones after it.
 */
@Slf4j
public class ActionExecutor {

    private final MessageActionHandler messageHandler;
    private final FollowUpActionHandler followUpHandler;
    private final PatientUpdateActionHandler patientUpdateHandler;
    private final StaffNotificationActionHandler staffNotificationHandler;
    private final Clock clock;
    private final Duration actionTimeout;

    public ActionExecutor(MessageActionHandler messageHandler,
                          FollowUpActionHandler followUpHandler,
                          PatientUpdateActionHandler patientUpdateHandler,
                          StaffNotificationActionHandler staffNotificationHandler,
                          Clock clock,
                          Duration actionTimeout) {
        this.messageHandler = Objects.requireNonNull(messageHandler, "messageHandler");
        this.followUpHandler = Objects.requireNonNull(followUpHandler, "followUpHandler");
        this.patientUpdateHandler = Objects.requireNonNull(patientUpdateHandler, "patientUpdateHandler");
        this.staffNotificationHandler = Objects.requireNonNull(staffNotificationHandler, "staffNotificationHandler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.actionTimeout = Objects.requireNonNull(actionTimeout, "actionTimeout");
    }

    public ActionPreview preview(int index, ActionSpec action, Patient patient, RunContext context) {
        return new ActionPreview(index, action.type(), handlerFor(action.type()).render(action, patient, context),
                action.delayHours());
    }

    /** Renders the payload a live run would produce, without touching any collaborator. */
    public Map<String, Object> render(ActionSpec action, Patient patient, RunContext context) {
        return handlerFor(action.type()).render(action, patient, context);
    }

    public Mono<ActionResult> execute(int index, ActionSpec action, Patient patient, RunContext context) {
        ActionType type = action.type();
        return Mono.defer(() -> {
            if (type.requiresPatient() && patient == null) {
                return Mono.just(ActionResult.failed(index, type, "No patient in context for " + type,
                        Map.of(), clock.instant()));
            }
            ActionHandler handler = handlerFor(type);
            Map<String, Object> payload = handler.render(action, patient, context);
            return handler.apply(action, payload, patient, context)
                    .timeout(actionTimeout)
                    .map(id -> ActionResult.succeeded(index, type, id, payload, clock.instant()))
                    .switchIfEmpty(Mono.fromSupplier(() ->
                            ActionResult.succeeded(index, type, null, payload, clock.instant())))
                    .onErrorResume(e -> Mono.just(failed(index, type, e, payload, context)));
        }).onErrorResume(e -> Mono.just(failed(index, type, e, Map.of(), context)));
    }

    private ActionHandler handlerFor(ActionType type) {
        return switch (type) {
            case SEND_SMS, SEND_EMAIL -> messageHandler;
            case CREATE_FOLLOW_UP, CREATE_TASK -> followUpHandler;
            case UPDATE_STATUS, UPDATE_LIFECYCLE, ADD_TAG -> patientUpdateHandler;
            case NOTIFY_STAFF -> staffNotificationHandler;
        };
    }

    private ActionResult failed(int index, ActionType type, Throwable error, Map<String, Object> payload,
                                RunContext context) {
        String message = error instanceof TimeoutException
                ? "Action timed out after " + actionTimeout
                : error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        log.warn("[action] failed workflow={} execution={} index={} type={} error={}",
                context.workflowId(), context.executionId(), index, type, message);
        return ActionResult.failed(index, type, message, payload, clock.instant());
    }
}
