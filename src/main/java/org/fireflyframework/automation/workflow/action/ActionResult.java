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

import org.fireflyframework.automation.core.model.ActionStatus;
import org.fireflyframework.automation.workflow.model.ActionType;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one action within a run. Failures are values: a failed action carries
 * its error and the run continues with the next action.
 *
 * @param sideEffectId identifier of what the action produced (message id, follow-up id,
 *                     scheduled action id), when it produced something identifiable
 * @param output       the rendered payload; identical to the dry-run preview payload
 */
public record ActionResult(
        int index,
        ActionType type,
        ActionStatus status,
        String sideEffectId,
        String error,
        Map<String, Object> output,
        Instant executedAt
) {
    public ActionResult {
        output = output != null ? Collections.unmodifiableMap(new LinkedHashMap<>(output)) : Map.of();
    }

    public static ActionResult succeeded(int index, ActionType type, String sideEffectId,
                                         Map<String, Object> output, Instant at) {
        return new ActionResult(index, type, ActionStatus.SUCCEEDED, sideEffectId, null, output, at);
    }

    public static ActionResult scheduled(int index, ActionType type, String scheduledActionId,
                                         Map<String, Object> output, Instant at) {
        return new ActionResult(index, type, ActionStatus.SCHEDULED, scheduledActionId, null, output, at);
    }

    public static ActionResult failed(int index, ActionType type, String error,
                                      Map<String, Object> output, Instant at) {
        return new ActionResult(index, type, ActionStatus.FAILED, null, error, output, at);
    }

    public boolean success() {
        return status != ActionStatus.FAILED;
    }
}
