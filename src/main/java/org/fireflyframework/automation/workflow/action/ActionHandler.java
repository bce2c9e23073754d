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

import org.fireflyframework.automation.integration.Patient;
import org.fireflyframework.automation.workflow.model.ActionSpec;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Executes one family of action kinds. Rendering is pure and shared by dry runs and
 * live runs, so a preview always shows exactly what a live run would send.
 */
public interface ActionHandler {

    Map<String, Object> render(ActionSpec action, Patient patient, RunContext context);

    /**
     * Performs the side effect described by a rendered payload.
     *
     * @return the identifier of what was produced, or empty when there is none
     */
    Mono<String> apply(ActionSpec action, Map<String, Object> payload, Patient patient, RunContext context);

    static IllegalArgumentException unsupported(ActionHandler handler, ActionSpec action) {
        return new IllegalArgumentException(handler.getClass().getSimpleName() + " cannot handle " + action.type());
    }
}
