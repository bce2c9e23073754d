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

package org.fireflyframework.automation.workflow.condition;

import org.fireflyframework.automation.integration.Patient;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the map conditions and templates are evaluated against: the patient's
 * fields at the top level, the occurrence payload under {@code event} and
 * trigger-derived data under {@code trigger}.
 */
public final class PatientContext {

    public static final String EVENT = "event";
    public static final String TRIGGER = "trigger";

    private PatientContext() {}

    public static Map<String, Object> build(Patient patient, Map<String, Object> eventPayload,
                                            Map<String, Object> triggerData) {
        Map<String, Object> ctx = patient != null ? patient.toContextMap() : new LinkedHashMap<>();
        ctx.put(EVENT, eventPayload != null ? eventPayload : Map.of());
        ctx.put(TRIGGER, triggerData != null ? triggerData : Map.of());
        return Collections.unmodifiableMap(ctx);
    }
}
