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
import org.fireflyframework.automation.integration.PatientRepository;
import org.fireflyframework.automation.workflow.model.ActionSpec;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.fireflyframework.automation.workflow.action.Payloads.put;
import static org.fireflyframework.automation.workflow.action.Payloads.string;

/**
 * UPDATE_STATUS, UPDATE_LIFECYCLE and ADD_TAG. Tags are merged with set-union
 * semantics, so adding a tag the patient already carries succeeds without change.
 */
public class PatientUpdateActionHandler implements ActionHandler {

    private final PatientRepository patientRepository;

    public PatientUpdateActionHandler(PatientRepository patientRepository) {
        this.patientRepository = patientRepository;
    }

    @Override
    public Map<String, Object> render(ActionSpec action, Patient patient, RunContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (action instanceof ActionSpec.UpdateStatus status) {
            payload.put("field", "status");
            put(payload, "value", status.value());
        } else if (action instanceof ActionSpec.UpdateLifecycle lifecycle) {
            payload.put("field", "lifecycle_stage");
            put(payload, "value", lifecycle.value());
        } else if (action instanceof ActionSpec.AddTag tag) {
            payload.put("field", "tags");
            put(payload, "value", tag.tag());
        } else {
            throw ActionHandler.unsupported(this, action);
        }
        return payload;
    }

    @Override
    public Mono<String> apply(ActionSpec action, Map<String, Object> payload, Patient patient, RunContext context) {
        String value = string(payload, "value");
        if (value == null || value.isBlank()) {
            return Mono.error(new IllegalArgumentException(action.type() + " has no value"));
        }
        String organizationId = context.organizationId();
        if (action instanceof ActionSpec.UpdateStatus) {
            return patientRepository.updateStatus(organizationId, patient.id(), value).map(Patient::id);
        }
        if (action instanceof ActionSpec.UpdateLifecycle) {
            return patientRepository.updateLifecycleStage(organizationId, patient.id(), value).map(Patient::id);
        }
        return patientRepository.addTag(organizationId, patient.id(), value).map(added -> patient.id());
    }
}
