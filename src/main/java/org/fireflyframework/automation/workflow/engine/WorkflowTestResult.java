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

package org.fireflyframework.automation.workflow.engine;

import org.fireflyframework.automation.integration.Patient;
import org.fireflyframework.automation.workflow.action.ActionPreview;
import org.fireflyframework.automation.workflow.model.TriggerType;

import java.util.List;
import java.util.Map;

/**
 * Result of a dry run. Previews are produced for every action whether or not the
 * conditions pass, so authors can see what the workflow would send.
 */
public record WorkflowTestResult(
        String workflowId,
        String workflowName,
        TriggerType triggerType,
        PatientSummary patient,
        boolean conditionsPassed,
        Map<String, Object> triggerData,
        List<ActionPreview> actions
) {
    public WorkflowTestResult {
        triggerData = Map.copyOf(triggerData);
        actions = List.copyOf(actions);
    }

    public record PatientSummary(String id, String name, String email, String phone, String status,
                                 String lifecycleStage) {

        public static PatientSummary of(Patient patient) {
            return new PatientSummary(patient.id(), patient.fullName(), patient.email(), patient.phone(),
                    patient.status(), patient.lifecycleStage());
        }
    }
}
