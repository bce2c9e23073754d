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

package org.fireflyframework.automation.integration;

import java.time.LocalDate;

/**
 * A follow-up or task to create in the host application's follow-up list.
 *
 * @param patientId     patient the follow-up concerns; {@code null} for staff-only notes
 * @param autoGenerated always {@code true} for engine-created entries
 * @param triggerRule   provenance shown to staff, e.g. {@code "Workflow automation"}
 */
public record FollowUpRequest(
        String organizationId,
        String patientId,
        String followUpType,
        String reason,
        String priority,
        LocalDate dueDate,
        String assignedTo,
        boolean autoGenerated,
        String triggerRule,
        String workflowId
) {}
