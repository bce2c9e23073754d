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

package org.fireflyframework.automation.core.model;

public enum ExecutionStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }

    /**
     * Whether a stored record in this status may be moved to {@code next}.
     * SKIPPED and FAILED records may also be created directly in that state.
     */
    public boolean canTransitionTo(ExecutionStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED;
            case RUNNING -> next == RUNNING || next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED, SKIPPED -> false;
        };
    }

    /**
     * Statuses that count against a workflow's per-patient run limit. In-flight
     * runs count so that concurrent occurrences cannot both slip under the limit.
     */
    public boolean countsTowardRunLimit() {
        return this == COMPLETED || this == PENDING || this == RUNNING;
    }
}
