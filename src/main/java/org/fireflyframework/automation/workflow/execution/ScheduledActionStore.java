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

package org.fireflyframework.automation.workflow.execution;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

public interface ScheduledActionStore {

    Mono<ScheduledAction> save(ScheduledAction action);

    /**
     * Atomically moves due PENDING actions to PROCESSING and emits them, oldest due first.
     * An action is claimed by at most one caller.
     */
    Flux<ScheduledAction> claimDue(Instant now, int limit);

    Mono<ScheduledAction> markCompleted(String id, Instant at);

    Mono<ScheduledAction> markFailed(String id, String error, Instant at);

    Flux<ScheduledAction> findByExecution(String executionId);
}
