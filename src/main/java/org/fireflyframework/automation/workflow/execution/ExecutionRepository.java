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

import org.fireflyframework.automation.core.model.ExecutionStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Storage for {@link WorkflowExecution} records.
 *
 * <p>Implementations must guarantee two things under concurrency: at most one record per
 * {@code (workflowId, patientId, occurrenceKey)}, and an atomic check-and-insert in
 * {@link #reserve(WorkflowExecution, int)} so that two concurrent occurrences cannot both
 * pass a workflow's per-patient run limit.
 */
public interface ExecutionRepository {

    /**
     * Atomically counts the runs of {@code pending.workflowId()} for {@code pending.patientId()}
     * (completed and in-flight) and stores either the pending record or, when the count has
     * reached {@code maxRunsPerPatient}, a SKIPPED copy of it. A limit of {@code 0} is
     * unlimited, and patient-less records are never limited.
     *
     * @return the stored record, PENDING or SKIPPED
     * @throws org.fireflyframework.automation.core.exception.DuplicateExecutionException (as an error
     *         signal) if a record already exists for the same occurrence
     */
    Mono<WorkflowExecution> reserve(WorkflowExecution pending, int maxRunsPerPatient);

    /**
     * Inserts a new record. Used for records created directly in a terminal state.
     */
    Mono<WorkflowExecution> insert(WorkflowExecution execution);

    /**
     * Replaces a stored record, enforcing the status transition rules. Terminal records
     * cannot be updated.
     */
    Mono<WorkflowExecution> update(WorkflowExecution execution);

    Mono<WorkflowExecution> findById(String executionId);

    /** Newest first. */
    Flux<WorkflowExecution> findByWorkflow(String workflowId);

    Flux<WorkflowExecution> findByStatus(ExecutionStatus status);

    Mono<Long> countRuns(String workflowId, String patientId);

    /**
     * Deletes FAILED and SKIPPED records whose last activity is before {@code before}.
     * COMPLETED records back the per-patient run limit and are never deleted.
     *
     * @return the number of deleted records
     */
    Mono<Long> deleteUncountedBefore(Instant before);
}
