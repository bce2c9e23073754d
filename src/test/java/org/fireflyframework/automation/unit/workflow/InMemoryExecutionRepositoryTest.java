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

package org.fireflyframework.automation.unit.workflow;

import org.fireflyframework.automation.core.exception.DuplicateExecutionException;
import org.fireflyframework.automation.core.exception.IllegalExecutionTransitionException;
import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.workflow.execution.InMemoryExecutionRepository;
import org.fireflyframework.automation.workflow.execution.WorkflowExecution;
import org.fireflyframework.automation.workflow.model.TriggerType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class InMemoryExecutionRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-10T09:00:00Z");

    private InMemoryExecutionRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryExecutionRepository();
    }

    private static WorkflowExecution pending(String patientId, String occurrenceKey) {
        return WorkflowExecution.pending("wf-1", "org-1", patientId, occurrenceKey, TriggerType.APPOINTMENT_MISSED,
                Map.of(), 1, NOW);
    }

    @Test
    void reserve_skipsOnceTheRunLimitIsReached() {
        StepVerifier.create(repository.reserve(pending("p-1", "event:1"), 2))
                .assertNext(e -> assertThat(e.status()).isEqualTo(ExecutionStatus.PENDING))
                .verifyComplete();
        StepVerifier.create(repository.reserve(pending("p-1", "event:2"), 2))
                .assertNext(e -> assertThat(e.status()).isEqualTo(ExecutionStatus.PENDING))
                .verifyComplete();
        StepVerifier.create(repository.reserve(pending("p-1", "event:3"), 2))
                .assertNext(e -> {
                    assertThat(e.status()).isEqualTo(ExecutionStatus.SKIPPED);
                    assertThat(e.errorMessage()).contains("Max runs per patient reached");
                })
                .verifyComplete();
        assertThat(repository.countRuns("wf-1", "p-1").block()).isEqualTo(2L);
    }

    @Test
    void reserve_withZeroLimitIsUnlimited() {
        for (int i = 0; i < 5; i++) {
            assertThat(repository.reserve(pending("p-1", "event:" + i), 0).block().status())
                    .isEqualTo(ExecutionStatus.PENDING);
        }
    }

    @Test
    void failedAndSkippedRuns_doNotCountTowardTheLimit() {
        WorkflowExecution first = repository.reserve(pending("p-1", "event:1"), 1).block();
        repository.update(first.fail("boom", NOW)).block();

        assertThat(repository.reserve(pending("p-1", "event:2"), 1).block().status())
                .isEqualTo(ExecutionStatus.PENDING);
    }

    @Test
    void sameOccurrence_isRejectedAsDuplicate() {
        repository.reserve(pending("p-1", "event:1"), 0).block();

        StepVerifier.create(repository.reserve(pending("p-1", "event:1"), 0))
                .expectError(DuplicateExecutionException.class)
                .verify();
        assertThat(repository.size()).isEqualTo(1);
    }

    @Test
    void concurrentReservations_neverExceedTheLimit() {
        List<WorkflowExecution> results = Flux.range(0, 50)
                .flatMap(i -> repository.reserve(pending("p-1", "event:" + i), 3)
                        .subscribeOn(Schedulers.parallel()), 16)
                .collectList()
                .block(Duration.ofSeconds(10));

        assertThat(results).hasSize(50);
        assertThat(results).filteredOn(e -> e.status() == ExecutionStatus.PENDING).hasSize(3);
        assertThat(results).filteredOn(e -> e.status() == ExecutionStatus.SKIPPED).hasSize(47);
    }

    @Test
    void terminalExecutions_cannotBeReopened() {
        WorkflowExecution reserved = repository.reserve(pending("p-1", "event:1"), 0).block();
        WorkflowExecution running = repository.update(reserved.start(NOW)).block();
        WorkflowExecution completed = repository.update(running.complete(List.of(), NOW)).block();

        StepVerifier.create(repository.update(completed.start(NOW.plusSeconds(1))))
                .expectError(IllegalExecutionTransitionException.class)
                .verify();
        assertThat(repository.findById(reserved.id()).block().status()).isEqualTo(ExecutionStatus.COMPLETED);
    }

    @Test
    void findByWorkflow_returnsNewestFirst() {
        repository.insert(WorkflowExecution.pending("wf-1", "org-1", "p-1", "event:a", TriggerType.CUSTOM,
                Map.of(), 0, NOW)).block();
        repository.insert(WorkflowExecution.pending("wf-1", "org-1", "p-2", "event:b", TriggerType.CUSTOM,
                Map.of(), 0, NOW.plusSeconds(60))).block();

        StepVerifier.create(repository.findByWorkflow("wf-1").map(WorkflowExecution::patientId))
                .expectNext("p-2", "p-1")
                .verifyComplete();
    }

    @Test
    void deleteUncountedBefore_removesOnlyOldFailedAndSkippedRecords() {
        WorkflowExecution old = repository.reserve(pending("p-1", "event:1"), 0).block();
        repository.update(old.fail("boom", NOW.minus(Duration.ofDays(40)))).block();
        repository.reserve(pending("p-2", "event:2"), 0).block();

        StepVerifier.create(repository.deleteUncountedBefore(NOW.minus(Duration.ofDays(30))))
                .expectNext(1L)
                .verifyComplete();
        assertThat(repository.size()).isEqualTo(1);
    }

    @Test
    void deleteUncountedBefore_keepsCompletedRunsSoTheLimitStillHolds() {
        WorkflowExecution reserved = repository.reserve(pending("p-1", "event:1"), 1).block();
        WorkflowExecution running = repository.update(reserved.start(NOW.minus(Duration.ofDays(100)))).block();
        repository.update(running.complete(List.of(), NOW.minus(Duration.ofDays(100)))).block();

        StepVerifier.create(repository.deleteUncountedBefore(NOW.minus(Duration.ofDays(30))))
                .expectNext(0L)
                .verifyComplete();
        assertThat(repository.reserve(pending("p-1", "event:2"), 1).block().status())
                .isEqualTo(ExecutionStatus.SKIPPED);
    }

    @Test
    void clear_resetsRecordsAndLimits() {
        repository.reserve(pending("p-1", "event:1"), 1).block();
        repository.clear();

        assertThat(repository.size()).isZero();
        assertThat(repository.reserve(pending("p-1", "event:1"), 1).block().status())
                .isEqualTo(ExecutionStatus.PENDING);
    }
}
