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

package org.fireflyframework.automation.core.recovery;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.core.observability.AutomationEvents;
import org.fireflyframework.automation.workflow.execution.ExecutionRepository;
import org.fireflyframework.automation.workflow.execution.WorkflowExecution;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Housekeeping for execution records. Runs that were PENDING or RUNNING when the
 * process stopped are never resumed: actions may already have reached patients, so
 * they are marked FAILED for an operator to review.
 */
@Slf4j
public class RecoveryService {

    static final String INTERRUPTED_MESSAGE = "Interrupted: execution did not finish before the engine stopped";

    private final ExecutionRepository executionRepository;
    private final AutomationEvents events;
    private final Clock clock;
    private final Duration staleThreshold;

    public RecoveryService(ExecutionRepository executionRepository, AutomationEvents events, Clock clock,
                           Duration staleThreshold) {
        this.executionRepository = Objects.requireNonNull(executionRepository, "executionRepository");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(staleThreshold, "staleThreshold must not be null");
        if (staleThreshold.isNegative() || staleThreshold.isZero()) {
            throw new IllegalArgumentException("staleThreshold must be positive, got: " + staleThreshold);
        }
        this.staleThreshold = staleThreshold;
    }

    /** Active executions with no activity for longer than the stale threshold. */
    public Flux<WorkflowExecution> findStaleExecutions() {
        Instant cutoff = clock.instant().minus(staleThreshold);
        return Flux.concat(
                        executionRepository.findByStatus(ExecutionStatus.PENDING),
                        executionRepository.findByStatus(ExecutionStatus.RUNNING))
                .filter(e -> e.lastActivity().isBefore(cutoff));
    }

    /**
     * Marks every stale PENDING or RUNNING execution FAILED.
     *
     * @return number of executions reconciled
     */
    public Mono<Long> reconcileInterruptedExecutions() {
        return findStaleExecutions()
                .concatMap(stale -> executionRepository.update(stale.fail(INTERRUPTED_MESSAGE, clock.instant()))
                        .doOnNext(failed -> events.onExecutionRecovered(failed.workflowId(), failed.id(), stale.status()))
                        .onErrorResume(e -> {
                            log.warn("[recovery] could not reconcile executionId={}: {}", stale.id(), e.getMessage());
                            return Mono.empty();
                        }))
                .count()
                .doOnNext(count -> {
                    if (count > 0) {
                        log.warn("[recovery] marked {} interrupted executions as FAILED", count);
                    } else {
                        log.info("[recovery] no interrupted executions found");
                    }
                });
    }

    /**
     * Removes FAILED and SKIPPED executions older than {@code olderThan}. Completed runs are
     * kept because they count toward each workflow's per-patient run limit.
     */
    public Mono<Long> cleanupExecutions(Duration olderThan) {
        return executionRepository.deleteUncountedBefore(clock.instant().minus(olderThan))
                .doOnNext(count -> log.info("[recovery] cleaned up {} failed or skipped executions older than {}", count, olderThan))
                .doOnError(err -> log.error("[recovery] cleanup failed for duration {}", olderThan, err));
    }
}
