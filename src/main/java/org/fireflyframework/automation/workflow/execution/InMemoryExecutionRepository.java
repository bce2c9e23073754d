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

import org.fireflyframework.automation.core.exception.DuplicateExecutionException;
import org.fireflyframework.automation.core.exception.IllegalExecutionTransitionException;
import org.fireflyframework.automation.core.model.ExecutionStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default execution store. Reservations for the same workflow and patient are
 * serialized on a per-pair lock; the occurrence index enforces record uniqueness.
 */
public class InMemoryExecutionRepository implements ExecutionRepository {

    private final ConcurrentHashMap<String, WorkflowExecution> store = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> occurrenceIndex = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Object> locks = new ConcurrentHashMap<>();

    @Override
    public Mono<WorkflowExecution> reserve(WorkflowExecution pending, int maxRunsPerPatient) {
        return Mono.fromCallable(() -> {
            synchronized (lockFor(pending.workflowId(), pending.patientId())) {
                ensureUnique(pending);
                WorkflowExecution toStore = pending;
                if (pending.patientId() != null && maxRunsPerPatient > 0) {
                    long runs = count(pending.workflowId(), pending.patientId());
                    if (runs >= maxRunsPerPatient) {
                        toStore = pending.skip("Max runs per patient reached (" + runs + "/" + maxRunsPerPatient + ")");
                    }
                }
                return put(toStore);
            }
        });
    }

    @Override
    public Mono<WorkflowExecution> insert(WorkflowExecution execution) {
        return Mono.fromCallable(() -> {
            synchronized (lockFor(execution.workflowId(), execution.patientId())) {
                ensureUnique(execution);
                return put(execution);
            }
        });
    }

    @Override
    public Mono<WorkflowExecution> update(WorkflowExecution execution) {
        return Mono.fromCallable(() -> store.compute(execution.id(), (id, current) -> {
            if (current == null) {
                throw new IllegalStateException("Execution '" + id + "' does not exist");
            }
            if (!current.status().canTransitionTo(execution.status())) {
                throw new IllegalExecutionTransitionException(id, current.status(), execution.status());
            }
            return execution;
        }));
    }

    @Override
    public Mono<WorkflowExecution> findById(String executionId) {
        return Mono.fromCallable(() -> store.get(executionId));
    }

    @Override
    public Flux<WorkflowExecution> findByWorkflow(String workflowId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(store.values()))
                .filter(e -> e.workflowId().equals(workflowId))
                .sort(Comparator.comparing(WorkflowExecution::createdAt).reversed()
                        .thenComparing(WorkflowExecution::id)));
    }

    @Override
    public Flux<WorkflowExecution> findByStatus(ExecutionStatus status) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(store.values()))
                .filter(e -> e.status() == status));
    }

    @Override
    public Mono<Long> countRuns(String workflowId, String patientId) {
        return Mono.fromCallable(() -> count(workflowId, patientId));
    }

    @Override
    public Mono<Long> deleteUncountedBefore(Instant before) {
        return Mono.fromCallable(() -> {
            long count = 0;
            var it = store.entrySet().iterator();
            while (it.hasNext()) {
                var entry = it.next();
                WorkflowExecution execution = entry.getValue();
                if (execution.status().isTerminal() && !execution.status().countsTowardRunLimit()
                        && execution.lastActivity().isBefore(before)) {
                    it.remove();
                    occurrenceIndex.remove(occurrenceKey(execution), execution.id());
                    count++;
                }
            }
            return count;
        });
    }

    private long count(String workflowId, String patientId) {
        return store.values().stream()
                .filter(e -> e.workflowId().equals(workflowId) && Objects.equals(e.patientId(), patientId))
                .filter(e -> e.status().countsTowardRunLimit())
                .count();
    }

    private void ensureUnique(WorkflowExecution execution) {
        if (occurrenceIndex.containsKey(occurrenceKey(execution))) {
            throw new DuplicateExecutionException(execution.workflowId(), execution.patientId(),
                    execution.occurrenceKey());
        }
    }

    private WorkflowExecution put(WorkflowExecution execution) {
        occurrenceIndex.put(occurrenceKey(execution), execution.id());
        store.put(execution.id(), execution);
        return execution;
    }

    private Object lockFor(String workflowId, String patientId) {
        return locks.computeIfAbsent(workflowId + "|" + patientId, k -> new Object());
    }

    private static String occurrenceKey(WorkflowExecution execution) {
        return execution.workflowId() + "|" + execution.patientId() + "|" + execution.occurrenceKey();
    }

    // Test helpers
    public int size() { return store.size(); }
    public void clear() { store.clear(); occurrenceIndex.clear(); locks.clear(); }
}
