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

import org.fireflyframework.automation.core.model.ScheduledActionStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryScheduledActionStore implements ScheduledActionStore {

    private final ConcurrentHashMap<String, ScheduledAction> store = new ConcurrentHashMap<>();

    @Override
    public Mono<ScheduledAction> save(ScheduledAction action) {
        return Mono.fromCallable(() -> {
            store.put(action.id(), action);
            return action;
        });
    }

    @Override
    public Flux<ScheduledAction> claimDue(Instant now, int limit) {
        return Flux.defer(() -> {
            List<ScheduledAction> due = store.values().stream()
                    .filter(a -> a.isDue(now))
                    .sorted(Comparator.comparing(ScheduledAction::dueAt))
                    .limit(limit)
                    .toList();
            List<ScheduledAction> claimed = new ArrayList<>();
            for (ScheduledAction candidate : due) {
                ScheduledAction processing = candidate.withStatus(ScheduledActionStatus.PROCESSING, null, null);
                if (store.replace(candidate.id(), candidate, processing)) {
                    claimed.add(processing);
                }
            }
            return Flux.fromIterable(claimed);
        });
    }

    @Override
    public Mono<ScheduledAction> markCompleted(String id, Instant at) {
        return finish(id, ScheduledActionStatus.COMPLETED, at, null);
    }

    @Override
    public Mono<ScheduledAction> markFailed(String id, String error, Instant at) {
        return finish(id, ScheduledActionStatus.FAILED, at, error);
    }

    @Override
    public Flux<ScheduledAction> findByExecution(String executionId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(store.values()))
                .filter(a -> a.executionId().equals(executionId))
                .sort(Comparator.comparingInt(ScheduledAction::actionIndex)));
    }

    private Mono<ScheduledAction> finish(String id, ScheduledActionStatus status, Instant at, String error) {
        return Mono.fromCallable(() -> store.computeIfPresent(id, (k, current) -> {
            if (current.status() != ScheduledActionStatus.PROCESSING) {
                throw new IllegalStateException("Scheduled action '" + id + "' is " + current.status()
                        + ", expected PROCESSING");
            }
            return current.withStatus(status, at, error);
        }));
    }

    public int size() { return store.size(); }
}
