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

package org.fireflyframework.automation.workflow.repository;

import org.fireflyframework.automation.workflow.model.TriggerType;
import org.fireflyframework.automation.workflow.model.Workflow;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryWorkflowRepository implements WorkflowRepository {

    private static final Comparator<Workflow> NEWEST_FIRST = Comparator
            .<Workflow, Instant>comparing(Workflow::createdAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(Workflow::id);

    private final ConcurrentHashMap<String, Workflow> store = new ConcurrentHashMap<>();

    @Override
    public Mono<Workflow> save(Workflow workflow) {
        Objects.requireNonNull(workflow.id(), "workflow id must be assigned before saving");
        return Mono.fromCallable(() -> {
            store.put(workflow.id(), workflow);
            return workflow;
        });
    }

    @Override
    public Mono<Workflow> findById(String workflowId) {
        return Mono.fromCallable(() -> store.get(workflowId));
    }

    @Override
    public Flux<Workflow> findByOrganization(String organizationId) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(store.values()))
                .filter(w -> organizationId.equals(w.organizationId()))
                .sort(NEWEST_FIRST));
    }

    @Override
    public Flux<Workflow> findActive(String organizationId, TriggerType triggerType) {
        return findByOrganization(organizationId)
                .filter(w -> w.active() && w.triggerType() == triggerType);
    }

    @Override
    public Flux<String> findOrganizationsWithActiveTriggers(Collection<TriggerType> triggerTypes) {
        return Flux.defer(() -> Flux.fromIterable(List.copyOf(store.values()))
                .filter(w -> w.active() && triggerTypes.contains(w.triggerType()))
                .map(Workflow::organizationId)
                .distinct()
                .sort());
    }

    @Override
    public Mono<Boolean> deleteById(String workflowId) {
        return Mono.fromCallable(() -> store.remove(workflowId) != null);
    }
}
