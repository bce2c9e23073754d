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

package org.fireflyframework.automation.workflow.service;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.core.exception.WorkflowNotFoundException;
import org.fireflyframework.automation.core.validation.WorkflowValidator;
import org.fireflyframework.automation.workflow.model.Workflow;
import org.fireflyframework.automation.workflow.repository.WorkflowRepository;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Authoring operations on workflows. Every save is validated, so configuration errors
 * are reported here rather than when the workflow is triggered.
 */
@Slf4j
public class WorkflowService {

    private final WorkflowRepository workflowRepository;
    private final WorkflowValidator validator;
    private final Clock clock;
    private final int maxPageSize;

    public WorkflowService(WorkflowRepository workflowRepository, WorkflowValidator validator, Clock clock,
                           int maxPageSize) {
        this.workflowRepository = Objects.requireNonNull(workflowRepository, "workflowRepository");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.maxPageSize = maxPageSize;
    }

    public Mono<Workflow> createWorkflow(Workflow draft) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            Workflow workflow = draft.withId(draft.id() != null ? draft.id() : UUID.randomUUID().toString())
                    .withAudit(draft.createdBy(), now, now);
            validator.validateAndThrow(validator.validate(workflow));
            return workflowRepository.save(workflow);
        }).doOnNext(w -> log.info("[automation] workflow created id={} name='{}' trigger={} organizationId={}",
                w.id(), w.name(), w.triggerType(), w.organizationId()));
    }

    /**
     * Replaces a workflow's definition. Identity, organization and creation audit fields
     * are kept from the stored workflow.
     */
    public Mono<Workflow> updateWorkflow(String workflowId, Workflow changes) {
        return getWorkflow(workflowId)
                .map(existing -> changes.withId(existing.id())
                        .withOrganization(existing.organizationId())
                        .withAudit(existing.createdBy(), existing.createdAt(), clock.instant()))
                .flatMap(updated -> {
                    validator.validateAndThrow(validator.validate(updated));
                    return workflowRepository.save(updated);
                })
                .doOnNext(w -> log.info("[automation] workflow updated id={} name='{}'", w.id(), w.name()));
    }

    public Mono<Void> deleteWorkflow(String workflowId) {
        return workflowRepository.deleteById(workflowId)
                .flatMap(deleted -> deleted
                        ? Mono.<Void>empty()
                        : Mono.error(new WorkflowNotFoundException(workflowId)))
                .doOnSuccess(v -> log.info("[automation] workflow deleted id={}", workflowId));
    }

    /**
     * Flips the active flag. Deactivation is how in-progress automation is stopped:
     * inactive workflows are never matched and their delayed actions are not run.
     */
    public Mono<Workflow> toggleWorkflow(String workflowId) {
        return getWorkflow(workflowId)
                .flatMap(existing -> workflowRepository.save(existing.withActive(!existing.active(), clock.instant())))
                .doOnNext(w -> log.info("[automation] workflow {} id={}", w.active() ? "activated" : "deactivated", w.id()));
    }

    public Mono<Workflow> getWorkflow(String workflowId) {
        return workflowRepository.findById(workflowId)
                .switchIfEmpty(Mono.error(() -> new WorkflowNotFoundException(workflowId)));
    }

    /** Newest first. */
    public Mono<WorkflowPage> listWorkflows(String organizationId, WorkflowQuery query) {
        int page = Math.max(1, query.page());
        int limit = Math.min(Math.max(1, query.limit()), maxPageSize);
        return workflowRepository.findByOrganization(organizationId)
                .filter(w -> query.active() == null || w.active().equals(query.active()))
                .filter(w -> query.triggerType() == null || w.triggerType() == query.triggerType())
                .collectList()
                .map(all -> page(all, page, limit));
    }

    private static WorkflowPage page(List<Workflow> all, int page, int limit) {
        int from = (int) Math.min((long) (page - 1) * limit, all.size());
        int to = Math.min(from + limit, all.size());
        int pages = (int) Math.ceil(all.size() / (double) limit);
        return new WorkflowPage(all.subList(from, to), page, limit, all.size(), pages);
    }
}
