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

import java.util.Collection;

public interface WorkflowRepository {

    Mono<Workflow> save(Workflow workflow);

    Mono<Workflow> findById(String workflowId);

    Flux<Workflow> findByOrganization(String organizationId);

    /**
     * Active workflows of an organization for one trigger type. Inactive workflows are
     * never returned, so deactivating a workflow stops it from running.
     */
    Flux<Workflow> findActive(String organizationId, TriggerType triggerType);

    /** Organizations with at least one active workflow on any of the given trigger types. */
    Flux<String> findOrganizationsWithActiveTriggers(Collection<TriggerType> triggerTypes);

    Mono<Boolean> deleteById(String workflowId);
}
