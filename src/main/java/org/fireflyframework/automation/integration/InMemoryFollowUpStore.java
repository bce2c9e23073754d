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

package org.fireflyframework.automation.integration;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryFollowUpStore implements FollowUpStore {

    private final Map<String, FollowUpRequest> store = new ConcurrentHashMap<>();

    @Override
    public Mono<String> createFollowUp(FollowUpRequest request) {
        return Mono.fromCallable(() -> {
            String id = UUID.randomUUID().toString();
            store.put(id, request);
            return id;
        });
    }

    public Mono<FollowUpRequest> findById(String followUpId) {
        return Mono.justOrEmpty(store.get(followUpId));
    }

    public Flux<FollowUpRequest> findByOrganization(String organizationId) {
        return Flux.fromIterable(store.values())
                .filter(r -> organizationId.equals(r.organizationId()));
    }

    public int size() {
        return store.size();
    }
}
