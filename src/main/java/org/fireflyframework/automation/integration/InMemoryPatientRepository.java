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

import org.fireflyframework.automation.core.exception.PatientNotFoundException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

public class InMemoryPatientRepository implements PatientRepository {

    private final Map<String, Patient> store = new ConcurrentHashMap<>();

    @Override
    public Mono<Patient> findById(String organizationId, String patientId) {
        return Mono.fromCallable(() -> store.get(patientId))
                .filter(p -> p.organizationId().equals(organizationId));
    }

    @Override
    public Flux<Patient> findByOrganization(String organizationId) {
        return Flux.fromIterable(store.values())
                .filter(p -> p.organizationId().equals(organizationId))
                .sort(Comparator.comparing(Patient::id));
    }

    @Override
    public Mono<Patient> save(Patient patient) {
        return Mono.fromCallable(() -> {
            store.put(patient.id(), patient);
            return patient;
        });
    }

    @Override
    public Mono<Patient> updateStatus(String organizationId, String patientId, String status) {
        return modify(organizationId, patientId, p -> p.withStatus(status));
    }

    @Override
    public Mono<Patient> updateLifecycleStage(String organizationId, String patientId, String lifecycleStage) {
        return modify(organizationId, patientId, p -> p.withLifecycleStage(lifecycleStage));
    }

    @Override
    public Mono<Boolean> addTag(String organizationId, String patientId, String tag) {
        AtomicBoolean added = new AtomicBoolean(false);
        return modify(organizationId, patientId, p -> {
            if (p.tags().contains(tag)) {
                return p;
            }
            added.set(true);
            return p.withTag(tag);
        }).map(p -> added.get());
    }

    private Mono<Patient> modify(String organizationId, String patientId, UnaryOperator<Patient> change) {
        return Mono.fromCallable(() -> store.computeIfPresent(patientId,
                        (id, current) -> current.organizationId().equals(organizationId) ? change.apply(current) : current))
                .filter(p -> p.organizationId().equals(organizationId))
                .switchIfEmpty(Mono.error(() -> new PatientNotFoundException(patientId)));
    }
}
