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

/**
 * Access to the host application's patient records. Lookups are scoped to an
 * organization; a patient of another organization is treated as absent.
 */
public interface PatientRepository {

    Mono<Patient> findById(String organizationId, String patientId);

    Flux<Patient> findByOrganization(String organizationId);

    Mono<Patient> save(Patient patient);

    Mono<Patient> updateStatus(String organizationId, String patientId, String status);

    Mono<Patient> updateLifecycleStage(String organizationId, String patientId, String lifecycleStage);

    /**
     * Adds a tag with set-union semantics.
     *
     * @return {@code true} if the tag was added, {@code false} if the patient already had it
     */
    Mono<Boolean> addTag(String organizationId, String patientId, String tag);
}
