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

import org.fireflyframework.automation.core.exception.WorkflowNotFoundException;
import org.fireflyframework.automation.core.exception.WorkflowValidationException;
import org.fireflyframework.automation.core.template.TemplateRenderer;
import org.fireflyframework.automation.core.validation.WorkflowValidator;
import org.fireflyframework.automation.workflow.model.TriggerType;
import org.fireflyframework.automation.workflow.model.Workflow;
import org.fireflyframework.automation.workflow.repository.InMemoryWorkflowRepository;
import org.fireflyframework.automation.workflow.service.WorkflowQuery;
import org.fireflyframework.automation.workflow.service.WorkflowService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

class WorkflowServiceTest {

    private static final String ORG = "org-1";
    private static final Instant NOW = Instant.parse("2026-03-10T09:00:00Z");

    private InMemoryWorkflowRepository repository;
    private WorkflowService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryWorkflowRepository();
        service = new WorkflowService(repository, new WorkflowValidator(new TemplateRenderer()),
                Clock.fixed(NOW, ZoneOffset.UTC), 3);
    }

    private static Workflow draft(String name, TriggerType type) {
        return Workflow.builder(name).organization(ORG).trigger(type).sendSms("Hei {fornavn}").build();
    }

    @Test
    void create_assignsIdAndAuditTimestamps() {
        StepVerifier.create(service.createWorkflow(draft("Welcome", TriggerType.PATIENT_CREATED)))
                .assertNext(wf -> {
                    assertThat(wf.id()).isNotBlank();
                    assertThat(wf.createdAt()).isEqualTo(NOW);
                    assertThat(wf.updatedAt()).isEqualTo(NOW);
                    assertThat(wf.active()).isTrue();
                })
                .verifyComplete();

        assertThat(repository.findByOrganization(ORG).collectList().block()).hasSize(1);
    }

    @Test
    void create_rejectsInvalidWorkflowWithoutSaving() {
        Workflow invalid = Workflow.builder("Custom").organization(ORG).trigger(TriggerType.CUSTOM)
                .sendSms("Hi").build();

        StepVerifier.create(service.createWorkflow(invalid))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(WorkflowValidationException.class)
                        .hasMessageContaining("CUSTOM trigger requires event_type"))
                .verify();

        assertThat(repository.findByOrganization(ORG).collectList().block()).isEmpty();
    }

    @Test
    void update_keepsIdentityAndCreationAudit() {
        Workflow created = service.createWorkflow(
                Workflow.builder("Welcome").id("wf-1").organization(ORG).createdBy("staff-1")
                        .trigger(TriggerType.PATIENT_CREATED).sendSms("Hi").build()).block();
        Workflow changes = Workflow.builder("Welcome v2").organization("someone-else")
                .trigger(TriggerType.PATIENT_CREATED).sendSms("Hello {firstName}").build();

        StepVerifier.create(service.updateWorkflow(created.id(), changes))
                .assertNext(wf -> {
                    assertThat(wf.id()).isEqualTo("wf-1");
                    assertThat(wf.name()).isEqualTo("Welcome v2");
                    assertThat(wf.organizationId()).isEqualTo(ORG);
                    assertThat(wf.createdBy()).isEqualTo("staff-1");
                    assertThat(wf.createdAt()).isEqualTo(NOW);
                })
                .verifyComplete();
    }

    @Test
    void toggle_flipsActiveFlag() {
        Workflow created = service.createWorkflow(draft("Welcome", TriggerType.PATIENT_CREATED)).block();

        StepVerifier.create(service.toggleWorkflow(created.id()))
                .assertNext(wf -> assertThat(wf.active()).isFalse())
                .verifyComplete();
        StepVerifier.create(service.toggleWorkflow(created.id()))
                .assertNext(wf -> assertThat(wf.active()).isTrue())
                .verifyComplete();
    }

    @Test
    void missingWorkflow_isReportedAsNotFound() {
        StepVerifier.create(service.getWorkflow("nope"))
                .expectError(WorkflowNotFoundException.class)
                .verify();
        StepVerifier.create(service.toggleWorkflow("nope"))
                .expectError(WorkflowNotFoundException.class)
                .verify();
        StepVerifier.create(service.deleteWorkflow("nope"))
                .expectError(WorkflowNotFoundException.class)
                .verify();
    }

    @Test
    void delete_removesWorkflow() {
        Workflow created = service.createWorkflow(draft("Welcome", TriggerType.PATIENT_CREATED)).block();

        StepVerifier.create(service.deleteWorkflow(created.id())).verifyComplete();

        StepVerifier.create(service.getWorkflow(created.id()))
                .expectError(WorkflowNotFoundException.class)
                .verify();
    }

    @Test
    void list_filtersAndPages() {
        for (int i = 1; i <= 5; i++) {
            service.createWorkflow(Workflow.builder("Missed " + i).id("wf-" + i).organization(ORG)
                    .trigger(TriggerType.APPOINTMENT_MISSED).sendSms("Hi").build()).block();
        }
        service.createWorkflow(Workflow.builder("Birthday").id("wf-b").organization(ORG)
                .trigger(TriggerType.BIRTHDAY).active(false).sendSms("Hi").build()).block();
        service.createWorkflow(Workflow.builder("Other org").id("wf-x").organization("org-2")
                .trigger(TriggerType.BIRTHDAY).sendSms("Hi").build()).block();

        StepVerifier.create(service.listWorkflows(ORG,
                        WorkflowQuery.all().withTriggerType(TriggerType.APPOINTMENT_MISSED).withPage(2, 2)))
                .assertNext(page -> {
                    assertThat(page.total()).isEqualTo(5);
                    assertThat(page.pages()).isEqualTo(3);
                    assertThat(page.items()).extracting(Workflow::id).containsExactly("wf-3", "wf-4");
                })
                .verifyComplete();

        StepVerifier.create(service.listWorkflows(ORG, WorkflowQuery.all().withActive(false)))
                .assertNext(page -> assertThat(page.items()).extracting(Workflow::id).containsExactly("wf-b"))
                .verifyComplete();

        // limit is capped at the configured maximum
        StepVerifier.create(service.listWorkflows(ORG, WorkflowQuery.all().withPage(1, 500)))
                .assertNext(page -> {
                    assertThat(page.limit()).isEqualTo(3);
                    assertThat(page.items()).hasSize(3);
                    assertThat(page.total()).isEqualTo(6);
                })
                .verifyComplete();
    }

    @Test
    void list_pageFarPastTheEnd_isEmpty() {
        service.createWorkflow(Workflow.builder("Missed").id("wf-1").organization(ORG)
                .trigger(TriggerType.APPOINTMENT_MISSED).sendSms("Hi").build()).block();

        StepVerifier.create(service.listWorkflows(ORG, WorkflowQuery.all().withPage(Integer.MAX_VALUE, 3)))
                .assertNext(page -> {
                    assertThat(page.items()).isEmpty();
                    assertThat(page.total()).isEqualTo(1);
                })
                .verifyComplete();
    }
}
