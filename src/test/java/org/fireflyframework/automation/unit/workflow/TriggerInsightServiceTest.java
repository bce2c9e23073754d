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

import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.integration.InMemoryPatientRepository;
import org.fireflyframework.automation.integration.Patient;
import org.fireflyframework.automation.workflow.execution.InMemoryExecutionRepository;
import org.fireflyframework.automation.workflow.execution.WorkflowExecution;
import org.fireflyframework.automation.workflow.model.TriggerType;
import org.fireflyframework.automation.workflow.model.Workflow;
import org.fireflyframework.automation.workflow.repository.InMemoryWorkflowRepository;
import org.fireflyframework.automation.workflow.service.TriggerInsightService;
import org.fireflyframework.automation.workflow.service.TriggerInsightService.RecallCandidate;
import org.fireflyframework.automation.workflow.service.TriggerInsightService.TriggerStatistics;
import org.fireflyframework.automation.workflow.service.TriggerInsightService.UpcomingBirthday;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TriggerInsightServiceTest {

    private static final String ORG = "org-1";
    private static final Instant NOW = Instant.parse("2026-03-10T09:00:00Z");

    private InMemoryWorkflowRepository workflows;
    private InMemoryExecutionRepository executions;
    private InMemoryPatientRepository patients;
    private TriggerInsightService insights;

    @BeforeEach
    void setUp() {
        workflows = new InMemoryWorkflowRepository();
        executions = new InMemoryExecutionRepository();
        patients = new InMemoryPatientRepository();
        insights = new TriggerInsightService(workflows, executions, patients,
                Clock.fixed(NOW, ZoneOffset.UTC), List.of("inactive"));
    }

    private void saveWorkflow(String id, TriggerType type, boolean active) {
        workflows.save(Workflow.builder(id).id(id).organization(ORG).trigger(type).active(active)
                .sendSms("Hi").build()).block();
    }

    private void recordRun(String workflowId, String patientId, String key, ExecutionStatus outcome) {
        WorkflowExecution reserved = executions.reserve(WorkflowExecution.pending(workflowId, ORG, patientId, key,
                TriggerType.APPOINTMENT_MISSED, Map.of(), 1, NOW), 0).block();
        WorkflowExecution running = executions.update(reserved.start(NOW)).block();
        if (outcome == ExecutionStatus.COMPLETED) {
            executions.update(running.complete(List.of(), NOW)).block();
        } else {
            executions.update(running.fail("boom", NOW)).block();
        }
    }

    @Test
    void triggerStatistics_groupsWorkflowsAndRunsByTriggerType() {
        saveWorkflow("wf-1", TriggerType.APPOINTMENT_MISSED, true);
        saveWorkflow("wf-2", TriggerType.APPOINTMENT_MISSED, false);
        saveWorkflow("wf-3", TriggerType.BIRTHDAY, true);
        recordRun("wf-1", "p-1", "event:1", ExecutionStatus.COMPLETED);
        recordRun("wf-1", "p-2", "event:2", ExecutionStatus.FAILED);
        recordRun("wf-2", "p-1", "event:3", ExecutionStatus.COMPLETED);

        List<TriggerStatistics> stats = insights.triggerStatistics(ORG).collectList().block();

        assertThat(stats).extracting(TriggerStatistics::triggerType)
                .containsExactly(TriggerType.APPOINTMENT_MISSED, TriggerType.BIRTHDAY);
        TriggerStatistics missed = stats.get(0);
        assertThat(missed.workflowCount()).isEqualTo(2);
        assertThat(missed.activeCount()).isEqualTo(1);
        assertThat(missed.totalExecutions()).isEqualTo(3);
        assertThat(missed.completed()).isEqualTo(2);
        assertThat(missed.failed()).isEqualTo(1);
        assertThat(missed.lastExecution()).isEqualTo(NOW);
        TriggerStatistics birthday = stats.get(1);
        assertThat(birthday.totalExecutions()).isZero();
        assertThat(birthday.lastExecution()).isNull();
    }

    @Test
    void upcomingBirthdays_areSoonestFirstAndSkipExcludedPatients() {
        patients.save(Patient.of("p-1", ORG, "Kari", "Nordmann").withDateOfBirth(LocalDate.of(1990, 3, 15))).block();
        patients.save(Patient.of("p-2", ORG, "Ola", "Nordmann").withDateOfBirth(LocalDate.of(1985, 3, 10))).block();
        patients.save(Patient.of("p-3", ORG, "Per", "Hansen").withDateOfBirth(LocalDate.of(1970, 3, 12))
                .withStatus("INACTIVE")).block();
        patients.save(Patient.of("p-4", ORG, "Liv", "Berg").withDateOfBirth(LocalDate.of(1970, 4, 30))).block();

        List<UpcomingBirthday> upcoming = insights.upcomingBirthdays(ORG, 7).collectList().block();

        assertThat(upcoming).extracting(b -> b.patient().id()).containsExactly("p-2", "p-1");
        assertThat(upcoming.get(0).daysUntil()).isZero();
        assertThat(upcoming.get(0).turningAge()).isEqualTo(41);
        assertThat(upcoming.get(1).nextBirthday()).isEqualTo(LocalDate.of(2026, 3, 15));
        assertThat(upcoming.get(1).turningAge()).isEqualTo(36);
    }

    @Test
    void patientsNeedingRecall_areLongestAbsenceFirst() {
        LocalDate today = LocalDate.of(2026, 3, 10);
        patients.save(Patient.of("p-1", ORG, "Kari", "Nordmann").withVisits(today.minusDays(50), 3)).block();
        patients.save(Patient.of("p-2", ORG, "Ola", "Nordmann").withVisits(today.minusDays(120), 1)).block();
        patients.save(Patient.of("p-3", ORG, "Per", "Hansen").withVisits(today.minusDays(10), 8)).block();
        patients.save(Patient.of("p-4", ORG, "Liv", "Berg")).block();

        List<RecallCandidate> recall = insights.patientsNeedingRecall(ORG, 42).collectList().block();

        assertThat(recall).extracting(c -> c.patient().id()).containsExactly("p-2", "p-1");
        assertThat(recall).extracting(RecallCandidate::daysSinceVisit).containsExactly(120L, 50L);
    }
}
