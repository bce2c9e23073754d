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

import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.integration.Patient;
import org.fireflyframework.automation.integration.PatientRepository;
import org.fireflyframework.automation.workflow.execution.ExecutionRepository;
import org.fireflyframework.automation.workflow.execution.WorkflowExecution;
import org.fireflyframework.automation.workflow.model.TriggerType;
import org.fireflyframework.automation.workflow.model.Workflow;
import org.fireflyframework.automation.workflow.repository.WorkflowRepository;
import org.fireflyframework.automation.workflow.trigger.TriggerEvaluator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only views over workflows, executions and patients that help staff tune
 * time-based automation.
 */
public class TriggerInsightService {

    private final WorkflowRepository workflowRepository;
    private final ExecutionRepository executionRepository;
    private final PatientRepository patientRepository;
    private final Clock clock;
    private final Set<String> excludedStatuses;

    public TriggerInsightService(WorkflowRepository workflowRepository, ExecutionRepository executionRepository,
                                 PatientRepository patientRepository, Clock clock, List<String> excludedStatuses) {
        this.workflowRepository = Objects.requireNonNull(workflowRepository, "workflowRepository");
        this.executionRepository = Objects.requireNonNull(executionRepository, "executionRepository");
        this.patientRepository = Objects.requireNonNull(patientRepository, "patientRepository");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.excludedStatuses = excludedStatuses.stream()
                .map(s -> s.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public record TriggerStatistics(TriggerType triggerType, int workflowCount, int activeCount,
                                    long totalExecutions, long completed, long failed, long skipped,
                                    Instant lastExecution) {}

    public record UpcomingBirthday(Patient patient, LocalDate nextBirthday, int turningAge, long daysUntil) {}

    public record RecallCandidate(Patient patient, long daysSinceVisit) {}

    /** One entry per trigger type that has at least one workflow, in trigger type order. */
    public Flux<TriggerStatistics> triggerStatistics(String organizationId) {
        return workflowRepository.findByOrganization(organizationId)
                .collectMultimap(Workflow::triggerType)
                .flatMapMany(byType -> Flux.fromIterable(byType.keySet())
                        .sort(Comparator.naturalOrder())
                        .concatMap(type -> statisticsFor(type, List.copyOf(byType.get(type)))));
    }

    private Mono<TriggerStatistics> statisticsFor(TriggerType type, List<Workflow> workflows) {
        int active = (int) workflows.stream().filter(Workflow::active).count();
        return Flux.fromIterable(workflows)
                .concatMap(w -> executionRepository.findByWorkflow(w.id()))
                .collectList()
                .map(executions -> new TriggerStatistics(type, workflows.size(), active,
                        executions.size(),
                        count(executions, ExecutionStatus.COMPLETED),
                        count(executions, ExecutionStatus.FAILED),
                        count(executions, ExecutionStatus.SKIPPED),
                        executions.stream()
                                .map(WorkflowExecution::createdAt)
                                .filter(Objects::nonNull)
                                .max(Comparator.naturalOrder())
                                .orElse(null)));
    }

    /** Patients whose next birthday is within {@code days} days, today included, soonest first. */
    public Flux<UpcomingBirthday> upcomingBirthdays(String organizationId, int days) {
        LocalDate today = LocalDate.now(clock);
        return eligiblePatients(organizationId)
                .filter(p -> p.dateOfBirth() != null)
                .mapNotNull(p -> {
                    for (int offset = 0; offset <= days; offset++) {
                        LocalDate date = today.plusDays(offset);
                        if (TriggerEvaluator.birthdayFallsOn(p.dateOfBirth(), date)) {
                            return new UpcomingBirthday(p, date, TriggerEvaluator.ageOn(p.dateOfBirth(), date), offset);
                        }
                    }
                    return null;
                })
                .sort(Comparator.comparingLong(UpcomingBirthday::daysUntil)
                        .thenComparing(b -> b.patient().id()));
    }

    /** Patients whose last visit was at least {@code days} days ago, longest absence first. */
    public Flux<RecallCandidate> patientsNeedingRecall(String organizationId, int days) {
        LocalDate today = LocalDate.now(clock);
        return eligiblePatients(organizationId)
                .filter(p -> p.lastVisitDate() != null)
                .map(p -> new RecallCandidate(p, ChronoUnit.DAYS.between(p.lastVisitDate(), today)))
                .filter(c -> c.daysSinceVisit() >= days)
                .sort(Comparator.comparingLong(RecallCandidate::daysSinceVisit).reversed()
                        .thenComparing(c -> c.patient().id()));
    }

    private Flux<Patient> eligiblePatients(String organizationId) {
        return patientRepository.findByOrganization(organizationId)
                .filter(p -> p.status() == null || !excludedStatuses.contains(p.status().toUpperCase(Locale.ROOT)));
    }

    private static long count(List<WorkflowExecution> executions, ExecutionStatus status) {
        return executions.stream().filter(e -> e.status() == status).count();
    }
}
