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

package org.fireflyframework.automation.workflow.engine;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.core.event.DailyTick;
import org.fireflyframework.automation.core.event.DomainEvent;
import org.fireflyframework.automation.core.event.Occurrence;
import org.fireflyframework.automation.core.exception.DuplicateExecutionException;
import org.fireflyframework.automation.core.exception.PatientNotFoundException;
import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.core.model.ScheduledActionStatus;
import org.fireflyframework.automation.core.observability.AutomationEvents;
import org.fireflyframework.automation.core.validation.WorkflowValidator;
import org.fireflyframework.automation.integration.Patient;
import org.fireflyframework.automation.integration.PatientRepository;
import org.fireflyframework.automation.workflow.action.ActionExecutor;
import org.fireflyframework.automation.workflow.action.ActionPreview;
import org.fireflyframework.automation.workflow.action.ActionResult;
import org.fireflyframework.automation.workflow.action.RunContext;
import org.fireflyframework.automation.workflow.condition.ConditionEvaluator;
import org.fireflyframework.automation.workflow.condition.PatientContext;
import org.fireflyframework.automation.workflow.execution.ExecutionPage;
import org.fireflyframework.automation.workflow.execution.ExecutionQuery;
import org.fireflyframework.automation.workflow.execution.ExecutionRepository;
import org.fireflyframework.automation.workflow.execution.ScheduledAction;
import org.fireflyframework.automation.workflow.execution.ScheduledActionStore;
import org.fireflyframework.automation.workflow.execution.WorkflowExecution;
import org.fireflyframework.automation.workflow.model.ActionSpec;
import org.fireflyframework.automation.workflow.model.TriggerType;
import org.fireflyframework.automation.workflow.model.Workflow;
import org.fireflyframework.automation.workflow.repository.WorkflowRepository;
import org.fireflyframework.automation.workflow.trigger.TriggerCandidate;
import org.fireflyframework.automation.workflow.trigger.TriggerEvaluator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Runs workflows in response to occurrences.
 *
 * <p>For each active workflow listening to the occurrence's trigger, the engine asks the
 * {@link TriggerEvaluator} for candidate patients and, per candidate:
 * <ol>
 *   <li>evaluates the conditions; a non-match leaves no record, an evaluation error leaves a FAILED record</li>
 *   <li>reserves an execution through the store's atomic run-limit check; over the limit the record is SKIPPED</li>
 *   <li>moves the record to RUNNING and executes the actions strictly in order</li>
 *   <li>finalizes the record as COMPLETED, even when individual actions failed</li>
 * </ol>
 *
 * <p>Failures are isolated per workflow and per candidate: one broken workflow never
 * prevents the others from processing the same occurrence.
 */
@Slf4j
public class AutomationEngine {

    private static final List<TriggerType> TIME_TRIGGERS = Arrays.stream(TriggerType.values())
            .filter(TriggerType::isTimeBased)
            .toList();

    private final WorkflowRepository workflowRepository;
    private final ExecutionRepository executionRepository;
    private final ScheduledActionStore scheduledActionStore;
    private final PatientRepository patientRepository;
    private final TriggerEvaluator triggerEvaluator;
    private final ConditionEvaluator conditionEvaluator;
    private final ActionExecutor actionExecutor;
    private final WorkflowValidator workflowValidator;
    private final AutomationEvents events;
    private final Clock clock;
    private final EngineSettings settings;

    public AutomationEngine(WorkflowRepository workflowRepository,
                            ExecutionRepository executionRepository,
                            ScheduledActionStore scheduledActionStore,
                            PatientRepository patientRepository,
                            TriggerEvaluator triggerEvaluator,
                            ConditionEvaluator conditionEvaluator,
                            ActionExecutor actionExecutor,
                            WorkflowValidator workflowValidator,
                            AutomationEvents events,
                            Clock clock,
                            EngineSettings settings) {
        this.workflowRepository = Objects.requireNonNull(workflowRepository, "workflowRepository");
        this.executionRepository = Objects.requireNonNull(executionRepository, "executionRepository");
        this.scheduledActionStore = Objects.requireNonNull(scheduledActionStore, "scheduledActionStore");
        this.patientRepository = Objects.requireNonNull(patientRepository, "patientRepository");
        this.triggerEvaluator = Objects.requireNonNull(triggerEvaluator, "triggerEvaluator");
        this.conditionEvaluator = Objects.requireNonNull(conditionEvaluator, "conditionEvaluator");
        this.actionExecutor = Objects.requireNonNull(actionExecutor, "actionExecutor");
        this.workflowValidator = Objects.requireNonNull(workflowValidator, "workflowValidator");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    // ── Entry points ──────────────────────────────────────────────

    /**
     * Runs every active workflow of the event's organization whose trigger matches the event.
     */
    public Mono<TriggerSummary> triggerWorkflow(DomainEvent event) {
        log.debug("[automation] event received type={} organizationId={} patientId={} eventId={}",
                event.type(), event.organizationId(), event.patientId(), event.eventId());
        return workflowRepository.findActive(event.organizationId(), event.type())
                .concatMap(workflow -> runWorkflow(workflow, event))
                .collectList()
                .map(executions -> new TriggerSummary(event.occurrenceKey(event.type()), executions));
    }

    /**
     * Evaluates the organization's time-triggered workflows for one calendar day. Repeating
     * the call for the same day never produces a second run for the same patient.
     */
    public Mono<TriggerSummary> processTimeBasedTriggers(String organizationId, LocalDate asOfDate) {
        DailyTick tick = new DailyTick(organizationId, asOfDate);
        log.info("[automation] processing time triggers organizationId={} asOf={}", organizationId, asOfDate);
        return Flux.fromIterable(TIME_TRIGGERS)
                .concatMap(type -> workflowRepository.findActive(organizationId, type))
                .concatMap(workflow -> runWorkflow(workflow, tick))
                .collectList()
                .map(executions -> new TriggerSummary("tick:" + organizationId + ":" + asOfDate, executions));
    }

    /** Processes the current day, as given by {@link #today()}. */
    public Mono<TriggerSummary> processTimeBasedTriggers(String organizationId) {
        return processTimeBasedTriggers(organizationId, today());
    }

    /** The calendar day in the configured zone, falling back to the clock's zone. */
    public LocalDate today() {
        return LocalDate.now(settings.zone() == null ? clock : clock.withZone(settings.zone()));
    }

    /**
     * Dry run of a (possibly unsaved) workflow against one patient. Validates the definition,
     * forces the trigger to match, evaluates the conditions and renders every action. No
     * execution record is written and no side-effecting collaborator is called.
     */
    public Mono<WorkflowTestResult> testWorkflow(Workflow definition, String patientId) {
        return Mono.defer(() -> {
            workflowValidator.validateAndThrow(workflowValidator.validate(definition));
            return patientRepository.findById(definition.organizationId(), patientId)
                    .switchIfEmpty(Mono.error(() -> new PatientNotFoundException(patientId)))
                    .map(patient -> dryRun(definition, patient));
        });
    }

    /**
     * Execution history of a workflow, newest first, optionally filtered by status.
     */
    public Mono<ExecutionPage> getWorkflowExecutions(String workflowId, ExecutionQuery query) {
        int page = Math.max(1, query.page());
        int limit = query.limit() == null || query.limit() <= 0
                ? settings.defaultPageSize()
                : Math.min(query.limit(), settings.maxPageSize());
        return executionRepository.findByWorkflow(workflowId)
                .filter(e -> query.status() == null || e.status() == query.status())
                .collectList()
                .map(all -> ExecutionPage.of(all, page, limit));
    }

    /**
     * Executes delayed actions that have come due. Actions of a workflow that has since
     * been deactivated or deleted are marked FAILED without running.
     */
    public Flux<ScheduledAction> processScheduledActions(Instant now) {
        return scheduledActionStore.claimDue(now, settings.scheduledActionBatchSize())
                .concatMap(scheduled -> processScheduledAction(scheduled)
                        .onErrorResume(e -> scheduledActionStore.markFailed(scheduled.id(), describe(e), clock.instant())))
                .doOnNext(done -> events.onScheduledActionProcessed(done.workflowId(), done.id(),
                        done.status() == ScheduledActionStatus.COMPLETED));
    }

    // ── Run pipeline ──────────────────────────────────────────────

    private Flux<WorkflowExecution> runWorkflow(Workflow workflow, Occurrence occurrence) {
        return triggerEvaluator.matches(workflow, occurrence)
                .flatMapMany(match -> Flux.fromIterable(match.candidates()))
                .flatMap(candidate -> runCandidate(workflow, occurrence, candidate), settings.maxConcurrentRuns())
                .onErrorResume(e -> {
                    events.onWorkflowError(workflow.name(), e);
                    return Flux.empty();
                });
    }

    private Mono<WorkflowExecution> runCandidate(Workflow workflow, Occurrence occurrence, TriggerCandidate candidate) {
        String occurrenceKey = occurrence.occurrenceKey(workflow.triggerType());
        Map<String, Object> snapshot = snapshot(occurrence, candidate);
        return loadPatient(workflow.organizationId(), candidate.patientId())
                .flatMap(patient -> {
                    Map<String, Object> context = PatientContext.build(patient.orElse(null),
                            occurrence.payload(), candidate.triggerData());
                    boolean passed;
                    try {
                        passed = conditionEvaluator.evaluate(workflow.conditions(), context);
                    } catch (RuntimeException e) {
                        return recordFailure(workflow, candidate, occurrenceKey, snapshot,
                                "Condition evaluation failed: " + describe(e));
                    }
                    if (!passed) {
                        events.onConditionsNotMet(workflow.name(), candidate.patientId());
                        return Mono.empty();
                    }
                    WorkflowExecution pending = WorkflowExecution.pending(workflow.id(), workflow.organizationId(),
                            candidate.patientId(), occurrenceKey, workflow.triggerType(), snapshot,
                            workflow.actions().size(), clock.instant());
                    return executionRepository.reserve(pending, workflow.maxRunsPerPatient())
                            .flatMap(reserved -> {
                                if (reserved.status() == ExecutionStatus.SKIPPED) {
                                    events.onExecutionSkipped(workflow.name(), reserved.id(), reserved.patientId(),
                                            reserved.errorMessage());
                                    return Mono.just(reserved);
                                }
                                return execute(workflow, reserved, patient.orElse(null), context);
                            });
                })
                .onErrorResume(PatientNotFoundException.class,
                        e -> recordFailure(workflow, candidate, occurrenceKey, snapshot, e.getMessage()))
                .onErrorResume(DuplicateExecutionException.class, e -> {
                    log.debug("[automation] occurrence already recorded workflow={} patientId={} occurrence={}",
                            workflow.id(), candidate.patientId(), occurrenceKey);
                    return Mono.empty();
                })
                .onErrorResume(e -> {
                    events.onWorkflowError(workflow.name(), e);
                    return Mono.empty();
                });
    }

    private Mono<WorkflowExecution> execute(Workflow workflow, WorkflowExecution reserved, Patient patient,
                                            Map<String, Object> context) {
        Instant started = clock.instant();
        RunContext runContext = new RunContext(workflow.id(), workflow.name(), workflow.organizationId(),
                reserved.id(), today(), context);
        events.onExecutionStarted(workflow.name(), reserved.id(), reserved.patientId());
        return executionRepository.update(reserved.start(started))
                .flatMap(running -> Flux.range(0, workflow.actions().size())
                        .concatMap(index -> runAction(workflow, running, index, patient, runContext))
                        .collectList()
                        .flatMap(results -> executionRepository.update(running.complete(results, clock.instant()))))
                .doOnNext(done -> events.onExecutionCompleted(workflow.name(), done.id(), done.status(),
                        Duration.between(started, clock.instant()).toMillis()))
                .onErrorResume(e -> failRun(workflow, reserved.id(), e));
    }

    private Mono<ActionResult> runAction(Workflow workflow, WorkflowExecution execution, int index,
                                         Patient patient, RunContext runContext) {
        ActionSpec action = workflow.actions().get(index);
        Mono<ActionResult> result = action.isDelayed()
                ? scheduleAction(workflow, execution, index, action)
                : actionExecutor.execute(index, action, patient, runContext);
        return result.doOnNext(r -> events.onActionCompleted(workflow.name(), execution.id(), r));
    }

    private Mono<ActionResult> scheduleAction(Workflow workflow, WorkflowExecution execution, int index,
                                              ActionSpec action) {
        Instant now = clock.instant();
        Instant dueAt = now.plus(Duration.ofHours(action.delayHoursOrZero()));
        ScheduledAction scheduled = ScheduledAction.pending(execution.id(), workflow.id(), workflow.organizationId(),
                execution.patientId(), index, action, execution.triggerSnapshot(), dueAt, now);
        return scheduledActionStore.save(scheduled)
                .map(saved -> {
                    events.onActionScheduled(workflow.name(), execution.id(), saved.id(), dueAt);
                    Map<String, Object> output = new LinkedHashMap<>();
                    output.put("due_at", dueAt.toString());
                    output.put("delay_hours", action.delayHoursOrZero());
                    return ActionResult.scheduled(index, action.type(), saved.id(), output, now);
                });
    }

    private Mono<WorkflowExecution> failRun(Workflow workflow, String executionId, Throwable error) {
        log.error("[automation] execution failed workflow={} executionId={} error={}",
                workflow.id(), executionId, error.getMessage(), error);
        events.onWorkflowError(workflow.name(), error);
        return executionRepository.findById(executionId)
                .flatMap(current -> current.status().isTerminal()
                        ? Mono.just(current)
                        : executionRepository.update(current.fail(describe(error), clock.instant())))
                .doOnNext(failed -> events.onExecutionCompleted(workflow.name(), failed.id(), failed.status(), 0));
    }

    private Mono<WorkflowExecution> recordFailure(Workflow workflow, TriggerCandidate candidate, String occurrenceKey,
                                                  Map<String, Object> snapshot, String error) {
        WorkflowExecution failed = WorkflowExecution.failed(workflow.id(), workflow.organizationId(),
                candidate.patientId(), occurrenceKey, workflow.triggerType(), snapshot, workflow.actions().size(),
                error, clock.instant());
        return executionRepository.insert(failed)
                .doOnNext(saved -> events.onExecutionCompleted(workflow.name(), saved.id(), saved.status(), 0));
    }

    // ── Scheduled actions ─────────────────────────────────────────

    private Mono<ScheduledAction> processScheduledAction(ScheduledAction scheduled) {
        return workflowRepository.findById(scheduled.workflowId())
                .filter(Workflow::active)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException(
                        "Workflow '" + scheduled.workflowId() + "' is no longer active")))
                .flatMap(workflow -> loadPatient(scheduled.organizationId(), scheduled.patientId())
                        .flatMap(patient -> {
                            Map<String, Object> context = PatientContext.build(patient.orElse(null),
                                    nested(scheduled.triggerData(), PatientContext.EVENT),
                                    nested(scheduled.triggerData(), PatientContext.TRIGGER));
                            RunContext runContext = new RunContext(workflow.id(), workflow.name(),
                                    scheduled.organizationId(), scheduled.executionId(), today(), context);
                            return actionExecutor.execute(scheduled.actionIndex(), scheduled.action(),
                                    patient.orElse(null), runContext);
                        }))
                .flatMap(result -> result.success()
                        ? scheduledActionStore.markCompleted(scheduled.id(), clock.instant())
                        : scheduledActionStore.markFailed(scheduled.id(), result.error(), clock.instant()));
    }

    // ── Helpers ───────────────────────────────────────────────────

    private WorkflowTestResult dryRun(Workflow definition, Patient patient) {
        LocalDate today = today();
        Map<String, Object> triggerData = sampleTriggerData(definition, patient, today);
        Map<String, Object> context = PatientContext.build(patient, Map.of(), triggerData);
        boolean passed = conditionEvaluator.evaluate(definition.conditions(), context);
        RunContext runContext = new RunContext(definition.id(), definition.name(), definition.organizationId(),
                null, today, context);
        List<ActionPreview> previews = IntStream.range(0, definition.actions().size())
                .mapToObj(i -> actionExecutor.preview(i, definition.actions().get(i), patient, runContext))
                .toList();
        log.info("[automation] dry run workflow={} patientId={} conditionsPassed={} actions={}",
                definition.name(), patient.id(), passed, previews.size());
        return new WorkflowTestResult(definition.id(), definition.name(), definition.triggerType(),
                WorkflowTestResult.PatientSummary.of(patient), passed, triggerData, previews);
    }

    private static Map<String, Object> sampleTriggerData(Workflow definition, Patient patient, LocalDate today) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("trigger_type", definition.triggerType().name());
        if (definition.triggerType() == TriggerType.DAYS_SINCE_VISIT && patient.lastVisitDate() != null) {
            data.put("days_since_visit", ChronoUnit.DAYS.between(patient.lastVisitDate(), today));
            data.put("last_visit_date", patient.lastVisitDate().toString());
        } else if (definition.triggerType() == TriggerType.BIRTHDAY && patient.dateOfBirth() != null) {
            LocalDate next = patient.dateOfBirth().withYear(today.getYear());
            if (next.isBefore(today)) {
                next = patient.dateOfBirth().withYear(today.getYear() + 1);
            }
            data.put("age", TriggerEvaluator.ageOn(patient.dateOfBirth(), next));
            data.put("birth_date", patient.dateOfBirth().toString());
        }
        return data;
    }

    private Mono<Optional<Patient>> loadPatient(String organizationId, String patientId) {
        if (patientId == null) {
            return Mono.just(Optional.empty());
        }
        return patientRepository.findById(organizationId, patientId)
                .map(Optional::of)
                .switchIfEmpty(Mono.error(() -> new PatientNotFoundException(patientId)));
    }

    private static Map<String, Object> snapshot(Occurrence occurrence, TriggerCandidate candidate) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put(PatientContext.EVENT, occurrence.payload());
        snapshot.put(PatientContext.TRIGGER, candidate.triggerData());
        return snapshot;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> nested(Map<String, Object> map, String key) {
        return map.get(key) instanceof Map<?, ?> inner ? (Map<String, Object>) inner : Map.of();
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
