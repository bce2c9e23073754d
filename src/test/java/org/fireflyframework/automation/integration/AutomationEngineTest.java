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

import org.fireflyframework.automation.core.event.AppointmentReminderPublisher;
import org.fireflyframework.automation.core.event.AppointmentReminderPublisher.ReminderSummary;
import org.fireflyframework.automation.core.event.DomainEvent;
import org.fireflyframework.automation.core.event.DomainEventGateway;
import org.fireflyframework.automation.core.model.ActionStatus;
import org.fireflyframework.automation.core.model.ExecutionStatus;
import org.fireflyframework.automation.core.model.ScheduledActionStatus;
import org.fireflyframework.automation.core.observability.AutomationEvents;
import org.fireflyframework.automation.core.recovery.RecoveryService;
import org.fireflyframework.automation.core.template.TemplateRenderer;
import org.fireflyframework.automation.core.validation.WorkflowValidator;
import org.fireflyframework.automation.workflow.action.ActionDefaults;
import org.fireflyframework.automation.workflow.action.ActionExecutor;
import org.fireflyframework.automation.workflow.action.FollowUpActionHandler;
import org.fireflyframework.automation.workflow.action.MessageActionHandler;
import org.fireflyframework.automation.workflow.action.PatientUpdateActionHandler;
import org.fireflyframework.automation.workflow.action.StaffNotificationActionHandler;
import org.fireflyframework.automation.workflow.condition.ConditionEvaluator;
import org.fireflyframework.automation.workflow.engine.AutomationEngine;
import org.fireflyframework.automation.workflow.engine.EngineSettings;
import org.fireflyframework.automation.workflow.engine.TriggerSummary;
import org.fireflyframework.automation.workflow.execution.ExecutionQuery;
import org.fireflyframework.automation.workflow.execution.InMemoryExecutionRepository;
import org.fireflyframework.automation.workflow.execution.InMemoryScheduledActionStore;
import org.fireflyframework.automation.workflow.execution.ScheduledAction;
import org.fireflyframework.automation.workflow.execution.WorkflowExecution;
import org.fireflyframework.automation.workflow.model.ActionSpec;
import org.fireflyframework.automation.workflow.model.ConditionClause;
import org.fireflyframework.automation.workflow.model.ConditionLogic;
import org.fireflyframework.automation.workflow.model.ConditionOperator;
import org.fireflyframework.automation.workflow.model.TriggerConfig;
import org.fireflyframework.automation.workflow.model.TriggerType;
import org.fireflyframework.automation.workflow.model.Workflow;
import org.fireflyframework.automation.workflow.repository.InMemoryWorkflowRepository;
import org.fireflyframework.automation.workflow.trigger.TriggerEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

/**
 * Drives the engine end to end over the in-memory stores: trigger matching, condition
 * evaluation, run limits, action execution, delayed actions and dry runs.
 */
class AutomationEngineTest {

    private static final String ORG = "org-1";
    private static final Instant NOW = Instant.parse("2026-03-10T09:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    private RecordingSender sender;
    private InMemoryWorkflowRepository workflows;
    private InMemoryExecutionRepository executions;
    private InMemoryScheduledActionStore scheduledActions;
    private InMemoryPatientRepository patients;
    private InMemoryFollowUpStore followUps;
    private ActionExecutor actionExecutor;
    private AutomationEngine engine;

    /** Records outgoing messages; fails every message when {@code failing} is set. */
    static class RecordingSender implements CommunicationSender {
        final List<OutboundMessage> sent = new CopyOnWriteArrayList<>();
        volatile boolean failing;

        @Override
        public Mono<DeliveryReceipt> send(OutboundMessage message) {
            if (failing) {
                return Mono.error(new IllegalStateException("gateway down"));
            }
            sent.add(message);
            return Mono.just(new DeliveryReceipt("msg-" + sent.size(), "QUEUED"));
        }
    }

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        sender = new RecordingSender();
        workflows = new InMemoryWorkflowRepository();
        executions = new InMemoryExecutionRepository();
        scheduledActions = new InMemoryScheduledActionStore();
        patients = new InMemoryPatientRepository();
        followUps = new InMemoryFollowUpStore();
        TemplateRenderer renderer = new TemplateRenderer();
        ActionDefaults defaults = ActionDefaults.standard();
        actionExecutor = new ActionExecutor(
                new MessageActionHandler(sender, renderer, null),
                new FollowUpActionHandler(followUps, renderer, defaults),
                new PatientUpdateActionHandler(patients),
                new StaffNotificationActionHandler(new InMemoryStaffDirectory(), followUps, renderer, defaults),
                clock,
                Duration.ofSeconds(5));
        engine = engine(clock, new EngineSettings(4, 2, 3, 10));

        patients.save(Patient.of("p-1", ORG, "Kari", "Nordmann").withContact("kari@example.com", "+4799999999")
                .withVisits(TODAY.minusDays(42), 3)).block();
    }

    private AutomationEngine engine(Clock clock, EngineSettings settings) {
        return new AutomationEngine(workflows, executions, scheduledActions, patients,
                new TriggerEvaluator(patients, List.of("INACTIVE", "ARCHIVED"), 42),
                new ConditionEvaluator(), actionExecutor, new WorkflowValidator(new TemplateRenderer()),
                new AutomationEvents() {}, clock, settings);
    }

    private Workflow save(Workflow workflow) {
        return workflows.save(workflow).block();
    }

    private static DomainEvent missed(String eventId, String patientId) {
        return new DomainEvent(eventId, ORG, TriggerType.APPOINTMENT_MISSED, patientId,
                Map.of("appointment_type", "Physio"), NOW);
    }

    private TriggerSummary trigger(DomainEvent event) {
        return engine.triggerWorkflow(event).block();
    }

    @Test
    void missedAppointment_sendsRenderedSmsAndRecordsCompletedRun() {
        save(Workflow.builder("Missed appointment").id("wf-1").organization(ORG)
                .trigger(TriggerType.APPOINTMENT_MISSED)
                .when("status", ConditionOperator.EQUALS, "ACTIVE")
                .sendSms("Hei {fornavn}, vi savnet deg i dag.")
                .build());

        StepVerifier.create(engine.triggerWorkflow(missed("evt-1", "p-1")))
                .assertNext(summary -> {
                    assertThat(summary.occurrence()).isEqualTo("event:evt-1");
                    assertThat(summary.completed()).isEqualTo(1);
                    WorkflowExecution run = summary.executions().get(0);
                    assertThat(run.patientId()).isEqualTo("p-1");
                    assertThat(run.actionResults()).extracting(r -> r.status())
                            .containsExactly(ActionStatus.SUCCEEDED);
                })
                .verifyComplete();

        assertThat(sender.sent).singleElement().satisfies(msg -> {
            assertThat(msg.channel()).isEqualTo(OutboundMessage.Channel.SMS);
            assertThat(msg.recipient()).isEqualTo("+4799999999");
            assertThat(msg.body()).isEqualTo("Hei Kari, vi savnet deg i dag.");
        });
    }

    @Test
    void unmatchedConditions_andOtherOrganizations_leaveNoRecord() {
        save(Workflow.builder("VIP only").id("wf-1").organization(ORG).trigger(TriggerType.APPOINTMENT_MISSED)
                .when("tags", ConditionOperator.CONTAINS, "vip").sendSms("Hi").build());
        save(Workflow.builder("Other clinic").id("wf-2").organization("org-2")
                .trigger(TriggerType.APPOINTMENT_MISSED).sendSms("Hi").build());

        assertThat(trigger(missed("evt-1", "p-1")).executions()).isEmpty();
        assertThat(executions.size()).isZero();
        assertThat(sender.sent).isEmpty();
    }

    @Test
    void runLimit_skipsFurtherOccurrencesForTheSamePatient() {
        save(Workflow.builder("Twice at most").id("wf-1").organization(ORG).trigger(TriggerType.APPOINTMENT_MISSED)
                .maxRunsPerPatient(2).sendSms("Hi").build());

        trigger(missed("evt-1", "p-1"));
        trigger(missed("evt-2", "p-1"));
        TriggerSummary third = trigger(missed("evt-3", "p-1"));

        assertThat(third.skipped()).isEqualTo(1);
        assertThat(third.executions().get(0).errorMessage()).contains("Max runs per patient reached");
        assertThat(sender.sent).hasSize(2);
    }

    @Test
    void retentionCleanup_doesNotResetTheRunLimit() {
        save(Workflow.builder("Once").id("wf-1").organization(ORG).trigger(TriggerType.APPOINTMENT_MISSED)
                .maxRunsPerPatient(1).sendSms("Hi").build());
        trigger(missed("evt-1", "p-1"));

        RecoveryService later = new RecoveryService(executions, new AutomationEvents() {},
                Clock.fixed(NOW.plus(Duration.ofDays(100)), ZoneOffset.UTC), Duration.ofHours(1));
        StepVerifier.create(later.cleanupExecutions(Duration.ofDays(30)))
                .expectNext(0L)
                .verifyComplete();

        TriggerSummary second = trigger(missed("evt-2", "p-1"));
        assertThat(second.skipped()).isEqualTo(1);
        assertThat(sender.sent).hasSize(1);
    }

    @Test
    void sameEventDeliveredTwice_runsOnce() {
        save(Workflow.builder("Unlimited").id("wf-1").organization(ORG).trigger(TriggerType.APPOINTMENT_MISSED)
                .maxRunsPerPatient(0).sendSms("Hi").build());

        trigger(missed("evt-1", "p-1"));
        TriggerSummary redelivered = trigger(missed("evt-1", "p-1"));

        assertThat(redelivered.executions()).isEmpty();
        assertThat(sender.sent).hasSize(1);
    }

    @Test
    void failingAction_doesNotStopLaterActions() {
        save(Workflow.builder("Mixed").id("wf-1").organization(ORG).trigger(TriggerType.APPOINTMENT_MISSED)
                .sendSms("Hi").addTag("missed-appointment").build());
        sender.failing = true;

        WorkflowExecution run = trigger(missed("evt-1", "p-1")).executions().get(0);

        assertThat(run.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(run.actionResults()).extracting(r -> r.status())
                .containsExactly(ActionStatus.FAILED, ActionStatus.SUCCEEDED);
        assertThat(run.actionResults().get(0).error()).contains("gateway down");
        assertThat(patients.findById(ORG, "p-1").block().tags()).contains("missed-appointment");
    }

    @Test
    void conditionError_recordsFailedRun() {
        save(new Workflow("wf-1", ORG, "Broken", null, TriggerType.APPOINTMENT_MISSED, null,
                List.of(new ConditionClause("status", null, "ACTIVE", ConditionLogic.AND)),
                List.of(new ActionSpec.SendSms("Hi")), true, 1, null, NOW, NOW));

        WorkflowExecution run = trigger(missed("evt-1", "p-1")).executions().get(0);

        assertThat(run.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(run.errorMessage()).startsWith("Condition evaluation failed");
        assertThat(sender.sent).isEmpty();
    }

    @Test
    void unknownPatient_recordsFailedRun() {
        save(Workflow.builder("Missed").id("wf-1").organization(ORG).trigger(TriggerType.APPOINTMENT_MISSED)
                .sendSms("Hi").build());

        WorkflowExecution run = trigger(missed("evt-1", "ghost")).executions().get(0);

        assertThat(run.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(run.patientId()).isEqualTo("ghost");
    }

    @Test
    void dailyTick_isIdempotentPerDay() {
        save(Workflow.builder("Recall").id("wf-1").organization(ORG)
                .trigger(TriggerType.DAYS_SINCE_VISIT, TriggerConfig.daysSinceVisit(42))
                .maxRunsPerPatient(0)
                .sendSms("Hei {fornavn}, det er {lastVisit} siden sist.")
                .build());

        TriggerSummary first = engine.processTimeBasedTriggers(ORG, TODAY).block();
        TriggerSummary again = engine.processTimeBasedTriggers(ORG, TODAY).block();

        assertThat(first.occurrence()).isEqualTo("tick:org-1:2026-03-10");
        assertThat(first.completed()).isEqualTo(1);
        assertThat(again.executions()).isEmpty();

        // a later visit brings the patient back to the 42-day mark on a new day
        LocalDate tomorrow = TODAY.plusDays(1);
        patients.save(patients.findById(ORG, "p-1").block().withVisits(tomorrow.minusDays(42), 4)).block();
        TriggerSummary nextDay = engine.processTimeBasedTriggers(ORG, tomorrow).block();

        assertThat(nextDay.completed()).isEqualTo(1);
        assertThat(sender.sent).hasSize(2);
    }

    @Test
    void currentDayTick_usesTheConfiguredZone() {
        // 23:30 UTC is already the next day in Oslo
        Clock lateEvening = Clock.fixed(Instant.parse("2026-03-10T23:30:00Z"), ZoneOffset.UTC);
        AutomationEngine oslo = engine(lateEvening, new EngineSettings(4, 2, 3, 10, ZoneId.of("Europe/Oslo")));
        AutomationEngine utc = engine(lateEvening, new EngineSettings(4, 2, 3, 10));

        assertThat(oslo.today()).isEqualTo(LocalDate.of(2026, 3, 11));
        assertThat(utc.today()).isEqualTo(LocalDate.of(2026, 3, 10));
        StepVerifier.create(oslo.processTimeBasedTriggers(ORG))
                .assertNext(summary -> assertThat(summary.occurrence()).isEqualTo("tick:" + ORG + ":2026-03-11"))
                .verifyComplete();
    }

    @Test
    void appointmentReminders_goOutOncePerAppointment() {
        save(Workflow.builder("Reminder").id("wf-1").organization(ORG).trigger(TriggerType.APPOINTMENT_SCHEDULED)
                .maxRunsPerPatient(0).sendSms("Hei {fornavn}, husk timen din.").build());
        InMemoryAppointmentCalendar calendar = new InMemoryAppointmentCalendar();
        calendar.save(Appointment.scheduled("apt-1", ORG, "p-1", "Physio", TODAY.plusDays(1), LocalTime.of(10, 0)))
                .block();
        calendar.save(Appointment.scheduled("apt-2", ORG, "p-1", "Physio", TODAY.plusDays(5), null)).block();
        calendar.save(new Appointment("apt-3", ORG, "p-1", "Physio", TODAY.plusDays(1), null, "CANCELLED", false))
                .block();
        AppointmentReminderPublisher reminders = new AppointmentReminderPublisher(new DomainEventGateway(engine),
                calendar, Clock.fixed(NOW, ZoneOffset.UTC), 2);

        StepVerifier.create(reminders.publishReminders(TODAY))
                .expectNext(new ReminderSummary(1, 1))
                .verifyComplete();
        StepVerifier.create(reminders.publishReminders(TODAY))
                .expectNext(new ReminderSummary(0, 0))
                .verifyComplete();

        assertThat(sender.sent).singleElement()
                .satisfies(msg -> assertThat(msg.body()).isEqualTo("Hei Kari, husk timen din."));
        assertThat(calendar.findById("apt-1").block().reminderSent()).isTrue();
        assertThat(calendar.findById("apt-2").block().reminderSent()).isFalse();
        assertThat(executions.findByWorkflow("wf-1").map(WorkflowExecution::occurrenceKey).collectList().block())
                .containsExactly("event:reminder:apt-1");
    }

    @Test
    void delayedAction_runsWhenDue() {
        save(Workflow.builder("Follow up later").id("wf-1").organization(ORG).trigger(TriggerType.APPOINTMENT_MISSED)
                .action(new ActionSpec.SendSms("Hei {fornavn}", null, 24))
                .build());

        WorkflowExecution run = trigger(missed("evt-1", "p-1")).executions().get(0);

        assertThat(run.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(run.actionResults().get(0).status()).isEqualTo(ActionStatus.SCHEDULED);
        assertThat(run.actionResults().get(0).output()).containsEntry("delay_hours", 24);
        assertThat(sender.sent).isEmpty();

        assertThat(engine.processScheduledActions(NOW.plus(Duration.ofHours(23))).collectList().block()).isEmpty();

        List<ScheduledAction> processed = engine.processScheduledActions(NOW.plus(Duration.ofHours(24)))
                .collectList().block();

        assertThat(processed).singleElement()
                .satisfies(a -> assertThat(a.status()).isEqualTo(ScheduledActionStatus.COMPLETED));
        assertThat(sender.sent).singleElement().satisfies(msg -> assertThat(msg.body()).isEqualTo("Hei Kari"));
    }

    @Test
    void delayedActionOfDeactivatedWorkflow_isFailedWithoutRunning() {
        Workflow wf = save(Workflow.builder("Follow up later").id("wf-1").organization(ORG)
                .trigger(TriggerType.APPOINTMENT_MISSED)
                .action(new ActionSpec.SendSms("Hi", null, 2))
                .build());
        trigger(missed("evt-1", "p-1"));
        save(wf.withActive(false, NOW));

        List<ScheduledAction> processed = engine.processScheduledActions(NOW.plus(Duration.ofHours(3)))
                .collectList().block();

        assertThat(processed).singleElement().satisfies(a -> {
            assertThat(a.status()).isEqualTo(ScheduledActionStatus.FAILED);
            assertThat(a.errorMessage()).contains("no longer active");
        });
        assertThat(sender.sent).isEmpty();
    }

    @Test
    void dryRun_rendersActionsWithoutSideEffects() {
        Workflow draft = Workflow.builder("Recall draft").organization(ORG)
                .trigger(TriggerType.DAYS_SINCE_VISIT, TriggerConfig.daysSinceVisit(42))
                .when("trigger.days_since_visit", ConditionOperator.GREATER_THAN, 41)
                .sendSms("Hei {fornavn}")
                .addTag("recall")
                .build();

        StepVerifier.create(engine.testWorkflow(draft, "p-1"))
                .assertNext(result -> {
                    assertThat(result.conditionsPassed()).isTrue();
                    assertThat(result.triggerData()).containsEntry("days_since_visit", 42L);
                    assertThat(result.patient().name()).isEqualTo("Kari Nordmann");
                    assertThat(result.actions()).hasSize(2);
                    assertThat(result.actions().get(0).payload()).containsEntry("body", "Hei Kari");
                })
                .verifyComplete();

        assertThat(sender.sent).isEmpty();
        assertThat(executions.size()).isZero();
        assertThat(patients.findById(ORG, "p-1").block().tags()).doesNotContain("recall");
    }

    @Test
    void executionHistory_isPagedNewestFirst() {
        save(Workflow.builder("Unlimited").id("wf-1").organization(ORG).trigger(TriggerType.APPOINTMENT_MISSED)
                .maxRunsPerPatient(0).sendSms("Hi").build());
        for (int i = 1; i <= 5; i++) {
            trigger(missed("evt-" + i, "p-1"));
        }

        StepVerifier.create(engine.getWorkflowExecutions("wf-1", ExecutionQuery.firstPage()))
                .assertNext(page -> {
                    assertThat(page.limit()).isEqualTo(2);
                    assertThat(page.total()).isEqualTo(5);
                    assertThat(page.pages()).isEqualTo(3);
                    assertThat(page.items()).hasSize(2);
                })
                .verifyComplete();

        StepVerifier.create(engine.getWorkflowExecutions("wf-1",
                        new ExecutionQuery(1, 50, ExecutionStatus.COMPLETED)))
                .assertNext(page -> {
                    assertThat(page.limit()).isEqualTo(3);
                    assertThat(page.items()).hasSize(3);
                    assertThat(page.total()).isEqualTo(5);
                })
                .verifyComplete();
    }

    @Test
    void executionHistory_pageFarPastTheEnd_isEmpty() {
        save(Workflow.builder("Missed").id("wf-1").organization(ORG).trigger(TriggerType.APPOINTMENT_MISSED)
                .sendSms("Hi").build());
        trigger(missed("evt-1", "p-1"));

        StepVerifier.create(engine.getWorkflowExecutions("wf-1", ExecutionQuery.of((1 << 30) + 1, 2)))
                .assertNext(page -> {
                    assertThat(page.items()).isEmpty();
                    assertThat(page.total()).isEqualTo(1);
                    assertThat(page.page()).isEqualTo((1 << 30) + 1);
                })
                .verifyComplete();
    }
}
