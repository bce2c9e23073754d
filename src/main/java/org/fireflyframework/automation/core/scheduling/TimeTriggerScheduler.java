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

package org.fireflyframework.automation.core.scheduling;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.core.event.AppointmentReminderPublisher;
import org.fireflyframework.automation.workflow.engine.AutomationEngine;
import org.fireflyframework.automation.workflow.engine.TriggerSummary;
import org.fireflyframework.automation.workflow.model.TriggerType;
import org.fireflyframework.automation.workflow.repository.WorkflowRepository;
import org.springframework.beans.factory.SmartInitializingSingleton;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * Registers the recurring automation jobs with the {@link AutomationScheduler} once the
 * application context is ready: the daily tick that evaluates time-based triggers for
 * every organization that has an active time-triggered workflow, the appointment
 * reminder pass, and the poll that runs delayed actions that have come due.
 *
 * <p>Both the tick and the reminder pass use {@link AutomationEngine#today()} as the
 * calendar day.
 */
@Slf4j
public class TimeTriggerScheduler implements SmartInitializingSingleton {

    static final String TIME_TRIGGERS_TASK = "automation.time-triggers";
    static final String SCHEDULED_ACTIONS_TASK = "automation.scheduled-actions";
    static final String REMINDERS_TASK = "automation.appointment-reminders";

    private static final List<TriggerType> TIME_TRIGGERS = Arrays.stream(TriggerType.values())
            .filter(TriggerType::isTimeBased)
            .toList();

    private final AutomationScheduler scheduler;
    private final AutomationEngine engine;
    private final WorkflowRepository workflowRepository;
    private final AppointmentReminderPublisher reminders;
    private final Clock clock;
    private final String cron;
    private final String reminderCron;
    private final String zone;
    private final Duration scheduledActionsInterval;

    public TimeTriggerScheduler(AutomationScheduler scheduler, AutomationEngine engine,
                                WorkflowRepository workflowRepository, AppointmentReminderPublisher reminders,
                                Clock clock, String cron, String reminderCron, String zone,
                                Duration scheduledActionsInterval) {
        this.scheduler = scheduler;
        this.engine = engine;
        this.workflowRepository = workflowRepository;
        this.reminders = reminders;
        this.clock = clock;
        this.cron = cron;
        this.reminderCron = reminderCron;
        this.zone = zone;
        this.scheduledActionsInterval = scheduledActionsInterval;
    }

    @Override
    public void afterSingletonsInstantiated() {
        scheduler.scheduleWithCron(TIME_TRIGGERS_TASK,
                () -> runTimeTriggers().subscribe(
                        count -> log.info("[scheduler] daily tick finished organizations={}", count),
                        e -> log.error("[scheduler] daily tick failed: {}", e.getMessage(), e)),
                cron, zone);
        scheduler.scheduleWithCron(REMINDERS_TASK,
                () -> runAppointmentReminders().subscribe(
                        summary -> log.debug("[scheduler] reminder pass finished sent={}", summary.sent()),
                        e -> log.error("[scheduler] appointment reminders failed: {}", e.getMessage(), e)),
                reminderCron, zone);
        scheduler.scheduleWithFixedDelay(SCHEDULED_ACTIONS_TASK,
                () -> runScheduledActions().subscribe(
                        count -> {
                            if (count > 0) {
                                log.info("[scheduler] delayed actions processed count={}", count);
                            }
                        },
                        e -> log.error("[scheduler] delayed action poll failed: {}", e.getMessage(), e)),
                scheduledActionsInterval, scheduledActionsInterval);
    }

    /**
     * Processes today's tick for each organization with active time-triggered workflows.
     * A failure in one organization is logged and the others still run.
     *
     * @return number of organizations processed
     */
    public Mono<Long> runTimeTriggers() {
        LocalDate today = engine.today();
        return workflowRepository.findOrganizationsWithActiveTriggers(TIME_TRIGGERS)
                .concatMap(organizationId -> engine.processTimeBasedTriggers(organizationId, today)
                        .doOnNext(summary -> logSummary(organizationId, summary))
                        .onErrorResume(e -> {
                            log.error("[scheduler] time triggers failed organizationId={}: {}",
                                    organizationId, e.getMessage(), e);
                            return Mono.empty();
                        }))
                .count();
    }

    public Mono<AppointmentReminderPublisher.ReminderSummary> runAppointmentReminders() {
        return reminders.publishReminders(engine.today());
    }

    /** @return number of delayed actions claimed and processed */
    public Mono<Long> runScheduledActions() {
        return engine.processScheduledActions(clock.instant()).count();
    }

    private static void logSummary(String organizationId, TriggerSummary summary) {
        log.info("[scheduler] time triggers organizationId={} executions={} completed={} skipped={} failed={}",
                organizationId, summary.executions().size(), summary.completed(), summary.skipped(),
                summary.failed());
    }
}
