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

package org.fireflyframework.automation.config;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.core.event.AppointmentReminderPublisher;
import org.fireflyframework.automation.core.event.DomainEventGateway;
import org.fireflyframework.automation.core.observability.AutomationEvents;
import org.fireflyframework.automation.core.observability.AutomationLoggerEvents;
import org.fireflyframework.automation.core.observability.CompositeAutomationEvents;
import org.fireflyframework.automation.core.recovery.RecoveryInitializer;
import org.fireflyframework.automation.core.recovery.RecoveryService;
import org.fireflyframework.automation.core.resilience.ResilienceDecorator;
import org.fireflyframework.automation.core.template.TemplateRenderer;
import org.fireflyframework.automation.core.validation.WorkflowValidator;
import org.fireflyframework.automation.integration.CommunicationSender;
import org.fireflyframework.automation.integration.AppointmentCalendar;
import org.fireflyframework.automation.integration.FollowUpStore;
import org.fireflyframework.automation.integration.InMemoryAppointmentCalendar;
import org.fireflyframework.automation.integration.InMemoryFollowUpStore;
import org.fireflyframework.automation.integration.InMemoryPatientRepository;
import org.fireflyframework.automation.integration.InMemoryStaffDirectory;
import org.fireflyframework.automation.integration.LoggingCommunicationSender;
import org.fireflyframework.automation.integration.PatientRepository;
import org.fireflyframework.automation.integration.StaffDirectory;
import org.fireflyframework.automation.workflow.action.ActionDefaults;
import org.fireflyframework.automation.workflow.action.ActionExecutor;
import org.fireflyframework.automation.workflow.action.FollowUpActionHandler;
import org.fireflyframework.automation.workflow.action.MessageActionHandler;
import org.fireflyframework.automation.workflow.action.PatientUpdateActionHandler;
import org.fireflyframework.automation.workflow.action.StaffNotificationActionHandler;
import org.fireflyframework.automation.workflow.condition.ConditionEvaluator;
import org.fireflyframework.automation.workflow.engine.AutomationEngine;
import org.fireflyframework.automation.workflow.engine.EngineSettings;
import org.fireflyframework.automation.workflow.execution.ExecutionRepository;
import org.fireflyframework.automation.workflow.execution.InMemoryExecutionRepository;
import org.fireflyframework.automation.workflow.execution.InMemoryScheduledActionStore;
import org.fireflyframework.automation.workflow.execution.ScheduledActionStore;
import org.fireflyframework.automation.workflow.repository.InMemoryWorkflowRepository;
import org.fireflyframework.automation.workflow.repository.WorkflowRepository;
import org.fireflyframework.automation.workflow.service.TriggerInsightService;
import org.fireflyframework.automation.workflow.service.WorkflowDefinitionCodec;
import org.fireflyframework.automation.workflow.service.WorkflowService;
import org.fireflyframework.automation.workflow.trigger.TriggerEvaluator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.ZoneId;
import java.util.List;

/**
 * Main auto-configuration for the patient automation engine.
 *
 * <p>Wires the engine with in-memory stores and a logging message sender. Host
 * applications replace any of them by declaring their own bean of the same type;
 * in production at least {@link PatientRepository}, {@link CommunicationSender},
 * {@link FollowUpStore}, {@link StaffDirectory} and {@link AppointmentCalendar} are
 * expected to be supplied.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(AutomationProperties.class)
@ConditionalOnProperty(name = "firefly.automation.engine.enabled", havingValue = "true", matchIfMissing = true)
public class AutomationAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock automationClock() {
        return Clock.systemDefaultZone();
    }

    // ── Observability ─────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    public AutomationLoggerEvents automationLoggerEvents() {
        return new AutomationLoggerEvents();
    }

    /**
     * Fans lifecycle notifications out to every other {@link AutomationEvents} bean
     * (the logger, metrics when enabled, and any listener the application declares).
     */
    @Bean
    @Primary
    @ConditionalOnMissingBean(name = "automationEvents")
    public CompositeAutomationEvents automationEvents(ObjectProvider<AutomationEvents> listeners) {
        List<AutomationEvents> delegates = listeners.orderedStream()
                .filter(l -> !(l instanceof CompositeAutomationEvents))
                .toList();
        log.info("[automation] Lifecycle events composed from {} listener(s)", delegates.size());
        return new CompositeAutomationEvents(delegates);
    }

    // ── Stores and collaborators ──────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    public WorkflowRepository workflowRepository() {
        log.info("[automation] Using in-memory workflow repository (default)");
        return new InMemoryWorkflowRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionRepository executionRepository() {
        log.info("[automation] Using in-memory execution repository (default)");
        return new InMemoryExecutionRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduledActionStore scheduledActionStore() {
        return new InMemoryScheduledActionStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public PatientRepository patientRepository() {
        log.warn("[automation] No PatientRepository bean found, using in-memory patients");
        return new InMemoryPatientRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public CommunicationSender communicationSender() {
        log.warn("[automation] No CommunicationSender bean found, outbound messages will only be logged");
        return new LoggingCommunicationSender();
    }

    @Bean
    @ConditionalOnMissingBean
    public FollowUpStore followUpStore() {
        return new InMemoryFollowUpStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public StaffDirectory staffDirectory() {
        return new InMemoryStaffDirectory();
    }

    @Bean
    @ConditionalOnMissingBean
    public AppointmentCalendar appointmentCalendar() {
        return new InMemoryAppointmentCalendar();
    }

    // ── Evaluation ────────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    public TemplateRenderer templateRenderer() {
        return new TemplateRenderer();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConditionEvaluator conditionEvaluator() {
        return new ConditionEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowValidator workflowValidator(TemplateRenderer templateRenderer) {
        return new WorkflowValidator(templateRenderer);
    }

    @Bean
    @ConditionalOnMissingBean
    public TriggerEvaluator triggerEvaluator(PatientRepository patientRepository, AutomationProperties properties) {
        var defaults = properties.getDefaults();
        return new TriggerEvaluator(patientRepository, defaults.getExcludedStatuses(), defaults.getDaysSinceVisit());
    }

    // ── Actions ───────────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    public ActionDefaults actionDefaults(AutomationProperties properties) {
        var defaults = properties.getDefaults();
        return new ActionDefaults(defaults.getFollowUpDueInDays(), defaults.getTaskDueInDays(),
                ActionDefaults.standard().priority(), defaults.getStaffRoles());
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageActionHandler messageActionHandler(CommunicationSender sender, TemplateRenderer renderer,
                                                     ObjectProvider<ResilienceDecorator> resilience) {
        return new MessageActionHandler(sender, renderer, resilience.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public FollowUpActionHandler followUpActionHandler(FollowUpStore followUpStore, TemplateRenderer renderer,
                                                       ActionDefaults actionDefaults) {
        return new FollowUpActionHandler(followUpStore, renderer, actionDefaults);
    }

    @Bean
    @ConditionalOnMissingBean
    public PatientUpdateActionHandler patientUpdateActionHandler(PatientRepository patientRepository) {
        return new PatientUpdateActionHandler(patientRepository);
    }

    @Bean
    @ConditionalOnMissingBean
    public StaffNotificationActionHandler staffNotificationActionHandler(StaffDirectory staffDirectory,
                                                                         FollowUpStore followUpStore,
                                                                         TemplateRenderer renderer,
                                                                         ActionDefaults actionDefaults) {
        return new StaffNotificationActionHandler(staffDirectory, followUpStore, renderer, actionDefaults);
    }

    @Bean
    @ConditionalOnMissingBean
    public ActionExecutor actionExecutor(MessageActionHandler messageActionHandler,
                                         FollowUpActionHandler followUpActionHandler,
                                         PatientUpdateActionHandler patientUpdateActionHandler,
                                         StaffNotificationActionHandler staffNotificationActionHandler,
                                         Clock clock,
                                         AutomationProperties properties) {
        return new ActionExecutor(messageActionHandler, followUpActionHandler, patientUpdateActionHandler,
                staffNotificationActionHandler, clock, properties.getEngine().getActionTimeout());
    }

    // ── Engine and services ───────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    public EngineSettings engineSettings(AutomationProperties properties) {
        return new EngineSettings(properties.getEngine().getMaxConcurrentRuns(),
                properties.getExecutions().getDefaultPageSize(),
                properties.getExecutions().getMaxPageSize(),
                EngineSettings.defaults().scheduledActionBatchSize(),
                zone(properties.getScheduling().getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public AutomationEngine automationEngine(WorkflowRepository workflowRepository,
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
        log.info("[automation] Engine initialized with max concurrent runs: {}", settings.maxConcurrentRuns());
        return new AutomationEngine(workflowRepository, executionRepository, scheduledActionStore,
                patientRepository, triggerEvaluator, conditionEvaluator, actionExecutor, workflowValidator,
                events, clock, settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public DomainEventGateway domainEventGateway(AutomationEngine engine) {
        return new DomainEventGateway(engine);
    }

    @Bean
    @ConditionalOnMissingBean
    public AppointmentReminderPublisher appointmentReminderPublisher(DomainEventGateway gateway,
                                                                     AppointmentCalendar calendar, Clock clock,
                                                                     AutomationProperties properties) {
        return new AppointmentReminderPublisher(gateway, calendar, clock,
                properties.getScheduling().getReminderWindowDays());
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowDefinitionCodec workflowDefinitionCodec() {
        return new WorkflowDefinitionCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowService workflowService(WorkflowRepository workflowRepository, WorkflowValidator validator,
                                           Clock clock, AutomationProperties properties) {
        return new WorkflowService(workflowRepository, validator, clock, properties.getExecutions().getMaxPageSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public TriggerInsightService triggerInsightService(WorkflowRepository workflowRepository,
                                                       ExecutionRepository executionRepository,
                                                       PatientRepository patientRepository,
                                                       Clock clock, EngineSettings settings,
                                                       AutomationProperties properties) {
        Clock zoned = settings.zone() == null ? clock : clock.withZone(settings.zone());
        return new TriggerInsightService(workflowRepository, executionRepository, patientRepository, zoned,
                properties.getDefaults().getExcludedStatuses());
    }

    // ── Recovery ──────────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.automation.recovery.enabled", havingValue = "true", matchIfMissing = true)
    public RecoveryService recoveryService(ExecutionRepository executionRepository, AutomationEvents events,
                                           Clock clock, AutomationProperties properties) {
        log.info("[automation] Recovery service initialized with stale threshold: {}",
                properties.getRecovery().getStaleThreshold());
        return new RecoveryService(executionRepository, events, clock, properties.getRecovery().getStaleThreshold());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = {"firefly.automation.recovery.enabled", "firefly.automation.recovery.reconcile-on-startup"},
            havingValue = "true", matchIfMissing = true)
    public RecoveryInitializer recoveryInitializer(RecoveryService recoveryService) {
        return new RecoveryInitializer(recoveryService);
    }

    private static ZoneId zone(String zone) {
        return zone == null || zone.isBlank() ? null : ZoneId.of(zone);
    }
}
