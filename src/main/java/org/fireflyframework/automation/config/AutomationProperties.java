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

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the patient automation engine.
 *
 * <p>Example YAML:
 * <pre>{@code
 * firefly:
 *   automation:
 *     engine:
 *       enabled: true
 *       max-concurrent-runs: 4
 *       action-timeout: 30s
 *     defaults:
 *       follow-up-due-in-days: 7
 *       task-due-in-days: 1
 *       staff-roles: [ADMIN, PRACTITIONER]
 *       excluded-statuses: [INACTIVE, ARCHIVED, DECEASED]
 *       days-since-visit: 42
 *     scheduling:
 *       enabled: true
 *       thread-pool-size: 2
 *       time-trigger-cron: "0 0 6 * * *"
 *       appointment-reminder-cron: "0 0 * * * *"
 *       reminder-window-days: 2
 *       zone: Europe/Oslo
 *       scheduled-actions-interval: 1m
 *     recovery:
 *       enabled: true
 *       reconcile-on-startup: true
 *       stale-threshold: 1h
 *     executions:
 *       default-page-size: 50
 *       max-page-size: 200
 *     resilience:
 *       enabled: true
 *       failure-rate-threshold: 50
 *       wait-duration-in-open-state: 60s
 *       sliding-window-size: 20
 *     metrics:
 *       enabled: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "firefly.automation")
public class AutomationProperties {

    @NestedConfigurationProperty
    private EngineProperties engine = new EngineProperties();

    @NestedConfigurationProperty
    private DefaultsProperties defaults = new DefaultsProperties();

    @NestedConfigurationProperty
    private SchedulingProperties scheduling = new SchedulingProperties();

    @NestedConfigurationProperty
    private RecoveryProperties recovery = new RecoveryProperties();

    @NestedConfigurationProperty
    private ExecutionsProperties executions = new ExecutionsProperties();

    @NestedConfigurationProperty
    private ResilienceProperties resilience = new ResilienceProperties();

    @NestedConfigurationProperty
    private MetricsProperties metrics = new MetricsProperties();

    // --- Getters and Setters ---

    public EngineProperties getEngine() { return engine; }
    public void setEngine(EngineProperties engine) { this.engine = engine; }

    public DefaultsProperties getDefaults() { return defaults; }
    public void setDefaults(DefaultsProperties defaults) { this.defaults = defaults; }

    public SchedulingProperties getScheduling() { return scheduling; }
    public void setScheduling(SchedulingProperties scheduling) { this.scheduling = scheduling; }

    public RecoveryProperties getRecovery() { return recovery; }
    public void setRecovery(RecoveryProperties recovery) { this.recovery = recovery; }

    public ExecutionsProperties getExecutions() { return executions; }
    public void setExecutions(ExecutionsProperties executions) { this.executions = executions; }

    public ResilienceProperties getResilience() { return resilience; }
    public void setResilience(ResilienceProperties resilience) { this.resilience = resilience; }

    public MetricsProperties getMetrics() { return metrics; }
    public void setMetrics(MetricsProperties metrics) { this.metrics = metrics; }

    // --- Nested property classes ---

    public static class EngineProperties {
        private boolean enabled = true;
        private int maxConcurrentRuns = 4;
        private Duration actionTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getMaxConcurrentRuns() { return maxConcurrentRuns; }
        public void setMaxConcurrentRuns(int maxConcurrentRuns) { this.maxConcurrentRuns = maxConcurrentRuns; }

        public Duration getActionTimeout() { return actionTimeout; }
        public void setActionTimeout(Duration actionTimeout) { this.actionTimeout = actionTimeout; }
    }

    public static class DefaultsProperties {
        private int followUpDueInDays = 7;
        private int taskDueInDays = 1;
        private List<String> staffRoles = new ArrayList<>(List.of("ADMIN", "PRACTITIONER"));
        private List<String> excludedStatuses = new ArrayList<>(List.of("INACTIVE", "ARCHIVED", "DECEASED"));
        private int daysSinceVisit = 42;

        public int getFollowUpDueInDays() { return followUpDueInDays; }
        public void setFollowUpDueInDays(int followUpDueInDays) { this.followUpDueInDays = followUpDueInDays; }

        public int getTaskDueInDays() { return taskDueInDays; }
        public void setTaskDueInDays(int taskDueInDays) { this.taskDueInDays = taskDueInDays; }

        public List<String> getStaffRoles() { return staffRoles; }
        public void setStaffRoles(List<String> staffRoles) { this.staffRoles = staffRoles; }

        public List<String> getExcludedStatuses() { return excludedStatuses; }
        public void setExcludedStatuses(List<String> excludedStatuses) { this.excludedStatuses = excludedStatuses; }

        public int getDaysSinceVisit() { return daysSinceVisit; }
        public void setDaysSinceVisit(int daysSinceVisit) { this.daysSinceVisit = daysSinceVisit; }
    }

    public static class SchedulingProperties {
        private boolean enabled = true;
        private int threadPoolSize = 2;
        private String timeTriggerCron = "0 0 6 * * *";
        private String appointmentReminderCron = "0 0 * * * *";
        private int reminderWindowDays = 2;
        private String zone;
        private Duration scheduledActionsInterval = Duration.ofMinutes(1);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getThreadPoolSize() { return threadPoolSize; }
        public void setThreadPoolSize(int threadPoolSize) { this.threadPoolSize = threadPoolSize; }

        public String getTimeTriggerCron() { return timeTriggerCron; }
        public void setTimeTriggerCron(String timeTriggerCron) { this.timeTriggerCron = timeTriggerCron; }

        public String getAppointmentReminderCron() { return appointmentReminderCron; }
        public void setAppointmentReminderCron(String appointmentReminderCron) { this.appointmentReminderCron = appointmentReminderCron; }

        public int getReminderWindowDays() { return reminderWindowDays; }
        public void setReminderWindowDays(int reminderWindowDays) { this.reminderWindowDays = reminderWindowDays; }

        public String getZone() { return zone; }
        public void setZone(String zone) { this.zone = zone; }

        public Duration getScheduledActionsInterval() { return scheduledActionsInterval; }
        public void setScheduledActionsInterval(Duration scheduledActionsInterval) { this.scheduledActionsInterval = scheduledActionsInterval; }
    }

    public static class RecoveryProperties {
        private boolean enabled = true;
        private boolean reconcileOnStartup = true;
        private Duration staleThreshold = Duration.ofHours(1);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public boolean isReconcileOnStartup() { return reconcileOnStartup; }
        public void setReconcileOnStartup(boolean reconcileOnStartup) { this.reconcileOnStartup = reconcileOnStartup; }

        public Duration getStaleThreshold() { return staleThreshold; }
        public void setStaleThreshold(Duration staleThreshold) { this.staleThreshold = staleThreshold; }
    }

    public static class ExecutionsProperties {
        private int defaultPageSize = 50;
        private int maxPageSize = 200;

        public int getDefaultPageSize() { return defaultPageSize; }
        public void setDefaultPageSize(int defaultPageSize) { this.defaultPageSize = defaultPageSize; }

        public int getMaxPageSize() { return maxPageSize; }
        public void setMaxPageSize(int maxPageSize) { this.maxPageSize = maxPageSize; }
    }

    public static class ResilienceProperties {
        private boolean enabled = true;
        private float failureRateThreshold = 50f;
        private Duration waitDurationInOpenState = Duration.ofSeconds(60);
        private int slidingWindowSize = 20;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public float getFailureRateThreshold() { return failureRateThreshold; }
        public void setFailureRateThreshold(float failureRateThreshold) { this.failureRateThreshold = failureRateThreshold; }

        public Duration getWaitDurationInOpenState() { return waitDurationInOpenState; }
        public void setWaitDurationInOpenState(Duration waitDurationInOpenState) { this.waitDurationInOpenState = waitDurationInOpenState; }

        public int getSlidingWindowSize() { return slidingWindowSize; }
        public void setSlidingWindowSize(int slidingWindowSize) { this.slidingWindowSize = slidingWindowSize; }
    }

    public static class MetricsProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
