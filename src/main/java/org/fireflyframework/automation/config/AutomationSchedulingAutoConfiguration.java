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
import org.fireflyframework.automation.core.scheduling.AutomationScheduler;
import org.fireflyframework.automation.core.scheduling.TimeTriggerScheduler;
import org.fireflyframework.automation.workflow.engine.AutomationEngine;
import org.fireflyframework.automation.workflow.repository.WorkflowRepository;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Schedules the recurring jobs of {@link TimeTriggerScheduler}.
 */
@Slf4j
@AutoConfiguration(after = AutomationAutoConfiguration.class)
@ConditionalOnBean(AutomationEngine.class)
@ConditionalOnProperty(name = "firefly.automation.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class AutomationSchedulingAutoConfiguration {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public AutomationScheduler automationScheduler(AutomationProperties properties) {
        int poolSize = properties.getScheduling().getThreadPoolSize();
        log.info("[automation] Scheduler initialized with thread pool size: {}", poolSize);
        return new AutomationScheduler(poolSize);
    }

    @Bean
    @ConditionalOnMissingBean
    public TimeTriggerScheduler timeTriggerScheduler(AutomationScheduler scheduler, AutomationEngine engine,
                                                     WorkflowRepository workflowRepository,
                                                     AppointmentReminderPublisher reminders, Clock clock,
                                                     AutomationProperties properties) {
        var scheduling = properties.getScheduling();
        log.info("[automation] Time triggers scheduled with cron '{}' zone '{}'",
                scheduling.getTimeTriggerCron(), scheduling.getZone());
        return new TimeTriggerScheduler(scheduler, engine, workflowRepository, reminders, clock,
                scheduling.getTimeTriggerCron(), scheduling.getAppointmentReminderCron(), scheduling.getZone(),
                scheduling.getScheduledActionsInterval());
    }
}
