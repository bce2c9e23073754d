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

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.core.resilience.ResilienceDecorator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for resilience4j circuit breakers around outbound messaging.
 *
 * <p>Uses the application's {@code CircuitBreakerRegistry} when one exists, otherwise
 * builds one from {@code firefly.automation.resilience.*}.
 */
@Slf4j
@AutoConfiguration(before = AutomationAutoConfiguration.class)
@ConditionalOnClass(CircuitBreakerRegistry.class)
@EnableConfigurationProperties(AutomationProperties.class)
@ConditionalOnProperty(name = "firefly.automation.resilience.enabled", havingValue = "true", matchIfMissing = true)
public class AutomationResilienceAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerRegistry automationCircuitBreakerRegistry(AutomationProperties properties) {
        var resilience = properties.getResilience();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(resilience.getFailureRateThreshold())
                .waitDurationInOpenState(resilience.getWaitDurationInOpenState())
                .slidingWindowSize(resilience.getSlidingWindowSize())
                .build();
        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResilienceDecorator resilienceDecorator(CircuitBreakerRegistry registry) {
        log.info("[automation] Resilience decorator initialized with circuit breaker support");
        return new ResilienceDecorator(registry);
    }
}
