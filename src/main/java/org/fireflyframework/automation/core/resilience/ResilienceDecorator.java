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

package org.fireflyframework.automation.core.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import reactor.core.publisher.Mono;

/**
 * Wraps calls to outbound collaborators in a circuit breaker per channel, so a failing
 * SMS provider stops being called for a while instead of failing every run slowly.
 */
public class ResilienceDecorator {
    private static final String PREFIX = "automation.";

    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public ResilienceDecorator(CircuitBreakerRegistry circuitBreakerRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    public <T> Mono<T> decorate(String channel, Mono<T> mono) {
        return mono.transformDeferred(CircuitBreakerOperator.of(getCircuitBreaker(channel)));
    }

    public CircuitBreaker getCircuitBreaker(String channel) {
        return circuitBreakerRegistry.circuitBreaker(PREFIX + channel);
    }
}
