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

package org.fireflyframework.automation.core.recovery;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.SmartInitializingSingleton;

import java.time.Duration;

/**
 * Reconciles interrupted executions once the application context is ready.
 */
@Slf4j
public class RecoveryInitializer implements SmartInitializingSingleton {

    private static final Duration STARTUP_TIMEOUT = Duration.ofMinutes(1);

    private final RecoveryService recoveryService;

    public RecoveryInitializer(RecoveryService recoveryService) {
        this.recoveryService = recoveryService;
    }

    @Override
    public void afterSingletonsInstantiated() {
        log.info("[recovery] reconciling interrupted executions on startup");
        recoveryService.reconcileInterruptedExecutions().block(STARTUP_TIMEOUT);
    }
}
