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

import java.time.ZoneId;

/**
 * Tuning knobs of the {@link AutomationEngine}.
 *
 * @param maxConcurrentRuns         candidates of one workflow processed concurrently during a tick
 * @param defaultPageSize           execution history page size when none is requested
 * @param maxPageSize               upper bound for a requested page size
 * @param scheduledActionBatchSize  due scheduled actions claimed per processing pass
 * @param zone                      zone that decides the calendar day; {@code null} uses the clock's zone
 */
public record EngineSettings(int maxConcurrentRuns, int defaultPageSize, int maxPageSize, int scheduledActionBatchSize,
                             ZoneId zone) {

    public EngineSettings(int maxConcurrentRuns, int defaultPageSize, int maxPageSize, int scheduledActionBatchSize) {
        this(maxConcurrentRuns, defaultPageSize, maxPageSize, scheduledActionBatchSize, null);
    }

    public EngineSettings {
        if (maxConcurrentRuns < 1) {
            throw new IllegalArgumentException("maxConcurrentRuns must be at least 1, got: " + maxConcurrentRuns);
        }
        if (defaultPageSize < 1 || maxPageSize < defaultPageSize) {
            throw new IllegalArgumentException("invalid page sizes: default=" + defaultPageSize + ", max=" + maxPageSize);
        }
        if (scheduledActionBatchSize < 1) {
            throw new IllegalArgumentException("scheduledActionBatchSize must be at least 1, got: " + scheduledActionBatchSize);
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(4, 50, 200, 100);
    }
}
