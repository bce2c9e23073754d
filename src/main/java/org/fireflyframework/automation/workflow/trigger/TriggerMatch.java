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

package org.fireflyframework.automation.workflow.trigger;

import java.util.List;

public record TriggerMatch(boolean matched, List<TriggerCandidate> candidates) {

    private static final TriggerMatch NO_MATCH = new TriggerMatch(false, List.of());

    public TriggerMatch {
        candidates = List.copyOf(candidates);
    }

    public static TriggerMatch noMatch() {
        return NO_MATCH;
    }

    public static TriggerMatch of(List<TriggerCandidate> candidates) {
        return candidates.isEmpty() ? NO_MATCH : new TriggerMatch(true, candidates);
    }
}
