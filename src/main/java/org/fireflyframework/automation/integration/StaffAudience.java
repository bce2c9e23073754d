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

import java.util.List;

/**
 * Who a staff notification goes to: explicit staff ids win over roles.
 */
public record StaffAudience(List<String> staffIds, List<String> roles) {

    public StaffAudience {
        staffIds = staffIds != null ? List.copyOf(staffIds) : List.of();
        roles = roles != null ? List.copyOf(roles) : List.of();
    }

    public boolean hasExplicitStaff() {
        return !staffIds.isEmpty();
    }
}
