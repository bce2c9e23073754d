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

import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryStaffDirectory implements StaffDirectory {

    private final Map<String, StaffMember> members = new ConcurrentHashMap<>();

    public InMemoryStaffDirectory register(StaffMember member) {
        members.put(member.id(), member);
        return this;
    }

    @Override
    public Mono<List<String>> resolveStaff(String organizationId, StaffAudience audience) {
        return Mono.fromSupplier(() -> members.values().stream()
                .filter(m -> m.active() && m.organizationId().equals(organizationId))
                .filter(m -> audience.hasExplicitStaff()
                        ? audience.staffIds().contains(m.id())
                        : audience.roles().stream().anyMatch(r -> r.equalsIgnoreCase(m.role())))
                .sorted(Comparator.comparing(StaffMember::id))
                .map(StaffMember::id)
                .toList());
    }
}
