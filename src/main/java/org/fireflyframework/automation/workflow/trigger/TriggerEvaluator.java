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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.core.event.DailyTick;
import org.fireflyframework.automation.core.event.DomainEvent;
import org.fireflyframework.automation.core.event.Occurrence;
import org.fireflyframework.automation.integration.Patient;
import org.fireflyframework.automation.integration.PatientRepository;
import org.fireflyframework.automation.workflow.model.TriggerConfig;
import org.fireflyframework.automation.workflow.model.TriggerType;
import org.fireflyframework.automation.workflow.model.Workflow;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.MonthDay;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether an occurrence fires a workflow's trigger and for which patients.
 *
 * <p>Event triggers match a {@link DomainEvent} of the same type that passes the
 * trigger's sub-filters; the event's patient is the single candidate. Time triggers
 * match only the {@link DailyTick} of the workflow's organization and scan its
 * patients, skipping those whose status is excluded.
 */
@Slf4j
public class TriggerEvaluator {

    private static final MonthDay LEAP_DAY = MonthDay.of(2, 29);

    private final PatientRepository patientRepository;
    private final List<String> defaultExcludedStatuses;
    private final int defaultDaysSinceVisit;

    public TriggerEvaluator(PatientRepository patientRepository, List<String> defaultExcludedStatuses,
                            int defaultDaysSinceVisit) {
        this.patientRepository = Objects.requireNonNull(patientRepository, "patientRepository");
        this.defaultExcludedStatuses = List.copyOf(defaultExcludedStatuses);
        this.defaultDaysSinceVisit = defaultDaysSinceVisit;
    }

    public Mono<TriggerMatch> matches(Workflow workflow, Occurrence occurrence) {
        if (!workflow.organizationId().equals(occurrence.organizationId())) {
            return Mono.just(TriggerMatch.noMatch());
        }
        if (occurrence instanceof DomainEvent event) {
            return Mono.fromSupplier(() -> matchEvent(workflow, event));
        }
        if (occurrence instanceof DailyTick tick && workflow.triggerType().isTimeBased()) {
            return matchTick(workflow, tick);
        }
        return Mono.just(TriggerMatch.noMatch());
    }

    private TriggerMatch matchEvent(Workflow workflow, DomainEvent event) {
        if (workflow.triggerType() != event.type()) {
            return TriggerMatch.noMatch();
        }
        TriggerConfig config = workflow.triggerConfig();
        Map<String, Object> payload = event.payload();

        if (event.type().isAppointmentTrigger() && hasText(config.appointmentType())
                && !config.appointmentType().equalsIgnoreCase(text(payload.get("appointment_type")))) {
            return TriggerMatch.noMatch();
        }
        if (event.type() == TriggerType.LIFECYCLE_CHANGE) {
            if (hasText(config.fromStage()) && !config.fromStage().equalsIgnoreCase(text(payload.get("previous_lifecycle")))) {
                return TriggerMatch.noMatch();
            }
            if (hasText(config.toStage()) && !config.toStage().equalsIgnoreCase(text(payload.get("new_lifecycle")))) {
                return TriggerMatch.noMatch();
            }
        }
        if (event.type() == TriggerType.CUSTOM
                && (!hasText(config.eventType()) || !config.eventType().equals(text(payload.get("event_type"))))) {
            return TriggerMatch.noMatch();
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("trigger_type", event.type().name());
        data.put("event_id", event.eventId());
        data.put("occurred_at", event.occurredAt().toString());
        return TriggerMatch.of(List.of(new TriggerCandidate(event.patientId(), data)));
    }

    private Mono<TriggerMatch> matchTick(Workflow workflow, DailyTick tick) {
        TriggerConfig config = workflow.triggerConfig();
        Set<String> excluded = config.excludeStatusesOr(defaultExcludedStatuses).stream()
                .map(s -> s.toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
        LocalDate asOf = tick.asOfDate();

        return patientRepository.findByOrganization(workflow.organizationId())
                .filter(p -> p.status() == null || !excluded.contains(p.status().toUpperCase(Locale.ROOT)))
                .mapNotNull(p -> workflow.triggerType() == TriggerType.BIRTHDAY
                        ? birthdayCandidate(p, config, asOf)
                        : daysSinceVisitCandidate(p, config, asOf))
                .collectList()
                .map(TriggerMatch::of)
                .doOnNext(m -> log.debug("[trigger] workflow={} trigger={} asOf={} candidates={}",
                        workflow.id(), workflow.triggerType(), asOf, m.candidates().size()));
    }

    private TriggerCandidate daysSinceVisitCandidate(Patient patient, TriggerConfig config, LocalDate asOf) {
        int days = config.daysOr(defaultDaysSinceVisit);
        LocalDate lastVisit = patient.lastVisitDate();
        if (lastVisit == null || !lastVisit.plusDays(days).equals(asOf)) {
            return null;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("trigger_type", TriggerType.DAYS_SINCE_VISIT.name());
        data.put("days_since_visit", ChronoUnit.DAYS.between(lastVisit, asOf));
        data.put("last_visit_date", lastVisit.toString());
        return new TriggerCandidate(patient.id(), data);
    }

    private TriggerCandidate birthdayCandidate(Patient patient, TriggerConfig config, LocalDate asOf) {
        int daysBefore = config.daysBeforeOr(0);
        LocalDate birthday = asOf.plusDays(daysBefore);
        LocalDate dateOfBirth = patient.dateOfBirth();
        if (dateOfBirth == null || !birthdayFallsOn(dateOfBirth, birthday)) {
            return null;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("trigger_type", TriggerType.BIRTHDAY.name());
        data.put("age", ageOn(dateOfBirth, birthday));
        data.put("birth_date", dateOfBirth.toString());
        data.put("days_before", daysBefore);
        return new TriggerCandidate(patient.id(), data);
    }

    /**
     * Whether {@code date} is the patient's birthday. A 29 February birthday is
     * celebrated on 28 February in non-leap years.
     */
    public static boolean birthdayFallsOn(LocalDate dateOfBirth, LocalDate date) {
        MonthDay birth = MonthDay.from(dateOfBirth);
        if (birth.equals(LEAP_DAY) && !date.isLeapYear()) {
            return date.getMonthValue() == 2 && date.getDayOfMonth() == 28;
        }
        return birth.equals(MonthDay.from(date));
    }

    /** The age the patient turns on the birthday that falls on {@code birthday}. */
    public static int ageOn(LocalDate dateOfBirth, LocalDate birthday) {
        return birthday.getYear() - dateOfBirth.getYear();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }
}
