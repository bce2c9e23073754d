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

package org.fireflyframework.automation.unit.workflow;

import org.fireflyframework.automation.core.template.TemplateRenderer;
import org.fireflyframework.automation.integration.Patient;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TemplateRendererTest {

    private final TemplateRenderer renderer = new TemplateRenderer();

    private final Map<String, Object> context = Patient.of("p-1", "org-1", "Kari", "Nordmann")
            .withContact("kari@example.com", "+4799999999")
            .withVisits(LocalDate.of(2026, 1, 15), 3)
            .toContextMap();

    @Test
    void rendersEnglishPlaceholders() {
        String out = renderer.render("Hi {firstName} {lastName} ({fullName}), last visit {lastVisit}, "
                + "visits {totalVisits}, {email} {phone}", context);
        assertThat(out).isEqualTo("Hi Kari Nordmann (Kari Nordmann), last visit 2026-01-15, "
                + "visits 3, kari@example.com +4799999999");
    }

    @Test
    void rendersNorwegianAliases() {
        String out = renderer.render("Hei {fornavn} {etternavn} / {fulltNavn} / {epost} / {telefon}", context);
        assertThat(out).isEqualTo("Hei Kari Nordmann / Kari Nordmann / kari@example.com / +4799999999");
    }

    @Test
    void unknownPlaceholdersAndMissingDataStayLiteral() {
        Map<String, Object> noPhone = Patient.of("p-2", "org-1", "Ola", null).toContextMap();
        assertThat(renderer.render("{firstName} {unknown} {phone}", noPhone)).isEqualTo("Ola {unknown} {phone}");
    }

    @Test
    void substitutedValuesAreNotExpandedAgain() {
        Map<String, Object> tricky = Patient.of("p-3", "org-1", "{lastName}", "$1 Smith").toContextMap();
        assertThat(renderer.render("{firstName}|{lastName}", tricky)).isEqualTo("{lastName}|$1 Smith");
    }

    @Test
    void nullAndEmptyTemplatesAreReturnedAsIs() {
        assertThat(renderer.render(null, context)).isNull();
        assertThat(renderer.render("", context)).isEmpty();
    }

    @Test
    void knowsItsVariables() {
        assertThat(renderer.isKnownVariable("fornavn")).isTrue();
        assertThat(renderer.isKnownVariable("first_name")).isFalse();
    }
}
