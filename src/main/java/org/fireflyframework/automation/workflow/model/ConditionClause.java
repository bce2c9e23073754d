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

package org.fireflyframework.automation.workflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One predicate over the patient context. A clause whose {@code logic} is
 * {@link ConditionLogic#OR} opens a new OR-group; all other clauses are AND-ed
 * into the current group.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConditionClause(String field, ConditionOperator operator, Object value, ConditionLogic logic) {

    public ConditionClause {
        if (logic == null) {
            logic = ConditionLogic.AND;
        }
    }

    public static ConditionClause of(String field, ConditionOperator operator, Object value) {
        return new ConditionClause(field, operator, value, ConditionLogic.AND);
    }

    public static ConditionClause or(String field, ConditionOperator operator, Object value) {
        return new ConditionClause(field, operator, value, ConditionLogic.OR);
    }
}
