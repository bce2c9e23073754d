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

package org.fireflyframework.automation.workflow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.fireflyframework.automation.core.exception.WorkflowValidationException;
import org.fireflyframework.automation.workflow.model.Workflow;

import java.util.stream.Collectors;

/**
 * Reads and writes workflow definitions as JSON with snake_case property names, the
 * format authoring clients exchange. Unknown trigger types, action types and condition
 * operators are rejected as validation errors.
 */
public class WorkflowDefinitionCodec {

    private final ObjectMapper mapper;

    public WorkflowDefinitionCodec() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public WorkflowDefinitionCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Workflow read(String json) {
        try {
            return mapper.readValue(json, Workflow.class);
        } catch (JsonMappingException e) {
            throw new WorkflowValidationException(location(e), e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            throw new WorkflowValidationException("workflow", "Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String write(Workflow workflow) {
        try {
            return mapper.writeValueAsString(workflow);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize workflow '" + workflow.id() + "'", e);
        }
    }

    private static String location(JsonMappingException e) {
        String path = e.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? "." + ref.getFieldName() : "[" + ref.getIndex() + "]")
                .collect(Collectors.joining());
        return "workflow" + path;
    }
}
