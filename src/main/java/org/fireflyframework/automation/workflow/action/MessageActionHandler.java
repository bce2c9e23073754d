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

package org.fireflyframework.automation.workflow.action;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.automation.core.resilience.ResilienceDecorator;
import org.fireflyframework.automation.core.template.TemplateRenderer;
import org.fireflyframework.automation.integration.CommunicationSender;
import org.fireflyframework.automation.integration.DeliveryReceipt;
import org.fireflyframework.automation.integration.OutboundMessage;
import org.fireflyframework.automation.integration.OutboundMessage.Channel;
import org.fireflyframework.automation.integration.Patient;
import org.fireflyframework.automation.workflow.model.ActionSpec;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import static org.fireflyframework.automation.workflow.action.Payloads.put;
import static org.fireflyframework.automation.workflow.action.Payloads.string;

/**
 * SEND_SMS and SEND_EMAIL: renders the templates and hands the message to the
 * {@link CommunicationSender}, behind a per-channel circuit breaker when one is configured.
 */
@Slf4j
public class MessageActionHandler implements ActionHandler {

    private final CommunicationSender sender;
    private final TemplateRenderer renderer;
    private final ResilienceDecorator resilience;

    public MessageActionHandler(CommunicationSender sender, TemplateRenderer renderer, ResilienceDecorator resilience) {
        this.sender = sender;
        this.renderer = renderer;
        this.resilience = resilience;
    }

    @Override
    public Map<String, Object> render(ActionSpec action, Patient patient, RunContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (action instanceof ActionSpec.SendSms sms) {
            payload.put("channel", Channel.SMS.name());
            put(payload, "to", patient != null ? patient.phone() : null);
            put(payload, "body", renderer.render(sms.template(), context.context()));
            put(payload, "template_id", sms.templateId());
        } else if (action instanceof ActionSpec.SendEmail email) {
            payload.put("channel", Channel.EMAIL.name());
            put(payload, "to", patient != null ? patient.email() : null);
            put(payload, "subject", renderer.render(email.subject(), context.context()));
            put(payload, "body", renderer.render(email.body(), context.context()));
            put(payload, "template_id", email.templateId());
        } else {
            throw ActionHandler.unsupported(this, action);
        }
        return payload;
    }

    @Override
    public Mono<String> apply(ActionSpec action, Map<String, Object> payload, Patient patient, RunContext context) {
        Channel channel = Channel.valueOf(string(payload, "channel"));
        String recipient = string(payload, "to");
        if (recipient == null || recipient.isBlank()) {
            return Mono.error(new IllegalStateException(channel == Channel.SMS
                    ? "Patient has no phone number" : "Patient has no email address"));
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        put(metadata, "workflow_id", context.workflowId());
        put(metadata, "execution_id", context.executionId());
        OutboundMessage message = new OutboundMessage(channel, context.organizationId(), patient.id(), recipient,
                string(payload, "subject"), string(payload, "body"), string(payload, "template_id"), metadata);
        Mono<DeliveryReceipt> send = sender.send(message);
        if (resilience != null) {
            send = resilience.decorate(channel.name().toLowerCase(Locale.ROOT), send);
        }
        return send.map(DeliveryReceipt::messageId)
                .doOnNext(id -> log.debug("[action] {} sent patientId={} messageId={}", channel, patient.id(), id));
    }
}
