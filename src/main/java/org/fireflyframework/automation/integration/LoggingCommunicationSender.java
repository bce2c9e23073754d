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

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Default sender used when the host application registers none. Messages are
 * only logged and acknowledged as {@code LOGGED}.
 */
@Slf4j
public class LoggingCommunicationSender implements CommunicationSender {

    @Override
    public Mono<DeliveryReceipt> send(OutboundMessage message) {
        return Mono.fromSupplier(() -> {
            String messageId = UUID.randomUUID().toString();
            log.info("[communication] channel={} organizationId={} patientId={} recipient={} messageId={}",
                    message.channel(), message.organizationId(), message.patientId(), message.recipient(), messageId);
            return new DeliveryReceipt(messageId, "LOGGED");
        });
    }
}
