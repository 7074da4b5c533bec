package dev.mars.eventline.core.bus;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

import dev.mars.eventline.api.broker.StreamBroker;
import dev.mars.eventline.api.codec.EncodedMessage;
import dev.mars.eventline.api.codec.MessageCodec;
import dev.mars.eventline.api.domain.Event;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Publishes events to the broker stream named after the event.
 */
public class BrokerEventPublisher implements EventPublisher {
    private static final Logger logger = LoggerFactory.getLogger(BrokerEventPublisher.class);

    private final StreamBroker broker;
    private final MessageCodec codec;

    public BrokerEventPublisher(StreamBroker broker, MessageCodec codec) {
        this.broker = Objects.requireNonNull(broker, "StreamBroker cannot be null");
        this.codec = Objects.requireNonNull(codec, "MessageCodec cannot be null");
    }

    @Override
    public Future<Void> publish(Event event) {
        EncodedMessage encoded;
        try {
            encoded = codec.encode(event);
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
        return broker.append(event.stream(), encoded.data())
            .onSuccess(offset -> logger.debug("Published event: eventId={}, stream={}, offset={}",
                event.messageId(), event.stream(), offset))
            .mapEmpty();
    }
}
