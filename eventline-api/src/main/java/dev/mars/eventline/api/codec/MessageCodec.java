package dev.mars.eventline.api.codec;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.eventline.api.domain.Event;
import dev.mars.eventline.api.domain.Message;
import dev.mars.eventline.api.error.MessageCodecException;

import java.io.IOException;
import java.util.Objects;

/**
 * Jackson based encoding of messages and registry driven decoding of events.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class MessageCodec {

    private final ObjectMapper objectMapper;
    private final EventTypeRegistry registry;

    public MessageCodec(EventTypeRegistry registry) {
        this(createDefaultObjectMapper(), registry);
    }

    public MessageCodec(ObjectMapper objectMapper, EventTypeRegistry registry) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
        this.registry = Objects.requireNonNull(registry, "EventTypeRegistry cannot be null");
    }

    /**
     * ObjectMapper with Java time support and ISO-8601 timestamps.
     */
    public static ObjectMapper createDefaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public EncodedMessage encode(Message message) {
        Objects.requireNonNull(message, "Message cannot be null");
        try {
            return new EncodedMessage(message.messageId(), message.messageType(),
                objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            throw new MessageCodecException("Failed to encode message " + message.messageId()
                + " of type " + message.messageType(), e);
        }
    }

    /**
     * Decodes {@code json} with the decoder registered for {@code eventType}.
     *
     * @throws dev.mars.eventline.api.error.UnknownEventTypeException if the type is not registered
     * @throws MessageCodecException if the payload cannot be read
     */
    public Event decode(String eventType, String json) {
        EventDecoder decoder = registry.resolve(eventType);
        try {
            return decoder.decode(json, objectMapper);
        } catch (IOException e) {
            throw new MessageCodecException("Failed to decode event of type " + eventType, e);
        }
    }

    public EventTypeRegistry getRegistry() {
        return registry;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
