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

import dev.mars.eventline.api.domain.Event;
import dev.mars.eventline.api.error.ConfigurationException;
import dev.mars.eventline.api.error.EventlineErrorCodes;
import dev.mars.eventline.api.error.UnknownEventTypeException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable table from event type discriminator to decoder. Built once at startup;
 * every stored or streamed event type must be registered before it can be read back.
 *
 * <pre>{@code
 * EventTypeRegistry registry = EventTypeRegistry.builder()
 *     .register("order.created", OrderCreated.class)
 *     .register("order.item_added", OrderItemAdded.class)
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public final class EventTypeRegistry {

    private final Map<String, EventDecoder> decoders;

    private EventTypeRegistry(Map<String, EventDecoder> decoders) {
        this.decoders = Collections.unmodifiableMap(new LinkedHashMap<>(decoders));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<EventDecoder> find(String eventType) {
        return Optional.ofNullable(decoders.get(eventType));
    }

    public EventDecoder resolve(String eventType) {
        EventDecoder decoder = decoders.get(eventType);
        if (decoder == null) {
            throw new UnknownEventTypeException(eventType);
        }
        return decoder;
    }

    public boolean contains(String eventType) {
        return decoders.containsKey(eventType);
    }

    public Set<String> eventTypes() {
        return decoders.keySet();
    }

    /**
     * Fails with a {@link ConfigurationException} naming every type in {@code required}
     * that has no registered decoder.
     */
    public void validateCovers(Collection<String> required) {
        List<String> missing = required.stream()
            .filter(type -> !decoders.containsKey(type))
            .distinct()
            .sorted()
            .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new ConfigurationException(EventlineErrorCodes.EVENT_TYPES_MISSING,
                "No decoder registered for event types: " + String.join(", ", missing));
        }
    }

    public static final class Builder {
        private final Map<String, EventDecoder> decoders = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(String eventType, Class<? extends Event> type) {
            return register(eventType, EventDecoder.of(type));
        }

        public Builder register(String eventType, EventDecoder decoder) {
            if (eventType == null || eventType.isBlank()) {
                throw new IllegalArgumentException("Event type cannot be null or blank");
            }
            if (decoder == null) {
                throw new IllegalArgumentException("Decoder cannot be null for " + eventType);
            }
            if (decoders.putIfAbsent(eventType, decoder) != null) {
                throw new ConfigurationException("Event type registered twice: " + eventType);
            }
            return this;
        }

        public EventTypeRegistry build() {
            return new EventTypeRegistry(decoders);
        }
    }
}
