package dev.mars.eventline.core.consumer;

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

import dev.mars.eventline.api.broker.StreamRecord;
import dev.mars.eventline.api.codec.MessageCodec;
import dev.mars.eventline.api.domain.Event;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Maps broker records to typed events. By default a stream carries the event type of
 * the same name; other streams can be pointed at a registered type explicitly.
 */
public final class StreamEventMapping {

    private final MessageCodec codec;
    private final Map<String, String> streamTypes;

    private StreamEventMapping(MessageCodec codec, Map<String, String> streamTypes) {
        this.codec = Objects.requireNonNull(codec, "MessageCodec cannot be null");
        this.streamTypes = Collections.unmodifiableMap(streamTypes);
    }

    public static StreamEventMapping byStreamName(MessageCodec codec) {
        return new StreamEventMapping(codec, Map.of());
    }

    public StreamEventMapping withType(String stream, String eventType) {
        Map<String, String> copy = new LinkedHashMap<>(streamTypes);
        copy.put(stream, eventType);
        return new StreamEventMapping(codec, copy);
    }

    public String eventTypeFor(String stream) {
        return streamTypes.getOrDefault(stream, stream);
    }

    /**
     * @throws dev.mars.eventline.api.error.UnknownEventTypeException if the stream's type is not registered
     */
    public Event toEvent(StreamRecord record) {
        return codec.decode(eventTypeFor(record.stream()), record.data());
    }

    /**
     * Checks at startup that every stream resolves to a registered event type.
     */
    public void validateCovers(Collection<String> streams) {
        codec.getRegistry().validateCovers(streams.stream().map(this::eventTypeFor).collect(Collectors.toList()));
    }
}
