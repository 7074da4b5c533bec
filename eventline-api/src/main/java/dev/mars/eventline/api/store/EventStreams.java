package dev.mars.eventline.api.store;

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

import dev.mars.eventline.api.codec.EncodedMessage;
import dev.mars.eventline.api.codec.MessageCodec;
import dev.mars.eventline.api.domain.Aggregate;
import dev.mars.eventline.api.domain.AggregateFactory;
import dev.mars.eventline.api.domain.DomainEvent;
import dev.mars.eventline.api.domain.Event;
import dev.mars.eventline.api.error.AggregateNotFoundException;
import dev.mars.eventline.api.error.MessageCodecException;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversions shared by event store implementations.
 */
public final class EventStreams {

    private EventStreams() {
    }

    /**
     * Encodes pending events into rows with contiguous versions after {@code currentVersion}.
     */
    public static List<StoredEvent> toRows(MessageCodec codec, String aggregateId,
                                           List<? extends DomainEvent> events, long currentVersion) {
        List<StoredEvent> rows = new ArrayList<>(events.size());
        long version = currentVersion;
        for (DomainEvent event : events) {
            if (!aggregateId.equals(event.aggregateId())) {
                throw new IllegalArgumentException("Event " + event.messageId() + " belongs to aggregate "
                    + event.aggregateId() + ", not " + aggregateId);
            }
            version++;
            EncodedMessage encoded = codec.encode(event);
            rows.add(new StoredEvent(encoded.id(), aggregateId, encoded.type(), version,
                event.createdAt(), encoded.data()));
        }
        return rows;
    }

    /**
     * Decodes rows already sorted by version and folds them into a fresh aggregate.
     */
    public static <A extends Aggregate> A replay(MessageCodec codec, String aggregateId,
                                                 List<StoredEvent> rows, AggregateFactory<A> factory) {
        if (rows.isEmpty()) {
            throw new AggregateNotFoundException(aggregateId);
        }
        List<DomainEvent> events = new ArrayList<>(rows.size());
        for (StoredEvent row : rows) {
            Event event = codec.decode(row.type(), row.data());
            if (!(event instanceof DomainEvent)) {
                throw new MessageCodecException("Stored event " + row.id() + " of type " + row.type()
                    + " is not a domain event", null);
            }
            events.add((DomainEvent) event);
        }
        return Aggregate.replay(aggregateId, events, factory);
    }
}
