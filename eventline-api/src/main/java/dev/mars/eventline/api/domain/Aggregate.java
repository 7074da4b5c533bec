package dev.mars.eventline.api.domain;

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

import dev.mars.eventline.api.error.UnknownEventTypeException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class for event-sourced aggregates.
 *
 * <p>State changes only through {@link #mutate(DomainEvent)}. New facts are buffered as
 * pending events until a unit of work drains and persists them. {@link #getVersion()}
 * is the stream position of the last persisted event, {@value #NO_VERSION} before any
 * event has been committed.</p>
 *
 * <p>Instances are not shared between units of work; the pending buffer is guarded so
 * that a drain observes a consistent snapshot.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public abstract class Aggregate {

    public static final long NO_VERSION = -1L;

    private final String id;
    private long version = NO_VERSION;
    private List<DomainEvent> pending = new ArrayList<>();

    protected Aggregate(String id) {
        this.id = Objects.requireNonNull(id, "Aggregate id cannot be null");
    }

    public String getId() {
        return id;
    }

    public long getVersion() {
        return version;
    }

    /**
     * Applies one event to in-memory state. Must be deterministic and free of side
     * effects; unknown events should fail through {@link #unknownEvent(DomainEvent)}.
     */
    protected abstract void mutate(DomainEvent event);

    /**
     * Buffers an event for persistence without touching state.
     */
    public synchronized void newEvent(DomainEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");
        if (!id.equals(event.aggregateId())) {
            throw new IllegalArgumentException("Event " + event.messageId() + " belongs to aggregate "
                + event.aggregateId() + ", not " + id);
        }
        pending.add(event);
    }

    /**
     * Mutates state and buffers the event.
     */
    protected void raise(DomainEvent event) {
        mutate(event);
        newEvent(event);
    }

    /**
     * Hands over the pending events and leaves the buffer empty.
     */
    public synchronized List<DomainEvent> drain() {
        List<DomainEvent> drained = pending;
        pending = new ArrayList<>();
        return Collections.unmodifiableList(drained);
    }

    public synchronized List<DomainEvent> pendingEvents() {
        return List.copyOf(pending);
    }

    public synchronized boolean hasPendingEvents() {
        return !pending.isEmpty();
    }

    /**
     * Records that events up to {@code persistedVersion} are now in the store.
     */
    public void markPersisted(long persistedVersion) {
        if (persistedVersion < version) {
            throw new IllegalArgumentException("Version cannot move backwards: " + version + " -> " + persistedVersion);
        }
        this.version = persistedVersion;
    }

    protected UnknownEventTypeException unknownEvent(DomainEvent event) {
        return new UnknownEventTypeException(event.eventType(), getClass().getSimpleName());
    }

    /**
     * Rebuilds an aggregate by folding {@code events}, already in stream order, over
     * a fresh instance. Pending events are left empty.
     */
    public static <A extends Aggregate> A replay(String aggregateId, List<? extends DomainEvent> events,
                                                 AggregateFactory<A> factory) {
        A aggregate = factory.empty(aggregateId);
        Aggregate target = aggregate;
        long version = NO_VERSION;
        for (DomainEvent event : events) {
            target.mutate(event);
            version++;
        }
        target.version = version;
        return aggregate;
    }
}
