package dev.mars.eventline.api.consumer;

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

import dev.mars.eventline.api.broker.StreamOffsets;
import dev.mars.eventline.api.domain.ChangeSet;
import dev.mars.eventline.api.domain.Messages;

import java.util.Objects;

/**
 * Progress of one named handler through one broker stream.
 *
 * <p>{@code ackedId} only moves forward. The consumer remembers the state it was loaded
 * with so that an update writes just the changed columns.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class Consumer {

    private final String id;
    private final String stream;
    private final String name;
    private final boolean retroactive;
    private String ackedId;
    private ConsumerState persistedState;

    private Consumer(String id, String stream, String name, String ackedId, boolean retroactive,
                     ConsumerState persistedState) {
        this.id = Objects.requireNonNull(id, "Consumer id cannot be null");
        this.stream = Objects.requireNonNull(stream, "Consumer stream cannot be null");
        this.name = Objects.requireNonNull(name, "Consumer name cannot be null");
        this.ackedId = Objects.requireNonNull(ackedId, "Consumer acked id cannot be null");
        this.retroactive = retroactive;
        this.persistedState = persistedState;
    }

    /**
     * A consumer that has not been stored yet. Retroactive consumers start at
     * {@link StreamOffsets#START}; others at the supplied stream tip.
     */
    public static Consumer create(String stream, String name, boolean retroactive, String streamTip) {
        String start = retroactive || streamTip == null ? StreamOffsets.START : streamTip;
        return new Consumer(Messages.newId(), stream, name, start, retroactive, null);
    }

    /**
     * A consumer read back from storage.
     */
    public static Consumer restore(String id, String stream, String name, String ackedId, boolean retroactive) {
        Consumer consumer = new Consumer(id, stream, name, ackedId, retroactive, null);
        consumer.markPersisted();
        return consumer;
    }

    /**
     * Advances the acknowledged offset.
     *
     * @throws IllegalArgumentException if {@code offset} is behind the current one
     */
    public void acknowledge(String offset) {
        if (StreamOffsets.compare(offset, ackedId) < 0) {
            throw new IllegalArgumentException("Consumer " + name + " cannot move acked id backwards from "
                + ackedId + " to " + offset);
        }
        this.ackedId = offset;
    }

    public ConsumerState snapshot() {
        return new ConsumerState(stream, name, ackedId, retroactive);
    }

    /**
     * Columns changed since the consumer was loaded or last stored.
     */
    public ChangeSet changes() {
        return ChangeSet.between(persistedState, snapshot());
    }

    public boolean isPersisted() {
        return persistedState != null;
    }

    public void markPersisted() {
        this.persistedState = snapshot();
    }

    public String getId() { return id; }
    public String getStream() { return stream; }
    public String getName() { return name; }
    public String getAckedId() { return ackedId; }
    public boolean isRetroactive() { return retroactive; }

    @Override
    public String toString() {
        return "Consumer{id='" + id + "', stream='" + stream + "', name='" + name + "', ackedId='" + ackedId
            + "', retroactive=" + retroactive + '}';
    }
}
