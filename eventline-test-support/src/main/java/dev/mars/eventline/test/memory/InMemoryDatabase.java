package dev.mars.eventline.test.memory;

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

import dev.mars.eventline.api.codec.MessageCodec;
import dev.mars.eventline.api.error.DuplicateMessageException;
import dev.mars.eventline.api.error.DuplicateVersionException;
import dev.mars.eventline.api.store.StoredEvent;
import dev.mars.eventline.api.tx.TransactionRunner;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Transactional in-memory stand-in for the PostgreSQL tables, for tests that should
 * not need a container.
 *
 * <p>Each transaction stages its writes; commit re-checks the same uniqueness rules
 * the schema enforces ({@code (stream_id, version)}, processed message id, outbox id)
 * and applies everything at once. A failed work future or a failed commit discards
 * the staged writes.</p>
 *
 * <p>{@link #failNextCommit(RuntimeException)} simulates a crash at commit time.</p>
 */
public class InMemoryDatabase implements TransactionRunner<InMemoryTransaction> {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryDatabase.class);

    private final List<StoredEvent> events = new ArrayList<>();
    private final Map<String, OutboxEntry> outbox = new LinkedHashMap<>();
    private final Set<String> processed = new LinkedHashSet<>();
    private final Map<String, ConsumerRow> consumers = new LinkedHashMap<>();
    private final AtomicReference<RuntimeException> nextCommitFailure = new AtomicReference<>();
    private final AtomicInteger commits = new AtomicInteger();
    private final AtomicInteger rollbacks = new AtomicInteger();
    private final AtomicInteger consumerWrites = new AtomicInteger();

    @Override
    public <T> Future<T> withTransaction(Function<InMemoryTransaction, Future<T>> work) {
        InMemoryTransaction tx = new InMemoryTransaction(this);
        Future<T> result;
        try {
            result = work.apply(tx);
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        if (result == null) {
            result = Future.failedFuture(new IllegalStateException("Transaction work returned a null future"));
        }
        return result.transform(ar -> {
            if (ar.failed()) {
                rollback(tx);
                return Future.failedFuture(ar.cause());
            }
            try {
                commit(tx);
                return Future.succeededFuture(ar.result());
            } catch (RuntimeException e) {
                rollback(tx);
                return Future.failedFuture(e);
            }
        });
    }

    public InMemoryEventStore eventStore(MessageCodec codec) {
        return new InMemoryEventStore(codec);
    }

    public InMemoryOutbox outbox(MessageCodec codec) {
        return new InMemoryOutbox(codec);
    }

    public InMemoryProcessedMessageLedger ledger() {
        return new InMemoryProcessedMessageLedger();
    }

    public InMemoryConsumerRepository consumerRepository() {
        return new InMemoryConsumerRepository();
    }

    /**
     * The next commit throws {@code failure} instead of applying the transaction.
     */
    public void failNextCommit(RuntimeException failure) {
        nextCommitFailure.set(failure);
    }

    private synchronized void commit(InMemoryTransaction tx) {
        RuntimeException failure = nextCommitFailure.getAndSet(null);
        if (failure != null) {
            throw failure;
        }
        for (StoredEvent event : tx.stagedEvents()) {
            if (hasCommittedEventVersion(event.streamId(), event.version())) {
                throw new DuplicateVersionException(event.streamId(), event.version());
            }
        }
        for (String messageId : tx.stagedProcessed()) {
            if (processed.contains(messageId)) {
                throw new DuplicateMessageException(messageId);
            }
        }
        for (OutboxEntry entry : tx.stagedOutbox()) {
            if (outbox.containsKey(entry.id())) {
                throw new IllegalStateException("Duplicate outbox id: " + entry.id());
            }
        }
        events.addAll(tx.stagedEvents());
        tx.stagedOutbox().forEach(entry -> outbox.put(entry.id(), entry));
        processed.addAll(tx.stagedProcessed());
        consumers.putAll(tx.stagedConsumers());
        tx.close();
        commits.incrementAndGet();
        logger.debug("Committed in-memory transaction: events={}, outbox={}, processed={}, consumers={}",
            tx.stagedEvents().size(), tx.stagedOutbox().size(), tx.stagedProcessed().size(),
            tx.stagedConsumers().size());
    }

    private void rollback(InMemoryTransaction tx) {
        tx.close();
        rollbacks.incrementAndGet();
        logger.debug("Rolled back in-memory transaction");
    }

    void recordConsumerWrite() {
        consumerWrites.incrementAndGet();
    }

    synchronized boolean hasCommittedEventVersion(String streamId, long version) {
        return events.stream().anyMatch(e -> e.streamId().equals(streamId) && e.version() == version);
    }

    synchronized boolean isCommittedProcessed(String messageId) {
        return processed.contains(messageId);
    }

    synchronized Optional<ConsumerRow> committedConsumer(String consumerId) {
        return Optional.ofNullable(consumers.get(consumerId));
    }

    synchronized List<ConsumerRow> committedConsumers() {
        return new ArrayList<>(consumers.values());
    }

    // Inspection for assertions

    public synchronized List<StoredEvent> committedEvents(String streamId) {
        return events.stream()
            .filter(e -> e.streamId().equals(streamId))
            .sorted((a, b) -> Long.compare(a.version(), b.version()))
            .collect(Collectors.toList());
    }

    public synchronized List<OutboxEntry> outboxEntries() {
        return List.copyOf(outbox.values());
    }

    public synchronized Set<String> processedMessageIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(processed));
    }

    public synchronized List<ConsumerRow> consumerRows() {
        return List.copyOf(consumers.values());
    }

    public int commitCount() {
        return commits.get();
    }

    public int rollbackCount() {
        return rollbacks.get();
    }

    /**
     * Number of consumer inserts and updates that actually wrote a row.
     */
    public int consumerWriteCount() {
        return consumerWrites.get();
    }
}
