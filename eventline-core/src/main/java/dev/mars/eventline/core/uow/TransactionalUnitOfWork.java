package dev.mars.eventline.core.uow;

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

import dev.mars.eventline.api.consumer.Consumer;
import dev.mars.eventline.api.consumer.ConsumerRepository;
import dev.mars.eventline.api.domain.Aggregate;
import dev.mars.eventline.api.domain.DomainEvent;
import dev.mars.eventline.api.domain.Message;
import dev.mars.eventline.api.error.ConfigurationException;
import dev.mars.eventline.api.ledger.ProcessedMessageLedger;
import dev.mars.eventline.api.outbox.Outbox;
import dev.mars.eventline.api.store.EventStore;
import dev.mars.eventline.core.metrics.EventlineMetrics;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A unit of work bound to one transaction handle.
 *
 * <p>{@link #flush()} drains every aggregate the repository has seen, appends the drained
 * events to the store, advances each aggregate's version and sends all of the events to the
 * outbox, in that order, on the same transaction. Committing or rolling back is the caller's
 * job; {@link UnitOfWorkFactory} does it through a
 * {@link dev.mars.eventline.api.tx.TransactionRunner}.</p>
 *
 * @param <C> transaction handle type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class TransactionalUnitOfWork<C> implements UnitOfWork {
    private static final Logger logger = LoggerFactory.getLogger(TransactionalUnitOfWork.class);

    private final C tx;
    private final EventStore<C> eventStore;
    private final Outbox<C> outbox;
    private final ProcessedMessageLedger<C> ledger;
    private final ConsumerRepository<C> consumerRepository;
    private final EventlineMetrics metrics;
    private final AtomicReference<UnitOfWorkState> state = new AtomicReference<>(UnitOfWorkState.IDLE);
    private final TransactionalAggregateRepository<C> repository;

    private final TransactionalOutbox outboxView = new TransactionalOutbox() {
        @Override
        public Future<Void> send(List<? extends Message> messages) {
            return requireActive("outbox send").compose(v -> outbox.send(tx, messages))
                .onSuccess(v -> metrics.recordOutboxMessages(messages.size()));
        }
    };

    private final ProcessedMessages ledgerView = new ProcessedMessages() {
        @Override
        public Future<Boolean> isProcessed(String messageId) {
            return requireActive("ledger read").compose(v -> ledger.isProcessed(tx, messageId));
        }

        @Override
        public Future<Void> markProcessed(String messageId) {
            return requireActive("ledger write").compose(v -> ledger.markProcessed(tx, messageId));
        }
    };

    private final ConsumerStore consumerView = new ConsumerStore() {
        @Override
        public Future<Consumer> get(String consumerId) {
            return requireConsumers("consumer read").compose(v -> consumerRepository.get(tx, consumerId));
        }

        @Override
        public Future<List<Consumer>> list() {
            return requireConsumers("consumer read").compose(v -> consumerRepository.list(tx));
        }

        @Override
        public Future<Void> add(Consumer consumer) {
            return requireConsumers("consumer write").compose(v -> consumerRepository.add(tx, consumer));
        }

        @Override
        public Future<Void> update(Consumer consumer) {
            return requireConsumers("consumer write").compose(v -> consumerRepository.update(tx, consumer));
        }
    };

    public TransactionalUnitOfWork(C tx, EventStore<C> eventStore, Outbox<C> outbox,
                                   ProcessedMessageLedger<C> ledger, ConsumerRepository<C> consumerRepository,
                                   EventlineMetrics metrics) {
        this.tx = tx;
        this.eventStore = eventStore;
        this.outbox = outbox;
        this.ledger = ledger;
        this.consumerRepository = consumerRepository;
        this.metrics = metrics != null ? metrics : EventlineMetrics.noop();
        this.repository = new TransactionalAggregateRepository<>(tx, eventStore,
            () -> state.get() == UnitOfWorkState.ACTIVE);
    }

    @Override
    public AggregateRepository repository() {
        return repository;
    }

    @Override
    public TransactionalOutbox outbox() {
        return outboxView;
    }

    @Override
    public ProcessedMessages ledger() {
        return ledgerView;
    }

    @Override
    public ConsumerStore consumers() {
        return consumerView;
    }

    @Override
    public UnitOfWorkState state() {
        return state.get();
    }

    public void begin() {
        if (tx == null) {
            throw ConfigurationException.noActiveTransaction("unit of work");
        }
        transition(UnitOfWorkState.IDLE, UnitOfWorkState.ACTIVE);
    }

    /**
     * Persists pending events of every seen aggregate and returns them in flush order.
     */
    public Future<List<DomainEvent>> flush() {
        try {
            transition(UnitOfWorkState.ACTIVE, UnitOfWorkState.COMMITTING);
        } catch (IllegalStateException e) {
            return Future.failedFuture(e);
        }

        List<DomainEvent> collected = new ArrayList<>();
        Future<Void> chain = Future.succeededFuture();
        for (Aggregate aggregate : repository.seen()) {
            chain = chain.compose(v -> appendPending(aggregate, collected));
        }
        return chain
            .compose(v -> collected.isEmpty() ? Future.<Void>succeededFuture() : outbox.send(tx, collected))
            .map(v -> {
                metrics.recordOutboxMessages(collected.size());
                logger.debug("Flushed unit of work: aggregates={}, events={}", repository.seen().size(), collected.size());
                return List.copyOf(collected);
            });
    }

    private Future<Void> appendPending(Aggregate aggregate, List<DomainEvent> collected) {
        List<DomainEvent> drained = aggregate.drain();
        if (drained.isEmpty()) {
            return Future.succeededFuture();
        }
        long currentVersion = aggregate.getVersion();
        return eventStore.append(tx, aggregate.getId(), drained, currentVersion)
            .map(v -> {
                aggregate.markPersisted(currentVersion + drained.size());
                collected.addAll(drained);
                metrics.recordEventsAppended(drained.size());
                return null;
            });
    }

    void markRollingBack() {
        UnitOfWorkState current = state.get();
        if (current == UnitOfWorkState.ACTIVE || current == UnitOfWorkState.COMMITTING) {
            state.compareAndSet(current, UnitOfWorkState.ROLLING_BACK);
        }
    }

    void close() {
        state.set(UnitOfWorkState.CLOSED);
    }

    private Future<Void> requireActive(String operation) {
        if (state.get() != UnitOfWorkState.ACTIVE) {
            return Future.failedFuture(ConfigurationException.noActiveTransaction(operation));
        }
        return Future.succeededFuture();
    }

    private Future<Void> requireConsumers(String operation) {
        if (consumerRepository == null) {
            return Future.failedFuture(new ConfigurationException("No consumer repository configured for " + operation));
        }
        return requireActive(operation);
    }

    private void transition(UnitOfWorkState from, UnitOfWorkState to) {
        if (!state.compareAndSet(from, to)) {
            throw new IllegalStateException("Unit of work cannot move from " + state.get() + " to " + to);
        }
    }
}
