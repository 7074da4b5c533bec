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

import dev.mars.eventline.api.broker.StreamBroker;
import dev.mars.eventline.api.broker.StreamRecord;
import dev.mars.eventline.api.consumer.Consumer;
import dev.mars.eventline.api.domain.Event;
import dev.mars.eventline.core.bus.MessageBus;
import dev.mars.eventline.core.metrics.EventlineMetrics;
import dev.mars.eventline.core.uow.UnitOfWork;
import dev.mars.eventline.core.uow.UnitOfWorkFactory;
import dev.mars.eventline.core.uow.UnitOfWorkResult;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Feeds one broker stream into the bus on behalf of one stored consumer.
 *
 * <p>Each iteration opens a unit of work, re-reads the consumer row, reads the records
 * after its acknowledged offset, dispatches each through the bus and advances the offset.
 * The offset is written in that same unit of work, so a failure anywhere before commit
 * leaves it unchanged and the records are delivered again: delivery is at least once and
 * handlers are expected to be idempotent.</p>
 *
 * <p>Iteration failures are logged and the loop carries on after the poll interval. The
 * loop runs until {@link #stop()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class StreamConsumerLoop {
    private static final Logger logger = LoggerFactory.getLogger(StreamConsumerLoop.class);

    private final Vertx vertx;
    private final String consumerId;
    private final UnitOfWorkFactory<?> unitOfWorkFactory;
    private final StreamBroker broker;
    private final StreamEventMapping mapping;
    private final MessageBus bus;
    private final ConsumerLoopConfig config;
    private final EventlineMetrics metrics;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<ConsumerLoopState> state = new AtomicReference<>(ConsumerLoopState.IDLE);
    private volatile long timerId = -1;

    public StreamConsumerLoop(Vertx vertx, String consumerId, UnitOfWorkFactory<?> unitOfWorkFactory,
                              StreamBroker broker, StreamEventMapping mapping, MessageBus bus,
                              ConsumerLoopConfig config, EventlineMetrics metrics) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.consumerId = Objects.requireNonNull(consumerId, "Consumer id cannot be null");
        this.unitOfWorkFactory = Objects.requireNonNull(unitOfWorkFactory, "UnitOfWorkFactory cannot be null");
        this.broker = Objects.requireNonNull(broker, "StreamBroker cannot be null");
        this.mapping = Objects.requireNonNull(mapping, "StreamEventMapping cannot be null");
        this.bus = Objects.requireNonNull(bus, "MessageBus cannot be null");
        this.config = config != null ? config : ConsumerLoopConfig.defaults();
        this.metrics = metrics != null ? metrics : EventlineMetrics.noop();
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.debug("Consumer loop already running: consumerId={}", consumerId);
            return;
        }
        logger.info("Starting consumer loop: consumerId={}, {}", consumerId, config);
        tick();
    }

    /**
     * Stops the loop. An iteration already in flight completes; no further one starts.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            long id = timerId;
            if (id >= 0) {
                vertx.cancelTimer(id);
            }
            logger.info("Stopped consumer loop: consumerId={}", consumerId);
        }
        state.set(ConsumerLoopState.STOPPED);
    }

    public boolean isRunning() {
        return running.get();
    }

    public ConsumerLoopState getState() {
        return state.get();
    }

    public String getConsumerId() {
        return consumerId;
    }

    /**
     * Runs a single read-dispatch-acknowledge iteration.
     *
     * @return number of records dispatched and acknowledged
     */
    public Future<Integer> runOnce() {
        AtomicReference<String> consumerName = new AtomicReference<>(consumerId);
        return unitOfWorkFactory.<Integer>execute(uow -> uow.consumers().get(consumerId).compose(consumer -> {
                consumerName.set(consumer.getName());
                state.set(ConsumerLoopState.READING);
                return broker.readAfter(consumer.getStream(), consumer.getAckedId(), config.getBatchSize())
                    .compose(records -> dispatchAll(consumer, records))
                    .compose(count -> acknowledge(uow, consumer, count));
            }))
            .map(UnitOfWorkResult::value)
            .onSuccess(count -> {
                if (count > 0) {
                    metrics.recordConsumerRecords(consumerName.get(), count);
                    logger.debug("Consumer iteration committed: consumer={}, records={}", consumerName.get(), count);
                }
            });
    }

    private Future<Integer> dispatchAll(Consumer consumer, List<StreamRecord> records) {
        Future<Integer> chain = Future.succeededFuture(0);
        for (StreamRecord record : records) {
            chain = chain.compose(dispatched -> dispatch(consumer, record).map(v -> dispatched + 1));
        }
        return chain;
    }

    private Future<Void> dispatch(Consumer consumer, StreamRecord record) {
        state.set(ConsumerLoopState.HANDLING);
        Event event;
        try {
            event = mapping.toEvent(record);
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
        logger.debug("Dispatching stream record: consumer={}, stream={}, offset={}, eventId={}",
            consumer.getName(), record.stream(), record.offset(), event.messageId());
        return bus.handle(event).map(handled -> {
            state.set(ConsumerLoopState.ACKING);
            consumer.acknowledge(record.offset());
            return null;
        });
    }

    private Future<Integer> acknowledge(UnitOfWork uow, Consumer consumer, int count) {
        if (count == 0) {
            return Future.succeededFuture(0);
        }
        return uow.consumers().update(consumer).map(v -> count);
    }

    private void tick() {
        if (!running.get()) {
            return;
        }
        runOnce().onComplete(ar -> {
            if (ar.failed()) {
                logger.error("Consumer iteration failed, will retry: consumerId={}, error={}",
                    consumerId, ar.cause().getMessage(), ar.cause());
                metrics.recordConsumerFailure(consumerId);
            }
            scheduleNext();
        });
    }

    private void scheduleNext() {
        if (!running.get()) {
            state.set(ConsumerLoopState.STOPPED);
            return;
        }
        state.set(ConsumerLoopState.BACKOFF);
        long delay = Math.max(1L, config.getPollInterval().toMillis());
        timerId = vertx.setTimer(delay, id -> tick());
    }
}
