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
import dev.mars.eventline.api.consumer.Consumer;
import dev.mars.eventline.api.error.ConfigurationException;
import dev.mars.eventline.api.error.EventlineErrorCodes;
import dev.mars.eventline.core.bus.MessageBus;
import dev.mars.eventline.core.metrics.EventlineMetrics;
import dev.mars.eventline.core.uow.UnitOfWorkFactory;
import dev.mars.eventline.core.uow.UnitOfWorkResult;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Registers configured consumers, then runs one {@link StreamConsumerLoop} per stored
 * consumer until closed.
 *
 * <p>Each loop iteration holds a connection for its consumer unit of work while handlers
 * open units of work of their own. A supervisor built with a loop limit refuses to start
 * more loops than that limit, which callers set below the connection pool size.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class ConsumerSupervisor implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConsumerSupervisor.class);

    public static final int UNLIMITED_LOOPS = 0;

    private final Vertx vertx;
    private final UnitOfWorkFactory<?> unitOfWorkFactory;
    private final StreamBroker broker;
    private final StreamEventMapping mapping;
    private final MessageBus bus;
    private final ConsumerLoopConfig loopConfig;
    private final EventlineMetrics metrics;
    private final ConsumerRegistrar registrar;
    private final int maxLoops;
    private final List<StreamConsumerLoop> loops = new CopyOnWriteArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    public ConsumerSupervisor(Vertx vertx, UnitOfWorkFactory<?> unitOfWorkFactory, StreamBroker broker,
                              StreamEventMapping mapping, MessageBus bus, ConsumerLoopConfig loopConfig,
                              EventlineMetrics metrics) {
        this(vertx, unitOfWorkFactory, broker, mapping, bus, loopConfig, metrics, UNLIMITED_LOOPS);
    }

    /**
     * @param maxLoops upper bound on concurrently running loops, or {@link #UNLIMITED_LOOPS}
     */
    public ConsumerSupervisor(Vertx vertx, UnitOfWorkFactory<?> unitOfWorkFactory, StreamBroker broker,
                              StreamEventMapping mapping, MessageBus bus, ConsumerLoopConfig loopConfig,
                              EventlineMetrics metrics, int maxLoops) {
        if (maxLoops != UNLIMITED_LOOPS && maxLoops < 1) {
            throw new IllegalArgumentException("Max loops must be positive, got: " + maxLoops);
        }
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.unitOfWorkFactory = Objects.requireNonNull(unitOfWorkFactory, "UnitOfWorkFactory cannot be null");
        this.broker = Objects.requireNonNull(broker, "StreamBroker cannot be null");
        this.mapping = Objects.requireNonNull(mapping, "StreamEventMapping cannot be null");
        this.bus = Objects.requireNonNull(bus, "MessageBus cannot be null");
        this.loopConfig = loopConfig != null ? loopConfig : ConsumerLoopConfig.defaults();
        this.metrics = metrics != null ? metrics : EventlineMetrics.noop();
        this.registrar = new ConsumerRegistrar(unitOfWorkFactory, broker);
        this.maxLoops = maxLoops;
    }

    /**
     * Registers the configured handlers on the bus, creates missing consumers and starts
     * a loop for every stored consumer.
     */
    public Future<List<StreamConsumerLoop>> start(List<ConsumerConfig> configs) {
        if (!started.compareAndSet(false, true)) {
            return Future.failedFuture(new IllegalStateException("Consumer supervisor already started"));
        }
        try {
            requireWithinLoopLimit(configs.size());
            mapping.validateCovers(configs.stream().map(ConsumerConfig::stream).collect(Collectors.toList()));
            for (ConsumerConfig config : configs) {
                if (config.handler() != null) {
                    bus.getRegistry().onEvent(mapping.eventTypeFor(config.stream()), config.name(), config.handler());
                }
            }
        } catch (RuntimeException e) {
            started.set(false);
            return Future.failedFuture(e);
        }

        return registrar.register(configs)
            .compose(created -> unitOfWorkFactory.<List<Consumer>>execute(uow -> uow.consumers().list()))
            .map(UnitOfWorkResult::value)
            .compose(consumers -> {
                try {
                    requireWithinLoopLimit(consumers.size());
                } catch (ConfigurationException e) {
                    started.set(false);
                    return Future.failedFuture(e);
                }
                return Future.succeededFuture(consumers);
            })
            .map(consumers -> {
                for (Consumer consumer : consumers) {
                    StreamConsumerLoop loop = new StreamConsumerLoop(vertx, consumer.getId(), unitOfWorkFactory,
                        broker, mapping, bus, loopConfig, metrics);
                    loops.add(loop);
                    loop.start();
                }
                logger.info("Started {} consumer loop(s)", loops.size());
                return List.copyOf(loops);
            });
    }

    private void requireWithinLoopLimit(int consumerCount) {
        if (maxLoops != UNLIMITED_LOOPS && consumerCount > maxLoops) {
            throw new ConfigurationException(EventlineErrorCodes.CONSUMER_LIMIT_EXCEEDED,
                "Cannot run " + consumerCount + " consumer loop(s), the limit is " + maxLoops
                    + "; raise the connection pool size or run fewer consumers");
        }
    }

    public int getMaxLoops() {
        return maxLoops;
    }

    public List<StreamConsumerLoop> getLoops() {
        return new ArrayList<>(loops);
    }

    public void stop() {
        loops.forEach(StreamConsumerLoop::stop);
        logger.info("Stopped {} consumer loop(s)", loops.size());
        loops.clear();
    }

    @Override
    public void close() {
        stop();
    }
}
