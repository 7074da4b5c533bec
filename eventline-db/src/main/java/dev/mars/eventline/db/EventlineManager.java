package dev.mars.eventline.db;

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
import dev.mars.eventline.api.codec.EventTypeRegistry;
import dev.mars.eventline.api.codec.MessageCodec;
import dev.mars.eventline.core.bus.EventPublisher;
import dev.mars.eventline.core.bus.HandlerRegistry;
import dev.mars.eventline.core.bus.MessageBus;
import dev.mars.eventline.core.consumer.ConsumerSupervisor;
import dev.mars.eventline.core.consumer.StreamEventMapping;
import dev.mars.eventline.core.metrics.EventlineMetrics;
import dev.mars.eventline.core.uow.UnitOfWorkFactory;
import dev.mars.eventline.db.config.EventlineConfiguration;
import dev.mars.eventline.db.connection.PgConnectionManager;
import dev.mars.eventline.db.consumer.PgConsumerRepository;
import dev.mars.eventline.db.ledger.PgProcessedMessageLedger;
import dev.mars.eventline.db.outbox.PgOutbox;
import dev.mars.eventline.db.setup.SchemaInitializer;
import dev.mars.eventline.db.store.PgEventStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.SqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

/**
 * Wires the PostgreSQL implementations into a ready-to-use unit of work factory.
 *
 * <pre>{@code
 * EventlineManager manager = new EventlineManager(new EventlineConfiguration("production"), registry);
 * manager.start()
 *     .compose(v -> manager.getUnitOfWorkFactory().execute(uow -> ...));
 * }</pre>
 *
 * <p>The manager creates its own Vert.x instance unless one is supplied, and only closes
 * the instance it created.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 1.0
 */
public class EventlineManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventlineManager.class);

    private final EventlineConfiguration configuration;
    private final Vertx vertx;
    private final boolean vertxOwnedByManager;
    private final MeterRegistry meterRegistry;

    private final PgConnectionManager connectionManager;
    private final Pool pool;
    private final MessageCodec codec;
    private final EventlineMetrics metrics;
    private final PgEventStore eventStore;
    private final PgOutbox outbox;
    private final PgProcessedMessageLedger ledger;
    private final PgConsumerRepository consumerRepository;
    private final UnitOfWorkFactory<SqlConnection> unitOfWorkFactory;
    private final List<ConsumerSupervisor> supervisors = new CopyOnWriteArrayList<>();

    private volatile boolean started = false;

    public EventlineManager(EventlineConfiguration configuration, EventTypeRegistry registry) {
        this(configuration, registry, new SimpleMeterRegistry(), null);
    }

    /**
     * In a Vert.x application pass the application's instance so pools share its event loops.
     */
    public EventlineManager(EventlineConfiguration configuration, EventTypeRegistry registry,
                            MeterRegistry meterRegistry, Vertx vertx) {
        this.configuration = Objects.requireNonNull(configuration, "EventlineConfiguration cannot be null");
        Objects.requireNonNull(registry, "EventTypeRegistry cannot be null");
        this.meterRegistry = meterRegistry;

        logger.info("Initializing Eventline manager with profile: {}", configuration.getProfile());

        if (vertx != null) {
            this.vertx = vertx;
            this.vertxOwnedByManager = false;
            logger.info("Using provided Vert.x instance (external ownership)");
        } else {
            this.vertx = Vertx.vertx();
            this.vertxOwnedByManager = true;
            logger.info("Created new Vert.x instance (manager ownership)");
        }

        this.connectionManager = new PgConnectionManager(this.vertx);
        this.pool = connectionManager.getOrCreateReactivePool(EventlineDefaults.DEFAULT_POOL_ID,
            configuration.getDatabaseConfig(), configuration.getPoolConfig());

        this.codec = new MessageCodec(registry);
        EventlineConfiguration.MetricsConfig metricsConfig = configuration.getMetricsConfig();
        this.metrics = new EventlineMetrics(metricsConfig.getInstanceId());
        if (metricsConfig.isEnabled() && meterRegistry != null) {
            metrics.bindTo(meterRegistry);
        }

        this.eventStore = new PgEventStore(codec);
        this.outbox = new PgOutbox(codec);
        this.ledger = new PgProcessedMessageLedger();
        this.consumerRepository = new PgConsumerRepository();
        this.unitOfWorkFactory = new UnitOfWorkFactory<>(connectionManager, eventStore, outbox, ledger,
            consumerRepository, metrics);

        logger.info("Eventline manager initialized");
    }

    /**
     * Creates the schema if needed and verifies connectivity.
     */
    public Future<Void> start() {
        if (started) {
            logger.warn("Eventline manager is already started");
            return Future.succeededFuture();
        }
        return new SchemaInitializer(connectionManager, configuration.getDatabaseConfig().getSchema())
            .initializeSchema()
            .compose(v -> connectionManager.checkHealth(EventlineDefaults.DEFAULT_POOL_ID))
            .compose(healthy -> {
                if (!healthy) {
                    return Future.<Void>failedFuture(new IllegalStateException("Database health check failed"));
                }
                started = true;
                logger.info("Eventline manager started");
                return Future.<Void>succeededFuture();
            });
    }

    public MessageBus newMessageBus(HandlerRegistry handlers, EventPublisher publisher) {
        return new MessageBus(configuration.getBusDomain(), unitOfWorkFactory, handlers, publisher, metrics);
    }

    /**
     * A supervisor for consumer loops on {@code broker}; it is stopped when the manager closes.
     * It runs at most one loop fewer than the pool holds connections, so handler units of work
     * always find a free connection.
     */
    public ConsumerSupervisor newConsumerSupervisor(StreamBroker broker, StreamEventMapping mapping, MessageBus bus) {
        ConsumerSupervisor supervisor = new ConsumerSupervisor(vertx, unitOfWorkFactory, broker, mapping, bus,
            configuration.getConsumerLoopConfig(), metrics,
            maxConsumerLoops(configuration.getPoolConfig().getMaxSize()));
        supervisors.add(supervisor);
        return supervisor;
    }

    static int maxConsumerLoops(int poolMaxSize) {
        return poolMaxSize - 1;
    }

    public Future<Void> closeReactive() {
        logger.info("Closing Eventline manager");
        supervisors.forEach(ConsumerSupervisor::stop);
        supervisors.clear();
        started = false;
        return connectionManager.closeAsync()
            .compose(v -> vertxOwnedByManager ? vertx.close() : Future.<Void>succeededFuture())
            .onSuccess(v -> logger.info("Eventline manager closed"));
    }

    @Override
    public void close() {
        try {
            closeReactive().toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while closing Eventline manager");
        } catch (Exception e) {
            logger.error("Error closing Eventline manager", e);
        }
    }

    public boolean isStarted() { return started; }
    public EventlineConfiguration getConfiguration() { return configuration; }
    public Vertx getVertx() { return vertx; }
    public Pool getPool() { return pool; }
    public PgConnectionManager getConnectionManager() { return connectionManager; }
    public MessageCodec getCodec() { return codec; }
    public EventlineMetrics getMetrics() { return metrics; }
    public MeterRegistry getMeterRegistry() { return meterRegistry; }
    public PgEventStore getEventStore() { return eventStore; }
    public PgOutbox getOutbox() { return outbox; }
    public PgProcessedMessageLedger getLedger() { return ledger; }
    public PgConsumerRepository getConsumerRepository() { return consumerRepository; }
    public UnitOfWorkFactory<SqlConnection> getUnitOfWorkFactory() { return unitOfWorkFactory; }
}
