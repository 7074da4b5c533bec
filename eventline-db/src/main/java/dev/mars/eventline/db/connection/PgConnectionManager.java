package dev.mars.eventline.db.connection;

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

import dev.mars.eventline.api.tx.TransactionRunner;
import dev.mars.eventline.db.EventlineDefaults;
import dev.mars.eventline.db.config.PgConnectionConfig;
import dev.mars.eventline.db.config.PgPoolConfig;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgBuilder;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.SslMode;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import io.vertx.sqlclient.SqlConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Owns the Vert.x reactive PostgreSQL pools, one per service id, and applies each
 * service's configured {@code search_path} before handing out a connection.
 *
 * <p>As a {@link TransactionRunner} it runs work on the default pool: the transaction
 * commits when the work's future succeeds and rolls back when it fails.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 2.0
 */
public class PgConnectionManager implements TransactionRunner<SqlConnection>, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PgConnectionManager.class);

    private final Map<String, Pool> reactivePools = new ConcurrentHashMap<>();
    private final Map<String, String> serviceSchemas = new ConcurrentHashMap<>();
    private final Vertx vertx;

    public PgConnectionManager(Vertx vertx) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
    }

    /**
     * Creates or returns the pool for {@code serviceId}.
     */
    public Pool getOrCreateReactivePool(String serviceId, PgConnectionConfig connectionConfig, PgPoolConfig poolConfig) {
        Objects.requireNonNull(connectionConfig, "connectionConfig");
        Objects.requireNonNull(poolConfig, "poolConfig");

        return reactivePools.computeIfAbsent(resolveServiceId(serviceId), id -> {
            Pool pool = createReactivePool(connectionConfig, poolConfig);
            String configuredSchema = connectionConfig.getSchema();
            if (configuredSchema != null && !configuredSchema.isBlank()) {
                String normalized = normalizeSearchPath(configuredSchema);
                serviceSchemas.put(id, normalized);
                logger.info("Configured search_path for service '{}' as: {}", id, normalized);
            }
            logger.info("Created reactive pool for service '{}': {}", id, poolConfig);
            return pool;
        });
    }

    public Pool getExistingPool(String serviceId) {
        return reactivePools.get(resolveServiceId(serviceId));
    }

    @Override
    public <T> Future<T> withTransaction(Function<SqlConnection, Future<T>> work) {
        return withTransaction(null, work);
    }

    /**
     * Runs {@code operation} in a transaction on the pool of {@code serviceId}
     * ({@code null} for the default pool), after applying the search path.
     */
    public <T> Future<T> withTransaction(String serviceId, Function<SqlConnection, Future<T>> operation) {
        String resolvedId = resolveServiceId(serviceId);
        Pool pool = reactivePools.get(resolvedId);
        if (pool == null) {
            return Future.failedFuture(new IllegalStateException("No reactive pool found for service: " + resolvedId));
        }
        String searchPath = serviceSchemas.get(resolvedId);
        if (searchPath == null || searchPath.isBlank()) {
            return pool.withTransaction(operation);
        }
        return pool.withTransaction(conn ->
            conn.query("SET LOCAL search_path TO " + searchPath)
                .execute()
                .onFailure(err -> logger.warn("Failed to apply search_path '{}' for service '{}': {}",
                    searchPath, resolvedId, err.toString()))
                .compose(rs -> operation.apply(conn))
        );
    }

    public <T> Future<T> withConnection(String serviceId, Function<SqlConnection, Future<T>> operation) {
        String resolvedId = resolveServiceId(serviceId);
        Pool pool = reactivePools.get(resolvedId);
        if (pool == null) {
            return Future.failedFuture(new IllegalStateException("No reactive pool found for service: " + resolvedId));
        }
        String searchPath = serviceSchemas.get(resolvedId);
        if (searchPath == null || searchPath.isBlank()) {
            return pool.withConnection(operation);
        }
        return pool.withConnection(conn ->
            conn.query("SET search_path TO " + searchPath)
                .execute()
                .compose(rs -> operation.apply(conn))
        );
    }

    /**
     * Runs {@code SELECT 1} on the pool; never fails.
     */
    public Future<Boolean> checkHealth(String serviceId) {
        String resolvedId = resolveServiceId(serviceId);
        if (!reactivePools.containsKey(resolvedId)) {
            return Future.succeededFuture(false);
        }
        return withConnection(resolvedId, conn -> conn.query("SELECT 1").execute().map(rs -> true))
            .recover(err -> {
                logger.warn("Health check failed for {}: {}", resolvedId, err.getMessage());
                return Future.succeededFuture(false);
            });
    }

    private String resolveServiceId(String serviceId) {
        return (serviceId == null || serviceId.isBlank()) ? EventlineDefaults.DEFAULT_POOL_ID : serviceId;
    }

    private Pool createReactivePool(PgConnectionConfig connectionConfig, PgPoolConfig poolConfig) {
        PgConnectOptions connectOptions = new PgConnectOptions()
            .setHost(connectionConfig.getHost())
            .setPort(connectionConfig.getPort())
            .setDatabase(connectionConfig.getDatabase())
            .setUser(connectionConfig.getUsername())
            .setPassword(connectionConfig.getPassword())
            .setSslMode(connectionConfig.isSslEnabled() ? SslMode.REQUIRE : SslMode.DISABLE);

        PoolOptions poolOptions = new PoolOptions()
            .setMaxSize(poolConfig.getMaxSize())
            .setMaxWaitQueueSize(poolConfig.getMaxWaitQueueSize())
            .setConnectionTimeout((int) poolConfig.getConnectionTimeout().toSeconds())
            .setConnectionTimeoutUnit(TimeUnit.SECONDS)
            .setIdleTimeout((int) poolConfig.getIdleTimeout().toSeconds())
            .setIdleTimeoutUnit(TimeUnit.SECONDS)
            .setShared(poolConfig.isShared());

        return PgBuilder.pool()
            .with(poolOptions)
            .connectingTo(connectOptions)
            .using(vertx)
            .build();
    }

    /**
     * Accepts identifiers separated by commas; letters, digits and underscore only.
     */
    static String normalizeSearchPath(String schemaConfig) {
        String s = schemaConfig.trim();
        if (!s.matches("[A-Za-z0-9_,\\s]+")) {
            throw new IllegalArgumentException(
                "Invalid schema config (allowed: letters, digits, underscore, comma, space): " + schemaConfig);
        }
        StringBuilder sb = new StringBuilder();
        for (String part : s.split(",")) {
            String p = part.trim();
            if (p.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(p);
        }
        return sb.toString();
    }

    public Future<Void> closeAsync() {
        List<Future<Void>> closeFutures = new ArrayList<>();
        reactivePools.forEach((serviceId, pool) -> closeFutures.add(pool.close()
            .onFailure(err -> logger.warn("Failed to close reactive pool for service: {}", serviceId, err))));
        reactivePools.clear();
        serviceSchemas.clear();
        return Future.all(closeFutures)
            .<Void>mapEmpty()
            .recover(err -> {
                logger.warn("Some pools failed to close cleanly: {}", err.getMessage());
                return Future.succeededFuture();
            });
    }

    @Override
    public void close() {
        try {
            closeAsync().toCompletionStage().toCompletableFuture().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while closing PgConnectionManager", e);
        } catch (Exception e) {
            logger.error("Error during synchronous close", e);
        }
    }
}
