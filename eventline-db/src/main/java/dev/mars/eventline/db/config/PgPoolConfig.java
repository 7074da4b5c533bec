package dev.mars.eventline.db.config;

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

import java.time.Duration;
import java.util.Objects;

/**
 * Vert.x reactive pool settings. Each unit of work holds one connection for its whole
 * transaction, and a consumer iteration holds one while the bus takes others, so the
 * pool must allow at least two connections per active consumer loop.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-07-13
 * @version 2.0
 */
public final class PgPoolConfig {
    private final int maxSize;
    private final int maxWaitQueueSize;
    private final Duration connectionTimeout;
    private final Duration idleTimeout;
    private final boolean shared;

    private PgPoolConfig(Builder builder) {
        this.maxSize = builder.maxSize;
        this.maxWaitQueueSize = builder.maxWaitQueueSize;
        this.connectionTimeout = builder.connectionTimeout;
        this.idleTimeout = builder.idleTimeout;
        this.shared = builder.shared;
    }

    /** Maps to {@code PoolOptions.setMaxSize()}. */
    public int getMaxSize() { return maxSize; }

    /** Maps to {@code PoolOptions.setMaxWaitQueueSize()}. */
    public int getMaxWaitQueueSize() { return maxWaitQueueSize; }

    public Duration getConnectionTimeout() { return connectionTimeout; }

    public Duration getIdleTimeout() { return idleTimeout; }

    /** Whether verticles with matching options share one pool. */
    public boolean isShared() { return shared; }

    @Override
    public String toString() {
        return "PgPoolConfig{maxSize=" + maxSize + ", maxWaitQueueSize=" + maxWaitQueueSize
            + ", connectionTimeout=" + connectionTimeout + ", idleTimeout=" + idleTimeout + ", shared=" + shared + '}';
    }

    public static final class Builder {
        private int maxSize = 16;
        private int maxWaitQueueSize = 128;
        private Duration connectionTimeout = Duration.ofSeconds(30);
        private Duration idleTimeout = Duration.ofMinutes(10);
        private boolean shared = true;

        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder maxWaitQueueSize(int maxWaitQueueSize) {
            this.maxWaitQueueSize = maxWaitQueueSize;
            return this;
        }

        public Builder connectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = Objects.requireNonNull(connectionTimeout, "connectionTimeout");
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
            return this;
        }

        public Builder shared(boolean shared) {
            this.shared = shared;
            return this;
        }

        public PgPoolConfig build() {
            return new PgPoolConfig(this);
        }
    }
}
