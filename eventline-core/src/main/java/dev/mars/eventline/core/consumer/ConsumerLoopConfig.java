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

import java.time.Duration;

/**
 * Timing and batching of consumer loops.
 */
public class ConsumerLoopConfig {

    private final Duration pollInterval;
    private final int batchSize;

    private ConsumerLoopConfig(Builder builder) {
        this.pollInterval = builder.pollInterval;
        this.batchSize = builder.batchSize;
    }

    public static ConsumerLoopConfig defaults() {
        return new Builder().build();
    }

    public Duration getPollInterval() { return pollInterval; }
    public int getBatchSize() { return batchSize; }

    @Override
    public String toString() {
        return "ConsumerLoopConfig{pollInterval=" + pollInterval + ", batchSize=" + batchSize + '}';
    }

    public static class Builder {
        private Duration pollInterval = Duration.ofSeconds(3);
        private int batchSize = 1;

        public Builder pollInterval(Duration pollInterval) {
            if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("Poll interval must be positive");
            }
            this.pollInterval = pollInterval;
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize < 1) {
                throw new IllegalArgumentException("Batch size must be at least 1");
            }
            this.batchSize = batchSize;
            return this;
        }

        public ConsumerLoopConfig build() {
            return new ConsumerLoopConfig(this);
        }
    }
}
