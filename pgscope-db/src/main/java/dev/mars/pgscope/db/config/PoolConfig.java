package dev.mars.pgscope.db.config;

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
 * Sizing and timing of a {@link dev.mars.pgscope.db.pool.BoundedConnectionPool}.
 *
 * <ul>
 *   <li>{@code minSize} connections are opened when the pool starts and kept through idle reaping</li>
 *   <li>{@code maxSize} is the steady-state ceiling</li>
 *   <li>{@code maxOverflow} extra connections may be opened under load; they are closed again as soon
 *       as they come back with nobody waiting</li>
 *   <li>{@code maxWaitQueueSize} bounds the callers waiting for a connection, negative means unbounded</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class PoolConfig {
    private final int minSize;
    private final int maxSize;
    private final int maxOverflow;
    private final int maxWaitQueueSize;
    private final Duration acquireTimeout;
    private final Duration idleTimeout;

    private PoolConfig(Builder builder) {
        if (builder.maxSize <= 0) {
            throw new IllegalArgumentException("Pool max size must be positive: " + builder.maxSize);
        }
        if (builder.minSize < 0 || builder.minSize > builder.maxSize) {
            throw new IllegalArgumentException("Pool min size must be between 0 and max size: " + builder.minSize);
        }
        if (builder.maxOverflow < 0) {
            throw new IllegalArgumentException("Pool max overflow cannot be negative: " + builder.maxOverflow);
        }
        this.minSize = builder.minSize;
        this.maxSize = builder.maxSize;
        this.maxOverflow = builder.maxOverflow;
        this.maxWaitQueueSize = builder.maxWaitQueueSize;
        this.acquireTimeout = builder.acquireTimeout;
        this.idleTimeout = builder.idleTimeout;
    }

    public int getMinSize() {
        return minSize;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public int getMaxOverflow() {
        return maxOverflow;
    }

    public int getMaxWaitQueueSize() {
        return maxWaitQueueSize;
    }

    /**
     * Wait applied when the caller does not pass its own timeout. {@code null} waits indefinitely.
     */
    public Duration getAcquireTimeout() {
        return acquireTimeout;
    }

    /**
     * Idle time after which connections above {@code minSize} are closed. {@code null} or zero disables reaping.
     */
    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
            "minSize=" + minSize +
            ", maxSize=" + maxSize +
            ", maxOverflow=" + maxOverflow +
            ", maxWaitQueueSize=" + maxWaitQueueSize +
            ", acquireTimeout=" + acquireTimeout +
            ", idleTimeout=" + idleTimeout +
            '}';
    }

    public static final class Builder {
        private int minSize = 1;
        private int maxSize = 10;
        private int maxOverflow = 0;
        private int maxWaitQueueSize = 128;
        private Duration acquireTimeout = Duration.ofSeconds(30);
        private Duration idleTimeout = Duration.ofMinutes(10);

        public Builder minSize(int minSize) {
            this.minSize = minSize;
            return this;
        }

        public Builder maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder maxOverflow(int maxOverflow) {
            this.maxOverflow = maxOverflow;
            return this;
        }

        public Builder maxWaitQueueSize(int maxWaitQueueSize) {
            this.maxWaitQueueSize = maxWaitQueueSize;
            return this;
        }

        public Builder acquireTimeout(Duration acquireTimeout) {
            this.acquireTimeout = acquireTimeout;
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            this.idleTimeout = idleTimeout;
            return this;
        }

        public PoolConfig build() {
            return new PoolConfig(this);
        }
    }
}
