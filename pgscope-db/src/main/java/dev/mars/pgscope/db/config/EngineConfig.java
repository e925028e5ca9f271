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
 * Engine behaviour settings.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class EngineConfig {
    private final boolean strictReleaseOrder;
    private final Duration queryTimeout;
    private final String savepointPrefix;
    private final int cursorPrefetch;

    private EngineConfig(Builder builder) {
        if (builder.cursorPrefetch <= 0) {
            throw new IllegalArgumentException("Cursor prefetch must be positive: " + builder.cursorPrefetch);
        }
        if (builder.savepointPrefix == null || !builder.savepointPrefix.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("Savepoint prefix must be a plain SQL identifier: " + builder.savepointPrefix);
        }
        this.strictReleaseOrder = builder.strictReleaseOrder;
        this.queryTimeout = builder.queryTimeout;
        this.savepointPrefix = builder.savepointPrefix;
        this.cursorPrefetch = builder.cursorPrefetch;
    }

    public static EngineConfig defaults() {
        return new Builder().build();
    }

    /**
     * When true, reusable connections of one task must be released in reverse acquisition order.
     */
    public boolean isStrictReleaseOrder() {
        return strictReleaseOrder;
    }

    /**
     * Statement timeout applied to queries that do not set their own. {@code null} means none.
     */
    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public String getSavepointPrefix() {
        return savepointPrefix;
    }

    public int getCursorPrefetch() {
        return cursorPrefetch;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
            "strictReleaseOrder=" + strictReleaseOrder +
            ", queryTimeout=" + queryTimeout +
            ", savepointPrefix='" + savepointPrefix + '\'' +
            ", cursorPrefetch=" + cursorPrefetch +
            '}';
    }

    public static final class Builder {
        private boolean strictReleaseOrder = true;
        private Duration queryTimeout;
        private String savepointPrefix = "pgscope_sp_";
        private int cursorPrefetch = 50;

        public Builder strictReleaseOrder(boolean strictReleaseOrder) {
            this.strictReleaseOrder = strictReleaseOrder;
            return this;
        }

        public Builder queryTimeout(Duration queryTimeout) {
            this.queryTimeout = queryTimeout;
            return this;
        }

        public Builder savepointPrefix(String savepointPrefix) {
            this.savepointPrefix = savepointPrefix;
            return this;
        }

        public Builder cursorPrefetch(int cursorPrefetch) {
            this.cursorPrefetch = cursorPrefetch;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
