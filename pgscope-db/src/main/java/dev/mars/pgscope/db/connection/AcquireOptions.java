package dev.mars.pgscope.db.connection;

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
 * How {@link dev.mars.pgscope.db.engine.PgScopeEngine#acquire} obtains a connection.
 *
 * <ul>
 *   <li>{@code timeout} - maximum wait for a pooled connection, {@code null} for the pool default</li>
 *   <li>{@code reuse} - share the task's innermost reusable connection when there is one</li>
 *   <li>{@code lazy} - defer taking a pooled connection until the first statement</li>
 *   <li>{@code reusable} - make a new connection visible to later {@code reuse} acquisitions;
 *       ignored when the acquisition reuses</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class AcquireOptions {

    private static final AcquireOptions DEFAULTS = builder().build();
    private static final AcquireOptions REUSE = builder().reuse(true).build();

    private final Duration timeout;
    private final boolean reuse;
    private final boolean lazy;
    private final boolean reusable;

    private AcquireOptions(Builder builder) {
        this.timeout = builder.timeout;
        this.reuse = builder.reuse;
        this.lazy = builder.lazy;
        this.reusable = builder.reusable;
    }

    public static AcquireOptions defaults() {
        return DEFAULTS;
    }

    public static AcquireOptions reuse() {
        return REUSE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration getTimeout() {
        return timeout;
    }

    public boolean isReuse() {
        return reuse;
    }

    public boolean isLazy() {
        return lazy;
    }

    public boolean isReusable() {
        return reusable;
    }

    @Override
    public String toString() {
        return "AcquireOptions{timeout=" + timeout + ", reuse=" + reuse + ", lazy=" + lazy + ", reusable=" + reusable + "}";
    }

    public static final class Builder {
        private Duration timeout;
        private boolean reuse;
        private boolean lazy;
        private boolean reusable = true;

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder reuse(boolean reuse) {
            this.reuse = reuse;
            return this;
        }

        public Builder lazy(boolean lazy) {
            this.lazy = lazy;
            return this;
        }

        public Builder reusable(boolean reusable) {
            this.reusable = reusable;
            return this;
        }

        public AcquireOptions build() {
            return new AcquireOptions(this);
        }
    }
}
