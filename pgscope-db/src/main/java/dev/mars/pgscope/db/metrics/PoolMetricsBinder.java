package dev.mars.pgscope.db.metrics;

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

import dev.mars.pgscope.api.spi.ConnectionPool;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;

/**
 * Publishes a pool's accounting as gauges.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class PoolMetricsBinder implements MeterBinder {

    private final ConnectionPool pool;
    private final String poolName;

    public PoolMetricsBinder(ConnectionPool pool, String poolName) {
        this.pool = pool;
        this.poolName = poolName;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("pgscope.pool.size", pool, p -> p.stats().size())
            .tag("pool", poolName)
            .description("Open connections, idle plus checked out")
            .register(registry);
        Gauge.builder("pgscope.pool.checked.out", pool, p -> p.stats().checkedOut())
            .tag("pool", poolName)
            .description("Connections lent to handles")
            .register(registry);
        Gauge.builder("pgscope.pool.checked.in", pool, p -> p.stats().checkedIn())
            .tag("pool", poolName)
            .description("Idle connections")
            .register(registry);
        Gauge.builder("pgscope.pool.overflow", pool, p -> p.stats().overflow())
            .tag("pool", poolName)
            .description("Connections above the steady maximum size")
            .register(registry);
        Gauge.builder("pgscope.pool.waiting", pool, p -> p.stats().waiting())
            .tag("pool", poolName)
            .description("Callers queued for a connection")
            .register(registry);
    }
}
