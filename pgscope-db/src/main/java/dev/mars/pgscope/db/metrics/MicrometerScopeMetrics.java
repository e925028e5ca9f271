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

import dev.mars.pgscope.api.metrics.ScopeMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of ScopeMetrics.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class MicrometerScopeMetrics implements ScopeMetrics {

    private final MeterRegistry registry;

    public MicrometerScopeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void connectionAcquired(boolean reused) {
        Counter.builder("pgscope.connections.acquired")
            .tag("reused", Boolean.toString(reused))
            .description("Connection handles handed out by the engine")
            .register(registry)
            .increment();
    }

    @Override
    public void connectionReleased(boolean permanent) {
        Counter.builder("pgscope.connections.released")
            .tag("permanent", Boolean.toString(permanent))
            .description("Connection handle releases")
            .register(registry)
            .increment();
    }

    @Override
    public void acquireTimedOut() {
        Counter.builder("pgscope.pool.acquire.timeouts")
            .description("Pool acquisitions that ran out of time")
            .register(registry)
            .increment();
    }

    @Override
    public void transactionCompleted(boolean nested, String outcome) {
        Counter.builder("pgscope.transactions.completed")
            .tag("nested", Boolean.toString(nested))
            .tag("outcome", outcome != null ? outcome : "unknown")
            .description("Finished transactions and savepoints")
            .register(registry)
            .increment();
    }

    @Override
    public void recordQuery(long nanos) {
        Timer.builder("pgscope.query.duration")
            .description("Statement execution time")
            .register(registry)
            .record(nanos, TimeUnit.NANOSECONDS);
    }
}
