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

import dev.mars.pgscope.api.query.Query;
import dev.mars.pgscope.db.InMemoryEngineTestBase;
import dev.mars.pgscope.db.connection.AcquireOptions;
import dev.mars.pgscope.db.connection.ConnectionHandle;
import dev.mars.pgscope.db.context.TaskContext;
import dev.mars.pgscope.db.engine.PgScopeEngine;
import dev.mars.pgscope.test.categories.TestCategories;
import dev.mars.pgscope.test.memory.InMemoryDialect;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.vertx.core.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Meters recorded through {@link MicrometerScopeMetrics} and {@link PoolMetricsBinder}.
 */
@Tag(TestCategories.CORE)
class MicrometerScopeMetricsTest extends InMemoryEngineTestBase {

    private SimpleMeterRegistry registry;
    private PgScopeEngine metered;

    @BeforeEach
    void setUpMetrics() {
        registry = new SimpleMeterRegistry();
        metered = new PgScopeEngine(pool, new InMemoryDialect(), engineConfig(), new MicrometerScopeMetrics(registry));
        new PoolMetricsBinder(pool, "test").bindTo(registry);
    }

    private double counter(String name, String... tags) {
        return registry.get(name).tags(tags).counter().count();
    }

    @Test
    void testConnectionAndTransactionCounters() throws Exception {
        TaskContext task = TaskContext.root();
        await(metered.transaction(task, outer -> outer.connection().status(Query.of("UPDATE accounts SET balance = 1"))
            .compose(r -> metered.transaction(task, inner -> inner.connection().status(Query.of("DELETE FROM accounts WHERE id = 2"))))));

        assertEquals(1.0, counter("pgscope.connections.acquired", "reused", "false"));
        assertEquals(1.0, counter("pgscope.connections.acquired", "reused", "true"));
        assertEquals(2.0, counter("pgscope.connections.released", "permanent", "true"));
        assertEquals(1.0, counter("pgscope.transactions.completed", "nested", "false", "outcome", "commit"));
        assertEquals(1.0, counter("pgscope.transactions.completed", "nested", "true", "outcome", "commit"));
        assertEquals(2L, registry.get("pgscope.query.duration").timer().count());
    }

    @Test
    void testRollbackAndSoftReleaseCounted() throws Exception {
        TaskContext task = TaskContext.root();
        ConnectionHandle conn = await(metered.acquire(task));
        await(conn.release(false));
        await(conn.transaction(tx -> Future.failedFuture(new IllegalStateException("no"))).recover(err -> Future.succeededFuture()));
        await(conn.release());

        assertEquals(1.0, counter("pgscope.connections.released", "permanent", "false"));
        assertEquals(1.0, counter("pgscope.transactions.completed", "nested", "false", "outcome", "rollback"));
    }

    @Test
    void testAcquireTimeoutCounted() throws Exception {
        List<ConnectionHandle> held = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            held.add(await(metered.acquire(TaskContext.root())));
        }

        awaitFailure(metered.acquire(TaskContext.root(), AcquireOptions.builder().timeout(Duration.ofMillis(50)).build()));
        assertEquals(1.0, counter("pgscope.pool.acquire.timeouts"));

        for (ConnectionHandle handle : held) {
            await(handle.release());
        }
    }

    @Test
    void testPoolGauges() throws Exception {
        ConnectionHandle conn = await(metered.acquire(TaskContext.root()));

        assertEquals(1.0, registry.get("pgscope.pool.size").tag("pool", "test").gauge().value());
        assertEquals(1.0, registry.get("pgscope.pool.checked.out").tag("pool", "test").gauge().value());
        assertEquals(0.0, registry.get("pgscope.pool.checked.in").tag("pool", "test").gauge().value());

        await(conn.release());
        assertEquals(0.0, registry.get("pgscope.pool.checked.out").tag("pool", "test").gauge().value());
        assertEquals(1.0, registry.get("pgscope.pool.checked.in").tag("pool", "test").gauge().value());
        assertEquals(0.0, registry.get("pgscope.pool.waiting").tag("pool", "test").gauge().value());
    }
}
