package dev.mars.pgscope.pg;

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
import dev.mars.pgscope.db.config.ConnectionConfig;
import dev.mars.pgscope.db.config.EngineConfig;
import dev.mars.pgscope.db.config.PgScopeConfiguration;
import dev.mars.pgscope.db.config.PoolConfig;
import dev.mars.pgscope.db.engine.PgScopeEngine;
import dev.mars.pgscope.db.metrics.MicrometerScopeMetrics;
import dev.mars.pgscope.db.metrics.NoOpScopeMetrics;
import dev.mars.pgscope.db.metrics.PoolMetricsBinder;
import dev.mars.pgscope.db.pool.BoundedConnectionPool;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a started {@link PgScopeEngine} backed by PostgreSQL.
 *
 * <p>The caller keeps ownership of the {@link Vertx} instance. Closing the engine closes the pool
 * and its connections only.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class PgScopeEngines {
    private static final Logger logger = LoggerFactory.getLogger(PgScopeEngines.class);

    static final String POOL_NAME = "pgscope";

    private PgScopeEngines() {
    }

    public static Future<PgScopeEngine> create(Vertx vertx, PgScopeConfiguration configuration) {
        return create(vertx, configuration, null);
    }

    public static Future<PgScopeEngine> create(Vertx vertx, PgScopeConfiguration configuration, MeterRegistry registry) {
        MeterRegistry effective = configuration.isMetricsEnabled() ? registry : null;
        return create(vertx, configuration.getConnectionConfig(), configuration.getPoolConfig(),
            configuration.getEngineConfig(), effective);
    }

    public static Future<PgScopeEngine> create(Vertx vertx, ConnectionConfig connectionConfig, PoolConfig poolConfig,
                                               EngineConfig engineConfig, MeterRegistry registry) {
        BoundedConnectionPool pool;
        try {
            pool = new BoundedConnectionPool(vertx, new PgConnectionFactory(vertx, connectionConfig), poolConfig, POOL_NAME);
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }

        ScopeMetrics metrics = NoOpScopeMetrics.INSTANCE;
        if (registry != null) {
            metrics = new MicrometerScopeMetrics(registry);
            new PoolMetricsBinder(pool, POOL_NAME).bindTo(registry);
        }
        ScopeMetrics engineMetrics = metrics;

        return pool.start()
            .map(v -> new PgScopeEngine(pool, new PostgresDialect(), engineConfig, engineMetrics))
            .recover(err -> {
                logger.error("Failed to start PgScope engine against {}: {}", connectionConfig, err.getMessage());
                return pool.close().transform(ar -> Future.failedFuture(err));
            });
    }
}
