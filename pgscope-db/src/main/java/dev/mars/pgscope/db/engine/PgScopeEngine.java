package dev.mars.pgscope.db.engine;

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

import dev.mars.pgscope.api.error.InterfaceException;
import dev.mars.pgscope.api.metrics.ScopeMetrics;
import dev.mars.pgscope.api.query.CompiledStatement;
import dev.mars.pgscope.api.query.ExecutionOptions;
import dev.mars.pgscope.api.query.Query;
import dev.mars.pgscope.api.query.QueryResult;
import dev.mars.pgscope.api.spi.ConnectionPool;
import dev.mars.pgscope.api.spi.Dialect;
import dev.mars.pgscope.api.spi.PoolStats;
import dev.mars.pgscope.api.transaction.TransactionOptions;
import dev.mars.pgscope.db.config.EngineConfig;
import dev.mars.pgscope.db.connection.AcquireOptions;
import dev.mars.pgscope.db.connection.ConnectionHandle;
import dev.mars.pgscope.db.context.TaskContext;
import dev.mars.pgscope.db.metrics.NoOpScopeMetrics;
import dev.mars.pgscope.db.transaction.TransactionManager;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Entry point for connection-scoped database work.
 *
 * <p>The engine hands out {@link ConnectionHandle}s bound to a {@link TaskContext}. Acquisitions with
 * {@code reuse} share the task's innermost reusable connection, so nested code can join an
 * enclosing transaction without being given the connection explicitly.</p>
 *
 * <pre>{@code
 * TaskContext task = TaskContext.root("import");
 * engine.transaction(task, TransactionOptions.defaults(), tx ->
 *     engine.status(task, Query.of("INSERT INTO accounts (id, balance) VALUES (?, ?)", 1, 100))
 *         .compose(r -> engine.scalar(task, Query.of("SELECT COUNT(*) FROM accounts"))));
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class PgScopeEngine implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PgScopeEngine.class);

    private static final AcquireOptions TRANSACTION_ACQUIRE = AcquireOptions.builder().reuse(true).reusable(true).build();

    private final ConnectionPool pool;
    private final Dialect dialect;
    private final EngineConfig config;
    private final ScopeMetrics metrics;
    private final ExecutionOptions defaultExecutionOptions;
    private volatile boolean closed;

    public PgScopeEngine(ConnectionPool pool, Dialect dialect, EngineConfig config) {
        this(pool, dialect, config, NoOpScopeMetrics.INSTANCE);
    }

    public PgScopeEngine(ConnectionPool pool, Dialect dialect, EngineConfig config, ScopeMetrics metrics) {
        this.pool = Objects.requireNonNull(pool, "pool cannot be null");
        this.dialect = Objects.requireNonNull(dialect, "dialect cannot be null");
        this.config = config != null ? config : EngineConfig.defaults();
        this.metrics = metrics != null ? metrics : NoOpScopeMetrics.INSTANCE;
        this.defaultExecutionOptions = ExecutionOptions.builder().timeout(this.config.getQueryTimeout()).build();
        logger.info("Created PgScope engine with dialect {} and {}", dialect.name(), this.config);
    }

    public ConnectionPool pool() {
        return pool;
    }

    public Dialect dialect() {
        return dialect;
    }

    public EngineConfig config() {
        return config;
    }

    public ScopeMetrics metrics() {
        return metrics;
    }

    public ExecutionOptions defaultExecutionOptions() {
        return defaultExecutionOptions;
    }

    public CompiledStatement compile(Query<?> query) {
        return dialect.compile(query);
    }

    public PoolStats poolStats() {
        return pool.stats();
    }

    /**
     * The task's innermost reusable connection, or {@code null}.
     */
    public ConnectionHandle currentConnection(TaskContext task) {
        return task.currentConnection();
    }

    public Future<ConnectionHandle> acquire(TaskContext task) {
        return acquire(task, AcquireOptions.defaults());
    }

    /**
     * Obtains a connection handle for {@code task}.
     *
     * <p>With {@code reuse} and a non-empty stack the result shares the innermost connection.
     * Otherwise a new handle is created and, when {@code reusable}, pushed on the stack. Unless
     * {@code lazy}, the physical connection is taken before the future completes; a failure then
     * removes the handle again and is reported to the caller.</p>
     */
    public Future<ConnectionHandle> acquire(TaskContext task, AcquireOptions options) {
        if (closed) {
            return Future.failedFuture(new InterfaceException("Engine is closed"));
        }
        AcquireOptions opts = options != null ? options : AcquireOptions.defaults();
        ConnectionHandle top = task.currentConnection();

        ConnectionHandle handle;
        if (opts.isReuse() && top != null) {
            handle = ConnectionHandle.reusing(this, task, top, opts.getTimeout());
            metrics.connectionAcquired(true);
        } else {
            handle = ConnectionHandle.root(this, task, opts.getTimeout(), opts.isReusable());
            if (opts.isReusable()) {
                task.getOrCreateStack().push(handle);
            }
            metrics.connectionAcquired(false);
        }
        logger.debug("Acquired {} for {} with {}", handle, task, opts);

        if (opts.isLazy()) {
            return Future.succeededFuture(handle);
        }
        return handle.getPhysicalConnection().transform(ar -> {
            if (ar.succeeded()) {
                return Future.succeededFuture(handle);
            }
            Throwable failure = ar.cause();
            return handle.release().transform(released -> {
                if (released.failed()) {
                    failure.addSuppressed(released.cause());
                }
                return Future.<ConnectionHandle>failedFuture(failure);
            });
        });
    }

    public <T> Future<T> withConnection(TaskContext task, Function<ConnectionHandle, Future<T>> body) {
        return withConnection(task, AcquireOptions.defaults(), body);
    }

    /**
     * Acquires a connection, runs {@code body} and releases the connection on every outcome.
     */
    public <T> Future<T> withConnection(TaskContext task, AcquireOptions options, Function<ConnectionHandle, Future<T>> body) {
        return acquire(task, options).compose(handle -> {
            Future<T> outcome;
            try {
                outcome = body.apply(handle);
            } catch (RuntimeException e) {
                outcome = Future.failedFuture(e);
            }
            if (outcome == null) {
                outcome = Future.failedFuture(new IllegalStateException("Connection body returned null instead of a Future"));
            }
            return outcome.transform(ar -> releaseAfter(handle, ar));
        });
    }

    private static <T> Future<T> releaseAfter(ConnectionHandle handle, AsyncResult<T> outcome) {
        return handle.release().transform(released -> {
            if (outcome.succeeded()) {
                return released.succeeded()
                    ? Future.succeededFuture(outcome.result())
                    : Future.<T>failedFuture(released.cause());
            }
            if (released.failed()) {
                outcome.cause().addSuppressed(released.cause());
            }
            return Future.<T>failedFuture(outcome.cause());
        });
    }

    public <R> Future<List<R>> all(TaskContext task, Query<R> query) {
        return withConnection(task, AcquireOptions.reuse(), conn -> conn.all(query));
    }

    public <R> Future<R> first(TaskContext task, Query<R> query) {
        return withConnection(task, AcquireOptions.reuse(), conn -> conn.first(query));
    }

    public <R> Future<R> one(TaskContext task, Query<R> query) {
        return withConnection(task, AcquireOptions.reuse(), conn -> conn.one(query));
    }

    public <R> Future<R> oneOrNone(TaskContext task, Query<R> query) {
        return withConnection(task, AcquireOptions.reuse(), conn -> conn.oneOrNone(query));
    }

    public Future<Object> scalar(TaskContext task, Query<?> query) {
        return withConnection(task, AcquireOptions.reuse(), conn -> conn.scalar(query));
    }

    public Future<QueryResult> status(TaskContext task, Query<?> query) {
        return withConnection(task, AcquireOptions.reuse(), conn -> conn.status(query));
    }

    /**
     * Runs {@code body} in a managed transaction on the task's current connection, or on a new
     * reusable one when the task holds none. Nested calls become savepoints.
     */
    public <T> Future<T> transaction(TaskContext task, TransactionOptions options, Function<TransactionManager, Future<T>> body) {
        return transaction(task, options, TRANSACTION_ACQUIRE, body);
    }

    public <T> Future<T> transaction(TaskContext task, Function<TransactionManager, Future<T>> body) {
        return transaction(task, TransactionOptions.defaults(), TRANSACTION_ACQUIRE, body);
    }

    public <T> Future<T> transaction(TaskContext task, TransactionOptions options, AcquireOptions acquireOptions,
                                     Function<TransactionManager, Future<T>> body) {
        return withConnection(task, acquireOptions, conn -> conn.transaction(options, body));
    }

    /**
     * Starts a manual transaction on a new reusable connection. The caller commits or rolls back
     * and then releases {@link TransactionManager#connection()}.
     */
    public Future<TransactionManager> begin(TaskContext task, TransactionOptions options) {
        return acquire(task, AcquireOptions.defaults()).compose(conn -> conn.begin(options).transform(ar -> {
            if (ar.succeeded()) {
                return Future.succeededFuture(ar.result());
            }
            Throwable failure = ar.cause();
            return conn.release().transform(released -> {
                if (released.failed()) {
                    failure.addSuppressed(released.cause());
                }
                return Future.<TransactionManager>failedFuture(failure);
            });
        }));
    }

    public boolean isClosed() {
        return closed;
    }

    public Future<Void> closeAsync() {
        if (closed) {
            return Future.succeededFuture();
        }
        closed = true;
        logger.info("Closing PgScope engine");
        return pool.close();
    }

    @Override
    public void close() {
        try {
            closeAsync().toCompletionStage().toCompletableFuture().get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while closing PgScope engine", e);
        } catch (Exception e) {
            logger.error("Error closing PgScope engine", e);
        }
    }

    @Override
    public String toString() {
        return "PgScopeEngine{dialect=" + dialect.name() + ", pool=" + pool.stats() + "}";
    }
}
