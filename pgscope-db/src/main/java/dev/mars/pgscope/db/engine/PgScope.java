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

import dev.mars.pgscope.api.error.UninitializedException;
import dev.mars.pgscope.api.query.Query;
import dev.mars.pgscope.api.query.QueryResult;
import dev.mars.pgscope.api.transaction.TransactionOptions;
import dev.mars.pgscope.db.connection.AcquireOptions;
import dev.mars.pgscope.db.connection.ConnectionHandle;
import dev.mars.pgscope.db.context.TaskContext;
import dev.mars.pgscope.db.transaction.TransactionManager;
import io.vertx.core.Future;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Application-wide holder of a bound engine.
 *
 * <p>Code can be written against a {@code PgScope} before an engine exists; the engine is bound at
 * start-up with {@link #setBind(PgScopeEngine)}. Every delegating call made while nothing is bound
 * fails with {@link UninitializedException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class PgScope {

    private final AtomicReference<PgScopeEngine> bind = new AtomicReference<>();

    public PgScope() {
    }

    public PgScope(PgScopeEngine engine) {
        bind.set(engine);
    }

    public PgScope setBind(PgScopeEngine engine) {
        bind.set(engine);
        return this;
    }

    /**
     * Unbinds and returns the engine, which is left open.
     */
    public PgScopeEngine popBind() {
        return bind.getAndSet(null);
    }

    public boolean isBound() {
        return bind.get() != null;
    }

    public PgScopeEngine engine() {
        PgScopeEngine engine = bind.get();
        if (engine == null) {
            throw new UninitializedException("PgScope engine is not initialized; call setBind() first");
        }
        return engine;
    }

    private <T> Future<T> withEngine(Function<PgScopeEngine, Future<T>> call) {
        PgScopeEngine engine;
        try {
            engine = engine();
        } catch (UninitializedException e) {
            return Future.failedFuture(e);
        }
        return call.apply(engine);
    }

    public Future<ConnectionHandle> acquire(TaskContext task, AcquireOptions options) {
        return withEngine(engine -> engine.acquire(task, options));
    }

    public <T> Future<T> withConnection(TaskContext task, AcquireOptions options, Function<ConnectionHandle, Future<T>> body) {
        return withEngine(engine -> engine.withConnection(task, options, body));
    }

    public <R> Future<List<R>> all(TaskContext task, Query<R> query) {
        return withEngine(engine -> engine.all(task, query));
    }

    public <R> Future<R> first(TaskContext task, Query<R> query) {
        return withEngine(engine -> engine.first(task, query));
    }

    public <R> Future<R> one(TaskContext task, Query<R> query) {
        return withEngine(engine -> engine.one(task, query));
    }

    public <R> Future<R> oneOrNone(TaskContext task, Query<R> query) {
        return withEngine(engine -> engine.oneOrNone(task, query));
    }

    public Future<Object> scalar(TaskContext task, Query<?> query) {
        return withEngine(engine -> engine.scalar(task, query));
    }

    public Future<QueryResult> status(TaskContext task, Query<?> query) {
        return withEngine(engine -> engine.status(task, query));
    }

    public <T> Future<T> transaction(TaskContext task, TransactionOptions options, Function<TransactionManager, Future<T>> body) {
        return withEngine(engine -> engine.transaction(task, options, body));
    }

    public Future<TransactionManager> begin(TaskContext task, TransactionOptions options) {
        return withEngine(engine -> engine.begin(task, options));
    }
}
