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

import dev.mars.pgscope.api.error.InterfaceException;
import dev.mars.pgscope.api.error.MultipleResultsException;
import dev.mars.pgscope.api.error.NoResultException;
import dev.mars.pgscope.api.error.OperationTimeoutException;
import dev.mars.pgscope.api.query.CompiledStatement;
import dev.mars.pgscope.api.query.ExecutionOptions;
import dev.mars.pgscope.api.query.Query;
import dev.mars.pgscope.api.query.QueryResult;
import dev.mars.pgscope.api.query.Row;
import dev.mars.pgscope.api.spi.PhysicalConnection;
import dev.mars.pgscope.api.transaction.TransactionOptions;
import dev.mars.pgscope.db.context.TaskContext;
import dev.mars.pgscope.db.engine.PgScopeEngine;
import dev.mars.pgscope.db.result.ResultMapper;
import dev.mars.pgscope.db.result.RowCursor;
import dev.mars.pgscope.db.transaction.TransactionManager;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * A borrowed database connection.
 *
 * <p>A <em>root</em> handle owns at most one physical connection from the pool. It may be lazy and
 * take the physical connection only when a statement first needs it. A <em>reusing</em> handle
 * shares its root's physical connection and never returns it to the pool.</p>
 *
 * <p>{@link #release()} ends the handle: it leaves the task's stack and a root hands its physical
 * connection back. {@link #release(boolean) release(false)} only hands the physical connection back;
 * the handle stays usable and takes a new one on its next statement.</p>
 *
 * <p>The root also tracks the transactions open on its physical connection, innermost last. Ending
 * a transaction that is not the innermost is rejected.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class ConnectionHandle {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionHandle.class);

    private static final AtomicLong IDS = new AtomicLong();

    private final long id;
    private final PgScopeEngine engine;
    private final TaskContext context;
    private final ConnectionHandle root;
    private final Duration timeout;
    private final boolean reusable;

    // root-only state
    private PhysicalConnection physical;
    private Future<PhysicalConnection> pending;
    private long generation;
    private final Deque<TransactionManager> transactions = new ArrayDeque<>();

    private volatile boolean closed;

    private ConnectionHandle(PgScopeEngine engine, TaskContext context, ConnectionHandle root,
                             Duration timeout, boolean reusable) {
        this.id = IDS.incrementAndGet();
        this.engine = engine;
        this.context = context;
        this.root = root != null ? root : this;
        this.timeout = timeout;
        this.reusable = reusable;
    }

    /**
     * Creates a handle that will own its own physical connection.
     */
    public static ConnectionHandle root(PgScopeEngine engine, TaskContext context, Duration timeout, boolean reusable) {
        return new ConnectionHandle(engine, context, null, timeout, reusable);
    }

    /**
     * Creates a handle sharing {@code root}'s physical connection.
     */
    public static ConnectionHandle reusing(PgScopeEngine engine, TaskContext context, ConnectionHandle root, Duration timeout) {
        return new ConnectionHandle(engine, context, root.root, timeout, false);
    }

    public ConnectionHandle root() {
        return root;
    }

    public boolean isRoot() {
        return root == this;
    }

    public boolean isReusable() {
        return reusable;
    }

    public boolean isClosed() {
        return closed;
    }

    public TaskContext context() {
        return context;
    }

    public PgScopeEngine engine() {
        return engine;
    }

    /**
     * True when the root currently holds a physical connection.
     */
    public boolean isMaterialized() {
        synchronized (root) {
            return root.physical != null;
        }
    }

    /**
     * The physical connection, taking one from the pool first when the root has none.
     * Concurrent callers on the same root share one pool acquisition.
     */
    public Future<PhysicalConnection> getPhysicalConnection() {
        return materialize(timeout);
    }

    private Future<PhysicalConnection> materialize(Duration acquireTimeout) {
        if (closed) {
            return Future.failedFuture(new InterfaceException("Connection " + this + " has been released"));
        }
        if (root != this) {
            if (root.closed) {
                return Future.failedFuture(new InterfaceException("Connection " + this + " reuses " + root + " which has been released"));
            }
            return root.materialize(Deadline.min(timeout, acquireTimeout));
        }
        Future<PhysicalConnection> inFlight;
        Future<PhysicalConnection> acquiring = null;
        synchronized (this) {
            if (physical != null) {
                return Future.succeededFuture(physical);
            }
            inFlight = pending;
            if (inFlight == null) {
                long acquiredFor = generation;
                acquiring = engine.pool().acquire(acquireTimeout).compose(conn -> adopt(conn, acquiredFor));
                pending = acquiring;
            }
        }
        if (inFlight != null) {
            return joinAcquisition(inFlight, acquireTimeout);
        }
        Future<PhysicalConnection> started = acquiring;
        started.onComplete(ar -> {
            synchronized (this) {
                if (pending == started) {
                    pending = null;
                }
            }
            if (ar.failed() && ar.cause() instanceof OperationTimeoutException) {
                engine.metrics().acquireTimedOut();
            }
        });
        return started;
    }

    /**
     * Keeps a freshly acquired connection unless the handle was released while it was on its way,
     * in which case it goes straight back to the pool.
     */
    private Future<PhysicalConnection> adopt(PhysicalConnection conn, long acquiredFor) {
        boolean kept;
        synchronized (this) {
            kept = !closed && generation == acquiredFor;
            if (kept) {
                physical = conn;
            }
        }
        if (!kept) {
            logger.debug("Connection {} was released while acquiring, returning {}", this, conn.id());
            return engine.pool().release(conn).transform(ar -> Future.failedFuture(
                new InterfaceException("Connection " + this + " was released while acquiring")));
        }
        logger.debug("Connection {} took physical connection {}", this, conn.id());
        return Future.succeededFuture(conn);
    }

    /**
     * Waits on an acquisition started by another statement, bounded by this caller's own budget.
     */
    private Future<PhysicalConnection> joinAcquisition(Future<PhysicalConnection> inFlight, Duration budget) {
        if (budget == null) {
            return inFlight;
        }
        return inFlight.timeout(Math.max(1L, budget.toMillis()), TimeUnit.MILLISECONDS)
            .recover(err -> {
                if (err instanceof TimeoutException) {
                    engine.metrics().acquireTimedOut();
                    return Future.failedFuture(new OperationTimeoutException(
                        "Timed out after " + budget.toMillis() + "ms waiting for connection " + this, budget));
                }
                return Future.failedFuture(err);
            });
    }

    /**
     * Permanently releases this handle.
     */
    public Future<Void> release() {
        return release(true);
    }

    /**
     * Releases this handle.
     *
     * @param permanent {@code true} ends the handle and removes it from the task's stack;
     *                  {@code false} returns a root's physical connection to the pool but keeps the
     *                  handle usable
     * @return completes once any physical connection is back in the pool
     */
    public Future<Void> release(boolean permanent) {
        if (closed) {
            return Future.failedFuture(new InterfaceException("Connection " + this + " has already been released"));
        }
        if (permanent) {
            if (root == this && reusable) {
                try {
                    context.removeConnection(this, engine.config().isStrictReleaseOrder());
                } catch (InterfaceException e) {
                    return Future.failedFuture(e);
                }
            }
            closed = true;
            engine.metrics().connectionReleased(true);
            logger.debug("Released connection {}", this);
            if (root != this) {
                return Future.succeededFuture();
            }
            return returnPhysicalConnection();
        }

        if (root != this) {
            engine.metrics().connectionReleased(false);
            return Future.succeededFuture();
        }
        synchronized (this) {
            if (!transactions.isEmpty() || (physical != null && physical.isInTransaction())) {
                return Future.failedFuture(new InterfaceException(
                    "Cannot soft-release connection " + this + " while a transaction is active"));
            }
        }
        engine.metrics().connectionReleased(false);
        logger.debug("Soft-released connection {}", this);
        return returnPhysicalConnection();
    }

    /**
     * Detaches the physical connection and any acquisition in flight, then returns the connection to
     * the pool after rolling back anything left open on it. Completes once an acquisition that was
     * in flight has settled too.
     */
    private Future<Void> returnPhysicalConnection() {
        Future<PhysicalConnection> inFlight;
        PhysicalConnection conn;
        List<TransactionManager> abandoned;
        synchronized (this) {
            generation++;
            inFlight = pending;
            pending = null;
            conn = physical;
            physical = null;
            abandoned = new ArrayList<>(transactions);
            transactions.clear();
        }
        for (TransactionManager tx : abandoned) {
            tx.abandon();
        }
        Future<Void> settled = inFlight == null ? Future.succeededFuture() : inFlight.transform(ar -> Future.succeededFuture());
        if (conn == null) {
            return settled;
        }
        return resetPhysicalConnection(conn)
            .transform(ignored -> engine.pool().release(conn))
            .compose(v -> settled);
    }

    private Future<Void> resetPhysicalConnection(PhysicalConnection conn) {
        if (conn.isClosed() || !conn.isInTransaction()) {
            return Future.succeededFuture();
        }
        logger.warn("Connection {} returned with an open transaction on {}, rolling back", this, conn.id());
        return conn.rollback().recover(err -> {
            logger.warn("Rollback of leftover transaction on {} failed, closing it: {}", conn.id(), err.getMessage());
            return conn.close();
        });
    }

    // Transaction bookkeeping, kept on the root

    public void pushTransaction(TransactionManager tx) {
        synchronized (root) {
            root.transactions.addLast(tx);
        }
    }

    public void popTransaction(TransactionManager tx) {
        synchronized (root) {
            TransactionManager innermost = root.transactions.peekLast();
            if (innermost != tx) {
                throw new InterfaceException("Transaction " + tx + " is not the innermost transaction on " + root);
            }
            root.transactions.removeLast();
        }
    }

    /**
     * The innermost active transaction on this handle's physical connection, or {@code null}.
     */
    public TransactionManager currentTransaction() {
        synchronized (root) {
            return root.transactions.peekLast();
        }
    }

    // Statements

    /**
     * Executes a statement and returns its raw buffered result.
     */
    public Future<QueryResult> execute(Query<?> query) {
        ExecutionOptions options = query.options().merge(engine.defaultExecutionOptions());
        CompiledStatement statement;
        try {
            statement = engine.dialect().compile(query);
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
        Deadline deadline = Deadline.after(options.getTimeout());
        return materialize(Deadline.min(timeout, deadline.remaining())).compose(conn -> {
            if (deadline.isExpired()) {
                return Future.failedFuture(new OperationTimeoutException(
                    "Statement timed out before it could be sent", deadline.budget()));
            }
            long start = System.nanoTime();
            return conn.execute(statement, deadline.remaining())
                .onComplete(ar -> engine.metrics().recordQuery(System.nanoTime() - start));
        });
    }

    public <R> Future<List<R>> all(Query<R> query) {
        return execute(query).map(result -> ResultMapper.mapAll(result.getRows(), query.options()));
    }

    /**
     * The first row, or {@code null} when there is none.
     */
    public <R> Future<R> first(Query<R> query) {
        return execute(query).map(result -> result.getRows().isEmpty()
            ? null
            : ResultMapper.<R>map(result.getRows().get(0), query.options()));
    }

    /**
     * Exactly one row.
     */
    public <R> Future<R> one(Query<R> query) {
        return execute(query).compose(result -> {
            List<Row> rows = result.getRows();
            if (rows.isEmpty()) {
                return Future.failedFuture(new NoResultException("No row was found for one(): " + query.sql()));
            }
            if (rows.size() > 1) {
                return Future.failedFuture(new MultipleResultsException(
                    "Multiple rows were found for one(): " + query.sql(), rows.size()));
            }
            return Future.succeededFuture(ResultMapper.<R>map(rows.get(0), query.options()));
        });
    }

    /**
     * At most one row; {@code null} when there is none.
     */
    public <R> Future<R> oneOrNone(Query<R> query) {
        return execute(query).compose(result -> {
            List<Row> rows = result.getRows();
            if (rows.size() > 1) {
                return Future.failedFuture(new MultipleResultsException(
                    "Multiple rows were found for oneOrNone(): " + query.sql(), rows.size()));
            }
            return Future.succeededFuture(rows.isEmpty() ? null : ResultMapper.<R>map(rows.get(0), query.options()));
        });
    }

    /**
     * First column of the first row, or {@code null} when there is no row.
     */
    public Future<Object> scalar(Query<?> query) {
        return execute(query).map(result -> result.getRows().isEmpty() ? null : result.getRows().get(0).get(0));
    }

    /**
     * The command status and affected row count.
     */
    public Future<QueryResult> status(Query<?> query) {
        return execute(query);
    }

    /**
     * Opens a cursor. The connection must be inside a transaction; the cursor is closed when that
     * transaction ends.
     */
    public <R> Future<RowCursor<R>> iterate(Query<R> query) {
        TransactionManager tx = currentTransaction();
        if (tx == null) {
            return Future.failedFuture(new InterfaceException("iterate() must be called inside a transaction"));
        }
        CompiledStatement statement;
        try {
            statement = engine.dialect().compile(query);
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
        ExecutionOptions options = query.options().merge(engine.defaultExecutionOptions());
        return getPhysicalConnection()
            .compose(conn -> conn.openCursor(statement))
            .map(driverCursor -> {
                RowCursor<R> cursor = new RowCursor<>(driverCursor, options, engine.config().getCursorPrefetch());
                tx.registerCursor(cursor);
                return cursor;
            });
    }

    // Transactions

    /**
     * Creates a transaction on this connection without starting it.
     */
    public TransactionManager newTransaction(TransactionOptions options) {
        return new TransactionManager(this, options);
    }

    /**
     * Runs {@code body} in a managed transaction: committed when it succeeds, rolled back when it
     * fails.
     */
    public <T> Future<T> transaction(TransactionOptions options, Function<TransactionManager, Future<T>> body) {
        return newTransaction(options).run(body);
    }

    public <T> Future<T> transaction(Function<TransactionManager, Future<T>> body) {
        return transaction(TransactionOptions.defaults(), body);
    }

    /**
     * Starts a manual transaction; the caller must commit or roll it back.
     */
    public Future<TransactionManager> begin(TransactionOptions options) {
        return newTransaction(options).begin();
    }

    public Future<TransactionManager> begin() {
        return begin(TransactionOptions.defaults());
    }

    @Override
    public String toString() {
        return root == this ? "conn-" + id : "conn-" + id + "(reusing conn-" + root.id + ")";
    }
}
