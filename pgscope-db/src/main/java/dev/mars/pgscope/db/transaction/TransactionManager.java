package dev.mars.pgscope.db.transaction;

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
import dev.mars.pgscope.api.spi.PhysicalConnection;
import dev.mars.pgscope.api.transaction.TransactionOptions;
import dev.mars.pgscope.db.connection.ConnectionHandle;
import dev.mars.pgscope.db.result.RowCursor;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * One transaction on a connection handle.
 *
 * <p>When the physical connection is not yet in a transaction, starting issues {@code BEGIN};
 * otherwise the transaction is nested and becomes a savepoint. Commit of a savepoint releases it,
 * rollback returns to it.</p>
 *
 * <p>A transaction is used in exactly one of two modes, fixed when it starts:</p>
 * <ul>
 *   <li><b>managed</b>, through {@link #run(Function)}: the body's outcome decides. Success commits.
 *       Failure rolls back, except for a commit {@link TransactionBreak} aimed at this transaction.
 *       A break aimed at this transaction is absorbed and the result is {@code null}; any other
 *       failure propagates. Inside the body, {@link #commit()} and {@link #rollback()} behave like
 *       {@link #raiseCommit()} and {@link #raiseRollback()}.</li>
 *   <li><b>manual</b>, through {@link #begin()}: the caller ends the transaction with
 *       {@link #commit()} or {@link #rollback()}. Break signals are rejected.</li>
 * </ul>
 *
 * <pre>{@code
 * engine.transaction(task, TransactionOptions.defaults(), outer ->
 *     engine.transaction(task, TransactionOptions.defaults(), inner ->
 *         inner.connection().status(insert)
 *             .compose(r -> outer.raiseCommit())));   // inner rolls back, outer commits
 * }</pre>
 *
 * <p>A commit that fails is not followed by an automatic rollback. The commit error propagates, and
 * the connection rolls back whatever is left open when it goes back to the pool.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class TransactionManager {
    private static final Logger logger = LoggerFactory.getLogger(TransactionManager.class);

    private static final AtomicLong SAVEPOINT_IDS = new AtomicLong();

    private final ConnectionHandle connection;
    private final TransactionOptions options;
    private final List<RowCursor<?>> cursors = new ArrayList<>();

    private Boolean managed;
    private volatile TransactionState state = TransactionState.UNINITIALIZED;
    private PhysicalConnection physical;
    private String savepoint;

    public TransactionManager(ConnectionHandle connection, TransactionOptions options) {
        this.connection = connection;
        this.options = options != null ? options : TransactionOptions.defaults();
    }

    public ConnectionHandle connection() {
        return connection;
    }

    public TransactionState getState() {
        return state;
    }

    /**
     * Whether this is a managed transaction; {@code null} until started.
     */
    public Boolean isManaged() {
        return managed;
    }

    public boolean isNested() {
        return savepoint != null;
    }

    /**
     * The savepoint name of a nested transaction, or {@code null}.
     */
    public String savepointName() {
        return savepoint;
    }

    /**
     * Starts the transaction in manual mode.
     */
    public Future<TransactionManager> begin() {
        return start(false);
    }

    /**
     * Starts the transaction in managed mode, runs {@code body} and ends the transaction from the
     * body's outcome.
     */
    public <T> Future<T> run(Function<TransactionManager, Future<T>> body) {
        return start(true).compose(tx -> {
            Future<T> outcome;
            try {
                outcome = body.apply(this);
            } catch (RuntimeException e) {
                outcome = Future.failedFuture(e);
            }
            if (outcome == null) {
                outcome = Future.failedFuture(new IllegalStateException("Transaction body returned null instead of a Future"));
            }
            return outcome.transform(ar -> finish(ar.succeeded() ? null : ar.cause(), ar.succeeded() ? ar.result() : null));
        });
    }

    private <T> Future<T> finish(Throwable failure, T result) {
        boolean ownBreak = failure instanceof TransactionBreak && ((TransactionBreak) failure).target() == this;
        boolean commit = failure == null || (ownBreak && ((TransactionBreak) failure).isCommit());
        if (failure != null && !ownBreak) {
            logger.debug("Transaction {} body failed, rolling back: {}", this, failure.toString());
        }
        Future<Void> end = commit ? end(true) : end(false);
        return end.transform(endResult -> {
            if (endResult.failed()) {
                Throwable endFailure = endResult.cause();
                if (!commit && failure != null && !ownBreak) {
                    failure.addSuppressed(endFailure);
                    return Future.failedFuture(failure);
                }
                if (failure != null && failure != endFailure) {
                    endFailure.addSuppressed(failure);
                }
                return Future.failedFuture(endFailure);
            }
            if (failure == null) {
                return Future.succeededFuture(result);
            }
            if (ownBreak) {
                return Future.succeededFuture(null);
            }
            return Future.failedFuture(failure);
        });
    }

    private Future<TransactionManager> start(boolean managedMode) {
        synchronized (this) {
            if (managed != null) {
                return Future.failedFuture(new InterfaceException("Transaction " + this + " has already been started"));
            }
            managed = managedMode;
        }
        return connection.getPhysicalConnection().compose(conn -> {
            physical = conn;
            if (conn.isInTransaction()) {
                if (!options.isDefault()) {
                    return Future.failedFuture(new InterfaceException(
                        "Nested transaction cannot set isolation, read-only or deferrable: " + options));
                }
                savepoint = connection.engine().config().getSavepointPrefix() + SAVEPOINT_IDS.incrementAndGet();
                return conn.savepoint(savepoint);
            }
            return conn.begin(options);
        }).map(v -> {
            state = TransactionState.STARTED;
            connection.pushTransaction(this);
            logger.debug("Started {} transaction {} on {}", managed ? "managed" : "manual", this, connection);
            return this;
        }).onFailure(err -> {
            if (state == TransactionState.UNINITIALIZED) {
                state = TransactionState.FAILED;
            }
        });
    }

    /**
     * Commits. In managed mode this is {@link #raiseCommit()}.
     */
    public Future<Void> commit() {
        if (managed == null) {
            return Future.failedFuture(new InterfaceException("Transaction " + this + " has not been started"));
        }
        if (managed) {
            return raiseCommit();
        }
        return end(true);
    }

    /**
     * Rolls back. In managed mode this is {@link #raiseRollback()}.
     */
    public Future<Void> rollback() {
        if (managed == null) {
            return Future.failedFuture(new InterfaceException("Transaction " + this + " has not been started"));
        }
        if (managed) {
            return raiseRollback();
        }
        return end(false);
    }

    /**
     * A failed future carrying a commit break aimed at this transaction. Returning it from a
     * managed body, directly or from any enclosed transaction, commits this transaction.
     */
    public <T> Future<T> raiseCommit() {
        return raise(true);
    }

    /**
     * A failed future carrying a rollback break aimed at this transaction.
     */
    public <T> Future<T> raiseRollback() {
        return raise(false);
    }

    private <T> Future<T> raise(boolean commit) {
        if (managed == null || !managed) {
            return Future.failedFuture(new InterfaceException(
                (commit ? "raiseCommit()" : "raiseRollback()") + " is only valid in a managed transaction"));
        }
        if (state != TransactionState.STARTED) {
            return Future.failedFuture(new InterfaceException("Transaction " + this + " is not active: " + state));
        }
        return Future.failedFuture(new TransactionBreak(this, commit));
    }

    private Future<Void> end(boolean commit) {
        if (state != TransactionState.STARTED) {
            return Future.failedFuture(new InterfaceException("Transaction " + this + " is not active: " + state));
        }
        try {
            connection.popTransaction(this);
        } catch (InterfaceException e) {
            return Future.failedFuture(e);
        }
        boolean nested = savepoint != null;
        Future<Void> statement;
        if (commit) {
            statement = closeCursors().compose(v -> nested ? physical.releaseSavepoint(savepoint) : physical.commit());
        } else {
            statement = closeCursors().compose(v -> nested
                ? physical.rollbackToSavepoint(savepoint).compose(x -> physical.releaseSavepoint(savepoint))
                : physical.rollback());
        }
        return statement.transform(ar -> {
            String outcome;
            if (ar.succeeded()) {
                state = commit ? TransactionState.COMMITTED : TransactionState.ROLLED_BACK;
                outcome = commit ? "commit" : "rollback";
                logger.debug("Transaction {} {}", this, commit ? "committed" : "rolled back");
            } else {
                state = TransactionState.FAILED;
                outcome = "failed";
                logger.warn("Transaction {} failed to {}: {}", this, commit ? "commit" : "roll back", ar.cause().getMessage());
            }
            connection.engine().metrics().transactionCompleted(nested, outcome);
            return ar.succeeded() ? Future.<Void>succeededFuture() : Future.<Void>failedFuture(ar.cause());
        });
    }

    /**
     * Attaches a cursor so that it is closed when this transaction ends.
     */
    public synchronized void registerCursor(RowCursor<?> cursor) {
        cursors.add(cursor);
    }

    private Future<Void> closeCursors() {
        List<RowCursor<?>> open;
        synchronized (this) {
            open = new ArrayList<>(cursors);
            cursors.clear();
        }
        Future<Void> chain = Future.succeededFuture();
        for (RowCursor<?> cursor : open) {
            chain = chain.compose(v -> cursor.close().recover(err -> {
                logger.warn("Failed to close cursor at end of transaction {}: {}", this, err.getMessage());
                return Future.succeededFuture();
            }));
        }
        return chain;
    }

    /**
     * Marks the transaction as rolled back because its connection went back to the pool while it was
     * still open.
     */
    public void abandon() {
        if (state == TransactionState.STARTED) {
            logger.warn("Transaction {} was still open when its connection was returned; it is rolled back", this);
            state = TransactionState.ROLLED_BACK;
            List<RowCursor<?>> open;
            synchronized (this) {
                open = new ArrayList<>(cursors);
                cursors.clear();
            }
            for (RowCursor<?> cursor : open) {
                cursor.close().onFailure(err ->
                    logger.warn("Failed to close cursor of abandoned transaction {}: {}", this, err.getMessage()));
            }
        }
    }

    @Override
    public String toString() {
        return "tx@" + Integer.toHexString(System.identityHashCode(this)) + (savepoint != null ? "[" + savepoint + "]" : "");
    }
}
