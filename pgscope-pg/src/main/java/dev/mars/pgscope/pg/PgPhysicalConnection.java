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

import dev.mars.pgscope.api.error.OperationTimeoutException;
import dev.mars.pgscope.api.query.CompiledStatement;
import dev.mars.pgscope.api.query.QueryResult;
import dev.mars.pgscope.api.spi.DriverCursor;
import dev.mars.pgscope.api.spi.PhysicalConnection;
import dev.mars.pgscope.api.transaction.TransactionOptions;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgConnection;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * {@link PhysicalConnection} over a Vert.x {@link PgConnection}.
 *
 * <p>Transaction control is sent as plain SQL ({@code BEGIN}, {@code SAVEPOINT}, ...) rather than
 * through the client's transaction object, so a failing statement never ends the transaction on
 * its own and the transaction manager stays in charge. Whether a transaction is open is tracked
 * from the commands sent on this connection.</p>
 *
 * <p>A statement timeout fails the statement locally and asks the server to cancel it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class PgPhysicalConnection implements PhysicalConnection {
    private static final Logger logger = LoggerFactory.getLogger(PgPhysicalConnection.class);

    private final Vertx vertx;
    private final PgConnection connection;
    private final String id;
    private volatile boolean inTransaction;
    private volatile boolean closed;

    public PgPhysicalConnection(Vertx vertx, PgConnection connection, String id) {
        this.vertx = vertx;
        this.connection = connection;
        this.id = id;
        connection.closeHandler(v -> {
            closed = true;
            logger.debug("Physical connection {} closed", id);
        });
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Future<QueryResult> execute(CompiledStatement statement, Duration timeout) {
        if (closed) {
            return Future.failedFuture(new IllegalStateException("Connection " + id + " is closed"));
        }
        String sql = statement.sql();
        Future<RowSet<io.vertx.sqlclient.Row>> running = statement.params().isEmpty()
            ? connection.query(sql).execute()
            : connection.preparedQuery(sql).execute(toTuple(statement.params()));
        Future<RowSet<io.vertx.sqlclient.Row>> bounded = timeout == null ? running : withTimeout(running, timeout, sql);
        return bounded.map(rowSet -> {
            trackTransactionCommand(sql);
            return new QueryResult(PgRows.toRows(rowSet), rowSet.rowCount(), commandStatus(sql, rowSet.rowCount()));
        });
    }

    private <T> Future<T> withTimeout(Future<T> running, Duration timeout, String sql) {
        Promise<T> promise = Promise.promise();
        long timerId = vertx.setTimer(Math.max(1L, timeout.toMillis()), id -> {
            if (promise.tryFail(new OperationTimeoutException(
                    "Statement exceeded " + timeout.toMillis() + "ms: " + sql, timeout))) {
                logger.debug("Cancelling statement on {} after {}", this.id, timeout);
                connection.cancelRequest().onFailure(err ->
                    logger.warn("Cancel request for {} failed: {}", this.id, err.getMessage()));
            }
        });
        running.onComplete(ar -> {
            vertx.cancelTimer(timerId);
            if (ar.succeeded()) {
                promise.tryComplete(ar.result());
            } else {
                promise.tryFail(ar.cause());
            }
        });
        return promise.future();
    }

    @Override
    public Future<DriverCursor> openCursor(CompiledStatement statement) {
        return connection.prepare(statement.sql())
            .map(prepared -> new PgDriverCursor(prepared, prepared.cursor(toTuple(statement.params()))));
    }

    @Override
    public boolean isInTransaction() {
        return inTransaction;
    }

    @Override
    public Future<Void> begin(TransactionOptions options) {
        return command(PostgresDialect.beginStatement(options)).onSuccess(v -> inTransaction = true);
    }

    @Override
    public Future<Void> commit() {
        return command("COMMIT").onComplete(ar -> inTransaction = false);
    }

    @Override
    public Future<Void> rollback() {
        return command("ROLLBACK").onComplete(ar -> inTransaction = false);
    }

    @Override
    public Future<Void> savepoint(String name) {
        return command("SAVEPOINT " + name);
    }

    @Override
    public Future<Void> rollbackToSavepoint(String name) {
        return command("ROLLBACK TO SAVEPOINT " + name);
    }

    @Override
    public Future<Void> releaseSavepoint(String name) {
        return command("RELEASE SAVEPOINT " + name);
    }

    @Override
    public Future<Void> close() {
        if (closed) {
            return Future.succeededFuture();
        }
        closed = true;
        inTransaction = false;
        return connection.close();
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    private Future<Void> command(String sql) {
        if (closed) {
            return Future.failedFuture(new IllegalStateException("Connection " + id + " is closed"));
        }
        logger.debug("{}: {}", id, sql);
        return connection.query(sql).execute().mapEmpty();
    }

    /**
     * Keeps the transaction flag right when transaction control arrives as a plain statement.
     */
    private void trackTransactionCommand(String sql) {
        String verb = verb(sql);
        switch (verb) {
            case "BEGIN":
            case "START":
                inTransaction = true;
                break;
            case "COMMIT":
            case "END":
            case "ABORT":
                inTransaction = false;
                break;
            case "ROLLBACK":
                if (!sql.trim().toUpperCase(Locale.ROOT).matches("ROLLBACK\\s+TO\\b.*")) {
                    inTransaction = false;
                }
                break;
            default:
                break;
        }
    }

    static String commandStatus(String sql, int rowCount) {
        String verb = verb(sql);
        switch (verb) {
            case "INSERT":
                return "INSERT 0 " + rowCount;
            case "SELECT":
            case "UPDATE":
            case "DELETE":
            case "MERGE":
            case "FETCH":
            case "MOVE":
            case "COPY":
                return verb + " " + rowCount;
            case "WITH":
                return "SELECT " + rowCount;
            default:
                return verb;
        }
    }

    private static String verb(String sql) {
        String trimmed = sql.trim();
        int end = 0;
        while (end < trimmed.length() && Character.isLetter(trimmed.charAt(end))) {
            end++;
        }
        return trimmed.substring(0, end).toUpperCase(Locale.ROOT);
    }

    private static Tuple toTuple(List<Object> params) {
        Tuple tuple = Tuple.tuple();
        for (Object param : params) {
            tuple.addValue(param);
        }
        return tuple;
    }

    @Override
    public String toString() {
        return "PgPhysicalConnection{" + id + "}";
    }
}
