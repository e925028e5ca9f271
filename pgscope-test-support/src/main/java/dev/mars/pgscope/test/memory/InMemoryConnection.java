package dev.mars.pgscope.test.memory;

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

import dev.mars.pgscope.api.query.CompiledStatement;
import dev.mars.pgscope.api.query.QueryResult;
import dev.mars.pgscope.api.spi.DriverCursor;
import dev.mars.pgscope.api.spi.PhysicalConnection;
import dev.mars.pgscope.api.transaction.TransactionOptions;
import io.vertx.core.Future;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Map;

/**
 * Physical connection of an {@link InMemoryDatabase}.
 */
final class InMemoryConnection implements PhysicalConnection {

    private final InMemoryDatabase database;
    private final String id;
    private final Deque<Savepoint> savepoints = new ArrayDeque<>();
    private Map<String, InMemoryTable> working;
    private volatile boolean closed;

    InMemoryConnection(InMemoryDatabase database, String id) {
        this.database = database;
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Future<QueryResult> execute(CompiledStatement statement, Duration timeout) {
        try {
            checkOpen();
            database.record(id, statement.sql());
            if (working != null) {
                return Future.succeededFuture(InMemorySql.execute(working, statement.sql(), statement.params()));
            }
            return Future.succeededFuture(database.autocommit(statement.sql(), statement.params()));
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }

    @Override
    public Future<DriverCursor> openCursor(CompiledStatement statement) {
        try {
            checkOpen();
            if (working == null) {
                throw new InMemorySqlException("cursor can only be declared in a transaction block");
            }
            database.record(id, statement.sql());
            QueryResult result = InMemorySql.execute(working, statement.sql(), statement.params());
            return Future.succeededFuture(new InMemoryCursor(database, result.getRows()));
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }

    @Override
    public boolean isInTransaction() {
        return working != null;
    }

    @Override
    public Future<Void> begin(TransactionOptions options) {
        return command(beginText(options), () -> {
            if (working != null) {
                throw new InMemorySqlException("there is already a transaction in progress");
            }
            working = database.snapshot();
        });
    }

    @Override
    public Future<Void> commit() {
        return command("COMMIT", () -> {
            if (working == null) {
                return;
            }
            Map<String, InMemoryTable> committed = working;
            working = null;
            savepoints.clear();
            RuntimeException failure = database.takeCommitFailure();
            if (failure != null) {
                throw failure;
            }
            database.install(committed);
        });
    }

    @Override
    public Future<Void> rollback() {
        return command("ROLLBACK", () -> {
            working = null;
            savepoints.clear();
        });
    }

    @Override
    public Future<Void> savepoint(String name) {
        return command("SAVEPOINT " + name, () -> {
            requireTransaction("SAVEPOINT");
            savepoints.push(new Savepoint(name, InMemoryTable.copyAll(working)));
        });
    }

    @Override
    public Future<Void> rollbackToSavepoint(String name) {
        return command("ROLLBACK TO SAVEPOINT " + name, () -> {
            requireTransaction("ROLLBACK TO SAVEPOINT");
            Savepoint target = unwindTo(name);
            working = InMemoryTable.copyAll(target.state);
        });
    }

    @Override
    public Future<Void> releaseSavepoint(String name) {
        return command("RELEASE SAVEPOINT " + name, () -> {
            requireTransaction("RELEASE SAVEPOINT");
            unwindTo(name);
            savepoints.pop();
        });
    }

    @Override
    public Future<Void> close() {
        if (!closed) {
            closed = true;
            working = null;
            savepoints.clear();
            database.connectionClosed();
        }
        return Future.succeededFuture();
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    /**
     * Pops savepoints above {@code name}, leaving it on top.
     */
    private Savepoint unwindTo(String name) {
        boolean found = false;
        for (Iterator<Savepoint> it = savepoints.iterator(); it.hasNext(); ) {
            if (it.next().name.equals(name)) {
                found = true;
                break;
            }
        }
        if (!found) {
            throw new InMemorySqlException("savepoint \"" + name + "\" does not exist");
        }
        while (!savepoints.peek().name.equals(name)) {
            savepoints.pop();
        }
        return savepoints.peek();
    }

    private Future<Void> command(String text, Runnable action) {
        try {
            checkOpen();
            database.record(id, text);
            action.run();
            return Future.succeededFuture();
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }

    private void requireTransaction(String command) {
        if (working == null) {
            throw new InMemorySqlException(command + " can only be used in transaction blocks");
        }
    }

    private void checkOpen() {
        if (closed) {
            throw new InMemorySqlException("connection " + id + " is closed");
        }
    }

    private static String beginText(TransactionOptions options) {
        StringBuilder text = new StringBuilder("BEGIN");
        if (options != null) {
            if (options.getIsolation() != null) {
                text.append(" ISOLATION LEVEL ").append(options.getIsolation().sql());
            }
            if (options.getReadOnly() != null) {
                text.append(options.getReadOnly() ? " READ ONLY" : " READ WRITE");
            }
            if (options.getDeferrable() != null) {
                text.append(options.getDeferrable() ? " DEFERRABLE" : " NOT DEFERRABLE");
            }
        }
        return text.toString();
    }

    private static final class Savepoint {
        final String name;
        final Map<String, InMemoryTable> state;

        Savepoint(String name, Map<String, InMemoryTable> state) {
            this.name = name;
            this.state = state;
        }
    }
}
