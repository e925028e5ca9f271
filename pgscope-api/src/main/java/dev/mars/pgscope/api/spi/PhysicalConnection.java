package dev.mars.pgscope.api.spi;

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
import dev.mars.pgscope.api.transaction.TransactionOptions;
import io.vertx.core.Future;

import java.time.Duration;

/**
 * A driver-level connection to the database.
 *
 * <p>Implementations track whether a transaction is open on the server side so that the
 * transaction manager can choose between {@code BEGIN} and {@code SAVEPOINT}. A physical
 * connection is owned by one root connection handle at a time and is not safe for concurrent
 * statements.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public interface PhysicalConnection {

    /**
     * Stable identifier used in log messages.
     */
    String id();

    /**
     * Executes one statement and buffers its rows.
     *
     * @param statement the compiled statement
     * @param timeout   maximum execution time, or {@code null} for none
     * @return the buffered result, or a failed future with
     *         {@link dev.mars.pgscope.api.error.OperationTimeoutException} when the timeout expires
     */
    Future<QueryResult> execute(CompiledStatement statement, Duration timeout);

    /**
     * Opens a server-side cursor. Only valid inside a transaction.
     */
    Future<DriverCursor> openCursor(CompiledStatement statement);

    boolean isInTransaction();

    Future<Void> begin(TransactionOptions options);

    Future<Void> commit();

    Future<Void> rollback();

    Future<Void> savepoint(String name);

    Future<Void> rollbackToSavepoint(String name);

    Future<Void> releaseSavepoint(String name);

    Future<Void> close();

    boolean isClosed();
}
