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

import io.vertx.core.Future;

import java.time.Duration;

/**
 * Source of physical connections.
 *
 * <p>Every connection obtained from {@link #acquire(Duration)} must be handed back exactly once
 * through {@link #release(PhysicalConnection)}. A connection that was closed while checked out is
 * still released so the pool can forget it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public interface ConnectionPool {

    /**
     * Borrows a connection, waiting while the pool is exhausted.
     *
     * @param timeout maximum wait, or {@code null} to wait indefinitely
     * @return the connection, or a failed future with
     *         {@link dev.mars.pgscope.api.error.OperationTimeoutException} when the wait expires
     */
    Future<PhysicalConnection> acquire(Duration timeout);

    /**
     * Returns a borrowed connection.
     */
    Future<Void> release(PhysicalConnection connection);

    PoolStats stats();

    Future<Void> close();
}
