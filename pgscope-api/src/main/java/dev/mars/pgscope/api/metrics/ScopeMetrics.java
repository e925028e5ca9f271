package dev.mars.pgscope.api.metrics;

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

/**
 * Metrics interface for connection and transaction lifecycle events.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public interface ScopeMetrics {

    /**
     * Count a handle acquisition.
     *
     * Metric name: pgscope.connections.acquired
     * Tags: reused ("true" when the handle shares the stack's top connection)
     */
    void connectionAcquired(boolean reused);

    /**
     * Count a handle release.
     *
     * Metric name: pgscope.connections.released
     * Tags: permanent
     */
    void connectionReleased(boolean permanent);

    /**
     * Count a pool acquire that timed out.
     *
     * Metric name: pgscope.pool.acquire.timeouts
     */
    void acquireTimedOut();

    /**
     * Count a finished transaction or savepoint.
     *
     * Metric name: pgscope.transactions.completed
     * Tags: nested, outcome (commit, rollback, failed)
     */
    void transactionCompleted(boolean nested, String outcome);

    /**
     * Record statement execution time.
     *
     * Metric name: pgscope.query.duration
     */
    void recordQuery(long nanos);
}
