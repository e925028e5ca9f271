package dev.mars.pgscope.db.metrics;

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

/**
 * No-op implementation of ScopeMetrics.
 *
 * Used when no MeterRegistry is available.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class NoOpScopeMetrics implements ScopeMetrics {

    public static final NoOpScopeMetrics INSTANCE = new NoOpScopeMetrics();

    @Override
    public void connectionAcquired(boolean reused) {
        // No-op
    }

    @Override
    public void connectionReleased(boolean permanent) {
        // No-op
    }

    @Override
    public void acquireTimedOut() {
        // No-op
    }

    @Override
    public void transactionCompleted(boolean nested, String outcome) {
        // No-op
    }

    @Override
    public void recordQuery(long nanos) {
        // No-op
    }
}
