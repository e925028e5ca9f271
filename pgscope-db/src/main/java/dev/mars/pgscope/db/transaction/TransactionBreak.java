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

import dev.mars.pgscope.api.error.PgScopeException;

/**
 * Signal that unwinds nested managed transactions up to {@link #target()}, which then commits or
 * rolls back depending on {@link #isCommit()} and completes normally with a {@code null} result.
 * Every other transaction it passes through rolls back.
 *
 * <p>Obtained from {@link TransactionManager#raiseCommit()} and {@link TransactionManager#raiseRollback()}
 * as a failed future, which the transaction body returns.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class TransactionBreak extends PgScopeException {

    private static final long serialVersionUID = 1L;

    private final transient TransactionManager target;
    private final boolean commit;

    TransactionBreak(TransactionManager target, boolean commit) {
        super((commit ? "commit" : "rollback") + " break for " + target, null, false);
        this.target = target;
        this.commit = commit;
    }

    public TransactionManager target() {
        return target;
    }

    public boolean isCommit() {
        return commit;
    }
}
