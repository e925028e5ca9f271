package dev.mars.pgscope.api.transaction;

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
 * Options of an outermost transaction. Each field is optional; an unset field leaves the server
 * default in place. Nested transactions become savepoints and cannot carry any of these options.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class TransactionOptions {

    private static final TransactionOptions DEFAULTS = new TransactionOptions(null, null, null);

    private final IsolationLevel isolation;
    private final Boolean readOnly;
    private final Boolean deferrable;

    private TransactionOptions(IsolationLevel isolation, Boolean readOnly, Boolean deferrable) {
        this.isolation = isolation;
        this.readOnly = readOnly;
        this.deferrable = deferrable;
    }

    public static TransactionOptions defaults() {
        return DEFAULTS;
    }

    public static TransactionOptions isolation(IsolationLevel isolation) {
        return new TransactionOptions(isolation, null, null);
    }

    public TransactionOptions withIsolation(IsolationLevel isolation) {
        return new TransactionOptions(isolation, readOnly, deferrable);
    }

    public TransactionOptions withReadOnly(boolean readOnly) {
        return new TransactionOptions(isolation, readOnly, deferrable);
    }

    public TransactionOptions withDeferrable(boolean deferrable) {
        return new TransactionOptions(isolation, readOnly, deferrable);
    }

    public IsolationLevel getIsolation() {
        return isolation;
    }

    public Boolean getReadOnly() {
        return readOnly;
    }

    public Boolean getDeferrable() {
        return deferrable;
    }

    /**
     * True when no option is set.
     */
    public boolean isDefault() {
        return isolation == null && readOnly == null && deferrable == null;
    }

    @Override
    public String toString() {
        return "TransactionOptions{isolation=" + isolation + ", readOnly=" + readOnly + ", deferrable=" + deferrable + "}";
    }
}
