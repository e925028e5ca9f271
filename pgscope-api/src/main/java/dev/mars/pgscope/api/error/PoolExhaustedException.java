package dev.mars.pgscope.api.error;

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
 * The pool is at its overflow limit and its wait queue is full, so the request was rejected
 * without waiting.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class PoolExhaustedException extends PgScopeException {

    private static final long serialVersionUID = 1L;

    private final int waiting;

    public PoolExhaustedException(String message, int waiting) {
        super(message);
        this.waiting = waiting;
    }

    public int getWaiting() {
        return waiting;
    }
}
