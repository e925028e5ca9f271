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
 * Base type of every failure raised by PgScope itself.
 *
 * <p>Driver errors (for example {@code io.vertx.pgclient.PgException}) are never wrapped in this
 * type, they reach the caller unchanged.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class PgScopeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PgScopeException(String message) {
        super(message);
    }

    public PgScopeException(String message, Throwable cause) {
        super(message, cause);
    }

    protected PgScopeException(String message, Throwable cause, boolean writableStackTrace) {
        super(message, cause, true, writableStackTrace);
    }
}
