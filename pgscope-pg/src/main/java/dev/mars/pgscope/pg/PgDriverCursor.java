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

import dev.mars.pgscope.api.query.Row;
import dev.mars.pgscope.api.spi.DriverCursor;
import io.vertx.core.Future;
import io.vertx.sqlclient.Cursor;
import io.vertx.sqlclient.PreparedStatement;

import java.util.List;

/**
 * Server-side cursor on a prepared statement. Closing it also closes the statement.
 */
final class PgDriverCursor implements DriverCursor {

    private final PreparedStatement statement;
    private final Cursor cursor;
    private boolean started;

    PgDriverCursor(PreparedStatement statement, Cursor cursor) {
        this.statement = statement;
        this.cursor = cursor;
    }

    @Override
    public Future<List<Row>> read(int count) {
        return cursor.read(count).map(rowSet -> {
            started = true;
            return PgRows.toRows(rowSet);
        });
    }

    @Override
    public boolean hasMore() {
        return !started || cursor.hasMore();
    }

    @Override
    public Future<Void> close() {
        return cursor.close().transform(ar -> statement.close());
    }
}
