package dev.mars.pgscope.db.result;

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

import dev.mars.pgscope.api.error.InterfaceException;
import dev.mars.pgscope.api.query.ExecutionOptions;
import dev.mars.pgscope.api.query.Row;
import dev.mars.pgscope.api.spi.DriverCursor;
import io.vertx.core.Future;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Streaming access to a query result inside a transaction.
 *
 * <p>{@link #next()} reads ahead in batches of {@code prefetch} rows; {@link #many(int)} and
 * {@link #forward(int)} read exactly what they need. The cursor is closed automatically when the
 * transaction that opened it ends.</p>
 *
 * @param <R> the element type produced per row
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class RowCursor<R> {

    private final DriverCursor cursor;
    private final ExecutionOptions options;
    private final int prefetch;
    private final Deque<Row> buffer = new ArrayDeque<>();
    private boolean exhausted;
    private boolean closed;

    public RowCursor(DriverCursor cursor, ExecutionOptions options, int prefetch) {
        this.cursor = cursor;
        this.options = options;
        this.prefetch = prefetch;
    }

    /**
     * The next row, or {@code null} once the result is exhausted.
     */
    public Future<R> next() {
        if (closed) {
            return closedFailure();
        }
        if (!buffer.isEmpty()) {
            return Future.succeededFuture(ResultMapper.map(buffer.poll(), options));
        }
        if (exhausted) {
            return Future.succeededFuture(null);
        }
        return fetch(prefetch).map(rows -> {
            buffer.addAll(rows);
            Row row = buffer.poll();
            return row == null ? null : ResultMapper.<R>map(row, options);
        });
    }

    /**
     * Up to {@code count} further rows; fewer only when the result runs out.
     */
    public Future<List<R>> many(int count) {
        if (closed) {
            return closedFailure();
        }
        List<Row> rows = new ArrayList<>();
        while (!buffer.isEmpty() && rows.size() < count) {
            rows.add(buffer.poll());
        }
        if (rows.size() >= count || exhausted) {
            return Future.succeededFuture(ResultMapper.mapAll(rows, options));
        }
        return fetch(count - rows.size()).map(more -> {
            rows.addAll(more);
            return ResultMapper.mapAll(rows, options);
        });
    }

    /**
     * Skips {@code count} rows.
     */
    public Future<Void> forward(int count) {
        if (closed) {
            return closedFailure();
        }
        int remaining = count;
        while (!buffer.isEmpty() && remaining > 0) {
            buffer.poll();
            remaining--;
        }
        if (remaining == 0 || exhausted) {
            return Future.succeededFuture();
        }
        return fetch(remaining).mapEmpty();
    }

    public Future<Void> close() {
        if (closed) {
            return Future.succeededFuture();
        }
        closed = true;
        buffer.clear();
        return cursor.close();
    }

    public boolean isClosed() {
        return closed;
    }

    private Future<List<Row>> fetch(int count) {
        return cursor.read(count).map(rows -> {
            if (rows.size() < count || !cursor.hasMore()) {
                exhausted = true;
            }
            return rows;
        });
    }

    private <T> Future<T> closedFailure() {
        return Future.failedFuture(new InterfaceException("Cursor is closed"));
    }
}
