package dev.mars.pgscope.api.query;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Buffered outcome of one statement: the rows it returned, the number of rows it affected and the
 * command status reported by the server (for example {@code "UPDATE 3"}).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class QueryResult {

    private final List<Row> rows;
    private final int rowCount;
    private final String status;

    public QueryResult(List<Row> rows, int rowCount, String status) {
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.rowCount = rowCount;
        this.status = status;
    }

    public static QueryResult of(List<Row> rows, String status) {
        return new QueryResult(rows, rows.size(), status);
    }

    public static QueryResult command(String status, int rowCount) {
        return new QueryResult(List.of(), rowCount, status);
    }

    public List<Row> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rowCount;
    }

    public String getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "QueryResult{status='" + status + "', rowCount=" + rowCount + ", rows=" + rows.size() + "}";
    }
}
