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
import io.vertx.sqlclient.RowSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts Vert.x SQL client rows into PgScope rows.
 */
final class PgRows {

    private PgRows() {
    }

    static List<Row> toRows(RowSet<io.vertx.sqlclient.Row> rowSet) {
        List<Row> rows = new ArrayList<>(rowSet.size());
        for (io.vertx.sqlclient.Row source : rowSet) {
            int size = source.size();
            List<String> columns = new ArrayList<>(size);
            List<Object> values = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                columns.add(source.getColumnName(i));
                values.add(source.getValue(i));
            }
            rows.add(new Row(columns, values));
        }
        return rows;
    }
}
