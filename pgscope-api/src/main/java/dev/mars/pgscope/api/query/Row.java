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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One result row: column names and values in result order.
 *
 * <p>Rows are driver independent so that loaders, cursors and the engine never see driver types.
 * Column lookup by name returns the first column carrying that name.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class Row {

    private final List<String> columns;
    private final List<Object> values;

    public Row(List<String> columns, List<Object> values) {
        Objects.requireNonNull(columns, "columns cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        if (columns.size() != values.size()) {
            throw new IllegalArgumentException("Row has " + columns.size() + " columns but "
                + values.size() + " values");
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Creates a row from an ordered map of column name to value.
     */
    public static Row of(Map<String, ?> columnValues) {
        return new Row(new ArrayList<>(columnValues.keySet()), new ArrayList<>(columnValues.values()));
    }

    public int size() {
        return values.size();
    }

    public List<String> columns() {
        return columns;
    }

    public List<Object> values() {
        return values;
    }

    public Object get(int index) {
        if (index < 0 || index >= values.size()) {
            throw new IndexOutOfBoundsException("Column index " + index + " out of range for row of size " + values.size());
        }
        return values.get(index);
    }

    public Object get(String column) {
        return values.get(indexOf(column));
    }

    public <T> T get(String column, Class<T> type) {
        return type.cast(get(column));
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int indexOf(String column) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("No column named '" + column + "' in " + columns);
        }
        return index;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            map.putIfAbsent(columns.get(i), values.get(i));
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row)) return false;
        Row other = (Row) o;
        return columns.equals(other.columns) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, values);
    }

    @Override
    public String toString() {
        return "Row" + toMap();
    }
}
