package dev.mars.pgscope.api.loader;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.pgscope.api.query.Row;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Factory methods for the common {@link Loader} shapes.
 *
 * <p>Model loading converts the row's column map with Jackson, so a model is any type Jackson can
 * bind: a bean with setters, a record, or a class with a {@code @JsonCreator}. Columns without a
 * matching property are ignored.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class Loaders {

    private static final ObjectMapper MODEL_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private Loaders() {
    }

    public static Loader<Row> row() {
        return row -> row;
    }

    public static Loader<Object> column(String name) {
        Objects.requireNonNull(name, "column name cannot be null");
        return row -> row.get(name);
    }

    public static Loader<Object> column(int index) {
        return row -> row.get(index);
    }

    public static <T> Loader<T> column(String name, Class<T> type) {
        Objects.requireNonNull(type, "type cannot be null");
        return row -> type.cast(row.get(name));
    }

    public static <T> Loader<T> model(Class<T> type) {
        Objects.requireNonNull(type, "model type cannot be null");
        return row -> MODEL_MAPPER.convertValue(row.toMap(), type);
    }

    /**
     * Applies each loader to the same row and collects the results in order.
     */
    public static Loader<List<Object>> tuple(Loader<?>... loaders) {
        List<Loader<?>> parts = List.of(loaders);
        return row -> {
            List<Object> values = new ArrayList<>(parts.size());
            for (Loader<?> part : parts) {
                values.add(part.load(row));
            }
            return Collections.unmodifiableList(values);
        };
    }

    public static <T> Loader<T> value(T constant) {
        return row -> constant;
    }

    public static <T> Loader<T> of(Function<Row, T> function) {
        Objects.requireNonNull(function, "function cannot be null");
        return function::apply;
    }
}
