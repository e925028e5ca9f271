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

import dev.mars.pgscope.api.loader.Loader;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable query descriptor: SQL text, its parameters and its {@link ExecutionOptions}.
 *
 * <p>The type parameter is the element type produced for each row once the options are applied.
 * Every modifier returns a new copy, the receiver is never changed:</p>
 * <pre>{@code
 * Query<Account> byId = Query.of("SELECT * FROM accounts WHERE id = ?", 7)
 *     .model(Account.class)
 *     .timeout(Duration.ofSeconds(2));
 * }</pre>
 *
 * <p>Parameters are either positional ({@code ?}) or named ({@code :name}); the dialect rewrites
 * them into the driver's placeholder syntax.</p>
 *
 * @param <R> the element type produced per row
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class Query<R> {

    private final String sql;
    private final List<Object> params;
    private final Map<String, Object> namedParams;
    private final ExecutionOptions options;

    private Query(String sql, List<Object> params, Map<String, Object> namedParams, ExecutionOptions options) {
        this.sql = Objects.requireNonNull(sql, "sql cannot be null");
        this.params = params;
        this.namedParams = namedParams;
        this.options = options;
    }

    public static Query<Row> of(String sql, Object... params) {
        List<Object> values = new ArrayList<>(params.length);
        Collections.addAll(values, params);
        return new Query<>(sql, Collections.unmodifiableList(values), null, ExecutionOptions.defaults());
    }

    public static Query<Row> named(String sql, Map<String, ?> params) {
        Map<String, Object> values = new LinkedHashMap<>(params);
        return new Query<>(sql, List.of(), Collections.unmodifiableMap(values), ExecutionOptions.defaults());
    }

    /**
     * Maps each row onto {@code type} by column name.
     */
    public <T> Query<T> model(Class<T> type) {
        return new Query<>(sql, params, namedParams,
            options.toBuilder().model(type).loader(null).returnModel(true).build());
    }

    public <T> Query<T> loader(Loader<T> loader) {
        return new Query<>(sql, params, namedParams,
            options.toBuilder().loader(loader).returnModel(true).build());
    }

    /**
     * Returns raw rows regardless of the model or loader set on this query.
     */
    public Query<Row> raw() {
        return new Query<>(sql, params, namedParams, options.toBuilder().returnModel(false).build());
    }

    public Query<R> timeout(Duration timeout) {
        return new Query<>(sql, params, namedParams, options.toBuilder().timeout(timeout).build());
    }

    /**
     * Replaces the execution options wholesale. The element type is no longer statically known.
     */
    public Query<Object> executionOptions(ExecutionOptions newOptions) {
        return new Query<>(sql, params, namedParams, Objects.requireNonNull(newOptions, "options cannot be null"));
    }

    public String sql() {
        return sql;
    }

    public List<Object> params() {
        return params;
    }

    public Map<String, Object> namedParams() {
        return namedParams;
    }

    public boolean isNamed() {
        return namedParams != null;
    }

    public ExecutionOptions options() {
        return options;
    }

    @Override
    public String toString() {
        return "Query{sql='" + sql + "', params=" + (isNamed() ? namedParams : params) + ", options=" + options + "}";
    }
}
