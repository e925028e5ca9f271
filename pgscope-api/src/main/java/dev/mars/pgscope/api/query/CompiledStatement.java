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
import java.util.Objects;

/**
 * Driver-ready statement text with its bound parameters in placeholder order.
 *
 * @param sql    statement text in the driver's placeholder syntax
 * @param params parameter values, may contain {@code null}
 */
public record CompiledStatement(String sql, List<Object> params) {

    public CompiledStatement {
        Objects.requireNonNull(sql, "sql cannot be null");
        params = params == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
    }

    public static CompiledStatement of(String sql, Object... params) {
        List<Object> values = new ArrayList<>(params.length);
        Collections.addAll(values, params);
        return new CompiledStatement(sql, values);
    }
}
