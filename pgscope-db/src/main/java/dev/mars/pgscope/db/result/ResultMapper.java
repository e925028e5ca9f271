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

import dev.mars.pgscope.api.loader.Loader;
import dev.mars.pgscope.api.loader.Loaders;
import dev.mars.pgscope.api.query.ExecutionOptions;
import dev.mars.pgscope.api.query.Row;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies {@link ExecutionOptions} to raw rows.
 *
 * <p>With {@code returnModel} off, rows are returned as they are. Otherwise an explicit loader wins
 * over a model type, and with neither set the raw row is returned.</p>
 */
public final class ResultMapper {

    private ResultMapper() {
    }

    @SuppressWarnings("unchecked")
    public static <R> R map(Row row, ExecutionOptions options) {
        return (R) loaderFor(options).load(row);
    }

    @SuppressWarnings("unchecked")
    public static <R> List<R> mapAll(List<Row> rows, ExecutionOptions options) {
        Loader<?> loader = loaderFor(options);
        List<R> mapped = new ArrayList<>(rows.size());
        for (Row row : rows) {
            mapped.add((R) loader.load(row));
        }
        return mapped;
    }

    private static Loader<?> loaderFor(ExecutionOptions options) {
        if (!options.isReturnModel()) {
            return Loaders.row();
        }
        if (options.getLoader() != null) {
            return options.getLoader();
        }
        if (options.getModel() != null) {
            return Loaders.model(options.getModel());
        }
        return Loaders.row();
    }
}
