package dev.mars.pgscope.api.spi;

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
import io.vertx.core.Future;

import java.util.List;

/**
 * Driver side of a streaming cursor.
 */
public interface DriverCursor {

    /**
     * Reads up to {@code count} further rows. An empty list means the cursor is exhausted.
     */
    Future<List<Row>> read(int count);

    boolean hasMore();

    Future<Void> close();
}
