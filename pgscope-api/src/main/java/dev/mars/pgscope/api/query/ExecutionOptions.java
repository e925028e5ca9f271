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
import java.util.Objects;

/**
 * Per-query execution settings.
 *
 * <p>Immutable. Every field is optional; unset fields are filled from the engine defaults with
 * {@link #merge(ExecutionOptions)}. Defaults when nothing is set anywhere:</p>
 * <ul>
 *   <li>{@code returnModel} - {@code true}, rows go through the loader or model mapping</li>
 *   <li>{@code model} - none, rows are returned as {@link Row}</li>
 *   <li>{@code timeout} - none, statements may run indefinitely</li>
 *   <li>{@code loader} - none</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class ExecutionOptions {

    private static final ExecutionOptions DEFAULTS = builder().build();

    private final Boolean returnModel;
    private final Class<?> model;
    private final Duration timeout;
    private final Loader<?> loader;

    private ExecutionOptions(Builder builder) {
        this.returnModel = builder.returnModel;
        this.model = builder.model;
        this.timeout = builder.timeout;
        this.loader = builder.loader;
    }

    public static ExecutionOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.returnModel = returnModel;
        builder.model = model;
        builder.timeout = timeout;
        builder.loader = loader;
        return builder;
    }

    /**
     * Returns options where each field unset here takes the value from {@code fallback}.
     */
    public ExecutionOptions merge(ExecutionOptions fallback) {
        if (fallback == null) {
            return this;
        }
        Builder builder = toBuilder();
        if (builder.returnModel == null) builder.returnModel = fallback.returnModel;
        if (builder.model == null) builder.model = fallback.model;
        if (builder.timeout == null) builder.timeout = fallback.timeout;
        if (builder.loader == null) builder.loader = fallback.loader;
        return builder.build();
    }

    public boolean isReturnModel() {
        return returnModel == null || returnModel;
    }

    public Class<?> getModel() {
        return model;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Loader<?> getLoader() {
        return loader;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExecutionOptions)) return false;
        ExecutionOptions that = (ExecutionOptions) o;
        return Objects.equals(returnModel, that.returnModel) && Objects.equals(model, that.model)
            && Objects.equals(timeout, that.timeout) && Objects.equals(loader, that.loader);
    }

    @Override
    public int hashCode() {
        return Objects.hash(returnModel, model, timeout, loader);
    }

    @Override
    public String toString() {
        return "ExecutionOptions{returnModel=" + isReturnModel() + ", model=" + model
            + ", timeout=" + timeout + ", loader=" + loader + "}";
    }

    public static class Builder {
        private Boolean returnModel;
        private Class<?> model;
        private Duration timeout;
        private Loader<?> loader;

        public Builder returnModel(boolean returnModel) {
            this.returnModel = returnModel;
            return this;
        }

        public Builder model(Class<?> model) {
            this.model = model;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout != null && timeout.isNegative()) {
                throw new IllegalArgumentException("Timeout cannot be negative: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public Builder loader(Loader<?> loader) {
            this.loader = loader;
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(this);
        }
    }
}
