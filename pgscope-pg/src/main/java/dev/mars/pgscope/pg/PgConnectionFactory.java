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

import dev.mars.pgscope.api.spi.ConnectionFactory;
import dev.mars.pgscope.api.spi.PhysicalConnection;
import dev.mars.pgscope.db.config.ConnectionConfig;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.PgConnection;
import io.vertx.pgclient.SslMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Opens single PostgreSQL connections for {@link dev.mars.pgscope.db.pool.BoundedConnectionPool}.
 *
 * <p>When a schema other than {@code public} is configured, {@code search_path} is set on every
 * new connection before it is handed out.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class PgConnectionFactory implements ConnectionFactory {
    private static final Logger logger = LoggerFactory.getLogger(PgConnectionFactory.class);

    private final Vertx vertx;
    private final PgConnectOptions connectOptions;
    private final String searchPath;
    private final AtomicLong sequence = new AtomicLong();

    public PgConnectionFactory(Vertx vertx, ConnectionConfig config) {
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        Objects.requireNonNull(config.getHost(), "host");
        Objects.requireNonNull(config.getDatabase(), "database");
        Objects.requireNonNull(config.getUsername(), "username");
        Objects.requireNonNull(config.getPassword(), "password");

        this.connectOptions = new PgConnectOptions()
            .setHost(config.getHost())
            .setPort(config.getPort())
            .setDatabase(config.getDatabase())
            .setUser(config.getUsername())
            .setPassword(config.getPassword());

        if (config.isSslEnabled()) {
            connectOptions.setSslMode(SslMode.REQUIRE);
        } else {
            connectOptions.setSslMode(SslMode.DISABLE);
        }

        String normalized = normalizeSearchPath(config.getSchema());
        this.searchPath = normalized.isEmpty() || "public".equalsIgnoreCase(normalized) ? null : normalized;
    }

    @Override
    public Future<PhysicalConnection> connect() {
        String id = "pg-" + sequence.incrementAndGet();
        return PgConnection.connect(vertx, connectOptions)
            .compose(conn -> applySearchPath(conn, id)
                .map(v -> (PhysicalConnection) new PgPhysicalConnection(vertx, conn, id))
                .recover(err -> conn.close().transform(ar -> Future.<PhysicalConnection>failedFuture(err))))
            .onSuccess(conn -> logger.debug("Opened physical connection {} to {}:{}/{}", id,
                connectOptions.getHost(), connectOptions.getPort(), connectOptions.getDatabase()));
    }

    private Future<Void> applySearchPath(PgConnection conn, String id) {
        if (searchPath == null) {
            return Future.succeededFuture();
        }
        return conn.query("SET search_path TO " + searchPath).execute()
            .onFailure(err -> logger.warn("Failed to apply search_path '{}' on {}: {}", searchPath, id, err.toString()))
            .mapEmpty();
    }

    String searchPath() {
        return searchPath;
    }

    /**
     * Accepts identifiers separated by commas. Only letters, digits and underscores are allowed
     * in an identifier.
     */
    static String normalizeSearchPath(String schemaConfig) {
        if (schemaConfig == null) {
            return "";
        }
        String s = schemaConfig.trim();
        if (s.isEmpty()) {
            return "";
        }
        if (!s.matches("[A-Za-z0-9_,\\s]+")) {
            throw new IllegalArgumentException(
                "Invalid schema (allowed: letters, digits, underscore, comma, space): " + schemaConfig);
        }
        StringBuilder sb = new StringBuilder();
        for (String part : s.split(",")) {
            String p = part.trim();
            if (p.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(p);
        }
        return sb.toString();
    }
}
