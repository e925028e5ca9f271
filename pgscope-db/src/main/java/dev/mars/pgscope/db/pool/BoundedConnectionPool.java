package dev.mars.pgscope.db.pool;

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

import dev.mars.pgscope.api.error.InterfaceException;
import dev.mars.pgscope.api.error.OperationTimeoutException;
import dev.mars.pgscope.api.error.PoolExhaustedException;
import dev.mars.pgscope.api.spi.ConnectionFactory;
import dev.mars.pgscope.api.spi.ConnectionPool;
import dev.mars.pgscope.api.spi.PhysicalConnection;
import dev.mars.pgscope.api.spi.PoolStats;
import dev.mars.pgscope.db.config.PoolConfig;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Connection pool with a steady maximum size and a bounded overflow.
 *
 * <p>Acquisition order: an idle connection if there is one, a new connection while the pool holds
 * fewer than {@code maxSize + maxOverflow}, otherwise a place in the wait queue. A released
 * connection goes to the oldest waiter; with nobody waiting it is closed when the pool is above
 * {@code maxSize} and kept idle otherwise. Waiters that time out leave the queue and never receive a
 * connection.</p>
 *
 * <p>All accounting is guarded by the pool's monitor. Promises are completed and connections are
 * closed outside of it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class BoundedConnectionPool implements ConnectionPool {
    private static final Logger logger = LoggerFactory.getLogger(BoundedConnectionPool.class);

    private final Vertx vertx;
    private final ConnectionFactory factory;
    private final PoolConfig config;
    private final String name;

    private final Deque<IdleConnection> idle = new ArrayDeque<>();
    private final Set<PhysicalConnection> checkedOut = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private int opening;
    private boolean closed;
    private long reaperTimerId = -1;

    public BoundedConnectionPool(Vertx vertx, ConnectionFactory factory, PoolConfig config) {
        this(vertx, factory, config, "default");
    }

    public BoundedConnectionPool(Vertx vertx, ConnectionFactory factory, PoolConfig config, String name) {
        this.vertx = vertx;
        this.factory = factory;
        this.config = config;
        this.name = name;
    }

    /**
     * Opens {@code minSize} connections and starts idle reaping.
     */
    public Future<Void> start() {
        List<Future<PhysicalConnection>> opened = new ArrayList<>();
        synchronized (this) {
            if (closed) {
                return Future.failedFuture(new InterfaceException("Pool " + name + " is closed"));
            }
            int missing = config.getMinSize() - total();
            for (int i = 0; i < missing; i++) {
                opening++;
                opened.add(factory.connect().onComplete(ar -> {
                    synchronized (this) {
                        opening--;
                    }
                    if (ar.succeeded()) {
                        offerIdle(ar.result());
                    }
                }));
            }
            Duration idleTimeout = config.getIdleTimeout();
            if (idleTimeout != null && !idleTimeout.isZero() && reaperTimerId < 0) {
                long interval = Math.max(1000L, idleTimeout.toMillis() / 2);
                reaperTimerId = vertx.setPeriodic(interval, id -> reapIdle());
            }
        }
        logger.info("Starting pool {} with {}", name, config);
        return Future.all(opened).mapEmpty();
    }

    @Override
    public Future<PhysicalConnection> acquire(Duration timeout) {
        Duration wait = timeout != null ? timeout : config.getAcquireTimeout();
        List<PhysicalConnection> broken = new ArrayList<>();
        Future<PhysicalConnection> result;
        boolean connect = false;
        synchronized (this) {
            if (closed) {
                return Future.failedFuture(new InterfaceException("Pool " + name + " is closed"));
            }
            PhysicalConnection reused = null;
            while (reused == null && !idle.isEmpty()) {
                PhysicalConnection candidate = idle.pollLast().connection;
                if (candidate.isClosed()) {
                    broken.add(candidate);
                } else {
                    reused = candidate;
                }
            }
            if (reused != null) {
                checkedOut.add(reused);
                result = Future.succeededFuture(reused);
            } else if (total() < capacity()) {
                opening++;
                connect = true;
                result = null;
            } else if (config.getMaxWaitQueueSize() >= 0 && waiters.size() >= config.getMaxWaitQueueSize()) {
                result = Future.failedFuture(new PoolExhaustedException(
                    "Pool " + name + " is exhausted: " + waiters.size() + " callers already waiting", waiters.size()));
            } else {
                Waiter waiter = new Waiter();
                waiters.addLast(waiter);
                if (wait != null) {
                    waiter.timerId = vertx.setTimer(Math.max(1L, wait.toMillis()), id -> expire(waiter, wait));
                }
                result = waiter.promise.future();
            }
        }
        if (!broken.isEmpty()) {
            logger.debug("Discarded {} closed idle connections from pool {}", broken.size(), name);
        }
        if (connect) {
            return openConnection();
        }
        return result;
    }

    private Future<PhysicalConnection> openConnection() {
        return factory.connect().transform(ar -> {
            boolean discard;
            synchronized (this) {
                opening--;
                discard = closed && ar.succeeded();
                if (ar.succeeded() && !discard) {
                    checkedOut.add(ar.result());
                }
            }
            if (ar.failed()) {
                logger.warn("Pool {} failed to open a connection: {}", name, ar.cause().getMessage());
                serveWaiters();
                return Future.failedFuture(ar.cause());
            }
            if (discard) {
                closeQuietly(ar.result());
                return Future.failedFuture(new InterfaceException("Pool " + name + " is closed"));
            }
            logger.debug("Pool {} opened connection {}", name, ar.result().id());
            return Future.succeededFuture(ar.result());
        });
    }

    private void expire(Waiter waiter, Duration wait) {
        boolean removed;
        synchronized (this) {
            removed = waiters.remove(waiter);
        }
        if (removed) {
            logger.debug("Waiter timed out after {} on pool {}", wait, name);
            waiter.promise.fail(new OperationTimeoutException(
                "Timed out after " + wait.toMillis() + "ms waiting for a connection from pool " + name, wait));
        }
    }

    @Override
    public Future<Void> release(PhysicalConnection connection) {
        Waiter waiter = null;
        boolean close = false;
        synchronized (this) {
            if (!checkedOut.remove(connection)) {
                return Future.failedFuture(new InterfaceException(
                    "Connection " + connection.id() + " is not checked out from pool " + name));
            }
            if (closed || connection.isClosed()) {
                close = true;
            } else if (!waiters.isEmpty()) {
                waiter = waiters.pollFirst();
                checkedOut.add(connection);
            } else if (total() + 1 > config.getMaxSize()) {
                close = true;
            } else {
                idle.addLast(new IdleConnection(connection, System.nanoTime()));
            }
        }
        if (waiter != null) {
            cancelTimer(waiter);
            waiter.promise.complete(connection);
            return Future.succeededFuture();
        }
        if (close) {
            return closeQuietly(connection).onComplete(ar -> serveWaiters());
        }
        return Future.succeededFuture();
    }

    /**
     * Opens connections for queued waiters while there is capacity.
     */
    private void serveWaiters() {
        while (true) {
            Waiter waiter;
            synchronized (this) {
                if (closed || waiters.isEmpty() || total() >= capacity()) {
                    return;
                }
                waiter = waiters.pollFirst();
                opening++;
            }
            cancelTimer(waiter);
            openConnection().onComplete(ar -> {
                if (ar.succeeded()) {
                    waiter.promise.complete(ar.result());
                } else {
                    waiter.promise.fail(ar.cause());
                }
            });
        }
    }

    private void offerIdle(PhysicalConnection connection) {
        Waiter waiter = null;
        boolean close = false;
        synchronized (this) {
            if (closed) {
                close = true;
            } else if (!waiters.isEmpty()) {
                waiter = waiters.pollFirst();
                checkedOut.add(connection);
            } else {
                idle.addLast(new IdleConnection(connection, System.nanoTime()));
            }
        }
        if (waiter != null) {
            cancelTimer(waiter);
            waiter.promise.complete(connection);
        } else if (close) {
            closeQuietly(connection);
        }
    }

    void reapIdle() {
        List<PhysicalConnection> expired = new ArrayList<>();
        Duration idleTimeout = config.getIdleTimeout();
        if (idleTimeout == null) {
            return;
        }
        long now = System.nanoTime();
        synchronized (this) {
            Iterator<IdleConnection> it = idle.iterator();
            while (it.hasNext() && total() > config.getMinSize()) {
                IdleConnection candidate = it.next();
                if (now - candidate.since >= idleTimeout.toNanos() || candidate.connection.isClosed()) {
                    it.remove();
                    expired.add(candidate.connection);
                }
            }
        }
        if (!expired.isEmpty()) {
            logger.debug("Pool {} closing {} idle connections", name, expired.size());
            expired.forEach(this::closeQuietly);
        }
    }

    @Override
    public synchronized PoolStats stats() {
        int size = total();
        return new PoolStats(size, checkedOut.size(), idle.size(), Math.max(0, size - config.getMaxSize()), waiters.size());
    }

    public String name() {
        return name;
    }

    public PoolConfig config() {
        return config;
    }

    @Override
    public Future<Void> close() {
        List<PhysicalConnection> toClose = new ArrayList<>();
        List<Waiter> pendingWaiters;
        synchronized (this) {
            if (closed) {
                return Future.succeededFuture();
            }
            closed = true;
            if (reaperTimerId >= 0) {
                vertx.cancelTimer(reaperTimerId);
                reaperTimerId = -1;
            }
            idle.forEach(entry -> toClose.add(entry.connection));
            idle.clear();
            pendingWaiters = new ArrayList<>(waiters);
            waiters.clear();
        }
        for (Waiter waiter : pendingWaiters) {
            cancelTimer(waiter);
            waiter.promise.fail(new InterfaceException("Pool " + name + " is closed"));
        }
        logger.info("Closing pool {} ({} idle connections, {} still checked out)", name, toClose.size(), checkedOutCount());
        List<Future<Void>> closing = new ArrayList<>();
        toClose.forEach(conn -> closing.add(closeQuietly(conn)));
        return Future.all(closing).mapEmpty();
    }

    private synchronized int checkedOutCount() {
        return checkedOut.size();
    }

    private Future<Void> closeQuietly(PhysicalConnection connection) {
        return connection.close().recover(err -> {
            logger.warn("Failed to close connection {} of pool {}: {}", connection.id(), name, err.getMessage());
            return Future.succeededFuture();
        });
    }

    private void cancelTimer(Waiter waiter) {
        if (waiter.timerId >= 0) {
            vertx.cancelTimer(waiter.timerId);
        }
    }

    private int total() {
        return idle.size() + checkedOut.size() + opening;
    }

    private int capacity() {
        return config.getMaxSize() + config.getMaxOverflow();
    }

    private static final class IdleConnection {
        final PhysicalConnection connection;
        final long since;

        IdleConnection(PhysicalConnection connection, long since) {
            this.connection = connection;
            this.since = since;
        }
    }

    private static final class Waiter {
        final Promise<PhysicalConnection> promise = Promise.promise();
        long timerId = -1;
    }
}
