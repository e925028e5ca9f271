package dev.mars.pgscope.db.connection;

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
import dev.mars.pgscope.api.query.Query;
import dev.mars.pgscope.api.spi.PhysicalConnection;
import dev.mars.pgscope.db.InMemoryEngineTestBase;
import dev.mars.pgscope.db.config.EngineConfig;
import dev.mars.pgscope.db.context.TaskContext;
import dev.mars.pgscope.db.engine.PgScopeEngine;
import dev.mars.pgscope.db.transaction.TransactionManager;
import dev.mars.pgscope.db.transaction.TransactionState;
import dev.mars.pgscope.test.categories.TestCategories;
import dev.mars.pgscope.test.memory.InMemoryDialect;
import io.vertx.core.Future;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lifecycle of {@link ConnectionHandle}: laziness, reuse, soft and permanent release.
 */
@Tag(TestCategories.CORE)
class ConnectionHandleTest extends InMemoryEngineTestBase {

    private static final AcquireOptions LAZY = AcquireOptions.builder().lazy(true).build();
    private static final Query<?> SELECT_ONE = Query.of("SELECT 1");

    @Test
    void testLazyHandleNeverUsedNeverTouchesPool() throws Exception {
        TaskContext task = TaskContext.root();
        ConnectionHandle handle = await(engine.acquire(task, LAZY));

        assertFalse(handle.isMaterialized());
        await(handle.release());

        assertEquals(0, database.connectionsOpened());
        assertEquals(0, pool.stats().size());
        assertTrue(handle.isClosed());
    }

    @Test
    void testLazyHandleMaterializesOnFirstStatement() throws Exception {
        ConnectionHandle handle = await(engine.acquire(TaskContext.root(), LAZY));
        assertEquals(0, pool.stats().checkedOut());

        assertEquals(1, await(handle.scalar(SELECT_ONE)));
        assertTrue(handle.isMaterialized());
        assertEquals(1, pool.stats().checkedOut());

        await(handle.release());
        assertEquals(0, pool.stats().checkedOut());
        assertEquals(1, pool.stats().checkedIn());
    }

    @Test
    void testEagerAcquireTakesConnectionBeforeCompleting() throws Exception {
        ConnectionHandle handle = await(engine.acquire(TaskContext.root()));
        assertTrue(handle.isMaterialized());
        assertEquals(1, pool.stats().checkedOut());
        await(handle.release());
    }

    @Test
    void testSoftReleaseReturnsConnectionAndKeepsHandleUsable() throws Exception {
        TaskContext task = TaskContext.root();
        ConnectionHandle handle = await(engine.acquire(task));

        await(handle.release(false));
        assertFalse(handle.isClosed());
        assertFalse(handle.isMaterialized());
        assertEquals(0, pool.stats().checkedOut());
        assertSame(handle, task.currentConnection(), "a soft release keeps the handle on the stack");

        assertEquals(2L, await(handle.scalar(Query.of("SELECT COUNT(*) FROM accounts"))));
        assertTrue(handle.isMaterialized());
        assertEquals(1, pool.stats().checkedOut());

        await(handle.release());
        assertNull(task.currentConnection());
    }

    @Test
    void testSoftReleaseRejectedInsideTransaction() throws Exception {
        ConnectionHandle handle = await(engine.acquire(TaskContext.root()));
        TransactionManager tx = await(handle.begin());

        Throwable failure = awaitFailure(handle.release(false));
        assertInstanceOf(InterfaceException.class, failure);
        assertTrue(handle.isMaterialized());

        await(tx.rollback());
        await(handle.release());
    }

    @Test
    void testDoubleReleaseFails() throws Exception {
        ConnectionHandle handle = await(engine.acquire(TaskContext.root()));
        await(handle.release());

        Throwable failure = awaitFailure(handle.release());
        assertInstanceOf(InterfaceException.class, failure);
        assertEquals(1, pool.stats().checkedIn(), "the connection went back exactly once");
    }

    @Test
    void testUseAfterReleaseFails() throws Exception {
        ConnectionHandle handle = await(engine.acquire(TaskContext.root()));
        await(handle.release());

        assertInstanceOf(InterfaceException.class, awaitFailure(handle.all(Query.of("SELECT * FROM accounts"))));
        assertInstanceOf(InterfaceException.class, awaitFailure(handle.getPhysicalConnection()));
    }

    @Test
    void testReusingHandleSharesPhysicalConnection() throws Exception {
        TaskContext task = TaskContext.root();
        ConnectionHandle root = await(engine.acquire(task));
        ConnectionHandle reusing = await(engine.acquire(task, AcquireOptions.reuse()));

        assertFalse(reusing.isRoot());
        assertSame(root, reusing.root());
        PhysicalConnection physical = await(root.getPhysicalConnection());
        assertSame(physical, await(reusing.getPhysicalConnection()));
        assertEquals(List.of(root), task.stack().snapshot(), "reusing handles are not pushed");

        await(reusing.release());
        assertEquals(1, pool.stats().checkedOut(), "releasing a reusing handle keeps the root's connection");
        assertFalse(root.isClosed());

        await(root.release());
        assertEquals(0, pool.stats().checkedOut());
        assertEquals(1, database.connectionsOpened());
    }

    @Test
    void testReuseOnEmptyStackCreatesRoot() throws Exception {
        TaskContext task = TaskContext.root();
        ConnectionHandle handle = await(engine.acquire(task, AcquireOptions.reuse()));
        assertTrue(handle.isRoot());
        assertSame(handle, task.currentConnection());
        await(handle.release());
    }

    @Test
    void testReusingHandleFailsOnceRootReleased() throws Exception {
        TaskContext task = TaskContext.root();
        ConnectionHandle root = await(engine.acquire(task));
        ConnectionHandle reusing = await(engine.acquire(task, AcquireOptions.reuse()));

        await(root.release());
        assertInstanceOf(InterfaceException.class, awaitFailure(reusing.scalar(SELECT_ONE)));
    }

    @Test
    void testStrictReleaseOrderRejectsOuterFirst() throws Exception {
        TaskContext task = TaskContext.root();
        ConnectionHandle outer = await(engine.acquire(task));
        ConnectionHandle inner = await(engine.acquire(task));

        Throwable failure = awaitFailure(outer.release());
        assertInstanceOf(InterfaceException.class, failure);
        assertTrue(failure.getMessage().contains("Wrong release order"));
        assertFalse(outer.isClosed(), "a rejected release leaves the handle usable");
        assertEquals(1, await(outer.scalar(SELECT_ONE)));

        await(inner.release());
        await(outer.release());
        assertEquals(0, pool.stats().checkedOut());
        assertNull(task.stack());
    }

    @Test
    void testRelaxedReleaseOrderRemovesFromMiddle() throws Exception {
        PgScopeEngine relaxed = new PgScopeEngine(pool, new InMemoryDialect(),
            new EngineConfig.Builder().strictReleaseOrder(false).build());
        TaskContext task = TaskContext.root();
        ConnectionHandle outer = await(relaxed.acquire(task));
        ConnectionHandle inner = await(relaxed.acquire(task));

        await(outer.release());
        assertEquals(List.of(inner), task.stack().snapshot());
        assertSame(inner, task.currentConnection());

        await(inner.release());
        assertEquals(0, pool.stats().checkedOut());
    }

    @Test
    void testReleaseDuringInFlightAcquireReturnsConnection() throws Exception {
        database.holdConnects();
        ConnectionHandle handle = await(engine.acquire(TaskContext.root(), LAZY));

        Future<PhysicalConnection> acquiring = handle.getPhysicalConnection();
        Future<Void> released = handle.release();
        assertFalse(released.isComplete(), "release waits for the acquisition in flight");

        database.releaseConnects();
        await(released);

        assertInstanceOf(InterfaceException.class, awaitFailure(acquiring));
        assertEquals(0, pool.stats().checkedOut());
        assertEquals(1, pool.stats().checkedIn());
    }

    @Test
    void testSoftReleaseDuringInFlightAcquireKeepsConnectionInPool() throws Exception {
        database.holdConnects();
        ConnectionHandle handle = await(engine.acquire(TaskContext.root(), LAZY));

        Future<PhysicalConnection> acquiring = handle.getPhysicalConnection();
        Future<Void> released = handle.release(false);
        assertFalse(released.isComplete(), "soft release waits for the acquisition in flight");

        database.releaseConnects();
        await(released);

        assertInstanceOf(InterfaceException.class, awaitFailure(acquiring));
        assertFalse(handle.isMaterialized());
        assertFalse(handle.isClosed());
        assertEquals(0, pool.stats().checkedOut());
        assertEquals(1, pool.stats().checkedIn());

        assertEquals(1, await(handle.scalar(SELECT_ONE)));
        assertEquals(1, pool.stats().checkedOut());
        await(handle.release());
        assertEquals(0, pool.stats().checkedOut());
    }

    @Test
    void testStatementJoiningAcquisitionKeepsItsOwnTimeout() throws Exception {
        TaskContext holder = TaskContext.root("holder");
        List<ConnectionHandle> held = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            held.add(await(engine.acquire(holder, AcquireOptions.builder().reusable(false).build())));
        }
        ConnectionHandle handle = await(engine.acquire(TaskContext.root(), LAZY));

        Future<Object> unbounded = handle.scalar(SELECT_ONE);
        long start = System.nanoTime();
        Throwable failure = awaitFailure(handle.scalar(Query.of("SELECT 1").timeout(Duration.ofMillis(100))));

        assertInstanceOf(OperationTimeoutException.class, failure);
        assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(1)) < 0,
            "the joining statement gave up after its own 100ms");
        assertFalse(unbounded.isComplete());

        await(held.get(0).release());
        assertEquals(1, await(unbounded));

        for (ConnectionHandle other : held.subList(1, held.size())) {
            await(other.release());
        }
        await(handle.release());
        assertEquals(0, pool.stats().checkedOut());
    }

    @Test
    void testConcurrentMaterializationSharesOneAcquire() throws Exception {
        database.holdConnects();
        ConnectionHandle handle = await(engine.acquire(TaskContext.root(), LAZY));

        Future<PhysicalConnection> first = handle.getPhysicalConnection();
        Future<PhysicalConnection> second = handle.getPhysicalConnection();
        database.releaseConnects();

        assertSame(await(first), await(second));
        assertEquals(1, database.connectionsOpened());
        await(handle.release());
    }

    @Test
    void testReleaseRollsBackLeftoverTransaction() throws Exception {
        ConnectionHandle handle = await(engine.acquire(TaskContext.root()));
        TransactionManager tx = await(handle.begin());
        await(handle.status(Query.of("DELETE FROM accounts")));

        await(handle.release());

        assertEquals(TransactionState.ROLLED_BACK, tx.getState());
        assertEquals("ROLLBACK", database.statements().get(database.statements().size() - 1));
        assertEquals(2L, accountCount());
        assertEquals(1, pool.stats().checkedIn());
    }

    @Test
    void testToStringNamesRoot() throws Exception {
        TaskContext task = TaskContext.root();
        ConnectionHandle root = await(engine.acquire(task, LAZY));
        ConnectionHandle reusing = await(engine.acquire(task, AcquireOptions.builder().reuse(true).lazy(true).build()));

        assertTrue(root.toString().startsWith("conn-"));
        assertTrue(reusing.toString().contains("(reusing " + root + ")"));

        await(reusing.release());
        await(root.release());
    }
}
