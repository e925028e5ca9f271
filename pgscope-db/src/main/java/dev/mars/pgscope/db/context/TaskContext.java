package dev.mars.pgscope.db.context;

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
import dev.mars.pgscope.db.connection.ConnectionHandle;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Identity of one logical task and owner of its {@link ConnectionStack}.
 *
 * <p>A task context is passed explicitly to every engine call. Work that runs concurrently with its
 * parent gets its own context from {@link #fork(String)}: the child starts with the parent's
 * connections as of the fork, so {@code reuse} acquisitions in the child share the parent's current
 * connection, while later pushes and pops in either context stay invisible to the other.
 * {@link #detach(String)} creates a context that inherits nothing.</p>
 *
 * <p>A context must only be used from the continuation chain of its own task.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class TaskContext {

    private static final AtomicLong IDS = new AtomicLong();

    private final long id;
    private final String name;
    private final TaskContext parent;
    private ConnectionStack stack;

    private TaskContext(String name, TaskContext parent) {
        this.id = IDS.incrementAndGet();
        this.name = name != null ? name : "task-" + id;
        this.parent = parent;
    }

    public static TaskContext root() {
        return new TaskContext(null, null);
    }

    public static TaskContext root(String name) {
        return new TaskContext(name, null);
    }

    public TaskContext fork() {
        return fork(null);
    }

    public synchronized TaskContext fork(String childName) {
        TaskContext child = new TaskContext(childName, this);
        if (stack != null) {
            child.stack = stack.copyFor(child);
        }
        return child;
    }

    public TaskContext detach(String newName) {
        return new TaskContext(newName, null);
    }

    public long id() {
        return id;
    }

    public String name() {
        return name;
    }

    /**
     * The context this one was forked from, or {@code null}.
     */
    public TaskContext parent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * The stack, or {@code null} when no reusable connection is held.
     */
    public synchronized ConnectionStack stack() {
        return stack;
    }

    public synchronized ConnectionStack getOrCreateStack() {
        if (stack == null) {
            stack = new ConnectionStack(this);
        }
        return stack;
    }

    /**
     * The innermost reusable connection of this task, or {@code null}.
     */
    public synchronized ConnectionHandle currentConnection() {
        return stack == null ? null : stack.top();
    }

    /**
     * Removes {@code handle} from this task's stack.
     *
     * @param strict when true the handle must be on top of the stack
     * @throws InterfaceException when the handle is not on top (strict) or not on the stack at all
     */
    public synchronized void removeConnection(ConnectionHandle handle, boolean strict) {
        if (stack == null) {
            throw new InterfaceException("Wrong release order: task " + name + " holds no reusable connection");
        }
        if (strict) {
            stack.pop(handle);
        } else {
            stack.remove(candidate -> candidate == handle);
        }
        if (stack.isEmpty()) {
            stack = null;
        }
    }

    @Override
    public String toString() {
        return "TaskContext{" + name + (parent != null ? ", parent=" + parent.name : "") + "}";
    }
}
