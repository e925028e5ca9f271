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

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Ordered reusable connections of one task, innermost last.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class ConnectionStack {

    private final TaskContext owner;
    private final LinkedList<ConnectionHandle> handles = new LinkedList<>();

    ConnectionStack(TaskContext owner) {
        this.owner = owner;
    }

    public TaskContext owner() {
        return owner;
    }

    public synchronized void push(ConnectionHandle handle) {
        handles.addLast(handle);
    }

    public synchronized ConnectionHandle top() {
        return handles.peekLast();
    }

    public synchronized int size() {
        return handles.size();
    }

    public synchronized boolean isEmpty() {
        return handles.isEmpty();
    }

    public synchronized boolean contains(ConnectionHandle handle) {
        return handles.contains(handle);
    }

    /**
     * Handles from outermost to innermost.
     */
    public synchronized List<ConnectionHandle> snapshot() {
        return new ArrayList<>(handles);
    }

    /**
     * Removes the top handle, which must be {@code handle}.
     */
    synchronized void pop(ConnectionHandle handle) {
        ConnectionHandle top = handles.peekLast();
        if (top != handle) {
            throw new InterfaceException("Wrong release order: " + handle + " is not the innermost connection of "
                + owner.name() + " (innermost is " + top + ")");
        }
        handles.removeLast();
    }

    /**
     * Removes the innermost handle matching {@code predicate}.
     */
    synchronized ConnectionHandle remove(Predicate<ConnectionHandle> predicate) {
        Iterator<ConnectionHandle> it = handles.descendingIterator();
        while (it.hasNext()) {
            ConnectionHandle candidate = it.next();
            if (predicate.test(candidate)) {
                it.remove();
                return candidate;
            }
        }
        throw new InterfaceException("Wrong release order: connection is not held by " + owner.name());
    }

    synchronized ConnectionStack copyFor(TaskContext child) {
        ConnectionStack copy = new ConnectionStack(child);
        copy.handles.addAll(handles);
        return copy;
    }

    @Override
    public synchronized String toString() {
        return "ConnectionStack{owner=" + owner.name() + ", handles=" + handles + "}";
    }
}
