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

import java.time.Duration;

/**
 * A point in time after which an operation has run out of budget. Sequential waits share one
 * deadline, so each wait gets only what earlier ones left over.
 *
 * <p>A deadline created from a {@code null} timeout never expires.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(null, 0L);

    private final Duration budget;
    private final long expiresAtNanos;

    private Deadline(Duration budget, long expiresAtNanos) {
        this.budget = budget;
        this.expiresAtNanos = expiresAtNanos;
    }

    public static Deadline after(Duration timeout) {
        if (timeout == null) {
            return NONE;
        }
        return new Deadline(timeout, System.nanoTime() + timeout.toNanos());
    }

    public static Deadline none() {
        return NONE;
    }

    public boolean isBounded() {
        return budget != null;
    }

    /**
     * The original budget, or {@code null} for an unbounded deadline.
     */
    public Duration budget() {
        return budget;
    }

    /**
     * Time left, never negative, or {@code null} for an unbounded deadline.
     */
    public Duration remaining() {
        if (budget == null) {
            return null;
        }
        long left = expiresAtNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    public boolean isExpired() {
        return budget != null && expiresAtNanos - System.nanoTime() <= 0;
    }

    /**
     * The shorter of two optional timeouts, {@code null} meaning unbounded.
     */
    public static Duration min(Duration a, Duration b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.compareTo(b) <= 0 ? a : b;
    }

    @Override
    public String toString() {
        return budget == null ? "Deadline{none}" : "Deadline{budget=" + budget + ", remaining=" + remaining() + "}";
    }
}
