/*
 * This file is part of Dependency-Track.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 * Copyright (c) OWASP Foundation. All Rights Reserved.
 */
package org.dependencytrack.updater.distlock;

import org.dependencytrack.updater.common.context.OperationCancelledException;
import org.dependencytrack.updater.common.context.OperationContext;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Base for {@link DistributedLock}s whose backend only offers a non-blocking acquisition primitive.
 * <p>
 * Blocking acquisition is implemented by polling the backend at a fixed interval,
 * until either the lock is granted, or the {@link OperationContext} is done.
 *
 * @since 5.7.0
 */
public abstract class AbstractPollingLock implements DistributedLock {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractPollingLock.class);
    private static final Duration CANCELLATION_CHECK_INTERVAL = Duration.ofMillis(50);

    private final Duration pollInterval;
    private @Nullable String heldKey;
    private boolean closed;

    protected AbstractPollingLock(final Duration pollInterval) {
        requireNonNull(pollInterval, "pollInterval must not be null");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }

        this.pollInterval = pollInterval;
    }

    /**
     * Make a single, non-blocking attempt to acquire {@code key}.
     *
     * @param key Key of the lock.
     * @return {@code true} when the lock was granted.
     * @throws LockException When the backend failed.
     */
    protected abstract boolean attemptAcquire(String key) throws LockException;

    /**
     * Invoked when acquisition of {@code key} is given up after one or more failed attempts,
     * allowing implementations to free resources they allocated for the attempt.
     */
    protected void abandonAcquire(final String key) {
    }

    /**
     * Release the grant for {@code key}.
     *
     * @param key Key of the lock.
     * @throws LockException When the backend failed.
     */
    protected abstract void release(String key) throws LockException;

    @Override
    public final void lock(final OperationContext ctx, final String key) throws LockException {
        requireNonNull(ctx, "ctx must not be null");
        requireNonNull(key, "key must not be null");
        ensureOpen();

        if (heldKey != null && !heldKey.equals(key)) {
            throw new IllegalStateException(
                    "Handle already holds lock %s; Can not acquire %s".formatted(heldKey, key));
        }

        while (true) {
            if (ctx.isDone()) {
                abandon(key);
                LOGGER.debug("Gave up waiting for lock {}", key);
                ctx.checkActive();
            }

            if (heldKey == null && attempt(key)) {
                heldKey = key;
                LOGGER.debug("Acquired lock {}", key);
                return;
            }

            final Duration sleepDuration = ctx.boundTimeout(pollInterval);
            LOGGER.debug("Lock {} is held elsewhere; Retrying in {}", key, sleepDuration);
            try {
                awaitNextAttempt(ctx, sleepDuration);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandon(key);
                final var cancelled = new OperationCancelledException(
                        OperationCancelledException.Reason.CANCELLED,
                        "Interrupted while waiting for lock %s".formatted(key));
                cancelled.initCause(e);
                throw cancelled;
            }
        }
    }

    @Override
    public final boolean tryLock(final OperationContext ctx, final String key) throws LockException {
        requireNonNull(ctx, "ctx must not be null");
        requireNonNull(key, "key must not be null");
        ensureOpen();

        if (heldKey != null) {
            if (!heldKey.equals(key)) {
                throw new IllegalStateException(
                        "Handle already holds lock %s; Can not acquire %s".formatted(heldKey, key));
            }

            return false;
        }

        ctx.checkActive();

        if (attempt(key)) {
            heldKey = key;
            LOGGER.debug("Acquired lock {}", key);
            return true;
        }

        abandon(key);
        return false;
    }

    @Override
    public final void unlock(final OperationContext ctx) throws LockException {
        requireNonNull(ctx, "ctx must not be null");
        if (heldKey == null) {
            throw new IllegalStateException("Handle does not hold a lock");
        }

        final String key = heldKey;
        heldKey = null;
        release(key);
        LOGGER.debug("Released lock {}", key);
    }

    @Override
    public final Optional<String> heldKey() {
        return Optional.ofNullable(heldKey);
    }

    @Override
    public void close() throws LockException {
        if (closed) {
            return;
        }

        closed = true;
        if (heldKey != null) {
            unlock(OperationContext.background());
        }
    }

    /**
     * Sleep for {@code duration}, returning early when {@code ctx} is done.
     */
    private static void awaitNextAttempt(final OperationContext ctx, final Duration duration) throws InterruptedException {
        final long deadlineNanos = System.nanoTime() + Math.max(1, duration.toNanos());
        long remainingNanos;
        while (!ctx.isDone() && (remainingNanos = deadlineNanos - System.nanoTime()) > 0) {
            //noinspection BusyWait
            Thread.sleep(Math.max(1, TimeUnit.NANOSECONDS.toMillis(
                    Math.min(remainingNanos, CANCELLATION_CHECK_INTERVAL.toNanos()))));
        }
    }

    private boolean attempt(final String key) throws LockException {
        try {
            return attemptAcquire(key);
        } catch (LockException | RuntimeException e) {
            abandon(key);
            throw e;
        }
    }

    private void abandon(final String key) {
        if (heldKey == null) {
            abandonAcquire(key);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Handle is closed");
        }
    }

}
