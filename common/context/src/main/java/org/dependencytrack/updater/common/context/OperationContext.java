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
package org.dependencytrack.updater.common.context;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Carries the cancellation signal and deadline of an operation across API boundaries.
 * <p>
 * Contexts form a tree: a context derived via {@link #withTimeout(Duration)} or
 * {@link #withDeadline(Instant)} never outlives its parent. Its deadline is the earlier of
 * the requested one and the parent's, and cancelling the parent cancels all of its descendants.
 * Cancelling a derived context does not affect its parent.
 * <p>
 * Blocking operations accepting a context are expected to call {@link #checkActive()}
 * before, and to bound their waits by {@link #boundTimeout(Duration)}.
 *
 * @since 5.7.0
 */
public final class OperationContext {

    private final @Nullable OperationContext parent;
    private final @Nullable Instant deadline;
    private volatile boolean cancelled;

    private OperationContext(final @Nullable OperationContext parent, final @Nullable Instant deadline) {
        this.parent = parent;
        this.deadline = deadline;
    }

    /**
     * @return A new root context without deadline.
     */
    public static OperationContext background() {
        return new OperationContext(null, null);
    }

    public static OperationContext ofTimeout(final Duration timeout) {
        return background().withTimeout(timeout);
    }

    public OperationContext withTimeout(final Duration timeout) {
        requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }

        return withDeadline(Instant.now().plus(timeout));
    }

    public OperationContext withDeadline(final Instant deadline) {
        requireNonNull(deadline, "deadline must not be null");

        final Instant parentDeadline = this.deadline().orElse(null);
        final Instant effectiveDeadline = parentDeadline != null && parentDeadline.isBefore(deadline)
                ? parentDeadline
                : deadline;

        return new OperationContext(this, effectiveDeadline);
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * @return The time left until the deadline, or empty if this context has no deadline.
     * Never negative.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }

        final Duration remaining = Duration.between(Instant.now(), deadline);
        return Optional.of(remaining.isNegative() ? Duration.ZERO : remaining);
    }

    /**
     * @param timeout The timeout an operation would like to apply.
     * @return The smaller of {@code timeout} and the time remaining until the deadline.
     */
    public Duration boundTimeout(final Duration timeout) {
        requireNonNull(timeout, "timeout must not be null");

        return remaining()
                .filter(remaining -> remaining.compareTo(timeout) < 0)
                .orElse(timeout);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (parent != null && parent.isCancelled());
    }

    public boolean isDeadlineExceeded() {
        return deadline != null && !Instant.now().isBefore(deadline);
    }

    public boolean isDone() {
        return isCancelled() || isDeadlineExceeded();
    }

    /**
     * @throws OperationCancelledException When this context is cancelled, or its deadline has passed.
     */
    public void checkActive() {
        if (isCancelled()) {
            throw new OperationCancelledException(
                    OperationCancelledException.Reason.CANCELLED, "Operation was cancelled");
        }
        if (isDeadlineExceeded()) {
            throw new OperationCancelledException(
                    OperationCancelledException.Reason.DEADLINE_EXCEEDED,
                    "Deadline of %s exceeded".formatted(deadline));
        }
    }

    @Override
    public String toString() {
        return "OperationContext{deadline=%s, cancelled=%s}".formatted(deadline, isCancelled());
    }

}
