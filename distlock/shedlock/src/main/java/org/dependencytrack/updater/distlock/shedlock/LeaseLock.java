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
package org.dependencytrack.updater.distlock.shedlock;

import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.core.SimpleLock;
import org.dependencytrack.updater.distlock.AbstractPollingLock;
import org.dependencytrack.updater.distlock.LockException;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A {@link org.dependencytrack.updater.distlock.DistributedLock} backed by a ShedLock {@link LockProvider}.
 * <p>
 * Grants are leases: they expire after the configured lease duration, even when
 * the holder never releases them. Holders must finish their work within the lease duration,
 * otherwise another process may acquire the lock concurrently.
 *
 * @since 5.7.0
 */
final class LeaseLock extends AbstractPollingLock {

    private final LockProvider lockProvider;
    private final Duration leaseDuration;
    private @Nullable SimpleLock lease;

    LeaseLock(final LockProvider lockProvider, final Duration leaseDuration, final Duration pollInterval) {
        super(pollInterval);
        this.lockProvider = requireNonNull(lockProvider, "lockProvider must not be null");
        this.leaseDuration = requireNonNull(leaseDuration, "leaseDuration must not be null");
    }

    @Override
    protected boolean attemptAcquire(final String key) throws LockException {
        final var lockConfig = new LockConfiguration(Instant.now(), key, leaseDuration, Duration.ZERO);

        final Optional<SimpleLock> acquired;
        try {
            acquired = lockProvider.lock(lockConfig);
        } catch (RuntimeException e) {
            throw new LockException("Failed to acquire lease for %s".formatted(key), e);
        }

        acquired.ifPresent(simpleLock -> this.lease = simpleLock);
        return acquired.isPresent();
    }

    @Override
    protected void release(final String key) throws LockException {
        if (lease == null) {
            throw new IllegalStateException("No lease is associated with lock " + key);
        }

        try {
            lease.unlock();
        } catch (RuntimeException e) {
            throw new LockException("Failed to release lease for %s".formatted(key), e);
        } finally {
            lease = null;
        }
    }

}
