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

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbc.JdbcLockProvider;
import org.dependencytrack.updater.distlock.DistributedLock;
import org.dependencytrack.updater.distlock.DistributedLockProvider;

import javax.sql.DataSource;
import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * @since 5.7.0
 */
public final class LeaseLockProvider implements DistributedLockProvider {

    public static final Duration DEFAULT_LEASE_DURATION = Duration.ofMinutes(30);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

    private final LockProvider lockProvider;
    private final Duration leaseDuration;
    private final Duration pollInterval;

    public LeaseLockProvider(
            final LockProvider lockProvider,
            final Duration leaseDuration,
            final Duration pollInterval) {
        this.lockProvider = requireNonNull(lockProvider, "lockProvider must not be null");
        this.leaseDuration = requireNonNull(leaseDuration, "leaseDuration must not be null");
        this.pollInterval = requireNonNull(pollInterval, "pollInterval must not be null");
        if (leaseDuration.isNegative() || leaseDuration.isZero()) {
            throw new IllegalArgumentException("leaseDuration must be positive");
        }
    }

    /**
     * Create a {@link LeaseLockProvider} that stores leases in the {@code shedlock} table.
     *
     * @param dataSource    The {@link DataSource} to use.
     * @param leaseDuration Maximum duration of a lease.
     * @param pollInterval  Interval in which blocked acquisitions are retried.
     * @return The {@link LeaseLockProvider}.
     */
    public static LeaseLockProvider forDataSource(
            final DataSource dataSource,
            final Duration leaseDuration,
            final Duration pollInterval) {
        return new LeaseLockProvider(new JdbcLockProvider(dataSource), leaseDuration, pollInterval);
    }

    @Override
    public DistributedLock newLock() {
        return new LeaseLock(lockProvider, leaseDuration, pollInterval);
    }

}
