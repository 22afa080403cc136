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
package org.dependencytrack.updater.distlock.postgres;

import org.dependencytrack.updater.distlock.DistributedLock;
import org.dependencytrack.updater.distlock.DistributedLockProvider;
import org.jdbi.v3.core.Jdbi;

import javax.sql.DataSource;
import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * @since 5.7.0
 */
public final class PostgresAdvisoryLockProvider implements DistributedLockProvider {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(500);

    private final Jdbi jdbi;
    private final Duration pollInterval;

    public PostgresAdvisoryLockProvider(final Jdbi jdbi, final Duration pollInterval) {
        this.jdbi = requireNonNull(jdbi, "jdbi must not be null");
        this.pollInterval = requireNonNull(pollInterval, "pollInterval must not be null");
    }

    public PostgresAdvisoryLockProvider(final DataSource dataSource) {
        this(Jdbi.create(dataSource), DEFAULT_POLL_INTERVAL);
    }

    @Override
    public DistributedLock newLock() {
        return new PostgresAdvisoryLock(jdbi, pollInterval);
    }

}
