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

import org.dependencytrack.updater.distlock.AbstractPollingLock;
import org.dependencytrack.updater.distlock.LockException;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * A {@link org.dependencytrack.updater.distlock.DistributedLock} backed by PostgreSQL
 * session-level advisory locks.
 * <p>
 * A grant pins a database connection for its entire lifetime, since advisory locks
 * are owned by the session that acquired them. If the holding process dies, the session
 * ends and PostgreSQL releases the lock.
 *
 * @since 5.7.0
 */
final class PostgresAdvisoryLock extends AbstractPollingLock {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresAdvisoryLock.class);

    private final Jdbi jdbi;
    private @Nullable Handle handle;

    PostgresAdvisoryLock(final Jdbi jdbi, final Duration pollInterval) {
        super(pollInterval);
        this.jdbi = requireNonNull(jdbi, "jdbi must not be null");
    }

    @Override
    protected boolean attemptAcquire(final String key) throws LockException {
        try {
            if (handle == null) {
                handle = jdbi.open();
            }

            return handle.createQuery("""
                            select pg_try_advisory_lock(:lockId)
                            """)
                    .bind("lockId", AdvisoryLockKeys.toLockId(key))
                    .mapTo(boolean.class)
                    .one();
        } catch (JdbiException e) {
            throw new LockException("Failed to acquire advisory lock for %s".formatted(key), e);
        }
    }

    @Override
    protected void abandonAcquire(final String key) {
        closeHandle();
    }

    @Override
    protected void release(final String key) throws LockException {
        if (handle == null) {
            throw new IllegalStateException("No connection is associated with lock " + key);
        }

        try {
            final boolean released = handle.createQuery("""
                            select pg_advisory_unlock(:lockId)
                            """)
                    .bind("lockId", AdvisoryLockKeys.toLockId(key))
                    .mapTo(boolean.class)
                    .one();
            if (!released) {
                // The session no longer owned the lock, e.g. because it was terminated
                // by an administrator and the pool handed out a reconnected session.
                LOGGER.warn("Advisory lock for {} was not held by the session anymore", key);
            }
        } catch (JdbiException e) {
            throw new LockException("Failed to release advisory lock for %s".formatted(key), e);
        } finally {
            closeHandle();
        }
    }

    private void closeHandle() {
        if (handle == null) {
            return;
        }

        try {
            handle.close();
        } catch (JdbiException e) {
            LOGGER.warn("Failed to close database handle", e);
        } finally {
            handle = null;
        }
    }

}
