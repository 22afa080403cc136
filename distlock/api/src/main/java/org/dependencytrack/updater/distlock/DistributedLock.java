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

import java.util.Optional;

/**
 * A handle to a mutual-exclusion primitive that is visible across processes.
 * <p>
 * A handle represents at most one grant at a time, and is <em>not</em> reentrant:
 * requesting the key it already holds behaves exactly like contention with another process.
 * Handles are meant to be used by a single thread, and are not safe for concurrent use.
 *
 * @since 5.7.0
 */
public interface DistributedLock extends AutoCloseable {

    /**
     * Block until exclusive ownership of {@code key} is granted.
     *
     * @param ctx The context bounding the wait.
     * @param key Key of the lock.
     * @throws OperationCancelledException When {@code ctx} is cancelled, or its deadline passes,
     *                                     before the lock was granted. Nothing is held in that case.
     * @throws IllegalStateException       When this handle already holds a grant for a different key.
     * @throws LockException               When the lock backend failed.
     */
    void lock(OperationContext ctx, String key) throws LockException;

    /**
     * Attempt to acquire exclusive ownership of {@code key} without waiting.
     *
     * @param ctx The context of the operation.
     * @param key Key of the lock.
     * @return {@code true} when the lock was granted, {@code false} when it is held elsewhere
     * (including by this very handle).
     * @throws IllegalStateException When this handle already holds a grant for a different key.
     * @throws LockException         When the lock backend failed.
     */
    boolean tryLock(OperationContext ctx, String key) throws LockException;

    /**
     * Release the outstanding grant of this handle.
     *
     * @param ctx The context of the operation.
     * @throws IllegalStateException When this handle does not hold a grant.
     * @throws LockException         When the lock backend failed to release the grant.
     */
    void unlock(OperationContext ctx) throws LockException;

    /**
     * @return Key of the currently held grant, if any.
     */
    Optional<String> heldKey();

    /**
     * Release the outstanding grant, if any, as well as all backend resources of this handle.
     */
    @Override
    void close() throws LockException;

}
