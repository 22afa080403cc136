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
import org.dependencytrack.updater.common.context.OperationContext;
import org.dependencytrack.updater.distlock.DistributedLock;
import org.dependencytrack.updater.distlock.LockException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LeaseLockBackendFailureTest {

    @Test
    void shouldRequestLeaseWithConfiguredDuration() throws Exception {
        final var lockProviderMock = mock(LockProvider.class);
        final var simpleLockMock = mock(SimpleLock.class);
        when(lockProviderMock.lock(any(LockConfiguration.class))).thenReturn(Optional.of(simpleLockMock));

        final var lockProvider = new LeaseLockProvider(lockProviderMock, Duration.ofMinutes(10), Duration.ofMillis(50));
        try (final DistributedLock lock = lockProvider.newLock()) {
            assertThat(lock.tryLock(OperationContext.background(), "foo")).isTrue();
        }

        final var configCaptor = ArgumentCaptor.forClass(LockConfiguration.class);
        verify(lockProviderMock).lock(configCaptor.capture());
        assertThat(configCaptor.getValue().getName()).isEqualTo("foo");
        assertThat(configCaptor.getValue().getLockAtMostFor()).isEqualTo(Duration.ofMinutes(10));
        assertThat(configCaptor.getValue().getLockAtLeastFor()).isEqualTo(Duration.ZERO);
        verify(simpleLockMock).unlock();
    }

    @Test
    void tryLockShouldThrowLockExceptionWhenBackendFails() {
        final var lockProviderMock = mock(LockProvider.class);
        when(lockProviderMock.lock(any(LockConfiguration.class))).thenThrow(new IllegalStateException("Connection refused"));

        final DistributedLock lock = new LeaseLockProvider(lockProviderMock, Duration.ofMinutes(10), Duration.ofMillis(50)).newLock();

        assertThatExceptionOfType(LockException.class)
                .isThrownBy(() -> lock.tryLock(OperationContext.background(), "foo"))
                .withMessage("Failed to acquire lease for foo")
                .withCauseInstanceOf(IllegalStateException.class);
        assertThat(lock.heldKey()).isEmpty();
    }

    @Test
    void unlockShouldThrowLockExceptionWhenBackendFails() throws Exception {
        final var lockProviderMock = mock(LockProvider.class);
        final var simpleLockMock = mock(SimpleLock.class);
        when(lockProviderMock.lock(any(LockConfiguration.class))).thenReturn(Optional.of(simpleLockMock));
        doThrow(new IllegalStateException("Connection refused")).when(simpleLockMock).unlock();

        final DistributedLock lock = new LeaseLockProvider(lockProviderMock, Duration.ofMinutes(10), Duration.ofMillis(50)).newLock();
        lock.lock(OperationContext.background(), "foo");

        assertThatExceptionOfType(LockException.class)
                .isThrownBy(() -> lock.unlock(OperationContext.background()))
                .withMessage("Failed to release lease for foo");
        assertThat(lock.heldKey()).isEmpty();
    }

}
