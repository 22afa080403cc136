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
package org.dependencytrack.updater.runtime;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import org.eclipse.microprofile.config.Config;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Settings of an {@link UpdateManager}.
 * <p>
 * When created from {@link Config}, values are read from {@code updater.manager.*}.
 *
 * @since 5.7.0
 */
public class UpdateManagerConfig {

    /**
     * How the lock of an updater is acquired before it runs.
     */
    public enum LockMode {

        /**
         * Skip the updater if another process holds its lock.
         */
        TRY,

        /**
         * Wait for the lock, for at most {@link #lockWaitTimeout()}.
         */
        WAIT

    }

    /**
     * What to do with the records that were decoded before content turned out to be malformed.
     */
    public enum PartialResultPolicy {

        DISCARD,

        /**
         * Store the records, but keep the prior fingerprint, so that the content is fetched again.
         */
        PERSIST

    }

    static final String PREFIX = "updater.manager.";

    private LockMode lockMode = LockMode.TRY;
    private Duration lockWaitTimeout = Duration.ofMinutes(5);
    private PartialResultPolicy partialResultPolicy = PartialResultPolicy.DISCARD;
    private Duration runTimeout = Duration.ofMinutes(30);
    private int workerPoolSize = 4;
    private Set<String> enabledFactories = Set.of();
    private MeterRegistry meterRegistry = Metrics.globalRegistry;

    public static UpdateManagerConfig fromConfig(final Config config) {
        requireNonNull(config, "config must not be null");

        final var managerConfig = new UpdateManagerConfig();
        config.getOptionalValue(PREFIX + "lock-mode", String.class)
                .map(value -> LockMode.valueOf(value.toUpperCase(Locale.ROOT)))
                .ifPresent(managerConfig::setLockMode);
        config.getOptionalValue(PREFIX + "lock-wait-timeout", Duration.class)
                .ifPresent(managerConfig::setLockWaitTimeout);
        config.getOptionalValue(PREFIX + "partial-result-policy", String.class)
                .map(value -> PartialResultPolicy.valueOf(value.toUpperCase(Locale.ROOT)))
                .ifPresent(managerConfig::setPartialResultPolicy);
        config.getOptionalValue(PREFIX + "run-timeout", Duration.class)
                .ifPresent(managerConfig::setRunTimeout);
        config.getOptionalValue(PREFIX + "worker-pool-size", int.class)
                .ifPresent(managerConfig::setWorkerPoolSize);
        config.getOptionalValues(PREFIX + "factories", String.class)
                .map(Set::copyOf)
                .ifPresent(managerConfig::setEnabledFactories);
        return managerConfig;
    }

    public LockMode lockMode() {
        return lockMode;
    }

    public void setLockMode(final LockMode lockMode) {
        this.lockMode = requireNonNull(lockMode, "lockMode must not be null");
    }

    public Duration lockWaitTimeout() {
        return lockWaitTimeout;
    }

    public void setLockWaitTimeout(final Duration lockWaitTimeout) {
        this.lockWaitTimeout = requirePositive(lockWaitTimeout, "lockWaitTimeout");
    }

    public PartialResultPolicy partialResultPolicy() {
        return partialResultPolicy;
    }

    public void setPartialResultPolicy(final PartialResultPolicy partialResultPolicy) {
        this.partialResultPolicy = requireNonNull(partialResultPolicy, "partialResultPolicy must not be null");
    }

    /**
     * @return Upper bound of a single update cycle, lock acquisition included.
     */
    public Duration runTimeout() {
        return runTimeout;
    }

    public void setRunTimeout(final Duration runTimeout) {
        this.runTimeout = requirePositive(runTimeout, "runTimeout");
    }

    public int workerPoolSize() {
        return workerPoolSize;
    }

    public void setWorkerPoolSize(final int workerPoolSize) {
        if (workerPoolSize < 1) {
            throw new IllegalArgumentException("workerPoolSize must be at least 1, but is " + workerPoolSize);
        }

        this.workerPoolSize = workerPoolSize;
    }

    /**
     * @return Names of the {@link org.dependencytrack.updater.api.UpdaterFactory}s to use.
     * An empty set enables all of them.
     */
    public Set<String> enabledFactories() {
        return enabledFactories;
    }

    public void setEnabledFactories(final Set<String> enabledFactories) {
        this.enabledFactories = Set.copyOf(requireNonNull(enabledFactories, "enabledFactories must not be null"));
    }

    public MeterRegistry meterRegistry() {
        return meterRegistry;
    }

    public void setMeterRegistry(final MeterRegistry meterRegistry) {
        this.meterRegistry = requireNonNull(meterRegistry, "meterRegistry must not be null");
    }

    private static Duration requirePositive(final Duration duration, final String name) {
        requireNonNull(duration, name + " must not be null");
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("%s must be positive, but is %s".formatted(name, duration));
        }

        return duration;
    }

}
