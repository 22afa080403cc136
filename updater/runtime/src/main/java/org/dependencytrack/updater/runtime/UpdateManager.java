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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.dependencytrack.updater.api.ConfigUnmarshaler;
import org.dependencytrack.updater.api.Configurable;
import org.dependencytrack.updater.api.FetchResult;
import org.dependencytrack.updater.api.Fingerprint;
import org.dependencytrack.updater.api.MalformedContentException;
import org.dependencytrack.updater.api.Updater;
import org.dependencytrack.updater.api.UpdaterConfigurationException;
import org.dependencytrack.updater.api.UpdaterFactory;
import org.dependencytrack.updater.api.UpdaterFetchException;
import org.dependencytrack.updater.api.VulnerabilityRecord;
import org.dependencytrack.updater.common.context.OperationCancelledException;
import org.dependencytrack.updater.common.context.OperationContext;
import org.dependencytrack.updater.distlock.DistributedLock;
import org.dependencytrack.updater.distlock.DistributedLockProvider;
import org.dependencytrack.updater.distlock.LockException;
import org.dependencytrack.updater.runtime.UpdateManagerConfig.LockMode;
import org.dependencytrack.updater.runtime.UpdateManagerConfig.PartialResultPolicy;
import org.dependencytrack.updater.runtime.persistence.UpdaterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Runs update cycles of {@link Updater}s.
 * <p>
 * A cycle acquires the distributed lock of the updater, configures the updater if necessary,
 * fetches content, and, if the content changed, parses and stores it along with its new {@link Fingerprint}.
 * At most one cycle per updater runs at a time across all processes sharing the lock backend.
 *
 * @since 5.7.0
 */
public final class UpdateManager implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(UpdateManager.class);

    private final UpdaterStore store;
    private final DistributedLockProvider lockProvider;
    private final HttpClient httpClient;
    private final Function<String, ConfigUnmarshaler> unmarshalerFactory;
    private final Supplier<List<UpdaterFactory>> factoriesSupplier;
    private final UpdateManagerConfig config;
    private final MeterRegistry meterRegistry;
    private final Set<Updater> configuredUpdaters = ConcurrentHashMap.newKeySet();
    private final ExecutorService executor;
    private volatile List<Updater> updaters;

    public UpdateManager(
            final UpdaterStore store,
            final DistributedLockProvider lockProvider,
            final HttpClient httpClient,
            final Function<String, ConfigUnmarshaler> unmarshalerFactory,
            final UpdateManagerConfig config) {
        this(store, lockProvider, httpClient, unmarshalerFactory, config, UpdateManager::loadFactories);
    }

    UpdateManager(
            final UpdaterStore store,
            final DistributedLockProvider lockProvider,
            final HttpClient httpClient,
            final Function<String, ConfigUnmarshaler> unmarshalerFactory,
            final UpdateManagerConfig config,
            final Supplier<List<UpdaterFactory>> factoriesSupplier) {
        this.store = requireNonNull(store, "store must not be null");
        this.lockProvider = requireNonNull(lockProvider, "lockProvider must not be null");
        this.httpClient = requireNonNull(httpClient, "httpClient must not be null");
        this.unmarshalerFactory = requireNonNull(unmarshalerFactory, "unmarshalerFactory must not be null");
        this.config = requireNonNull(config, "config must not be null");
        this.factoriesSupplier = requireNonNull(factoriesSupplier, "factoriesSupplier must not be null");
        this.meterRegistry = config.meterRegistry();
        this.executor = Executors.newFixedThreadPool(config.workerPoolSize(), new BasicThreadFactory.Builder()
                .namingPattern("UpdateManager-Worker-%d")
                .daemon(true)
                .build());
        new ExecutorServiceMetrics(executor, "updater.manager", null)
                .bindTo(meterRegistry);
    }

    /**
     * Run a single update cycle of {@code updater} on the calling thread.
     * <p>
     * Failures are reported via the returned {@link UpdateOutcome}, not thrown.
     *
     * @param ctx     The context of the cycle.
     * @param updater The {@link Updater} to run.
     * @return The {@link UpdateOutcome} of the cycle.
     */
    public UpdateOutcome run(final OperationContext ctx, final Updater updater) {
        requireNonNull(ctx, "ctx must not be null");
        requireNonNull(updater, "updater must not be null");

        final String updaterName = updater.name();
        final OperationContext runCtx = ctx.withTimeout(config.runTimeout());
        final Timer.Sample timerSample = Timer.start(meterRegistry);

        UpdateOutcome outcome;
        try (var ignoredMdcUpdater = MDC.putCloseable("updater", updaterName)) {
            outcome = runLocked(runCtx, updater);
        } catch (LockException e) {
            LOGGER.error("Failed to coordinate update of {} via lock backend", updaterName, e);
            outcome = UpdateOutcome.failed(updaterName, e);
        } catch (OperationCancelledException e) {
            LOGGER.warn("Update of {} was cancelled ({})", updaterName, e.reason(), e);
            outcome = UpdateOutcome.failed(updaterName, e);
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected failure during update of {}", updaterName, e);
            outcome = UpdateOutcome.failed(updaterName, e);
        } finally {
            timerSample.stop(Timer.builder("updater.run.duration")
                    .tag("updater", updaterName)
                    .register(meterRegistry));
        }

        Counter.builder("updater.runs")
                .tag("updater", updaterName)
                .tag("status", outcome.status().name())
                .register(meterRegistry)
                .increment();

        return outcome;
    }

    /**
     * Run a single update cycle of all discovered updaters, using the manager's worker pool.
     *
     * @param ctx The context of the cycles.
     * @return The {@link UpdateOutcome}s, keyed by updater name.
     * @throws OperationCancelledException When interrupted while waiting for cycles to complete.
     */
    public Map<String, UpdateOutcome> runAll(final OperationContext ctx) {
        requireNonNull(ctx, "ctx must not be null");

        final var futureByUpdaterName = new LinkedHashMap<String, Future<UpdateOutcome>>();
        for (final Updater updater : updaters()) {
            futureByUpdaterName.put(updater.name(), executor.submit(() -> run(ctx, updater)));
        }

        final var outcomeByUpdaterName = new LinkedHashMap<String, UpdateOutcome>(futureByUpdaterName.size());
        for (final Map.Entry<String, Future<UpdateOutcome>> entry : futureByUpdaterName.entrySet()) {
            final String updaterName = entry.getKey();
            try {
                outcomeByUpdaterName.put(updaterName, entry.getValue().get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futureByUpdaterName.values().forEach(future -> future.cancel(true));
                final var cancelled = new OperationCancelledException(
                        OperationCancelledException.Reason.CANCELLED,
                        "Interrupted while waiting for updaters to complete");
                cancelled.initCause(e);
                throw cancelled;
            } catch (ExecutionException e) {
                outcomeByUpdaterName.put(updaterName, UpdateOutcome.failed(updaterName, e.getCause()));
            }
        }

        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("Completed update cycle of {} updaters: {}", outcomeByUpdaterName.size(),
                    outcomeByUpdaterName.values().stream()
                            .map(outcome -> outcome.updater() + "=" + outcome.status())
                            .toList());
        }

        return outcomeByUpdaterName;
    }

    /**
     * @return The updaters of all enabled {@link UpdaterFactory}s, created on first access.
     * @throws IllegalStateException When multiple updaters share the same name.
     */
    public List<Updater> updaters() {
        List<Updater> result = updaters;
        if (result == null) {
            synchronized (this) {
                result = updaters;
                if (result == null) {
                    result = createUpdaters();
                    updaters = result;
                }
            }
        }

        return result;
    }

    @Override
    public void close() {
        LOGGER.info("Waiting for workers to stop");
        executor.shutdown();
        try {
            final boolean terminated = executor.awaitTermination(30, TimeUnit.SECONDS);
            if (!terminated) {
                LOGGER.warn("Workers did not stop in time; Interrupting them");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    private UpdateOutcome runLocked(final OperationContext ctx, final Updater updater) throws LockException {
        final String updaterName = updater.name();

        try (final DistributedLock lock = lockProvider.newLock()) {
            if (!acquireLock(ctx, lock, updaterName)) {
                LOGGER.info("Lock of {} is held by another process; Skipping", updaterName);
                return UpdateOutcome.skipped(updaterName);
            }

            try {
                return update(ctx, updater);
            } finally {
                // The cycle's context may already be done at this point.
                lock.unlock(OperationContext.background());
            }
        }
    }

    private boolean acquireLock(
            final OperationContext ctx,
            final DistributedLock lock,
            final String updaterName) throws LockException {
        if (config.lockMode() == LockMode.TRY) {
            return lock.tryLock(ctx, updaterName);
        }

        final OperationContext lockCtx = ctx.withTimeout(config.lockWaitTimeout());
        try {
            lock.lock(lockCtx, updaterName);
            return true;
        } catch (OperationCancelledException e) {
            if (ctx.isDone()) {
                throw e;
            }

            // Only the wait timed out, not the cycle itself.
            return false;
        }
    }

    private UpdateOutcome update(final OperationContext ctx, final Updater updater) {
        final String updaterName = updater.name();

        if (updater instanceof final Configurable configurable && !configuredUpdaters.contains(updater)) {
            try {
                configurable.configure(ctx, unmarshalerFactory.apply(updaterName), httpClient);
                configuredUpdaters.add(updater);
            } catch (UpdaterConfigurationException e) {
                LOGGER.error("Failed to configure {}", updaterName, e);
                return UpdateOutcome.failed(updaterName, e);
            }
        }

        final Fingerprint priorFingerprint = store.getFingerprint(updaterName);

        final FetchResult fetchResult;
        try {
            fetchResult = updater.fetch(ctx, priorFingerprint);
        } catch (UpdaterFetchException e) {
            LOGGER.warn("Failed to fetch content of {}", updaterName, e);
            return UpdateOutcome.failed(updaterName, e);
        }

        if (!(fetchResult instanceof final FetchResult.Updated updated)) {
            LOGGER.info("Content of {} did not change since {}", updaterName, priorFingerprint);
            return UpdateOutcome.unchanged(updaterName);
        }

        try {
            return store(ctx, updater, updated);
        } finally {
            try {
                updated.close();
            } catch (IOException e) {
                LOGGER.warn("Failed to close content of {}", updaterName, e);
            }
        }
    }

    private UpdateOutcome store(final OperationContext ctx, final Updater updater, final FetchResult.Updated updated) {
        final String updaterName = updater.name();

        final List<VulnerabilityRecord> records;
        try {
            records = updater.parse(ctx, updated.content());
        } catch (MalformedContentException e) {
            return handleMalformedContent(updaterName, e);
        }

        store.storeUpdate(updaterName, updated.fingerprint(), records);
        LOGGER.info("Stored {} records of {}; Fingerprint is now {}", records.size(), updaterName, updated.fingerprint());
        return UpdateOutcome.updated(updaterName, records.size());
    }

    private UpdateOutcome handleMalformedContent(final String updaterName, final MalformedContentException e) {
        final List<VulnerabilityRecord> partialRecords = e.partialRecords();

        if (config.partialResultPolicy() == PartialResultPolicy.DISCARD || partialRecords.isEmpty()) {
            LOGGER.error("Content of {} is malformed; Discarding {} records decoded before the failure",
                    updaterName, partialRecords.size(), e);
            return UpdateOutcome.failed(updaterName, e);
        }

        store.storeRecords(updaterName, partialRecords);
        LOGGER.warn("""
                Content of {} is malformed; Stored {} records decoded before the failure, \
                but kept the prior fingerprint""", updaterName, partialRecords.size(), e);
        return UpdateOutcome.partial(updaterName, partialRecords.size(), e);
    }

    private List<Updater> createUpdaters() {
        final Set<String> enabledFactories = config.enabledFactories();
        final var seenFactories = new HashSet<String>();
        final var seenUpdaters = new HashSet<String>();
        final var result = new ArrayList<Updater>();

        for (final UpdaterFactory factory : factoriesSupplier.get()) {
            seenFactories.add(factory.name());
            if (!enabledFactories.isEmpty() && !enabledFactories.contains(factory.name())) {
                LOGGER.debug("Factory {} is not enabled", factory.name());
                continue;
            }

            for (final Updater updater : factory.createUpdaters()) {
                if (!seenUpdaters.add(updater.name())) {
                    throw new IllegalStateException(
                            "Multiple updaters with name %s were created".formatted(updater.name()));
                }

                result.add(updater);
            }
        }

        for (final String enabledFactory : enabledFactories) {
            if (!seenFactories.contains(enabledFactory)) {
                LOGGER.warn("Factory {} is enabled, but not available", enabledFactory);
            }
        }

        LOGGER.info("Discovered {} updaters", result.size());
        return Collections.unmodifiableList(result);
    }

    private static List<UpdaterFactory> loadFactories() {
        return ServiceLoader.load(UpdaterFactory.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();
    }

}
