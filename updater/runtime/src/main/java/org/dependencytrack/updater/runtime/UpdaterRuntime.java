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

import org.dependencytrack.updater.common.context.OperationContext;
import org.dependencytrack.updater.common.datasource.DataSourceRegistry;
import org.dependencytrack.updater.distlock.DistributedLockProvider;
import org.dependencytrack.updater.distlock.postgres.PostgresAdvisoryLockProvider;
import org.dependencytrack.updater.distlock.shedlock.LeaseLockProvider;
import org.dependencytrack.updater.runtime.persistence.JdbiUpdaterStore;
import org.dependencytrack.updater.support.liquibase.MigrationExecutor;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Wires an {@link UpdateManager} from {@link Config}.
 * <p>
 * Relevant properties:
 * <ul>
 *     <li>{@code updater.datasource.*}: the PostgreSQL database that holds results and locks</li>
 *     <li>{@code updater.database.migrate}: whether to apply the schema on startup (default {@code true})</li>
 *     <li>{@code updater.lock.backend}: {@code postgres} (advisory locks, default) or {@code lease}</li>
 *     <li>{@code updater.lock.poll-interval}, {@code updater.lock.lease-duration}</li>
 *     <li>{@code updater.manager.*}: see {@link UpdateManagerConfig}</li>
 *     <li>{@code updater.<updater-name>.*}: configuration of individual updaters</li>
 * </ul>
 *
 * @since 5.7.0
 */
public final class UpdaterRuntime implements AutoCloseable {

    enum LockBackend {
        POSTGRES,
        LEASE
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(UpdaterRuntime.class);

    private final DataSourceRegistry dataSourceRegistry;
    private final UpdateManager updateManager;

    private UpdaterRuntime(final DataSourceRegistry dataSourceRegistry, final UpdateManager updateManager) {
        this.dataSourceRegistry = dataSourceRegistry;
        this.updateManager = updateManager;
    }

    /**
     * @return An {@link UpdaterRuntime} configured by {@link ConfigProvider#getConfig()}.
     */
    public static UpdaterRuntime fromGlobalConfig() {
        return create(ConfigProvider.getConfig());
    }

    public static UpdaterRuntime create(final Config config) {
        requireNonNull(config, "config must not be null");

        final var dataSourceRegistry = new DataSourceRegistry(config);
        try {
            final DataSource dataSource = dataSourceRegistry.getDefault();

            if (config.getOptionalValue("updater.database.migrate", boolean.class).orElse(true)) {
                LOGGER.info("Applying database migrations");
                new MigrationExecutor(dataSource, JdbiUpdaterStore.CHANGELOG_PATH)
                        .withChangeLogTableName("UPDATER_DATABASECHANGELOG")
                        .withChangeLogLockTableName("UPDATER_DATABASECHANGELOGLOCK")
                        .executeMigration();
            }

            final var updateManager = new UpdateManager(
                    new JdbiUpdaterStore(dataSource),
                    createLockProvider(config, dataSource),
                    HttpClients.create(config),
                    new ConfigUnmarshalers(config)::forUpdater,
                    UpdateManagerConfig.fromConfig(config));

            return new UpdaterRuntime(dataSourceRegistry, updateManager);
        } catch (RuntimeException e) {
            dataSourceRegistry.close();
            throw e;
        }
    }

    public UpdateManager updateManager() {
        return updateManager;
    }

    /**
     * Run a single update cycle of all updaters.
     *
     * @return The {@link UpdateOutcome}s, keyed by updater name.
     */
    public Map<String, UpdateOutcome> runOnce() {
        return updateManager.runAll(OperationContext.background());
    }

    @Override
    public void close() {
        updateManager.close();
        dataSourceRegistry.close();
    }

    static DistributedLockProvider createLockProvider(final Config config, final DataSource dataSource) {
        final LockBackend backend = config.getOptionalValue("updater.lock.backend", String.class)
                .map(value -> LockBackend.valueOf(value.toUpperCase(Locale.ROOT)))
                .orElse(LockBackend.POSTGRES);

        return switch (backend) {
            case POSTGRES -> new PostgresAdvisoryLockProvider(
                    Jdbi.create(dataSource),
                    config.getOptionalValue("updater.lock.poll-interval", Duration.class)
                            .orElse(PostgresAdvisoryLockProvider.DEFAULT_POLL_INTERVAL));
            case LEASE -> LeaseLockProvider.forDataSource(
                    dataSource,
                    config.getOptionalValue("updater.lock.lease-duration", Duration.class)
                            .orElse(LeaseLockProvider.DEFAULT_LEASE_DURATION),
                    config.getOptionalValue("updater.lock.poll-interval", Duration.class)
                            .orElse(LeaseLockProvider.DEFAULT_POLL_INTERVAL));
        };
    }

}
