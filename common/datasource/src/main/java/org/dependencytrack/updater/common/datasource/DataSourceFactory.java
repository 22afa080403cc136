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
package org.dependencytrack.updater.common.datasource;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.micrometer.core.instrument.Metrics;
import org.postgresql.ds.PGSimpleDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * @since 5.7.0
 */
final class DataSourceFactory {

    private DataSourceFactory() {
    }

    static DataSource createDataSource(final DataSourceConfig config) {
        if (!config.isPoolEnabled()) {
            return createSimpleDataSource(config);
        }

        final var hikariConfig = new HikariConfig();
        hikariConfig.setPoolName(config.getName());
        hikariConfig.setJdbcUrl(config.getUrl());
        hikariConfig.setMaximumPoolSize(config.getPoolMaxSize());
        hikariConfig.setMinimumIdle(config.getPoolMinIdle());
        hikariConfig.setMetricRegistry(Metrics.globalRegistry);
        hikariConfig.addDataSourceProperty("ApplicationName", config.getApplicationName());
        config.getUsername().ifPresent(hikariConfig::setUsername);
        getPassword(config).ifPresent(hikariConfig::setPassword);
        config.getConnectionTimeoutMillis().ifPresent(hikariConfig::setConnectionTimeout);
        config.getPoolIdleTimeoutMillis().ifPresent(hikariConfig::setIdleTimeout);
        config.getPoolMaxLifetimeMillis().ifPresent(hikariConfig::setMaxLifetime);
        return new HikariDataSource(hikariConfig);
    }

    private static DataSource createSimpleDataSource(final DataSourceConfig config) {
        // Session-scoped advisory locks are bound to the physical connection,
        // which is why a plain data source is sufficient for lock handles.
        final var dataSource = new PGSimpleDataSource();
        dataSource.setUrl(config.getUrl());
        dataSource.setApplicationName(config.getApplicationName());
        config.getUsername().ifPresent(dataSource::setUser);
        getPassword(config).ifPresent(dataSource::setPassword);
        config.getConnectionTimeoutMillis()
                .map(TimeUnit.MILLISECONDS::toSeconds)
                .map(Math::toIntExact)
                .ifPresent(dataSource::setConnectTimeout);
        return dataSource;
    }

    private static Optional<String> getPassword(final DataSourceConfig config) {
        final Path passwordFilePath = config.getPasswordFilePath().orElse(null);
        if (passwordFilePath == null) {
            return config.getPassword();
        }

        try {
            return Optional.of(Files.readString(passwordFilePath).trim());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read password file " + passwordFilePath, e);
        }
    }

}
