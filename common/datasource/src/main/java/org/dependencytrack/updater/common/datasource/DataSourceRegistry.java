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

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * Lazily creates, caches, and closes {@link DataSource}s by name.
 *
 * @since 5.7.0
 */
public final class DataSourceRegistry implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(DataSourceRegistry.class);

    private final Config config;
    private final Map<String, DataSource> dataSourceByName;

    public DataSourceRegistry(final Config config) {
        this.config = requireNonNull(config, "config must not be null");
        this.dataSourceByName = new ConcurrentHashMap<>();
    }

    /**
     * @return A {@link DataSourceRegistry} backed by the global {@link Config}.
     */
    public static DataSourceRegistry fromGlobalConfig() {
        return new DataSourceRegistry(ConfigProvider.getConfig());
    }

    /**
     * Get a data source from the registry, creating it if it does not exist yet.
     *
     * @param name Name of the data source.
     * @return The data source.
     * @throws java.util.NoSuchElementException When a required property of the data source is not configured.
     */
    public DataSource get(final String name) {
        requireNonNull(name, "name must not be null");
        return dataSourceByName.computeIfAbsent(name, dataSourceName -> {
            LOGGER.info("Creating data source {}", dataSourceName);
            return DataSourceFactory.createDataSource(new DataSourceConfig(config, dataSourceName));
        });
    }

    public DataSource getDefault() {
        return get(DataSourceConfig.DEFAULT_NAME);
    }

    /**
     * Removes a data source from the registry and closes it.
     *
     * @param name Name of the data source to close.
     */
    public void close(final String name) {
        final DataSource dataSource = dataSourceByName.remove(name);
        if (dataSource == null) {
            return;
        }

        LOGGER.info("Closing data source {}", name);
        if (dataSource instanceof final Closeable closeable) {
            try {
                closeable.close();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to close data source " + name, e);
            }
        }
    }

    @Override
    public void close() {
        dataSourceByName.keySet().forEach(this::close);
    }

    Set<String> getNames() {
        return Set.copyOf(dataSourceByName.keySet());
    }

}
