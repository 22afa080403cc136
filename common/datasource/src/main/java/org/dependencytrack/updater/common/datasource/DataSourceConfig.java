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

import java.nio.file.Path;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Typed access to the {@code updater.datasource.*} properties of a single data source.
 * <p>
 * The default data source is configured via {@code updater.datasource.<property>},
 * named data sources via {@code updater.datasource.<name>.<property>}.
 *
 * @since 5.7.0
 */
final class DataSourceConfig {

    static final String DEFAULT_NAME = "default";
    static final String DEFAULT_APPLICATION_NAME = "vuln-feed-updater";

    private final Config config;
    private final String name;
    private final String prefix;

    DataSourceConfig(final Config config, final String name) {
        this.config = requireNonNull(config, "config must not be null");
        this.name = requireNonNull(name, "name must not be null");
        this.prefix = DEFAULT_NAME.equals(name)
                ? "updater.datasource."
                : "updater.datasource.%s.".formatted(name);
    }

    String getName() {
        return name;
    }

    String getUrl() {
        return config.getValue(prefix + "url", String.class);
    }

    Optional<String> getUsername() {
        return config.getOptionalValue(prefix + "username", String.class);
    }

    Optional<String> getPassword() {
        return config.getOptionalValue(prefix + "password", String.class);
    }

    Optional<Path> getPasswordFilePath() {
        return config.getOptionalValue(prefix + "password-file", Path.class);
    }

    String getApplicationName() {
        return config.getOptionalValue(prefix + "application-name", String.class).orElse(DEFAULT_APPLICATION_NAME);
    }

    Optional<Long> getConnectionTimeoutMillis() {
        return config.getOptionalValue(prefix + "connection-timeout-ms", long.class);
    }

    boolean isPoolEnabled() {
        return config.getOptionalValue(prefix + "pool.enabled", boolean.class).orElse(false);
    }

    int getPoolMaxSize() {
        return config.getValue(prefix + "pool.max-size", int.class);
    }

    int getPoolMinIdle() {
        return config.getValue(prefix + "pool.min-idle", int.class);
    }

    Optional<Long> getPoolIdleTimeoutMillis() {
        return config.getOptionalValue(prefix + "pool.idle-timeout-ms", long.class);
    }

    Optional<Long> getPoolMaxLifetimeMillis() {
        return config.getOptionalValue(prefix + "pool.max-lifetime-ms", long.class);
    }

}
