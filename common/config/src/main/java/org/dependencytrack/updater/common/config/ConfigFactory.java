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
package org.dependencytrack.updater.common.config;

import io.smallrye.config.ExpressionConfigSourceInterceptor;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.ProfileConfigSourceInterceptor;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.SmallRyeConfigFactory;
import io.smallrye.config.SmallRyeConfigProviderResolver;

import java.util.List;
import java.util.Map;

/**
 * Assembles the {@link SmallRyeConfig} used by updater processes.
 * <p>
 * Registered via {@code META-INF/services/io.smallrye.config.SmallRyeConfigFactory},
 * such that {@code ConfigProvider.getConfig()} yields a config built by this factory.
 *
 * @since 5.7.0
 */
public final class ConfigFactory extends SmallRyeConfigFactory {

    static final List<String> PROFILES = List.of("prod", "dev", "test");

    @Override
    public SmallRyeConfig getConfigFor(
            final SmallRyeConfigProviderResolver configProviderResolver,
            final ClassLoader classLoader) {
        return newBuilder(classLoader)
                // System properties (400), environment variables (300), .env file (295),
                // config/application.properties (260), classpath application.properties (250),
                // and META-INF/microprofile-config.properties (100).
                .addDefaultSources()
                .addDiscoveredSources()
                .addDiscoveredCustomizers()
                .build();
    }

    /**
     * Builds a config that consists <em>only</em> of the given properties.
     * <p>
     * Expressions and profiles are still evaluated, which makes the result suitable
     * for embedding, and for tests that must not pick up ambient system properties.
     *
     * @param properties The properties to expose.
     * @return A {@link SmallRyeConfig}.
     */
    public static SmallRyeConfig fromProperties(final Map<String, String> properties) {
        return newBuilder(ConfigFactory.class.getClassLoader())
                .withSources(new PropertiesConfigSource(properties, "in-memory", 500))
                .build();
    }

    private static SmallRyeConfigBuilder newBuilder(final ClassLoader classLoader) {
        return new SmallRyeConfigBuilder()
                .forClassLoader(classLoader)
                // https://smallrye.io/smallrye-config/Main/config/expressions/
                .withInterceptors(new ExpressionConfigSourceInterceptor())
                // https://smallrye.io/smallrye-config/Main/config/profiles/
                .withInterceptors(new ProfileConfigSourceInterceptor(PROFILES));
    }

}
