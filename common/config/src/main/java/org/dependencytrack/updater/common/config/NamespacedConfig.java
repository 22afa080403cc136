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

import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigValue;
import org.eclipse.microprofile.config.spi.ConfigSource;
import org.eclipse.microprofile.config.spi.Converter;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

import static java.util.Objects.requireNonNull;

/**
 * A {@link Config} view that only exposes properties below a given namespace,
 * e.g. {@code updater.aws-linux2-updater}.
 * <p>
 * Property names are resolved relative to the namespace, while expressions
 * are still evaluated against the complete delegate.
 *
 * @since 5.7.0
 */
public final class NamespacedConfig implements Config {

    private final Config delegate;
    private final String prefix;

    public NamespacedConfig(final Config delegate, final String namespace) {
        this.delegate = requireNonNull(delegate, "delegate must not be null");
        requireNonNull(namespace, "namespace must not be null");
        if (namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }

        this.prefix = namespace.endsWith(".") ? namespace : namespace + ".";
    }

    /**
     * @param name Name of the nested namespace.
     * @return A {@link NamespacedConfig} for {@code <this namespace>.<name>}.
     */
    public NamespacedConfig child(final String name) {
        return new NamespacedConfig(delegate, prefix + requireNonNull(name, "name must not be null"));
    }

    public String namespace() {
        return prefix.substring(0, prefix.length() - 1);
    }

    /**
     * @return {@code true} when no property exists below this namespace.
     */
    public boolean isEmpty() {
        return propertyNames().isEmpty();
    }

    /**
     * Resolves all properties below this namespace as raw strings, keyed by their relative name.
     * <p>
     * Properties that are defined, but resolve to no value (e.g. empty strings), are omitted.
     *
     * @return A sorted {@link Map} of relative property names to values.
     */
    public Map<String, String> toMap() {
        final var values = new TreeMap<String, String>();
        for (final String name : propertyNames()) {
            getOptionalValue(name, String.class).ifPresent(value -> values.put(name, value));
        }

        return values;
    }

    @Override
    public <T> T getValue(final String propertyName, final Class<T> propertyType) {
        return delegate.getValue(prefix + propertyName, propertyType);
    }

    @Override
    public ConfigValue getConfigValue(final String propertyName) {
        return delegate.getConfigValue(prefix + propertyName);
    }

    @Override
    public <T> Optional<T> getOptionalValue(final String propertyName, final Class<T> propertyType) {
        return delegate.getOptionalValue(prefix + propertyName, propertyType);
    }

    @Override
    public <T> List<T> getValues(final String propertyName, final Class<T> propertyType) {
        // Delegated so that indexed properties (name[0], name[1], ...) are understood.
        return delegate.getValues(prefix + propertyName, propertyType);
    }

    @Override
    public <T> Optional<List<T>> getOptionalValues(final String propertyName, final Class<T> propertyType) {
        return delegate.getOptionalValues(prefix + propertyName, propertyType);
    }

    @Override
    public Iterable<String> getPropertyNames() {
        return propertyNames();
    }

    @Override
    public Iterable<ConfigSource> getConfigSources() {
        return delegate.getConfigSources();
    }

    @Override
    public <T> Optional<Converter<T>> getConverter(final Class<T> forType) {
        return delegate.getConverter(forType);
    }

    @Override
    public <T> T unwrap(final Class<T> type) {
        if (type.isInstance(this)) {
            return type.cast(this);
        }

        return delegate.unwrap(type);
    }

    private Set<String> propertyNames() {
        return StreamSupport.stream(delegate.getPropertyNames().spliterator(), false)
                .filter(name -> name.startsWith(prefix))
                .map(name -> name.substring(prefix.length()))
                .filter(name -> !name.isEmpty())
                .collect(Collectors.toSet());
    }

}
