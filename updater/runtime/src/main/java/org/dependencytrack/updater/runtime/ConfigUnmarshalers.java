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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.dependencytrack.updater.api.ConfigUnmarshaler;
import org.dependencytrack.updater.common.config.NamespacedConfig;
import org.eclipse.microprofile.config.Config;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Creates {@link ConfigUnmarshaler}s that map the {@code updater.<updater-name>.*} properties
 * of a {@link Config} onto the configuration objects of updaters.
 * <p>
 * Property names are interpreted as paths: {@code a.b=1} populates field {@code b} of the
 * object in field {@code a}, and {@code a[0]=x} populates the first element of the list in field {@code a}.
 * All values are provided as text; Jackson coerces them to the type of the target field.
 *
 * @since 5.7.0
 */
public final class ConfigUnmarshalers {

    private static final Pattern SEGMENT_PATTERN = Pattern.compile("^([^\\[\\]]+)((?:\\[\\d+])*)$");
    private static final Pattern INDEX_PATTERN = Pattern.compile("\\[(\\d+)]");
    static final int MAX_INDEX = 1023;

    private final Config config;
    private final ObjectMapper objectMapper;

    public ConfigUnmarshalers(final Config config) {
        this.config = requireNonNull(config, "config must not be null");
        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
                .build();
    }

    /**
     * @param updaterName Name of the updater.
     * @return A {@link ConfigUnmarshaler} for the properties of the updater with name {@code updaterName}.
     */
    public ConfigUnmarshaler forUpdater(final String updaterName) {
        requireNonNull(updaterName, "updaterName must not be null");

        final var updaterConfig = new NamespacedConfig(config, "updater." + updaterName);
        return target -> {
            requireNonNull(target, "target must not be null");

            final ObjectNode tree = toTree(updaterConfig.toMap());
            if (tree.isEmpty()) {
                return;
            }

            objectMapper.readerForUpdating(target).readValue(tree);
        };
    }

    static ObjectNode toTree(final Map<String, String> properties) throws IOException {
        final ObjectNode root = JsonNodeFactory.instance.objectNode();

        for (final Map.Entry<String, String> property : properties.entrySet()) {
            final List<Object> path = parsePath(property.getKey());

            JsonNode container = root;
            for (int i = 0; i < path.size() - 1; i++) {
                final Object token = path.get(i);
                final boolean nextIsIndex = path.get(i + 1) instanceof Integer;

                JsonNode child = getChild(container, token);
                if (child == null || child.isNull()) {
                    child = nextIsIndex
                            ? JsonNodeFactory.instance.arrayNode()
                            : JsonNodeFactory.instance.objectNode();
                    setChild(container, token, child);
                } else if (nextIsIndex ? !child.isArray() : !child.isObject()) {
                    throw new IOException("Property %s conflicts with another property".formatted(property.getKey()));
                }

                container = child;
            }

            final Object leafToken = path.get(path.size() - 1);
            final JsonNode existing = getChild(container, leafToken);
            if (existing != null && existing.isContainerNode()) {
                throw new IOException("Property %s conflicts with another property".formatted(property.getKey()));
            }

            setChild(container, leafToken, JsonNodeFactory.instance.textNode(property.getValue()));
        }

        return root;
    }

    private static List<Object> parsePath(final String propertyName) throws IOException {
        final var path = new ArrayList<Object>();

        for (final String segment : propertyName.split("\\.", -1)) {
            final Matcher segmentMatcher = SEGMENT_PATTERN.matcher(segment);
            if (!segmentMatcher.matches()) {
                throw new IOException("Invalid property name: " + propertyName);
            }

            path.add(segmentMatcher.group(1));

            final Matcher indexMatcher = INDEX_PATTERN.matcher(segmentMatcher.group(2));
            while (indexMatcher.find()) {
                final int index;
                try {
                    index = Integer.parseInt(indexMatcher.group(1));
                } catch (NumberFormatException e) {
                    throw new IOException("Invalid index in property name: " + propertyName, e);
                }
                if (index > MAX_INDEX) {
                    throw new IOException("Index of property %s exceeds the maximum of %d".formatted(
                            propertyName, MAX_INDEX));
                }

                path.add(index);
            }
        }

        return path;
    }

    private static JsonNode getChild(final JsonNode container, final Object token) {
        if (token instanceof final Integer index) {
            return index < container.size() ? container.get(index) : null;
        }

        return container.get((String) token);
    }

    private static void setChild(final JsonNode container, final Object token, final JsonNode child) {
        if (container instanceof final ArrayNode arrayNode) {
            final int index = (Integer) token;
            while (arrayNode.size() <= index) {
                arrayNode.addNull();
            }

            arrayNode.set(index, child);
        } else {
            ((ObjectNode) container).set((String) token, child);
        }
    }

}
