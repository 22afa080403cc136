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
package org.dependencytrack.updater.api;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A normalized vulnerability, describing how a single advisory affects a single package.
 *
 * @param updater            Name of the {@link Updater} that produced the record.
 * @param name               Identifier of the vulnerability, e.g. {@code ALAS2-2023-1234}.
 * @param description        Free-form description.
 * @param issued             When the advisory was issued.
 * @param links              Reference links, separated by a single space.
 * @param severity           Severity label as published by the source.
 * @param normalizedSeverity Severity on the {@link Severity} scale.
 * @param distribution       The affected distribution.
 * @param affectedPackage    The affected package.
 * @param fixedInVersion     Version the vulnerability was fixed in, or empty if it is not fixed yet.
 * @since 5.7.0
 */
public record VulnerabilityRecord(
        String updater,
        String name,
        String description,
        Instant issued,
        String links,
        String severity,
        Severity normalizedSeverity,
        Distribution distribution,
        AffectedPackage affectedPackage,
        String fixedInVersion) {

    public VulnerabilityRecord {
        requireNonNull(updater, "updater must not be null");
        requireNonNull(name, "name must not be null");
        requireNonNull(issued, "issued must not be null");
        requireNonNull(normalizedSeverity, "normalizedSeverity must not be null");
        requireNonNull(distribution, "distribution must not be null");
        requireNonNull(affectedPackage, "affectedPackage must not be null");
        description = description != null ? description : "";
        links = links != null ? links.trim() : "";
        severity = severity != null ? severity : "";
        fixedInVersion = fixedInVersion != null ? fixedInVersion : "";
    }

    /**
     * @return The distinct reference links of this record, in their original order.
     */
    public Set<String> linkSet() {
        if (links.isEmpty()) {
            return Set.of();
        }

        return Arrays.stream(links.split("\\s+"))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public boolean isFixed() {
        return !fixedInVersion.isEmpty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .updater(updater)
                .name(name)
                .description(description)
                .issued(issued)
                .links(links)
                .severity(severity)
                .normalizedSeverity(normalizedSeverity)
                .distribution(distribution)
                .affectedPackage(affectedPackage)
                .fixedInVersion(fixedInVersion);
    }

    public static final class Builder {

        private String updater;
        private String name;
        private String description;
        private Instant issued;
        private String links;
        private String severity;
        private Severity normalizedSeverity = Severity.UNKNOWN;
        private Distribution distribution;
        private AffectedPackage affectedPackage;
        private String fixedInVersion;

        private Builder() {
        }

        public Builder updater(final String updater) {
            this.updater = updater;
            return this;
        }

        public Builder name(final String name) {
            this.name = name;
            return this;
        }

        public Builder description(final String description) {
            this.description = description;
            return this;
        }

        public Builder issued(final Instant issued) {
            this.issued = issued;
            return this;
        }

        public Builder links(final String links) {
            this.links = links;
            return this;
        }

        public Builder severity(final String severity) {
            this.severity = severity;
            return this;
        }

        public Builder normalizedSeverity(final Severity normalizedSeverity) {
            this.normalizedSeverity = normalizedSeverity;
            return this;
        }

        public Builder distribution(final Distribution distribution) {
            this.distribution = distribution;
            return this;
        }

        public Builder affectedPackage(final AffectedPackage affectedPackage) {
            this.affectedPackage = affectedPackage;
            return this;
        }

        public Builder fixedInVersion(final String fixedInVersion) {
            this.fixedInVersion = fixedInVersion;
            return this;
        }

        public VulnerabilityRecord build() {
            return new VulnerabilityRecord(
                    updater,
                    name,
                    description,
                    issued,
                    links,
                    severity,
                    normalizedSeverity,
                    distribution,
                    affectedPackage,
                    fixedInVersion);
        }

    }

}
