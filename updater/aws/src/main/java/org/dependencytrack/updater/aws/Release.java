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
package org.dependencytrack.updater.aws;

import org.dependencytrack.updater.api.Distribution;

import java.net.URI;
import java.util.Arrays;

import static java.util.Objects.requireNonNull;

/**
 * Amazon Linux releases for which ALAS advisories are published.
 *
 * @since 5.7.0
 */
public enum Release {

    LINUX1(
            "linux1",
            URI.create("http://repo.us-west-2.amazonaws.com/2018.03/updates/x86_64/mirror.list"),
            new Distribution(
                    "amzn",
                    "Amazon Linux AMI",
                    "2018.03",
                    "Amazon Linux AMI 2018.03",
                    "cpe:/o:amazon:linux:2018.03:ga")),

    LINUX2(
            "linux2",
            URI.create("https://cdn.amazonlinux.com/2/core/latest/x86_64/mirror.list"),
            new Distribution(
                    "amzn",
                    "Amazon Linux",
                    "2",
                    "Amazon Linux 2",
                    "cpe:2.3:o:amazon:amazon_linux:2")),

    LINUX2023(
            "linux2023",
            URI.create("https://cdn.amazonlinux.com/al2023/core/mirrors/latest/x86_64/mirror.list"),
            new Distribution(
                    "amzn",
                    "Amazon Linux",
                    "2023",
                    "Amazon Linux 2023",
                    "cpe:2.3:o:amazon:amazon_linux:2023"));

    private final String id;
    private final URI mirrorListUri;
    private final Distribution distribution;

    Release(final String id, final URI mirrorListUri, final Distribution distribution) {
        this.id = id;
        this.mirrorListUri = mirrorListUri;
        this.distribution = distribution;
    }

    public String id() {
        return id;
    }

    /**
     * @return URI of the upstream list of repository mirrors for this release.
     */
    public URI mirrorListUri() {
        return mirrorListUri;
    }

    public Distribution distribution() {
        return distribution;
    }

    public static Release fromId(final String id) {
        requireNonNull(id, "id must not be null");
        return Arrays.stream(values())
                .filter(release -> release.id.equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown release: " + id));
    }

    @Override
    public String toString() {
        return id;
    }

}
