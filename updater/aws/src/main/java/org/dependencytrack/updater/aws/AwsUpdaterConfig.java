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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of an {@link AwsUpdater}, populated via
 * {@link org.dependencytrack.updater.api.ConfigUnmarshaler}.
 *
 * @since 5.7.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AwsUpdaterConfig {

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);

    /**
     * Applied to each network call.
     */
    @JsonProperty("timeout")
    private Duration timeout = DEFAULT_TIMEOUT;

    /**
     * URLs to use instead of the release's upstream mirror list.
     * <p>
     * The layout of resources at the provided URLs must be the same as upstream.
     */
    @JsonProperty("mirrors")
    private List<String> mirrors = new ArrayList<>();

    /**
     * Whether downloaded documents are verified against the checksum advertised by the repository metadata.
     */
    @JsonProperty("verify-checksums")
    private boolean verifyChecksums = true;

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(final Duration timeout) {
        this.timeout = timeout;
    }

    public boolean isVerifyChecksums() {
        return verifyChecksums;
    }

    public void setVerifyChecksums(final boolean verifyChecksums) {
        this.verifyChecksums = verifyChecksums;
    }

    public List<String> getMirrors() {
        return mirrors;
    }

    public void setMirrors(final List<String> mirrors) {
        this.mirrors = mirrors;
    }

}
