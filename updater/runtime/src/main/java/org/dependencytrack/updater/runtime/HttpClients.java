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

import org.eclipse.microprofile.config.Config;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * @since 5.7.0
 */
final class HttpClients {

    static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private HttpClients() {
    }

    /**
     * Create the {@link HttpClient} that is shared by all updaters.
     * <p>
     * Reads {@code updater.http.connect-timeout} from {@code config}.
     */
    static HttpClient create(final Config config) {
        final Duration connectTimeout = config
                .getOptionalValue("updater.http.connect-timeout", Duration.class)
                .orElse(DEFAULT_CONNECT_TIMEOUT);

        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

}
