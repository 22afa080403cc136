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

import org.dependencytrack.updater.common.context.OperationContext;

import java.net.http.HttpClient;

/**
 * Implemented by {@link Updater}s that accept external configuration.
 * <p>
 * Updaters that do not implement this interface operate with compiled-in defaults.
 *
 * @since 5.7.0
 */
public interface Configurable {

    /**
     * Configure the updater before its first fetch.
     *
     * @param ctx         The context of the operation.
     * @param unmarshaler Access to the updater's externally stored configuration.
     * @param httpClient  The {@link HttpClient} to use for all network calls. Shared, and owned by the caller.
     * @throws UpdaterConfigurationException When the configuration is invalid, or could not be applied.
     */
    void configure(OperationContext ctx, ConfigUnmarshaler unmarshaler, HttpClient httpClient)
            throws UpdaterConfigurationException;

}
