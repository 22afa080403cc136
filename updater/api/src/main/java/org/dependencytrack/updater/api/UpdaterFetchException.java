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

/**
 * Signals a transient failure to retrieve feed content, e.g. a network error,
 * an unexpected HTTP response, or a checksum mismatch.
 * <p>
 * Callers may retry with backoff.
 *
 * @since 5.7.0
 */
public final class UpdaterFetchException extends UpdaterException {

    public UpdaterFetchException(final String message) {
        super(message, null);
    }

    public UpdaterFetchException(final String message, final Throwable cause) {
        super(message, cause);
    }

}
