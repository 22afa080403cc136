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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

import static java.util.Objects.requireNonNull;

/**
 * Result of {@link Updater#fetch(org.dependencytrack.updater.common.context.OperationContext, Fingerprint)}.
 *
 * @since 5.7.0
 */
public sealed interface FetchResult {

    /**
     * The upstream content is identical to what the prior {@link Fingerprint} describes.
     */
    record Unchanged() implements FetchResult {

        public static final Unchanged INSTANCE = new Unchanged();

    }

    /**
     * The upstream content changed.
     *
     * @param content     Stream positioned at the start of the <em>uncompressed</em> content.
     *                    Owned by the caller, who must close it.
     * @param fingerprint Fingerprint of the content, to be persisted once it was processed successfully.
     */
    record Updated(InputStream content, Fingerprint fingerprint) implements FetchResult, Closeable {

        public Updated {
            requireNonNull(content, "content must not be null");
            requireNonNull(fingerprint, "fingerprint must not be null");
            if (fingerprint.isEmpty()) {
                throw new IllegalArgumentException("fingerprint must not be empty");
            }
        }

        @Override
        public void close() throws IOException {
            content.close();
        }

    }

    static FetchResult unchanged() {
        return Unchanged.INSTANCE;
    }

    static FetchResult updated(final InputStream content, final Fingerprint fingerprint) {
        return new Updated(content, fingerprint);
    }

}
