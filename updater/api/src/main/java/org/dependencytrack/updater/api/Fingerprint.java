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

import static java.util.Objects.requireNonNull;

/**
 * Opaque token identifying the state of a feed's content as last observed by an {@link Updater}.
 * <p>
 * Only equality is meaningful. Equal content always yields an equal fingerprint,
 * different content yields a different fingerprint with overwhelming probability.
 *
 * @param value The raw token, e.g. a content checksum.
 * @since 5.7.0
 */
public record Fingerprint(String value) {

    /**
     * Sentinel for "never fetched".
     */
    public static final Fingerprint EMPTY = new Fingerprint("");

    public Fingerprint {
        requireNonNull(value, "value must not be null");
    }

    public static Fingerprint of(final String value) {
        return value == null || value.isEmpty() ? EMPTY : new Fingerprint(value);
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    @Override
    public String toString() {
        return value;
    }

}
