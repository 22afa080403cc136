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

import org.jspecify.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Result of a single update cycle of an {@link org.dependencytrack.updater.api.Updater}.
 *
 * @param updater     Name of the updater.
 * @param status      The {@link Status} of the cycle.
 * @param recordCount Number of records that were stored.
 * @param failure     The failure that ended the cycle, if any.
 * @since 5.7.0
 */
public record UpdateOutcome(String updater, Status status, int recordCount, @Nullable Throwable failure) {

    public enum Status {

        /**
         * The lock of the updater was held elsewhere.
         */
        SKIPPED,

        /**
         * The upstream content did not change since the last cycle.
         */
        UNCHANGED,

        UPDATED,

        /**
         * Only part of the content could be decoded, and the decoded part was stored.
         */
        PARTIAL,

        FAILED

    }

    public UpdateOutcome {
        requireNonNull(updater, "updater must not be null");
        requireNonNull(status, "status must not be null");
        if (recordCount < 0) {
            throw new IllegalArgumentException("recordCount must not be negative");
        }
        if (status == Status.FAILED && failure == null) {
            throw new IllegalArgumentException("failure must not be null for status " + status);
        }
    }

    static UpdateOutcome skipped(final String updater) {
        return new UpdateOutcome(updater, Status.SKIPPED, 0, null);
    }

    static UpdateOutcome unchanged(final String updater) {
        return new UpdateOutcome(updater, Status.UNCHANGED, 0, null);
    }

    static UpdateOutcome updated(final String updater, final int recordCount) {
        return new UpdateOutcome(updater, Status.UPDATED, recordCount, null);
    }

    static UpdateOutcome partial(final String updater, final int recordCount, final Throwable failure) {
        return new UpdateOutcome(updater, Status.PARTIAL, recordCount, failure);
    }

    static UpdateOutcome failed(final String updater, final Throwable failure) {
        return new UpdateOutcome(updater, Status.FAILED, 0, failure);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

}
