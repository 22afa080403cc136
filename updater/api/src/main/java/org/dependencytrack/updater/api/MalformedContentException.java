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

import java.util.List;

/**
 * Signals that feed content could only be decoded partially.
 * <p>
 * Whether the records decoded up to the failure are used is up to the caller.
 *
 * @since 5.7.0
 */
public final class MalformedContentException extends UpdaterException {

    private final transient List<VulnerabilityRecord> partialRecords;

    public MalformedContentException(
            final String message,
            final Throwable cause,
            final List<VulnerabilityRecord> partialRecords) {
        super(message, cause);
        this.partialRecords = partialRecords != null ? List.copyOf(partialRecords) : List.of();
    }

    /**
     * @return The records that were fully decoded before the failure occurred. May be empty.
     */
    public List<VulnerabilityRecord> partialRecords() {
        return partialRecords;
    }

}
