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
package org.dependencytrack.updater.runtime.persistence;

import org.dependencytrack.updater.api.Fingerprint;
import org.dependencytrack.updater.api.VulnerabilityRecord;

import java.util.Collection;

/**
 * Persists the results of updaters, and the {@link Fingerprint} of the content they were derived from.
 *
 * @since 5.7.0
 */
public interface UpdaterStore {

    /**
     * @param updater Name of the updater.
     * @return The last stored {@link Fingerprint}, or {@link Fingerprint#EMPTY} if none was stored yet.
     */
    Fingerprint getFingerprint(String updater);

    /**
     * Store {@code records} and advance the fingerprint of {@code updater} to {@code fingerprint}.
     * <p>
     * Either both, or neither, are stored.
     *
     * @param updater     Name of the updater.
     * @param fingerprint The new {@link Fingerprint}. Must not be empty.
     * @param records     The records to store.
     */
    void storeUpdate(String updater, Fingerprint fingerprint, Collection<VulnerabilityRecord> records);

    /**
     * Store {@code records} without touching the fingerprint of {@code updater}.
     *
     * @param updater Name of the updater.
     * @param records The records to store.
     */
    void storeRecords(String updater, Collection<VulnerabilityRecord> records);

}
