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

import org.dependencytrack.updater.common.context.OperationCancelledException;
import org.dependencytrack.updater.common.context.OperationContext;

import java.io.InputStream;
import java.util.List;

/**
 * Fetches and parses a single security advisory feed.
 * <p>
 * Updaters are passive: they are driven by an orchestrator, which serializes invocations
 * per {@link #name()} across all processes, and persists results as well as fingerprints.
 * Apart from configuration injected via {@link Configurable}, updaters hold no state across calls.
 *
 * @since 5.7.0
 */
public interface Updater {

    /**
     * @return Stable, human-readable name of this updater, e.g. {@code aws-linux2-updater}.
     * Used as lock key, and to associate persisted records and fingerprints with the feed.
     */
    String name();

    /**
     * Determine whether the feed changed since it was last observed, and retrieve its content if it did.
     * <p>
     * Every network call is bounded by the smaller of the updater's configured timeout,
     * and the time remaining in {@code ctx}.
     *
     * @param ctx              The context of the operation.
     * @param priorFingerprint The {@link Fingerprint} of the last successfully processed content,
     *                         or {@link Fingerprint#EMPTY} if there is none.
     * @return {@link FetchResult.Unchanged} when the content did not change,
     * otherwise {@link FetchResult.Updated} with the new content and fingerprint.
     * @throws UpdaterFetchException       When the content could not be retrieved.
     * @throws OperationCancelledException When {@code ctx} is done.
     */
    FetchResult fetch(OperationContext ctx, Fingerprint priorFingerprint) throws UpdaterFetchException;

    /**
     * Decode feed content into normalized records.
     * <p>
     * The stream is consumed entirely, but not closed.
     *
     * @param ctx     The context of the operation.
     * @param content Content as returned by {@link #fetch(OperationContext, Fingerprint)}.
     * @return The decoded records.
     * @throws MalformedContentException   When the content could not be decoded completely.
     *                                     Records decoded before the failure are available via
     *                                     {@link MalformedContentException#partialRecords()}.
     * @throws OperationCancelledException When {@code ctx} is done.
     */
    List<VulnerabilityRecord> parse(OperationContext ctx, InputStream content) throws MalformedContentException;

}
