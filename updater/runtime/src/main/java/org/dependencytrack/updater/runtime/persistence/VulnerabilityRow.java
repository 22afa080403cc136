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

import org.dependencytrack.updater.api.VulnerabilityRecord;

import java.time.Instant;

/**
 * Flat projection of a {@link VulnerabilityRecord}, as bound to the {@code vulnerability} table.
 *
 * @since 5.7.0
 */
public record VulnerabilityRow(
        String updater,
        String name,
        String description,
        Instant issued,
        String links,
        String severity,
        String normalizedSeverity,
        String packageName,
        String packageKind,
        String distDid,
        String distName,
        String distVersionId,
        String distPrettyName,
        String distCpe,
        String fixedInVersion) {

    static VulnerabilityRow of(final VulnerabilityRecord record) {
        return new VulnerabilityRow(
                record.updater(),
                record.name(),
                record.description(),
                record.issued(),
                record.links(),
                record.severity(),
                record.normalizedSeverity().name(),
                record.affectedPackage().name(),
                record.affectedPackage().kind().name(),
                record.distribution().did(),
                record.distribution().name(),
                record.distribution().versionId(),
                record.distribution().prettyName(),
                record.distribution().cpe(),
                record.fixedInVersion());
    }

}
