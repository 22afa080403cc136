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
 * An operating system distribution that vulnerabilities may affect.
 * <p>
 * Attribute names follow the {@code os-release(5)} fields they correspond to.
 *
 * @param did        Distribution ID, e.g. {@code amzn}.
 * @param name       Human-readable name, e.g. {@code Amazon Linux}.
 * @param versionId  Version identifier, e.g. {@code 2}.
 * @param prettyName Full human-readable name including the version.
 * @param cpe        CPE of the distribution.
 * @since 5.7.0
 */
public record Distribution(String did, String name, String versionId, String prettyName, String cpe) {

    public Distribution {
        requireNonNull(did, "did must not be null");
        requireNonNull(name, "name must not be null");
        requireNonNull(versionId, "versionId must not be null");
        requireNonNull(prettyName, "prettyName must not be null");
        requireNonNull(cpe, "cpe must not be null");
    }

}
