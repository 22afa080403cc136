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
 * @since 5.7.0
 */
public record AffectedPackage(String name, PackageKind kind) {

    public AffectedPackage {
        requireNonNull(name, "name must not be null");
        requireNonNull(kind, "kind must not be null");
    }

    public static AffectedPackage binary(final String name) {
        return new AffectedPackage(name, PackageKind.BINARY);
    }

}
