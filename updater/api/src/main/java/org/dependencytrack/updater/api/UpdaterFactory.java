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
 * Creates the {@link Updater}s of a feed family.
 * <p>
 * Implementations are discovered via {@link java.util.ServiceLoader}, and must thus
 * be registered in {@code META-INF/services/org.dependencytrack.updater.api.UpdaterFactory}.
 *
 * @since 5.7.0
 */
public interface UpdaterFactory {

    /**
     * @return Name of the feed family, e.g. {@code aws}.
     */
    String name();

    /**
     * @return The updaters of this family. Names must be unique across all factories.
     */
    List<Updater> createUpdaters();

}
