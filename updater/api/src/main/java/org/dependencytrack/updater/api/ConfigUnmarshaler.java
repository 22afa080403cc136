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

import java.io.IOException;

/**
 * Populates configuration objects from externally stored configuration.
 *
 * @since 5.7.0
 */
@FunctionalInterface
public interface ConfigUnmarshaler {

    /**
     * Populate the fields of {@code target}. Fields without a corresponding
     * external value keep their current value.
     *
     * @param target The object to populate.
     * @throws IOException When the configuration could not be read, or not be mapped onto {@code target}.
     */
    void unmarshal(Object target) throws IOException;

    /**
     * @return A {@link ConfigUnmarshaler} that leaves all targets untouched.
     */
    static ConfigUnmarshaler noop() {
        return target -> {
        };
    }

}
