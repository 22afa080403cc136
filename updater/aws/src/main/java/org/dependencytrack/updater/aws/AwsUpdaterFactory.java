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
package org.dependencytrack.updater.aws;

import org.dependencytrack.updater.api.Updater;
import org.dependencytrack.updater.api.UpdaterFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Creates one {@link AwsUpdater} per supported Amazon Linux {@link Release}.
 *
 * @since 5.7.0
 */
public final class AwsUpdaterFactory implements UpdaterFactory {

    @Override
    public String name() {
        return "aws";
    }

    @Override
    public List<Updater> createUpdaters() {
        return Arrays.stream(Release.values())
                .<Updater>map(AwsUpdater::new)
                .toList();
    }

}
