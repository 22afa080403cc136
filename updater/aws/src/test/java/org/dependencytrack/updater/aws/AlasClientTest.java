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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class AlasClientTest {

    @Test
    void parseMirrorListShouldIgnoreBlankLinesAndComments() throws Exception {
        final var mirrorList = """
                # Mirrors for Amazon Linux 2
                https://cdn.amazonlinux.com/2/core/2.0/x86_64/6b0225ccc542f3834c95733dcf321ab9f1e77e6ca6817469771a8af7c49efe6c

                  https://mirror.example.com/amzn2/  \r
                """;

        assertThat(AlasClient.parseMirrorList(mirrorList)).containsExactly(
                URI.create("https://cdn.amazonlinux.com/2/core/2.0/x86_64/6b0225ccc542f3834c95733dcf321ab9f1e77e6ca6817469771a8af7c49efe6c/"),
                URI.create("https://mirror.example.com/amzn2/"));
    }

    @Test
    void parseMirrorListShouldThrowOnInvalidUrl() {
        assertThatExceptionOfType(IOException.class)
                .isThrownBy(() -> AlasClient.parseMirrorList("ftp://mirror.example.com/"))
                .withMessage("Mirror list contains invalid URL: ftp://mirror.example.com/");
    }

    @Test
    void toMirrorUriShouldResolveRelativeLocationsBelowMirror() {
        final URI mirror = AlasClient.toMirrorUri("https://mirror.example.com/amzn2/core");

        assertThat(mirror.resolve("repodata/repomd.xml"))
                .isEqualTo(URI.create("https://mirror.example.com/amzn2/core/repodata/repomd.xml"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"mirror.example.com/amzn2", "/amzn2", "file:///tmp/amzn2", "https:///amzn2"})
    void toMirrorUriShouldRejectNonHttpUrls(final String url) {
        assertThatExceptionOfType(IllegalArgumentException.class)
                .isThrownBy(() -> AlasClient.toMirrorUri(url));
    }

}
