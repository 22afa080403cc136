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

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class VulnerabilityRecordTest {

    private static final Distribution DISTRIBUTION = new Distribution(
            "amzn", "Amazon Linux", "2", "Amazon Linux 2", "cpe:2.3:o:amazon:amazon_linux:2");

    @Test
    void shouldDefaultOptionalAttributes() {
        final VulnerabilityRecord record = VulnerabilityRecord.builder()
                .updater("aws-linux2-updater")
                .name("ALAS2-2023-0001")
                .issued(Instant.EPOCH)
                .distribution(DISTRIBUTION)
                .affectedPackage(AffectedPackage.binary("curl"))
                .build();

        assertThat(record.description()).isEmpty();
        assertThat(record.links()).isEmpty();
        assertThat(record.linkSet()).isEmpty();
        assertThat(record.severity()).isEmpty();
        assertThat(record.normalizedSeverity()).isEqualTo(Severity.UNKNOWN);
        assertThat(record.fixedInVersion()).isEmpty();
        assertThat(record.isFixed()).isFalse();
    }

    @Test
    void linkSetShouldSplitOnWhitespaceAndDeduplicate() {
        final VulnerabilityRecord record = VulnerabilityRecord.builder()
                .updater("aws-linux2-updater")
                .name("ALAS2-2023-0001")
                .issued(Instant.EPOCH)
                .links(" https://a.example.com  https://b.example.com https://a.example.com ")
                .distribution(DISTRIBUTION)
                .affectedPackage(AffectedPackage.binary("curl"))
                .fixedInVersion("7.88.1-1.amzn2")
                .build();

        assertThat(record.links()).isEqualTo("https://a.example.com  https://b.example.com https://a.example.com");
        assertThat(record.linkSet()).containsExactly("https://a.example.com", "https://b.example.com");
        assertThat(record.isFixed()).isTrue();
    }

    @Test
    void toBuilderShouldCopyAllAttributes() {
        final VulnerabilityRecord record = VulnerabilityRecord.builder()
                .updater("aws-linux2-updater")
                .name("ALAS2-2023-0001")
                .description("description")
                .issued(Instant.EPOCH)
                .links("https://a.example.com")
                .severity("important")
                .normalizedSeverity(Severity.HIGH)
                .distribution(DISTRIBUTION)
                .affectedPackage(AffectedPackage.binary("curl"))
                .fixedInVersion("7.88.1-1.amzn2")
                .build();

        assertThat(record.toBuilder().build()).isEqualTo(record);
        assertThat(record.toBuilder().affectedPackage(AffectedPackage.binary("libcurl")).build())
                .isNotEqualTo(record);
    }

    @Test
    void shouldThrowWhenRequiredAttributeIsMissing() {
        assertThatExceptionOfType(NullPointerException.class)
                .isThrownBy(() -> VulnerabilityRecord.builder()
                        .updater("aws-linux2-updater")
                        .name("ALAS2-2023-0001")
                        .distribution(DISTRIBUTION)
                        .affectedPackage(AffectedPackage.binary("curl"))
                        .build())
                .withMessage("issued must not be null");
    }

    @Test
    void malformedContentExceptionShouldExposePartialRecords() {
        final VulnerabilityRecord record = VulnerabilityRecord.builder()
                .updater("aws-linux2-updater")
                .name("ALAS2-2023-0001")
                .issued(Instant.EPOCH)
                .distribution(DISTRIBUTION)
                .affectedPackage(AffectedPackage.binary("curl"))
                .build();

        final var exception = new MalformedContentException("boom", null, List.of(record));
        assertThat(exception.partialRecords()).containsExactly(record);
        assertThat(new MalformedContentException("boom", null, null).partialRecords()).isEmpty();
    }

}
