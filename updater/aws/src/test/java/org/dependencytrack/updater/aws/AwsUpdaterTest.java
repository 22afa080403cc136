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

import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import org.dependencytrack.updater.api.ConfigUnmarshaler;
import org.dependencytrack.updater.api.FetchResult;
import org.dependencytrack.updater.api.Fingerprint;
import org.dependencytrack.updater.api.UpdaterConfigurationException;
import org.dependencytrack.updater.api.UpdaterFetchException;
import org.dependencytrack.updater.api.VulnerabilityRecord;
import org.dependencytrack.updater.common.context.OperationCancelledException;
import org.dependencytrack.updater.common.context.OperationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class AwsUpdaterTest {

    @RegisterExtension
    private static final WireMockExtension WIREMOCK = WireMockExtension.newInstance()
            .options(WireMockConfiguration.wireMockConfig().dynamicPort())
            .build();

    private HttpClient httpClient;
    private byte[] updateInfo;
    private byte[] updateInfoGz;

    @BeforeEach
    void beforeEach() {
        httpClient = HttpClient.newHttpClient();
        updateInfo = AlasFixtures.resource("updateinfo.xml");
        updateInfoGz = AlasFixtures.gzip(updateInfo);
    }

    @Test
    void nameShouldIncludeRelease() {
        assertThat(new AwsUpdater(Release.LINUX1).name()).isEqualTo("aws-linux1-updater");
        assertThat(new AwsUpdater(Release.LINUX2).name()).isEqualTo("aws-linux2-updater");
        assertThat(new AwsUpdater(Release.LINUX2023).name()).isEqualTo("aws-linux2023-updater");
    }

    @Test
    void fetchShouldReturnUncompressedContentAndChecksum() throws Exception {
        final String checksum = stubMirror("/mirror-a", updateInfoGz);
        final AwsUpdater updater = configuredUpdater(List.of(WIREMOCK.baseUrl() + "/mirror-a"));

        final FetchResult result = updater.fetch(OperationContext.background(), Fingerprint.EMPTY);

        assertThat(result).isInstanceOf(FetchResult.Updated.class);
        try (final var updated = (FetchResult.Updated) result) {
            assertThat(updated.fingerprint()).isEqualTo(Fingerprint.of(checksum));
            assertThat(updated.content().readAllBytes()).isEqualTo(updateInfo);
        }
    }

    @Test
    void fetchShouldBeIdempotentForUnchangedContent() throws Exception {
        final String checksum = stubMirror("/mirror-a", updateInfoGz);
        final AwsUpdater updater = configuredUpdater(List.of(WIREMOCK.baseUrl() + "/mirror-a"));

        final FetchResult first = updater.fetch(OperationContext.background(), Fingerprint.of(checksum));
        final FetchResult second = updater.fetch(OperationContext.background(), Fingerprint.of(checksum));

        assertThat(first).isInstanceOf(FetchResult.Unchanged.class);
        assertThat(second).isInstanceOf(FetchResult.Unchanged.class);
        WIREMOCK.verify(2, getRequestedFor(urlPathEqualTo("/mirror-a/repodata/repomd.xml")));
        WIREMOCK.verify(0, getRequestedFor(urlPathEqualTo("/mirror-a/repodata/updateinfo.xml.gz")));
    }

    @Test
    void fetchShouldReturnNewFingerprintWhenChecksumChanged() throws Exception {
        final String checksum = stubMirror("/mirror-a", updateInfoGz);
        final AwsUpdater updater = configuredUpdater(List.of(WIREMOCK.baseUrl() + "/mirror-a"));

        final FetchResult result = updater.fetch(OperationContext.background(), Fingerprint.of("outdated"));

        assertThat(result).isInstanceOfSatisfying(FetchResult.Updated.class, updated -> {
            assertThat(updated.fingerprint()).isNotEqualTo(Fingerprint.of("outdated"));
            assertThat(updated.fingerprint().value()).isEqualTo(checksum);
        });
        ((FetchResult.Updated) result).close();
    }

    @Test
    void shouldDetectChangeEndToEnd() throws Exception {
        final byte[] singleAdvisory = AlasFixtures.resource("updateinfo-single.xml");
        WIREMOCK.stubFor(get(urlPathEqualTo("/mirror-a/repodata/repomd.xml"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withBody(AlasFixtures.repoMd("abc", "repodata/updateinfo.xml.gz"))));
        WIREMOCK.stubFor(get(urlPathEqualTo("/mirror-a/repodata/updateinfo.xml.gz"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withBody(AlasFixtures.gzip(singleAdvisory))));

        final var updater = new AwsUpdater(Release.LINUX2);
        updater.configure(OperationContext.background(), target -> {
            final var config = (AwsUpdaterConfig) target;
            config.setMirrors(List.of(WIREMOCK.baseUrl() + "/mirror-a"));
            config.setVerifyChecksums(false);
        }, httpClient);

        assertThat(updater.fetch(OperationContext.background(), Fingerprint.of("abc")))
                .isInstanceOf(FetchResult.Unchanged.class);

        WIREMOCK.stubFor(get(urlPathEqualTo("/mirror-a/repodata/repomd.xml"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withBody(AlasFixtures.repoMd("def", "repodata/updateinfo.xml.gz"))));

        final FetchResult result = updater.fetch(OperationContext.background(), Fingerprint.of("abc"));
        assertThat(result).isInstanceOf(FetchResult.Updated.class);

        try (final var updated = (FetchResult.Updated) result) {
            assertThat(updated.fingerprint()).isEqualTo(Fingerprint.of("def"));

            final List<VulnerabilityRecord> records = updater.parse(OperationContext.background(), updated.content());
            assertThat(records).hasSize(2);
            assertThat(records).extracting(VulnerabilityRecord::name).containsOnly("ALAS2-2023-2000");
            assertThat(records).extracting(VulnerabilityRecord::fixedInVersion).doesNotHaveDuplicates();
        }
    }

    @Test
    void fetchShouldFallOverToNextMirror() throws Exception {
        WIREMOCK.stubFor(get(urlPathEqualTo("/mirror-a/repodata/repomd.xml"))
                .willReturn(aResponse().withStatus(503)));
        final String checksum = stubMirror("/mirror-b", updateInfoGz);

        final AwsUpdater updater = configuredUpdater(List.of(
                WIREMOCK.baseUrl() + "/mirror-a",
                WIREMOCK.baseUrl() + "/mirror-b"));

        try (final var updated = (FetchResult.Updated) updater.fetch(OperationContext.background(), Fingerprint.EMPTY)) {
            assertThat(updated.fingerprint()).isEqualTo(Fingerprint.of(checksum));
        }

        WIREMOCK.verify(1, getRequestedFor(urlPathEqualTo("/mirror-a/repodata/repomd.xml")));
        WIREMOCK.verify(1, getRequestedFor(urlPathEqualTo("/mirror-b/repodata/updateinfo.xml.gz")));
    }

    @Test
    void fetchShouldFallOverToNextMirrorOnChecksumMismatch() throws Exception {
        WIREMOCK.stubFor(get(urlPathEqualTo("/mirror-a/repodata/repomd.xml"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withBody(AlasFixtures.repoMd(AlasFixtures.sha256(updateInfoGz), "repodata/updateinfo.xml.gz"))));
        WIREMOCK.stubFor(get(urlPathEqualTo("/mirror-a/repodata/updateinfo.xml.gz"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withBody(AlasFixtures.gzip("<updates/>".getBytes()))));
        final String checksum = stubMirror("/mirror-b", updateInfoGz);

        final AwsUpdater updater = configuredUpdater(List.of(
                WIREMOCK.baseUrl() + "/mirror-a",
                WIREMOCK.baseUrl() + "/mirror-b"));

        try (final var updated = (FetchResult.Updated) updater.fetch(OperationContext.background(), Fingerprint.EMPTY)) {
            assertThat(updated.fingerprint()).isEqualTo(Fingerprint.of(checksum));
            assertThat(updated.content().readAllBytes()).isEqualTo(updateInfo);
        }
    }

    @Test
    void fetchShouldThrowWhenAllMirrorsFail() throws Exception {
        WIREMOCK.stubFor(get(urlPathEqualTo("/mirror-a/repodata/repomd.xml"))
                .willReturn(aResponse().withStatus(500)));
        WIREMOCK.stubFor(get(urlPathEqualTo("/mirror-b/repodata/repomd.xml"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withBody("<repomd><data type=\"primary\"/></repomd>")));

        final AwsUpdater updater = configuredUpdater(List.of(
                WIREMOCK.baseUrl() + "/mirror-a",
                WIREMOCK.baseUrl() + "/mirror-b"));

        assertThatExceptionOfType(UpdaterFetchException.class)
                .isThrownBy(() -> updater.fetch(OperationContext.background(), Fingerprint.EMPTY))
                .withMessage("Failed to fetch updates from any of 2 mirrors")
                .havingCause()
                .withMessageContaining("does not list updateinfo");
    }

    @Test
    void fetchShouldHonorTimeout() throws Exception {
        WIREMOCK.stubFor(get(urlPathEqualTo("/mirror-a/repodata/repomd.xml"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withFixedDelay(2_000)
                        .withBody(AlasFixtures.repoMd("abc", "repodata/updateinfo.xml.gz"))));

        final var updater = new AwsUpdater(Release.LINUX2);
        updater.configure(OperationContext.background(), target -> {
            final var config = (AwsUpdaterConfig) target;
            config.setMirrors(List.of(WIREMOCK.baseUrl() + "/mirror-a"));
            config.setTimeout(Duration.ofMillis(200));
        }, httpClient);

        assertThatExceptionOfType(UpdaterFetchException.class)
                .isThrownBy(() -> updater.fetch(OperationContext.background(), Fingerprint.EMPTY));
    }

    @Test
    void fetchShouldThrowWhenContextDeadlineExceeded() throws Exception {
        WIREMOCK.stubFor(get(urlPathEqualTo("/mirror-a/repodata/repomd.xml"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withFixedDelay(2_000)
                        .withBody(AlasFixtures.repoMd("abc", "repodata/updateinfo.xml.gz"))));

        final AwsUpdater updater = configuredUpdater(List.of(WIREMOCK.baseUrl() + "/mirror-a"));

        assertThatExceptionOfType(OperationCancelledException.class)
                .isThrownBy(() -> updater.fetch(OperationContext.ofTimeout(Duration.ofMillis(200)), Fingerprint.EMPTY))
                .satisfies(e -> assertThat(e.isDeadlineExceeded()).isTrue());
    }

    @Test
    void fetchShouldHonorTimeoutWhileReceivingBody() throws Exception {
        WIREMOCK.stubFor(get(urlPathEqualTo("/mirror-a/repodata/repomd.xml"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withChunkedDribbleDelay(20, 6_000)
                        .withBody(AlasFixtures.repoMd("abc", "repodata/updateinfo.xml.gz"))));

        final var updater = new AwsUpdater(Release.LINUX2);
        updater.configure(OperationContext.background(), target -> {
            final var config = (AwsUpdaterConfig) target;
            config.setMirrors(List.of(WIREMOCK.baseUrl() + "/mirror-a"));
            config.setTimeout(Duration.ofSeconds(1));
        }, httpClient);

        final long startNanos = System.nanoTime();
        assertThatExceptionOfType(UpdaterFetchException.class)
                .isThrownBy(() -> updater.fetch(OperationContext.background(), Fingerprint.of("abc")));
        assertThat(Duration.ofNanos(System.nanoTime() - startNanos)).isLessThan(Duration.ofSeconds(4));
    }

    @Test
    void fetchShouldAbortPromptlyWhenCancelled() throws Exception {
        WIREMOCK.stubFor(get(urlPathEqualTo("/mirror-a/repodata/repomd.xml"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withFixedDelay(5_000)
                        .withBody(AlasFixtures.repoMd("abc", "repodata/updateinfo.xml.gz"))));

        final AwsUpdater updater = configuredUpdater(List.of(WIREMOCK.baseUrl() + "/mirror-a"));

        final var ctx = OperationContext.background();
        final CompletableFuture<FetchResult> fetchFuture = CompletableFuture.supplyAsync(() -> {
            try {
                return updater.fetch(ctx, Fingerprint.of("abc"));
            } catch (UpdaterFetchException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(200);
        ctx.cancel();

        final long startNanos = System.nanoTime();
        assertThat(fetchFuture)
                .failsWithin(Duration.ofSeconds(3))
                .withThrowableOfType(ExecutionException.class)
                .havingCause()
                .isInstanceOfSatisfying(OperationCancelledException.class,
                        e -> assertThat(e.reason()).isEqualTo(OperationCancelledException.Reason.CANCELLED));
        assertThat(Duration.ofNanos(System.nanoTime() - startNanos)).isLessThan(Duration.ofSeconds(2));
    }

    @Test
    void configureShouldResolveMirrorsFromMirrorList() throws Exception {
        WIREMOCK.stubFor(get(urlPathEqualTo("/mirror.list"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withBody("""
                                # Primary
                                %s/mirror-a

                                %s/mirror-b
                                """.formatted(WIREMOCK.baseUrl(), WIREMOCK.baseUrl()))));

        final var updater = new AwsUpdater(Release.LINUX2, URI.create(WIREMOCK.baseUrl() + "/mirror.list"));
        updater.configure(OperationContext.background(), ConfigUnmarshaler.noop(), httpClient);

        assertThat(updater.client()).isNotNull();
        assertThat(updater.client().mirrors()).containsExactly(
                URI.create(WIREMOCK.baseUrl() + "/mirror-a/"),
                URI.create(WIREMOCK.baseUrl() + "/mirror-b/"));
        assertThat(updater.config().getTimeout()).isEqualTo(Duration.ofSeconds(15));
    }

    @Test
    void configureShouldNotResolveMirrorListWhenMirrorsAreConfigured() throws Exception {
        final var updater = new AwsUpdater(Release.LINUX2, URI.create(WIREMOCK.baseUrl() + "/mirror.list"));
        updater.configure(OperationContext.background(), target ->
                ((AwsUpdaterConfig) target).setMirrors(List.of(WIREMOCK.baseUrl() + "/mirror-a")), httpClient);

        assertThat(updater.client().mirrors()).containsExactly(URI.create(WIREMOCK.baseUrl() + "/mirror-a/"));
        WIREMOCK.verify(0, getRequestedFor(urlPathEqualTo("/mirror.list")));
    }

    @Test
    void configureShouldThrowWhenMirrorListIsUnavailable() {
        WIREMOCK.stubFor(get(urlPathEqualTo("/mirror.list"))
                .willReturn(aResponse().withStatus(404)));

        final var updater = new AwsUpdater(Release.LINUX2, URI.create(WIREMOCK.baseUrl() + "/mirror.list"));

        assertThatExceptionOfType(UpdaterConfigurationException.class)
                .isThrownBy(() -> updater.configure(OperationContext.background(), ConfigUnmarshaler.noop(), httpClient))
                .withMessage("Failed to resolve mirrors of aws-linux2-updater");
        assertThat(updater.client()).isNull();
    }

    @Test
    void configureShouldThrowOnInvalidMirror() {
        final var updater = new AwsUpdater(Release.LINUX2);

        assertThatExceptionOfType(UpdaterConfigurationException.class)
                .isThrownBy(() -> updater.configure(OperationContext.background(), target ->
                        ((AwsUpdaterConfig) target).setMirrors(List.of("not a url")), httpClient))
                .withMessage("Invalid mirror configured for aws-linux2-updater: not a url");
    }

    @Test
    void configureShouldThrowOnEmptyMirror() {
        final var updater = new AwsUpdater(Release.LINUX2);
        final var mirrors = new ArrayList<String>();
        mirrors.add(null);
        mirrors.add(WIREMOCK.baseUrl() + "/mirror-a");

        assertThatExceptionOfType(UpdaterConfigurationException.class)
                .isThrownBy(() -> updater.configure(OperationContext.background(), target ->
                        ((AwsUpdaterConfig) target).setMirrors(mirrors), httpClient))
                .withMessage("Empty mirror configured for aws-linux2-updater");
        assertThat(updater.client()).isNull();
    }

    @Test
    void configureShouldThrowOnNonPositiveTimeout() {
        final var updater = new AwsUpdater(Release.LINUX2);

        assertThatExceptionOfType(UpdaterConfigurationException.class)
                .isThrownBy(() -> updater.configure(OperationContext.background(), target ->
                        ((AwsUpdaterConfig) target).setTimeout(Duration.ZERO), httpClient))
                .withMessage("Timeout of aws-linux2-updater must be positive, but is PT0S");
    }

    @Test
    void configureShouldThrowWhenUnmarshalingFails() {
        final var updater = new AwsUpdater(Release.LINUX2);

        assertThatExceptionOfType(UpdaterConfigurationException.class)
                .isThrownBy(() -> updater.configure(OperationContext.background(), target -> {
                    throw new IOException("Malformed duration");
                }, httpClient))
                .withMessage("Failed to unmarshal configuration of aws-linux2-updater");
    }

    @Test
    void configureShouldOnlyBeAllowedOnce() throws Exception {
        final AwsUpdater updater = configuredUpdater(List.of(WIREMOCK.baseUrl() + "/mirror-a"));

        assertThatExceptionOfType(IllegalStateException.class)
                .isThrownBy(() -> updater.configure(OperationContext.background(), ConfigUnmarshaler.noop(), httpClient))
                .withMessage("Updater aws-linux2-updater is already configured");
    }

    private AwsUpdater configuredUpdater(final List<String> mirrors) throws UpdaterConfigurationException {
        final var updater = new AwsUpdater(Release.LINUX2);
        updater.configure(OperationContext.background(), target -> ((AwsUpdaterConfig) target).setMirrors(mirrors), httpClient);
        return updater;
    }

    private static String stubMirror(final String path, final byte[] updateInfoGz) {
        final String checksum = AlasFixtures.sha256(updateInfoGz);
        WIREMOCK.stubFor(get(urlPathEqualTo(path + "/repodata/repomd.xml"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/xml")
                        .withBody(AlasFixtures.repoMd(checksum, "repodata/updateinfo.xml.gz"))));
        WIREMOCK.stubFor(get(urlPathEqualTo(path + "/repodata/updateinfo.xml.gz"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withBody(updateInfoGz)));
        return checksum;
    }

}
