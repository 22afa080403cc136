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
package org.dependencytrack.updater.runtime;

import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import org.dependencytrack.updater.api.Fingerprint;
import org.dependencytrack.updater.common.config.ConfigFactory;
import org.dependencytrack.updater.distlock.postgres.PostgresAdvisoryLockProvider;
import org.dependencytrack.updater.distlock.shedlock.LeaseLockProvider;
import org.dependencytrack.updater.runtime.UpdateOutcome.Status;
import org.dependencytrack.updater.runtime.persistence.JdbiUpdaterStore;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.postgresql.ds.PGSimpleDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.zip.GZIPOutputStream;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathMatching;
import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class UpdaterRuntimeTest {

    @Container
    private final PostgreSQLContainer<?> postgresContainer =
            new PostgreSQLContainer<>("postgres:14-alpine");

    @RegisterExtension
    private static final WireMockExtension WIREMOCK = WireMockExtension.newInstance()
            .options(WireMockConfiguration.wireMockConfig().dynamicPort())
            .build();

    private static final List<String> UPDATER_NAMES = List.of(
            "aws-linux1-updater",
            "aws-linux2-updater",
            "aws-linux2023-updater");

    private String checksum;

    @BeforeEach
    void beforeEach() throws Exception {
        final byte[] updateInfoGz = gzip(resource("/alas/updateinfo.xml"));
        checksum = HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(updateInfoGz));

        WIREMOCK.stubFor(get(urlPathMatching("/[a-z0-9]+/repodata/repomd.xml"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withBody(/* language=XML */ """
                                <?xml version="1.0" encoding="UTF-8"?>
                                <repomd xmlns="http://linux.duke.edu/metadata/repo">
                                  <data type="updateinfo">
                                    <checksum type="sha256">%s</checksum>
                                    <location href="repodata/updateinfo.xml.gz"/>
                                  </data>
                                </repomd>
                                """.formatted(checksum))));
        WIREMOCK.stubFor(get(urlPathMatching("/[a-z0-9]+/repodata/updateinfo.xml.gz"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withBody(updateInfoGz)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"postgres", "lease"})
    void shouldStoreUpdatesOnceAndDetectUnchangedContent(final String lockBackend) {
        try (final UpdaterRuntime runtime = UpdaterRuntime.create(newConfig(lockBackend))) {
            final Map<String, UpdateOutcome> firstOutcomes = runtime.runOnce();
            assertThat(firstOutcomes).containsOnlyKeys(UPDATER_NAMES);
            assertThat(firstOutcomes.values()).allSatisfy(outcome -> {
                assertThat(outcome.status()).isEqualTo(Status.UPDATED);
                assertThat(outcome.recordCount()).isEqualTo(3);
            });

            final Map<String, UpdateOutcome> secondOutcomes = runtime.runOnce();
            assertThat(secondOutcomes.values())
                    .extracting(UpdateOutcome::status)
                    .containsOnly(Status.UNCHANGED);
        }

        WIREMOCK.verify(6, getRequestedFor(urlPathMatching("/[a-z0-9]+/repodata/repomd.xml")));
        WIREMOCK.verify(3, getRequestedFor(urlPathMatching("/[a-z0-9]+/repodata/updateinfo.xml.gz")));

        final var store = new JdbiUpdaterStore(newDataSource());
        for (final String updaterName : UPDATER_NAMES) {
            assertThat(store.getFingerprint(updaterName)).isEqualTo(Fingerprint.of(checksum));
        }
    }

    @Test
    void shouldUpdateEachFeedOnlyOnceWhenRunConcurrently() {
        final Config config = newConfig("postgres");

        try (final UpdaterRuntime runtimeA = UpdaterRuntime.create(config);
             final UpdaterRuntime runtimeB = UpdaterRuntime.create(config)) {
            final CompletableFuture<Map<String, UpdateOutcome>> futureA = CompletableFuture.supplyAsync(runtimeA::runOnce);
            final CompletableFuture<Map<String, UpdateOutcome>> futureB = CompletableFuture.supplyAsync(runtimeB::runOnce);

            final Map<String, UpdateOutcome> outcomesA = futureA.join();
            final Map<String, UpdateOutcome> outcomesB = futureB.join();

            for (final String updaterName : UPDATER_NAMES) {
                assertThat(List.of(outcomesA.get(updaterName).status(), outcomesB.get(updaterName).status()))
                        .as("Outcomes of %s", updaterName)
                        .containsOnlyOnce(Status.UPDATED)
                        .containsAnyOf(Status.SKIPPED, Status.UNCHANGED);
            }
        }

        WIREMOCK.verify(3, getRequestedFor(urlPathMatching("/[a-z0-9]+/repodata/updateinfo.xml.gz")));
    }

    @Test
    void shouldReportFailureOfSingleUpdaterWithoutAffectingOthers() {
        WIREMOCK.stubFor(get(urlPathEqualTo("/amzn1/repodata/repomd.xml"))
                .willReturn(aResponse().withStatus(503)));

        try (final UpdaterRuntime runtime = UpdaterRuntime.create(newConfig("postgres"))) {
            final Map<String, UpdateOutcome> outcomes = runtime.runOnce();

            assertThat(outcomes.get("aws-linux1-updater").status()).isEqualTo(Status.FAILED);
            assertThat(outcomes.get("aws-linux2-updater").status()).isEqualTo(Status.UPDATED);
            assertThat(outcomes.get("aws-linux2023-updater").status()).isEqualTo(Status.UPDATED);
        }

        final var store = new JdbiUpdaterStore(newDataSource());
        assertThat(store.getFingerprint("aws-linux1-updater")).isEqualTo(Fingerprint.EMPTY);
    }

    @Test
    void createLockProviderShouldSelectConfiguredBackend() {
        final PGSimpleDataSource dataSource = newDataSource();

        assertThat(UpdaterRuntime.createLockProvider(ConfigFactory.fromProperties(Map.of()), dataSource))
                .isInstanceOf(PostgresAdvisoryLockProvider.class);
        assertThat(UpdaterRuntime.createLockProvider(ConfigFactory.fromProperties(Map.of(
                "updater.lock.backend", "LEASE")), dataSource))
                .isInstanceOf(LeaseLockProvider.class);
    }

    private Config newConfig(final String lockBackend) {
        final var properties = new HashMap<String, String>();
        properties.put("updater.datasource.url", postgresContainer.getJdbcUrl());
        properties.put("updater.datasource.username", postgresContainer.getUsername());
        properties.put("updater.datasource.password", postgresContainer.getPassword());
        properties.put("updater.lock.backend", lockBackend);
        properties.put("updater.lock.poll-interval", "PT0.1S");
        properties.put("updater.manager.factories", "aws");
        properties.put("updater.aws-linux1-updater.mirrors[0]", WIREMOCK.baseUrl() + "/amzn1");
        properties.put("updater.aws-linux2-updater.mirrors[0]", WIREMOCK.baseUrl() + "/amzn2");
        properties.put("updater.aws-linux2023-updater.mirrors[0]", WIREMOCK.baseUrl() + "/al2023");
        return ConfigFactory.fromProperties(properties);
    }

    private PGSimpleDataSource newDataSource() {
        final var dataSource = new PGSimpleDataSource();
        dataSource.setUrl(postgresContainer.getJdbcUrl());
        dataSource.setUser(postgresContainer.getUsername());
        dataSource.setPassword(postgresContainer.getPassword());
        return dataSource;
    }

    private static byte[] resource(final String name) throws IOException {
        try (final InputStream inputStream = UpdaterRuntimeTest.class.getResourceAsStream(name)) {
            assertThat(inputStream).isNotNull();
            return inputStream.readAllBytes();
        }
    }

    private static byte[] gzip(final byte[] content) throws IOException {
        final var outputStream = new ByteArrayOutputStream();
        try (final var gzipOutputStream = new GZIPOutputStream(outputStream)) {
            gzipOutputStream.write(content);
        }

        return outputStream.toByteArray();
    }

}
