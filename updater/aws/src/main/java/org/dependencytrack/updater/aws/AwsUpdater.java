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

import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.dependencytrack.updater.api.ConfigUnmarshaler;
import org.dependencytrack.updater.api.Configurable;
import org.dependencytrack.updater.api.FetchResult;
import org.dependencytrack.updater.api.Fingerprint;
import org.dependencytrack.updater.api.MalformedContentException;
import org.dependencytrack.updater.api.Updater;
import org.dependencytrack.updater.api.UpdaterConfigurationException;
import org.dependencytrack.updater.api.UpdaterFetchException;
import org.dependencytrack.updater.api.VulnerabilityRecord;
import org.dependencytrack.updater.common.context.OperationContext;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An {@link Updater} for Amazon Linux Security Advisories (ALAS) of a single {@link Release}.
 * <p>
 * Changes are detected using the checksum of the {@code updateinfo} document,
 * as advertised by the repository metadata. The document is only downloaded when
 * that checksum differs from the prior {@link Fingerprint}.
 *
 * @since 5.7.0
 */
public final class AwsUpdater implements Updater, Configurable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AwsUpdater.class);

    private final Release release;
    private final URI mirrorListUri;
    private final XmlMapper xmlMapper;
    private final AlasUpdateParser parser;
    private AwsUpdaterConfig config;
    private volatile @Nullable AlasClient client;

    public AwsUpdater(final Release release) {
        this(release, release.mirrorListUri());
    }

    AwsUpdater(final Release release, final URI mirrorListUri) {
        this.release = requireNonNull(release, "release must not be null");
        this.mirrorListUri = requireNonNull(mirrorListUri, "mirrorListUri must not be null");
        this.xmlMapper = AlasXml.createMapper();
        this.parser = new AlasUpdateParser(xmlMapper, name(), release.distribution());
        this.config = new AwsUpdaterConfig();
    }

    @Override
    public String name() {
        return "aws-%s-updater".formatted(release.id());
    }

    public Release release() {
        return release;
    }

    @Override
    public synchronized void configure(
            final OperationContext ctx,
            final ConfigUnmarshaler unmarshaler,
            final HttpClient httpClient) throws UpdaterConfigurationException {
        requireNonNull(ctx, "ctx must not be null");
        requireNonNull(unmarshaler, "unmarshaler must not be null");
        requireNonNull(httpClient, "httpClient must not be null");
        if (client != null) {
            throw new IllegalStateException("Updater %s is already configured".formatted(name()));
        }

        final var newConfig = new AwsUpdaterConfig();
        try {
            unmarshaler.unmarshal(newConfig);
        } catch (IOException e) {
            throw new UpdaterConfigurationException(
                    "Failed to unmarshal configuration of %s".formatted(name()), e);
        }

        final Duration timeout = newConfig.getTimeout();
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new UpdaterConfigurationException(
                    "Timeout of %s must be positive, but is %s".formatted(name(), timeout));
        }

        final var mirrors = new ArrayList<URI>();
        if (newConfig.getMirrors() != null) {
            for (final String mirror : newConfig.getMirrors()) {
                if (mirror == null || mirror.isBlank()) {
                    throw new UpdaterConfigurationException(
                            "Empty mirror configured for %s".formatted(name()));
                }

                try {
                    mirrors.add(AlasClient.toMirrorUri(mirror));
                } catch (IllegalArgumentException e) {
                    throw new UpdaterConfigurationException(
                            "Invalid mirror configured for %s: %s".formatted(name(), mirror), e);
                }
            }
        }

        if (mirrors.isEmpty()) {
            try {
                mirrors.addAll(AlasClient.resolveMirrors(ctx, httpClient, mirrorListUri, timeout));
            } catch (IOException e) {
                throw new UpdaterConfigurationException(
                        "Failed to resolve mirrors of %s".formatted(name()), e);
            }
        } else {
            LOGGER.debug("Using {} explicitly configured mirrors for {}", mirrors.size(), name());
        }

        this.config = newConfig;
        this.client = new AlasClient(httpClient, mirrors, timeout, newConfig.isVerifyChecksums(), xmlMapper);
        LOGGER.info("Configured {} with {} mirrors and timeout {}", name(), mirrors.size(), timeout);
    }

    @Override
    public FetchResult fetch(final OperationContext ctx, final Fingerprint priorFingerprint) throws UpdaterFetchException {
        requireNonNull(ctx, "ctx must not be null");
        requireNonNull(priorFingerprint, "priorFingerprint must not be null");

        AlasClient fetchClient = client;
        if (fetchClient == null) {
            // Not configured; Fall back to a client that lives for this call only.
            fetchClient = newDefaultClient(ctx);
        }

        return fetchClient.fetchUpdates(ctx, priorFingerprint);
    }

    @Override
    public List<VulnerabilityRecord> parse(final OperationContext ctx, final InputStream content) throws MalformedContentException {
        requireNonNull(ctx, "ctx must not be null");
        requireNonNull(content, "content must not be null");

        return parser.parse(ctx, content);
    }

    AwsUpdaterConfig config() {
        return config;
    }

    @Nullable
    AlasClient client() {
        return client;
    }

    private AlasClient newDefaultClient(final OperationContext ctx) throws UpdaterFetchException {
        final HttpClient httpClient = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();

        final List<URI> mirrors;
        try {
            mirrors = AlasClient.resolveMirrors(ctx, httpClient, mirrorListUri, config.getTimeout());
        } catch (IOException e) {
            throw new UpdaterFetchException("Failed to resolve mirrors of %s".formatted(name()), e);
        }

        return new AlasClient(httpClient, mirrors, config.getTimeout(), config.isVerifyChecksums(), xmlMapper);
    }

    @Override
    public String toString() {
        return name();
    }

}
