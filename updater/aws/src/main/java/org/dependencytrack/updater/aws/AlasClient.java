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
import org.dependencytrack.updater.api.FetchResult;
import org.dependencytrack.updater.api.Fingerprint;
import org.dependencytrack.updater.api.UpdaterFetchException;
import org.dependencytrack.updater.common.context.OperationCancelledException;
import org.dependencytrack.updater.common.context.OperationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.zip.GZIPInputStream;

import static java.util.Objects.requireNonNull;

/**
 * Retrieves repository metadata and advisories from the mirrors of an Amazon Linux release.
 * <p>
 * Mirrors are tried in order. A mirror that fails in any way, including serving content
 * that does not match its advertised checksum, is skipped in favour of the next one.
 *
 * @since 5.7.0
 */
final class AlasClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(AlasClient.class);
    private static final Duration CANCELLATION_CHECK_INTERVAL = Duration.ofMillis(100);

    private final HttpClient httpClient;
    private final List<URI> mirrors;
    private final Duration timeout;
    private final boolean verifyChecksums;
    private final XmlMapper xmlMapper;

    AlasClient(
            final HttpClient httpClient,
            final List<URI> mirrors,
            final Duration timeout,
            final boolean verifyChecksums,
            final XmlMapper xmlMapper) {
        this.httpClient = requireNonNull(httpClient, "httpClient must not be null");
        this.mirrors = List.copyOf(requireNonNull(mirrors, "mirrors must not be null"));
        this.timeout = requireNonNull(timeout, "timeout must not be null");
        this.verifyChecksums = verifyChecksums;
        this.xmlMapper = requireNonNull(xmlMapper, "xmlMapper must not be null");
        if (this.mirrors.isEmpty()) {
            throw new IllegalArgumentException("mirrors must not be empty");
        }
    }

    List<URI> mirrors() {
        return mirrors;
    }

    /**
     * Resolve the mirrors of a release from its upstream mirror list.
     * <p>
     * The list contains one URL per line. Blank lines, and lines starting with {@code #}, are ignored.
     */
    static List<URI> resolveMirrors(
            final OperationContext ctx,
            final HttpClient httpClient,
            final URI mirrorListUri,
            final Duration timeout) throws IOException {
        LOGGER.debug("Resolving mirrors from {}", mirrorListUri);

        final HttpResponse<String> response = send(ctx, httpClient,
                newRequest(ctx, mirrorListUri, timeout), HttpResponse.BodyHandlers.ofString(), timeout);
        requireSuccess(response);

        final List<URI> mirrors = parseMirrorList(response.body());
        if (mirrors.isEmpty()) {
            throw new IOException("Mirror list at %s does not contain any mirrors".formatted(mirrorListUri));
        }

        LOGGER.debug("Resolved {} mirrors from {}", mirrors.size(), mirrorListUri);
        return mirrors;
    }

    static List<URI> parseMirrorList(final String mirrorList) throws IOException {
        final var mirrors = new ArrayList<URI>();
        for (final String line : mirrorList.split("\\R")) {
            final String trimmedLine = line.trim();
            if (trimmedLine.isEmpty() || trimmedLine.startsWith("#")) {
                continue;
            }

            try {
                mirrors.add(toMirrorUri(trimmedLine));
            } catch (IllegalArgumentException e) {
                throw new IOException("Mirror list contains invalid URL: " + trimmedLine, e);
            }
        }

        return mirrors;
    }

    /**
     * @throws IllegalArgumentException When {@code url} is not an absolute http(s) URL.
     */
    static URI toMirrorUri(final String url) {
        final URI uri = URI.create(url.trim());
        if (!uri.isAbsolute()
            || uri.getHost() == null
            || !("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))) {
            throw new IllegalArgumentException("Not an absolute http(s) URL: " + url);
        }

        // Mirror URLs denote directories; relative locations must resolve below them.
        return uri.getPath() != null && uri.getPath().endsWith("/")
                ? uri
                : URI.create(uri + "/");
    }

    /**
     * Fetch the {@code updateinfo} document, unless its checksum matches {@code priorFingerprint}.
     *
     * @param ctx              The context of the operation.
     * @param priorFingerprint Checksum of the last processed {@code updateinfo} document.
     * @return The {@link FetchResult}.
     * @throws UpdaterFetchException When no mirror was able to serve the document.
     */
    FetchResult fetchUpdates(final OperationContext ctx, final Fingerprint priorFingerprint) throws UpdaterFetchException {
        Exception lastException = null;
        for (final URI mirror : mirrors) {
            ctx.checkActive();

            try {
                return fetchUpdates(ctx, mirror, priorFingerprint);
            } catch (IOException e) {
                LOGGER.warn("Failed to fetch updates from mirror {}; Trying next mirror", mirror, e);
                lastException = e;
            }
        }

        throw new UpdaterFetchException(
                "Failed to fetch updates from any of %d mirrors".formatted(mirrors.size()), lastException);
    }

    private FetchResult fetchUpdates(
            final OperationContext ctx,
            final URI mirror,
            final Fingerprint priorFingerprint) throws IOException {
        final RepoMd.Data updateInfo = fetchRepoMd(ctx, mirror)
                .findData(RepoMd.TYPE_UPDATEINFO)
                .orElseThrow(() -> new IOException("Repository metadata of %s does not list %s".formatted(
                        mirror, RepoMd.TYPE_UPDATEINFO)));
        if (updateInfo.checksum() == null
            || updateInfo.checksum().value() == null
            || updateInfo.checksum().value().isEmpty()) {
            throw new IOException("Repository metadata of %s does not contain a checksum for %s".formatted(
                    mirror, RepoMd.TYPE_UPDATEINFO));
        }
        if (updateInfo.location() == null || updateInfo.location().href() == null) {
            throw new IOException("Repository metadata of %s does not contain a location for %s".formatted(
                    mirror, RepoMd.TYPE_UPDATEINFO));
        }

        final var fingerprint = Fingerprint.of(updateInfo.checksum().value());
        if (fingerprint.equals(priorFingerprint)) {
            LOGGER.debug("Checksum of {} did not change: {}", RepoMd.TYPE_UPDATEINFO, fingerprint);
            return FetchResult.unchanged();
        }

        final URI updatesUri = mirror.resolve(updateInfo.location().href());
        final Path updatesFile = download(ctx, updatesUri);
        try {
            if (verifyChecksums) {
                verifyChecksum(updatesFile, updateInfo.checksum());
            }
            return FetchResult.updated(open(updatesFile, updatesUri), fingerprint);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(updatesFile);
            throw e;
        }
    }

    private RepoMd fetchRepoMd(final OperationContext ctx, final URI mirror) throws IOException {
        final URI repoMdUri = mirror.resolve("repodata/repomd.xml");
        LOGGER.debug("Fetching repository metadata from {}", repoMdUri);

        final HttpResponse<byte[]> response = send(ctx, httpClient,
                newRequest(ctx, repoMdUri, timeout), HttpResponse.BodyHandlers.ofByteArray(), timeout);
        requireSuccess(response);
        return xmlMapper.readValue(response.body(), RepoMd.class);
    }

    private Path download(final OperationContext ctx, final URI uri) throws IOException {
        final Path tempFile = Files.createTempFile("alas-updates-", null);

        LOGGER.info("Downloading {} to {}", uri, tempFile);
        try {
            final HttpResponse<Path> response = send(ctx, httpClient,
                    newRequest(ctx, uri, timeout), HttpResponse.BodyHandlers.ofFile(tempFile), timeout);
            requireSuccess(response);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }

        return tempFile;
    }

    private static void verifyChecksum(final Path file, final RepoMd.Checksum checksum) throws IOException {
        final MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(toDigestAlgorithm(checksum.type()));
        } catch (NoSuchAlgorithmException e) {
            throw new IOException("Unsupported checksum type: " + checksum.type(), e);
        }

        try (final var digestInputStream = new DigestInputStream(Files.newInputStream(file), digest)) {
            digestInputStream.transferTo(OutputStream.nullOutputStream());
        }

        final String actualChecksum = HexFormat.of().formatHex(digest.digest());
        if (!actualChecksum.equalsIgnoreCase(checksum.value())) {
            throw new IOException("Checksum mismatch: expected %s, but got %s".formatted(
                    checksum.value(), actualChecksum));
        }
    }

    private static String toDigestAlgorithm(final String checksumType) {
        if (checksumType == null) {
            return "SHA-256";
        }

        return switch (checksumType.toLowerCase(Locale.ROOT)) {
            case "sha", "sha1" -> "SHA-1";
            case "sha224" -> "SHA-224";
            case "sha256" -> "SHA-256";
            case "sha384" -> "SHA-384";
            case "sha512" -> "SHA-512";
            default -> checksumType;
        };
    }

    private static InputStream open(final Path file, final URI uri) throws IOException {
        final InputStream fileInputStream = Files.newInputStream(file, StandardOpenOption.DELETE_ON_CLOSE);
        final var bufferedInputStream = new BufferedInputStream(fileInputStream);
        if (!uri.getPath().endsWith(".gz")) {
            return bufferedInputStream;
        }

        try {
            return new GZIPInputStream(bufferedInputStream);
        } catch (IOException e) {
            bufferedInputStream.close();
            throw e;
        }
    }

    private static HttpRequest newRequest(final OperationContext ctx, final URI uri, final Duration timeout) {
        return HttpRequest.newBuilder()
                .uri(uri)
                .timeout(effectiveTimeout(ctx, timeout))
                .GET()
                .build();
    }

    /**
     * Send a request, bounding the <em>entire</em> exchange, including the transfer of the
     * response body, by the smaller of {@code timeout} and the time remaining in {@code ctx}.
     * <p>
     * {@code bodyHandler} must only complete once the body was fully received.
     * Cancellation of {@code ctx} aborts the exchange within {@link #CANCELLATION_CHECK_INTERVAL}.
     */
    private static <T> HttpResponse<T> send(
            final OperationContext ctx,
            final HttpClient httpClient,
            final HttpRequest request,
            final HttpResponse.BodyHandler<T> bodyHandler,
            final Duration timeout) throws IOException {
        ctx.checkActive();

        final Duration effectiveTimeout = effectiveTimeout(ctx, timeout);
        final long deadlineNanos = System.nanoTime() + effectiveTimeout.toNanos();
        final CompletableFuture<HttpResponse<T>> responseFuture = httpClient.sendAsync(request, bodyHandler);
        try {
            while (true) {
                if (ctx.isDone()) {
                    responseFuture.cancel(true);
                    ctx.checkActive();
                }

                final long remainingNanos = deadlineNanos - System.nanoTime();
                if (remainingNanos <= 0) {
                    responseFuture.cancel(true);
                    ctx.checkActive();
                    throw new HttpTimeoutException(
                            "Request to %s timed out after %s".formatted(request.uri(), effectiveTimeout));
                }

                try {
                    final HttpResponse<T> response = responseFuture.get(
                            Math.min(remainingNanos, CANCELLATION_CHECK_INTERVAL.toNanos()), TimeUnit.NANOSECONDS);
                    ctx.checkActive();
                    return response;
                } catch (TimeoutException e) {
                    LOGGER.trace("Still waiting for response from {}", request.uri());
                }
            }
        } catch (ExecutionException e) {
            if (e.getCause() instanceof final IOException ioException) {
                throw ioException;
            }

            throw new IOException("Request to %s failed".formatted(request.uri()), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            responseFuture.cancel(true);
            final var cancelled = new OperationCancelledException(
                    OperationCancelledException.Reason.CANCELLED,
                    "Interrupted while waiting for response from " + request.uri());
            cancelled.initCause(e);
            throw cancelled;
        }
    }

    private static Duration effectiveTimeout(final OperationContext ctx, final Duration timeout) {
        final Duration effectiveTimeout = ctx.boundTimeout(timeout);
        return effectiveTimeout.toMillis() < 1 ? Duration.ofMillis(1) : effectiveTimeout;
    }

    private static void requireSuccess(final HttpResponse<?> response) throws IOException {
        if (response.statusCode() != 200) {
            throw new IOException("Unexpected response code %d from %s".formatted(
                    response.statusCode(), response.uri()));
        }
    }

}
