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
import org.dependencytrack.updater.api.AffectedPackage;
import org.dependencytrack.updater.api.Distribution;
import org.dependencytrack.updater.api.MalformedContentException;
import org.dependencytrack.updater.api.VulnerabilityRecord;
import org.dependencytrack.updater.common.context.OperationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Decodes ALAS {@code updateinfo.xml} documents into {@link VulnerabilityRecord}s.
 * <p>
 * Documents are decoded one {@code update} element at a time, such that records
 * of advisories preceding a malformed one can still be returned.
 *
 * @since 5.7.0
 */
final class AlasUpdateParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(AlasUpdateParser.class);
    private static final DateTimeFormatter ISSUED_DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final XmlMapper xmlMapper;
    private final String updaterName;
    private final Distribution distribution;

    AlasUpdateParser(final XmlMapper xmlMapper, final String updaterName, final Distribution distribution) {
        this.xmlMapper = requireNonNull(xmlMapper, "xmlMapper must not be null");
        this.updaterName = requireNonNull(updaterName, "updaterName must not be null");
        this.distribution = requireNonNull(distribution, "distribution must not be null");
    }

    List<VulnerabilityRecord> parse(final OperationContext ctx, final InputStream content) throws MalformedContentException {
        final var records = new ArrayList<VulnerabilityRecord>();

        XMLStreamReader reader = null;
        try {
            reader = xmlMapper.getFactory().getXMLInputFactory().createXMLStreamReader(content);

            int advisoriesParsed = 0;
            while (reader.hasNext()) {
                if (reader.next() != XMLStreamConstants.START_ELEMENT
                    || !"update".equals(reader.getLocalName())) {
                    continue;
                }

                ctx.checkActive();

                // Leaves the reader positioned at the matching END_ELEMENT.
                final AlasUpdate update = xmlMapper.readValue(reader, AlasUpdate.class);
                records.addAll(convert(update, records));
                advisoriesParsed++;
            }

            LOGGER.debug("Parsed {} records from {} advisories", records.size(), advisoriesParsed);
        } catch (XMLStreamException | IOException e) {
            throw new MalformedContentException(
                    "Failed to decode updateinfo document after %d records".formatted(records.size()), e, records);
        } finally {
            closeQuietly(reader);
        }

        return records;
    }

    private List<VulnerabilityRecord> convert(
            final AlasUpdate update,
            final List<VulnerabilityRecord> recordsSoFar) throws MalformedContentException {
        if (update.id() == null || update.id().isBlank()) {
            throw new MalformedContentException("Encountered advisory without ID", null, recordsSoFar);
        }

        final Instant issued;
        try {
            issued = parseIssuedDate(update.issuedDate());
        } catch (DateTimeParseException e) {
            throw new MalformedContentException(
                    "Failed to parse issued date of advisory %s".formatted(update.id()), e, recordsSoFar);
        }

        final String links = update.references().stream()
                .map(AlasUpdate.Reference::href)
                .filter(Objects::nonNull)
                .collect(Collectors.joining(" "));

        final VulnerabilityRecord.Builder sharedBuilder = VulnerabilityRecord.builder()
                .updater(updaterName)
                .name(update.id())
                .description(update.description())
                .issued(issued)
                .links(links)
                .severity(update.severity())
                .normalizedSeverity(AlasSeverity.normalize(update.severity()))
                .distribution(distribution);

        final var records = new ArrayList<VulnerabilityRecord>(update.packages().size());
        for (final AlasUpdate.Package alasPackage : update.packages()) {
            if (alasPackage.name() == null) {
                throw new MalformedContentException(
                        "Encountered package without name in advisory %s".formatted(update.id()), null, recordsSoFar);
            }

            records.add(sharedBuilder
                    .affectedPackage(AffectedPackage.binary(alasPackage.name()))
                    .fixedInVersion("%s-%s".formatted(
                            Objects.toString(alasPackage.version(), ""),
                            Objects.toString(alasPackage.release(), "")))
                    .build());
        }

        return records;
    }

    static Instant parseIssuedDate(final String date) {
        if (date == null) {
            throw new DateTimeParseException("Date is missing", "", 0);
        }

        return LocalDateTime.parse(date.trim(), ISSUED_DATE_FORMATTER).toInstant(ZoneOffset.UTC);
    }

    private static void closeQuietly(final XMLStreamReader reader) {
        if (reader == null) {
            return;
        }

        try {
            reader.close();
        } catch (XMLStreamException e) {
            LOGGER.debug("Failed to close XML stream reader", e);
        }
    }

}
