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
package org.dependencytrack.updater.runtime.persistence;

import org.dependencytrack.updater.api.Fingerprint;
import org.dependencytrack.updater.api.VulnerabilityRecord;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.postgres.PostgresPlugin;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * An {@link UpdaterStore} backed by PostgreSQL.
 * <p>
 * The schema is managed by the Liquibase changelog at {@link #CHANGELOG_PATH}.
 *
 * @since 5.7.0
 */
public final class JdbiUpdaterStore implements UpdaterStore {

    public static final String CHANGELOG_PATH = "org/dependencytrack/updater/runtime/persistence/changelog.xml";

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbiUpdaterStore.class);

    private final Jdbi jdbi;

    public JdbiUpdaterStore(final DataSource dataSource) {
        this(Jdbi.create(requireNonNull(dataSource, "dataSource must not be null"))
                .installPlugin(new SqlObjectPlugin())
                .installPlugin(new PostgresPlugin()));
    }

    JdbiUpdaterStore(final Jdbi jdbi) {
        this.jdbi = requireNonNull(jdbi, "jdbi must not be null");
    }

    @Override
    public Fingerprint getFingerprint(final String updater) {
        requireNonNull(updater, "updater must not be null");

        return jdbi.withExtension(UpdaterDao.class, dao -> dao.getFingerprint(updater))
                .map(Fingerprint::of)
                .orElse(Fingerprint.EMPTY);
    }

    @Override
    public void storeUpdate(final String updater, final Fingerprint fingerprint, final Collection<VulnerabilityRecord> records) {
        requireNonNull(updater, "updater must not be null");
        requireNonNull(fingerprint, "fingerprint must not be null");
        requireNonNull(records, "records must not be null");
        if (fingerprint.isEmpty()) {
            throw new IllegalArgumentException("fingerprint must not be empty");
        }

        final List<VulnerabilityRow> rows = toRows(updater, records);
        jdbi.useTransaction(handle -> {
            final var dao = handle.attach(UpdaterDao.class);
            if (!rows.isEmpty()) {
                dao.upsertVulnerabilities(rows);
            }
            dao.upsertFingerprint(updater, fingerprint.value());
        });

        LOGGER.debug("Stored {} records and fingerprint {} of {}", rows.size(), fingerprint, updater);
    }

    @Override
    public void storeRecords(final String updater, final Collection<VulnerabilityRecord> records) {
        requireNonNull(updater, "updater must not be null");
        requireNonNull(records, "records must not be null");

        final List<VulnerabilityRow> rows = toRows(updater, records);
        if (rows.isEmpty()) {
            return;
        }

        jdbi.useTransaction(handle -> handle.attach(UpdaterDao.class).upsertVulnerabilities(rows));
        LOGGER.debug("Stored {} records of {}", rows.size(), updater);
    }

    long countRecords(final String updater) {
        return jdbi.withExtension(UpdaterDao.class, dao -> dao.countVulnerabilities(updater));
    }

    private static List<VulnerabilityRow> toRows(final String updater, final Collection<VulnerabilityRecord> records) {
        // A single upsert statement must not touch the same row twice,
        // so duplicates within one batch are collapsed; the last one wins.
        final var rowsByKey = new LinkedHashMap<List<String>, VulnerabilityRow>(records.size());
        for (final VulnerabilityRecord record : records) {
            if (!Objects.equals(updater, record.updater())) {
                throw new IllegalArgumentException(
                        "Record %s was produced by %s, not %s".formatted(record.name(), record.updater(), updater));
            }

            final VulnerabilityRow row = VulnerabilityRow.of(record);
            rowsByKey.put(List.of(row.name(), row.packageName(), row.packageKind(), row.distDid(), row.distVersionId()), row);
        }

        return List.copyOf(rowsByKey.values());
    }

}
