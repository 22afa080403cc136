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

import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Collection;
import java.util.Optional;

/**
 * @since 5.7.0
 */
public interface UpdaterDao {

    @SqlQuery("""
            SELECT "FINGERPRINT"
              FROM "UPDATER_FINGERPRINT"
             WHERE "UPDATER" = :updater
            """)
    Optional<String> getFingerprint(@Bind String updater);

    @SqlUpdate("""
            INSERT INTO "UPDATER_FINGERPRINT" ("UPDATER", "FINGERPRINT", "UPDATED_AT")
            VALUES (:updater, :fingerprint, NOW())
                ON CONFLICT ("UPDATER")
                DO UPDATE
               SET "FINGERPRINT" = EXCLUDED."FINGERPRINT"
                 , "UPDATED_AT" = EXCLUDED."UPDATED_AT"
            """)
    void upsertFingerprint(@Bind String updater, @Bind String fingerprint);

    @SqlBatch("""
            INSERT INTO "VULNERABILITY" (
              "UPDATER"
            , "NAME"
            , "DESCRIPTION"
            , "ISSUED"
            , "LINKS"
            , "SEVERITY"
            , "NORMALIZED_SEVERITY"
            , "PACKAGE_NAME"
            , "PACKAGE_KIND"
            , "DIST_DID"
            , "DIST_NAME"
            , "DIST_VERSION_ID"
            , "DIST_PRETTY_NAME"
            , "DIST_CPE"
            , "FIXED_IN_VERSION"
            , "UPDATED_AT"
            ) VALUES (
              :updater
            , :name
            , :description
            , :issued
            , :links
            , :severity
            , :normalizedSeverity
            , :packageName
            , :packageKind
            , :distDid
            , :distName
            , :distVersionId
            , :distPrettyName
            , :distCpe
            , :fixedInVersion
            , NOW()
            )
            ON CONFLICT ("UPDATER", "NAME", "PACKAGE_NAME", "PACKAGE_KIND", "DIST_DID", "DIST_VERSION_ID")
            DO UPDATE
            SET "DESCRIPTION" = EXCLUDED."DESCRIPTION"
              , "ISSUED" = EXCLUDED."ISSUED"
              , "LINKS" = EXCLUDED."LINKS"
              , "SEVERITY" = EXCLUDED."SEVERITY"
              , "NORMALIZED_SEVERITY" = EXCLUDED."NORMALIZED_SEVERITY"
              , "DIST_NAME" = EXCLUDED."DIST_NAME"
              , "DIST_PRETTY_NAME" = EXCLUDED."DIST_PRETTY_NAME"
              , "DIST_CPE" = EXCLUDED."DIST_CPE"
              , "FIXED_IN_VERSION" = EXCLUDED."FIXED_IN_VERSION"
              , "UPDATED_AT" = EXCLUDED."UPDATED_AT"
            """)
    int[] upsertVulnerabilities(@BindMethods Collection<VulnerabilityRow> rows);

    @SqlQuery("""
            SELECT COUNT(*)
              FROM "VULNERABILITY"
             WHERE "UPDATER" = :updater
            """)
    long countVulnerabilities(@Bind String updater);

}
