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
package org.dependencytrack.updater.support.liquibase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.postgresql.ds.PGSimpleDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatNoException;

@Testcontainers(disabledWithoutDocker = true)
class MigrationExecutorTest {

    @Container
    private final PostgreSQLContainer<?> postgresContainer =
            new PostgreSQLContainer<>(DockerImageName.parse("postgres:14-alpine"));

    private PGSimpleDataSource dataSource;

    @BeforeEach
    void beforeEach() {
        dataSource = new PGSimpleDataSource();
        dataSource.setUrl(postgresContainer.getJdbcUrl());
        dataSource.setUser(postgresContainer.getUsername());
        dataSource.setPassword(postgresContainer.getPassword());
    }

    @Test
    void shouldExecuteMigration() throws Exception {
        assertThatNoException()
                .isThrownBy(new MigrationExecutor(dataSource, "migration/changelog-test.xml")::executeMigration);

        assertThat(queryChangeSetId("databasechangelog")).isEqualTo("1");
    }

    @Test
    void shouldBeIdempotent() throws Exception {
        final var executor = new MigrationExecutor(dataSource, "migration/changelog-test.xml");
        executor.executeMigration();

        assertThatNoException().isThrownBy(executor::executeMigration);
        assertThat(queryChangeSetId("databasechangelog")).isEqualTo("1");
    }

    @Test
    void shouldExecuteMigrationWithCustomChangeLogTableName() throws Exception {
        assertThatNoException()
                .isThrownBy(
                        new MigrationExecutor(dataSource, "migration/changelog-test.xml")
                                .withChangeLogTableName("updater_changelog")
                                .withChangeLogLockTableName("updater_changeloglock")
                                ::executeMigration);

        assertThat(queryChangeSetId("updater_changelog")).isEqualTo("1");
    }

    @Test
    void shouldThrowWhenChangelogDoesNotExist() {
        assertThatExceptionOfType(MigrationException.class)
                .isThrownBy(new MigrationExecutor(dataSource, "migration/does-not-exist.xml")::executeMigration)
                .withMessage("Failed to apply changelog migration/does-not-exist.xml");
    }

    private String queryChangeSetId(final String tableName) throws Exception {
        try (final Connection connection = dataSource.getConnection();
             final PreparedStatement ps = connection.prepareStatement("select id from " + tableName)) {
            final ResultSet rs = ps.executeQuery();
            assertThat(rs.next()).isTrue();
            return rs.getString("id");
        }
    }

}
