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

import liquibase.logging.core.AbstractLogService;
import liquibase.logging.core.AbstractLogger;
import liquibase.plugin.Plugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.logging.Level;

/**
 * Routes Liquibase's JUL-style logging through SLF4J.
 *
 * @since 5.7.0
 */
final class LiquibaseLogger extends AbstractLogger {

    private final Logger logger;

    LiquibaseLogger(final Class<?> clazz) {
        this.logger = LoggerFactory.getLogger(clazz);
    }

    @Override
    public void log(final Level level, final String message, final Throwable e) {
        if (Level.OFF.equals(level)) {
            return;
        }

        final int value = level.intValue();
        if (value >= Level.SEVERE.intValue()) {
            logger.error(message, e);
        } else if (value >= Level.WARNING.intValue()) {
            logger.warn(message, e);
        } else if (value >= Level.INFO.intValue()) {
            logger.info(message, e);
        } else if (value >= Level.FINE.intValue()) {
            logger.debug(message, e);
        } else {
            logger.trace(message, e);
        }
    }

    static final class LogService extends AbstractLogService {

        @Override
        public int getPriority() {
            return Plugin.PRIORITY_SPECIALIZED;
        }

        @Override
        public liquibase.logging.Logger getLog(final Class clazz) {
            return new LiquibaseLogger(clazz);
        }

    }

}
