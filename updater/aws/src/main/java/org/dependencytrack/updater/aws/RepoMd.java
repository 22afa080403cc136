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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;

import java.util.List;
import java.util.Optional;

/**
 * Model of a yum repository's {@code repodata/repomd.xml}.
 *
 * @since 5.7.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JacksonXmlRootElement(localName = "repomd")
final class RepoMd {

    static final String TYPE_UPDATEINFO = "updateinfo";

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "data")
    private List<Data> data;

    List<Data> data() {
        return data != null ? data : List.of();
    }

    Optional<Data> findData(final String type) {
        return data().stream()
                .filter(data -> type.equals(data.type()))
                .findFirst();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Data {

        @JacksonXmlProperty(isAttribute = true, localName = "type")
        private String type;

        @JacksonXmlProperty(localName = "checksum")
        private Checksum checksum;

        @JacksonXmlProperty(localName = "location")
        private Location location;

        String type() {
            return type;
        }

        Checksum checksum() {
            return checksum;
        }

        Location location() {
            return location;
        }

    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Checksum {

        @JacksonXmlProperty(isAttribute = true, localName = "type")
        private String type;

        @JacksonXmlText
        private String value;

        String type() {
            return type;
        }

        String value() {
            return value != null ? value.trim() : null;
        }

    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Location {

        @JacksonXmlProperty(isAttribute = true, localName = "href")
        private String href;

        String href() {
            return href;
        }

    }

}
