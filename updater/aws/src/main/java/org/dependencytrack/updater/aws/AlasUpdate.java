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

import java.util.List;

/**
 * Model of a single {@code update} element of an ALAS {@code updateinfo.xml} document.
 *
 * @since 5.7.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
final class AlasUpdate {

    @JacksonXmlProperty(localName = "id")
    private String id;

    @JacksonXmlProperty(localName = "issued")
    private DateElement issued;

    @JacksonXmlProperty(localName = "severity")
    private String severity;

    @JacksonXmlProperty(localName = "description")
    private String description;

    @JacksonXmlElementWrapper(localName = "references")
    @JacksonXmlProperty(localName = "reference")
    private List<Reference> references;

    @JacksonXmlProperty(localName = "pkglist")
    private PackageList packageList;

    String id() {
        return id;
    }

    String issuedDate() {
        return issued != null ? issued.date : null;
    }

    String severity() {
        return severity;
    }

    String description() {
        return description;
    }

    List<Reference> references() {
        return references != null ? references : List.of();
    }

    /**
     * @return The packages of all collections of the {@code pkglist}, in document order.
     */
    List<Package> packages() {
        if (packageList == null || packageList.collections == null) {
            return List.of();
        }

        return packageList.collections.stream()
                .filter(collection -> collection.packages != null)
                .flatMap(collection -> collection.packages.stream())
                .toList();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class DateElement {

        @JacksonXmlProperty(isAttribute = true, localName = "date")
        private String date;

    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Reference {

        @JacksonXmlProperty(isAttribute = true, localName = "href")
        private String href;

        @JacksonXmlProperty(isAttribute = true, localName = "id")
        private String id;

        @JacksonXmlProperty(isAttribute = true, localName = "type")
        private String type;

        String href() {
            return href;
        }

        String id() {
            return id;
        }

        String type() {
            return type;
        }

    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class PackageList {

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "collection")
        private List<Collection> collections;

    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Collection {

        @JacksonXmlElementWrapper(useWrapping = false)
        @JacksonXmlProperty(localName = "package")
        private List<Package> packages;

    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class Package {

        @JacksonXmlProperty(isAttribute = true, localName = "name")
        private String name;

        @JacksonXmlProperty(isAttribute = true, localName = "epoch")
        private String epoch;

        @JacksonXmlProperty(isAttribute = true, localName = "version")
        private String version;

        @JacksonXmlProperty(isAttribute = true, localName = "release")
        private String release;

        @JacksonXmlProperty(isAttribute = true, localName = "arch")
        private String arch;

        String name() {
            return name;
        }

        String epoch() {
            return epoch;
        }

        String version() {
            return version;
        }

        String release() {
            return release;
        }

        String arch() {
            return arch;
        }

    }

}
