/*
 * This file is part of vulnrisk.
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
 * Copyright (c) The vulnrisk Authors. All Rights Reserved.
 */
package org.vulnrisk.vulnenrichment.kev;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * Known-exploited status of a CVE, as recorded in the CISA KEV catalog.
 * <p>
 * All fields but {@code inKev} are only populated for CVEs listed in the catalog.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KevRecord(
        boolean inKev,
        @Nullable String vulnerabilityName,
        @Nullable String vendorProject,
        @Nullable String product,
        @Nullable String dateAdded,
        @Nullable String dueDate,
        @Nullable String requiredAction,
        @Nullable String notes,
        @Nullable String shortDescription) {

    private static final KevRecord NOT_IN_KEV =
            new KevRecord(false, null, null, null, null, null, null, null, null);

    public static KevRecord notInKev() {
        return NOT_IN_KEV;
    }

    static KevRecord of(JsonNode catalogEntry) {
        return new KevRecord(
                true,
                catalogEntry.path("vulnerabilityName").asText(""),
                catalogEntry.path("vendorProject").asText(""),
                catalogEntry.path("product").asText(""),
                catalogEntry.path("dateAdded").asText(""),
                catalogEntry.path("dueDate").asText(""),
                catalogEntry.path("requiredAction").asText(""),
                catalogEntry.path("notes").asText(""),
                catalogEntry.path("shortDescription").asText(""));
    }

}
