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
package org.vulnrisk.vulnenrichment.api;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A syntactically valid CVE identifier, e.g. {@code CVE-2021-44228}.
 *
 * @since 1.0.0
 */
public record CveId(String value) implements Comparable<CveId> {

    private static final Pattern PATTERN = Pattern.compile("^CVE-\\d{4}-\\d+$");

    public CveId {
        if (!isValid(value)) {
            throw new ValidationException("Invalid CVE ID: %s".formatted(value));
        }
    }

    public static CveId of(@Nullable String value) {
        return new CveId(value);
    }

    public static boolean isValid(@Nullable String value) {
        return value != null && PATTERN.matcher(value).matches();
    }

    /**
     * Extracts the CVE ID of a finding.
     * <p>
     * The ID is taken from the first non-empty of the fields {@code cve},
     * {@code id} and {@code vulnerability.id}, in that order. When that value
     * is not a valid CVE ID, the finding is considered to have none.
     *
     * @param finding The finding to extract the CVE ID from.
     * @return The extracted {@link CveId}, or {@link Optional#empty()} when the
     * finding is not an object or does not carry a valid CVE ID.
     */
    public static Optional<CveId> extract(@Nullable JsonNode finding) {
        if (finding == null || !finding.isObject()) {
            return Optional.empty();
        }

        String candidate = FindingNodes.optionalText(finding, "cve");
        if (candidate == null) {
            candidate = FindingNodes.optionalText(finding, "id");
        }
        if (candidate == null) {
            candidate = FindingNodes.optionalText(finding.path("vulnerability"), "id");
        }

        return isValid(candidate)
                ? Optional.of(new CveId(candidate))
                : Optional.empty();
    }

    @Override
    public int compareTo(CveId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }

}
