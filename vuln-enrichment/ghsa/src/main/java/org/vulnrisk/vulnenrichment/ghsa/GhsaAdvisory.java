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
package org.vulnrisk.vulnenrichment.ghsa;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A GitHub Security Advisory.
 * <p>
 * An advisory with empty {@code ghsaId} is the "no advisory found" result.
 * When it also carries an {@code error}, looking up the advisory failed.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GhsaAdvisory(
        String ghsaId,
        String summary,
        @Nullable String description,
        @Nullable String severity,
        @Nullable String publishedAt,
        @Nullable String updatedAt,
        @Nullable String withdrawnAt,
        @Nullable String permalink,
        List<AffectedPackage> vulnerabilities,
        @Nullable List<String> references,
        @Nullable String error) {

    /**
     * @param firstPatchedVersion The first version not affected, or an empty string if no fix exists.
     */
    public record AffectedPackage(
            String packageName,
            String ecosystem,
            String vulnerableVersionRange,
            String firstPatchedVersion) {
    }

    private static final GhsaAdvisory EMPTY =
            new GhsaAdvisory("", "", null, null, null, null, null, null, List.of(), null, null);

    public GhsaAdvisory {
        vulnerabilities = vulnerabilities != null ? List.copyOf(vulnerabilities) : List.of();
        references = references != null ? List.copyOf(references) : null;
    }

    public static GhsaAdvisory empty() {
        return EMPTY;
    }

    static GhsaAdvisory failed(String error) {
        return new GhsaAdvisory("", "", null, null, null, null, null, null, List.of(), null, error);
    }

    public boolean isEmpty() {
        return ghsaId.isEmpty();
    }

}
