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

/**
 * Accessors for the loosely typed fields of findings.
 *
 * @since 1.0.0
 */
public final class FindingNodes {

    public static final String PRIORITY_FIELD = "priority";

    private FindingNodes() {
    }

    /**
     * @return The text of {@code field}, or {@code null} when it is absent, not textual, or blank.
     */
    public static @Nullable String optionalText(JsonNode node, String field) {
        final JsonNode fieldNode = node.get(field);
        if (fieldNode == null || !fieldNode.isTextual() || fieldNode.asText().isBlank()) {
            return null;
        }

        return fieldNode.asText();
    }

    /**
     * @return The value of the first of the given fields that holds a number.
     */
    public static Optional<Double> firstNumber(JsonNode node, String... fields) {
        for (final String field : fields) {
            final JsonNode fieldNode = node.get(field);
            if (fieldNode != null && fieldNode.isNumber()) {
                return Optional.of(fieldNode.doubleValue());
            }
        }

        return Optional.empty();
    }

    public static Optional<Priority> priority(JsonNode finding) {
        return Priority.fromLabel(optionalText(finding, PRIORITY_FIELD));
    }

}
