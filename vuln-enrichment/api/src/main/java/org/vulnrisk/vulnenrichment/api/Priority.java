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

import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * Remediation priority of a finding, from most to least urgent.
 *
 * @since 1.0.0
 */
public enum Priority {

    P0_IMMEDIATE("P0-IMMEDIATE"),
    P1_CRITICAL("P1-CRITICAL"),
    P2_HIGH("P2-HIGH"),
    P3_MEDIUM("P3-MEDIUM"),
    P4_LOW("P4-LOW");

    private final String label;

    Priority(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isMoreUrgentThan(Priority other) {
        return ordinal() < other.ordinal();
    }

    /**
     * @return The more urgent of both priorities.
     */
    public static Priority mostUrgent(Priority first, Priority second) {
        return second.isMoreUrgentThan(first) ? second : first;
    }

    public static Optional<Priority> fromLabel(@Nullable String label) {
        if (label == null) {
            return Optional.empty();
        }

        for (final Priority priority : values()) {
            if (priority.label.equals(label)) {
                return Optional.of(priority);
            }
        }

        return Optional.empty();
    }

}
