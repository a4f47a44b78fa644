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
package org.vulnrisk.vulnenrichment.aggregator;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import org.vulnrisk.vulnenrichment.api.FindingNodes;
import org.vulnrisk.vulnenrichment.api.Priority;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Number of findings per priority tier. All tiers are present, with a count of zero if necessary.
 *
 * @since 1.0.0
 */
public final class PrioritySummary {

    private final Map<Priority, Integer> countByPriority;

    private PrioritySummary(Map<Priority, Integer> countByPriority) {
        this.countByPriority = countByPriority;
    }

    /**
     * Counts the priorities of the given findings. Findings that are not objects,
     * or lack a known {@code priority}, are not counted.
     */
    public static PrioritySummary of(Collection<? extends JsonNode> findings) {
        final var countByPriority = new EnumMap<Priority, Integer>(Priority.class);
        for (final Priority priority : Priority.values()) {
            countByPriority.put(priority, 0);
        }

        for (final JsonNode finding : findings) {
            if (finding == null || !finding.isObject()) {
                continue;
            }

            final Optional<Priority> priority = FindingNodes.priority(finding);
            priority.ifPresent(value -> countByPriority.merge(value, 1, Integer::sum));
        }

        return new PrioritySummary(countByPriority);
    }

    public int count(Priority priority) {
        return countByPriority.get(priority);
    }

    public int total() {
        return countByPriority.values().stream().mapToInt(Integer::intValue).sum();
    }

    @JsonValue
    public Map<String, Integer> toMap() {
        final var countByLabel = new LinkedHashMap<String, Integer>();
        countByPriority.forEach((priority, count) -> countByLabel.put(priority.label(), count));
        return countByLabel;
    }

    @Override
    public boolean equals(Object other) {
        return this == other
                || (other instanceof PrioritySummary that && countByPriority.equals(that.countByPriority));
    }

    @Override
    public int hashCode() {
        return countByPriority.hashCode();
    }

    @Override
    public String toString() {
        return "PrioritySummary" + toMap();
    }

}
