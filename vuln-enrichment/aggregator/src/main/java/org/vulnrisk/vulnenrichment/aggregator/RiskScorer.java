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

import com.fasterxml.jackson.databind.JsonNode;
import org.vulnrisk.vulnenrichment.api.FindingNodes;
import org.vulnrisk.vulnenrichment.api.Priority;

import java.math.BigDecimal;
import java.math.RoundingMode;

import static java.util.Objects.requireNonNull;

/**
 * Computes risk scores and priorities from the signals attached to a finding.
 * Absent or malformed signals contribute nothing.
 *
 * @since 1.0.0
 */
public final class RiskScorer {

    private final RiskWeights weights;

    public RiskScorer(RiskWeights weights) {
        this.weights = requireNonNull(weights, "weights must not be null");
    }

    /**
     * @return The risk score in {@code [0, 100]}, rounded to two decimal places.
     */
    public double score(JsonNode finding) {
        final double cvss = FindingNodes.firstNumber(finding, "cvssScore", "cvss_score", "cvss").orElse(0.0);
        final double epssScore = FindingNodes.firstNumber(finding.path("epss"), "epssScore").orElse(0.0);

        final double exploitFactor;
        if (isWeaponized(finding)) {
            exploitFactor = 1.0;
        } else if (finding.path("exploit").path("available").asBoolean(false)) {
            exploitFactor = 0.5;
        } else {
            exploitFactor = 0.0;
        }

        final double rawScore = weights.cvss() * (cvss / 10)
                + weights.epss() * epssScore
                + weights.kev() * (isInKev(finding) ? 1 : 0)
                + weights.exploit() * exploitFactor;
        if (Double.isNaN(rawScore)) {
            return 0.0;
        }

        final double clampedScore = Math.max(0.0, Math.min(100.0, rawScore));
        return BigDecimal.valueOf(clampedScore)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public Priority priority(JsonNode finding, double score) {
        if (isInKev(finding)) {
            return Priority.P0_IMMEDIATE;
        }

        final Priority scorePriority;
        if (score >= weights.criticalThreshold()) {
            scorePriority = Priority.P1_CRITICAL;
        } else if (score >= weights.highThreshold()) {
            scorePriority = Priority.P2_HIGH;
        } else if (score >= weights.mediumThreshold()) {
            scorePriority = Priority.P3_MEDIUM;
        } else {
            scorePriority = Priority.P4_LOW;
        }

        return isWeaponized(finding)
                ? Priority.mostUrgent(scorePriority, Priority.P1_CRITICAL)
                : scorePriority;
    }

    public Priority priority(JsonNode finding) {
        return priority(finding, score(finding));
    }

    private static boolean isInKev(JsonNode finding) {
        return finding.path("kev").path("inKev").asBoolean(false);
    }

    private static boolean isWeaponized(JsonNode finding) {
        return finding.path("exploit").path("weaponized").asBoolean(false);
    }

}
