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

import org.eclipse.microprofile.config.Config;

/**
 * Weights of the risk score terms, and the score thresholds of the priority tiers.
 * <p>
 * The score is {@code cvss * cvss/10 + epss * epssScore + kev * inKev + exploit * exploitFactor},
 * clamped to {@code [0, 100]}.
 *
 * @since 1.0.0
 */
public record RiskWeights(
        double cvss,
        double epss,
        double kev,
        double exploit,
        double criticalThreshold,
        double highThreshold,
        double mediumThreshold) {

    public static final RiskWeights DEFAULT = new RiskWeights(40, 30, 20, 10, 80, 60, 40);

    public RiskWeights {
        requireNonNegative("cvss", cvss);
        requireNonNegative("epss", epss);
        requireNonNegative("kev", kev);
        requireNonNegative("exploit", exploit);
        requireNonNegative("criticalThreshold", criticalThreshold);
        requireNonNegative("highThreshold", highThreshold);
        requireNonNegative("mediumThreshold", mediumThreshold);
        if (!(criticalThreshold > highThreshold && highThreshold > mediumThreshold)) {
            throw new IllegalArgumentException(
                    "Thresholds must be strictly descending, but are critical=%s, high=%s, medium=%s".formatted(
                            criticalThreshold, highThreshold, mediumThreshold));
        }
    }

    /**
     * Reads weights from {@code vulnrisk.risk.weight.*} and {@code vulnrisk.risk.threshold.*},
     * falling back to {@link #DEFAULT} for absent properties.
     *
     * @throws IllegalStateException When the configured values are invalid.
     */
    public static RiskWeights fromConfig(Config config) {
        try {
            return new RiskWeights(
                    config.getOptionalValue("vulnrisk.risk.weight.cvss", double.class).orElse(DEFAULT.cvss()),
                    config.getOptionalValue("vulnrisk.risk.weight.epss", double.class).orElse(DEFAULT.epss()),
                    config.getOptionalValue("vulnrisk.risk.weight.kev", double.class).orElse(DEFAULT.kev()),
                    config.getOptionalValue("vulnrisk.risk.weight.exploit", double.class).orElse(DEFAULT.exploit()),
                    config.getOptionalValue("vulnrisk.risk.threshold.critical", double.class).orElse(DEFAULT.criticalThreshold()),
                    config.getOptionalValue("vulnrisk.risk.threshold.high", double.class).orElse(DEFAULT.highThreshold()),
                    config.getOptionalValue("vulnrisk.risk.threshold.medium", double.class).orElse(DEFAULT.mediumThreshold()));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid risk configuration: " + e.getMessage(), e);
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
            throw new IllegalArgumentException("%s must be a non-negative number, but is %s".formatted(name, value));
        }
    }

}
