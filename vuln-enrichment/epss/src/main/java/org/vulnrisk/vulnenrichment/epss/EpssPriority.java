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
package org.vulnrisk.vulnenrichment.epss;

import org.vulnrisk.vulnenrichment.api.ValidationException;

/**
 * @since 1.0.0
 */
public enum EpssPriority {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * @param score The EPSS score to map.
     * @return The band the score falls into.
     * @throws ValidationException When the score is not within {@code [0, 1]}.
     */
    public static EpssPriority of(double score) {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new ValidationException("EPSS score must be between 0.0 and 1.0, but is %s".formatted(score));
        }

        if (score >= 0.75) {
            return CRITICAL;
        } else if (score >= 0.50) {
            return HIGH;
        } else if (score >= 0.25) {
            return MEDIUM;
        }

        return LOW;
    }

}
