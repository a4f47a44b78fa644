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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * @param findings The enriched findings, in input order.
 * @param summary  Number of findings per priority.
 * @param failures Failures of individual sources. Their presence does not make the result partial.
 * @param partial  Whether enrichment was cut short by a deadline or interruption.
 *                 Findings that were not fully enriched only carry EPSS data, if any.
 * @since 1.0.0
 */
public record EnrichmentResult(
        List<JsonNode> findings,
        PrioritySummary summary,
        List<SourceFailure> failures,
        boolean partial) {

    public EnrichmentResult {
        findings = Collections.unmodifiableList(new ArrayList<>(findings));
        failures = List.copyOf(failures);
    }

}
