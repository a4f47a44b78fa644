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

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;

/**
 * A source of risk signals for individual findings.
 * <p>
 * Enrichers attach their results to the given finding under their own field,
 * and never remove data that was written by other enrichers.
 * Enrichers must be safe for concurrent use.
 *
 * @since 1.0.0
 */
public interface VulnEnricher {

    /**
     * @return Name of the enricher, used in logs, metrics, and failure reports.
     */
    String name();

    /**
     * Enriches a finding in place.
     * <p>
     * Findings without a valid CVE ID are enriched with the enricher's "no data" result.
     *
     * @param finding The finding to enrich.
     * @throws IOException When the enricher's remote source could not be reached,
     *                     and no cached data was available to fall back to.
     */
    void enrich(ObjectNode finding) throws IOException;

}
