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

import org.vulnrisk.common.config.SourceConfig;
import org.vulnrisk.vulnenrichment.api.EnrichmentContext;
import org.vulnrisk.vulnenrichment.api.VulnEnricherFactory;

import java.net.URI;

/**
 * @since 1.0.0
 */
public final class EpssSourceFactory implements VulnEnricherFactory<EpssSource> {

    static final String NAME = "epss";
    static final String CACHE_NAME = "epss_cache";
    static final URI DEFAULT_URL = URI.create("https://api.first.org/data/v1/epss");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled(EnrichmentContext ctx) {
        return new SourceConfig(ctx.config(), NAME).enabled();
    }

    @Override
    public EpssSource create(EnrichmentContext ctx) {
        final var config = new SourceConfig(ctx.config(), NAME);
        if (!config.enabled()) {
            throw new IllegalStateException("Source %s is disabled".formatted(NAME));
        }

        return new EpssSource(
                ctx.cacheManager().getStore(CACHE_NAME),
                ctx.httpClient(),
                ctx.objectMapper(),
                config.url(DEFAULT_URL),
                config.timeout());
    }

}
