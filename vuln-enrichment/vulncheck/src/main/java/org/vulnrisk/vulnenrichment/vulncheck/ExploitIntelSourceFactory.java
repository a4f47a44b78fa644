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
package org.vulnrisk.vulnenrichment.vulncheck;

import org.vulnrisk.common.config.SourceConfig;
import org.vulnrisk.vulnenrichment.api.EnrichmentContext;
import org.vulnrisk.vulnenrichment.api.VulnEnricherFactory;

import java.net.URI;

/**
 * The API key is read from {@code vulncheck.api-key}, or the {@code VULNCHECK_API_KEY}
 * environment variable. The source remains enabled without it.
 *
 * @since 1.0.0
 */
public final class ExploitIntelSourceFactory implements VulnEnricherFactory<ExploitIntelSource> {

    static final String NAME = "vulncheck";
    static final String CACHE_NAME = "vulncheck_cache";
    static final String API_KEY_PROPERTY = "vulncheck.api-key";
    static final URI DEFAULT_URL = URI.create("https://api.vulncheck.com/v3/index/vulncheck-kev");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled(EnrichmentContext ctx) {
        return new SourceConfig(ctx.config(), NAME).enabled();
    }

    @Override
    public ExploitIntelSource create(EnrichmentContext ctx) {
        final var config = new SourceConfig(ctx.config(), NAME);
        if (!config.enabled()) {
            throw new IllegalStateException("Source %s is disabled".formatted(NAME));
        }

        return new ExploitIntelSource(
                ctx.cacheManager().getStore(CACHE_NAME),
                ctx.httpClient(),
                ctx.objectMapper(),
                config.url(DEFAULT_URL),
                config.timeout(),
                config.credential(API_KEY_PROPERTY).orElse(null));
    }

}
