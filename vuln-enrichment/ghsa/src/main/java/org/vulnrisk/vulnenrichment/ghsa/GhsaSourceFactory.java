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
package org.vulnrisk.vulnenrichment.ghsa;

import org.vulnrisk.common.config.SourceConfig;
import org.vulnrisk.vulnenrichment.api.EnrichmentContext;
import org.vulnrisk.vulnenrichment.api.VulnEnricherFactory;

import java.net.URI;

/**
 * The GHSA source is only enabled when a GitHub token is configured
 * via {@code github.token}, or the {@code GITHUB_TOKEN} environment variable.
 *
 * @since 1.0.0
 */
public final class GhsaSourceFactory implements VulnEnricherFactory<GhsaSource> {

    static final String NAME = "ghsa";
    static final String CACHE_NAME = "ghsa_cache";
    static final String TOKEN_PROPERTY = "github.token";
    static final URI DEFAULT_URL = URI.create("https://api.github.com/graphql");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled(EnrichmentContext ctx) {
        final var config = new SourceConfig(ctx.config(), NAME);
        return config.enabled() && config.credential(TOKEN_PROPERTY).isPresent();
    }

    @Override
    public GhsaSource create(EnrichmentContext ctx) {
        final var config = new SourceConfig(ctx.config(), NAME);
        if (!config.enabled()) {
            throw new IllegalStateException("Source %s is disabled".formatted(NAME));
        }

        final String token = config.credential(TOKEN_PROPERTY)
                .orElseThrow(() -> new IllegalStateException(
                        "Source %s requires %s to be configured".formatted(NAME, TOKEN_PROPERTY)));

        return new GhsaSource(
                ctx.cacheManager().getStore(CACHE_NAME),
                ctx.httpClient(),
                ctx.objectMapper(),
                config.url(DEFAULT_URL),
                config.timeout(),
                token);
    }

}
