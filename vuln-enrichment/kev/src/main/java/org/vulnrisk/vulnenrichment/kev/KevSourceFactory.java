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
package org.vulnrisk.vulnenrichment.kev;

import org.vulnrisk.common.config.SourceConfig;
import org.vulnrisk.vulnenrichment.api.EnrichmentContext;
import org.vulnrisk.vulnenrichment.api.VulnEnricherFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;

/**
 * @since 1.0.0
 */
public final class KevSourceFactory implements VulnEnricherFactory<KevSource> {

    static final String NAME = "kev";
    static final String CACHE_NAME = "kev_catalog";
    static final String FAILURE_BACKOFF_PROPERTY = "vulnrisk.source.kev.failure-backoff-ms";
    static final Duration DEFAULT_FAILURE_BACKOFF = Duration.ofMinutes(1);
    static final URI DEFAULT_URL = URI.create(
            "https://www.cisa.gov/sites/default/files/feeds/known_exploited_vulnerabilities.json");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled(EnrichmentContext ctx) {
        return new SourceConfig(ctx.config(), NAME).enabled();
    }

    @Override
    public KevSource create(EnrichmentContext ctx) {
        final var config = new SourceConfig(ctx.config(), NAME);
        if (!config.enabled()) {
            throw new IllegalStateException("Source %s is disabled".formatted(NAME));
        }

        return new KevSource(
                ctx.cacheManager().getStore(CACHE_NAME),
                ctx.httpClient(),
                ctx.objectMapper(),
                config.url(DEFAULT_URL),
                config.timeout(),
                failureBackoff(ctx),
                Clock.systemUTC());
    }

    private static Duration failureBackoff(EnrichmentContext ctx) {
        final Duration failureBackoff = ctx.config()
                .getOptionalValue(FAILURE_BACKOFF_PROPERTY, Long.class)
                .map(Duration::ofMillis)
                .orElse(DEFAULT_FAILURE_BACKOFF);
        if (failureBackoff.isNegative()) {
            throw new IllegalStateException(
                    "%s must not be negative, but is %d".formatted(FAILURE_BACKOFF_PROPERTY, failureBackoff.toMillis()));
        }

        return failureBackoff;
    }

}
