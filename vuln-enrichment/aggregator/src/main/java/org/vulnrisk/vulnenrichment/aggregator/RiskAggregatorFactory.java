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

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vulnrisk.vulnenrichment.api.EnrichmentContext;
import org.vulnrisk.vulnenrichment.api.VulnEnricher;
import org.vulnrisk.vulnenrichment.api.VulnEnricherFactory;
import org.vulnrisk.vulnenrichment.epss.EpssSource;
import org.vulnrisk.vulnenrichment.epss.EpssSourceFactory;
import org.vulnrisk.vulnenrichment.ghsa.GhsaSourceFactory;
import org.vulnrisk.vulnenrichment.kev.KevSourceFactory;
import org.vulnrisk.vulnenrichment.vulncheck.ExploitIntelSourceFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static java.util.Objects.requireNonNull;

/**
 * Creates {@link RiskAggregator}s from an {@link EnrichmentContext}.
 * <p>
 * Sources that are disabled, or lack required credentials, are left out.
 *
 * @since 1.0.0
 */
public final class RiskAggregatorFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(RiskAggregatorFactory.class);

    static final String CONCURRENCY_PROPERTY = "vulnrisk.aggregator.concurrency";
    static final int DEFAULT_CONCURRENCY = 8;

    private final EpssSourceFactory epssSourceFactory = new EpssSourceFactory();
    private final List<VulnEnricherFactory<?>> findingEnricherFactories = List.of(
            new KevSourceFactory(),
            new ExploitIntelSourceFactory(),
            new GhsaSourceFactory());

    public RiskAggregator create(EnrichmentContext ctx) {
        return create(ctx, null);
    }

    /**
     * @param ctx           The context to create sources from.
     * @param meterRegistry Registry to record metrics in, or {@code null} to disable metrics.
     * @return A new {@link RiskAggregator}. Callers are responsible for closing it.
     * @throws IllegalStateException When the configuration is invalid.
     */
    public RiskAggregator create(EnrichmentContext ctx, @Nullable MeterRegistry meterRegistry) {
        requireNonNull(ctx, "ctx must not be null");

        final int concurrency = ctx.config()
                .getOptionalValue(CONCURRENCY_PROPERTY, int.class)
                .orElse(DEFAULT_CONCURRENCY);
        if (concurrency <= 0) {
            throw new IllegalStateException(
                    "%s must be greater than 0, but is %d".formatted(CONCURRENCY_PROPERTY, concurrency));
        }

        final var scorer = new RiskScorer(RiskWeights.fromConfig(ctx.config()));

        EpssSource epssSource = null;
        if (epssSourceFactory.isEnabled(ctx)) {
            epssSource = epssSourceFactory.create(ctx);
        } else {
            LOGGER.info("Source {} is disabled", epssSourceFactory.name());
        }

        final var findingEnrichers = new ArrayList<VulnEnricher>(findingEnricherFactories.size());
        for (final VulnEnricherFactory<?> factory : findingEnricherFactories) {
            if (factory.isEnabled(ctx)) {
                findingEnrichers.add(factory.create(ctx));
            } else {
                LOGGER.info("Source {} is disabled", factory.name());
            }
        }

        final ExecutorService executor = Executors.newFixedThreadPool(concurrency, new BasicThreadFactory.Builder()
                .namingPattern("RiskAggregator-Worker-%d")
                .daemon(true)
                .build());
        if (meterRegistry != null) {
            new ExecutorServiceMetrics(executor, "vulnrisk.aggregator", null)
                    .bindTo(meterRegistry);
        }

        return new RiskAggregator(epssSource, findingEnrichers, scorer, executor, meterRegistry);
    }

}
