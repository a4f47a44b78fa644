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
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.vulnrisk.vulnenrichment.api.CveId;
import org.vulnrisk.vulnenrichment.api.FindingNodes;
import org.vulnrisk.vulnenrichment.api.Priority;
import org.vulnrisk.vulnenrichment.api.VulnEnricher;
import org.vulnrisk.vulnenrichment.epss.EpssSource;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static java.util.Objects.requireNonNull;

/**
 * Enriches findings with all configured sources, and scores and prioritizes them.
 * <p>
 * EPSS scores are fetched once for all findings. The remaining sources are
 * queried per finding, concurrently on a bounded pool of workers.
 * The input findings are never modified: enrichment happens on copies.
 *
 * @since 1.0.0
 */
public final class RiskAggregator implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RiskAggregator.class);

    static final String MDC_CVE = "vulnrisk.cve";

    private final @Nullable EpssSource epssSource;
    private final List<VulnEnricher> findingEnrichers;
    private final RiskScorer scorer;
    private final ExecutorService executor;
    private final @Nullable MeterRegistry meterRegistry;
    private final @Nullable Timer enrichmentTimer;

    /**
     * @param epssSource       The EPSS source, or {@code null} if disabled.
     * @param findingEnrichers Sources to query per finding, in the order they are to be applied.
     */
    RiskAggregator(
            @Nullable EpssSource epssSource,
            List<VulnEnricher> findingEnrichers,
            RiskScorer scorer,
            ExecutorService executor,
            @Nullable MeterRegistry meterRegistry) {
        this.epssSource = epssSource;
        this.findingEnrichers = List.copyOf(findingEnrichers);
        this.scorer = requireNonNull(scorer, "scorer must not be null");
        this.executor = requireNonNull(executor, "executor must not be null");
        this.meterRegistry = meterRegistry;
        this.enrichmentTimer = meterRegistry != null
                ? Timer.builder("vulnrisk.enrichment.duration")
                .description("Duration of enriching a list of findings")
                .register(meterRegistry)
                : null;
    }

    public EnrichmentResult enrichAll(List<? extends JsonNode> findings) {
        return enrichAll(findings, null);
    }

    /**
     * Enriches, scores, and prioritizes all given findings.
     * <p>
     * Elements that are not JSON objects are passed through unchanged.
     * When {@code deadline} passes, or the calling thread is interrupted, outstanding
     * work is cancelled and a {@linkplain EnrichmentResult#partial() partial} result is returned.
     * The interrupt flag of the calling thread is retained.
     *
     * @param findings The findings to enrich.
     * @param deadline Point in time at which to stop waiting for outstanding work, if any.
     * @return The enrichment result.
     */
    public EnrichmentResult enrichAll(List<? extends JsonNode> findings, @Nullable Instant deadline) {
        requireNonNull(findings, "findings must not be null");

        final Timer.Sample timerSample = Timer.start();
        try {
            return doEnrichAll(findings, deadline);
        } finally {
            if (enrichmentTimer != null) {
                final long durationNanos = timerSample.stop(enrichmentTimer);
                LOGGER.debug("Enrichment of {} findings completed in {}", findings.size(), Duration.ofNanos(durationNanos));
            }
        }
    }

    public double score(JsonNode finding) {
        return scorer.score(finding);
    }

    public Priority priority(JsonNode finding) {
        return scorer.priority(finding);
    }

    public PrioritySummary summarize(Collection<? extends JsonNode> findings) {
        return PrioritySummary.of(findings);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warn("Timed out while waiting for enrichment workers to stop");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private EnrichmentResult doEnrichAll(List<? extends JsonNode> findings, @Nullable Instant deadline) {
        final var failures = new ConcurrentLinkedQueue<SourceFailure>();
        boolean partial = false;

        final var baseFindings = new ArrayList<JsonNode>(findings.size());
        for (final JsonNode finding : findings) {
            baseFindings.add(finding instanceof ObjectNode objectNode ? objectNode.deepCopy() : finding);
        }

        if (epssSource != null && !baseFindings.isEmpty()) {
            final List<JsonNode> epssFindings = deepCopyObjects(baseFindings);
            final Future<Optional<IOException>> epssFuture = executor.submit(() -> epssSource.enrichBatch(epssFindings));
            final CompletionStatus status = await(epssFuture, deadline);
            if (status == CompletionStatus.COMPLETED) {
                baseFindings.clear();
                baseFindings.addAll(epssFindings);

                final Optional<IOException> epssFailure = getIfCompleted(epssFuture);
                if (epssFailure != null && epssFailure.isPresent()) {
                    recordFailure(failures, epssSource.name(), null, String.valueOf(epssFailure.get().getMessage()));
                }
            } else if (status == CompletionStatus.FAILED) {
                recordFailure(failures, epssSource.name(), null, "EPSS enrichment failed");
            } else {
                LOGGER.warn("EPSS enrichment did not complete in time; Returning findings without enrichment");
                return new EnrichmentResult(baseFindings, PrioritySummary.of(baseFindings), List.copyOf(failures), true);
            }
        }

        final var futures = new ArrayList<@Nullable Future<ObjectNode>>(baseFindings.size());
        for (final JsonNode baseFinding : baseFindings) {
            if (baseFinding instanceof ObjectNode objectNode) {
                final ObjectNode taskFinding = objectNode.deepCopy();
                futures.add(executor.submit(() -> enrichFinding(taskFinding, failures)));
            } else {
                futures.add(null);
            }
        }

        final var enrichedFindings = new ArrayList<JsonNode>(baseFindings.size());
        for (int i = 0; i < baseFindings.size(); i++) {
            final Future<ObjectNode> future = futures.get(i);
            if (future == null) {
                enrichedFindings.add(baseFindings.get(i));
                continue;
            }

            final CompletionStatus status = partial
                    ? (future.isDone() ? CompletionStatus.COMPLETED : CompletionStatus.CANCELLED)
                    : await(future, deadline);
            if (status == CompletionStatus.CANCELLED) {
                partial = true;
                future.cancel(true);
            }

            final ObjectNode enrichedFinding = getIfCompleted(future);
            enrichedFindings.add(enrichedFinding != null ? enrichedFinding : baseFindings.get(i));
        }

        if (partial) {
            for (final Future<ObjectNode> future : futures) {
                if (future != null) {
                    future.cancel(true);
                }
            }

            LOGGER.warn("Enrichment did not complete in time; Returning partial result");
        }

        return new EnrichmentResult(
                enrichedFindings,
                PrioritySummary.of(enrichedFindings),
                List.copyOf(failures),
                partial);
    }

    private ObjectNode enrichFinding(ObjectNode finding, Collection<SourceFailure> failures) {
        final String cveId = CveId.extract(finding).map(CveId::value).orElse(null);

        MDC.put(MDC_CVE, cveId != null ? cveId : "none");
        try {
            for (final VulnEnricher enricher : findingEnrichers) {
                if (Thread.currentThread().isInterrupted()) {
                    LOGGER.debug("Interrupted before {} enrichment", enricher.name());
                    return finding;
                }

                try {
                    enricher.enrich(finding);
                } catch (IOException | RuntimeException e) {
                    LOGGER.warn("Failed to enrich finding with {} data", enricher.name(), e);
                    recordFailure(failures, enricher.name(), cveId, String.valueOf(e.getMessage()));
                }
            }

            final double score = scorer.score(finding);
            finding.put("riskScore", score);
            finding.put(FindingNodes.PRIORITY_FIELD, scorer.priority(finding, score).label());
            return finding;
        } finally {
            MDC.remove(MDC_CVE);
        }
    }

    private void recordFailure(
            Collection<SourceFailure> failures,
            String source,
            @Nullable String cveId,
            String message) {
        failures.add(new SourceFailure(source, cveId, message));
        if (meterRegistry != null) {
            Counter.builder("vulnrisk.enrichment.source.failures")
                    .description("Number of findings a source failed to enrich")
                    .tag("source", source)
                    .register(meterRegistry)
                    .increment();
        }
    }

    private enum CompletionStatus {
        COMPLETED,
        FAILED,
        CANCELLED
    }

    private static CompletionStatus await(Future<?> future, @Nullable Instant deadline) {
        try {
            if (deadline == null) {
                future.get();
            } else {
                final long remainingNanos = Duration.between(Instant.now(), deadline).toNanos();
                future.get(Math.max(0, remainingNanos), TimeUnit.NANOSECONDS);
            }

            return CompletionStatus.COMPLETED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return CompletionStatus.CANCELLED;
        } catch (TimeoutException | CancellationException e) {
            future.cancel(true);
            return CompletionStatus.CANCELLED;
        } catch (ExecutionException e) {
            LOGGER.warn("Enrichment task failed", e.getCause());
            return CompletionStatus.FAILED;
        }
    }

    private static <T> @Nullable T getIfCompleted(Future<T> future) {
        if (!future.isDone() || future.isCancelled()) {
            return null;
        }

        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException e) {
            return null;
        }
    }

    private static List<JsonNode> deepCopyObjects(List<JsonNode> findings) {
        final var copies = new ArrayList<JsonNode>(findings.size());
        for (final JsonNode finding : findings) {
            copies.add(finding instanceof ObjectNode objectNode ? objectNode.deepCopy() : finding);
        }

        return copies;
    }

}
