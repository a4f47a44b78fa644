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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vulnrisk.cache.api.CacheLookup;
import org.vulnrisk.cache.api.CacheStore;
import org.vulnrisk.vulnenrichment.api.CveId;
import org.vulnrisk.vulnenrichment.api.HttpRequests;
import org.vulnrisk.vulnenrichment.api.UpstreamSchemaException;
import org.vulnrisk.vulnenrichment.api.ValidationException;
import org.vulnrisk.vulnenrichment.api.VulnEnricher;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Enriches findings with scores of the Exploit Prediction Scoring System (EPSS).
 * <p>
 * Scores are requested in batches of {@value #REQUEST_BATCH_SIZE} CVEs per API call,
 * and cached per CVE.
 *
 * @since 1.0.0
 */
public final class EpssSource implements VulnEnricher {

    private static final Logger LOGGER = LoggerFactory.getLogger(EpssSource.class);

    static final int REQUEST_BATCH_SIZE = 100;

    private record FetchResult(Map<String, EpssRecord> recordByCveId, @Nullable IOException failure) {
    }

    private final CacheStore cache;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI apiUrl;
    private final Duration timeout;

    EpssSource(
            CacheStore cache,
            HttpClient httpClient,
            ObjectMapper objectMapper,
            URI apiUrl,
            Duration timeout) {
        this.cache = requireNonNull(cache, "cache must not be null");
        this.httpClient = requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = requireNonNull(objectMapper, "objectMapper must not be null");
        this.apiUrl = requireNonNull(apiUrl, "apiUrl must not be null");
        this.timeout = requireNonNull(timeout, "timeout must not be null");
    }

    @Override
    public String name() {
        return EpssSourceFactory.NAME;
    }

    /**
     * Fetches EPSS scores for the given CVEs.
     * <p>
     * Fresh scores are taken from cache. All others are requested from the API.
     * When a request fails, stale cached scores of the affected CVEs are used instead.
     * CVEs that the API has no score for are absent from the result.
     *
     * @param cveIds IDs of the CVEs to fetch scores for.
     * @return Scores by CVE ID.
     * @throws ValidationException When any of the given IDs is not a valid CVE ID.
     *                             No request is issued in this case.
     * @throws IOException         When a request failed for CVEs that have no cached score.
     */
    public Map<String, EpssRecord> fetchScores(List<String> cveIds) throws IOException {
        final FetchResult result = fetch(cveIds);
        if (result.failure() != null) {
            throw result.failure();
        }

        return result.recordByCveId();
    }

    public static EpssPriority priorityBand(double score) {
        return EpssPriority.of(score);
    }

    /**
     * Enriches all given findings with a single, batched, score lookup.
     * <p>
     * Findings that are not objects, or have no valid CVE ID, are left untouched.
     * So are findings for which no score could be obtained.
     *
     * @param findings The findings to enrich.
     * @return The failure that prevented scores from being obtained, if any.
     */
    public Optional<IOException> enrichBatch(List<? extends JsonNode> findings) {
        requireNonNull(findings, "findings must not be null");

        final var cveIds = new ArrayList<String>(findings.size());
        for (final JsonNode finding : findings) {
            CveId.extract(finding).ifPresent(cveId -> cveIds.add(cveId.value()));
        }
        if (cveIds.isEmpty()) {
            LOGGER.debug("None of {} findings has a CVE ID; Skipping EPSS enrichment", findings.size());
            return Optional.empty();
        }

        final FetchResult result;
        try {
            result = fetch(cveIds);
        } catch (IOException e) {
            LOGGER.warn("Failed to fetch EPSS scores; Continuing without them", e);
            return Optional.of(e);
        }
        if (result.failure() != null) {
            LOGGER.warn("Failed to fetch EPSS scores for some CVEs; Continuing without them", result.failure());
        }

        for (final JsonNode finding : findings) {
            if (!(finding instanceof ObjectNode findingObject)) {
                continue;
            }

            final Optional<CveId> cveId = CveId.extract(findingObject);
            if (cveId.isEmpty()) {
                continue;
            }

            final EpssRecord epssRecord = result.recordByCveId().get(cveId.get().value());
            if (epssRecord != null) {
                attach(findingObject, epssRecord);
            }
        }

        return Optional.ofNullable(result.failure());
    }

    @Override
    public void enrich(ObjectNode finding) {
        enrichBatch(List.of(finding));
    }

    private void attach(ObjectNode finding, EpssRecord epssRecord) {
        finding.set("epss", objectMapper.valueToTree(epssRecord));
        finding.put("exploitationProbability",
                String.format(Locale.ROOT, "%.1f%%", epssRecord.epssScore() * 100));
        finding.put("epssPriority", priorityBand(epssRecord.epssScore()).name());
    }

    private FetchResult fetch(Collection<String> cveIds) throws IOException {
        requireNonNull(cveIds, "cveIds must not be null");
        for (final String cveId : cveIds) {
            if (!CveId.isValid(cveId)) {
                throw new ValidationException("Invalid CVE ID: %s".formatted(cveId));
            }
        }

        final var distinctCveIds = new LinkedHashSet<>(cveIds);
        if (distinctCveIds.isEmpty()) {
            return new FetchResult(Map.of(), null);
        }

        final var recordByCveId = new HashMap<String, EpssRecord>(distinctCveIds.size());
        final var staleRecordByCveId = new HashMap<String, EpssRecord>();
        final var cveIdsToFetch = new ArrayList<String>();

        final Map<String, CacheLookup> lookups = cache.lookupMany(distinctCveIds);
        for (final String cveId : distinctCveIds) {
            final CacheLookup lookup = lookups.get(cveId);
            final EpssRecord cachedRecord = lookup != null ? readCachedRecord(cveId, lookup.value()) : null;
            if (cachedRecord != null && lookup.found()) {
                recordByCveId.put(cveId, cachedRecord);
                continue;
            }
            if (cachedRecord != null) {
                staleRecordByCveId.put(cveId, cachedRecord);
            }

            cveIdsToFetch.add(cveId);
        }

        LOGGER.debug("Found fresh EPSS scores for {}/{} CVEs in cache", recordByCveId.size(), distinctCveIds.size());

        IOException failure = null;
        for (final List<String> batch : partition(cveIdsToFetch, REQUEST_BATCH_SIZE)) {
            final Map<String, EpssRecord> fetchedRecords;
            try {
                fetchedRecords = fetchBatch(batch);
            } catch (IOException e) {
                int staleCount = 0;
                boolean missingFallback = false;
                for (final String cveId : batch) {
                    final EpssRecord staleRecord = staleRecordByCveId.get(cveId);
                    if (staleRecord != null) {
                        recordByCveId.put(cveId, staleRecord);
                        staleCount++;
                    } else {
                        missingFallback = true;
                    }
                }

                LOGGER.warn("EPSS request for batch of {} CVEs failed; Using stale scores for {} of them",
                        batch.size(), staleCount, e);
                if (missingFallback) {
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
                continue;
            }

            final var entriesToCache = new HashMap<String, JsonNode>(fetchedRecords.size());
            for (final Map.Entry<String, EpssRecord> entry : fetchedRecords.entrySet()) {
                recordByCveId.put(entry.getKey(), entry.getValue());
                entriesToCache.put(entry.getKey(), objectMapper.valueToTree(entry.getValue()));
            }

            cache.putMany(entriesToCache);
        }

        return new FetchResult(recordByCveId, failure);
    }

    private Map<String, EpssRecord> fetchBatch(List<String> batch) throws IOException {
        LOGGER.debug("Fetching EPSS scores for {} CVEs", batch.size());

        final var request = HttpRequest.newBuilder()
                .uri(HttpRequests.withQueryParameter(apiUrl, "cve", String.join(",", batch)))
                .header("Accept", "application/json")
                .timeout(timeout)
                .GET()
                .build();

        final JsonNode responseJson = HttpRequests.readJsonBody(objectMapper, HttpRequests.send(httpClient, request));
        if (!responseJson.isObject()) {
            throw new UpstreamSchemaException(
                    "Invalid EPSS response: expected an object, but got %s".formatted(responseJson.getNodeType()));
        }

        final JsonNode dataNode = responseJson.path("data");
        if (dataNode.isMissingNode() || dataNode.isNull()) {
            return Map.of();
        }
        if (!dataNode.isArray()) {
            throw new UpstreamSchemaException(
                    "Invalid EPSS response: expected data to be an array, but got %s".formatted(dataNode.getNodeType()));
        }

        final var recordByCveId = new HashMap<String, EpssRecord>(dataNode.size());
        for (final JsonNode entry : dataNode) {
            final String cveId = entry.path("cve").asText("");
            if (cveId.isEmpty()) {
                LOGGER.debug("Skipping EPSS entry without CVE ID");
                continue;
            }

            final Double score = parseProbability(entry.get("epss"));
            final Double percentile = parseProbability(entry.get("percentile"));
            if (score == null || percentile == null) {
                LOGGER.warn("Skipping EPSS entry of {} with invalid score {} or percentile {}",
                        cveId, entry.get("epss"), entry.get("percentile"));
                continue;
            }

            recordByCveId.put(cveId, new EpssRecord(score, percentile, entry.path("date").asText("")));
        }

        return recordByCveId;
    }

    private @Nullable EpssRecord readCachedRecord(String cveId, @Nullable JsonNode cachedValue) {
        if (cachedValue == null) {
            return null;
        }

        try {
            return objectMapper.treeToValue(cachedValue, EpssRecord.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOGGER.warn("Failed to read cached EPSS score of {}; Will re-fetch", cveId, e);
            return null;
        }
    }

    /**
     * The API reports scores as strings. Absent or empty values count as {@code 0.0}.
     *
     * @return The parsed value, or {@code null} when it is not a number within {@code [0, 1]}.
     */
    private static @Nullable Double parseProbability(@Nullable JsonNode node) {
        if (node == null || node.isNull()) {
            return 0.0;
        }

        final double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            if (node.asText().isBlank()) {
                return 0.0;
            }

            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }

        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            return null;
        }

        return value;
    }

    private static <T> List<List<T>> partition(List<T> list, int batchSize) {
        final var partitions = new ArrayList<List<T>>();
        for (int i = 0; i < list.size(); i += batchSize) {
            partitions.add(list.subList(i, Math.min(i + batchSize, list.size())));
        }

        return partitions;
    }

}
