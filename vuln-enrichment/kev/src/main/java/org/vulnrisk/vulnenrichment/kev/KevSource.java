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
import org.vulnrisk.vulnenrichment.api.Priority;
import org.vulnrisk.vulnenrichment.api.UpstreamSchemaException;
import org.vulnrisk.vulnenrichment.api.ValidationException;
import org.vulnrisk.vulnenrichment.api.VulnEnricher;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;

/**
 * Enriches findings with their status in the CISA Known Exploited Vulnerabilities catalog.
 * <p>
 * The catalog is fetched as a whole, cached under a single key, and indexed
 * by CVE ID. The index is rebuilt whenever the cached catalog changes, and the
 * catalog is refetched once the cache entry expired.
 * <p>
 * When fetching the catalog fails, no further attempt is made until {@code failureBackoff}
 * elapsed. Until then, lookups use the stale cached catalog if there is one, and fail otherwise.
 *
 * @since 1.0.0
 */
public final class KevSource implements VulnEnricher {

    private static final Logger LOGGER = LoggerFactory.getLogger(KevSource.class);

    static final String CATALOG_CACHE_KEY = "catalog";

    private record IndexedCatalog(JsonNode catalog, Map<String, JsonNode> index) {
    }

    private record LoadFailure(IOException cause, Instant failedAt) {
    }

    private final CacheStore cache;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI catalogUrl;
    private final Duration timeout;
    private final Duration failureBackoff;
    private final Clock clock;
    private final ReentrantLock loadLock;
    private volatile @Nullable IndexedCatalog indexedCatalog;
    private @Nullable LoadFailure lastFailure;

    KevSource(
            CacheStore cache,
            HttpClient httpClient,
            ObjectMapper objectMapper,
            URI catalogUrl,
            Duration timeout,
            Duration failureBackoff,
            Clock clock) {
        this.cache = requireNonNull(cache, "cache must not be null");
        this.httpClient = requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = requireNonNull(objectMapper, "objectMapper must not be null");
        this.catalogUrl = requireNonNull(catalogUrl, "catalogUrl must not be null");
        this.timeout = requireNonNull(timeout, "timeout must not be null");
        this.failureBackoff = requireNonNull(failureBackoff, "failureBackoff must not be null");
        this.clock = requireNonNull(clock, "clock must not be null");
        this.loadLock = new ReentrantLock();
    }

    @Override
    public String name() {
        return KevSourceFactory.NAME;
    }

    /**
     * @return The KEV catalog, from cache if fresh, from the network otherwise.
     * A stale cached catalog is returned when the network request fails.
     * @throws UpstreamSchemaException When the catalog is not an object with a {@code vulnerabilities} array,
     *                                 and no cached catalog is available.
     * @throws IOException             When the catalog could not be fetched, and no cached catalog is available.
     */
    public JsonNode fetchCatalog() throws IOException {
        final JsonNode catalog = cache.getOrLoad(CATALOG_CACHE_KEY, ignored -> downloadCatalog());
        return requireValidCatalog(catalog);
    }

    /**
     * @return Catalog entries by CVE ID. Entries without CVE ID are skipped.
     */
    public static Map<String, JsonNode> buildIndex(JsonNode catalog) throws UpstreamSchemaException {
        final JsonNode vulnerabilities = requireValidCatalog(catalog).get("vulnerabilities");

        final var entryByCveId = new HashMap<String, JsonNode>(vulnerabilities.size());
        for (final JsonNode entry : vulnerabilities) {
            final String cveId = entry.path("cveID").asText("");
            if (cveId.isEmpty()) {
                continue;
            }

            entryByCveId.put(cveId, entry);
        }

        return entryByCveId;
    }

    public KevRecord isKnownExploited(@Nullable String cveId) throws IOException {
        if (cveId == null || cveId.isEmpty()) {
            throw new ValidationException("CVE ID must not be empty");
        }

        final JsonNode entry = getIndex().get(cveId);
        return entry != null
                ? KevRecord.of(entry)
                : KevRecord.notInKev();
    }

    @Override
    public void enrich(ObjectNode finding) throws IOException {
        final CveId cveId = CveId.extract(finding).orElse(null);
        if (cveId == null) {
            finding.set("kev", objectMapper.valueToTree(KevRecord.notInKev()));
            return;
        }

        final KevRecord kevRecord = isKnownExploited(cveId.value());
        finding.set("kev", objectMapper.valueToTree(kevRecord));

        if (kevRecord.inKev()) {
            finding.put("effectiveSeverity", "CRITICAL");
            finding.put("priority", Priority.P0_IMMEDIATE.label());
            finding.put("kevContext", "[WARNING] ACTIVELY EXPLOITED: " + kevRecord.vulnerabilityName());
        }
    }

    private Map<String, JsonNode> getIndex() throws IOException {
        final CacheLookup lookup = cache.lookup(CATALOG_CACHE_KEY);
        if (lookup.found()) {
            return indexOf(requireNonNull(lookup.value()));
        }

        loadLock.lock();
        try {
            // The catalog may have been refreshed while waiting for the lock.
            final CacheLookup currentLookup = cache.lookup(CATALOG_CACHE_KEY);
            if (currentLookup.found()) {
                return indexOf(requireNonNull(currentLookup.value()));
            }

            final LoadFailure failure = lastFailure;
            if (failure != null && clock.instant().isBefore(failure.failedAt().plus(failureBackoff))) {
                if (currentLookup.hasStaleValue()) {
                    return indexOf(requireNonNull(currentLookup.value()));
                }

                throw new IOException("KEV catalog is unavailable", failure.cause());
            }

            final JsonNode catalog;
            try {
                catalog = downloadCatalog();
            } catch (InterruptedIOException e) {
                throw e;
            } catch (IOException e) {
                lastFailure = new LoadFailure(e, clock.instant());
                if (currentLookup.hasStaleValue()) {
                    LOGGER.warn("Failed to refresh KEV catalog; Using stale catalog for the next {}", failureBackoff, e);
                    return indexOf(requireNonNull(currentLookup.value()));
                }

                LOGGER.warn("Failed to load KEV catalog; Lookups will fail for the next {}", failureBackoff, e);
                throw e;
            }

            lastFailure = null;
            cache.put(CATALOG_CACHE_KEY, catalog);
            return indexOf(catalog);
        } finally {
            loadLock.unlock();
        }
    }

    private Map<String, JsonNode> indexOf(JsonNode catalog) throws UpstreamSchemaException {
        final IndexedCatalog current = indexedCatalog;
        if (current != null && current.catalog().equals(catalog)) {
            return current.index();
        }

        final Map<String, JsonNode> index = buildIndex(catalog);
        LOGGER.debug("Indexed {} KEV catalog entries", index.size());
        indexedCatalog = new IndexedCatalog(catalog, index);
        return index;
    }

    private JsonNode downloadCatalog() throws IOException {
        LOGGER.debug("Downloading KEV catalog from {}", catalogUrl);

        final var request = HttpRequest.newBuilder()
                .uri(catalogUrl)
                .header("Accept", "application/json")
                .timeout(timeout)
                .GET()
                .build();

        final JsonNode catalog = HttpRequests.readJsonBody(objectMapper, HttpRequests.send(httpClient, request));
        return requireValidCatalog(catalog);
    }

    private static JsonNode requireValidCatalog(JsonNode catalog) throws UpstreamSchemaException {
        if (!catalog.isObject()) {
            throw new UpstreamSchemaException(
                    "Invalid KEV catalog: expected an object, but got %s".formatted(catalog.getNodeType()));
        }
        if (!catalog.path("vulnerabilities").isArray()) {
            throw new UpstreamSchemaException("Invalid KEV catalog: missing vulnerabilities array");
        }

        return catalog;
    }

}
