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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vulnrisk.cache.api.CacheStore;
import org.vulnrisk.vulnenrichment.api.CveId;
import org.vulnrisk.vulnenrichment.api.FindingNodes;
import org.vulnrisk.vulnenrichment.api.HttpRequests;
import org.vulnrisk.vulnenrichment.api.InFlightRequests;
import org.vulnrisk.vulnenrichment.api.Priority;
import org.vulnrisk.vulnenrichment.api.UpstreamSchemaException;
import org.vulnrisk.vulnenrichment.api.ValidationException;
import org.vulnrisk.vulnenrichment.api.VulnEnricher;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * Enriches findings with exploit intelligence from the VulnCheck KEV index.
 * <p>
 * Without an API key, every CVE is reported as {@code credential required}
 * and no requests are issued.
 *
 * @since 1.0.0
 */
public final class ExploitIntelSource implements VulnEnricher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExploitIntelSource.class);

    static final String RATE_LIMIT_EXCEEDED = "Rate limit exceeded";

    private static final class RateLimitedException extends IOException {

        private RateLimitedException(URI uri) {
            super("Rate limit exceeded for request to %s".formatted(uri));
        }

    }

    private final CacheStore cache;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI apiUrl;
    private final Duration timeout;
    private final @Nullable String apiKey;
    private final InFlightRequests<String, JsonNode> inFlightRequests;

    ExploitIntelSource(
            CacheStore cache,
            HttpClient httpClient,
            ObjectMapper objectMapper,
            URI apiUrl,
            Duration timeout,
            @Nullable String apiKey) {
        this.cache = requireNonNull(cache, "cache must not be null");
        this.httpClient = requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = requireNonNull(objectMapper, "objectMapper must not be null");
        this.apiUrl = requireNonNull(apiUrl, "apiUrl must not be null");
        this.timeout = requireNonNull(timeout, "timeout must not be null");
        this.apiKey = apiKey;
        this.inFlightRequests = new InFlightRequests<>(ExploitIntelSourceFactory.NAME);
    }

    @Override
    public String name() {
        return ExploitIntelSourceFactory.NAME;
    }

    public boolean hasCredential() {
        return apiKey != null;
    }

    /**
     * @param cveId ID of the CVE to get the exploit status of.
     * @return The exploit status. Lookup failures other than the ones listed below are
     * reported through {@link ExploitRecord#error()}.
     * @throws ValidationException     When {@code cveId} is not a valid CVE ID.
     * @throws IllegalStateException   When the API rejected the API key.
     * @throws UpstreamSchemaException When the API responded with an unexpected body,
     *                                 and no cached status is available.
     */
    public ExploitRecord getExploitStatus(@Nullable String cveId) throws UpstreamSchemaException {
        if (cveId == null || cveId.isEmpty()) {
            throw new ValidationException("CVE ID must not be empty");
        }
        if (!CveId.isValid(cveId)) {
            throw new ValidationException("Invalid CVE ID: %s".formatted(cveId));
        }
        if (apiKey == null) {
            return ExploitRecord.credentialRequired();
        }

        final JsonNode recordJson;
        try {
            recordJson = inFlightRequests.execute(cveId, () -> cache.getOrLoad(cveId, this::requestExploitStatus));
        } catch (RateLimitedException e) {
            LOGGER.warn("VulnCheck rate limit exceeded for {}", cveId);
            return ExploitRecord.failed(RATE_LIMIT_EXCEEDED);
        } catch (UpstreamSchemaException e) {
            throw e;
        } catch (IOException e) {
            LOGGER.warn("VulnCheck query failed for {}", cveId, e);
            return ExploitRecord.failed(String.valueOf(e.getMessage()));
        }

        try {
            return objectMapper.treeToValue(recordJson, ExploitRecord.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOGGER.warn("Failed to read cached exploit status of {}", cveId, e);
            return ExploitRecord.failed("Invalid cached exploit status");
        }
    }

    @Override
    public void enrich(ObjectNode finding) throws UpstreamSchemaException {
        final CveId cveId = CveId.extract(finding).orElse(null);
        if (cveId == null) {
            finding.set("exploit", objectMapper.valueToTree(ExploitRecord.unknown()));
            return;
        }

        final ExploitRecord exploitRecord = getExploitStatus(cveId.value());
        finding.set("exploit", objectMapper.valueToTree(exploitRecord));

        if (exploitRecord.weaponized()) {
            final Priority priority = FindingNodes.priority(finding)
                    .map(existing -> Priority.mostUrgent(existing, Priority.P1_CRITICAL))
                    .orElse(Priority.P1_CRITICAL);
            finding.put(FindingNodes.PRIORITY_FIELD, priority.label());
            finding.put("exploitContext", "[WARNING] WEAPONIZED EXPLOIT AVAILABLE");
        }
    }

    private JsonNode requestExploitStatus(String cveId) throws IOException {
        LOGGER.debug("Querying exploit status of {}", cveId);

        final var request = HttpRequest.newBuilder()
                .uri(HttpRequests.withQueryParameter(apiUrl, "cve", cveId))
                .header("Accept", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .timeout(timeout)
                .GET()
                .build();

        final HttpResponse<InputStream> response = HttpRequests.send(httpClient, request);
        switch (response.statusCode()) {
            case 401, 403 -> {
                response.body().close();
                throw new IllegalStateException(
                        "VulnCheck rejected the API key with response code %d".formatted(response.statusCode()));
            }
            case 404 -> {
                response.body().close();
                return objectMapper.valueToTree(ExploitRecord.none());
            }
            case 429 -> {
                response.body().close();
                throw new RateLimitedException(request.uri());
            }
            default -> {
                // Other status codes are handled below.
            }
        }

        final JsonNode responseJson = HttpRequests.readJsonBody(objectMapper, response);
        if (!responseJson.isObject()) {
            throw new UpstreamSchemaException(
                    "Invalid VulnCheck response: expected an object, but got %s".formatted(responseJson.getNodeType()));
        }

        final JsonNode dataNode = responseJson.path("data");
        final JsonNode entry = dataNode.isArray() ? dataNode.path(0) : dataNode;
        if (!entry.isObject()) {
            return objectMapper.valueToTree(ExploitRecord.none());
        }

        return objectMapper.valueToTree(convert(entry));
    }

    private static ExploitRecord convert(JsonNode entry) {
        final JsonNode ransomwareNode = entry.path("ransomware_campaign_use");
        final boolean ransomwareUse = ransomwareNode.isBoolean()
                ? ransomwareNode.booleanValue()
                : "known".equalsIgnoreCase(ransomwareNode.asText(""));

        return new ExploitRecord(
                entry.path("exploit_available").asBoolean(false),
                entry.path("weaponized").asBoolean(false),
                entry.path("exploit_maturity").asText("unknown"),
                entry.path("attack_vector").asText("unknown"),
                entry.path("exploit_type").asText(""),
                entry.path("date_added").asText(""),
                entry.path("due_date").asText(""),
                ransomwareUse,
                null,
                null);
    }

}
