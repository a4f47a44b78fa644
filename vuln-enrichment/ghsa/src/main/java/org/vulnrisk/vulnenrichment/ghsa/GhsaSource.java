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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vulnrisk.cache.api.CacheStore;
import org.vulnrisk.vulnenrichment.api.CveId;
import org.vulnrisk.vulnenrichment.api.HttpRequests;
import org.vulnrisk.vulnenrichment.api.InFlightRequests;
import org.vulnrisk.vulnenrichment.api.UpstreamSchemaException;
import org.vulnrisk.vulnenrichment.api.ValidationException;
import org.vulnrisk.vulnenrichment.api.VulnEnricher;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Enriches findings with GitHub Security Advisories, queried per CVE
 * through the GitHub GraphQL API.
 *
 * @since 1.0.0
 */
public final class GhsaSource implements VulnEnricher {

    private static final Logger LOGGER = LoggerFactory.getLogger(GhsaSource.class);

    private static final String QUERY = loadQuery();

    private final CacheStore cache;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI apiUrl;
    private final Duration timeout;
    private final String token;
    private final InFlightRequests<String, JsonNode> inFlightRequests;

    GhsaSource(
            CacheStore cache,
            HttpClient httpClient,
            ObjectMapper objectMapper,
            URI apiUrl,
            Duration timeout,
            String token) {
        this.cache = requireNonNull(cache, "cache must not be null");
        this.httpClient = requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = requireNonNull(objectMapper, "objectMapper must not be null");
        this.apiUrl = requireNonNull(apiUrl, "apiUrl must not be null");
        this.timeout = requireNonNull(timeout, "timeout must not be null");
        this.token = requireNonNull(token, "token must not be null");
        this.inFlightRequests = new InFlightRequests<>(GhsaSourceFactory.NAME);
    }

    @Override
    public String name() {
        return GhsaSourceFactory.NAME;
    }

    /**
     * Queries the advisory of a CVE.
     * <p>
     * Transport failures are not raised, but reported through {@link GhsaAdvisory#error()}.
     *
     * @param cveId ID of the CVE to query the advisory for.
     * @return The advisory, or {@link GhsaAdvisory#empty()} if no advisory exists for the CVE.
     * @throws ValidationException   When {@code cveId} is not a valid CVE ID.
     * @throws GraphQlErrorException When the API responded with GraphQL errors.
     */
    public GhsaAdvisory queryAdvisory(@Nullable String cveId) {
        if (cveId == null || cveId.isEmpty()) {
            throw new ValidationException("CVE ID must not be empty");
        }
        if (!CveId.isValid(cveId)) {
            throw new ValidationException("Invalid CVE ID: %s".formatted(cveId));
        }

        final JsonNode advisoryJson;
        try {
            advisoryJson = inFlightRequests.execute(cveId, () -> cache.getOrLoad(cveId, this::requestAdvisory));
        } catch (IOException e) {
            LOGGER.warn("GHSA query failed for {}", cveId, e);
            return GhsaAdvisory.failed(String.valueOf(e.getMessage()));
        }

        try {
            return objectMapper.treeToValue(advisoryJson, GhsaAdvisory.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOGGER.warn("Failed to read cached advisory of {}", cveId, e);
            return GhsaAdvisory.failed("Invalid cached advisory");
        }
    }

    @Override
    public void enrich(ObjectNode finding) {
        final CveId cveId = CveId.extract(finding).orElse(null);
        if (cveId == null) {
            finding.set("ghsa", objectMapper.valueToTree(GhsaAdvisory.empty()));
            return;
        }

        final GhsaAdvisory advisory = queryAdvisory(cveId.value());
        finding.set("ghsa", objectMapper.valueToTree(advisory));

        for (final GhsaAdvisory.AffectedPackage affectedPackage : advisory.vulnerabilities()) {
            if (affectedPackage.firstPatchedVersion().isEmpty()) {
                continue;
            }

            final ObjectNode remediation;
            if (finding.get("remediation") instanceof ObjectNode existingRemediation) {
                remediation = existingRemediation;
            } else {
                remediation = finding.putObject("remediation");
            }

            remediation.put("fixedVersion", affectedPackage.firstPatchedVersion());
            remediation.put("vulnerableRange", affectedPackage.vulnerableVersionRange());
            break;
        }
    }

    private JsonNode requestAdvisory(String cveId) throws IOException {
        LOGGER.debug("Querying advisory of {}", cveId);

        final ObjectNode requestBody = objectMapper.createObjectNode();
        requestBody.put("query", QUERY);
        requestBody.putObject("variables").put("cve", cveId);

        final var request = HttpRequest.newBuilder()
                .uri(apiUrl)
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .header("Authorization", "bearer " + token)
                .timeout(timeout)
                .POST(BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(requestBody)))
                .build();

        final JsonNode responseJson = HttpRequests.readJsonBody(objectMapper, HttpRequests.send(httpClient, request));
        if (!responseJson.isObject()) {
            throw new UpstreamSchemaException(
                    "Invalid GraphQL response: expected an object, but got %s".formatted(responseJson.getNodeType()));
        }

        final JsonNode errorsNode = responseJson.path("errors");
        if (errorsNode.isArray() && !errorsNode.isEmpty()) {
            final var errorMessages = new ArrayList<String>(errorsNode.size());
            for (final JsonNode errorNode : errorsNode) {
                errorMessages.add(errorNode.path("message").asText("Unknown error"));
            }

            throw new GraphQlErrorException(errorMessages);
        }

        final JsonNode advisoryNodes = responseJson.path("data").path("securityAdvisories").path("nodes");
        if (!advisoryNodes.isArray() || advisoryNodes.isEmpty()) {
            LOGGER.debug("No advisory found for {}", cveId);
            return objectMapper.valueToTree(GhsaAdvisory.empty());
        }

        return objectMapper.valueToTree(convert(advisoryNodes.get(0)));
    }

    private static GhsaAdvisory convert(JsonNode advisoryNode) {
        final var affectedPackages = new ArrayList<GhsaAdvisory.AffectedPackage>();
        for (final JsonNode vulnNode : advisoryNode.path("vulnerabilities").path("nodes")) {
            affectedPackages.add(new GhsaAdvisory.AffectedPackage(
                    vulnNode.path("package").path("name").asText(""),
                    vulnNode.path("package").path("ecosystem").asText(""),
                    vulnNode.path("vulnerableVersionRange").asText(""),
                    vulnNode.path("firstPatchedVersion").path("identifier").asText("")));
        }

        final var references = new ArrayList<String>();
        for (final JsonNode referenceNode : advisoryNode.path("references")) {
            references.add(referenceNode.path("url").asText(""));
        }

        final JsonNode withdrawnAtNode = advisoryNode.path("withdrawnAt");

        return new GhsaAdvisory(
                advisoryNode.path("ghsaId").asText(""),
                advisoryNode.path("summary").asText(""),
                advisoryNode.path("description").asText(""),
                advisoryNode.path("severity").asText(""),
                advisoryNode.path("publishedAt").asText(""),
                advisoryNode.path("updatedAt").asText(""),
                withdrawnAtNode.isTextual() ? withdrawnAtNode.asText() : null,
                advisoryNode.path("permalink").asText(""),
                affectedPackages,
                references,
                null);
    }

    private static String loadQuery() {
        try (final InputStream queryInputStream = GhsaSource.class.getResourceAsStream("security-advisory.graphql")) {
            requireNonNull(queryInputStream, "security-advisory.graphql not found");
            return new String(queryInputStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load advisory query", e);
        }
    }

}
