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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.vulnrisk.cache.api.CacheManager;
import org.vulnrisk.cache.file.FileCacheProvider;
import org.vulnrisk.vulnenrichment.api.EnrichmentContext;
import org.vulnrisk.vulnenrichment.api.UnexpectedStatusException;
import org.vulnrisk.vulnenrichment.api.UpstreamSchemaException;
import org.vulnrisk.vulnenrichment.api.ValidationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.anyUrl;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static net.javacrumbs.jsonunit.assertj.JsonAssertions.assertThatJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

@WireMockTest
class KevSourceTest {

    private final ObjectMapper objectMapper = EnrichmentContext.createObjectMapper();

    @TempDir
    private Path cacheDir;

    private String catalogUrl;
    private CacheManager cacheManager;
    private KevSource kevSource;

    @BeforeEach
    void beforeEach(WireMockRuntimeInfo wmRuntimeInfo) {
        catalogUrl = wmRuntimeInfo.getHttpBaseUrl() + "/feeds/known_exploited_vulnerabilities.json";
        kevSource = createSource();
    }

    @AfterEach
    void afterEach() throws Exception {
        if (cacheManager != null) {
            cacheManager.close();
        }
    }

    private KevSource createSource() {
        return createSource(Map.of());
    }

    private KevSource createSource(Map<String, String> properties) {
        final var configProperties = new HashMap<String, String>();
        configProperties.put("vulnrisk.cache.directory", cacheDir.toString());
        configProperties.put("vulnrisk.source.kev.url", catalogUrl);
        configProperties.put("vulnrisk.source.kev.timeout-ms", "5000");
        configProperties.putAll(properties);

        final var config = new SmallRyeConfigBuilder()
                .withDefaultValues(configProperties)
                .build();
        cacheManager = new FileCacheProvider(config, null).create();

        return new KevSourceFactory().create(new EnrichmentContext(config, cacheManager));
    }

    private static void stubCatalog() {
        stubFor(get(urlPathEqualTo("/feeds/known_exploited_vulnerabilities.json"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBodyFile("kev-catalog.json")));
    }

    private void expireCache() throws IOException {
        Files.setLastModifiedTime(
                cacheDir.resolve("kev_catalog.json"),
                FileTime.from(Instant.now().minus(Duration.ofHours(25))));
    }

    @Test
    void shouldEnrichKnownExploitedFinding() throws Exception {
        stubCatalog();

        final var finding = (ObjectNode) objectMapper.readTree(/* language=JSON */ """
                {
                  "cve": "CVE-2021-44228",
                  "package": "pkg:maven/org.apache.logging.log4j/log4j-core@2.14.1",
                  "severity": "HIGH"
                }
                """);

        kevSource.enrich(finding);

        assertThatJson(finding).isEqualTo(/* language=JSON */ """
                {
                  "cve": "CVE-2021-44228",
                  "package": "pkg:maven/org.apache.logging.log4j/log4j-core@2.14.1",
                  "severity": "HIGH",
                  "kev": {
                    "inKev": true,
                    "vulnerabilityName": "Apache Log4j2 Remote Code Execution Vulnerability",
                    "vendorProject": "Apache",
                    "product": "Log4j2",
                    "dateAdded": "2021-12-10",
                    "dueDate": "2021-12-24",
                    "requiredAction": "${json-unit.any-string}",
                    "notes": "https://logging.apache.org/log4j/2.x/security.html",
                    "shortDescription": "${json-unit.any-string}"
                  },
                  "effectiveSeverity": "CRITICAL",
                  "priority": "P0-IMMEDIATE",
                  "kevContext": "[WARNING] ACTIVELY EXPLOITED: Apache Log4j2 Remote Code Execution Vulnerability"
                }
                """);
    }

    @Test
    void shouldEnrichFindingNotInCatalog() throws Exception {
        stubCatalog();

        final var finding = (ObjectNode) objectMapper.readTree("""
                {"vulnerability": {"id": "CVE-2024-00001"}, "severity": "LOW"}
                """);

        kevSource.enrich(finding);

        assertThatJson(finding).isEqualTo("""
                {"vulnerability": {"id": "CVE-2024-00001"}, "severity": "LOW", "kev": {"inKev": false}}
                """);
    }

    @Test
    void shouldNotFetchCatalogForFindingWithoutCveId() throws Exception {
        final var finding = (ObjectNode) objectMapper.readTree("""
                {"id": "not-a-cve"}
                """);

        kevSource.enrich(finding);

        assertThatJson(finding).isEqualTo("""
                {"id": "not-a-cve", "kev": {"inKev": false}}
                """);
        verify(0, getRequestedFor(anyUrl()));
    }

    @Test
    void shouldRejectEmptyCveId() {
        assertThatExceptionOfType(ValidationException.class)
                .isThrownBy(() -> kevSource.isKnownExploited(""));
        assertThatExceptionOfType(ValidationException.class)
                .isThrownBy(() -> kevSource.isKnownExploited(null));
    }

    @Test
    void shouldIndexCatalogOnlyOnce() throws Exception {
        stubCatalog();

        assertThat(kevSource.isKnownExploited("CVE-2021-44228").inKev()).isTrue();
        assertThat(kevSource.isKnownExploited("CVE-2017-5638").inKev()).isTrue();
        assertThat(kevSource.isKnownExploited("CVE-2024-00001").inKev()).isFalse();

        verify(1, getRequestedFor(anyUrl()));
    }

    @Test
    void shouldSkipEntriesWithoutCveIdWhenIndexing() throws Exception {
        final var catalog = objectMapper.readTree(
                getClass().getResourceAsStream("/__files/kev-catalog.json"));

        assertThat(KevSource.buildIndex(catalog)).containsOnlyKeys("CVE-2021-44228", "CVE-2017-5638");
    }

    @Test
    void shouldUseFreshCacheAcrossInstances() throws Exception {
        stubCatalog();

        assertThat(kevSource.isKnownExploited("CVE-2021-44228").inKev()).isTrue();
        assertThat(cacheDir.resolve("kev_catalog.json")).exists();

        final KevSource otherSource = createSource();
        assertThat(otherSource.isKnownExploited("CVE-2021-44228").inKev()).isTrue();

        verify(1, getRequestedFor(anyUrl()));
    }

    @Test
    void shouldRefetchExpiredCache() throws Exception {
        stubCatalog();

        kevSource.fetchCatalog();
        expireCache();
        kevSource.fetchCatalog();

        verify(2, getRequestedFor(anyUrl()));
    }

    @Test
    void shouldFallBackToStaleCacheWhenFetchFails() throws Exception {
        stubCatalog();
        kevSource.fetchCatalog();
        expireCache();

        stubFor(get(anyUrl())
                .willReturn(aResponse()
                        .withStatus(503)));

        final KevSource otherSource = createSource();
        assertThat(otherSource.isKnownExploited("CVE-2021-44228").inKev()).isTrue();

        verify(2, getRequestedFor(anyUrl()));
    }

    @Test
    void shouldFailWhenFetchFailsWithoutCache() {
        stubFor(get(anyUrl())
                .willReturn(aResponse()
                        .withStatus(503)));

        assertThatExceptionOfType(UnexpectedStatusException.class)
                .isThrownBy(() -> kevSource.isKnownExploited("CVE-2021-44228"))
                .withMessageContaining("unexpected response code 503");
    }

    @Test
    void shouldFailFastWithinBackoffAfterFailedCatalogLoad() {
        stubFor(get(anyUrl())
                .willReturn(aResponse()
                        .withStatus(503)));

        assertThatExceptionOfType(UnexpectedStatusException.class)
                .isThrownBy(() -> kevSource.isKnownExploited("CVE-2021-44228"));
        assertThatExceptionOfType(IOException.class)
                .isThrownBy(() -> kevSource.isKnownExploited("CVE-2017-5638"))
                .withMessage("KEV catalog is unavailable")
                .withCauseInstanceOf(UnexpectedStatusException.class);

        verify(1, getRequestedFor(anyUrl()));
    }

    @Test
    void shouldRecoverFromFailedCatalogLoadAfterBackoff() throws Exception {
        kevSource = createSource(Map.of("vulnrisk.source.kev.failure-backoff-ms", "0"));

        stubFor(get(anyUrl())
                .willReturn(aResponse()
                        .withStatus(503)));

        assertThatExceptionOfType(UnexpectedStatusException.class)
                .isThrownBy(() -> kevSource.isKnownExploited("CVE-2021-44228"));

        stubCatalog();

        assertThat(kevSource.isKnownExploited("CVE-2021-44228").inKev()).isTrue();
        verify(2, getRequestedFor(anyUrl()));
    }

    @Test
    void shouldRefreshIndexAfterCacheExpiry() throws Exception {
        stubCatalog();

        assertThat(kevSource.isKnownExploited("CVE-2021-44228").inKev()).isTrue();
        assertThat(kevSource.isKnownExploited("CVE-2024-12345").inKev()).isFalse();

        expireCache();
        stubFor(get(urlPathEqualTo("/feeds/known_exploited_vulnerabilities.json"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody(/* language=JSON */ """
                                {
                                  "catalogVersion": "2024.12.01",
                                  "vulnerabilities": [
                                    {
                                      "cveID": "CVE-2024-12345",
                                      "vulnerabilityName": "Example Remote Code Execution",
                                      "dateAdded": "2024-12-01",
                                      "dueDate": "2024-12-22",
                                      "requiredAction": "Apply updates per vendor instructions."
                                    }
                                  ]
                                }
                                """)));

        assertThat(kevSource.isKnownExploited("CVE-2024-12345").inKev()).isTrue();
        assertThat(kevSource.isKnownExploited("CVE-2021-44228").inKev()).isFalse();
        verify(2, getRequestedFor(anyUrl()));
    }

    @Test
    void shouldKeepStaleIndexWhenRefreshFails() throws Exception {
        stubCatalog();

        assertThat(kevSource.isKnownExploited("CVE-2021-44228").inKev()).isTrue();

        expireCache();
        stubFor(get(anyUrl())
                .willReturn(aResponse()
                        .withStatus(503)));

        assertThat(kevSource.isKnownExploited("CVE-2021-44228").inKev()).isTrue();
        assertThat(kevSource.isKnownExploited("CVE-2017-5638").inKev()).isTrue();
        verify(2, getRequestedFor(anyUrl()));
    }

    @Test
    void shouldRejectCatalogThatIsNotAnObject() {
        stubFor(get(anyUrl())
                .willReturn(aResponse()
                        .withStatus(200)
                        .withBody("[]")));

        assertThatExceptionOfType(UpstreamSchemaException.class)
                .isThrownBy(() -> kevSource.fetchCatalog())
                .withMessageContaining("expected an object");
        assertThat(cacheDir.resolve("kev_catalog.json")).doesNotExist();
    }

    @Test
    void shouldRejectCatalogWithoutVulnerabilities() {
        stubFor(get(anyUrl())
                .willReturn(aResponse()
                        .withStatus(200)
                        .withBody("{\"title\": \"CISA Catalog\"}")));

        assertThatExceptionOfType(UpstreamSchemaException.class)
                .isThrownBy(() -> kevSource.fetchCatalog())
                .withMessageContaining("missing vulnerabilities array");
    }

    @Test
    void shouldRejectCatalogThatIsNotJson() {
        stubFor(get(anyUrl())
                .willReturn(aResponse()
                        .withStatus(200)
                        .withBody("<html>Maintenance</html>")));

        assertThatExceptionOfType(UpstreamSchemaException.class)
                .isThrownBy(() -> kevSource.fetchCatalog());
    }

    @Test
    void shouldBeIdempotent() throws Exception {
        stubCatalog();

        final var finding = (ObjectNode) objectMapper.readTree("""
                {"cve": "CVE-2021-44228"}
                """);

        kevSource.enrich(finding);
        final String firstResult = objectMapper.writeValueAsString(finding);
        kevSource.enrich(finding);

        assertThat(objectMapper.writeValueAsString(finding)).isEqualTo(firstResult);
    }

}
