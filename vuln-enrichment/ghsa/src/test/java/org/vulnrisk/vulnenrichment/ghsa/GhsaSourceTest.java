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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.vulnrisk.cache.api.CacheManager;
import org.vulnrisk.cache.file.FileCacheProvider;
import org.vulnrisk.vulnenrichment.api.EnrichmentContext;
import org.vulnrisk.vulnenrichment.api.ValidationException;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.anyUrl;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static net.javacrumbs.jsonunit.assertj.JsonAssertions.assertThatJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

@WireMockTest
class GhsaSourceTest {

    private final ObjectMapper objectMapper = EnrichmentContext.createObjectMapper();

    @TempDir
    private Path cacheDir;

    private String apiUrl;
    private CacheManager cacheManager;
    private GhsaSource ghsaSource;

    @BeforeEach
    void beforeEach(WireMockRuntimeInfo wmRuntimeInfo) {
        apiUrl = wmRuntimeInfo.getHttpBaseUrl() + "/graphql";
        ghsaSource = new GhsaSourceFactory().create(createContext(Map.of("github.token", "ghp_test")));
    }

    @AfterEach
    void afterEach() throws Exception {
        if (cacheManager != null) {
            cacheManager.close();
        }
    }

    private EnrichmentContext createContext(Map<String, String> properties) {
        final var allProperties = new HashMap<>(properties);
        allProperties.put("vulnrisk.cache.directory", cacheDir.toString());
        allProperties.put("vulnrisk.source.ghsa.url", apiUrl);

        final Config config = new SmallRyeConfigBuilder()
                .withDefaultValues(allProperties)
                .build();
        cacheManager = new FileCacheProvider(config, null).create();

        return new EnrichmentContext(config, cacheManager);
    }

    private static void stubResponseFile(String fileName) {
        stubFor(post(urlPathEqualTo("/graphql"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBodyFile(fileName)));
    }

    @Test
    void shouldBeDisabledWithoutToken() {
        final var factory = new GhsaSourceFactory();

        assertThat(factory.isEnabled(createContext(Map.of()))).isFalse();
        assertThat(factory.isEnabled(createContext(Map.of("github.token", "  ")))).isFalse();
        assertThat(factory.isEnabled(createContext(Map.of("github.token", "ghp_test")))).isTrue();
        assertThat(factory.isEnabled(createContext(Map.of(
                "github.token", "ghp_test",
                "vulnrisk.source.ghsa.enabled", "false")))).isFalse();

        assertThatExceptionOfType(IllegalStateException.class)
                .isThrownBy(() -> factory.create(createContext(Map.of())))
                .withMessageContaining("github.token");
    }

    @Test
    void shouldQueryAdvisory() {
        stubResponseFile("ghsa-log4shell-response.json");

        final GhsaAdvisory advisory = ghsaSource.queryAdvisory("CVE-2021-44228");

        assertThat(advisory.ghsaId()).isEqualTo("GHSA-jfh8-c2jp-5v3q");
        assertThat(advisory.severity()).isEqualTo("CRITICAL");
        assertThat(advisory.withdrawnAt()).isNull();
        assertThat(advisory.vulnerabilities()).containsExactly(
                new GhsaAdvisory.AffectedPackage(
                        "org.ops4j.pax.logging:pax-logging-log4j2", "MAVEN", ">= 1.8.0, < 1.9.2", ""),
                new GhsaAdvisory.AffectedPackage(
                        "org.apache.logging.log4j:log4j-core", "MAVEN", ">= 2.13.0, < 2.15.0", "2.15.0"));
        assertThat(advisory.references()).containsExactly(
                "https://nvd.nist.gov/vuln/detail/CVE-2021-44228",
                "https://logging.apache.org/log4j/2.x/security.html");
        assertThat(advisory.error()).isNull();

        verify(1, postRequestedFor(urlPathEqualTo("/graphql"))
                .withHeader("Authorization", equalTo("bearer ghp_test"))
                .withRequestBody(matchingJsonPath("$.variables.cve", equalTo("CVE-2021-44228")))
                .withRequestBody(matchingJsonPath("$.query")));
    }

    @Test
    void shouldQueryEachCveOnlyOnce() {
        stubResponseFile("ghsa-log4shell-response.json");

        final GhsaAdvisory advisory = ghsaSource.queryAdvisory("CVE-2021-44228");
        final GhsaAdvisory cachedAdvisory = ghsaSource.queryAdvisory("CVE-2021-44228");

        assertThat(cachedAdvisory).isEqualTo(advisory);
        assertThat(cacheDir.resolve("ghsa_cache.json")).exists();
        verify(1, postRequestedFor(anyUrl()));
    }

    @Test
    void shouldReturnEmptyAdvisoryWhenNoneExists() {
        stubFor(post(urlPathEqualTo("/graphql"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withBody("{\"data\": {\"securityAdvisories\": {\"nodes\": []}}}")));

        assertThat(ghsaSource.queryAdvisory("CVE-2024-00001")).isEqualTo(GhsaAdvisory.empty());
        assertThat(ghsaSource.queryAdvisory("CVE-2024-00001")).isEqualTo(GhsaAdvisory.empty());

        verify(1, postRequestedFor(anyUrl()));
    }

    @Test
    void shouldRaiseGraphQlErrors() {
        stubFor(post(urlPathEqualTo("/graphql"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withBody(/* language=JSON */ """
                                {
                                  "errors": [
                                    {"message": "Field 'foo' doesn't exist on type 'SecurityAdvisory'"},
                                    {"message": "Something else"}
                                  ]
                                }
                                """)));

        assertThatExceptionOfType(GraphQlErrorException.class)
                .isThrownBy(() -> ghsaSource.queryAdvisory("CVE-2021-44228"))
                .withMessage("GraphQL errors: Field 'foo' doesn't exist on type 'SecurityAdvisory'; Something else");
        assertThat(cacheDir.resolve("ghsa_cache.json")).doesNotExist();
    }

    @Test
    void shouldDegradeTransportFailureToEmptyAdvisory() {
        stubFor(post(urlPathEqualTo("/graphql"))
                .willReturn(aResponse()
                        .withStatus(502)));

        final GhsaAdvisory advisory = ghsaSource.queryAdvisory("CVE-2021-44228");

        assertThat(advisory.isEmpty()).isTrue();
        assertThat(advisory.error()).contains("502");

        // Failures are not cached.
        ghsaSource.queryAdvisory("CVE-2021-44228");
        verify(2, postRequestedFor(anyUrl()));
    }

    @Test
    void shouldRejectInvalidCveIds() {
        assertThatExceptionOfType(ValidationException.class)
                .isThrownBy(() -> ghsaSource.queryAdvisory(""));
        assertThatExceptionOfType(ValidationException.class)
                .isThrownBy(() -> ghsaSource.queryAdvisory("GHSA-jfh8-c2jp-5v3q"));

        verify(0, postRequestedFor(anyUrl()));
    }

    @Test
    void shouldEnrichFindingWithRemediation() throws Exception {
        stubResponseFile("ghsa-log4shell-response.json");

        final var finding = (ObjectNode) objectMapper.readTree("""
                {"cve": "CVE-2021-44228", "remediation": {"note": "Upgrade"}}
                """);

        ghsaSource.enrich(finding);

        assertThatJson(finding).isEqualTo(/* language=JSON */ """
                {
                  "cve": "CVE-2021-44228",
                  "remediation": {
                    "note": "Upgrade",
                    "fixedVersion": "2.15.0",
                    "vulnerableRange": ">= 2.13.0, < 2.15.0"
                  },
                  "ghsa": {
                    "ghsaId": "GHSA-jfh8-c2jp-5v3q",
                    "summary": "Remote code injection in Log4j",
                    "description": "${json-unit.any-string}",
                    "severity": "CRITICAL",
                    "publishedAt": "2021-12-10T00:40:56Z",
                    "updatedAt": "2024-07-24T19:33:13Z",
                    "permalink": "https://github.com/advisories/GHSA-jfh8-c2jp-5v3q",
                    "vulnerabilities": [
                      {
                        "packageName": "org.ops4j.pax.logging:pax-logging-log4j2",
                        "ecosystem": "MAVEN",
                        "vulnerableVersionRange": ">= 1.8.0, < 1.9.2",
                        "firstPatchedVersion": ""
                      },
                      {
                        "packageName": "org.apache.logging.log4j:log4j-core",
                        "ecosystem": "MAVEN",
                        "vulnerableVersionRange": ">= 2.13.0, < 2.15.0",
                        "firstPatchedVersion": "2.15.0"
                      }
                    ],
                    "references": [
                      "https://nvd.nist.gov/vuln/detail/CVE-2021-44228",
                      "https://logging.apache.org/log4j/2.x/security.html"
                    ]
                  }
                }
                """);
    }

    @Test
    void shouldEnrichFindingWithoutCveId() throws Exception {
        final var finding = (ObjectNode) objectMapper.readTree("""
                {"id": "GHSA-jfh8-c2jp-5v3q"}
                """);

        ghsaSource.enrich(finding);

        assertThatJson(finding).isEqualTo("""
                {"id": "GHSA-jfh8-c2jp-5v3q", "ghsa": {"ghsaId": "", "summary": "", "vulnerabilities": []}}
                """);
        verify(0, postRequestedFor(anyUrl()));
    }

}
