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
package org.vulnrisk.vulnenrichment.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

class CveIdTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @ParameterizedTest
    @ValueSource(strings = {"CVE-2021-44228", "CVE-2024-00001", "CVE-1999-1"})
    void shouldAcceptValidIds(String value) {
        assertThat(CveId.isValid(value)).isTrue();
        assertThat(CveId.of(value).value()).isEqualTo(value);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"not-a-cve", "cve-2021-44228", "CVE-21-44228", "CVE-2021-", " CVE-2021-44228", "GHSA-jfh8-c2jp-5v3q"})
    void shouldRejectInvalidIds(String value) {
        assertThat(CveId.isValid(value)).isFalse();
        assertThatExceptionOfType(ValidationException.class)
                .isThrownBy(() -> CveId.of(value));
    }

    @Test
    void shouldExtractFromCveField() throws Exception {
        final JsonNode finding = objectMapper.readTree("""
                {"cve": "CVE-2021-44228", "id": "CVE-2020-0001", "vulnerability": {"id": "CVE-2019-0001"}}
                """);

        assertThat(CveId.extract(finding)).contains(CveId.of("CVE-2021-44228"));
    }

    @Test
    void shouldExtractFromIdField() throws Exception {
        final JsonNode finding = objectMapper.readTree("""
                {"id": "CVE-2020-0001", "vulnerability": {"id": "CVE-2019-0001"}}
                """);

        assertThat(CveId.extract(finding)).contains(CveId.of("CVE-2020-0001"));
    }

    @Test
    void shouldExtractFromNestedVulnerabilityId() throws Exception {
        final JsonNode finding = objectMapper.readTree("""
                {"package": "log4j-core", "vulnerability": {"id": "CVE-2019-0001"}}
                """);

        assertThat(CveId.extract(finding)).contains(CveId.of("CVE-2019-0001"));
    }

    @Test
    void shouldSkipEmptyFieldsDuringExtraction() throws Exception {
        final JsonNode finding = objectMapper.readTree("""
                {"cve": "", "id": null, "vulnerability": {"id": "CVE-2019-0001"}}
                """);

        assertThat(CveId.extract(finding)).contains(CveId.of("CVE-2019-0001"));
    }

    @Test
    void shouldNotExtractNonCveId() throws Exception {
        final JsonNode finding = objectMapper.readTree("""
                {"id": "GHSA-jfh8-c2jp-5v3q", "vulnerability": {"id": "CVE-2019-0001"}}
                """);

        assertThat(CveId.extract(finding)).isEmpty();
    }

    @Test
    void shouldNotExtractFromNonObjects() throws Exception {
        assertThat(CveId.extract(null)).isEmpty();
        assertThat(CveId.extract(objectMapper.readTree("\"CVE-2021-44228\""))).isEmpty();
        assertThat(CveId.extract(objectMapper.readTree("[\"CVE-2021-44228\"]"))).isEmpty();
    }

}
