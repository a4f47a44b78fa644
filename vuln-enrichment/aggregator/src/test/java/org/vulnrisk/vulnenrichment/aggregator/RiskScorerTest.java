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
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.vulnrisk.vulnenrichment.api.Priority;

import static org.assertj.core.api.Assertions.assertThat;

class RiskScorerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RiskScorer scorer = new RiskScorer(RiskWeights.DEFAULT);

    private JsonNode finding(String json) throws Exception {
        return objectMapper.readTree(json);
    }

    @Test
    void shouldScoreLowRiskFinding() throws Exception {
        final JsonNode finding = finding(/* language=JSON */ """
                {
                  "cve": "CVE-2024-00001",
                  "cvssScore": 3.0,
                  "epss": {"epssScore": 0.05},
                  "kev": {"inKev": false},
                  "exploit": {"available": false, "weaponized": false}
                }
                """);

        assertThat(scorer.score(finding)).isEqualTo(13.5);
        assertThat(scorer.priority(finding)).isEqualTo(Priority.P4_LOW);
    }

    @Test
    void shouldPrioritizeKnownExploitedRegardlessOfScore() throws Exception {
        final JsonNode finding = finding("{\"kev\": {\"inKev\": true}}");

        assertThat(scorer.score(finding)).isEqualTo(20.0);
        assertThat(scorer.priority(finding)).isEqualTo(Priority.P0_IMMEDIATE);
    }

    @Test
    void shouldNotPrioritizeWeaponizedExploitBelowCritical() throws Exception {
        final JsonNode finding = finding(/* language=JSON */ """
                {"cvssScore": 2.0, "exploit": {"available": true, "weaponized": true}}
                """);

        assertThat(scorer.score(finding)).isEqualTo(18.0);
        assertThat(scorer.priority(finding)).isEqualTo(Priority.P1_CRITICAL);
    }

    @Test
    void shouldCountAvailableExploitAtHalfWeight() throws Exception {
        final JsonNode finding = finding("{\"exploit\": {\"available\": true, \"weaponized\": false}}");

        assertThat(scorer.score(finding)).isEqualTo(5.0);
    }

    @Test
    void shouldScoreMaximumRisk() throws Exception {
        final JsonNode finding = finding(/* language=JSON */ """
                {
                  "cvssScore": 10.0,
                  "epss": {"epssScore": 1.0},
                  "kev": {"inKev": true},
                  "exploit": {"available": true, "weaponized": true}
                }
                """);

        assertThat(scorer.score(finding)).isEqualTo(100.0);
    }

    @Test
    void shouldClampScore() throws Exception {
        assertThat(scorer.score(finding("{\"cvssScore\": 25.0, \"kev\": {\"inKev\": true}}"))).isEqualTo(100.0);
        assertThat(scorer.score(finding("{\"cvssScore\": -10.0}"))).isEqualTo(0.0);
    }

    @Test
    void shouldRoundScoreHalfUp() throws Exception {
        // 40 * 0.5 + 30 * 0.12345 = 23.7035
        assertThat(scorer.score(finding("{\"cvssScore\": 5.0, \"epss\": {\"epssScore\": 0.12345}}"))).isEqualTo(23.7);
        // 30 * 0.00015 = 0.0045
        assertThat(scorer.score(finding("{\"epss\": {\"epssScore\": 0.00015}}"))).isEqualTo(0.0);
        // 30 * 0.00051 = 0.0153
        assertThat(scorer.score(finding("{\"epss\": {\"epssScore\": 0.00051}}"))).isEqualTo(0.02);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "{\"cvssScore\": 7.5}                    | 30.0",
            "{\"cvss_score\": 7.5}                   | 30.0",
            "{\"cvss\": 7.5}                         | 30.0",
            "{\"cvssScore\": \"high\", \"cvss\": 5.0} | 20.0",
            "{\"cvssScore\": \"7.5\"}                | 0.0",
            "{\"cvssScore\": null}                   | 0.0",
            "{}                                      | 0.0"
    })
    void shouldReadCvssScore(String findingJson, double expectedScore) throws Exception {
        assertThat(scorer.score(finding(findingJson))).isEqualTo(expectedScore);
    }

    @Test
    void shouldIgnoreMalformedSignals() throws Exception {
        final JsonNode finding = finding(/* language=JSON */ """
                {
                  "epss": "0.9",
                  "kev": true,
                  "exploit": {"weaponized": "yes"}
                }
                """);

        assertThat(scorer.score(finding)).isEqualTo(0.0);
        assertThat(scorer.priority(finding)).isEqualTo(Priority.P4_LOW);
    }

    @ParameterizedTest
    @CsvSource(value = {
            "100.0, P1_CRITICAL",
            "80.0, P1_CRITICAL",
            "79.99, P2_HIGH",
            "60.0, P2_HIGH",
            "59.99, P3_MEDIUM",
            "40.0, P3_MEDIUM",
            "39.99, P4_LOW",
            "0.0, P4_LOW"
    })
    void shouldMapScoreToPriority(double score, Priority expectedPriority) {
        assertThat(scorer.priority(objectMapper.createObjectNode(), score)).isEqualTo(expectedPriority);
    }

    @Test
    void shouldUseCustomWeights() throws Exception {
        final var customScorer = new RiskScorer(new RiskWeights(100, 0, 0, 0, 90, 50, 10));
        final JsonNode finding = finding("{\"cvssScore\": 9.0, \"epss\": {\"epssScore\": 1.0}}");

        assertThat(customScorer.score(finding)).isEqualTo(90.0);
        assertThat(customScorer.priority(finding)).isEqualTo(Priority.P1_CRITICAL);
    }

}
