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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.eclipse.microprofile.config.Config;
import org.vulnrisk.cache.api.CacheManager;

import java.net.http.HttpClient;

import static com.fasterxml.jackson.databind.DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES;
import static java.util.Objects.requireNonNull;

/**
 * Resources shared by all enrichers.
 *
 * @since 1.0.0
 */
public final class EnrichmentContext {

    private final Config config;
    private final CacheManager cacheManager;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public EnrichmentContext(
            Config config,
            CacheManager cacheManager,
            HttpClient httpClient,
            ObjectMapper objectMapper) {
        this.config = requireNonNull(config, "config must not be null");
        this.cacheManager = requireNonNull(cacheManager, "cacheManager must not be null");
        this.httpClient = requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public EnrichmentContext(Config config, CacheManager cacheManager) {
        this(config, cacheManager, HttpClient.newHttpClient(), createObjectMapper());
    }

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .disable(FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Config config() {
        return config;
    }

    public CacheManager cacheManager() {
        return cacheManager;
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

}
