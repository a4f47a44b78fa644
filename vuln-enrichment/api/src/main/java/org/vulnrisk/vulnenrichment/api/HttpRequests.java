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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;

/**
 * @since 1.0.0
 */
public final class HttpRequests {

    private HttpRequests() {
    }

    /**
     * Appends a query parameter to {@code uri}, keeping any query it already has.
     * The value is URL-encoded.
     */
    public static URI withQueryParameter(URI uri, String name, String value) {
        final String parameter = name + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8);
        final String uriString = uri.toString();
        final int fragmentIndex = uriString.indexOf('#');
        final String base = fragmentIndex >= 0 ? uriString.substring(0, fragmentIndex) : uriString;
        final String fragment = fragmentIndex >= 0 ? uriString.substring(fragmentIndex) : "";

        if (uri.getRawQuery() == null) {
            return URI.create(base + "?" + parameter + fragment);
        }
        if (uri.getRawQuery().isEmpty()) {
            return URI.create(base + parameter + fragment);
        }

        return URI.create(base + "&" + parameter + fragment);
    }

    /**
     * Sends a request, translating interruption into an {@link InterruptedIOException}
     * so that callers can treat it like any other transport failure.
     * The interrupt flag of the current thread is retained.
     */
    public static HttpResponse<InputStream> send(HttpClient httpClient, HttpRequest request) throws IOException {
        try {
            return httpClient.send(request, BodyHandlers.ofInputStream());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            final var interruptedException = new InterruptedIOException(
                    "Interrupted while waiting for response from %s".formatted(request.uri()));
            interruptedException.initCause(e);
            throw interruptedException;
        }
    }

    /**
     * Reads the body of a successful response as JSON.
     *
     * @throws UnexpectedStatusException When the response status is not 2xx.
     * @throws UpstreamSchemaException   When the body is not valid JSON.
     */
    public static JsonNode readJsonBody(ObjectMapper objectMapper, HttpResponse<InputStream> response) throws IOException {
        try (final InputStream bodyInputStream = response.body()) {
            if (response.statusCode() < 200 || response.statusCode() > 299) {
                throw new UnexpectedStatusException(response.uri(), response.statusCode());
            }

            try {
                return objectMapper.readTree(bodyInputStream);
            } catch (JsonProcessingException e) {
                throw new UpstreamSchemaException(
                        "Response from %s is not valid JSON".formatted(response.uri()), e);
            }
        }
    }

}
