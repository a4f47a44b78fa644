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
package org.vulnrisk.common.config;

import org.eclipse.microprofile.config.Config;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * Typed, namespaced view on the configuration of a single enrichment source.
 * <p>
 * All properties are read below {@code vulnrisk.source.<name>.}, e.g.
 * {@code vulnrisk.source.kev.url} or {@code vulnrisk.source.epss.timeout-ms}.
 *
 * @since 1.0.0
 */
public final class SourceConfig {

    private static final Pattern VALID_NAME_PATTERN = Pattern.compile("^[a-z0-9\\-]{2,64}$");
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final Config config;
    private final String name;
    private final String prefix;

    public SourceConfig(Config config, String name) {
        this.config = requireNonNull(config, "config must not be null");
        this.name = requireNonNull(name, "name must not be null");
        if (!VALID_NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException(
                    "name does not match expected pattern %s: %s".formatted(
                            VALID_NAME_PATTERN.pattern(), name));
        }
        this.prefix = "vulnrisk.source.%s.".formatted(name);
    }

    public String name() {
        return name;
    }

    public boolean enabled() {
        return config
                .getOptionalValue(prefix + "enabled", boolean.class)
                .orElse(true);
    }

    public URI url(URI defaultUrl) {
        return config
                .getOptionalValue(prefix + "url", String.class)
                .map(URI::create)
                .orElse(defaultUrl);
    }

    public Duration timeout() {
        final Duration timeout = config
                .getOptionalValue(prefix + "timeout-ms", long.class)
                .map(Duration::ofMillis)
                .orElse(DEFAULT_TIMEOUT);
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalStateException(
                    "%s timeout-ms must be positive, but is %d".formatted(prefix, timeout.toMillis()));
        }

        return timeout;
    }

    /**
     * Resolves a credential by its un-prefixed property name.
     * <p>
     * Credentials are not namespaced, so that the environment
     * variable mapping of MicroProfile Config applies ({@code github.token}
     * is satisfied by {@code GITHUB_TOKEN}). Blank values count as absent.
     *
     * @param propertyName Name of the credential property.
     * @return The credential, if configured.
     */
    public Optional<String> credential(String propertyName) {
        requireNonNull(propertyName, "propertyName must not be null");
        return config
                .getOptionalValue(propertyName, String.class)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

}
