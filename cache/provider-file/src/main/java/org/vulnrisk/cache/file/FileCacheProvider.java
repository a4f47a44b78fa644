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
package org.vulnrisk.cache.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import org.eclipse.microprofile.config.Config;
import org.jspecify.annotations.Nullable;
import org.vulnrisk.cache.api.CacheManager;

import java.time.Clock;

import static java.util.Objects.requireNonNull;

/**
 * Creates {@link CacheManager}s whose stores are backed by one JSON file each,
 * located in the directory configured via {@code vulnrisk.cache.directory}.
 *
 * @since 1.0.0
 */
public final class FileCacheProvider {

    private final Config config;
    private final @Nullable MeterRegistry meterRegistry;
    private final Clock clock;

    FileCacheProvider(Config config, @Nullable MeterRegistry meterRegistry, Clock clock) {
        this.config = requireNonNull(config, "config must not be null");
        this.meterRegistry = meterRegistry;
        this.clock = requireNonNull(clock, "clock must not be null");
    }

    public FileCacheProvider(Config config, @Nullable MeterRegistry meterRegistry) {
        this(config, meterRegistry, Clock.systemUTC());
    }

    public FileCacheProvider(Config config) {
        this(config, Metrics.globalRegistry);
    }

    public String name() {
        return "file";
    }

    public CacheManager create() {
        return new FileCacheManager(config, new ObjectMapper(), meterRegistry, clock);
    }

}
