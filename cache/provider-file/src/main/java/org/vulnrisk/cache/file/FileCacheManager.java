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
import org.eclipse.microprofile.config.Config;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vulnrisk.cache.api.CacheConfig;
import org.vulnrisk.cache.api.CacheManager;
import org.vulnrisk.cache.api.CacheStore;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.vulnrisk.cache.api.CacheManager.requireValidName;

/**
 * @since 1.0.0
 */
final class FileCacheManager implements CacheManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileCacheManager.class);

    private final Config config;
    private final ObjectMapper objectMapper;
    private final @Nullable MeterRegistry meterRegistry;
    private final Clock clock;
    private final Map<String, FileCacheStore> storeByName;

    FileCacheManager(
            Config config,
            ObjectMapper objectMapper,
            @Nullable MeterRegistry meterRegistry,
            Clock clock) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.storeByName = new ConcurrentHashMap<>();
    }

    @Override
    public CacheStore getStore(String name) {
        requireValidName(name);
        return storeByName.computeIfAbsent(name, this::createStore);
    }

    @Override
    public void close() {
        storeByName.clear();
    }

    private FileCacheStore createStore(String name) {
        final var cacheConfig = new CacheConfig(config, name);
        final Path filePath = cacheConfig.directory().resolve(name + ".json");

        final var store = new FileCacheStore(name, filePath, cacheConfig.ttl(), objectMapper, clock);
        if (meterRegistry != null) {
            new FileCacheMeterBinder(store).bindTo(meterRegistry);
        }

        LOGGER.debug("Created cache store {} backed by {} (ttl={})", name, store.filePath(), cacheConfig.ttl());
        return store;
    }

}
