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

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CacheMeterBinder;

import java.util.Optional;

/**
 * @since 1.0.0
 */
final class FileCacheMeterBinder extends CacheMeterBinder<FileCacheStore> {

    FileCacheMeterBinder(FileCacheStore store) {
        super(store, store.name(), null);
    }

    @Override
    protected Long size() {
        return Optional
                .ofNullable(getCache())
                .map(FileCacheStore::size)
                .orElse(0L);
    }

    @Override
    protected long hitCount() {
        return Optional
                .ofNullable(getCache())
                .map(FileCacheStore::hitCount)
                .orElse(0L);
    }

    @Override
    protected Long missCount() {
        return Optional
                .ofNullable(getCache())
                .map(FileCacheStore::missCount)
                .orElse(0L);
    }

    // Entries are never evicted individually, they expire with the file.
    @Override
    protected Long evictionCount() {
        return Optional
                .ofNullable(getCache())
                .map(FileCacheStore::expiredCount)
                .orElse(0L);
    }

    @Override
    protected long putCount() {
        return Optional
                .ofNullable(getCache())
                .map(FileCacheStore::putCount)
                .orElse(0L);
    }

    @Override
    protected void bindImplementationSpecificMetrics(MeterRegistry registry) {
        FunctionCounter
                .builder("cache.stale.fallbacks", getCache(), store -> store != null ? store.staleFallbackCount() : 0)
                .tags(getTagsWithCacheName())
                .description("The number of times a stale entry was served because refreshing it failed")
                .register(registry);
    }

}
