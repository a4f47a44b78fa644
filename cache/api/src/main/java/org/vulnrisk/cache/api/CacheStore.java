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
package org.vulnrisk.cache.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.Collection;
import java.util.Map;

/**
 * A persistent key-value cache, owned by exactly one enrichment source.
 * <p>
 * Freshness is tracked for the store as a whole, not per entry:
 * once the store's time-to-live elapsed, every entry is reported as stale
 * until the next successful write refreshes it.
 * <p>
 * Implementations must be safe for concurrent use. Failing to persist a
 * write must never surface to the caller.
 *
 * @since 1.0.0
 */
public interface CacheStore {

    String name();

    CacheLookup lookup(String key);

    /**
     * @param keys The keys to look up.
     * @return Lookups for all given keys that have a fresh or stale value. Misses are omitted.
     */
    Map<String, CacheLookup> lookupMany(Collection<String> keys);

    void put(String key, JsonNode value);

    void putMany(Map<String, JsonNode> entries);

    /**
     * Returns the fresh cached value for {@code key}, or loads, stores and returns a new one.
     * <p>
     * When the loader fails with an {@link IOException} and a stale value exists,
     * the stale value is returned instead and the failure is only logged.
     * Without any cached value, the failure is propagated.
     * Unchecked exceptions thrown by the loader are always propagated.
     *
     * @param key    The key to get the value for.
     * @param loader The loader to invoke when no fresh value is cached.
     * @return The fresh, newly loaded, or stale value.
     * @throws IOException When loading failed and no stale value was available.
     */
    JsonNode getOrLoad(String key, CacheLoader loader) throws IOException;

}
