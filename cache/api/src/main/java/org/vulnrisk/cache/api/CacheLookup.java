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
import org.jspecify.annotations.Nullable;

/**
 * Result of looking up a key in a {@link CacheStore}.
 * <p>
 * A lookup can end in three states:
 * <ul>
 *     <li>fresh hit: {@link #found()} is {@code true} and {@link #value()} is set</li>
 *     <li>stale hit: {@link #found()} is {@code false}, but {@link #value()} holds the
 *     expired payload, which callers may serve if refreshing it fails</li>
 *     <li>miss: neither is set</li>
 * </ul>
 *
 * @param value The cached payload, fresh or stale.
 * @param found Whether the payload is within its time-to-live.
 * @since 1.0.0
 */
public record CacheLookup(@Nullable JsonNode value, boolean found) {

    private static final CacheLookup MISS = new CacheLookup(null, false);

    public CacheLookup {
        if (found && value == null) {
            throw new IllegalArgumentException("A fresh lookup must carry a value");
        }
    }

    public static CacheLookup fresh(JsonNode value) {
        return new CacheLookup(value, true);
    }

    public static CacheLookup stale(JsonNode value) {
        return new CacheLookup(value, false);
    }

    public static CacheLookup miss() {
        return MISS;
    }

    public boolean hasStaleValue() {
        return !found && value != null;
    }

}
