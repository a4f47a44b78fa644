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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.vulnrisk.cache.api.CacheLoader;
import org.vulnrisk.cache.api.CacheLookup;
import org.vulnrisk.cache.api.CacheStore;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static java.util.Objects.requireNonNull;

/**
 * A {@link CacheStore} persisting all of its entries to a single JSON file.
 * <p>
 * The file holds one JSON object mapping keys to payloads. It carries no
 * timestamps: the store's age is the file's last modification time.
 * The parsed file is kept in memory and only re-read when its modification
 * time changes. Writes replace the file atomically and are serialized,
 * reads only wait for an ongoing write.
 *
 * @since 1.0.0
 */
final class FileCacheStore implements CacheStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileCacheStore.class);

    private record Snapshot(Map<String, JsonNode> entries, @Nullable Instant writtenAt) {

        private static final Snapshot EMPTY = new Snapshot(Map.of(), null);

        private boolean isFresh(Instant now, Duration ttl) {
            return writtenAt != null && Duration.between(writtenAt, now).compareTo(ttl) <= 0;
        }

    }

    private final String name;
    private final Path filePath;
    private final Duration ttl;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantReadWriteLock lock;
    private final AtomicLong hitCount;
    private final AtomicLong missCount;
    private final AtomicLong expiredCount;
    private final AtomicLong putCount;
    private final AtomicLong staleFallbackCount;
    private Snapshot snapshot;
    private @Nullable FileTime loadedModifiedTime;
    private boolean loaded;

    FileCacheStore(
            String name,
            Path filePath,
            Duration ttl,
            ObjectMapper objectMapper,
            Clock clock) {
        this.name = requireNonNull(name, "name must not be null");
        this.filePath = requireNonNull(filePath, "filePath must not be null").toAbsolutePath();
        this.ttl = requireNonNull(ttl, "ttl must not be null");
        this.objectMapper = requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = requireNonNull(clock, "clock must not be null");
        this.lock = new ReentrantReadWriteLock();
        this.hitCount = new AtomicLong();
        this.missCount = new AtomicLong();
        this.expiredCount = new AtomicLong();
        this.putCount = new AtomicLong();
        this.staleFallbackCount = new AtomicLong();
        this.snapshot = Snapshot.EMPTY;
    }

    @Override
    public String name() {
        return name;
    }

    Path filePath() {
        return filePath;
    }

    @Override
    public CacheLookup lookup(String key) {
        requireNonNull(key, "key must not be null");

        final Snapshot current = currentSnapshot();
        return lookup(current, key, current.isFresh(clock.instant(), ttl));
    }

    @Override
    public Map<String, CacheLookup> lookupMany(Collection<String> keys) {
        requireNonNull(keys, "keys must not be null");
        if (keys.isEmpty()) {
            return Map.of();
        }

        final Snapshot current = currentSnapshot();
        final boolean fresh = current.isFresh(clock.instant(), ttl);

        final var lookups = new HashMap<String, CacheLookup>(keys.size());
        for (final String key : keys) {
            final CacheLookup lookup = lookup(current, key, fresh);
            if (lookup.value() != null) {
                lookups.put(key, lookup);
            }
        }

        LOGGER.debug("{}: Found {}/{} keys (fresh={})", name, lookups.size(), keys.size(), fresh);
        return lookups;
    }

    @Override
    public void put(String key, JsonNode value) {
        requireNonNull(key, "key must not be null");
        requireNonNull(value, "value must not be null");

        putMany(Map.of(key, value));
    }

    @Override
    public void putMany(Map<String, JsonNode> entries) {
        requireNonNull(entries, "entries must not be null");
        if (entries.isEmpty()) {
            return;
        }

        lock.writeLock().lock();
        try {
            final var mergedEntries = new LinkedHashMap<>(refreshLocked().entries());
            for (final Map.Entry<String, JsonNode> entry : entries.entrySet()) {
                mergedEntries.put(
                        requireNonNull(entry.getKey(), "key must not be null"),
                        requireNonNull(entry.getValue(), "value must not be null").deepCopy());
            }

            putCount.addAndGet(entries.size());
            persistLocked(Collections.unmodifiableMap(mergedEntries));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public JsonNode getOrLoad(String key, CacheLoader loader) throws IOException {
        requireNonNull(loader, "loader must not be null");

        final CacheLookup lookup = lookup(key);
        if (lookup.found()) {
            return requireNonNull(lookup.value());
        }

        final JsonNode loadedValue;
        try {
            loadedValue = requireNonNull(loader.load(key), "loader must not return null");
        } catch (IOException e) {
            if (lookup.hasStaleValue()) {
                LOGGER.warn("{}: Failed to refresh {}; Serving stale value", name, key, e);
                staleFallbackCount.incrementAndGet();
                return requireNonNull(lookup.value());
            }

            throw e;
        }

        put(key, loadedValue);
        return loadedValue;
    }

    long size() {
        return currentSnapshot().entries().size();
    }

    long hitCount() {
        return hitCount.get();
    }

    long missCount() {
        return missCount.get();
    }

    long expiredCount() {
        return expiredCount.get();
    }

    long putCount() {
        return putCount.get();
    }

    long staleFallbackCount() {
        return staleFallbackCount.get();
    }

    private CacheLookup lookup(Snapshot current, String key, boolean fresh) {
        final JsonNode value = current.entries().get(key);
        if (value == null) {
            missCount.incrementAndGet();
            return CacheLookup.miss();
        }
        if (fresh) {
            hitCount.incrementAndGet();
            return CacheLookup.fresh(value.deepCopy());
        }

        missCount.incrementAndGet();
        expiredCount.incrementAndGet();
        return CacheLookup.stale(value.deepCopy());
    }

    private Snapshot currentSnapshot() {
        final FileTime modifiedTime = readModifiedTime();

        lock.readLock().lock();
        try {
            if (loaded && Objects.equals(modifiedTime, loadedModifiedTime)) {
                return snapshot;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            return refreshLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Snapshot refreshLocked() {
        final FileTime modifiedTime = readModifiedTime();
        if (loaded && Objects.equals(modifiedTime, loadedModifiedTime)) {
            return snapshot;
        }

        snapshot = modifiedTime != null
                ? readFile(modifiedTime)
                : Snapshot.EMPTY;
        loadedModifiedTime = modifiedTime;
        loaded = true;
        return snapshot;
    }

    private Snapshot readFile(FileTime modifiedTime) {
        final JsonNode fileContent;
        try {
            fileContent = objectMapper.readTree(filePath.toFile());
        } catch (IOException e) {
            LOGGER.warn("{}: Failed to read cache file {}; Treating it as empty", name, filePath, e);
            return Snapshot.EMPTY;
        }

        if (!(fileContent instanceof ObjectNode objectNode)) {
            LOGGER.warn("{}: Cache file {} does not contain a JSON object; Treating it as empty", name, filePath);
            return Snapshot.EMPTY;
        }

        final var entries = new LinkedHashMap<String, JsonNode>(objectNode.size());
        for (final Iterator<Map.Entry<String, JsonNode>> it = objectNode.fields(); it.hasNext(); ) {
            final Map.Entry<String, JsonNode> field = it.next();
            entries.put(field.getKey(), field.getValue());
        }

        LOGGER.debug("{}: Loaded {} entries from {}", name, entries.size(), filePath);
        return new Snapshot(Collections.unmodifiableMap(entries), modifiedTime.toInstant());
    }

    private void persistLocked(Map<String, JsonNode> entries) {
        final ObjectNode fileContent = objectMapper.createObjectNode();
        entries.forEach(fileContent::set);

        Path tempFilePath = null;
        try {
            Files.createDirectories(filePath.getParent());
            tempFilePath = Files.createTempFile(filePath.getParent(), filePath.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempFilePath.toFile(), fileContent);

            try {
                Files.move(tempFilePath, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFilePath, filePath, StandardCopyOption.REPLACE_EXISTING);
            }

            loadedModifiedTime = Files.getLastModifiedTime(filePath);
            snapshot = new Snapshot(entries, loadedModifiedTime.toInstant());
        } catch (IOException e) {
            LOGGER.warn("{}: Failed to write cache file {}; Keeping entries in memory only", name, filePath, e);
            snapshot = new Snapshot(entries, clock.instant());
            deleteQuietly(tempFilePath);
        }

        loaded = true;
    }

    private @Nullable FileTime readModifiedTime() {
        try {
            return Files.getLastModifiedTime(filePath);
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            LOGGER.warn("{}: Failed to determine modification time of {}", name, filePath, e);
            return null;
        }
    }

    private void deleteQuietly(@Nullable Path path) {
        if (path == null) {
            return;
        }

        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOGGER.debug("{}: Failed to delete temporary file {}", name, path, e);
        }
    }

}
