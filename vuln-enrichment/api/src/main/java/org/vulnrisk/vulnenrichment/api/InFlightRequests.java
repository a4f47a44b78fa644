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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;

/**
 * Collapses concurrent requests for the same key into a single execution.
 * <p>
 * The first caller for a key executes the request. Callers arriving while
 * it is in flight wait for, and receive, the same result or failure.
 * Once the request completed, the key is released and the next caller
 * executes the request again.
 *
 * @param <K> Type of the request key.
 * @param <V> Type of the request result.
 * @since 1.0.0
 */
public final class InFlightRequests<K, V> {

    private static final Logger LOGGER = LoggerFactory.getLogger(InFlightRequests.class);

    @FunctionalInterface
    public interface Request<V> {

        V execute() throws IOException;

    }

    private final String name;
    private final Map<K, CompletableFuture<V>> futureByKey;
    private final ReentrantLock lock;

    public InFlightRequests(String name) {
        this.name = requireNonNull(name, "name must not be null");
        this.futureByKey = new HashMap<>();
        this.lock = new ReentrantLock();
    }

    public V execute(K key, Request<V> request) throws IOException {
        requireNonNull(key, "key must not be null");
        requireNonNull(request, "request must not be null");

        final CompletableFuture<V> future;
        final boolean owner;
        lock.lock();
        try {
            final CompletableFuture<V> existingFuture = futureByKey.get(key);
            if (existingFuture != null) {
                future = existingFuture;
                owner = false;
            } else {
                future = new CompletableFuture<>();
                futureByKey.put(key, future);
                owner = true;
            }
        } finally {
            lock.unlock();
        }

        if (!owner) {
            LOGGER.debug("{}: Waiting for in-flight request of {}", name, key);
            return await(future);
        }

        try {
            final V result = request.execute();
            future.complete(result);
            return result;
        } catch (IOException | RuntimeException | Error e) {
            future.completeExceptionally(e);
            throw e;
        } finally {
            lock.lock();
            try {
                futureByKey.remove(key, future);
            } finally {
                lock.unlock();
            }
        }
    }

    int inFlightCount() {
        lock.lock();
        try {
            return futureByKey.size();
        } finally {
            lock.unlock();
        }
    }

    private V await(CompletableFuture<V> future) throws IOException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            final var interruptedException = new InterruptedIOException(
                    "%s: Interrupted while waiting for in-flight request".formatted(name));
            interruptedException.initCause(e);
            throw interruptedException;
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof IOException ioException) {
                throw ioException;
            } else if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            } else if (cause instanceof Error error) {
                throw error;
            }

            throw new IOException(cause);
        }
    }

}
