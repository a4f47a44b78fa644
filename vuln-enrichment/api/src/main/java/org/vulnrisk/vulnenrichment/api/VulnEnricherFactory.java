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

/**
 * @param <T> Type of the {@link VulnEnricher} created by this factory.
 * @since 1.0.0
 */
public interface VulnEnricherFactory<T extends VulnEnricher> {

    String name();

    /**
     * @param ctx The {@link EnrichmentContext} to evaluate configuration in.
     * @return Whether the enricher is enabled.
     */
    boolean isEnabled(EnrichmentContext ctx);

    /**
     * @param ctx The {@link EnrichmentContext} providing shared resources.
     * @return A new enricher.
     * @throws IllegalStateException When the enricher is disabled or misconfigured.
     */
    T create(EnrichmentContext ctx);

}
