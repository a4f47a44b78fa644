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
package org.vulnrisk.vulnenrichment.aggregator;

import org.jspecify.annotations.Nullable;

/**
 * A failure of a single source to enrich a single finding.
 *
 * @param source  Name of the source that failed.
 * @param cveId   ID of the CVE whose enrichment failed, if the finding has one.
 * @param message Description of the failure.
 * @since 1.0.0
 */
public record SourceFailure(String source, @Nullable String cveId, String message) {
}
