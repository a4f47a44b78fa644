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
package org.vulnrisk.vulnenrichment.vulncheck;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * Exploit intelligence for a CVE.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExploitRecord(
        boolean available,
        boolean weaponized,
        String maturity,
        @Nullable String attackVector,
        @Nullable String exploitType,
        @Nullable String dateAdded,
        @Nullable String dueDate,
        @Nullable Boolean ransomwareUse,
        @Nullable String note,
        @Nullable String error) {

    static final String CREDENTIAL_REQUIRED_NOTE = "credential required";

    static ExploitRecord unknown() {
        return new ExploitRecord(false, false, "unknown", null, null, null, null, null, null, null);
    }

    static ExploitRecord credentialRequired() {
        return new ExploitRecord(false, false, "unknown", "unknown", null, null, null, null, CREDENTIAL_REQUIRED_NOTE, null);
    }

    static ExploitRecord none() {
        return new ExploitRecord(false, false, "none", "unknown", null, null, null, null, null, null);
    }

    static ExploitRecord failed(String error) {
        return new ExploitRecord(false, false, "unknown", "unknown", null, null, null, null, null, error);
    }

}
