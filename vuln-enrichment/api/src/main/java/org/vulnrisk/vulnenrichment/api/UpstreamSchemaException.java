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

import java.io.IOException;

/**
 * Indicates a response from a remote source that does not have the expected shape.
 * <p>
 * This is an {@link IOException} so that a previously cached value
 * can be served in place of the unusable response.
 *
 * @since 1.0.0
 */
public class UpstreamSchemaException extends IOException {

    public UpstreamSchemaException(String message) {
        super(message);
    }

    public UpstreamSchemaException(String message, Throwable cause) {
        super(message, cause);
    }

}
