/*
 * Copyright 2024 Firefly Software Solutions Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.firefly.core.vfs.domain.model.node;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Text file variant of a node payload.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class TextPayload implements NodePayload {

    /**
     * MIME type of the text, e.g. text/markdown
     */
    String mimeType;

    /**
     * Content size in bytes, null when unknown
     */
    Long sizeBytes;

    /**
     * Inline content, only populated when a caller asks for it
     */
    String text;

    @Override
    @JsonIgnore
    public NodeKind kind() {
        return NodeKind.TEXT;
    }
}
