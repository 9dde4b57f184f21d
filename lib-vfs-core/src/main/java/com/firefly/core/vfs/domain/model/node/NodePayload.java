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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Variant-specific part of a {@link TreeNode}.
 *
 * <p>The hierarchy is closed: a node is a folder, a text file or a binary file, and each
 * variant carries only the fields relevant to it. The JSON form carries a {@code type}
 * discriminator.</p>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = FolderPayload.class, name = "folder"),
    @JsonSubTypes.Type(value = TextPayload.class, name = "text"),
    @JsonSubTypes.Type(value = BinaryPayload.class, name = "binary")
})
public sealed interface NodePayload permits FolderPayload, TextPayload, BinaryPayload {

    /**
     * Returns the kind of node this payload describes.
     *
     * @return the node kind
     */
    NodeKind kind();
}
