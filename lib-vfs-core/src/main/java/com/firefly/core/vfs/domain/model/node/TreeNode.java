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
import com.firefly.core.vfs.support.VfsPaths;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * A file or folder in the virtual filesystem.
 *
 * <p>Siblings under one parent are ordered by {@link #ordinal}. The ordinal is a property of
 * the node, distinct from its display {@link #name}; stores that sort by name may encode it
 * as a {@code NNNN_} prefix on disk, but the engine never parses names to order nodes.</p>
 *
 * <p>Key invariants:</p>
 * <ul>
 *   <li>The {@link #id} is assigned by the store at creation and never changes, including
 *       across renames and moves. Ordinal updates always address a node by id.</li>
 *   <li>No two children of the same folder share an ordinal. Gaps are allowed.</li>
 * </ul>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class TreeNode {

    /**
     * Unique node identifier (UUID), immutable
     */
    private final UUID id;

    /**
     * Display name, unique among siblings
     */
    private final String name;

    /**
     * Normalized path of the containing folder, "/" for top-level nodes and null for the root
     */
    private final String parentPath;

    /**
     * Sibling order, may be negative while a node is quarantined during a reorder
     */
    private final int ordinal;

    /**
     * Owning principal (Long), preserved across moves
     */
    private final Long ownerId;

    /**
     * Whether the node is publicly visible
     */
    private final Boolean publicNode;

    /**
     * Creation timestamp
     */
    private final Instant createdAt;

    /**
     * Last modification timestamp
     */
    private final Instant modifiedAt;

    /**
     * Variant-specific data
     */
    private final NodePayload payload;

    /**
     * Returns the normalized absolute path of this node.
     *
     * @return the node path, "/" for the root
     */
    @JsonIgnore
    public String getPath() {
        return parentPath == null ? VfsPaths.ROOT : VfsPaths.join(parentPath, name);
    }

    @JsonIgnore
    public NodeKind getKind() {
        return payload != null ? payload.kind() : NodeKind.BINARY;
    }

    @JsonIgnore
    public boolean isFolder() {
        return getKind() == NodeKind.FOLDER;
    }
}
