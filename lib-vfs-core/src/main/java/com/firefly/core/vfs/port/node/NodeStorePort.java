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
package com.firefly.core.vfs.port.node;

import com.firefly.core.vfs.domain.model.node.TreeNode;
import com.firefly.core.vfs.support.VfsPaths;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.UUID;

/**
 * Port interface for the hierarchical node store backing the virtual filesystem.
 *
 * <p>The store owns node identity, structure and the per-node {@code ordinal}. It knows
 * nothing about ordering algorithms: the engine reads children, computes new ordinals and
 * writes them back one node at a time through {@link #setOrdinal(UUID, int)}. Adapters
 * must relocate whole subtrees on {@link #moveNode(String, String)}, keeping descendant
 * relative paths, ids and content unchanged.</p>
 *
 * <p>All paths are absolute and normalized with {@link VfsPaths}. Query operations return
 * an empty {@link Mono} for missing nodes; mutations signal
 * {@link com.firefly.core.vfs.exception.NodeNotFoundException} instead.</p>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
public interface NodeStorePort {

    /** Sibling order used by every listing: ordinal first, name as tie-breaker. */
    Comparator<TreeNode> SIBLING_ORDER = Comparator.comparingInt(TreeNode::getOrdinal)
        .thenComparing(TreeNode::getName, Comparator.nullsFirst(Comparator.naturalOrder()));

    /**
     * Create a node under {@code node.parentPath} with the node's name, ordinal and payload.
     *
     * @param node the node to create, its id and timestamps are assigned by the store
     * @return Mono containing the created node
     */
    Mono<TreeNode> createNode(TreeNode node);

    /**
     * Get a node by id.
     *
     * @param nodeId the node id
     * @return Mono containing the node, empty if not found
     */
    Mono<TreeNode> getNode(UUID nodeId);

    /**
     * Get a node by path. The root path {@code /} resolves to the root folder.
     *
     * @param path the node path
     * @return Mono containing the node, empty if not found
     */
    Mono<TreeNode> getNodeByPath(String path);

    /**
     * Read all direct children of a folder, sorted by {@link #SIBLING_ORDER}.
     *
     * @param folderPath the folder path
     * @return Flux of child nodes, error if the folder does not exist
     */
    Flux<TreeNode> readChildren(String folderPath);

    /**
     * Update the ordinal of a single node.
     *
     * @param nodeId the node id
     * @param ordinal the new ordinal
     * @return Mono indicating completion
     */
    Mono<Void> setOrdinal(UUID nodeId, int ordinal);

    /**
     * Move or rename a node, relocating its whole subtree. The node keeps its id and ordinal.
     *
     * @param sourcePath the current node path
     * @param targetPath the new node path, whose parent must be an existing folder
     * @return Mono containing the relocated node
     */
    Mono<TreeNode> moveNode(String sourcePath, String targetPath);

    /**
     * Delete a node. Remaining siblings are not renumbered.
     *
     * @param path the node path
     * @param recursive whether a non-empty folder may be deleted with its contents
     * @return Mono indicating completion
     */
    Mono<Void> deleteNode(String path, boolean recursive);

    /**
     * Get the adapter name for identification.
     *
     * @return the adapter name
     */
    String getAdapterName();

    /**
     * Rename a node within its folder.
     *
     * @param path the node path
     * @param newName the new display name
     * @return Mono containing the renamed node
     */
    default Mono<TreeNode> renameNode(String path, String newName) {
        return moveNode(path, VfsPaths.join(VfsPaths.parent(path), newName));
    }

    /**
     * Check whether a node exists.
     *
     * @param path the node path
     * @return Mono containing true if the node exists
     */
    default Mono<Boolean> exists(String path) {
        return getNodeByPath(path).hasElement();
    }

    /**
     * Get the highest ordinal among the children of a folder.
     *
     * @param folderPath the folder path
     * @return Mono containing the maximum ordinal, empty if the folder has no children
     */
    default Mono<Integer> getMaxOrdinal(String folderPath) {
        return readChildren(folderPath)
            .map(TreeNode::getOrdinal)
            .reduce(Math::max);
    }
}
