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
package com.firefly.vfs.adapter.memory;

import com.firefly.core.vfs.adapter.AdapterFeature;
import com.firefly.core.vfs.adapter.VfsAdapter;
import com.firefly.core.vfs.domain.model.node.BinaryPayload;
import com.firefly.core.vfs.domain.model.node.FolderPayload;
import com.firefly.core.vfs.domain.model.node.NodePayload;
import com.firefly.core.vfs.domain.model.node.TextPayload;
import com.firefly.core.vfs.domain.model.node.TreeNode;
import com.firefly.core.vfs.exception.InvalidOperationException;
import com.firefly.core.vfs.exception.NodeAlreadyExistsException;
import com.firefly.core.vfs.exception.NodeNotFoundException;
import com.firefly.core.vfs.exception.OrdinalConflictException;
import com.firefly.core.vfs.port.node.NodeContentPort;
import com.firefly.core.vfs.port.node.NodeStorePort;
import com.firefly.core.vfs.support.VfsPaths;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link NodeStorePort} and {@link NodeContentPort}.
 *
 * <p>Nodes are kept in an id-keyed map with a path index next to it. Every operation runs
 * under the adapter's monitor, so each single store call is atomic; sequences of calls are
 * coordinated by the engine's folder locks.</p>
 *
 * <p>With {@code enforce-unique-ordinals} enabled (the default) the adapter refuses any
 * write that would leave two siblings on the same ordinal and signals an
 * {@link OrdinalConflictException}. This makes the store a strict checker of the engine's
 * write sequences.</p>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
@Slf4j
@VfsAdapter(
    type = "memory",
    description = "In-memory node store for tests and embedded use",
    supportedFeatures = {
        AdapterFeature.NODE_CRUD,
        AdapterFeature.CONTENT_STORAGE,
        AdapterFeature.ORDINAL_UPDATES,
        AdapterFeature.SUBTREE_MOVE,
        AdapterFeature.UNIQUE_ORDINALS,
        AdapterFeature.IN_MEMORY
    }
)
public class InMemoryNodeStoreAdapter implements NodeStorePort, NodeContentPort {

    private final InMemoryAdapterProperties properties;
    private final Map<UUID, TreeNode> nodes = new HashMap<>();
    private final Map<String, UUID> pathIndex = new HashMap<>();
    private final Map<UUID, StoredContent> contents = new HashMap<>();

    public InMemoryNodeStoreAdapter(InMemoryAdapterProperties properties) {
        this.properties = properties;
        Instant now = Instant.now();
        TreeNode root = TreeNode.builder()
            .id(UUID.randomUUID())
            .name("")
            .ordinal(0)
            .ownerId(properties.getRootOwnerId())
            .publicNode(properties.getRootPublic())
            .createdAt(now)
            .modifiedAt(now)
            .payload(FolderPayload.empty())
            .build();
        nodes.put(root.getId(), root);
        pathIndex.put(VfsPaths.ROOT, root.getId());
        log.info("InMemoryNodeStoreAdapter initialized, unique ordinals enforced: {}", properties.getEnforceUniqueOrdinals());
    }

    @Override
    public Mono<TreeNode> createNode(TreeNode node) {
        return Mono.fromCallable(() -> doCreate(node))
            .doOnSuccess(created -> log.debug("Created node {} at ordinal {}", created.getPath(), created.getOrdinal()));
    }

    @Override
    public Mono<TreeNode> getNode(UUID nodeId) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                TreeNode node = nodes.get(nodeId);
                return node == null ? null : decorate(node);
            }
        });
    }

    @Override
    public Mono<TreeNode> getNodeByPath(String path) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                UUID id = pathIndex.get(VfsPaths.normalize(path));
                return id == null ? null : decorate(nodes.get(id));
            }
        });
    }

    @Override
    public Flux<TreeNode> readChildren(String folderPath) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                String folder = VfsPaths.normalize(folderPath);
                requireFolder(folder);
                return childrenOf(folder).stream()
                    .map(this::decorate)
                    .sorted(SIBLING_ORDER)
                    .collect(Collectors.toList());
            }
        })
        .flatMapMany(Flux::fromIterable);
    }

    @Override
    public Mono<Void> setOrdinal(UUID nodeId, int ordinal) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                TreeNode node = nodes.get(nodeId);
                if (node == null) {
                    throw new NodeNotFoundException(String.valueOf(nodeId));
                }
                if (node.getParentPath() == null) {
                    throw new InvalidOperationException("The root folder has no ordinal", VfsPaths.ROOT);
                }
                if (node.getOrdinal() == ordinal) {
                    return;
                }
                checkOrdinalFree(node.getParentPath(), ordinal, nodeId);
                nodes.put(nodeId, node.toBuilder().ordinal(ordinal).modifiedAt(Instant.now()).build());
            }
        });
    }

    @Override
    public Mono<TreeNode> moveNode(String sourcePath, String targetPath) {
        return Mono.fromCallable(() -> doMove(VfsPaths.normalize(sourcePath), VfsPaths.normalize(targetPath)))
            .doOnSuccess(moved -> log.debug("Moved {} to {}", sourcePath, moved.getPath()));
    }

    @Override
    public Mono<Void> deleteNode(String path, boolean recursive) {
        return Mono.fromRunnable(() -> doDelete(VfsPaths.normalize(path), recursive));
    }

    @Override
    public Mono<Void> storeContent(UUID nodeId, byte[] content, String mimeType) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                TreeNode node = nodes.get(nodeId);
                if (node == null) {
                    throw new NodeNotFoundException(String.valueOf(nodeId));
                }
                if (node.isFolder()) {
                    throw new InvalidOperationException("Folders have no content: " + node.getPath(), node.getPath());
                }
                contents.put(nodeId, new StoredContent(content.clone(), mimeType));
                nodes.put(nodeId, node.toBuilder()
                    .payload(withSize(node.getPayload(), content.length))
                    .modifiedAt(Instant.now())
                    .build());
            }
        });
    }

    @Override
    public Mono<byte[]> getContent(UUID nodeId) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                StoredContent stored = contents.get(nodeId);
                return stored == null ? null : stored.bytes.clone();
            }
        });
    }

    @Override
    public Mono<Void> deleteContent(UUID nodeId) {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                contents.remove(nodeId);
            }
        });
    }

    @Override
    public String getAdapterName() {
        return "InMemoryNodeStoreAdapter";
    }

    /**
     * Returns the MIME type recorded with a node's content.
     *
     * @param nodeId the node id
     * @return the MIME type, or null if no content is stored
     */
    public synchronized String getMimeType(UUID nodeId) {
        StoredContent stored = contents.get(nodeId);
        return stored == null ? null : stored.mimeType;
    }

    /**
     * Returns the number of nodes in the store, the root included.
     */
    public synchronized int size() {
        return nodes.size();
    }

    private synchronized TreeNode doCreate(TreeNode node) {
        String parent = VfsPaths.normalize(node.getParentPath());
        requireFolder(parent);
        String name = VfsPaths.requireValidName(node.getName());
        String path = VfsPaths.join(parent, name);
        if (pathIndex.containsKey(path)) {
            throw new NodeAlreadyExistsException(path);
        }
        UUID id = node.getId() != null ? node.getId() : UUID.randomUUID();
        if (nodes.containsKey(id)) {
            throw new InvalidOperationException("Node id already in use: " + id, path);
        }
        checkOrdinalFree(parent, node.getOrdinal(), id);
        Instant now = Instant.now();
        TreeNode created = node.toBuilder()
            .id(id)
            .name(name)
            .parentPath(parent)
            .createdAt(now)
            .modifiedAt(now)
            .payload(node.getPayload() != null && node.isFolder() ? FolderPayload.empty() : node.getPayload())
            .build();
        nodes.put(id, created);
        pathIndex.put(path, id);
        return created;
    }

    private synchronized TreeNode doMove(String source, String target) {
        if (VfsPaths.ROOT.equals(source) || VfsPaths.ROOT.equals(target)) {
            throw new InvalidOperationException("The root folder cannot be moved", VfsPaths.ROOT);
        }
        UUID id = pathIndex.get(source);
        if (id == null) {
            throw new NodeNotFoundException(source);
        }
        TreeNode node = nodes.get(id);
        if (source.equals(target)) {
            return decorate(node);
        }
        String targetParent = VfsPaths.parent(target);
        String targetName = VfsPaths.requireValidName(VfsPaths.name(target));
        requireFolder(targetParent);
        if (node.isFolder() && VfsPaths.isSameOrDescendant(source, target)) {
            throw new InvalidOperationException("Cannot move a folder into itself: " + source, source);
        }
        if (pathIndex.containsKey(target)) {
            throw new NodeAlreadyExistsException(target);
        }
        if (!targetParent.equals(node.getParentPath())) {
            checkOrdinalFree(targetParent, node.getOrdinal(), id);
        }

        List<TreeNode> descendants = node.isFolder() ? descendantsOf(source) : List.of();
        TreeNode moved = node.toBuilder().parentPath(targetParent).name(targetName).modifiedAt(Instant.now()).build();
        pathIndex.remove(source);
        nodes.put(id, moved);
        pathIndex.put(target, id);
        for (TreeNode descendant : descendants) {
            String oldPath = descendant.getPath();
            TreeNode rebased = descendant.toBuilder()
                .parentPath(VfsPaths.rebase(descendant.getParentPath(), source, target))
                .build();
            pathIndex.remove(oldPath);
            nodes.put(rebased.getId(), rebased);
            pathIndex.put(rebased.getPath(), rebased.getId());
        }
        return decorate(moved);
    }

    private synchronized void doDelete(String path, boolean recursive) {
        if (VfsPaths.ROOT.equals(path)) {
            throw new InvalidOperationException("The root folder cannot be deleted", VfsPaths.ROOT);
        }
        UUID id = pathIndex.get(path);
        if (id == null) {
            throw new NodeNotFoundException(path);
        }
        TreeNode node = nodes.get(id);
        List<TreeNode> removed = new ArrayList<>();
        if (node.isFolder()) {
            List<TreeNode> descendants = descendantsOf(path);
            if (!descendants.isEmpty() && !recursive) {
                throw new InvalidOperationException("Folder is not empty: " + path, path);
            }
            removed.addAll(descendants);
        }
        removed.add(node);
        for (TreeNode gone : removed) {
            nodes.remove(gone.getId());
            pathIndex.remove(gone.getPath());
            contents.remove(gone.getId());
        }
        log.debug("Deleted {} ({} nodes)", path, removed.size());
    }

    private TreeNode requireFolder(String folder) {
        UUID id = pathIndex.get(folder);
        if (id == null) {
            throw new NodeNotFoundException(folder);
        }
        TreeNode node = nodes.get(id);
        if (!node.isFolder()) {
            throw new InvalidOperationException("Not a folder: " + folder, folder);
        }
        return node;
    }

    private void checkOrdinalFree(String folder, int ordinal, UUID self) {
        if (!Boolean.TRUE.equals(properties.getEnforceUniqueOrdinals())) {
            return;
        }
        for (TreeNode sibling : childrenOf(folder)) {
            if (sibling.getOrdinal() == ordinal && !sibling.getId().equals(self)) {
                throw new OrdinalConflictException(folder, ordinal);
            }
        }
    }

    private List<TreeNode> childrenOf(String folder) {
        return nodes.values().stream()
            .filter(node -> folder.equals(node.getParentPath()))
            .collect(Collectors.toList());
    }

    private List<TreeNode> descendantsOf(String folder) {
        return nodes.values().stream()
            .filter(node -> node.getParentPath() != null && VfsPaths.isSameOrDescendant(folder, node.getParentPath()))
            .collect(Collectors.toList());
    }

    private TreeNode decorate(TreeNode node) {
        if (!node.isFolder()) {
            return node;
        }
        String path = node.getPath();
        boolean hasChildren = nodes.values().stream().anyMatch(child -> Objects.equals(path, child.getParentPath()));
        return node.toBuilder().payload(FolderPayload.builder().hasChildren(hasChildren).build()).build();
    }

    private static NodePayload withSize(NodePayload payload, long size) {
        if (payload instanceof TextPayload) {
            return ((TextPayload) payload).toBuilder().sizeBytes(size).build();
        }
        if (payload instanceof BinaryPayload) {
            return ((BinaryPayload) payload).toBuilder().sizeBytes(size).build();
        }
        return payload;
    }

    private static final class StoredContent {
        private final byte[] bytes;
        private final String mimeType;

        private StoredContent(byte[] bytes, String mimeType) {
            this.bytes = bytes;
            this.mimeType = mimeType;
        }
    }
}
