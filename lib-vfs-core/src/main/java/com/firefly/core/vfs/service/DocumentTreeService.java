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
package com.firefly.core.vfs.service;

import com.firefly.core.vfs.domain.model.node.FolderPayload;
import com.firefly.core.vfs.domain.model.node.NodeKind;
import com.firefly.core.vfs.domain.model.node.NodePayload;
import com.firefly.core.vfs.domain.model.node.TreeNode;
import com.firefly.core.vfs.domain.model.ordering.InsertPosition;
import com.firefly.core.vfs.domain.model.result.DeleteResult;
import com.firefly.core.vfs.exception.InvalidOperationException;
import com.firefly.core.vfs.exception.NodeAlreadyExistsException;
import com.firefly.core.vfs.exception.NodeNotFoundException;
import com.firefly.core.vfs.ordering.FolderLockRegistry;
import com.firefly.core.vfs.ordering.OrdinalAssigner;
import com.firefly.core.vfs.ordering.OrdinalInvariantVerifier;
import com.firefly.core.vfs.port.node.NodeContentPort;
import com.firefly.core.vfs.port.node.NodeStorePort;
import com.firefly.core.vfs.support.NodeTypes;
import com.firefly.core.vfs.support.VfsPaths;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Document tree operations built on the ordering engine: creating files and folders at a
 * position, renaming, deleting and saving content.
 *
 * <p>New nodes inherit owner and visibility from their folder. Creation reserves the slot
 * through the {@link OrdinalAssigner}, so inserting in the middle of a folder shifts the
 * following siblings. Deletion never renumbers the remaining siblings.</p>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
@Slf4j
public class DocumentTreeService {

    private final NodeStorePort nodeStore;
    private final NodeContentPort contentPort;
    private final OrdinalAssigner ordinalAssigner;
    private final FolderLockRegistry lockRegistry;
    private final OrdinalInvariantVerifier verifier;
    private final NodeTypes nodeTypes;
    private final String defaultExtension;

    public DocumentTreeService(NodeStorePort nodeStore,
                               NodeContentPort contentPort,
                               OrdinalAssigner ordinalAssigner,
                               FolderLockRegistry lockRegistry,
                               OrdinalInvariantVerifier verifier,
                               NodeTypes nodeTypes,
                               String defaultExtension) {
        this.nodeStore = nodeStore;
        this.contentPort = contentPort;
        this.ordinalAssigner = ordinalAssigner;
        this.lockRegistry = lockRegistry;
        this.verifier = verifier;
        this.nodeTypes = nodeTypes;
        this.defaultExtension = defaultExtension;
    }

    /**
     * Lists the children of a folder in ordinal order.
     *
     * @param folder the folder path
     * @return Flux of child nodes
     */
    public Flux<TreeNode> listChildren(String folder) {
        return nodeStore.readChildren(VfsPaths.normalize(folder));
    }

    /**
     * Creates a text file. A name without an extension gets the default extension.
     *
     * @param folder the folder path
     * @param name the file name
     * @param position where to insert the file
     * @param content initial content, may be null for an empty file
     * @return Mono containing the created node
     */
    public Mono<TreeNode> createFile(String folder, String name, InsertPosition position, String content) {
        return Mono.defer(() -> {
            String fileName = withDefaultExtension(VfsPaths.requireValidName(name));
            byte[] bytes = (content == null ? "" : content).getBytes(StandardCharsets.UTF_8);
            NodePayload payload = nodeTypes.payloadFor(fileName, (long) bytes.length);
            return create(VfsPaths.normalize(folder), fileName, position, payload,
                created -> contentPort.storeContent(created.getId(), bytes, nodeTypes.mimeType(fileName)));
        })
        .doOnSuccess(node -> log.info("Created file {} at ordinal {}", node.getPath(), node.getOrdinal()));
    }

    /**
     * Creates a file with binary content, classified by its extension.
     *
     * @param folder the folder path
     * @param name the file name, including its extension
     * @param position where to insert the file
     * @param content the file content
     * @return Mono containing the created node
     */
    public Mono<TreeNode> uploadFile(String folder, String name, InsertPosition position, byte[] content) {
        return Mono.defer(() -> {
            String fileName = VfsPaths.requireValidName(name);
            byte[] bytes = content == null ? new byte[0] : content;
            NodePayload payload = nodeTypes.payloadFor(fileName, (long) bytes.length);
            return create(VfsPaths.normalize(folder), fileName, position, payload,
                created -> contentPort.storeContent(created.getId(), bytes, nodeTypes.mimeType(fileName)));
        })
        .doOnSuccess(node -> log.info("Uploaded {} at ordinal {}", node.getPath(), node.getOrdinal()));
    }

    /**
     * Creates an empty folder.
     *
     * @param folder the parent folder path
     * @param name the folder name
     * @param position where to insert the folder
     * @return Mono containing the created node
     */
    public Mono<TreeNode> createFolder(String folder, String name, InsertPosition position) {
        return Mono.defer(() -> create(VfsPaths.normalize(folder), VfsPaths.requireValidName(name), position,
                FolderPayload.empty(), created -> Mono.empty()))
            .doOnSuccess(node -> log.info("Created folder {} at ordinal {}", node.getPath(), node.getOrdinal()));
    }

    /**
     * Renames a node, keeping its id, ordinal and content.
     *
     * @param folder the folder path
     * @param oldName the current name
     * @param newName the new name
     * @return Mono containing the renamed node
     */
    public Mono<TreeNode> rename(String folder, String oldName, String newName) {
        return Mono.defer(() -> {
            String path = VfsPaths.normalize(folder);
            String source = VfsPaths.child(path, oldName);
            String target = VfsPaths.requireValidName(newName);
            return lockRegistry.withLocks(Set.of(path), () -> requireNode(source)
                .flatMap(node -> {
                    if (node.getName().equals(target)) {
                        return Mono.just(node);
                    }
                    return nodeStore.exists(VfsPaths.join(path, target))
                        .flatMap(exists -> Boolean.TRUE.equals(exists)
                            ? Mono.<TreeNode>error(new NodeAlreadyExistsException(VfsPaths.join(path, target)))
                            : nodeStore.renameNode(node.getPath(), target));
                }));
        })
        .doOnSuccess(node -> log.info("Renamed {} to {}", oldName, node.getPath()))
        .doOnError(error -> log.warn("Rename of {} in {} failed: {}", oldName, folder, error.getMessage()));
    }

    /**
     * Deletes several nodes of one folder, folders with their contents. Each item is attempted
     * and reported separately.
     *
     * @param folder the folder path
     * @param names the nodes to delete
     * @return Mono containing the per-item report
     */
    public Mono<DeleteResult> delete(String folder, List<String> names) {
        return Mono.defer(() -> {
            if (names == null || names.isEmpty()) {
                return Mono.error(new InvalidOperationException("No items to delete", folder));
            }
            names.forEach(VfsPaths::requireValidName);
            String path = VfsPaths.normalize(folder);
            DeleteResult.DeleteResultBuilder result = DeleteResult.builder().folder(path);
            return lockRegistry.withLocks(Set.of(path), () -> Flux.fromIterable(names)
                .concatMap(name -> nodeStore.deleteNode(VfsPaths.child(path, name), true)
                    .doOnSuccess(v -> result.deletedName(name))
                    .onErrorResume(error -> {
                        log.warn("Could not delete {} in {}: {}", name, path, error.getMessage());
                        result.error(name, error.getMessage());
                        return Mono.empty();
                    }))
                .then(Mono.fromSupplier(result::build)));
        })
        .doOnSuccess(result -> log.info("{} in {}", result.getMessage(), result.getFolder()));
    }

    /**
     * Replaces the content of a text file.
     *
     * @param folder the folder path
     * @param name the file name
     * @param content the new content
     * @return Mono containing the file node
     */
    public Mono<TreeNode> saveFile(String folder, String name, String content) {
        return Mono.defer(() -> {
            String path = VfsPaths.child(folder, name);
            return requireNode(path)
                .flatMap(node -> {
                    if (node.getKind() != NodeKind.TEXT) {
                        return Mono.error(new InvalidOperationException("Not a text file: " + path, path));
                    }
                    return contentPort.storeText(node.getId(), content == null ? "" : content).thenReturn(node);
                });
        })
        .doOnSuccess(node -> log.debug("Saved {}", node.getPath()));
    }

    /**
     * Reads the content of a text file.
     *
     * @param folder the folder path
     * @param name the file name
     * @return Mono containing the text, empty string if no content was stored
     */
    public Mono<String> readFile(String folder, String name) {
        return Mono.defer(() -> requireNode(VfsPaths.child(folder, name)))
            .flatMap(node -> contentPort.getText(node.getId()).defaultIfEmpty(""));
    }

    private Mono<TreeNode> create(String folder, String name, InsertPosition position, NodePayload payload,
                                  Function<TreeNode, Mono<Void>> contentWriter) {
        String path = VfsPaths.join(folder, name);
        return lockRegistry.withLocks(Set.of(folder), () -> requireNode(folder)
            .flatMap(parent -> {
                if (!parent.isFolder()) {
                    return Mono.error(new InvalidOperationException("Not a folder: " + folder, folder));
                }
                return nodeStore.exists(path)
                    .flatMap(exists -> Boolean.TRUE.equals(exists)
                        ? Mono.<TreeNode>error(new NodeAlreadyExistsException(path))
                        : ordinalAssigner.reserve(folder, position, 1)
                            .flatMap(ordinal -> nodeStore.createNode(TreeNode.builder()
                                .parentPath(folder)
                                .name(name)
                                .ordinal(ordinal)
                                .ownerId(parent.getOwnerId())
                                .publicNode(parent.getPublicNode())
                                .payload(payload)
                                .build())));
            })
            .flatMap(created -> contentWriter.apply(created).thenReturn(created))
            .flatMap(created -> verifier.verify(folder).thenReturn(created)));
    }

    private Mono<TreeNode> requireNode(String path) {
        return nodeStore.getNodeByPath(path)
            .switchIfEmpty(Mono.error(() -> new NodeNotFoundException(path)));
    }

    private String withDefaultExtension(String name) {
        return NodeTypes.hasExtension(name) ? name : name + "." + defaultExtension;
    }
}
