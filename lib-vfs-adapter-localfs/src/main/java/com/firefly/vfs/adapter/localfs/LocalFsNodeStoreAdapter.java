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
package com.firefly.vfs.adapter.localfs;

import com.firefly.core.vfs.adapter.AdapterFeature;
import com.firefly.core.vfs.adapter.VfsAdapter;
import com.firefly.core.vfs.domain.model.node.FolderPayload;
import com.firefly.core.vfs.domain.model.node.NodePayload;
import com.firefly.core.vfs.domain.model.node.TreeNode;
import com.firefly.core.vfs.exception.InvalidOperationException;
import com.firefly.core.vfs.exception.NodeAlreadyExistsException;
import com.firefly.core.vfs.exception.NodeNotFoundException;
import com.firefly.core.vfs.exception.VfsException;
import com.firefly.core.vfs.port.node.NodeContentPort;
import com.firefly.core.vfs.port.node.NodeStorePort;
import com.firefly.core.vfs.support.NodeTypes;
import com.firefly.core.vfs.support.OrdinalNameCodec;
import com.firefly.core.vfs.support.VfsPaths;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link NodeStorePort} and {@link NodeContentPort}.
 *
 * <p>Every file and directory below the configured root is a node. The ordinal is stored
 * as a {@code NNNN_} prefix of the entry name, so that a plain directory listing sorted by
 * name shows the tree in order:</p>
 * <pre>
 * root/
 *   0000_intro.md
 *   0001_chapters_/
 *     0000_one.md
 *   0002_appendix.md
 * </pre>
 *
 * <p>Entries without a prefix, typically copied in by hand, are adopted the first time
 * their folder is read: they are appended after the highest existing ordinal in name
 * order. Prefixes of a different width are rewritten to the canonical width. Names
 * starting with a dot are not part of the tree.</p>
 *
 * <p>Node ids are not persisted. They are handed out on first sight and tracked across
 * renames and moves made through this adapter.</p>
 *
 * <p>Calls refused with an access error are retried with the configured {@link Retry}.</p>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
@Slf4j
@VfsAdapter(
    type = "localfs",
    description = "Local filesystem node store with ordinal name prefixes",
    supportedFeatures = {
        AdapterFeature.NODE_CRUD,
        AdapterFeature.CONTENT_STORAGE,
        AdapterFeature.ORDINAL_UPDATES,
        AdapterFeature.SUBTREE_MOVE,
        AdapterFeature.NAME_PREFIX_ORDINALS,
        AdapterFeature.PERSISTENT_STORAGE
    }
)
public class LocalFsNodeStoreAdapter implements NodeStorePort, NodeContentPort {

    private final Path root;
    private final LocalFsAdapterProperties properties;
    private final OrdinalNameCodec codec;
    private final NodeTypes nodeTypes;
    private final Map<String, UUID> idsByPath = new HashMap<>();
    private final Map<UUID, String> pathsById = new HashMap<>();
    private final Retry retry;

    public LocalFsNodeStoreAdapter(LocalFsAdapterProperties properties, OrdinalNameCodec codec) {
        this(properties, codec, LocalFsAdapterAutoConfiguration.accessDeniedRetry(properties));
    }

    public LocalFsNodeStoreAdapter(LocalFsAdapterProperties properties, OrdinalNameCodec codec, Retry retry) {
        this.properties = properties;
        this.codec = codec;
        this.retry = retry;
        this.nodeTypes = new NodeTypes(new HashSet<>(properties.getTextExtensions()),
            new HashSet<>(properties.getImageExtensions()));
        this.root = Paths.get(properties.getRootPath()).toAbsolutePath().normalize();
        prepareRoot();
        idFor(VfsPaths.ROOT);
        log.info("LocalFsNodeStoreAdapter initialized with root: {}, prefix width: {}", root, codec.getWidth());
    }

    @Override
    public Mono<TreeNode> createNode(TreeNode node) {
        return io(node.getParentPath(), () -> doCreate(node))
            .doOnSuccess(created -> log.debug("Created {} at ordinal {}", created.getPath(), created.getOrdinal()));
    }

    @Override
    public Mono<TreeNode> getNode(UUID nodeId) {
        return io(String.valueOf(nodeId), () -> {
            synchronized (this) {
                String logical = pathsById.get(nodeId);
                if (logical == null) {
                    return null;
                }
                Path physical = locate(logical);
                if (physical == null) {
                    forget(logical);
                    return null;
                }
                return toNode(logical, physical);
            }
        });
    }

    @Override
    public Mono<TreeNode> getNodeByPath(String path) {
        return io(path, () -> {
            synchronized (this) {
                String logical = VfsPaths.normalize(path);
                Path physical = locate(logical);
                return physical == null ? null : toNode(logical, physical);
            }
        });
    }

    @Override
    public Flux<TreeNode> readChildren(String folderPath) {
        return io(folderPath, () -> {
            synchronized (this) {
                String folder = VfsPaths.normalize(folderPath);
                Path dir = requireFolder(folder);
                List<TreeNode> children = new ArrayList<>();
                for (Path entry : entries(dir)) {
                    children.add(toNode(VfsPaths.join(folder, logicalName(entry)), entry));
                }
                children.sort(SIBLING_ORDER);
                return children;
            }
        })
        .flatMapMany(Flux::fromIterable);
    }

    @Override
    public Mono<Void> setOrdinal(UUID nodeId, int ordinal) {
        return io(String.valueOf(nodeId), () -> {
            synchronized (this) {
                String logical = pathsById.get(nodeId);
                Path physical = logical == null ? null : locate(logical);
                if (physical == null) {
                    throw new NodeNotFoundException(String.valueOf(nodeId));
                }
                if (VfsPaths.ROOT.equals(logical)) {
                    throw new InvalidOperationException("The root folder has no ordinal", VfsPaths.ROOT);
                }
                Path renamed = physical.resolveSibling(codec.encode(ordinal, VfsPaths.name(logical)));
                if (!renamed.equals(physical)) {
                    Files.move(physical, renamed);
                    log.debug("Renamed {} to {}", physical.getFileName(), renamed.getFileName());
                }
                return Boolean.TRUE;
            }
        }).then();
    }

    @Override
    public Mono<TreeNode> moveNode(String sourcePath, String targetPath) {
        return io(sourcePath, () -> doMove(VfsPaths.normalize(sourcePath), VfsPaths.normalize(targetPath)))
            .doOnSuccess(moved -> log.debug("Moved {} to {}", sourcePath, moved.getPath()));
    }

    @Override
    public Mono<Void> deleteNode(String path, boolean recursive) {
        return io(path, () -> doDelete(VfsPaths.normalize(path), recursive)).then();
    }

    @Override
    public Mono<Void> storeContent(UUID nodeId, byte[] content, String mimeType) {
        return io(String.valueOf(nodeId), () -> {
            synchronized (this) {
                Path file = requireFile(nodeId);
                Files.write(file, content);
                return Boolean.TRUE;
            }
        }).then();
    }

    @Override
    public Mono<byte[]> getContent(UUID nodeId) {
        return io(String.valueOf(nodeId), () -> {
            synchronized (this) {
                String logical = pathsById.get(nodeId);
                Path file = logical == null ? null : locate(logical);
                if (file == null || Files.isDirectory(file)) {
                    return null;
                }
                return Files.readAllBytes(file);
            }
        });
    }

    @Override
    public Mono<Void> deleteContent(UUID nodeId) {
        return io(String.valueOf(nodeId), () -> {
            synchronized (this) {
                Files.write(requireFile(nodeId), new byte[0]);
                return Boolean.TRUE;
            }
        }).then();
    }

    @Override
    public String getAdapterName() {
        return "LocalFsNodeStoreAdapter";
    }

    /**
     * Returns the directory holding the tree.
     */
    public Path getRoot() {
        return root;
    }

    private synchronized TreeNode doCreate(TreeNode node) throws IOException {
        String parent = VfsPaths.normalize(node.getParentPath());
        Path dir = requireFolder(parent);
        String name = VfsPaths.requireValidName(node.getName());
        String logical = VfsPaths.join(parent, name);
        if (findEntry(dir, name).isPresent()) {
            throw new NodeAlreadyExistsException(logical);
        }
        Path target = dir.resolve(codec.encode(node.getOrdinal(), name));
        if (node.isFolder()) {
            Files.createDirectory(target);
        } else {
            Files.createFile(target);
        }
        if (node.getId() != null) {
            register(logical, node.getId());
        }
        return toNode(logical, target);
    }

    private synchronized TreeNode doMove(String source, String target) throws IOException {
        if (VfsPaths.ROOT.equals(source) || VfsPaths.ROOT.equals(target)) {
            throw new InvalidOperationException("The root folder cannot be moved", VfsPaths.ROOT);
        }
        Path physical = locate(source);
        if (physical == null) {
            throw new NodeNotFoundException(source);
        }
        if (source.equals(target)) {
            return toNode(source, physical);
        }
        String targetParent = VfsPaths.parent(target);
        String targetName = VfsPaths.requireValidName(VfsPaths.name(target));
        Path targetDir = requireFolder(targetParent);
        boolean folder = Files.isDirectory(physical);
        if (folder && VfsPaths.isSameOrDescendant(source, target)) {
            throw new InvalidOperationException("Cannot move a folder into itself: " + source, source);
        }
        if (findEntry(targetDir, targetName).isPresent()) {
            throw new NodeAlreadyExistsException(target);
        }
        int ordinal = codec.decode(physical.getFileName().toString())
            .map(OrdinalNameCodec.DecodedName::getOrdinal)
            .orElse(0);
        Path destination = targetDir.resolve(codec.encode(ordinal, targetName));
        Files.move(physical, destination);
        rekey(source, target);
        return toNode(target, destination);
    }

    private synchronized boolean doDelete(String path, boolean recursive) throws IOException {
        if (VfsPaths.ROOT.equals(path)) {
            throw new InvalidOperationException("The root folder cannot be deleted", VfsPaths.ROOT);
        }
        Path physical = locate(path);
        if (physical == null) {
            throw new NodeNotFoundException(path);
        }
        if (Files.isDirectory(physical)) {
            if (!recursive && !entries(physical).isEmpty()) {
                throw new InvalidOperationException("Folder is not empty: " + path, path);
            }
            try (Stream<Path> walk = Files.walk(physical)) {
                for (Path doomed : walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList())) {
                    Files.delete(doomed);
                }
            }
        } else {
            Files.delete(physical);
        }
        forget(path);
        log.debug("Deleted {}", path);
        return true;
    }

    /**
     * Resolves a logical path to its entry on disk, adopting unprefixed entries on the way.
     */
    private Path locate(String logical) throws IOException {
        if (VfsPaths.ROOT.equals(logical)) {
            return root;
        }
        Path current = root;
        for (String segment : logical.substring(1).split("/")) {
            if (!Files.isDirectory(current)) {
                return null;
            }
            Optional<Path> next = findEntry(current, segment);
            if (next.isEmpty()) {
                return null;
            }
            current = next.get();
        }
        return current;
    }

    private Optional<Path> findEntry(Path dir, String name) throws IOException {
        return entries(dir).stream()
            .filter(entry -> name.equals(logicalName(entry)))
            .findFirst();
    }

    /**
     * Lists the visible entries of a directory after bringing their names into canonical form.
     */
    private List<Path> entries(Path dir) throws IOException {
        List<Path> listed;
        try (Stream<Path> stream = Files.list(dir)) {
            listed = stream
                .filter(entry -> !entry.getFileName().toString().startsWith("."))
                .sorted(Comparator.comparing(entry -> entry.getFileName().toString()))
                .collect(Collectors.toList());
        }
        List<Path> result = new ArrayList<>();
        List<Path> unprefixed = new ArrayList<>();
        int max = -1;
        for (Path entry : listed) {
            String fileName = entry.getFileName().toString();
            Optional<OrdinalNameCodec.DecodedName> decoded = codec.decode(fileName);
            if (decoded.isEmpty()) {
                unprefixed.add(entry);
                continue;
            }
            max = Math.max(max, decoded.get().getOrdinal());
            String canonical = codec.normalize(fileName);
            if (!canonical.equals(fileName) && !Files.exists(entry.resolveSibling(canonical))) {
                Path renamed = Files.move(entry, entry.resolveSibling(canonical));
                log.info("Normalized ordinal prefix {} to {}", fileName, canonical);
                result.add(renamed);
            } else {
                result.add(entry);
            }
        }
        for (Path entry : unprefixed) {
            max = Math.addExact(max, 1);
            Path renamed = Files.move(entry, entry.resolveSibling(codec.encode(max, entry.getFileName().toString())));
            log.info("Adopted unprefixed entry {} at ordinal {}", entry.getFileName(), max);
            result.add(renamed);
        }
        return result;
    }

    private String logicalName(Path entry) {
        String fileName = entry.getFileName().toString();
        return codec.decode(fileName)
            .map(OrdinalNameCodec.DecodedName::getName)
            .orElse(fileName);
    }

    private Path requireFolder(String logical) throws IOException {
        Path dir = locate(logical);
        if (dir == null) {
            throw new NodeNotFoundException(logical);
        }
        if (!Files.isDirectory(dir)) {
            throw new InvalidOperationException("Not a folder: " + logical, logical);
        }
        return dir;
    }

    private Path requireFile(UUID nodeId) throws IOException {
        String logical = pathsById.get(nodeId);
        Path file = logical == null ? null : locate(logical);
        if (file == null) {
            throw new NodeNotFoundException(String.valueOf(nodeId));
        }
        if (Files.isDirectory(file)) {
            throw new InvalidOperationException("Folders have no content: " + logical, logical);
        }
        return file;
    }

    private TreeNode toNode(String logical, Path physical) throws IOException {
        BasicFileAttributes attributes = Files.readAttributes(physical, BasicFileAttributes.class);
        boolean isRoot = VfsPaths.ROOT.equals(logical);
        String name = isRoot ? "" : VfsPaths.name(logical);
        int ordinal = isRoot ? 0 : codec.decode(physical.getFileName().toString())
            .map(OrdinalNameCodec.DecodedName::getOrdinal)
            .orElse(0);
        NodePayload payload = attributes.isDirectory()
            ? FolderPayload.builder().hasChildren(!entries(physical).isEmpty()).build()
            : nodeTypes.payloadFor(name, attributes.size());
        return TreeNode.builder()
            .id(idFor(logical))
            .name(name)
            .parentPath(VfsPaths.parent(logical))
            .ordinal(ordinal)
            .ownerId(properties.getDefaultOwnerId())
            .publicNode(properties.getPublicNodes())
            .createdAt(attributes.creationTime().toInstant())
            .modifiedAt(attributes.lastModifiedTime().toInstant())
            .payload(payload)
            .build();
    }

    private UUID idFor(String logical) {
        UUID id = idsByPath.get(logical);
        if (id == null) {
            id = UUID.randomUUID();
            register(logical, id);
        }
        return id;
    }

    private void register(String logical, UUID id) {
        String previous = pathsById.put(id, logical);
        if (previous != null && !previous.equals(logical)) {
            idsByPath.remove(previous);
        }
        idsByPath.put(logical, id);
    }

    private void rekey(String from, String to) {
        Map<String, UUID> moved = new HashMap<>();
        idsByPath.entrySet().removeIf(entry -> {
            if (VfsPaths.isSameOrDescendant(from, entry.getKey())) {
                moved.put(VfsPaths.rebase(entry.getKey(), from, to), entry.getValue());
                return true;
            }
            return false;
        });
        moved.forEach(this::register);
    }

    private void forget(String logical) {
        idsByPath.entrySet().removeIf(entry -> {
            if (VfsPaths.isSameOrDescendant(logical, entry.getKey())) {
                pathsById.remove(entry.getValue());
                return true;
            }
            return false;
        });
    }

    private void prepareRoot() {
        if (Files.isDirectory(root)) {
            return;
        }
        if (!Boolean.TRUE.equals(properties.getCreateRoot())) {
            throw new IllegalStateException("Local filesystem root does not exist: " + root);
        }
        try {
            Files.createDirectories(root);
            log.info("Created local filesystem root {}", root);
        } catch (IOException e) {
            log.error("Failed to create local filesystem root {}", root, e);
            throw new IllegalStateException("Cannot create local filesystem root: " + root, e);
        }
    }

    private <T> Mono<T> io(String subject, Callable<T> operation) {
        return Mono.fromCallable(operation)
            .transformDeferred(RetryOperator.of(retry))
            .onErrorMap(IOException.class, e -> {
                log.error("Filesystem operation on {} failed", subject, e);
                return new VfsException("Filesystem operation failed: " + e.getMessage(), subject, e);
            });
    }
}
