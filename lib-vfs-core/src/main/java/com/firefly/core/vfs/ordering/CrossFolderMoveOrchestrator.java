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
package com.firefly.core.vfs.ordering;

import com.firefly.core.vfs.domain.model.node.TreeNode;
import com.firefly.core.vfs.domain.model.ordering.InsertPosition;
import com.firefly.core.vfs.domain.model.ordering.PasteItemResult;
import com.firefly.core.vfs.domain.model.ordering.PasteResult;
import com.firefly.core.vfs.exception.InvalidOperationException;
import com.firefly.core.vfs.exception.NodeAlreadyExistsException;
import com.firefly.core.vfs.exception.NodeNotFoundException;
import com.firefly.core.vfs.exception.OrdinalConflictException;
import com.firefly.core.vfs.exception.VfsException;
import com.firefly.core.vfs.port.node.NodeStorePort;
import com.firefly.core.vfs.support.VfsPaths;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Moves nodes, whole subtrees included, into a target folder at a chosen position.
 *
 * <p>For {@code k} items pasted at insert ordinal {@code p}:</p>
 * <ol>
 *   <li>the target folder is shifted by {@code k} from {@code p}, opening {@code [p, p + k)};</li>
 *   <li>each item in turn is parked on a quarantine ordinal, relocated by the store and
 *       given its final ordinal {@code p + i}.</li>
 * </ol>
 * <p>Parking the item before the move keeps it from arriving in the target with an ordinal
 * a target child already holds. Source folders are not renumbered; the gaps they are left
 * with are allowed.</p>
 *
 * <p>Pastes are best-effort rather than transactional. Items are processed strictly in
 * order and a failing item does not stop the rest: the {@link PasteResult} lists every
 * item with its outcome and the slot reserved for it, and {@link #retryFailed(PasteResult)}
 * places failed items into those slots without shifting again. When every item already
 * lives in the target folder the paste becomes a same-folder reorder.</p>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 * @see ReorderEngine
 */
@Slf4j
public class CrossFolderMoveOrchestrator {

    private final NodeStorePort nodeStore;
    private final OrdinalAssigner ordinalAssigner;
    private final RangeShifter rangeShifter;
    private final ReorderEngine reorderEngine;
    private final FolderLockRegistry lockRegistry;
    private final OrdinalInvariantVerifier verifier;
    private final int quarantineBase;

    public CrossFolderMoveOrchestrator(NodeStorePort nodeStore,
                                       OrdinalAssigner ordinalAssigner,
                                       RangeShifter rangeShifter,
                                       ReorderEngine reorderEngine,
                                       FolderLockRegistry lockRegistry,
                                       OrdinalInvariantVerifier verifier,
                                       int quarantineBase) {
        this.nodeStore = nodeStore;
        this.ordinalAssigner = ordinalAssigner;
        this.rangeShifter = rangeShifter;
        this.reorderEngine = reorderEngine;
        this.lockRegistry = lockRegistry;
        this.verifier = verifier;
        this.quarantineBase = quarantineBase;
    }

    /**
     * Pastes the given nodes into {@code targetFolder}, in the given order, at {@code position}.
     *
     * @param sourcePaths paths of the nodes to move, in their desired final order
     * @param targetFolder the destination folder
     * @param position where to insert the nodes among the target's children
     * @return Mono containing the per-item report; fails without any change when the input
     *         is invalid or the target folder does not exist
     */
    public Mono<PasteResult> paste(List<String> sourcePaths, String targetFolder, InsertPosition position) {
        return Mono.defer(() -> {
            List<String> sources = validateSources(sourcePaths);
            String target = VfsPaths.normalize(targetFolder);
            Objects.requireNonNull(position, "position");
            Set<String> folders = foldersOf(sources, target);

            log.info("Pasting {} item(s) into {} {}", sources.size(), target, position);
            return lockRegistry.withLocks(folders, () -> pasteUnlocked(sources, target, position));
        })
        .doOnSuccess(result -> log.info("{} into {}", result.getMessage(), result.getTargetFolder()))
        .doOnError(error -> log.error("Paste into {} failed: {}", targetFolder, error.getMessage()));
    }

    /**
     * Moves a single node and fails instead of reporting.
     *
     * @param sourcePath path of the node to move
     * @param targetFolder the destination folder
     * @param position where to insert the node
     * @return Mono containing the relocated node
     */
    public Mono<TreeNode> moveNode(String sourcePath, String targetFolder, InsertPosition position) {
        return paste(List.of(sourcePath), targetFolder, position)
            .flatMap(result -> {
                PasteItemResult item = result.getItems().get(0);
                if (!item.isSuccess()) {
                    Throwable cause = item.getError() != null ? item.getError()
                        : new VfsException(item.getErrorMessage(), item.getSourcePath());
                    return Mono.error(cause);
                }
                return nodeStore.getNodeByPath(item.getTargetPath())
                    .switchIfEmpty(Mono.error(() -> new NodeNotFoundException(item.getTargetPath())));
            });
    }

    /**
     * Retries the failed items of an earlier paste, placing each into the slot that was
     * reserved for it. The target folder is not shifted again.
     *
     * @param previous the report of the earlier paste
     * @return Mono containing the merged report; items whose reserved slot has been taken
     *         in the meantime fail with {@link OrdinalConflictException}
     */
    public Mono<PasteResult> retryFailed(PasteResult previous) {
        List<PasteItemResult> failed = previous.getFailedItems();
        if (failed.isEmpty()) {
            return Mono.just(previous);
        }
        String target = previous.getTargetFolder();
        Set<String> folders = foldersOf(failed.stream().map(PasteItemResult::getSourcePath)
            .collect(Collectors.toList()), target);

        log.info("Retrying {} failed item(s) of paste into {}", failed.size(), target);
        return lockRegistry.withLocks(folders, () -> nodeStore.readChildren(target)
                .collectList()
                .flatMap(children -> Flux.range(0, previous.getItems().size())
                    .concatMap(i -> {
                        PasteItemResult item = previous.getItems().get(i);
                        if (item.isSuccess()) {
                            return Mono.just(item);
                        }
                        Optional<TreeNode> occupant = children.stream()
                            .filter(child -> child.getOrdinal() == item.getReservedOrdinal())
                            .filter(child -> !child.getPath().equals(item.getSourcePath()))
                            .findFirst();
                        if (occupant.isPresent()) {
                            OrdinalConflictException conflict = new OrdinalConflictException(
                                "Reserved ordinal " + item.getReservedOrdinal() + " is now held by "
                                    + occupant.get().getName(), target, item.getReservedOrdinal());
                            return Mono.just(PasteItemResult.failed(item.getSourcePath(), item.getTargetPath(),
                                item.getNodeId(), item.getReservedOrdinal(), conflict));
                        }
                        return pasteOne(i, item.getSourcePath(), target, item.getReservedOrdinal());
                    })
                    .collectList())
                .flatMap(items -> verifier.verify(target)
                    .thenReturn(previous.toBuilder().clearItems().items(items).build())))
            .doOnSuccess(result -> log.info("Retry: {} into {}", result.getMessage(), target));
    }

    private Mono<PasteResult> pasteUnlocked(List<String> sources, String target, InsertPosition position) {
        return requireFolder(target).then(Mono.defer(() -> {
            boolean allInTarget = sources.stream().allMatch(source -> target.equals(VfsPaths.parent(source)));
            if (allInTarget) {
                return pasteWithinTarget(sources, target, position);
            }
            return pasteAcross(sources, target, position);
        }));
    }

    private Mono<PasteResult> pasteWithinTarget(List<String> sources, String target, InsertPosition position) {
        List<String> names = sources.stream().map(VfsPaths::name).collect(Collectors.toList());
        return reorderEngine.moveWithinFolderUnlocked(target, names, position)
            .then(nodeStore.readChildren(target).collectMap(TreeNode::getName, Function.identity()))
            .map(byName -> {
                List<PasteItemResult> items = new ArrayList<>();
                for (String source : sources) {
                    TreeNode node = byName.get(VfsPaths.name(source));
                    items.add(PasteItemResult.pasted(source, source, node.getId(), node.getOrdinal()));
                }
                return PasteResult.builder()
                    .targetFolder(target)
                    .insertOrdinal(items.get(0).getReservedOrdinal())
                    .items(items)
                    .build();
            });
    }

    private Mono<PasteResult> pasteAcross(List<String> sources, String target, InsertPosition position) {
        if (position.getKind() == InsertPosition.Kind.AFTER_NAME
                && sources.contains(VfsPaths.join(target, position.getAnchorName()))) {
            return Mono.error(new InvalidOperationException(
                "Cannot paste items after one of themselves", VfsPaths.join(target, position.getAnchorName())));
        }
        int count = sources.size();

        return ordinalAssigner.resolveInsertOrdinal(target, position)
            .flatMap(insertOrdinal -> quarantineItemsInTarget(sources, target)
                .flatMap(parked -> rangeShifter.shiftOrdinalsDown(target, insertOrdinal, count, parked))
                .then(Flux.range(0, count)
                    .concatMap(i -> pasteOne(i, sources.get(i), target, insertOrdinal + i))
                    .collectList())
                .flatMap(items -> verifier.verify(target).thenReturn(PasteResult.builder()
                    .targetFolder(target)
                    .insertOrdinal(insertOrdinal)
                    .items(items)
                    .build())));
    }

    /**
     * Parks the items that already live in the target folder so the shift can pass over them.
     *
     * @return Mono containing the ids of the parked nodes
     */
    private Mono<Set<UUID>> quarantineItemsInTarget(List<String> sources, String target) {
        return Flux.range(0, sources.size())
            .filter(i -> target.equals(VfsPaths.parent(sources.get(i))))
            .concatMap(i -> nodeStore.getNodeByPath(sources.get(i))
                .flatMap(node -> nodeStore.setOrdinal(node.getId(), quarantineBase + i).thenReturn(node.getId())))
            .collect(Collectors.toSet());
    }

    /**
     * Places one item at its final ordinal in the target folder, reporting instead of failing.
     */
    private Mono<PasteItemResult> pasteOne(int index, String source, String target, int finalOrdinal) {
        String targetPath = VfsPaths.join(target, VfsPaths.name(source));
        return nodeStore.getNodeByPath(source)
            .switchIfEmpty(Mono.error(() -> new NodeNotFoundException(source)))
            .flatMap(node -> placeNode(index, node, target, targetPath, finalOrdinal)
                .map(moved -> PasteItemResult.pasted(source, targetPath, moved.getId(), finalOrdinal))
                .onErrorResume(error -> Mono.just(itemFailed(source, targetPath, node.getId(), finalOrdinal, error))))
            .onErrorResume(error -> Mono.just(itemFailed(source, targetPath, null, finalOrdinal, error)));
    }

    private Mono<TreeNode> placeNode(int index, TreeNode node, String target, String targetPath, int finalOrdinal) {
        if (target.equals(node.getParentPath())) {
            return nodeStore.setOrdinal(node.getId(), finalOrdinal)
                .then(Mono.fromSupplier(() -> node.toBuilder().ordinal(finalOrdinal).build()));
        }
        if (node.isFolder() && VfsPaths.isSameOrDescendant(node.getPath(), target)) {
            return Mono.error(new InvalidOperationException(
                "Cannot move a folder into itself or one of its subfolders", node.getPath()));
        }
        return nodeStore.exists(targetPath)
            .flatMap(exists -> {
                if (Boolean.TRUE.equals(exists)) {
                    return Mono.error(new NodeAlreadyExistsException(targetPath));
                }
                return relocate(node, targetPath, quarantineBase + index, finalOrdinal);
            });
    }

    private Mono<TreeNode> relocate(TreeNode node, String targetPath, int parkingOrdinal, int finalOrdinal) {
        return nodeStore.setOrdinal(node.getId(), parkingOrdinal)
            .then(nodeStore.moveNode(node.getPath(), targetPath)
                .onErrorResume(error -> restoreOrdinal(node)
                    .onErrorResume(restoreError -> {
                        log.error("Could not restore ordinal {} of {} after failed move",
                                node.getOrdinal(), node.getPath(), restoreError);
                        error.addSuppressed(restoreError);
                        return Mono.empty();
                    })
                    .then(Mono.<TreeNode>error(error))))
            .flatMap(moved -> nodeStore.setOrdinal(moved.getId(), finalOrdinal)
                .thenReturn(moved.toBuilder().ordinal(finalOrdinal).build()))
            .doOnSuccess(moved -> log.debug("Moved {} to {} at ordinal {}", node.getPath(), targetPath, finalOrdinal));
    }

    private Mono<Void> restoreOrdinal(TreeNode node) {
        return nodeStore.setOrdinal(node.getId(), node.getOrdinal());
    }

    private Mono<TreeNode> requireFolder(String path) {
        return nodeStore.getNodeByPath(path)
            .switchIfEmpty(Mono.error(() -> new NodeNotFoundException("Target folder not found: " + path, path)))
            .flatMap(node -> node.isFolder() ? Mono.just(node)
                : Mono.<TreeNode>error(new InvalidOperationException("Target is not a folder: " + path, path)));
    }

    private static PasteItemResult itemFailed(String source, String targetPath, UUID nodeId, int ordinal, Throwable error) {
        log.warn("Failed to paste {} into slot {}: {}", source, ordinal, error.getMessage());
        return PasteItemResult.failed(source, targetPath, nodeId, ordinal, error);
    }

    private static List<String> validateSources(List<String> sourcePaths) {
        if (sourcePaths == null || sourcePaths.isEmpty()) {
            throw new InvalidOperationException("No items to paste");
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String sourcePath : sourcePaths) {
            String normalized = VfsPaths.normalize(sourcePath);
            if (VfsPaths.ROOT.equals(normalized)) {
                throw new InvalidOperationException("The root folder cannot be moved", normalized);
            }
            if (!unique.add(normalized)) {
                throw new InvalidOperationException("Item listed twice: " + normalized, normalized);
            }
        }
        return new ArrayList<>(unique);
    }

    private static Set<String> foldersOf(List<String> sources, String target) {
        Set<String> folders = new TreeSet<>();
        folders.add(target);
        for (String source : sources) {
            folders.add(VfsPaths.parent(source));
        }
        return folders;
    }
}
