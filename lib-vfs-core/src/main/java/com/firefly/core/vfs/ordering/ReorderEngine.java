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
import com.firefly.core.vfs.domain.model.ordering.MoveDirection;
import com.firefly.core.vfs.exception.InvalidOperationException;
import com.firefly.core.vfs.exception.NodeNotFoundException;
import com.firefly.core.vfs.port.node.NodeStorePort;
import com.firefly.core.vfs.support.VfsPaths;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rearranges the children of one folder without ever writing a duplicate ordinal.
 *
 * <p>A new permutation usually reuses the ordinals of the old one (reversing six items
 * reuses all six values), so writing final values directly would collide. The engine
 * writes in two phases instead:</p>
 * <ol>
 *   <li><b>Quarantine</b>: every child gets a distinct temporary ordinal counted up from
 *       the quarantine base (by default {@link Integer#MIN_VALUE}), a range no real
 *       ordinal uses.</li>
 *   <li><b>Commit</b>: children get {@code 0, 1, 2, ...} in their final order.</li>
 * </ol>
 * <p>Every write targets a value no other child holds at that moment.</p>
 *
 * <p>Children left out of a requested order keep their relative order and follow the
 * named ones, so the committed ordinals always cover the whole folder.</p>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
@Slf4j
public class ReorderEngine {

    private final NodeStorePort nodeStore;
    private final FolderLockRegistry lockRegistry;
    private final OrdinalInvariantVerifier verifier;
    private final int quarantineBase;

    public ReorderEngine(NodeStorePort nodeStore, FolderLockRegistry lockRegistry,
                         OrdinalInvariantVerifier verifier, int quarantineBase) {
        this.nodeStore = nodeStore;
        this.lockRegistry = lockRegistry;
        this.verifier = verifier;
        this.quarantineBase = quarantineBase;
    }

    /**
     * Reorders a folder so that its children appear in {@code desiredNameOrder}.
     *
     * @param folder the folder path
     * @param desiredNameOrder child names in their new order
     * @return Mono indicating completion
     */
    public Mono<Void> reorder(String folder, List<String> desiredNameOrder) {
        String path = VfsPaths.normalize(folder);
        return lockRegistry.withLocks(Set.of(path), () -> reorderUnlocked(path, desiredNameOrder))
            .doOnSuccess(v -> log.info("Reordered {} ({} named item(s))", path, desiredNameOrder.size()))
            .doOnError(error -> log.error("Failed to reorder {}", path, error));
    }

    /**
     * Moves one child a single step up or down by swapping it with its neighbour.
     *
     * @param folder the folder path
     * @param name the child to move
     * @param direction the direction
     * @return Mono indicating completion, error if the child is already first or last
     */
    public Mono<Void> moveUpOrDown(String folder, String name, MoveDirection direction) {
        String path = VfsPaths.normalize(folder);
        return lockRegistry.withLocks(Set.of(path), () -> swapWithNeighbour(path, name, direction))
            .doOnSuccess(v -> log.info("Moved {} {} in {}", name, direction, path))
            .doOnError(error -> log.warn("Failed to move {} {} in {}: {}", name, direction, path, error.getMessage()));
    }

    /**
     * Moves some children of a folder to a new position within the same folder, keeping the
     * order in which they are given.
     *
     * @param folder the folder path
     * @param names the children to move
     * @param position where to put them among the remaining children
     * @return Mono indicating completion
     */
    public Mono<Void> moveWithinFolder(String folder, List<String> names, InsertPosition position) {
        String path = VfsPaths.normalize(folder);
        return lockRegistry.withLocks(Set.of(path), () -> moveWithinFolderUnlocked(path, names, position))
            .doOnSuccess(v -> log.info("Moved {} item(s) {} in {}", names.size(), position, path));
    }

    Mono<Void> reorderUnlocked(String folder, List<String> desiredNameOrder) {
        Objects.requireNonNull(desiredNameOrder, "desiredNameOrder");
        Set<String> distinct = new HashSet<>(desiredNameOrder);
        if (distinct.size() != desiredNameOrder.size()) {
            return Mono.error(new InvalidOperationException("Reorder list contains duplicate names", folder));
        }
        return nodeStore.readChildren(folder)
            .collectList()
            .flatMap(children -> {
                Map<String, TreeNode> byName = indexByName(children);
                List<TreeNode> order = new ArrayList<>(children.size());
                for (String name : desiredNameOrder) {
                    TreeNode node = byName.remove(name);
                    if (node == null) {
                        return Mono.error(new NodeNotFoundException(VfsPaths.join(folder, name)));
                    }
                    order.add(node);
                }
                order.addAll(byName.values());
                return applyOrder(folder, order);
            });
    }

    Mono<Void> moveWithinFolderUnlocked(String folder, List<String> names, InsertPosition position) {
        Set<String> moving = new LinkedHashSet<>(names);
        if (moving.isEmpty() || moving.size() != names.size()) {
            return Mono.error(new InvalidOperationException("Move list must be non-empty and free of duplicates", folder));
        }
        return nodeStore.readChildren(folder)
            .collectList()
            .flatMap(children -> {
                Map<String, TreeNode> byName = indexByName(children);
                List<TreeNode> moved = new ArrayList<>();
                for (String name : moving) {
                    TreeNode node = byName.get(name);
                    if (node == null) {
                        return Mono.error(new NodeNotFoundException(VfsPaths.join(folder, name)));
                    }
                    moved.add(node);
                }
                List<TreeNode> remaining = children.stream()
                    .filter(child -> !moving.contains(child.getName()))
                    .collect(Collectors.toList());

                int index;
                try {
                    index = insertionIndex(folder, remaining, moving, position);
                } catch (RuntimeException e) {
                    return Mono.error(e);
                }
                List<TreeNode> order = new ArrayList<>(remaining);
                order.addAll(index, moved);
                return applyOrder(folder, order);
            });
    }

    /**
     * Writes the given order with the quarantine and commit phases.
     *
     * @param folder the folder path
     * @param order every child of the folder, in final order
     * @return Mono indicating completion
     */
    Mono<Void> applyOrder(String folder, List<TreeNode> order) {
        if (order.isEmpty() || isCommitted(order)) {
            log.debug("Order of {} already committed, nothing to write", folder);
            return Mono.empty();
        }
        Mono<Void> quarantine = Flux.range(0, order.size())
            .concatMap(i -> nodeStore.setOrdinal(order.get(i).getId(), quarantineBase + i))
            .then();
        Mono<Void> commit = Flux.range(0, order.size())
            .concatMap(i -> nodeStore.setOrdinal(order.get(i).getId(), i))
            .then();
        return quarantine
            .doOnSuccess(v -> log.debug("Quarantined {} node(s) in {}", order.size(), folder))
            .then(commit)
            .doOnSuccess(v -> log.debug("Committed {} ordinal(s) in {}", order.size(), folder))
            .then(verifier.verify(folder));
    }

    private Mono<Void> swapWithNeighbour(String folder, String name, MoveDirection direction) {
        return nodeStore.readChildren(folder)
            .collectList()
            .flatMap(children -> {
                int index = -1;
                for (int i = 0; i < children.size(); i++) {
                    if (children.get(i).getName().equals(name)) {
                        index = i;
                        break;
                    }
                }
                if (index < 0) {
                    return Mono.error(new NodeNotFoundException(VfsPaths.join(folder, name)));
                }
                int neighbourIndex = direction == MoveDirection.UP ? index - 1 : index + 1;
                if (neighbourIndex < 0) {
                    return Mono.error(new InvalidOperationException("Item is already at the top", VfsPaths.join(folder, name)));
                }
                if (neighbourIndex >= children.size()) {
                    return Mono.error(new InvalidOperationException("Item is already at the bottom", VfsPaths.join(folder, name)));
                }
                TreeNode item = children.get(index);
                TreeNode neighbour = children.get(neighbourIndex);
                // Park the item first so the neighbour can take its ordinal
                return nodeStore.setOrdinal(item.getId(), quarantineBase)
                    .then(nodeStore.setOrdinal(neighbour.getId(), item.getOrdinal()))
                    .then(nodeStore.setOrdinal(item.getId(), neighbour.getOrdinal()))
                    .then(verifier.verify(folder));
            });
    }

    private static int insertionIndex(String folder, List<TreeNode> remaining, Set<String> moving,
                                      InsertPosition position) {
        switch (position.getKind()) {
            case BEGINNING:
                return 0;
            case END:
                return remaining.size();
            case AFTER_ORDINAL:
                return (int) remaining.stream()
                    .filter(node -> node.getOrdinal() <= position.getAnchorOrdinal())
                    .count();
            case AFTER_NAME:
                if (moving.contains(position.getAnchorName())) {
                    throw new InvalidOperationException("Cannot insert items after one of themselves",
                        VfsPaths.join(folder, position.getAnchorName()));
                }
                for (int i = 0; i < remaining.size(); i++) {
                    if (remaining.get(i).getName().equals(position.getAnchorName())) {
                        return i + 1;
                    }
                }
                throw new NodeNotFoundException(VfsPaths.join(folder, position.getAnchorName()));
            case AFTER_NODE:
            default:
                for (int i = 0; i < remaining.size(); i++) {
                    if (remaining.get(i).getId().equals(position.getAnchorId())) {
                        return i + 1;
                    }
                }
                throw new NodeNotFoundException(position.getAnchorId().toString());
        }
    }

    private static Map<String, TreeNode> indexByName(List<TreeNode> children) {
        Map<String, TreeNode> byName = new LinkedHashMap<>();
        for (TreeNode child : children) {
            byName.put(child.getName(), child);
        }
        return byName;
    }

    private static boolean isCommitted(List<TreeNode> order) {
        for (int i = 0; i < order.size(); i++) {
            if (order.get(i).getOrdinal() != i) {
                return false;
            }
        }
        return true;
    }
}
