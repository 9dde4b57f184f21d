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
import com.firefly.core.vfs.exception.InvalidOperationException;
import com.firefly.core.vfs.exception.NodeNotFoundException;
import com.firefly.core.vfs.port.node.NodeStorePort;
import com.firefly.core.vfs.support.VfsPaths;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Resolves an {@link InsertPosition} to a concrete insert ordinal and reserves slots there.
 *
 * <p>Resolution rules:</p>
 * <ul>
 *   <li>after sibling X: {@code X.ordinal + 1}</li>
 *   <li>after ordinal t: {@code t + 1}</li>
 *   <li>at end: {@code max + 1}, or {@code 0} for an empty folder</li>
 *   <li>at beginning: {@code 0}</li>
 * </ul>
 *
 * <p>Like {@link RangeShifter}, the assigner does not lock; callers hold the folder.</p>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
@Slf4j
public class OrdinalAssigner {

    private final NodeStorePort nodeStore;
    private final RangeShifter rangeShifter;

    public OrdinalAssigner(NodeStorePort nodeStore, RangeShifter rangeShifter) {
        this.nodeStore = nodeStore;
        this.rangeShifter = rangeShifter;
    }

    /**
     * Resolves where new nodes would be inserted, without changing the folder.
     *
     * @param folder the folder path
     * @param position the requested position
     * @return Mono containing the insert ordinal, error if an anchor sibling does not exist
     */
    public Mono<Integer> resolveInsertOrdinal(String folder, InsertPosition position) {
        Objects.requireNonNull(position, "position");
        switch (position.getKind()) {
            case BEGINNING:
                return Mono.just(0);
            case AFTER_ORDINAL:
                return Mono.fromCallable(() -> Math.addExact(position.getAnchorOrdinal(), 1));
            case AFTER_NAME:
                return Mono.fromCallable(() -> VfsPaths.child(folder, position.getAnchorName()))
                    .flatMap(anchorPath -> nodeStore.getNodeByPath(anchorPath)
                        .switchIfEmpty(Mono.error(() -> new NodeNotFoundException(anchorPath))))
                    .map(anchor -> Math.addExact(anchor.getOrdinal(), 1));
            case AFTER_NODE:
                return nodeStore.getNode(position.getAnchorId())
                    .switchIfEmpty(Mono.error(() -> new NodeNotFoundException(position.getAnchorId().toString())))
                    .flatMap(anchor -> requireInFolder(anchor, folder))
                    .map(anchor -> Math.addExact(anchor.getOrdinal(), 1));
            case END:
            default:
                return nodeStore.getMaxOrdinal(folder)
                    .map(max -> Math.addExact(max, 1))
                    .defaultIfEmpty(0);
        }
    }

    /**
     * Resolves the insert ordinal and shifts the folder so that {@code count} consecutive
     * slots starting there are free.
     *
     * @param folder the folder path
     * @param position the requested position
     * @param count number of slots to reserve
     * @param excluded ids of children that must not be shifted
     * @return Mono containing the first reserved ordinal
     */
    public Mono<Integer> reserve(String folder, InsertPosition position, int count, Set<UUID> excluded) {
        if (count < 0) {
            return Mono.error(new InvalidOperationException("Cannot reserve " + count + " slots", folder));
        }
        return resolveInsertOrdinal(folder, position)
            .flatMap(insertOrdinal -> {
                if (count == 0) {
                    return Mono.just(insertOrdinal);
                }
                return rangeShifter.shiftOrdinalsDown(folder, insertOrdinal, count, excluded)
                    .thenReturn(insertOrdinal);
            })
            .doOnSuccess(insertOrdinal -> log.debug("Reserved {} slot(s) in {} at ordinal {} ({})",
                    count, folder, insertOrdinal, position));
    }

    /**
     * Resolves the insert ordinal and shifts the folder to make room for {@code count} nodes.
     */
    public Mono<Integer> reserve(String folder, InsertPosition position, int count) {
        return reserve(folder, position, count, Collections.emptySet());
    }

    /**
     * Final ordinals for {@code count} nodes placed from {@code insertOrdinal} on.
     *
     * @param insertOrdinal the first ordinal
     * @param count the number of nodes
     * @return the ordinals {@code insertOrdinal + i}
     */
    public static List<Integer> consecutive(int insertOrdinal, int count) {
        return IntStream.range(0, count)
            .mapToObj(i -> insertOrdinal + i)
            .collect(Collectors.toList());
    }

    private static Mono<TreeNode> requireInFolder(TreeNode anchor, String folder) {
        if (!VfsPaths.normalize(folder).equals(anchor.getParentPath())) {
            return Mono.error(new InvalidOperationException(
                "Anchor " + anchor.getPath() + " is not a child of " + folder, anchor.getPath()));
        }
        return Mono.just(anchor);
    }
}
