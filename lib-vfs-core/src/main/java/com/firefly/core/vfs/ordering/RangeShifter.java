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
import com.firefly.core.vfs.exception.InvalidOperationException;
import com.firefly.core.vfs.port.node.NodeStorePort;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.Comparator;
import java.util.Set;
import java.util.UUID;

/**
 * Opens a gap in a folder's ordinal sequence.
 *
 * <p>{@code shiftOrdinalsDown(folder, t, k)} adds {@code k} to the ordinal of every child
 * whose ordinal is at least {@code t}; children below {@code t} are untouched. Afterwards
 * the range {@code [t, t + k)} is free and the shifted children keep their relative order.
 * Updates are written highest ordinal first, so each write lands on a value no other
 * child holds and the folder never contains a duplicate between two writes.</p>
 *
 * <p>The shifter does not lock the folder; it is a building block for operations that
 * already hold it. A store failure part way through leaves the folder with a partial
 * shift, which is surfaced as the error of the returned Mono.</p>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
@Slf4j
public class RangeShifter {

    private final NodeStorePort nodeStore;

    public RangeShifter(NodeStorePort nodeStore) {
        this.nodeStore = nodeStore;
    }

    /**
     * Shifts every child at or above {@code thresholdOrdinal} by {@code shiftAmount}.
     *
     * @param folder the folder path
     * @param thresholdOrdinal first ordinal to vacate, may be negative
     * @param shiftAmount number of slots to open, must be positive
     * @return Mono containing the number of shifted children
     */
    public Mono<Integer> shiftOrdinalsDown(String folder, int thresholdOrdinal, int shiftAmount) {
        return shiftOrdinalsDown(folder, thresholdOrdinal, shiftAmount, Collections.emptySet());
    }

    /**
     * Shifts every child at or above {@code thresholdOrdinal} by {@code shiftAmount}, leaving
     * the children in {@code excluded} where they are.
     *
     * <p>Excluded children must not hold an ordinal that a shifted child can land on; callers
     * move them out of the way first (the paste orchestrator quarantines them).</p>
     *
     * @param folder the folder path
     * @param thresholdOrdinal first ordinal to vacate, may be negative
     * @param shiftAmount number of slots to open, must be positive
     * @param excluded ids of children to leave untouched
     * @return Mono containing the number of shifted children
     */
    public Mono<Integer> shiftOrdinalsDown(String folder, int thresholdOrdinal, int shiftAmount, Set<UUID> excluded) {
        if (shiftAmount <= 0) {
            return Mono.error(new InvalidOperationException(
                "Shift amount must be positive, got " + shiftAmount, folder));
        }
        return nodeStore.readChildren(folder)
            .filter(child -> child.getOrdinal() >= thresholdOrdinal && !excluded.contains(child.getId()))
            .sort(Comparator.comparingInt(TreeNode::getOrdinal).reversed())
            .concatMap(child -> {
                int shifted = Math.addExact(child.getOrdinal(), shiftAmount);
                log.debug("Shifting {} in {} from {} to {}", child.getName(), folder, child.getOrdinal(), shifted);
                return nodeStore.setOrdinal(child.getId(), shifted).thenReturn(child);
            })
            .count()
            .map(Long::intValue)
            .doOnSuccess(count -> log.debug("Shifted {} node(s) in {} from ordinal {} by {}",
                    count, folder, thresholdOrdinal, shiftAmount))
            .doOnError(error -> log.error("Failed to shift ordinals in {} from {} by {}",
                    folder, thresholdOrdinal, shiftAmount, error));
    }
}
