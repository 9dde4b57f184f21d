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
import com.firefly.core.vfs.exception.OrdinalConflictException;
import com.firefly.core.vfs.port.node.NodeStorePort;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Checks that no two children of a folder share an ordinal.
 */
@Slf4j
public class OrdinalInvariantVerifier {

    private final NodeStorePort nodeStore;
    private final boolean enabled;

    public OrdinalInvariantVerifier(NodeStorePort nodeStore, boolean enabled) {
        this.nodeStore = nodeStore;
        this.enabled = enabled;
    }

    /**
     * Re-reads a folder and fails with {@link OrdinalConflictException} on a duplicate ordinal.
     * Completes immediately when verification is disabled.
     *
     * @param folder the folder path
     * @return Mono indicating completion
     */
    public Mono<Void> verify(String folder) {
        if (!enabled) {
            return Mono.empty();
        }
        return nodeStore.readChildren(folder)
            .collectList()
            .flatMap(children -> {
                Optional<Integer> duplicate = findDuplicate(children);
                if (duplicate.isPresent()) {
                    log.error("Duplicate ordinal {} detected in folder {}", duplicate.get(), folder);
                    return Mono.<Void>error(new OrdinalConflictException(folder, duplicate.get()));
                }
                return Mono.<Void>empty();
            });
    }

    /**
     * Finds the first ordinal held by more than one node.
     *
     * @param siblings the children of one folder
     * @return the duplicated ordinal, empty when all ordinals are distinct
     */
    public static Optional<Integer> findDuplicate(Collection<TreeNode> siblings) {
        Set<Integer> seen = new HashSet<>();
        for (TreeNode sibling : siblings) {
            if (!seen.add(sibling.getOrdinal())) {
                return Optional.of(sibling.getOrdinal());
            }
        }
        return Optional.empty();
    }
}
