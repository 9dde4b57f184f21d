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
package com.firefly.core.vfs.transform;

import com.firefly.core.vfs.domain.model.node.NodeKind;
import com.firefly.core.vfs.domain.model.node.TextPayload;
import com.firefly.core.vfs.domain.model.node.TreeNode;
import com.firefly.core.vfs.domain.model.ordering.InsertPosition;
import com.firefly.core.vfs.domain.model.result.JoinResult;
import com.firefly.core.vfs.domain.model.result.SplitResult;
import com.firefly.core.vfs.exception.InvalidOperationException;
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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Join and split of text files, the two content operations that change sibling structure.
 *
 * <p><b>Join</b> concatenates two or more text files into the one with the lowest ordinal
 * and deletes the others. The survivor keeps its ordinal; the deleted files leave gaps.</p>
 *
 * <p><b>Split</b> divides one text file into consecutive siblings. The source keeps the first
 * part and its ordinal; the new parts take the slots directly after it, which are opened by
 * shifting the following siblings.</p>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
@Slf4j
public class StructuralTransformService {

    private final NodeStorePort nodeStore;
    private final NodeContentPort contentPort;
    private final OrdinalAssigner ordinalAssigner;
    private final FolderLockRegistry lockRegistry;
    private final OrdinalInvariantVerifier verifier;
    private final String joinSeparator;
    private final String splitDelimiter;

    public StructuralTransformService(NodeStorePort nodeStore,
                                      NodeContentPort contentPort,
                                      OrdinalAssigner ordinalAssigner,
                                      FolderLockRegistry lockRegistry,
                                      OrdinalInvariantVerifier verifier,
                                      String joinSeparator,
                                      String splitDelimiter) {
        this.nodeStore = nodeStore;
        this.contentPort = contentPort;
        this.ordinalAssigner = ordinalAssigner;
        this.lockRegistry = lockRegistry;
        this.verifier = verifier;
        this.joinSeparator = joinSeparator;
        this.splitDelimiter = splitDelimiter;
    }

    /**
     * Joins text files of one folder into the file with the lowest ordinal.
     *
     * @param folder the folder path
     * @param names the files to join, at least two
     * @return Mono containing the join report; deletion failures are reported, not raised
     */
    public Mono<JoinResult> join(String folder, List<String> names) {
        return Mono.defer(() -> {
            if (names == null || names.size() < 2) {
                return Mono.error(new InvalidOperationException("Join requires at least two files", folder));
            }
            if (new HashSet<>(names).size() != names.size()) {
                return Mono.error(new InvalidOperationException("Join list contains duplicate names", folder));
            }
            names.forEach(VfsPaths::requireValidName);
            String path = VfsPaths.normalize(folder);
            return lockRegistry.withLocks(Set.of(path), () -> joinUnlocked(path, names));
        })
        .doOnSuccess(result -> log.info("Joined {} file(s) into {}", result.getJoinedCount(), result.getSurvivor().getPath()))
        .doOnError(error -> log.warn("Join in {} failed: {}", folder, error.getMessage()));
    }

    /**
     * Splits a text file in two at a character offset.
     *
     * @param folder the folder path
     * @param name the file to split
     * @param offset the offset where the second part starts, strictly inside the content
     * @return Mono containing the split report
     */
    public Mono<SplitResult> split(String folder, String name, int offset) {
        String path = VfsPaths.normalize(folder);
        return lockRegistry.withLocks(Set.of(path), () -> requireTextFile(path, name)
                .flatMap(source -> contentPort.getText(source.getId())
                    .defaultIfEmpty("")
                    .flatMap(text -> {
                        if (offset <= 0 || offset >= text.length()) {
                            return Mono.error(new InvalidOperationException(
                                "Split offset " + offset + " is outside the content of " + source.getPath(),
                                source.getPath()));
                        }
                        return writeParts(path, source, List.of(text.substring(0, offset), text.substring(offset)));
                    })))
            .doOnSuccess(result -> log.info("Split {} into {} parts", result.getSource().getPath(), result.getPartCount()));
    }

    /**
     * Splits a text file on the configured delimiter ({@code "\n~\n"} by default).
     * Each part is trimmed. A file without the delimiter is left unchanged.
     *
     * @param folder the folder path
     * @param name the file to split
     * @return Mono containing the split report
     */
    public Mono<SplitResult> splitOnDelimiter(String folder, String name) {
        String path = VfsPaths.normalize(folder);
        return lockRegistry.withLocks(Set.of(path), () -> requireTextFile(path, name)
                .flatMap(source -> contentPort.getText(source.getId())
                    .defaultIfEmpty("")
                    .flatMap(text -> splitText(path, source, text))))
            .doOnSuccess(result -> log.info("Split {} into {} part(s)", result.getSource().getPath(), result.getPartCount()));
    }

    /**
     * Saves new content for a text file, splitting it on the configured delimiter.
     *
     * @param folder the folder path
     * @param name the file to save
     * @param content the new content
     * @return Mono containing the split report, a single part when the delimiter is absent
     */
    public Mono<SplitResult> saveAndSplit(String folder, String name, String content) {
        String path = VfsPaths.normalize(folder);
        return lockRegistry.withLocks(Set.of(path), () -> requireTextFile(path, name)
            .flatMap(source -> splitText(path, source, content == null ? "" : content)));
    }

    private Mono<SplitResult> splitText(String folder, TreeNode source, String text) {
        List<String> parts = Arrays.stream(text.split(Pattern.quote(splitDelimiter), -1))
            .map(String::trim)
            .collect(Collectors.toList());
        if (parts.size() < 2) {
            log.debug("No split delimiter in {}, saving unchanged", source.getPath());
            return contentPort.storeText(source.getId(), text)
                .thenReturn(SplitResult.builder().source(source).build());
        }
        return writeParts(folder, source, parts);
    }

    private Mono<SplitResult> writeParts(String folder, TreeNode source, List<String> parts) {
        int newParts = parts.size() - 1;
        return contentPort.storeText(source.getId(), parts.get(0))
            .then(ordinalAssigner.reserve(folder, InsertPosition.afterNode(source.getId()), newParts))
            .flatMap(insertOrdinal -> nodeStore.readChildren(folder)
                .map(TreeNode::getName)
                .collect(Collectors.toCollection(HashSet::new))
                .flatMap(usedNames -> Flux.range(1, newParts)
                    .concatMap(i -> createPart(folder, source, partName(source.getName(), usedNames),
                        insertOrdinal + i - 1, parts.get(i)))
                    .collectList()))
            .flatMap(created -> verifier.verify(folder)
                .then(nodeStore.getNode(source.getId()).defaultIfEmpty(source))
                .map(updated -> SplitResult.builder().source(updated).createdNodes(created).build()));
    }

    private Mono<TreeNode> createPart(String folder, TreeNode source, String name, int ordinal, String text) {
        String mimeType = source.getPayload() instanceof TextPayload
            ? ((TextPayload) source.getPayload()).getMimeType() : "text/plain";
        TreeNode part = TreeNode.builder()
            .parentPath(folder)
            .name(name)
            .ordinal(ordinal)
            .ownerId(source.getOwnerId())
            .publicNode(source.getPublicNode())
            .payload(TextPayload.builder()
                .mimeType(mimeType)
                .sizeBytes((long) text.getBytes(StandardCharsets.UTF_8).length)
                .build())
            .build();
        return nodeStore.createNode(part)
            .flatMap(created -> contentPort.storeText(created.getId(), text).thenReturn(created))
            .doOnSuccess(created -> log.debug("Created split part {} at ordinal {}", created.getPath(), ordinal));
    }

    private Mono<JoinResult> joinUnlocked(String folder, List<String> names) {
        return Flux.fromIterable(names)
            .concatMap(name -> requireTextFile(folder, name))
            .collectList()
            .flatMap(nodes -> {
                List<TreeNode> sorted = new ArrayList<>(nodes);
                sorted.sort(NodeStorePort.SIBLING_ORDER);
                TreeNode survivor = sorted.get(0);
                List<TreeNode> rest = sorted.subList(1, sorted.size());

                return Flux.fromIterable(sorted)
                    .concatMap(node -> contentPort.getText(node.getId()).defaultIfEmpty(""))
                    .collectList()
                    .flatMap(texts -> contentPort.storeText(survivor.getId(), String.join(joinSeparator, texts)))
                    .then(deleteJoined(rest, survivor, sorted.size()));
            });
    }

    private Mono<JoinResult> deleteJoined(List<TreeNode> rest, TreeNode survivor, int joinedCount) {
        JoinResult.JoinResultBuilder result = JoinResult.builder().joinedCount(joinedCount);
        return Flux.fromIterable(rest)
            .concatMap(node -> nodeStore.deleteNode(node.getPath(), false)
                .doOnSuccess(v -> result.deletedName(node.getName()))
                .onErrorResume(error -> {
                    log.warn("Could not delete {} after join: {}", node.getPath(), error.getMessage());
                    result.failedDelete(node.getName(), error.getMessage());
                    return Mono.empty();
                }))
            .then(nodeStore.getNode(survivor.getId()).defaultIfEmpty(survivor))
            .map(updated -> result.survivor(updated).build());
    }

    private Mono<TreeNode> requireTextFile(String folder, String name) {
        return Mono.fromCallable(() -> VfsPaths.child(folder, name))
            .flatMap(path -> nodeStore.getNodeByPath(path)
                .switchIfEmpty(Mono.error(() -> new NodeNotFoundException(path)))
                .flatMap(node -> node.getKind() == NodeKind.TEXT ? Mono.just(node)
                    : Mono.<TreeNode>error(new InvalidOperationException("Not a text file: " + path, path))));
    }

    /**
     * Picks {@code <stem>-<n><ext>} with the smallest {@code n} not used in the folder.
     */
    static String partName(String sourceName, Set<String> usedNames) {
        String extension = NodeTypes.extension(sourceName);
        String stem = extension.isEmpty() ? sourceName
            : sourceName.substring(0, sourceName.length() - extension.length() - 1);
        String suffix = sourceName.substring(stem.length());
        for (int n = 1; ; n++) {
            String candidate = stem + "-" + n + suffix;
            if (usedNames.add(candidate)) {
                return candidate;
            }
        }
    }
}
