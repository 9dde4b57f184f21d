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

import com.firefly.core.vfs.domain.model.node.FolderPayload;
import com.firefly.core.vfs.domain.model.node.TreeNode;
import com.firefly.core.vfs.port.node.NodeStorePort;
import com.firefly.core.vfs.support.VfsPaths;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Renders folder listings for viewers, including the pullup convention.
 *
 * <p>A folder whose name ends with the pullup suffix ({@code _} by default) is transparent
 * when pullup rendering is on: viewers show its children inline, each in the position given
 * by its own ordinal, instead of the folder itself. {@link #render(String, boolean)} attaches
 * those children to the folder node; {@link #renderInline(String)} returns the flattened
 * sequence a viewer displays, in which an empty pullup folder contributes nothing.</p>
 */
@Slf4j
public class TreeRenderService {

    private final NodeStorePort nodeStore;
    private final String pullupSuffix;
    private final boolean skipHidden;

    public TreeRenderService(NodeStorePort nodeStore, String pullupSuffix, boolean skipHidden) {
        this.nodeStore = nodeStore;
        this.pullupSuffix = pullupSuffix;
        this.skipHidden = skipHidden;
    }

    /**
     * Lists the children of a folder in ordinal order.
     *
     * @param folder the folder path
     * @param pullup whether pullup folders get their children attached, recursively
     * @return Flux of child nodes
     */
    public Flux<TreeNode> render(String folder, boolean pullup) {
        String path = VfsPaths.normalize(folder);
        return renderLevel(path, pullup)
            .doOnError(error -> log.error("Failed to render {}", path, error));
    }

    /**
     * Lists what a viewer displays for a folder: pullup folders are replaced by their
     * children, recursively.
     *
     * @param folder the folder path
     * @return Flux of displayed nodes in display order
     */
    public Flux<TreeNode> renderInline(String folder) {
        return render(folder, true).concatMap(this::flatten);
    }

    public boolean isPullupFolder(TreeNode node) {
        String name = node.getName();
        return node.isFolder() && name != null
            && name.endsWith(pullupSuffix) && name.length() > pullupSuffix.length();
    }

    private Flux<TreeNode> renderLevel(String folder, boolean pullup) {
        return nodeStore.readChildren(folder)
            .filter(this::isVisible)
            .concatMap(child -> {
                if (pullup && isPullupFolder(child)) {
                    return renderLevel(child.getPath(), true)
                        .collectList()
                        .map(children -> withChildren(child, children));
                }
                return Mono.just(child);
            });
    }

    private Flux<TreeNode> flatten(TreeNode node) {
        if (isPullupFolder(node) && node.getPayload() instanceof FolderPayload) {
            List<TreeNode> children = ((FolderPayload) node.getPayload()).getChildren();
            return children == null ? Flux.empty() : Flux.fromIterable(children).concatMap(this::flatten);
        }
        return Flux.just(node);
    }

    private boolean isVisible(TreeNode node) {
        return !skipHidden || node.getName() == null || !node.getName().startsWith(".");
    }

    private static TreeNode withChildren(TreeNode folder, List<TreeNode> children) {
        FolderPayload payload = folder.getPayload() instanceof FolderPayload
            ? (FolderPayload) folder.getPayload() : FolderPayload.empty();
        FolderPayload rendered = payload.toBuilder()
            .children(children.isEmpty() ? null : children)
            .hasChildren(!children.isEmpty() || payload.isHasChildren())
            .build();
        return folder.toBuilder().payload(rendered).build();
    }
}
