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
import com.firefly.core.vfs.testing.TreeNodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for TreeRenderService pullup rendering.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TreeRenderServiceTest {

    @Mock
    private NodeStorePort nodeStore;

    private TreeRenderService renderService;

    @BeforeEach
    void setUp() {
        renderService = new TreeRenderService(nodeStore, "_", true);
        when(nodeStore.readChildren("/book")).thenReturn(Flux.just(
            TreeNodes.file("/book", "intro.md", 0),
            TreeNodes.folder("/book", "chapter_", 1),
            TreeNodes.file("/book", ".draft.md", 2),
            TreeNodes.folder("/book", "assets", 3),
            TreeNodes.folder("/book", "empty_", 4)));
        when(nodeStore.readChildren("/book/chapter_")).thenReturn(Flux.just(
            TreeNodes.file("/book/chapter_", "one.md", 0),
            TreeNodes.folder("/book/chapter_", "deep_", 1)));
        when(nodeStore.readChildren("/book/chapter_/deep_")).thenReturn(Flux.just(
            TreeNodes.file("/book/chapter_/deep_", "nested.md", 0)));
        when(nodeStore.readChildren("/book/empty_")).thenReturn(Flux.empty());
    }

    @Test
    void render_ShouldAttachChildrenToPullupFoldersOnly() {
        StepVerifier.create(renderService.render("/book", true).collectList())
            .assertNext(nodes -> {
                assertThat(nodes).extracting(TreeNode::getName)
                    .containsExactly("intro.md", "chapter_", "assets", "empty_");
                FolderPayload chapter = (FolderPayload) nodes.get(1).getPayload();
                assertThat(chapter.getChildren()).extracting(TreeNode::getName).containsExactly("one.md", "deep_");
                FolderPayload deep = (FolderPayload) chapter.getChildren().get(1).getPayload();
                assertThat(deep.getChildren()).extracting(TreeNode::getName).containsExactly("nested.md");
                assertThat(((FolderPayload) nodes.get(2).getPayload()).getChildren()).isNull();
                assertThat(((FolderPayload) nodes.get(3).getPayload()).getChildren()).isNull();
            })
            .verifyComplete();

        verify(nodeStore, never()).readChildren("/book/assets");
    }

    @Test
    void render_ShouldNotDescendWithPullupOff() {
        StepVerifier.create(renderService.render("/book", false).map(TreeNode::getName))
            .expectNext("intro.md", "chapter_", "assets", "empty_")
            .verifyComplete();

        verify(nodeStore, never()).readChildren("/book/chapter_");
    }

    @Test
    void renderInline_ShouldFlattenPullupFoldersInOrder() {
        StepVerifier.create(renderService.renderInline("/book").map(TreeNode::getName))
            .expectNext("intro.md", "one.md", "nested.md", "assets")
            .verifyComplete();
    }

    @Test
    void renderInline_ShouldHideEmptyPullupFolder() {
        when(nodeStore.readChildren("/solo")).thenReturn(Flux.just(TreeNodes.folder("/solo", "empty_", 0)));
        when(nodeStore.readChildren("/solo/empty_")).thenReturn(Flux.empty());

        StepVerifier.create(renderService.renderInline("/solo"))
            .verifyComplete();
        StepVerifier.create(renderService.render("/solo", true).map(TreeNode::getName))
            .expectNext("empty_")
            .verifyComplete();
    }

    @Test
    void isPullupFolder_ShouldRequireFolderAndNonEmptyStem() {
        assertThat(renderService.isPullupFolder(TreeNodes.folder("/", "part_", 0))).isTrue();
        assertThat(renderService.isPullupFolder(TreeNodes.folder("/", "_", 0))).isFalse();
        assertThat(renderService.isPullupFolder(TreeNodes.file("/", "note_", 0))).isFalse();
    }
}
