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
import com.firefly.core.vfs.exception.InvalidOperationException;
import com.firefly.core.vfs.exception.NodeNotFoundException;
import com.firefly.core.vfs.port.node.NodeStorePort;
import com.firefly.core.vfs.testing.TreeNodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for CrossFolderMoveOrchestrator failure handling against a mocked store.
 * End-to-end paste scenarios run against the in-memory adapter.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CrossFolderMoveOrchestratorTest {

    private static final int BASE = Integer.MIN_VALUE;

    @Mock
    private NodeStorePort nodeStore;

    @Mock
    private OrdinalInvariantVerifier verifier;

    private CrossFolderMoveOrchestrator orchestrator;

    private TreeNode source;

    @BeforeEach
    void setUp() {
        FolderLockRegistry locks = new FolderLockRegistry(true, Duration.ofSeconds(5));
        RangeShifter shifter = new RangeShifter(nodeStore);
        OrdinalAssigner assigner = new OrdinalAssigner(nodeStore, shifter);
        ReorderEngine reorderEngine = new ReorderEngine(nodeStore, locks, verifier, BASE);
        orchestrator = new CrossFolderMoveOrchestrator(nodeStore, assigner, shifter, reorderEngine, locks, verifier, BASE);

        source = TreeNodes.file("/src", "a.md", 3);
        when(nodeStore.getNodeByPath("/dst")).thenReturn(Mono.just(TreeNodes.folder("/", "dst", 0)));
        when(nodeStore.getNodeByPath("/src/a.md")).thenReturn(Mono.just(source));
        when(nodeStore.readChildren("/dst")).thenReturn(Flux.empty());
        when(nodeStore.getMaxOrdinal("/dst")).thenReturn(Mono.empty());
        when(nodeStore.exists(anyString())).thenReturn(Mono.just(false));
        when(nodeStore.setOrdinal(any(), anyInt())).thenReturn(Mono.empty());
        when(verifier.verify(anyString())).thenReturn(Mono.empty());
    }

    @Test
    void paste_ShouldParkMoveAndCommitEachItem() {
        // Given
        TreeNode moved = source.toBuilder().parentPath("/dst").ordinal(BASE).build();
        when(nodeStore.moveNode("/src/a.md", "/dst/a.md")).thenReturn(Mono.just(moved));

        // When & Then
        StepVerifier.create(orchestrator.paste(List.of("/src/a.md"), "/dst", InsertPosition.atEnd()))
            .assertNext(result -> {
                assertThat(result.isComplete()).isTrue();
                assertThat(result.getInsertOrdinal()).isZero();
                assertThat(result.getItems().get(0).getTargetPath()).isEqualTo("/dst/a.md");
            })
            .verifyComplete();

        InOrder order = inOrder(nodeStore);
        order.verify(nodeStore).setOrdinal(source.getId(), BASE);
        order.verify(nodeStore).moveNode("/src/a.md", "/dst/a.md");
        order.verify(nodeStore).setOrdinal(source.getId(), 0);
    }

    @Test
    void paste_ShouldRestoreOrdinalAndReportWhenMoveFails() {
        // Given
        when(nodeStore.moveNode("/src/a.md", "/dst/a.md")).thenReturn(Mono.error(new IllegalStateException("io failure")));

        // When & Then
        StepVerifier.create(orchestrator.paste(List.of("/src/a.md"), "/dst", InsertPosition.atEnd()))
            .assertNext(result -> {
                assertThat(result.isSuccess()).isFalse();
                PasteItemResult item = result.getItems().get(0);
                assertThat(item.isSuccess()).isFalse();
                assertThat(item.getErrorMessage()).isEqualTo("io failure");
                assertThat(item.getErrorType()).isEqualTo("IllegalStateException");
                assertThat(item.getReservedOrdinal()).isZero();
            })
            .verifyComplete();

        InOrder order = inOrder(nodeStore);
        order.verify(nodeStore).setOrdinal(source.getId(), BASE);
        order.verify(nodeStore).moveNode("/src/a.md", "/dst/a.md");
        order.verify(nodeStore).setOrdinal(source.getId(), 3);
    }

    @Test
    void paste_ShouldReportFolderMovedIntoItsOwnSubtree() {
        // Given
        TreeNode folder = TreeNodes.folder("/", "parent", 0);
        when(nodeStore.getNodeByPath("/parent")).thenReturn(Mono.just(folder));
        when(nodeStore.getNodeByPath("/parent/child")).thenReturn(Mono.just(TreeNodes.folder("/parent", "child", 0)));
        when(nodeStore.readChildren("/parent/child")).thenReturn(Flux.empty());
        when(nodeStore.getMaxOrdinal("/parent/child")).thenReturn(Mono.empty());

        // When & Then
        StepVerifier.create(orchestrator.paste(List.of("/parent"), "/parent/child", InsertPosition.atEnd()))
            .assertNext(result -> assertThat(result.getItems().get(0).getError())
                .isInstanceOf(InvalidOperationException.class))
            .verifyComplete();

        verify(nodeStore, never()).moveNode(anyString(), anyString());
    }

    @Test
    void paste_ShouldRejectInvalidInputBeforeTouchingStore() {
        StepVerifier.create(orchestrator.paste(List.of(), "/dst", InsertPosition.atEnd()))
            .expectError(InvalidOperationException.class)
            .verify();
        StepVerifier.create(orchestrator.paste(List.of("/"), "/dst", InsertPosition.atEnd()))
            .expectError(InvalidOperationException.class)
            .verify();
        StepVerifier.create(orchestrator.paste(List.of("/src/a.md", "/src//a.md"), "/dst", InsertPosition.atEnd()))
            .expectError(InvalidOperationException.class)
            .verify();

        verifyNoInteractions(nodeStore);
    }

    @Test
    void paste_ShouldFailWhenTargetFolderIsMissing() {
        when(nodeStore.getNodeByPath("/missing")).thenReturn(Mono.empty());

        StepVerifier.create(orchestrator.paste(List.of("/src/a.md"), "/missing", InsertPosition.atEnd()))
            .expectError(NodeNotFoundException.class)
            .verify();

        verify(nodeStore, never()).setOrdinal(any(), anyInt());
    }

    @Test
    void moveNode_ShouldSurfaceItemFailureAsError() {
        when(nodeStore.moveNode("/src/a.md", "/dst/a.md")).thenReturn(Mono.error(new IllegalStateException("io failure")));

        StepVerifier.create(orchestrator.moveNode("/src/a.md", "/dst", InsertPosition.atBeginning()))
            .expectErrorMessage("io failure")
            .verify();
    }
}
