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
import com.firefly.core.vfs.testing.TreeNodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for OrdinalAssigner.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class OrdinalAssignerTest {

    @Mock
    private NodeStorePort nodeStore;

    @Mock
    private RangeShifter rangeShifter;

    private OrdinalAssigner assigner;

    @BeforeEach
    void setUp() {
        assigner = new OrdinalAssigner(nodeStore, rangeShifter);
        when(rangeShifter.shiftOrdinalsDown(anyString(), anyInt(), anyInt(), any())).thenReturn(Mono.just(0));
    }

    @Test
    void resolveInsertOrdinal_ShouldHandleBeginningAndOrdinalAnchors() {
        StepVerifier.create(assigner.resolveInsertOrdinal("/docs", InsertPosition.atBeginning()))
            .expectNext(0)
            .verifyComplete();
        StepVerifier.create(assigner.resolveInsertOrdinal("/docs", InsertPosition.afterOrdinal(4)))
            .expectNext(5)
            .verifyComplete();
    }

    @Test
    void resolveInsertOrdinal_ShouldPlaceAfterNamedAnchor() {
        TreeNode anchor = TreeNodes.file("/docs", "target-1.md", 7);
        when(nodeStore.getNodeByPath("/docs/target-1.md")).thenReturn(Mono.just(anchor));

        StepVerifier.create(assigner.resolveInsertOrdinal("/docs", InsertPosition.after("target-1.md")))
            .expectNext(8)
            .verifyComplete();
    }

    @Test
    void resolveInsertOrdinal_ShouldFailForMissingAnchor() {
        when(nodeStore.getNodeByPath(anyString())).thenReturn(Mono.empty());

        StepVerifier.create(assigner.resolveInsertOrdinal("/docs", InsertPosition.after("ghost.md")))
            .expectError(NodeNotFoundException.class)
            .verify();
    }

    @Test
    void resolveInsertOrdinal_ShouldRejectAnchorNodeFromAnotherFolder() {
        TreeNode elsewhere = TreeNodes.file("/other", "x.md", 1);
        when(nodeStore.getNode(elsewhere.getId())).thenReturn(Mono.just(elsewhere));

        StepVerifier.create(assigner.resolveInsertOrdinal("/docs", InsertPosition.afterNode(elsewhere.getId())))
            .expectError(InvalidOperationException.class)
            .verify();
    }

    @Test
    void resolveInsertOrdinal_ShouldRejectAnchorNameOutsideFolder() {
        StepVerifier.create(assigner.resolveInsertOrdinal("/docs", InsertPosition.after("../outside.md")))
            .expectError(InvalidOperationException.class)
            .verify();

        verify(nodeStore, never()).getNodeByPath(anyString());
    }

    @Test
    void resolveInsertOrdinal_ShouldFailInsteadOfWrappingAfterMaxOrdinal() {
        // Given
        TreeNode last = TreeNodes.file("/docs", "last.md", Integer.MAX_VALUE);
        when(nodeStore.getNodeByPath("/docs/last.md")).thenReturn(Mono.just(last));
        when(nodeStore.getNode(last.getId())).thenReturn(Mono.just(last));

        // When / Then
        StepVerifier.create(assigner.resolveInsertOrdinal("/docs", InsertPosition.after("last.md")))
            .expectError(ArithmeticException.class)
            .verify();
        StepVerifier.create(assigner.resolveInsertOrdinal("/docs", InsertPosition.afterNode(last.getId())))
            .expectError(ArithmeticException.class)
            .verify();
        StepVerifier.create(assigner.resolveInsertOrdinal("/docs", InsertPosition.afterOrdinal(Integer.MAX_VALUE)))
            .expectError(ArithmeticException.class)
            .verify();
    }

    @Test
    void resolveInsertOrdinal_ShouldAppendAfterMaxOrUseZeroForEmptyFolder() {
        when(nodeStore.getMaxOrdinal("/docs")).thenReturn(Mono.just(9));
        when(nodeStore.getMaxOrdinal("/empty")).thenReturn(Mono.empty());

        StepVerifier.create(assigner.resolveInsertOrdinal("/docs", InsertPosition.atEnd()))
            .expectNext(10)
            .verifyComplete();
        StepVerifier.create(assigner.resolveInsertOrdinal("/empty", InsertPosition.atEnd()))
            .expectNext(0)
            .verifyComplete();
    }

    @Test
    void reserve_ShouldShiftFromInsertOrdinalByCount() {
        TreeNode anchor = TreeNodes.file("/docs", "a.md", 1);
        when(nodeStore.getNode(anchor.getId())).thenReturn(Mono.just(anchor));
        Set<UUID> excluded = Set.of(UUID.randomUUID());

        StepVerifier.create(assigner.reserve("/docs", InsertPosition.afterNode(anchor.getId()), 3, excluded))
            .expectNext(2)
            .verifyComplete();

        verify(rangeShifter).shiftOrdinalsDown("/docs", 2, 3, excluded);
    }

    @Test
    void reserve_ShouldNotShiftForZeroCount() {
        StepVerifier.create(assigner.reserve("/docs", InsertPosition.atBeginning(), 0))
            .expectNext(0)
            .verifyComplete();

        verify(rangeShifter, never()).shiftOrdinalsDown(anyString(), anyInt(), anyInt(), any());
    }

    @Test
    void reserve_ShouldNotShiftWhenAnchorIsMissing() {
        when(nodeStore.getNodeByPath(anyString())).thenReturn(Mono.empty());

        StepVerifier.create(assigner.reserve("/docs", InsertPosition.after("ghost.md"), 2))
            .expectError(NodeNotFoundException.class)
            .verify();

        verify(rangeShifter, never()).shiftOrdinalsDown(eq("/docs"), anyInt(), anyInt(), any());
    }

    @Test
    void consecutive_ShouldListFinalOrdinals() {
        assertThat(OrdinalAssigner.consecutive(2, 3)).containsExactly(2, 3, 4);
        assertThat(OrdinalAssigner.consecutive(0, 0)).isEmpty();
    }
}
