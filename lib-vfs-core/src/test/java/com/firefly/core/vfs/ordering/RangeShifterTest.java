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

import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for RangeShifter.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RangeShifterTest {

    @Mock
    private NodeStorePort nodeStore;

    private RangeShifter rangeShifter;

    private TreeNode a;
    private TreeNode b;
    private TreeNode c;
    private TreeNode d;

    @BeforeEach
    void setUp() {
        rangeShifter = new RangeShifter(nodeStore);
        a = TreeNodes.file("/docs", "a.md", 0);
        b = TreeNodes.file("/docs", "b.md", 1);
        c = TreeNodes.file("/docs", "c.md", 2);
        d = TreeNodes.file("/docs", "d.md", 3);
        when(nodeStore.setOrdinal(any(), anyInt())).thenReturn(Mono.empty());
    }

    @Test
    void shiftOrdinalsDown_ShouldShiftFromThresholdHighestFirst() {
        // Given
        when(nodeStore.readChildren("/docs")).thenReturn(Flux.just(a, b, c, d));

        // When & Then
        StepVerifier.create(rangeShifter.shiftOrdinalsDown("/docs", 2, 3))
            .expectNext(2)
            .verifyComplete();

        InOrder order = inOrder(nodeStore);
        order.verify(nodeStore).setOrdinal(d.getId(), 6);
        order.verify(nodeStore).setOrdinal(c.getId(), 5);
        verify(nodeStore, never()).setOrdinal(a.getId(), 3);
        verify(nodeStore, never()).setOrdinal(b.getId(), 4);
    }

    @Test
    void shiftOrdinalsDown_ShouldCompleteWithZeroForEmptyFolder() {
        when(nodeStore.readChildren("/empty")).thenReturn(Flux.empty());

        StepVerifier.create(rangeShifter.shiftOrdinalsDown("/empty", 0, 2))
            .expectNext(0)
            .verifyComplete();

        verify(nodeStore, never()).setOrdinal(any(), anyInt());
    }

    @Test
    void shiftOrdinalsDown_ShouldShiftEverythingForNegativeThreshold() {
        when(nodeStore.readChildren("/docs")).thenReturn(Flux.just(a, b));

        StepVerifier.create(rangeShifter.shiftOrdinalsDown("/docs", -1, 1))
            .expectNext(2)
            .verifyComplete();

        InOrder order = inOrder(nodeStore);
        order.verify(nodeStore).setOrdinal(b.getId(), 2);
        order.verify(nodeStore).setOrdinal(a.getId(), 1);
    }

    @Test
    void shiftOrdinalsDown_ShouldLeaveExcludedNodesInPlace() {
        when(nodeStore.readChildren("/docs")).thenReturn(Flux.just(a, b, c, d));

        StepVerifier.create(rangeShifter.shiftOrdinalsDown("/docs", 1, 1, Set.of(c.getId())))
            .expectNext(2)
            .verifyComplete();

        verify(nodeStore).setOrdinal(d.getId(), 4);
        verify(nodeStore).setOrdinal(b.getId(), 2);
        verify(nodeStore, never()).setOrdinal(c.getId(), 3);
    }

    @Test
    void shiftOrdinalsDown_ShouldRejectNonPositiveAmountBeforeTouchingStore() {
        StepVerifier.create(rangeShifter.shiftOrdinalsDown("/docs", 0, 0))
            .expectError(InvalidOperationException.class)
            .verify();

        verifyNoInteractions(nodeStore);
    }

    @Test
    void shiftOrdinalsDown_ShouldPropagateStoreFailure() {
        when(nodeStore.readChildren(anyString())).thenReturn(Flux.just(a, b));
        when(nodeStore.setOrdinal(b.getId(), 2)).thenReturn(Mono.error(new IllegalStateException("disk full")));

        StepVerifier.create(rangeShifter.shiftOrdinalsDown("/docs", 0, 1))
            .expectErrorMessage("disk full")
            .verify();

        verify(nodeStore, never()).setOrdinal(a.getId(), 1);
    }
}
