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

import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class FolderLockRegistryTest {

    @Test
    void withLocks_ShouldRunOperationsOnSameFolderOneAfterAnother() {
        // Given
        FolderLockRegistry registry = new FolderLockRegistry(true, null);
        Sinks.One<String> firstGate = Sinks.one();
        List<String> events = new CopyOnWriteArrayList<>();

        Mono<String> first = registry.withLocks(List.of("/docs"), () -> {
            events.add("first-start");
            return firstGate.asMono().doOnNext(v -> events.add("first-end"));
        });
        Mono<String> second = registry.withLocks(List.of("/docs/"), () -> {
            events.add("second-start");
            return Mono.just("second");
        });

        // When
        first.subscribe();
        second.subscribe();

        // Then
        assertThat(events).containsExactly("first-start");
        assertThat(registry.activeFolderCount()).isEqualTo(1);

        firstGate.tryEmitValue("first");
        assertThat(events).containsExactly("first-start", "first-end", "second-start");
        assertThat(registry.activeFolderCount()).isZero();
    }

    @Test
    void withLocks_ShouldNotSerializeDisjointFolders() {
        FolderLockRegistry registry = new FolderLockRegistry(true, null);
        Sinks.One<String> gate = Sinks.one();
        List<String> events = new CopyOnWriteArrayList<>();

        registry.withLocks(List.of("/a"), () -> gate.asMono()).subscribe();
        registry.withLocks(List.of("/b"), () -> {
            events.add("b");
            return Mono.just("b");
        }).subscribe();

        assertThat(events).containsExactly("b");
        gate.tryEmitValue("a");
    }

    @Test
    void withLocks_ShouldReleaseFolderWhenOperationFails() {
        FolderLockRegistry registry = new FolderLockRegistry(true, null);

        StepVerifier.create(registry.withLocks(List.of("/docs"), () -> Mono.error(new IllegalStateException("boom"))))
            .expectErrorMessage("boom")
            .verify();
        StepVerifier.create(registry.withLocks(List.of("/docs"), () -> Mono.just(1)))
            .expectNext(1)
            .verifyComplete();
        assertThat(registry.activeFolderCount()).isZero();
    }

    @Test
    void withLocks_ShouldGiveUpWaitingWithoutRunningAction() {
        // Given
        FolderLockRegistry registry = new FolderLockRegistry(true, Duration.ofMillis(50));
        Sinks.One<String> holderGate = Sinks.one();
        List<String> events = new CopyOnWriteArrayList<>();
        registry.withLocks(List.of("/docs"), () -> holderGate.asMono()).subscribe();

        // When
        StepVerifier.create(registry.withLocks(List.of("/docs"), () -> {
                events.add("waiter");
                return Mono.just("waiter");
            }))
            .expectError(TimeoutException.class)
            .verify(Duration.ofSeconds(5));
        registry.withLocks(List.of("/docs"), () -> {
            events.add("next");
            return Mono.just("next");
        }).subscribe();

        // Then
        assertThat(events).isEmpty();
        holderGate.tryEmitValue("done");
        assertThat(events).containsExactly("next");
        assertThat(registry.activeFolderCount()).isZero();
    }

    @Test
    void withLocks_ShouldNotInterruptRunningAction() {
        // Given
        FolderLockRegistry registry = new FolderLockRegistry(true, Duration.ofMillis(20));

        // When / Then
        StepVerifier.create(registry.withLocks(List.of("/docs"),
                () -> Mono.delay(Duration.ofMillis(200)).thenReturn("slow")))
            .expectNext("slow")
            .verifyComplete();
    }

    @Test
    void withLocks_ShouldRunDirectlyWhenDisabled() {
        FolderLockRegistry registry = new FolderLockRegistry(false, null);

        registry.withLocks(List.of("/docs"), Mono::never).subscribe();

        StepVerifier.create(registry.withLocks(List.of("/docs"), () -> Mono.just("free")))
            .expectNext("free")
            .verifyComplete();
        assertThat(registry.activeFolderCount()).isZero();
    }
}
