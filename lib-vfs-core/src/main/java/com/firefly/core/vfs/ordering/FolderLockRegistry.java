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

import com.firefly.core.vfs.support.VfsPaths;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Serializes engine operations per folder without blocking threads.
 *
 * <p>Each folder has a tail: the completion signal of the last operation queued on it.
 * An operation registers its own completion signal as the new tail of every folder it
 * touches and subscribes to its action only once all previous tails have completed.
 * Registration for all folders of one operation happens atomically, so two operations
 * over overlapping folder sets always queue in the same relative order and cannot wait
 * on each other.</p>
 *
 * <p>The registry is not reentrant: an operation must not request a folder it already
 * holds. Engine components therefore take locks only in their public entry points and
 * call each other's unlocked internals.</p>
 *
 * <p>Only the wait for the folders is bounded. Once the action is subscribed it runs to
 * completion or to its first failure; a store write sequence is never cancelled halfway.
 * An operation that gives up waiting keeps its place in the queue until its predecessors
 * finish, so successors still never overlap with them.</p>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
@Slf4j
public class FolderLockRegistry {

    private final boolean enabled;
    private final Duration lockTimeout;
    private final Map<String, Mono<Void>> tails = new ConcurrentHashMap<>();

    public FolderLockRegistry(boolean enabled, Duration lockTimeout) {
        this.enabled = enabled;
        this.lockTimeout = lockTimeout;
    }

    /**
     * Runs {@code action} once no other operation holds any of {@code folders}.
     *
     * @param folders the folder paths the action reads or writes
     * @param action supplier of the operation, invoked on subscription once the folders are free
     * @param <T> the result type
     * @return Mono of the action result, failing with a {@link java.util.concurrent.TimeoutException}
     *         without running the action if the folders stay busy past the configured bound
     */
    public <T> Mono<T> withLocks(Collection<String> folders, Supplier<Mono<T>> action) {
        return enabled ? locked(folders, action) : Mono.defer(action);
    }

    /**
     * Number of folders with a queued or running operation.
     */
    public int activeFolderCount() {
        return tails.size();
    }

    private <T> Mono<T> locked(Collection<String> folders, Supplier<Mono<T>> action) {
        return Mono.defer(() -> {
            List<String> keys = folders.stream()
                .map(VfsPaths::normalize)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
            Sinks.Empty<Void> release = Sinks.empty();
            Mono<Void> completion = release.asMono();
            List<Mono<Void>> predecessors = new ArrayList<>();

            synchronized (tails) {
                for (String key : keys) {
                    Mono<Void> previous = tails.put(key, completion);
                    if (previous != null) {
                        predecessors.add(previous);
                    }
                }
            }
            if (!predecessors.isEmpty()) {
                log.debug("Waiting for {} queued operation(s) on folders {}", predecessors.size(), keys);
            }

            Mono<Void> ready = Mono.when(predecessors);
            if (!predecessors.isEmpty() && isBounded(lockTimeout)) {
                ready = ready.timeout(lockTimeout)
                    .doOnError(e -> log.warn("Gave up waiting {} for folders {}", lockTimeout, keys));
            }
            return ready
                .then(Mono.defer(action))
                .doFinally(signal -> Mono.when(predecessors)
                    .doFinally(done -> {
                        release.tryEmitEmpty();
                        keys.forEach(key -> tails.remove(key, completion));
                    })
                    .subscribe());
        });
    }

    private static boolean isBounded(Duration timeout) {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }
}
