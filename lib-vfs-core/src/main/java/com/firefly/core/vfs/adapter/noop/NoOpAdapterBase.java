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
package com.firefly.core.vfs.adapter.noop;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Shared behaviour of the no-op fallback adapters.
 *
 * <p>Every call is logged at WARN through this class's logger so that a missing adapter is
 * visible in the logs. Queries complete empty; mutations fail with
 * {@link UnsupportedOperationException}.</p>
 */
@Slf4j
public abstract class NoOpAdapterBase {

    private final String portName;

    protected NoOpAdapterBase(String portName) {
        this.portName = portName;
    }

    public String getPortName() {
        return portName;
    }

    public String getAdapterName() {
        return "NoOp" + portName + "Adapter";
    }

    protected void logQuery(String method) {
        log.warn("No {} adapter configured: {} returns no data", portName, method);
    }

    protected void logUnsupported(String method) {
        log.warn("No {} adapter configured: {} is not supported", portName, method);
    }

    protected <T> Mono<T> emptyQuery(String method) {
        logQuery(method);
        return Mono.empty();
    }

    protected <T> Flux<T> emptyListing(String method) {
        logQuery(method);
        return Flux.empty();
    }

    protected <T> Mono<T> unsupported(String method) {
        logUnsupported(method);
        return Mono.error(new UnsupportedOperationException(
            method + " requires a " + portName + " adapter; set firefly.vfs.adapter-type"));
    }
}
