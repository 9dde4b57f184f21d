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

import com.firefly.core.vfs.port.node.NodeContentPort;
import com.firefly.core.vfs.port.node.NodeStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory for creating no-op adapter implementations for the VFS port interfaces.
 *
 * <p>These adapters serve as fallbacks when no real adapter is configured, so the
 * application context starts and the missing store shows up in the logs instead of
 * as a startup failure.</p>
 *
 * <p>All no-op adapters created by this factory:</p>
 * <ul>
 *   <li>Log warnings when methods are called</li>
 *   <li>Return empty results for query operations</li>
 *   <li>Return error signals for modification operations</li>
 * </ul>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 * @see NoOpAdapterBase
 */
@Slf4j
@Component
public class NoOpAdapterFactory {

    /**
     * Creates a no-op NodeStorePort adapter.
     *
     * @return a new no-op adapter instance
     */
    public NodeStorePort createNodeStorePort() {
        log.info("Creating no-op NodeStorePort adapter as fallback");
        return new NoOpGenericAdapter<>("NodeStorePort", NodeStorePort.class).getProxy();
    }

    /**
     * Creates a no-op NodeContentPort adapter.
     *
     * @return a new no-op adapter instance
     */
    public NodeContentPort createNodeContentPort() {
        log.info("Creating no-op NodeContentPort adapter as fallback");
        return new NoOpGenericAdapter<>("NodeContentPort", NodeContentPort.class).getProxy();
    }
}
