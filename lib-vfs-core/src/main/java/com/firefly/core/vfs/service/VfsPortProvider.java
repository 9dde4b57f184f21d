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
package com.firefly.core.vfs.service;

import com.firefly.core.vfs.adapter.AdapterSelector;
import com.firefly.core.vfs.adapter.noop.NoOpAdapterFactory;
import com.firefly.core.vfs.config.VfsProperties;
import com.firefly.core.vfs.port.node.NodeContentPort;
import com.firefly.core.vfs.port.node.NodeStorePort;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Central service that provides access to the VFS ports with adapter selection and logging.
 *
 * <p>The ordering engine is wired against the ports returned here, so swapping the node
 * store (in-memory, local filesystem, a database) is a matter of configuration:</p>
 * <pre>
 * firefly:
 *   vfs:
 *     adapter-type: localfs
 * </pre>
 *
 * <p>When no adapter matches, the {@code require*} methods hand out no-op adapters from
 * {@link NoOpAdapterFactory} so that the application still starts.</p>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 * @see AdapterSelector
 * @see VfsProperties
 */
@Slf4j
public class VfsPortProvider {

    /** The adapter selector responsible for choosing appropriate adapters. */
    private final AdapterSelector adapterSelector;

    /** The VFS configuration properties. */
    private final VfsProperties vfsProperties;

    /** Source of fallback adapters. */
    private final NoOpAdapterFactory noOpAdapterFactory;

    public VfsPortProvider(AdapterSelector adapterSelector, VfsProperties vfsProperties,
                           NoOpAdapterFactory noOpAdapterFactory) {
        this.adapterSelector = adapterSelector;
        this.vfsProperties = vfsProperties;
        this.noOpAdapterFactory = noOpAdapterFactory;
    }

    /**
     * Retrieves the NodeStorePort implementation for structure and ordinal operations.
     *
     * @return an Optional containing the NodeStorePort implementation if available,
     *         or empty if no suitable adapter is found
     */
    public Optional<NodeStorePort> getNodeStorePort() {
        Optional<NodeStorePort> port = adapterSelector.selectAdapter(vfsProperties.getAdapterType(), NodeStorePort.class);
        if (port.isEmpty()) {
            log.warn("No NodeStorePort adapter found for type: {}. Node store features will not be available.",
                    vfsProperties.getAdapterType());
        }
        return port;
    }

    /**
     * Retrieves the NodeContentPort implementation for file content operations.
     *
     * @return an Optional containing the NodeContentPort implementation if available,
     *         or empty if no suitable adapter is found
     */
    public Optional<NodeContentPort> getNodeContentPort() {
        Optional<NodeContentPort> port = adapterSelector.selectAdapter(vfsProperties.getAdapterType(), NodeContentPort.class);
        if (port.isEmpty()) {
            log.warn("No NodeContentPort adapter found for type: {}. File content features will not be available.",
                    vfsProperties.getAdapterType());
        }
        return port;
    }

    /**
     * Returns the selected NodeStorePort, or a no-op fallback.
     */
    public NodeStorePort requireNodeStorePort() {
        return getNodeStorePort().orElseGet(noOpAdapterFactory::createNodeStorePort);
    }

    /**
     * Returns the selected NodeContentPort, or a no-op fallback.
     */
    public NodeContentPort requireNodeContentPort() {
        return getNodeContentPort().orElseGet(noOpAdapterFactory::createNodeContentPort);
    }
}
