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
package com.firefly.core.vfs.config;

import com.firefly.core.vfs.adapter.AdapterSelector;
import com.firefly.core.vfs.adapter.noop.NoOpAdapterFactory;
import com.firefly.core.vfs.ordering.CrossFolderMoveOrchestrator;
import com.firefly.core.vfs.ordering.FolderLockRegistry;
import com.firefly.core.vfs.ordering.OrdinalAssigner;
import com.firefly.core.vfs.ordering.OrdinalInvariantVerifier;
import com.firefly.core.vfs.ordering.RangeShifter;
import com.firefly.core.vfs.ordering.ReorderEngine;
import com.firefly.core.vfs.service.DocumentTreeService;
import com.firefly.core.vfs.service.VfsPortProvider;
import com.firefly.core.vfs.support.NodeTypes;
import com.firefly.core.vfs.support.OrdinalNameCodec;
import com.firefly.core.vfs.transform.StructuralTransformService;
import com.firefly.core.vfs.transform.TreeRenderService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;

import java.util.HashSet;

/**
 * Spring Boot auto-configuration for the Firefly VFS ordering engine.
 *
 * <p>Adapter discovery components are picked up by component scanning. The engine itself
 * (range shifter, ordinal assigner, reorder engine, move orchestrator, transforms) is
 * wired here against the node store selected by {@link VfsPortProvider}.</p>
 *
 * <p>Example configuration:</p>
 * <pre>
 * firefly:
 *   vfs:
 *     enabled: true
 *     adapter-type: localfs
 *     ordering:
 *       verify-after-write: true
 *       lock-timeout: 30s
 * </pre>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 * @see VfsProperties
 * @see VfsPortProvider
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(VfsProperties.class)
@ComponentScan(basePackages = "com.firefly.core.vfs.adapter")
@ConditionalOnProperty(prefix = "firefly.vfs", name = "enabled", havingValue = "true", matchIfMissing = true)
public class VfsAutoConfiguration {

    /**
     * Configures the port provider that selects the node store adapter.
     */
    @Bean
    @ConditionalOnMissingBean
    public VfsPortProvider vfsPortProvider(AdapterSelector adapterSelector, VfsProperties vfsProperties,
                                           NoOpAdapterFactory noOpAdapterFactory) {
        log.info("Configuring VFS Port Provider with adapter type: {}", vfsProperties.getAdapterType());
        return new VfsPortProvider(adapterSelector, vfsProperties, noOpAdapterFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public FolderLockRegistry folderLockRegistry(VfsProperties vfsProperties) {
        VfsProperties.Ordering ordering = vfsProperties.getOrdering();
        return new FolderLockRegistry(Boolean.TRUE.equals(ordering.getFolderLocking()), ordering.getLockTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public OrdinalInvariantVerifier ordinalInvariantVerifier(VfsPortProvider portProvider, VfsProperties vfsProperties) {
        return new OrdinalInvariantVerifier(portProvider.requireNodeStorePort(),
            Boolean.TRUE.equals(vfsProperties.getOrdering().getVerifyAfterWrite()));
    }

    @Bean
    @ConditionalOnMissingBean
    public RangeShifter rangeShifter(VfsPortProvider portProvider) {
        return new RangeShifter(portProvider.requireNodeStorePort());
    }

    @Bean
    @ConditionalOnMissingBean
    public OrdinalAssigner ordinalAssigner(VfsPortProvider portProvider, RangeShifter rangeShifter) {
        return new OrdinalAssigner(portProvider.requireNodeStorePort(), rangeShifter);
    }

    /**
     * Configures the two-phase reorder engine. The quarantine base must leave room for
     * the largest folder below the committed range.
     */
    @Bean
    @ConditionalOnMissingBean
    public ReorderEngine reorderEngine(VfsPortProvider portProvider, FolderLockRegistry folderLockRegistry,
                                       OrdinalInvariantVerifier verifier, VfsProperties vfsProperties) {
        return new ReorderEngine(portProvider.requireNodeStorePort(), folderLockRegistry, verifier,
            vfsProperties.getOrdering().getQuarantineBase());
    }

    @Bean
    @ConditionalOnMissingBean
    public CrossFolderMoveOrchestrator crossFolderMoveOrchestrator(VfsPortProvider portProvider,
                                                                   OrdinalAssigner ordinalAssigner,
                                                                   RangeShifter rangeShifter,
                                                                   ReorderEngine reorderEngine,
                                                                   FolderLockRegistry folderLockRegistry,
                                                                   OrdinalInvariantVerifier verifier,
                                                                   VfsProperties vfsProperties) {
        return new CrossFolderMoveOrchestrator(portProvider.requireNodeStorePort(), ordinalAssigner, rangeShifter,
            reorderEngine, folderLockRegistry, verifier, vfsProperties.getOrdering().getQuarantineBase());
    }

    @Bean
    @ConditionalOnMissingBean
    public StructuralTransformService structuralTransformService(VfsPortProvider portProvider,
                                                                 OrdinalAssigner ordinalAssigner,
                                                                 FolderLockRegistry folderLockRegistry,
                                                                 OrdinalInvariantVerifier verifier,
                                                                 VfsProperties vfsProperties) {
        VfsProperties.Transforms transforms = vfsProperties.getTransforms();
        return new StructuralTransformService(portProvider.requireNodeStorePort(), portProvider.requireNodeContentPort(),
            ordinalAssigner, folderLockRegistry, verifier, transforms.getJoinSeparator(), transforms.getSplitDelimiter());
    }

    @Bean
    @ConditionalOnMissingBean
    public TreeRenderService treeRenderService(VfsPortProvider portProvider, VfsProperties vfsProperties) {
        VfsProperties.Rendering rendering = vfsProperties.getRendering();
        return new TreeRenderService(portProvider.requireNodeStorePort(), rendering.getPullupSuffix(),
            Boolean.TRUE.equals(rendering.getSkipHidden()));
    }

    @Bean
    @ConditionalOnMissingBean
    public NodeTypes nodeTypes(VfsProperties vfsProperties) {
        VfsProperties.Transforms transforms = vfsProperties.getTransforms();
        return new NodeTypes(new HashSet<>(transforms.getTextExtensions()), new HashSet<>(transforms.getImageExtensions()));
    }

    @Bean
    @ConditionalOnMissingBean
    public OrdinalNameCodec ordinalNameCodec(VfsProperties vfsProperties) {
        return new OrdinalNameCodec(vfsProperties.getOrdering().getPrefixWidth());
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentTreeService documentTreeService(VfsPortProvider portProvider,
                                                   OrdinalAssigner ordinalAssigner,
                                                   FolderLockRegistry folderLockRegistry,
                                                   OrdinalInvariantVerifier verifier,
                                                   NodeTypes nodeTypes,
                                                   VfsProperties vfsProperties) {
        return new DocumentTreeService(portProvider.requireNodeStorePort(), portProvider.requireNodeContentPort(),
            ordinalAssigner, folderLockRegistry, verifier, nodeTypes,
            vfsProperties.getTransforms().getDefaultExtension());
    }
}
