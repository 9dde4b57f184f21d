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
package com.firefly.vfs.adapter.memory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the in-memory VFS adapter, active when
 * {@code firefly.vfs.adapter-type=memory}.
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
@Slf4j
@AutoConfiguration(beforeName = "com.firefly.core.vfs.config.VfsAutoConfiguration")
@ConditionalOnProperty(name = "firefly.vfs.adapter-type", havingValue = "memory")
@EnableConfigurationProperties(InMemoryAdapterProperties.class)
public class InMemoryAdapterAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public InMemoryNodeStoreAdapter inMemoryNodeStoreAdapter(InMemoryAdapterProperties properties) {
        log.info("Configuring in-memory VFS node store");
        return new InMemoryNodeStoreAdapter(properties);
    }
}
