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
package com.firefly.vfs.adapter.localfs;

import com.firefly.core.vfs.support.OrdinalNameCodec;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.nio.file.AccessDeniedException;

/**
 * Auto-configuration for the local filesystem VFS adapter, active when
 * {@code firefly.vfs.adapter-type=localfs}.
 *
 * <p>The prefix width comes from the shared {@link OrdinalNameCodec} bean
 * ({@code firefly.vfs.ordering.prefix-width}); without it the default width is used.
 * Filesystem calls refused with {@link AccessDeniedException} are retried through the
 * {@code localFsRetry} bean.</p>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
@Slf4j
@AutoConfiguration(beforeName = "com.firefly.core.vfs.config.VfsAutoConfiguration")
@ConditionalOnProperty(name = "firefly.vfs.adapter-type", havingValue = "localfs")
@EnableConfigurationProperties(LocalFsAdapterProperties.class)
public class LocalFsAdapterAutoConfiguration {

    static final int DEFAULT_PREFIX_WIDTH = 4;

    @Bean
    @ConditionalOnMissingBean(name = "localFsRetry")
    public Retry localFsRetry(LocalFsAdapterProperties properties) {
        log.info("Configuring local filesystem retry: {} retries, {} apart",
            properties.getMaxRetries(), properties.getRetryDelay());
        return accessDeniedRetry(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public LocalFsNodeStoreAdapter localFsNodeStoreAdapter(LocalFsAdapterProperties properties,
                                                           ObjectProvider<OrdinalNameCodec> codec,
                                                           @Qualifier("localFsRetry") Retry retry) {
        log.info("Configuring local filesystem VFS node store at {}", properties.getRootPath());
        return new LocalFsNodeStoreAdapter(properties,
            codec.getIfAvailable(() -> new OrdinalNameCodec(DEFAULT_PREFIX_WIDTH)), retry);
    }

    /**
     * Retry for calls refused with an access error. Every other failure, including the
     * other {@link java.nio.file.FileSystemException} types, fails on the first attempt.
     *
     * @param properties the adapter properties
     * @return the retry
     */
    static Retry accessDeniedRetry(LocalFsAdapterProperties properties) {
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(properties.getMaxRetries() + 1)
            .waitDuration(properties.getRetryDelay())
            .retryExceptions(AccessDeniedException.class)
            .build();
        return Retry.of("localFs", config);
    }
}
