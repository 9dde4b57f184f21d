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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the in-memory VFS adapter.
 *
 * <p>Environment variables follow the usual relaxed binding, e.g.
 * {@code FIREFLY_VFS_ADAPTER_MEMORY_ENFORCE_UNIQUE_ORDINALS}.</p>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "firefly.vfs.adapter.memory")
public class InMemoryAdapterProperties {

    /**
     * Reject any write that would give two siblings the same ordinal.
     */
    private Boolean enforceUniqueOrdinals = true;

    /**
     * Owner assigned to the root folder, inherited by nodes created under it.
     */
    private Long rootOwnerId;

    /**
     * Visibility of the root folder.
     */
    private Boolean rootPublic = false;
}
