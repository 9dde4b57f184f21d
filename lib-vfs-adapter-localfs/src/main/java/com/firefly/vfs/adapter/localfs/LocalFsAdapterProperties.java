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

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for the local filesystem VFS adapter.
 *
 * <p>Required properties:</p>
 * <ul>
 *   <li><strong>root-path:</strong> directory holding the tree</li>
 * </ul>
 *
 * <p>Optional properties:</p>
 * <ul>
 *   <li><strong>create-root:</strong> create the root directory when missing</li>
 *   <li><strong>default-owner-id:</strong> owner reported for every node</li>
 *   <li><strong>text-extensions / image-extensions:</strong> file classification</li>
 *   <li><strong>max-retries / retry-delay:</strong> retries of calls refused with an access error</li>
 * </ul>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "firefly.vfs.adapter.localfs")
public class LocalFsAdapterProperties {

    /**
     * Root directory of the tree.
     *
     * <p>Environment variable: {@code FIREFLY_VFS_ADAPTER_LOCALFS_ROOT_PATH}</p>
     */
    @NotBlank(message = "Local filesystem root path is required")
    private String rootPath;

    /**
     * Whether to create the root directory if it does not exist.
     */
    private Boolean createRoot = true;

    /**
     * Owner reported for nodes, the filesystem keeps no owner of its own.
     */
    private Long defaultOwnerId;

    /**
     * Whether nodes are reported as public.
     */
    private Boolean publicNodes = false;

    /**
     * Extensions of files reported as text.
     */
    @NotEmpty
    private List<String> textExtensions = List.of("md", "txt");

    /**
     * Extensions of files reported as images.
     */
    private List<String> imageExtensions = List.of("png", "jpg", "jpeg");

    /**
     * Maximum number of retries of a filesystem call refused with an access error,
     * as happens when another process holds a file open during a rename.
     * Optional, defaults to 3.
     *
     * <p>Environment variable: {@code FIREFLY_VFS_ADAPTER_LOCALFS_MAX_RETRIES}</p>
     */
    @NotNull
    @Min(0)
    private Integer maxRetries = 3;

    /**
     * Pause between retries.
     */
    @NotNull
    private Duration retryDelay = Duration.ofMillis(100);
}
