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

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the VFS ordering engine.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "firefly.vfs")
public class VfsProperties {

    /**
     * Whether the VFS engine is enabled
     */
    private Boolean enabled = true;

    /**
     * Adapter type to use (e.g., "memory", "localfs")
     */
    private String adapterType;

    /**
     * Adapter-specific properties
     */
    private Map<String, Object> properties;

    /**
     * Ordering engine settings
     */
    @Valid
    private Ordering ordering = new Ordering();

    /**
     * Join / split settings
     */
    @Valid
    private Transforms transforms = new Transforms();

    /**
     * Tree rendering settings
     */
    @Valid
    private Rendering rendering = new Rendering();

    /**
     * Ordering engine configuration
     */
    @Data
    public static class Ordering {

        /**
         * First temporary ordinal handed out during the quarantine phase of a reorder
         */
        private Integer quarantineBase = Integer.MIN_VALUE;

        /**
         * Re-read a folder after each write sequence and fail on duplicate ordinals
         */
        private Boolean verifyAfterWrite = true;

        /**
         * Serialize operations touching the same folder
         */
        private Boolean folderLocking = true;

        /**
         * Upper bound for the wait on busy folders; a running operation is never interrupted
         */
        private Duration lockTimeout = Duration.ofSeconds(30);

        /**
         * Width of the NNNN_ name prefix used by name-sorted stores
         */
        @Min(1)
        @Max(9)
        private Integer prefixWidth = 4;
    }

    /**
     * Join / split configuration
     */
    @Data
    public static class Transforms {

        /**
         * Text inserted between joined files
         */
        private String joinSeparator = "\n\n";

        /**
         * Delimiter that separates parts when splitting a file
         */
        @NotEmpty
        private String splitDelimiter = "\n~\n";

        /**
         * Extensions of files treated as text
         */
        @NotEmpty
        private List<String> textExtensions = List.of("md", "txt");

        /**
         * Extensions of files treated as images
         */
        private List<String> imageExtensions = List.of("png", "jpg", "jpeg");

        /**
         * Extension appended to new file names that have none
         */
        @NotBlank
        private String defaultExtension = "md";
    }

    /**
     * Tree rendering configuration
     */
    @Data
    public static class Rendering {

        /**
         * Folder name suffix marking a pullup folder
         */
        @NotEmpty
        private String pullupSuffix = "_";

        /**
         * Skip entries whose name starts with a dot
         */
        private Boolean skipHidden = true;
    }

    /**
     * Get adapter property value.
     *
     * @param key the property key
     * @return the property value, or null if not found
     */
    public Object getAdapterProperty(String key) {
        return properties != null ? properties.get(key) : null;
    }

    /**
     * Get adapter property value as string.
     *
     * @param key the property key
     * @return the property value as string, or null if not found
     */
    public String getAdapterPropertyAsString(String key) {
        Object value = getAdapterProperty(key);
        return value != null ? value.toString() : null;
    }

    /**
     * Check if adapter property exists.
     *
     * @param key the property key
     * @return true if property exists, false otherwise
     */
    public boolean hasAdapterProperty(String key) {
        return properties != null && properties.containsKey(key);
    }
}
