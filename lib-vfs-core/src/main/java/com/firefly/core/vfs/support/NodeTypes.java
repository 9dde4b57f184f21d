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
package com.firefly.core.vfs.support;

import com.firefly.core.vfs.domain.model.node.BinaryPayload;
import com.firefly.core.vfs.domain.model.node.NodePayload;
import com.firefly.core.vfs.domain.model.node.TextPayload;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Classifies files by extension into text, image and binary payloads.
 */
public class NodeTypes {

    private static final Map<String, String> MIME_TYPES = Map.of(
        "md", "text/markdown",
        "txt", "text/plain",
        "png", "image/png",
        "jpg", "image/jpeg",
        "jpeg", "image/jpeg",
        "gif", "image/gif",
        "svg", "image/svg+xml",
        "pdf", "application/pdf"
    );

    private final Set<String> textExtensions;
    private final Set<String> imageExtensions;

    public NodeTypes(Set<String> textExtensions, Set<String> imageExtensions) {
        this.textExtensions = lower(textExtensions);
        this.imageExtensions = lower(imageExtensions);
    }

    public static NodeTypes defaults() {
        return new NodeTypes(Set.of("md", "txt"), Set.of("png", "jpg", "jpeg"));
    }

    public static String extension(String name) {
        int dot = name == null ? -1 : name.lastIndexOf('.');
        return dot <= 0 || dot == name.length() - 1 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static boolean hasExtension(String name) {
        return !extension(name).isEmpty();
    }

    public boolean isText(String name) {
        return textExtensions.contains(extension(name));
    }

    public boolean isImage(String name) {
        return imageExtensions.contains(extension(name));
    }

    public String mimeType(String name) {
        String ext = extension(name);
        String mime = MIME_TYPES.get(ext);
        if (mime != null) {
            return mime;
        }
        return textExtensions.contains(ext) ? "text/plain" : "application/octet-stream";
    }

    /**
     * Builds the payload for a file with the given name and size.
     *
     * @param name the file name
     * @param sizeBytes the content size, null when unknown
     * @return a text or binary payload
     */
    public NodePayload payloadFor(String name, Long sizeBytes) {
        if (isText(name)) {
            return TextPayload.builder().mimeType(mimeType(name)).sizeBytes(sizeBytes).build();
        }
        return BinaryPayload.builder()
            .mimeType(mimeType(name))
            .sizeBytes(sizeBytes)
            .image(isImage(name))
            .build();
    }

    private static Set<String> lower(Set<String> extensions) {
        return extensions.stream()
            .map(ext -> ext.startsWith(".") ? ext.substring(1) : ext)
            .map(ext -> ext.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }
}
