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
package com.firefly.core.vfs.port.node;

import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Port interface for file content storage, addressed by node id.
 *
 * <p>Content is keyed by the node id, so it follows a file through renames and moves.</p>
 */
public interface NodeContentPort {

    /**
     * Store binary content for a file node, replacing any previous content.
     *
     * @param nodeId the node id
     * @param content the content
     * @param mimeType the MIME type of the content
     * @return Mono indicating completion
     */
    Mono<Void> storeContent(UUID nodeId, byte[] content, String mimeType);

    /**
     * Retrieve the content of a file node.
     *
     * @param nodeId the node id
     * @return Mono containing the content, empty if none was stored
     */
    Mono<byte[]> getContent(UUID nodeId);

    /**
     * Delete the content of a file node.
     *
     * @param nodeId the node id
     * @return Mono indicating completion
     */
    Mono<Void> deleteContent(UUID nodeId);

    /**
     * Store UTF-8 text content.
     *
     * @param nodeId the node id
     * @param text the text
     * @return Mono indicating completion
     */
    default Mono<Void> storeText(UUID nodeId, String text) {
        return storeContent(nodeId, text.getBytes(StandardCharsets.UTF_8), "text/plain");
    }

    /**
     * Retrieve content decoded as UTF-8 text.
     *
     * @param nodeId the node id
     * @return Mono containing the text, empty if none was stored
     */
    default Mono<String> getText(UUID nodeId) {
        return getContent(nodeId).map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }
}
