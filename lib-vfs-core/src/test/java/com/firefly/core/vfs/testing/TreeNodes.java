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
package com.firefly.core.vfs.testing;

import com.firefly.core.vfs.domain.model.node.BinaryPayload;
import com.firefly.core.vfs.domain.model.node.FolderPayload;
import com.firefly.core.vfs.domain.model.node.TextPayload;
import com.firefly.core.vfs.domain.model.node.TreeNode;

import java.util.UUID;

/**
 * Node fixtures shared by the engine and adapter tests.
 */
public final class TreeNodes {

    private TreeNodes() {
    }

    public static TreeNode file(String folder, String name, int ordinal) {
        return TreeNode.builder()
            .id(UUID.randomUUID())
            .parentPath(folder)
            .name(name)
            .ordinal(ordinal)
            .payload(TextPayload.builder().mimeType("text/markdown").sizeBytes(0L).build())
            .build();
    }

    public static TreeNode image(String folder, String name, int ordinal) {
        return TreeNode.builder()
            .id(UUID.randomUUID())
            .parentPath(folder)
            .name(name)
            .ordinal(ordinal)
            .payload(BinaryPayload.builder().mimeType("image/png").sizeBytes(0L).image(true).build())
            .build();
    }

    public static TreeNode folder(String parent, String name, int ordinal) {
        return TreeNode.builder()
            .id(UUID.randomUUID())
            .parentPath(parent)
            .name(name)
            .ordinal(ordinal)
            .payload(FolderPayload.empty())
            .build();
    }
}
