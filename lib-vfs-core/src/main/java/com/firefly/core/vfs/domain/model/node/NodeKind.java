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
package com.firefly.core.vfs.domain.model.node;

/**
 * Kind of a node in the virtual filesystem.
 *
 * <p>Every {@link NodePayload} reports exactly one kind; consumers switch over it
 * to handle each variant.</p>
 */
public enum NodeKind {

    /**
     * Directory holding other nodes
     */
    FOLDER,

    /**
     * Text file (markdown, plain text) that can be joined and split
     */
    TEXT,

    /**
     * Image file rendered inline by viewers
     */
    IMAGE,

    /**
     * Any other file, treated as opaque bytes
     */
    BINARY;

    public boolean isFile() {
        return this != FOLDER;
    }
}
