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
package com.firefly.core.vfs.adapter;

/**
 * Enumeration of VFS adapter features.
 * Used to declare what capabilities an adapter supports.
 */
public enum AdapterFeature {

    /**
     * Basic node create, read, delete
     */
    NODE_CRUD,

    /**
     * File content storage and retrieval
     */
    CONTENT_STORAGE,

    /**
     * Per-node ordinal updates
     */
    ORDINAL_UPDATES,

    /**
     * Moves relocate whole subtrees
     */
    SUBTREE_MOVE,

    /**
     * Refuses writes that would give two siblings the same ordinal
     */
    UNIQUE_ORDINALS,

    /**
     * Ordinals stored as NNNN_ file name prefixes
     */
    NAME_PREFIX_ORDINALS,

    /**
     * Data survives a restart
     */
    PERSISTENT_STORAGE,

    /**
     * Data lives in process memory only
     */
    IN_MEMORY
}
