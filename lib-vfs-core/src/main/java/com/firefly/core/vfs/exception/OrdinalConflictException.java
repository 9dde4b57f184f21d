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
package com.firefly.core.vfs.exception;

/**
 * Raised when two siblings would share, or are found to share, the same ordinal.
 *
 * <p>The ordering algorithms never produce this state themselves; seeing it means a
 * concurrent writer outside the engine touched the folder, or a reserved slot was
 * taken before a retry. It is treated as an infrastructure fault.</p>
 */
public class OrdinalConflictException extends VfsException {

    private final int ordinal;

    public OrdinalConflictException(String folder, int ordinal) {
        this("Duplicate ordinal " + ordinal + " in folder " + folder, folder, ordinal);
    }

    public OrdinalConflictException(String message, String folder, int ordinal) {
        super(message, folder);
        this.ordinal = ordinal;
    }

    public int getOrdinal() {
        return ordinal;
    }
}
