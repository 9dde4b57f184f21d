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
package com.firefly.core.vfs.domain.model.ordering;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.UUID;

/**
 * Outcome of pasting one item.
 *
 * <p>Every item carries the ordinal slot that was reserved for it in the target folder.
 * A failed item keeps its slot, so a retry can place it there without shifting again.</p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PasteItemResult {

    /**
     * Path of the item before the paste
     */
    String sourcePath;

    /**
     * Path of the item in the target folder
     */
    String targetPath;

    /**
     * Id of the moved node, null when the source could not be resolved
     */
    UUID nodeId;

    /**
     * Ordinal reserved for the item in the target folder
     */
    int reservedOrdinal;

    boolean success;

    /**
     * Failure reason, null on success
     */
    String errorMessage;

    /**
     * Simple name of the failure type, null on success
     */
    String errorType;

    @JsonIgnore
    transient Throwable error;

    public static PasteItemResult pasted(String sourcePath, String targetPath, UUID nodeId, int ordinal) {
        return PasteItemResult.builder()
            .sourcePath(sourcePath)
            .targetPath(targetPath)
            .nodeId(nodeId)
            .reservedOrdinal(ordinal)
            .success(true)
            .build();
    }

    public static PasteItemResult failed(String sourcePath, String targetPath, UUID nodeId, int ordinal, Throwable error) {
        return PasteItemResult.builder()
            .sourcePath(sourcePath)
            .targetPath(targetPath)
            .nodeId(nodeId)
            .reservedOrdinal(ordinal)
            .success(false)
            .errorMessage(error.getMessage())
            .errorType(error.getClass().getSimpleName())
            .error(error)
            .build();
    }
}
