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

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;
import java.util.UUID;

/**
 * Where new or moved nodes go among the children of a folder.
 *
 * <p>An anchored position ("after node X") resolves to {@code X.ordinal + 1}. Appending
 * resolves to {@code max + 1}, or {@code 0} for an empty folder. Inserting at the beginning
 * resolves to {@code 0}, after the existing children have been shifted out of the way.</p>
 *
 * @author Firefly Software Solutions Inc.
 * @version 1.0
 * @since 1.0
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InsertPosition {

    public enum Kind {
        BEGINNING,
        END,
        AFTER_NAME,
        AFTER_NODE,
        AFTER_ORDINAL
    }

    Kind kind;
    String anchorName;
    UUID anchorId;
    Integer anchorOrdinal;

    public static InsertPosition atBeginning() {
        return new InsertPosition(Kind.BEGINNING, null, null, null);
    }

    public static InsertPosition atEnd() {
        return new InsertPosition(Kind.END, null, null, null);
    }

    /**
     * Insert after the sibling with the given name.
     */
    public static InsertPosition after(String siblingName) {
        return new InsertPosition(Kind.AFTER_NAME, Objects.requireNonNull(siblingName, "siblingName"), null, null);
    }

    /**
     * Insert after the sibling with the given id.
     */
    public static InsertPosition afterNode(UUID siblingId) {
        return new InsertPosition(Kind.AFTER_NODE, null, Objects.requireNonNull(siblingId, "siblingId"), null);
    }

    /**
     * Insert after the given ordinal; {@code afterOrdinal(-1)} inserts at the beginning.
     */
    public static InsertPosition afterOrdinal(int ordinal) {
        return new InsertPosition(Kind.AFTER_ORDINAL, null, null, ordinal);
    }

    /**
     * Insert after the named sibling, or at the beginning when no name is given. This is how
     * paste and create behave when the user has not selected a node.
     */
    public static InsertPosition afterOrBeginning(String siblingName) {
        return siblingName == null || siblingName.isBlank() ? atBeginning() : after(siblingName);
    }

    public boolean isAnchored() {
        return kind == Kind.AFTER_NAME || kind == Kind.AFTER_NODE || kind == Kind.AFTER_ORDINAL;
    }

    @Override
    public String toString() {
        switch (kind) {
            case AFTER_NAME:
                return "after '" + anchorName + "'";
            case AFTER_NODE:
                return "after node " + anchorId;
            case AFTER_ORDINAL:
                return "after ordinal " + anchorOrdinal;
            case BEGINNING:
                return "at beginning";
            default:
                return "at end";
        }
    }
}
