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
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-item report of a multi-item paste or move.
 *
 * <p>Pastes are best-effort: items are processed in order and a failing item does not stop
 * the rest. The report names every failed item with its reason, and
 * {@code CrossFolderMoveOrchestrator#retryFailed(PasteResult)} can be used to retry just
 * those items.</p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class PasteResult {

    String targetFolder;

    /**
     * First ordinal of the reserved range in the target folder
     */
    int insertOrdinal;

    @Singular
    List<PasteItemResult> items;

    public int getPastedCount() {
        return (int) items.stream().filter(PasteItemResult::isSuccess).count();
    }

    public int getTotalItems() {
        return items.size();
    }

    /**
     * True when every item was pasted.
     */
    @JsonIgnore
    public boolean isComplete() {
        return getPastedCount() == getTotalItems();
    }

    /**
     * True when at least one item was pasted.
     */
    @JsonIgnore
    public boolean isSuccess() {
        return getPastedCount() > 0;
    }

    @JsonIgnore
    public List<PasteItemResult> getFailedItems() {
        return items.stream().filter(item -> !item.isSuccess()).collect(Collectors.toList());
    }

    public String getMessage() {
        return "Successfully pasted " + getPastedCount() + " of " + getTotalItems() + " items";
    }
}
