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
package com.firefly.core.vfs.domain.model.result;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.firefly.core.vfs.domain.model.node.TreeNode;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Outcome of joining several text files into one.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class JoinResult {

    /**
     * The file that now holds the joined content
     */
    TreeNode survivor;

    /**
     * Number of files whose content was joined
     */
    int joinedCount;

    @Singular
    List<String> deletedNames;

    /**
     * Files that could not be deleted after the join, with the reason
     */
    @Singular
    Map<String, String> failedDeletes;

    public boolean isComplete() {
        return failedDeletes.isEmpty();
    }
}
