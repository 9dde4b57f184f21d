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

/**
 * Outcome of splitting a text file into several siblings.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class SplitResult {

    /**
     * The original file, now holding the first part
     */
    TreeNode source;

    /**
     * New files holding the remaining parts, in order
     */
    @Singular("createdNode")
    List<TreeNode> createdNodes;

    public int getPartCount() {
        return 1 + createdNodes.size();
    }
}
