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
package com.firefly.vfs.adapter.memory;

import com.firefly.core.vfs.domain.model.node.TreeNode;
import com.firefly.core.vfs.domain.model.result.JoinResult;
import com.firefly.core.vfs.domain.model.result.SplitResult;
import com.firefly.core.vfs.exception.InvalidOperationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static com.firefly.core.vfs.testing.OrdinalAssertions.assertCommittedOrder;
import static com.firefly.core.vfs.testing.OrdinalAssertions.namesInOrder;
import static com.firefly.core.vfs.testing.OrdinalAssertions.ordinalsByName;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Join and split against the in-memory store.
 */
class StructuralTransformScenariosTest {

    private FlakyNodeStore store;
    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        store = new FlakyNodeStore();
        fixture = new EngineFixture(store);
        fixture.folder("/", "book", 0);
    }

    @Test
    void join_ShouldMergeIntoLowestOrdinalInSiblingOrder() {
        // Given
        fixture.file("/book", "b.md", 1, "Second");
        fixture.file("/book", "a.md", 0, "First");
        fixture.file("/book", "c.md", 2, "Third");
        fixture.file("/book", "d.md", 3, "Untouched");

        // When
        JoinResult result = fixture.transforms.join("/book", List.of("c.md", "a.md", "b.md")).block();

        // Then
        assertThat(result.isComplete()).isTrue();
        assertThat(result.getJoinedCount()).isEqualTo(3);
        assertThat(result.getSurvivor().getName()).isEqualTo("a.md");
        assertThat(result.getDeletedNames()).containsExactly("b.md", "c.md");
        assertThat(fixture.text("/book/a.md")).isEqualTo("First\n\nSecond\n\nThird");
        assertThat(ordinalsByName(store, "/book")).containsExactly(entry("a.md", 0), entry("d.md", 3));
    }

    @Test
    void join_ShouldReportFilesThatCouldNotBeDeleted() {
        fixture.files("/book", "a.md", "b.md", "c.md");
        store.failDeletesOf("/book/b.md");

        JoinResult result = fixture.transforms.join("/book", List.of("a.md", "b.md", "c.md")).block();

        assertThat(result.isComplete()).isFalse();
        assertThat(result.getFailedDeletes()).containsOnlyKeys("b.md");
        assertThat(result.getDeletedNames()).containsExactly("c.md");
        assertThat(namesInOrder(store, "/book")).containsExactly("a.md", "b.md");
    }

    @Test
    void join_ShouldRejectSingleFileAndNonTextFiles() {
        fixture.files("/book", "a.md");
        fixture.folder("/book", "sub", 1);

        StepVerifier.create(fixture.transforms.join("/book", List.of("a.md")))
            .expectError(InvalidOperationException.class)
            .verify();
        StepVerifier.create(fixture.transforms.join("/book", List.of("a.md", "sub")))
            .expectError(InvalidOperationException.class)
            .verify();
        assertThat(fixture.text("/book/a.md")).isEqualTo("Content of a.md");
    }

    @Test
    void split_ShouldPlaceSecondPartRightAfterSource() {
        // Given
        fixture.file("/book", "intro.md", 0, "Intro");
        fixture.file("/book", "notes.md", 1, "Hello World");
        fixture.file("/book", "outro.md", 2, "Outro");

        // When
        SplitResult result = fixture.transforms.split("/book", "notes.md", 5).block();

        // Then
        assertThat(result.getPartCount()).isEqualTo(2);
        assertThat(result.getCreatedNodes()).extracting(TreeNode::getName).containsExactly("notes-1.md");
        assertCommittedOrder(store, "/book", "intro.md", "notes.md", "notes-1.md", "outro.md");
        assertThat(fixture.text("/book/notes.md")).isEqualTo("Hello");
        assertThat(fixture.text("/book/notes-1.md")).isEqualTo(" World");
    }

    @Test
    void split_ShouldRejectOffsetOutsideContent() {
        fixture.file("/book", "notes.md", 0, "Hello");

        StepVerifier.create(fixture.transforms.split("/book", "notes.md", 0))
            .expectError(InvalidOperationException.class)
            .verify();
        StepVerifier.create(fixture.transforms.split("/book", "notes.md", 5))
            .expectError(InvalidOperationException.class)
            .verify();
        assertThat(namesInOrder(store, "/book")).containsExactly("notes.md");
    }

    @Test
    void splitOnDelimiter_ShouldCreateTrimmedPartsWithFreeNames() {
        fixture.file("/book", "notes.md", 0, "One\n~\n Two \n~\nThree");
        fixture.file("/book", "notes-1.md", 1, "Existing");

        SplitResult result = fixture.transforms.splitOnDelimiter("/book", "notes.md").block();

        assertThat(result.getCreatedNodes()).extracting(TreeNode::getName)
            .containsExactly("notes-2.md", "notes-3.md");
        assertCommittedOrder(store, "/book", "notes.md", "notes-2.md", "notes-3.md", "notes-1.md");
        assertThat(fixture.text("/book/notes.md")).isEqualTo("One");
        assertThat(fixture.text("/book/notes-2.md")).isEqualTo("Two");
        assertThat(fixture.text("/book/notes-3.md")).isEqualTo("Three");
    }

    @Test
    void saveAndSplit_ShouldOnlySaveWithoutDelimiter() {
        fixture.file("/book", "notes.md", 0, "Old");

        SplitResult result = fixture.transforms.saveAndSplit("/book", "notes.md", "New text").block();

        assertThat(result.getPartCount()).isEqualTo(1);
        assertThat(fixture.text("/book/notes.md")).isEqualTo("New text");
        assertThat(namesInOrder(store, "/book")).containsExactly("notes.md");
    }

    @Test
    void saveAndSplit_ShouldSplitSavedContent() {
        fixture.file("/book", "notes.md", 0, "Old");

        SplitResult result = fixture.transforms.saveAndSplit("/book", "notes.md", "Part A\n~\nPart B").block();

        assertThat(result.getPartCount()).isEqualTo(2);
        assertThat(fixture.text("/book/notes.md")).isEqualTo("Part A");
        assertThat(fixture.text("/book/notes-1.md")).isEqualTo("Part B");
    }

    @Test
    void joinAndSplit_ShouldRejectNamesOutsideFolder() {
        fixture.files("/book", "a.md");
        fixture.file("/", "outside.md", 1, "Outside");

        StepVerifier.create(fixture.transforms.join("/book", List.of("a.md", "../outside.md")))
            .expectError(InvalidOperationException.class)
            .verify();
        StepVerifier.create(fixture.transforms.splitOnDelimiter("/book", "../outside.md"))
            .expectError(InvalidOperationException.class)
            .verify();

        assertThat(fixture.text("/book/a.md")).isEqualTo("Content of a.md");
        assertThat(fixture.text("/outside.md")).isEqualTo("Outside");
        assertThat(namesInOrder(store, "/")).containsExactly("book", "outside.md");
    }
}
