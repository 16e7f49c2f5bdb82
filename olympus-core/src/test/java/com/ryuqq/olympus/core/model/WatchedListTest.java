package com.ryuqq.olympus.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * WatchedList 테스트.
 *
 * @author Olympus Team
 * @since 1.0.0
 */
class WatchedListTest {

    static final class Tags extends WatchedList<String> {

        Tags(List<String> initial) {
            super(initial);
        }

        @Override
        protected boolean compare(String a, String b) {
            return a.equalsIgnoreCase(b);
        }
    }

    @Test
    void add_NewItem_IsTrackedAsAdded() {
        // Given
        Tags tags = new Tags(List.of("java"));

        // When
        tags.add("kotlin");

        // Then
        assertThat(tags.getItems()).containsExactly("java", "kotlin");
        assertThat(tags.getAddedItems()).containsExactly("kotlin");
        assertThat(tags.getRemovedItems()).isEmpty();
        assertThat(tags.getOriginalItems()).containsExactly("java");
    }

    @Test
    void add_ExistingItem_ChangesNothing() {
        // Given
        Tags tags = new Tags(List.of("java"));

        // When
        tags.add("JAVA");

        // Then
        assertThat(tags.getItems()).containsExactly("java");
        assertThat(tags.getAddedItems()).isEmpty();
    }

    @Test
    void remove_OriginalItem_IsTrackedAsRemoved() {
        // Given
        Tags tags = new Tags(List.of("java", "go"));

        // When
        tags.remove("go");
        tags.remove("go");

        // Then
        assertThat(tags.getItems()).containsExactly("java");
        assertThat(tags.getRemovedItems()).containsExactly("go");
    }

    @Test
    void remove_AddedItem_CancelsTheAddition() {
        // Given
        Tags tags = new Tags(List.of("java"));
        tags.add("rust");

        // When
        tags.remove("rust");

        // Then
        assertThat(tags.getItems()).containsExactly("java");
        assertThat(tags.getAddedItems()).isEmpty();
        assertThat(tags.getRemovedItems()).isEmpty();
    }

    @Test
    void add_RemovedOriginalItem_CancelsTheRemoval() {
        // Given
        Tags tags = new Tags(List.of("java", "go"));
        tags.remove("go");

        // When
        tags.add("go");

        // Then
        assertThat(tags.getItems()).containsExactlyInAnyOrder("java", "go");
        assertThat(tags.getRemovedItems()).isEmpty();
        assertThat(tags.getAddedItems()).isEmpty();
    }

    @Test
    void exists_UsesCompare() {
        Tags tags = new Tags(List.of("java"));

        assertThat(tags.exists("Java")).isTrue();
        assertThat(tags.exists("scala")).isFalse();
    }

    @Test
    void views_AreReadOnly() {
        Tags tags = new Tags(List.of("java"));

        assertThatThrownBy(() -> tags.getItems().add("x"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> tags.getAddedItems().add("x"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void constructor_NullInitial_ThrowsException() {
        assertThatThrownBy(() -> new Tags(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
