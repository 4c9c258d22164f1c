package io.tabula.kernel;

import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntSelectionTest {

    @Test
    void shouldStartEmpty() {
        var selection = new IntSelection();
        assertThat(selection.size()).isZero();
        assertThat(selection.toIntArray()).isEmpty();
    }

    @Test
    void shouldKeepInsertionOrderAndDuplicates() {
        var selection = IntSelection.of(5, 1, 5, 3);
        assertThat(selection.toIntArray()).containsExactly(5, 1, 5, 3);
        assertThat(selection.get(2)).isEqualTo(5);
    }

    @Test
    void shouldGrowBeyondInitialCapacity() {
        var selection = new IntSelection(1);
        for (int i = 0; i < 100; i++) {
            selection.add(i);
        }
        assertThat(selection.size()).isEqualTo(100);
        assertThat(selection.get(99)).isEqualTo(99);
    }

    @Test
    void shouldRejectNegativePositions() {
        var selection = new IntSelection();
        assertThatThrownBy(() -> selection.add(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new IntSelection(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void enumeratorShouldVisitAllValues() {
        var selection = IntSelection.of(7, 8);
        IntEnumerator e = selection.enumerator();
        assertThat(e.nextInt()).isEqualTo(7);
        assertThat(e.nextInt()).isEqualTo(8);
        assertThat(e.hasNext()).isFalse();
        assertThatThrownBy(e::nextInt).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void copyShouldBeIndependent() {
        var selection = IntSelection.of(1);
        var copy = selection.copy();
        copy.add(2);
        assertThat(selection.toIntArray()).containsExactly(1);
        assertThat(copy.toIntArray()).containsExactly(1, 2);
    }

    @Test
    void getShouldRejectOutOfRangeIndex() {
        var selection = IntSelection.of(1);
        assertThatThrownBy(() -> selection.get(1))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
