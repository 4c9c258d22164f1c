package io.tabula.index;

import io.tabula.core.DuplicateLabelPolicy;
import io.tabula.core.ErrorKind;
import io.tabula.core.TabulaException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndexerTest {

    @Test
    @DisplayName("Should resolve unique labels to their positions")
    void shouldResolveUniqueLabels() {
        Indexer<String> indexer = Indexer.of("a", "b", "c");

        assertThat(indexer.size()).isEqualTo(3);
        assertThat(indexer.isUnique()).isTrue();
        assertThat(indexer.getLoc("b")).isEqualTo(1);
        assertThat(indexer.getLocs(List.of("c", "a"))).containsExactly(2, 0);
    }

    @Test
    @DisplayName("getLocs should return every position of a duplicated label")
    void getLocsShouldExpandDuplicates() {
        Indexer<String> indexer = Indexer.of("x", "y", "x", "z");

        assertThat(indexer.isUnique()).isFalse();
        assertThat(indexer.positionsOf("x")).containsExactly(0, 2);
        assertThat(indexer.getLocs(List.of("z", "x"))).containsExactly(3, 0, 2);
    }

    @Test
    void firstPolicyShouldPickEarliestPosition() {
        Indexer<String> indexer = Indexer.of("x", "y", "x");

        assertThat(indexer.getLocs(List.of("x", "y"), DuplicateLabelPolicy.FIRST)).containsExactly(0, 1);
    }

    @Test
    void rejectPolicyShouldFailOnDuplicate() {
        Indexer<String> indexer = Indexer.of("x", "y", "x");

        assertThat(indexer.getLocs(List.of("y"), DuplicateLabelPolicy.REJECT)).containsExactly(1);
        assertThatThrownBy(() -> indexer.getLocs(List.of("x"), DuplicateLabelPolicy.REJECT))
                .isInstanceOfSatisfying(TabulaException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.AMBIGUOUS_LABEL));
    }

    @Test
    void getLocShouldRejectDuplicatedLabel() {
        Indexer<String> indexer = Indexer.of("x", "x");

        assertThatThrownBy(() -> indexer.getLoc("x"))
                .isInstanceOf(TabulaException.class)
                .hasMessageContaining("matches 2 positions");
    }

    @Test
    @DisplayName("Unknown labels should fail with UNKNOWN_LABEL")
    void unknownLabelShouldFail() {
        Indexer<String> indexer = Indexer.of("a");

        assertThatThrownBy(() -> indexer.getLoc("q"))
                .isInstanceOfSatisfying(TabulaException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.UNKNOWN_LABEL));
        assertThatThrownBy(() -> indexer.getLocs(List.of("a", "q")))
                .isInstanceOf(TabulaException.class)
                .hasMessageContaining("label not found: q");
        assertThat(indexer.contains("q")).isFalse();
        assertThat(indexer.contains(null)).isFalse();
    }

    @Test
    void rangeShouldLabelPositions() {
        Indexer<Integer> indexer = Indexer.range(4);

        assertThat(indexer.labels()).containsExactly(0, 1, 2, 3);
        assertThat(indexer.getLoc(3)).isEqualTo(3);
        assertThat(Indexer.range(0).isEmpty()).isTrue();
    }

    @Test
    void reindexShouldFollowPositions() {
        Indexer<String> indexer = Indexer.of("a", "b", "c");

        Indexer<String> reindexed = indexer.reindex(new int[]{2, 2, 0});

        assertThat(reindexed.labels()).containsExactly("c", "c", "a");
        assertThat(reindexed.positionsOf("c")).containsExactly(0, 1);
        assertThat(indexer.labels()).containsExactly("a", "b", "c");
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 3, 100})
    void reindexShouldRejectInvalidPositions(int position) {
        Indexer<String> indexer = Indexer.of("a", "b", "c");

        assertThatThrownBy(() -> indexer.reindex(new int[]{0, position}))
                .isInstanceOfSatisfying(TabulaException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.OUT_OF_BOUNDS));
    }

    @Test
    void appendShouldConcatenateLabels() {
        Indexer<String> combined = Indexer.of("a", "b").append(Indexer.of("b", "c"));

        assertThat(combined.labels()).containsExactly("a", "b", "b", "c");
        assertThat(combined.positionsOf("b")).containsExactly(1, 2);
    }

    @Test
    @DisplayName("push should extend the lookup without touching copies")
    void pushShouldNotAffectCopies() {
        Indexer<String> indexer = Indexer.of("a");
        Indexer<String> copy = indexer.copy();

        indexer.push("b");
        indexer.push("a");

        assertThat(indexer.getLocs(List.of("a"))).containsExactly(0, 2);
        assertThat(copy.labels()).containsExactly("a");
        assertThat(copy.contains("b")).isFalse();
        assertThatThrownBy(() -> indexer.push(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void labelShouldRejectOutOfRangePosition() {
        Indexer<String> indexer = Indexer.of("a");

        assertThat(indexer.label(0)).isEqualTo("a");
        assertThatThrownBy(() -> indexer.label(1))
                .isInstanceOf(TabulaException.class)
                .hasMessageContaining("position out of range: 1");
    }

    @Test
    void equalityShouldFollowLabelSequence() {
        assertThat(Indexer.of("a", "b")).isEqualTo(new Indexer<>(List.of("a", "b")));
        assertThat(Indexer.of("a", "b")).hasSameHashCodeAs(Indexer.of("a", "b"));
        assertThat(Indexer.of("a", "b")).isNotEqualTo(Indexer.of("b", "a"));
        assertThat(Indexer.of("a").toString()).isEqualTo("Indexer[a]");
    }

    @Test
    void labelsViewShouldBeReadOnly() {
        Indexer<String> indexer = Indexer.of("a");

        assertThatThrownBy(() -> indexer.labels().add("b"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("A read-only view should follow its source and reject push")
    void readOnlyViewShouldRejectPush() {
        Indexer<String> indexer = Indexer.of("a", "b");
        Indexer<String> view = indexer.readOnlyView();

        assertThatThrownBy(() -> view.push("c")).isInstanceOf(IllegalStateException.class);
        assertThat(view.readOnlyView()).isSameAs(view);
        assertThat(view).isEqualTo(indexer);

        indexer.push("c");

        assertThat(view.labels()).containsExactly("a", "b", "c");
        assertThat(view.getLoc("c")).isEqualTo(2);
    }

    @Test
    void positionsOfShouldReturnCopy() {
        Indexer<String> indexer = Indexer.of("x", "y", "x");

        indexer.positionsOf("x")[0] = 1;

        assertThat(indexer.positionsOf("x")).containsExactly(0, 2);
        assertThat(indexer.getLocs(List.of("x"))).containsExactly(0, 2);
    }
}
