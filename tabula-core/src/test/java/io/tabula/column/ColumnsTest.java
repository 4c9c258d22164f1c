package io.tabula.column;

import io.tabula.core.ErrorKind;
import io.tabula.core.TabulaException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColumnsTest {

    @Test
    @DisplayName("Should infer column type from boxed values")
    void shouldInferColumnType() {
        assertThat(Columns.fromValues(List.of(1, 2L))).isEqualTo(LongColumn.of(1, 2));
        assertThat(Columns.fromValues(List.of(1.5, 2.5))).isEqualTo(DoubleColumn.of(1.5, 2.5));
        assertThat(Columns.fromValues(List.of(true, false))).isEqualTo(BooleanColumn.of(true, false));
        assertThat(Columns.fromValues(List.of("a", "b"))).isEqualTo(StringColumn.of("a", "b"));
    }

    @Test
    void doubleColumnShouldWidenIntegralValues() {
        Column column = Columns.fromValues(List.of(1, 2.5f, 3L), DType.DOUBLE);

        assertThat(column).isEqualTo(DoubleColumn.of(1.0, 2.5, 3.0));
    }

    @Test
    void longColumnShouldRejectFloatingValues() {
        assertThatThrownBy(() -> Columns.fromValues(List.of(1L, 2.5), DType.LONG))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("position 1");
    }

    @Test
    void shouldRejectNullsAndUnsupportedTypes() {
        assertThatThrownBy(() -> Columns.fromValues(Arrays.asList(1L, null), DType.LONG))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("value required at position 1");
        assertThatThrownBy(() -> Columns.fromValues(List.of(new Object())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported value type");
        assertThatThrownBy(() -> Columns.fromValues(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyValuesShouldGiveEmptyColumnOfRequestedType() {
        assertThat(Columns.fromValues(List.of(), DType.STRING)).isEqualTo(Columns.empty(DType.STRING));
        assertThat(Columns.empty(DType.BOOL).size()).isZero();
    }

    @Test
    void inferDTypeShouldWidenMixedNumbers() {
        assertThat(Columns.inferDType(List.of(1L, 2L), DType.BOOL)).isEqualTo(DType.LONG);
        assertThat(Columns.inferDType(List.of(1L, 2.0), DType.BOOL)).isEqualTo(DType.DOUBLE);
        assertThat(Columns.inferDType(List.of(), DType.BOOL)).isEqualTo(DType.BOOL);
        assertThatThrownBy(() -> Columns.inferDType(List.of(1L, "a"), DType.LONG))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Gather should follow positions and allow repeats")
    void gatherShouldFollowPositions() {
        StringColumn column = StringColumn.of("a", "b", "c");

        assertThat(column.gatherUnchecked(new int[]{2, 0, 2}).toList()).containsExactly("c", "a", "c");
        assertThat(column.gatherUnchecked(new int[0]).size()).isZero();
    }

    @Test
    void appendShouldRequireSameDType() {
        LongColumn longs = LongColumn.of(1, 2);

        assertThat(longs.append(LongColumn.of(3))).isEqualTo(LongColumn.of(1, 2, 3));
        assertThatThrownBy(() -> longs.append(DoubleColumn.of(3.0)))
                .isInstanceOfSatisfying(TabulaException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.DTYPE_MISMATCH));
    }

    @Test
    void getShouldCheckBounds() {
        BooleanColumn column = BooleanColumn.of(true);

        assertThat(column.get(0)).isTrue();
        assertThatThrownBy(() -> column.get(1))
                .isInstanceOfSatisfying(TabulaException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.OUT_OF_BOUNDS));
    }

    @Test
    void factoriesShouldCopyInput() {
        long[] values = {1, 2};
        LongColumn column = LongColumn.of(values);
        values[0] = 99;

        assertThat(column.getLong(0)).isEqualTo(1L);
        assertThat(column.toLongArray()).containsExactly(1L, 2L);
        assertThatThrownBy(() -> StringColumn.of("a", null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void numericFlagShouldFollowDType() {
        assertThat(LongColumn.of().isNumeric()).isTrue();
        assertThat(DoubleColumn.of().isNumeric()).isTrue();
        assertThat(BooleanColumn.of().isNumeric()).isFalse();
        assertThat(StringColumn.of().isNumeric()).isFalse();
    }
}
