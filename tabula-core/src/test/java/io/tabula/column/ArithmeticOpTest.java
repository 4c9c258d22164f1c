package io.tabula.column;

import io.tabula.core.ErrorKind;
import io.tabula.core.TabulaException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArithmeticOpTest {

    @Test
    void longOperandsShouldStayIntegral() {
        NumericColumn result = ArithmeticOp.ADD.apply(LongColumn.of(1, 2), LongColumn.of(10, 20));

        assertThat(result).isEqualTo(LongColumn.of(11, 22));
        assertThat(ArithmeticOp.DIV.apply(LongColumn.of(7), LongColumn.of(2))).isEqualTo(LongColumn.of(3));
        assertThat(ArithmeticOp.REM.apply(LongColumn.of(7), LongColumn.of(2))).isEqualTo(LongColumn.of(1));
    }

    @Test
    void doubleOperandShouldWidenResult() {
        NumericColumn result = ArithmeticOp.MUL.apply(LongColumn.of(2, 3), DoubleColumn.of(0.5, 2.0));

        assertThat(result).isEqualTo(DoubleColumn.of(1.0, 6.0));
    }

    @Test
    void broadcastShouldFollowScalarType() {
        assertThat(ArithmeticOp.SUB.broadcast(LongColumn.of(5, 6), 1)).isEqualTo(LongColumn.of(4, 5));
        assertThat(ArithmeticOp.DIV.broadcast(LongColumn.of(5), 2.0)).isEqualTo(DoubleColumn.of(2.5));
    }

    @Test
    void integralDivisionByZeroShouldThrow() {
        assertThatThrownBy(() -> ArithmeticOp.DIV.broadcast(LongColumn.of(1), 0))
                .isInstanceOf(ArithmeticException.class);
        assertThat(ArithmeticOp.DIV.broadcast(DoubleColumn.of(1.0), 0).getDouble(0)).isInfinite();
    }

    @Test
    void nonNumericOperandShouldFail() {
        assertThatThrownBy(() -> ArithmeticOp.ADD.apply(StringColumn.of("a"), LongColumn.of(1)))
                .isInstanceOfSatisfying(TabulaException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.DTYPE_MISMATCH));
    }

    @Test
    void operandsShouldHaveEqualSize() {
        assertThatThrownBy(() -> ArithmeticOp.ADD.apply(LongColumn.of(1), LongColumn.of(1, 2)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
