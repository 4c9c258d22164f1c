package io.tabula.column;

/**
 * Element-wise binary arithmetic. Two {@code LONG} operands stay integral (Java semantics:
 * truncating division, division by zero throws); any {@code DOUBLE} operand makes the result
 * {@code DOUBLE}.
 */
public enum ArithmeticOp {
    ADD {
        @Override
        public long applyAsLong(long left, long right) {
            return left + right;
        }

        @Override
        public double applyAsDouble(double left, double right) {
            return left + right;
        }
    },
    SUB {
        @Override
        public long applyAsLong(long left, long right) {
            return left - right;
        }

        @Override
        public double applyAsDouble(double left, double right) {
            return left - right;
        }
    },
    MUL {
        @Override
        public long applyAsLong(long left, long right) {
            return left * right;
        }

        @Override
        public double applyAsDouble(double left, double right) {
            return left * right;
        }
    },
    DIV {
        @Override
        public long applyAsLong(long left, long right) {
            return left / right;
        }

        @Override
        public double applyAsDouble(double left, double right) {
            return left / right;
        }
    },
    REM {
        @Override
        public long applyAsLong(long left, long right) {
            return left % right;
        }

        @Override
        public double applyAsDouble(double left, double right) {
            return left % right;
        }
    };

    public abstract long applyAsLong(long left, long right);

    public abstract double applyAsDouble(double left, double right);

    /**
     * Combine two equally sized columns element by element.
     */
    public NumericColumn apply(Column left, Column right) {
        NumericColumn l = requireNumeric(left);
        NumericColumn r = requireNumeric(right);
        if (l.size() != r.size()) {
            throw new IllegalArgumentException("operands must have equal size");
        }
        int size = l.size();
        if (l instanceof LongColumn ll && r instanceof LongColumn rl) {
            long[] result = new long[size];
            for (int i = 0; i < size; i++) {
                result[i] = applyAsLong(ll.getLong(i), rl.getLong(i));
            }
            return new LongColumn(result);
        }
        double[] result = new double[size];
        for (int i = 0; i < size; i++) {
            result[i] = applyAsDouble(l.getDouble(i), r.getDouble(i));
        }
        return new DoubleColumn(result);
    }

    /**
     * Combine every element of {@code left} with the scalar {@code right}.
     */
    public NumericColumn broadcast(Column left, Number right) {
        NumericColumn l = requireNumeric(left);
        if (right == null) {
            throw new IllegalArgumentException("scalar required");
        }
        DType scalarType = Columns.dtypeOf(right);
        int size = l.size();
        if (l instanceof LongColumn ll && scalarType == DType.LONG) {
            long scalar = right.longValue();
            long[] result = new long[size];
            for (int i = 0; i < size; i++) {
                result[i] = applyAsLong(ll.getLong(i), scalar);
            }
            return new LongColumn(result);
        }
        double scalar = right.doubleValue();
        double[] result = new double[size];
        for (int i = 0; i < size; i++) {
            result[i] = applyAsDouble(l.getDouble(i), scalar);
        }
        return new DoubleColumn(result);
    }

    private static NumericColumn requireNumeric(Column column) {
        if (column == null) {
            throw new IllegalArgumentException("column required");
        }
        if (!(column instanceof NumericColumn numeric)) {
            throw Columns.dtypeMismatch(DType.DOUBLE, column.dtype());
        }
        return numeric;
    }
}
