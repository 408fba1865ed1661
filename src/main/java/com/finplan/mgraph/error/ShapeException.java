package com.finplan.mgraph.error;

import java.util.Arrays;

/** Two tensors could not be aligned or broadcast against each other. */
public final class ShapeException extends EvaluationException {
    public ShapeException(String message) {
        super(ErrorKind.SHAPE, message);
    }

    public static ShapeException incompatible(int[] left, int[] right) {
        return new ShapeException("Shapes " + Arrays.toString(left) + " and " + Arrays.toString(right)
                + " cannot be broadcast together");
    }
}
