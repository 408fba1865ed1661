package com.finplan.mgraph.tensor;

import com.finplan.mgraph.error.ShapeException;

import java.util.Arrays;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Dense row-major array of doubles with an explicit shape.
 *
 * <p>
 * This is the storage backing one metric across its dimensions and the time
 * horizon (time is always the last axis), and also the value type flowing
 * through compiled formulas. Rank-0 tensors are scalars (formula constants).
 *
 * <h3>Broadcasting</h3>
 * Element-wise operations follow the usual trailing-axis rules: shapes are
 * right-aligned, and an axis of length 1 stretches to match the other
 * operand. Same-shape and scalar operands take a straight loop; everything else
 * walks both operands with zero strides on stretched axes, so no intermediate
 * expanded copies are made.
 */
public final class Tensor {
    private static final int[] SCALAR_SHAPE = new int[0];

    private final int[] shape;
    private final double[] data;

    private Tensor(int[] shape, double[] data) {
        this.shape = shape;
        this.data = data;
    }

    public static Tensor zeros(int... shape) {
        int[] s = shape.clone();
        return new Tensor(s, new double[elementCount(s)]);
    }

    public static Tensor scalar(double value) {
        return new Tensor(SCALAR_SHAPE, new double[] { value });
    }

    /** Wraps an existing array; the array is not copied. */
    public static Tensor of(int[] shape, double[] data) {
        int[] s = shape.clone();
        if (elementCount(s) != data.length)
            throw new ShapeException("Shape " + Arrays.toString(s) + " needs " + elementCount(s)
                    + " elements, got " + data.length);
        return new Tensor(s, data);
    }

    public int rank() {
        return shape.length;
    }

    public int[] shape() {
        return shape.clone();
    }

    public int dim(int axis) {
        return shape[axis];
    }

    public int size() {
        return data.length;
    }

    public boolean isScalar() {
        return shape.length == 0;
    }

    public double scalarValue() {
        if (data.length != 1)
            throw new ShapeException("Tensor of shape " + Arrays.toString(shape) + " is not a scalar");
        return data[0];
    }

    public boolean hasShape(int[] other) {
        return Arrays.equals(shape, other);
    }

    /**
     * Live backing array in row-major order. Writers must own the tensor (the
     * scheduler for calculated metrics, coordinate writes for inputs).
     */
    public double[] data() {
        return data;
    }

    public double get(int flatIndex) {
        return data[flatIndex];
    }

    public void set(int flatIndex, double value) {
        data[flatIndex] = value;
    }

    public void fill(double value) {
        Arrays.fill(data, value);
    }

    /**
     * Writes {@code value} into every cell whose index matches {@code fixed} on
     * the axes where {@code fixed[axis] >= 0}; axes marked -1 are written in
     * full.
     *
     * @return number of cells written
     */
    public int fillSlice(int[] fixed, double value) {
        if (fixed.length != shape.length)
            throw new ShapeException("Slice " + Arrays.toString(fixed) + " does not match rank " + shape.length);
        if (data.length == 0)
            return 0;
        int rank = shape.length;
        int[] strides = strides(shape);
        int[] idx = new int[rank];
        int base = 0;
        for (int ax = 0; ax < rank; ax++) {
            if (fixed[ax] >= shape[ax])
                throw new ShapeException("Index " + fixed[ax] + " out of range for axis " + ax + " of "
                        + Arrays.toString(shape));
            if (fixed[ax] >= 0)
                base += fixed[ax] * strides[ax];
        }
        int written = 0;
        while (true) {
            int flat = base;
            for (int ax = 0; ax < rank; ax++)
                if (fixed[ax] < 0)
                    flat += idx[ax] * strides[ax];
            data[flat] = value;
            written++;

            int ax = rank - 1;
            for (; ax >= 0; ax--) {
                if (fixed[ax] >= 0)
                    continue;
                if (++idx[ax] < shape[ax])
                    break;
                idx[ax] = 0;
            }
            if (ax < 0)
                return written;
        }
    }

    /** Copies values from a tensor with the same element count. */
    public void copyFrom(Tensor src) {
        if (src.data.length != data.length)
            throw ShapeException.incompatible(src.shape, shape);
        System.arraycopy(src.data, 0, data, 0, data.length);
    }

    public Tensor copy() {
        return new Tensor(shape, data.clone());
    }

    public double sum() {
        double s = 0;
        for (double v : data)
            s += v;
        return s;
    }

    /**
     * Replaces NaN and infinite cells with zero.
     *
     * @return number of cells replaced
     */
    public int zeroNonFinite() {
        int replaced = 0;
        for (int i = 0; i < data.length; i++) {
            if (!Double.isFinite(data[i])) {
                data[i] = 0.0;
                replaced++;
            }
        }
        return replaced;
    }

    /** Same data, new shape. The element count must match. */
    public Tensor reshape(int... newShape) {
        if (elementCount(newShape) != data.length)
            throw new ShapeException("Cannot reshape " + Arrays.toString(shape) + " to " + Arrays.toString(newShape));
        return new Tensor(newShape.clone(), data);
    }

    /** Returns a copy whose axis {@code i} is this tensor's axis {@code axes[i]}. */
    public Tensor permute(int... axes) {
        if (axes.length != shape.length)
            throw new ShapeException("Permutation " + Arrays.toString(axes) + " does not match rank " + shape.length);
        int rank = shape.length;
        int[] srcStrides = strides(shape);
        int[] outShape = new int[rank];
        int[] walk = new int[rank];
        for (int i = 0; i < rank; i++) {
            outShape[i] = shape[axes[i]];
            walk[i] = srcStrides[axes[i]];
        }
        double[] out = new double[data.length];
        int[] idx = new int[rank];
        int src = 0;
        for (int k = 0; k < out.length; k++) {
            out[k] = data[src];
            for (int ax = rank - 1; ax >= 0; ax--) {
                idx[ax]++;
                src += walk[ax];
                if (idx[ax] < outShape[ax])
                    break;
                src -= walk[ax] * outShape[ax];
                idx[ax] = 0;
            }
        }
        return new Tensor(outShape, out);
    }

    /** Materializes this tensor stretched to {@code target}. */
    public Tensor broadcastTo(int... target) {
        if (Arrays.equals(shape, target))
            return copy();
        int[] out = broadcastShape(shape, target);
        if (!Arrays.equals(out, target))
            throw ShapeException.incompatible(shape, target);
        if (data.length == 1) {
            Tensor t = zeros(target);
            t.fill(data[0]);
            return t;
        }
        int rank = target.length;
        int[] walk = broadcastStrides(shape, target);
        double[] result = new double[elementCount(target)];
        int[] idx = new int[rank];
        int src = 0;
        for (int k = 0; k < result.length; k++) {
            result[k] = data[src];
            for (int ax = rank - 1; ax >= 0; ax--) {
                idx[ax]++;
                src += walk[ax];
                if (idx[ax] < target[ax])
                    break;
                src -= walk[ax] * target[ax];
                idx[ax] = 0;
            }
        }
        return new Tensor(target.clone(), result);
    }

    public Tensor map(DoubleUnaryOperator op) {
        double[] out = new double[data.length];
        for (int i = 0; i < out.length; i++)
            out[i] = op.applyAsDouble(data[i]);
        return new Tensor(shape, out);
    }

    /** Element-wise {@code op(a, b)} with broadcasting. */
    public static Tensor combine(Tensor a, Tensor b, DoubleBinaryOperator op) {
        final double[] ad = a.data, bd = b.data;
        if (Arrays.equals(a.shape, b.shape)) {
            double[] out = new double[ad.length];
            for (int i = 0; i < out.length; i++)
                out[i] = op.applyAsDouble(ad[i], bd[i]);
            return new Tensor(a.shape, out);
        }
        if (bd.length == 1 && b.shape.length <= a.shape.length) {
            double bv = bd[0];
            double[] out = new double[ad.length];
            for (int i = 0; i < out.length; i++)
                out[i] = op.applyAsDouble(ad[i], bv);
            return new Tensor(a.shape, out);
        }
        if (ad.length == 1 && a.shape.length <= b.shape.length) {
            double av = ad[0];
            double[] out = new double[bd.length];
            for (int i = 0; i < out.length; i++)
                out[i] = op.applyAsDouble(av, bd[i]);
            return new Tensor(b.shape, out);
        }

        int[] outShape = broadcastShape(a.shape, b.shape);
        int rank = outShape.length;
        int[] wa = broadcastStrides(a.shape, outShape);
        int[] wb = broadcastStrides(b.shape, outShape);
        double[] out = new double[elementCount(outShape)];
        int[] idx = new int[rank];
        int ia = 0, ib = 0;
        for (int k = 0; k < out.length; k++) {
            out[k] = op.applyAsDouble(ad[ia], bd[ib]);
            for (int ax = rank - 1; ax >= 0; ax--) {
                idx[ax]++;
                ia += wa[ax];
                ib += wb[ax];
                if (idx[ax] < outShape[ax])
                    break;
                ia -= wa[ax] * outShape[ax];
                ib -= wb[ax] * outShape[ax];
                idx[ax] = 0;
            }
        }
        return new Tensor(outShape, out);
    }

    /** Result shape of broadcasting {@code a} against {@code b}. */
    public static int[] broadcastShape(int[] a, int[] b) {
        int rank = Math.max(a.length, b.length);
        int[] out = new int[rank];
        for (int i = 0; i < rank; i++) {
            int da = i < rank - a.length ? 1 : a[i - (rank - a.length)];
            int db = i < rank - b.length ? 1 : b[i - (rank - b.length)];
            if (da != db && da != 1 && db != 1)
                throw ShapeException.incompatible(a, b);
            out[i] = Math.max(da, db);
        }
        return out;
    }

    public static int elementCount(int[] shape) {
        int n = 1;
        for (int d : shape)
            n *= d;
        return n;
    }

    static int[] strides(int[] shape) {
        int[] s = new int[shape.length];
        int acc = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            s[i] = acc;
            acc *= shape[i];
        }
        return s;
    }

    // Strides of 'src' viewed in 'target' rank; stretched axes walk with stride 0.
    private static int[] broadcastStrides(int[] src, int[] target) {
        int rank = target.length;
        int offset = rank - src.length;
        int[] srcStrides = strides(src);
        int[] walk = new int[rank];
        for (int i = offset; i < rank; i++) {
            int s = src[i - offset];
            walk[i] = s == 1 ? 0 : srcStrides[i - offset];
        }
        return walk;
    }

    @Override
    public String toString() {
        return "Tensor" + Arrays.toString(shape) + (data.length <= 16 ? Arrays.toString(data) : "");
    }
}
