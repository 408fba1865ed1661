package com.finplan.mgraph.tensor;

import com.finplan.mgraph.error.ShapeException;

import java.util.Arrays;
import java.util.List;

/**
 * Brings a dependency tensor into the axis layout of the dependent metric so
 * that element-wise formula operations broadcast correctly.
 *
 * <p>
 * Precedence, first match wins:
 * <ol>
 * <li><b>Exact:</b> same declared dims and same shape, returned untouched.</li>
 * <li><b>Dimension expand:</b> every dependency dim is also a dependent dim.
 * Axes are permuted into the dependent's order and size-1 axes are inserted
 * for the dims the dependency does not vary over. Time stays last.</li>
 * <li><b>Uniform broadcast:</b> the dependency is a pure time series (every
 * non-time axis has length 1); it is stretched across all dependent axes.</li>
 * <li>Otherwise a {@link ShapeException} for the dependent node.</li>
 * </ol>
 */
public final class DimensionAligner {
    private DimensionAligner() {
    }

    public static Tensor align(Tensor dep, List<String> depDims, List<String> targetDims, int[] targetShape) {
        int[] depShape = dep.shape();
        if (depDims.equals(targetDims) && Arrays.equals(depShape, targetShape))
            return dep;

        int timeLen = depShape[depShape.length - 1];

        if (depShape.length == depDims.size() + 1 && targetDims.containsAll(depDims)) {
            int n = depDims.size();
            // dependency axes ordered by where their dim sits in the target
            Integer[] order = new Integer[n];
            for (int i = 0; i < n; i++)
                order[i] = i;
            Arrays.sort(order, (x, y) -> Integer.compare(
                    targetDims.indexOf(depDims.get(x)), targetDims.indexOf(depDims.get(y))));

            Tensor ordered = dep;
            boolean identity = true;
            int[] axes = new int[n + 1];
            for (int i = 0; i < n; i++) {
                axes[i] = order[i];
                identity &= order[i] == i;
            }
            axes[n] = n;
            if (!identity)
                ordered = dep.permute(axes);

            int[] expanded = new int[targetDims.size() + 1];
            for (int i = 0; i < targetDims.size(); i++) {
                int at = depDims.indexOf(targetDims.get(i));
                expanded[i] = at < 0 ? 1 : depShape[at];
            }
            expanded[targetDims.size()] = timeLen;
            return ordered.reshape(expanded);
        }

        if (isTimeSeries(depShape)) {
            int[] expanded = new int[targetDims.size() + 1];
            Arrays.fill(expanded, 1);
            expanded[targetDims.size()] = timeLen;
            return dep.reshape(expanded);
        }

        throw new ShapeException("Cannot align dependency dims " + depDims + " " + Arrays.toString(depShape)
                + " to dependent dims " + targetDims + " " + Arrays.toString(targetShape));
    }

    private static boolean isTimeSeries(int[] shape) {
        for (int i = 0; i < shape.length - 1; i++)
            if (shape[i] != 1)
                return false;
        return true;
    }
}
