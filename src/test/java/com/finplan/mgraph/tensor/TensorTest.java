package com.finplan.mgraph.tensor;

import com.finplan.mgraph.error.ShapeException;
import org.junit.Test;

import static org.junit.Assert.*;

public class TensorTest {
    private static final double EPS = 1e-12;

    @Test
    public void testZerosAndScalar() {
        Tensor t = Tensor.zeros(2, 3);
        assertEquals(2, t.rank());
        assertEquals(6, t.size());
        assertEquals(0.0, t.sum(), EPS);

        Tensor s = Tensor.scalar(4.5);
        assertTrue(s.isScalar());
        assertEquals(4.5, s.scalarValue(), EPS);
    }

    @Test
    public void testSameShapeCombine() {
        Tensor a = Tensor.of(new int[] { 2, 2 }, new double[] { 1, 2, 3, 4 });
        Tensor b = Tensor.of(new int[] { 2, 2 }, new double[] { 10, 20, 30, 40 });
        Tensor c = Tensor.combine(a, b, Double::sum);
        assertArrayEquals(new double[] { 11, 22, 33, 44 }, c.data(), EPS);
    }

    @Test
    public void testScalarCombineKeepsShape() {
        Tensor a = Tensor.of(new int[] { 3 }, new double[] { 1, 2, 3 });
        Tensor c = Tensor.combine(Tensor.scalar(10), a, (x, y) -> x - y);
        assertArrayEquals(new int[] { 3 }, c.shape());
        assertArrayEquals(new double[] { 9, 8, 7 }, c.data(), EPS);
    }

    @Test
    public void testTrailingAxisBroadcast() {
        Tensor a = Tensor.of(new int[] { 2, 3 }, new double[] { 1, 2, 3, 4, 5, 6 });
        Tensor b = Tensor.of(new int[] { 3 }, new double[] { 10, 20, 30 });
        Tensor c = Tensor.combine(a, b, Double::sum);
        assertArrayEquals(new int[] { 2, 3 }, c.shape());
        assertArrayEquals(new double[] { 11, 22, 33, 14, 25, 36 }, c.data(), EPS);
    }

    @Test
    public void testSizeOneAxesStretchBothWays() {
        // [2,1] * [1,3] -> [2,3] outer product
        Tensor col = Tensor.of(new int[] { 2, 1 }, new double[] { 1, 2 });
        Tensor row = Tensor.of(new int[] { 1, 3 }, new double[] { 1, 10, 100 });
        Tensor c = Tensor.combine(col, row, (x, y) -> x * y);
        assertArrayEquals(new int[] { 2, 3 }, c.shape());
        assertArrayEquals(new double[] { 1, 10, 100, 2, 20, 200 }, c.data(), EPS);
    }

    @Test(expected = ShapeException.class)
    public void testIncompatibleShapes() {
        Tensor.combine(Tensor.zeros(2, 3), Tensor.zeros(4), Double::sum);
    }

    @Test
    public void testPermute() {
        Tensor t = Tensor.of(new int[] { 2, 3 }, new double[] { 0, 1, 2, 3, 4, 5 });
        Tensor p = t.permute(1, 0);
        assertArrayEquals(new int[] { 3, 2 }, p.shape());
        assertArrayEquals(new double[] { 0, 3, 1, 4, 2, 5 }, p.data(), EPS);
    }

    @Test
    public void testReshapeSharesData() {
        Tensor t = Tensor.zeros(2, 3);
        Tensor r = t.reshape(6);
        r.set(4, 7.0);
        assertEquals(7.0, t.get(4), EPS);
    }

    @Test
    public void testBroadcastTo() {
        Tensor row = Tensor.of(new int[] { 1, 3 }, new double[] { 1, 2, 3 });
        Tensor b = row.broadcastTo(2, 3);
        assertArrayEquals(new double[] { 1, 2, 3, 1, 2, 3 }, b.data(), EPS);

        Tensor filled = Tensor.scalar(5).broadcastTo(2, 2);
        assertArrayEquals(new double[] { 5, 5, 5, 5 }, filled.data(), EPS);
    }

    @Test(expected = ShapeException.class)
    public void testBroadcastToSmallerShapeFails() {
        Tensor.zeros(2, 3).broadcastTo(3);
    }

    @Test
    public void testFillSlice() {
        Tensor t = Tensor.zeros(2, 3, 4);
        int written = t.fillSlice(new int[] { -1, 1, 2 }, 9.0);
        assertEquals(2, written);
        assertEquals(9.0, t.get(1 * 4 + 2), EPS);
        assertEquals(9.0, t.get(12 + 1 * 4 + 2), EPS);
        assertEquals(18.0, t.sum(), EPS);

        assertEquals(24, t.fillSlice(new int[] { -1, -1, -1 }, 1.0));
        assertEquals(24.0, t.sum(), EPS);
    }

    @Test(expected = ShapeException.class)
    public void testFillSliceOutOfRange() {
        Tensor.zeros(2, 3).fillSlice(new int[] { 2, -1 }, 1.0);
    }

    @Test
    public void testZeroNonFinite() {
        Tensor t = Tensor.of(new int[] { 4 }, new double[] { 1, Double.NaN, Double.POSITIVE_INFINITY, 2 });
        assertEquals(2, t.zeroNonFinite());
        assertArrayEquals(new double[] { 1, 0, 0, 2 }, t.data(), EPS);
    }

    @Test
    public void testCopyIsIndependent() {
        Tensor t = Tensor.zeros(3);
        Tensor c = t.copy();
        c.fill(1.0);
        assertEquals(0.0, t.sum(), EPS);
        assertEquals(3.0, c.sum(), EPS);
    }
}
