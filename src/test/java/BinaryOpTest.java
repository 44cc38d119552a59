import org.junit.jupiter.api.Test;

import com.numeval.expr.parser.BinaryOp;

import static org.junit.jupiter.api.Assertions.*;

public class BinaryOpTest {

    @Test
    void arithmetic() {
        assertEquals(5.0, BinaryOp.PLUS.apply(2, 3));
        assertEquals(-1.0, BinaryOp.MINUS.apply(2, 3));
        assertEquals(6.0, BinaryOp.MUL.apply(2, 3));
        assertEquals(2.5, BinaryOp.DIV.apply(5, 2));
        assertEquals(8.0, BinaryOp.EXP.apply(2, 3));
        assertEquals(3.0, BinaryOp.EXP.apply(9, 0.5));
        assertEquals(0.25, BinaryOp.EXP.apply(2, -2));
    }

    @Test
    void modulo_truncates_signFollowsDividend() {
        assertEquals(1.0, BinaryOp.MOD.apply(7, 3));
        assertEquals(-1.0, BinaryOp.MOD.apply(-7, 3));
        assertEquals(1.0, BinaryOp.MOD.apply(7, -3));
        assertEquals(1.5, BinaryOp.MOD.apply(5.5, 2));
        assertTrue(Double.isNaN(BinaryOp.MOD.apply(1, 0)));
    }

    @Test
    void division_byZero_followsIeee() {
        assertEquals(Double.POSITIVE_INFINITY, BinaryOp.DIV.apply(1, 0));
        assertEquals(Double.NEGATIVE_INFINITY, BinaryOp.DIV.apply(-1, 0));
        assertTrue(Double.isNaN(BinaryOp.DIV.apply(0, 0)));
    }

    @Test
    void comparisons_answerExactlyZeroOrOne() {
        BinaryOp[] cmps = { BinaryOp.LT, BinaryOp.LTE, BinaryOp.GT, BinaryOp.GTE, BinaryOp.EQ, BinaryOp.NE };
        double[][] pairs = { {1, 2}, {2, 1}, {2, 2}, {-0.0, 0.0}, {Double.NaN, 1}, {Double.NEGATIVE_INFINITY, 0} };
        for (BinaryOp op : cmps) {
            for (double[] p : pairs) {
                double r = op.apply(p[0], p[1]);
                assertTrue(r == 0.0 || r == 1.0, op + " on " + p[0] + ", " + p[1] + " gave " + r);
            }
        }

        assertEquals(1.0, BinaryOp.LT.apply(1, 2));
        assertEquals(0.0, BinaryOp.LT.apply(2, 2));
        assertEquals(1.0, BinaryOp.LTE.apply(2, 2));
        assertEquals(1.0, BinaryOp.GT.apply(3, 2));
        assertEquals(0.0, BinaryOp.GTE.apply(1, 2));
        assertEquals(1.0, BinaryOp.EQ.apply(-0.0, 0.0));
        assertEquals(0.0, BinaryOp.NE.apply(2, 2));
    }

    @Test
    void nanComparisons() {
        assertEquals(0.0, BinaryOp.EQ.apply(Double.NaN, Double.NaN));
        assertEquals(1.0, BinaryOp.NE.apply(Double.NaN, Double.NaN));
        assertEquals(0.0, BinaryOp.LT.apply(Double.NaN, 1));
        assertEquals(0.0, BinaryOp.GTE.apply(Double.NaN, 1));
    }

    @Test
    void or_returnsLeftWhenNonZero_elseRight() {
        assertEquals(5.0, BinaryOp.OR.apply(0, 5));
        assertEquals(3.0, BinaryOp.OR.apply(3, 5));
        assertEquals(-2.0, BinaryOp.OR.apply(-2, 5));
        assertEquals(0.0, BinaryOp.OR.apply(0, 0));
        // NaN is non-zero
        assertTrue(Double.isNaN(BinaryOp.OR.apply(Double.NaN, 5)));
    }

    @Test
    void and_returnsLeftWhenZero_elseRight() {
        assertEquals(0.0, BinaryOp.AND.apply(0, 5));
        assertEquals(5.0, BinaryOp.AND.apply(3, 5));
        assertEquals(0.0, BinaryOp.AND.apply(3, 0));
        assertEquals(7.0, BinaryOp.AND.apply(Double.NaN, 7));
    }

    @Test
    void nanPropagates() {
        assertTrue(Double.isNaN(BinaryOp.PLUS.apply(Double.NaN, 1)));
        assertTrue(Double.isNaN(BinaryOp.MUL.apply(Double.POSITIVE_INFINITY, 0)));
        assertEquals(1.0, BinaryOp.EXP.apply(Double.NaN, 0));
    }

    @Test
    void symbols() {
        assertEquals("^", BinaryOp.EXP.symbol());
        assertEquals("&&", BinaryOp.AND.toString());
        assertEquals(BinaryOp.Direction.RIGHT_TO_LEFT, BinaryOp.EXP.direction());
        assertEquals(BinaryOp.Direction.LEFT_TO_RIGHT, BinaryOp.MINUS.direction());
    }
}
