package com.numeval.expr.parser;

import static com.numeval.expr.parser.BinaryOp.AND;
import static com.numeval.expr.parser.BinaryOp.DIV;
import static com.numeval.expr.parser.BinaryOp.EQ;
import static com.numeval.expr.parser.BinaryOp.EXP;
import static com.numeval.expr.parser.BinaryOp.GT;
import static com.numeval.expr.parser.BinaryOp.GTE;
import static com.numeval.expr.parser.BinaryOp.LT;
import static com.numeval.expr.parser.BinaryOp.LTE;
import static com.numeval.expr.parser.BinaryOp.MINUS;
import static com.numeval.expr.parser.BinaryOp.MOD;
import static com.numeval.expr.parser.BinaryOp.MUL;
import static com.numeval.expr.parser.BinaryOp.NE;
import static com.numeval.expr.parser.BinaryOp.OR;
import static com.numeval.expr.parser.BinaryOp.PLUS;

import java.util.List;

import com.numeval.debug.Debug;

/**
 * Collapses resolved operand values and their operators into one number.
 *
 * One pass per operator, in {@link #REDUCTION_ORDER}. Each collapse replaces
 * vals[i] with op(vals[i], vals[i+1]) and drops vals[i+1] and ops[i], so
 * vals.size() == ops.size() + 1 holds throughout and every collapse shrinks
 * both lists by one.
 *
 * Why the scan direction matters:
 *   2^3^4   right-to-left gives 2^(3^4), not (2^3)^4 = 4096
 *   6-5-4-3 left-to-right gives -6, not 6-(5-(4-3)) = 0
 * Addition and multiplication scan right-to-left; the result is the same as
 * left-to-right up to floating rounding, and the order is kept as is.
 */
public final class ExpressionReducer {

    private static final String TAG = "numeval.reduce";

    public static final List<BinaryOp> REDUCTION_ORDER = List.of(
            EXP, MOD, DIV, MUL, MINUS, PLUS,
            LT, GT, LTE, GTE, EQ, NE,
            AND, OR);

    private ExpressionReducer() {}

    /** Reduces in place. On return vals holds the single result and ops is empty. */
    public static double reduce(List<Double> vals, List<BinaryOp> ops) {
        if (vals.size() != ops.size() + 1) {
            throw EvalException.structural(
                    "Expected one more value than operators, got " + vals.size() + " values and " + ops.size() + " ops");
        }

        for (BinaryOp op : REDUCTION_ORDER) {
            if (op.direction() == BinaryOp.Direction.RIGHT_TO_LEFT) rtol(vals, ops, op);
            else ltor(vals, ops, op);
        }

        if (!ops.isEmpty()) throw EvalException.structural("Unhandled Expression ops: " + ops);
        if (vals.size() != 1) throw EvalException.structural("More than one final Expression value");
        return vals.get(0);
    }

    /**
     * Scan from the last operator down. A collapse at i only shifts indices
     * greater than i, so the downward scan continues without restarting.
     */
    public static int rtol(List<Double> vals, List<BinaryOp> ops, BinaryOp op) {
        int collapsed = 0;
        for (int i = ops.size() - 1; i >= 0; i--) {
            if (ops.get(i) == op) {
                collapse(vals, ops, i);
                collapsed++;
            }
        }
        return collapsed;
    }

    /**
     * Scan from the first operator up. A collapse shifts everything to its
     * right, so the scan restarts from index 0 after each one.
     */
    public static int ltor(List<Double> vals, List<BinaryOp> ops, BinaryOp op) {
        int collapsed = 0;
        int i = 0;
        while (i < ops.size()) {
            if (ops.get(i) == op) {
                collapse(vals, ops, i);
                collapsed++;
                i = 0;
            } else {
                i++;
            }
        }
        return collapsed;
    }

    static void collapse(List<Double> vals, List<BinaryOp> ops, int i) {
        BinaryOp op = ops.get(i);
        double left = vals.get(i);
        double right = vals.get(i + 1);
        double result = op.apply(left, right);

        if (Debug.get().isEnabled()) {
            Debug.get().t(TAG, "collapse[" + i + "]: " + left + " " + op.symbol() + " " + right + " = " + result);
        }

        vals.set(i, result);
        vals.remove(i + 1);
        ops.remove(i);
    }
}
