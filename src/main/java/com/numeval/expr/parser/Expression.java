package com.numeval.expr.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.numeval.debug.Debug;
import com.numeval.expr.parser.Operand.OperandInterface;

/**
 * A flattened expression: operands at even positions, binary operators at
 * odd positions. {@code 1 + x * 3} is {@code [1, +, x, *, 3]}.
 *
 * The token list is immutable. Any list is accepted so that a defective
 * builder's output can still be represented; shape errors are reported by
 * {@link #eval(EvalNamespace)}.
 */
public final class Expression implements OperandInterface {

    private static final String TAG = "numeval.eval";

    public interface Tok {
    }

    public static final class ValueTok implements Tok {
        public final OperandInterface operand;

        public ValueTok(OperandInterface operand) {
            this.operand = operand;
        }

        @Override
        public String toString() {
            return "Value(" + operand + ")";
        }
    }

    public static final class OpTok implements Tok {
        public final BinaryOp op;

        public OpTok(BinaryOp op) {
            this.op = op;
        }

        @Override
        public String toString() {
            return "Op(" + op + ")";
        }
    }

    public static ValueTok value(OperandInterface operand) { return new ValueTok(operand); }
    public static ValueTok constant(double d) { return new ValueTok(new Operand.Constant(d)); }
    public static OpTok op(BinaryOp op) { return new OpTok(op); }

    private final List<Tok> toks;

    public Expression(List<? extends Tok> toks) {
        this.toks = Collections.unmodifiableList(new ArrayList<>(toks));
    }

    public List<Tok> toks() { return toks; }

    public int size() { return toks.size(); }

    @Override
    public double eval(EvalNamespace ns) {
        if (toks.size() % 2 != 1) throw EvalException.structural("Expression len should always be odd");

        boolean trace = Debug.get().isEnabled();
        List<Double> vals = new ArrayList<>(toks.size() / 2 + 1);
        List<BinaryOp> ops = new ArrayList<>(toks.size() / 2);

        for (int i = 0; i < toks.size(); i++) {
            Tok tok = toks.get(i);
            if (trace) Debug.get().t(TAG, "expression tok: (" + i + ", " + tok + ")");

            if (tok instanceof ValueTok) {
                if (i % 2 == 1) throw EvalException.structural("Found value at odd index " + i);
                OperandInterface operand = ((ValueTok) tok).operand;
                try {
                    vals.add(ns.evalBubble(operand));
                } catch (EvalException e) {
                    throw e.pre("evalBubble(" + operand + ")");
                }
            } else if (tok instanceof OpTok) {
                if (i % 2 == 0) throw EvalException.structural("Found binaryop at even index " + i);
                ops.add(((OpTok) tok).op);
            } else {
                throw EvalException.structural("Unknown expression token at index " + i + ": " + tok);
            }
        }

        return ExpressionReducer.reduce(vals, ops);
    }

    /** Source-like rendering without outer parentheses. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < toks.size(); i++) {
            if (i > 0) sb.append(' ');
            Tok tok = toks.get(i);
            if (tok instanceof ValueTok) sb.append(((ValueTok) tok).operand);
            else if (tok instanceof OpTok) sb.append(((OpTok) tok).op.symbol());
            else sb.append(tok);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "(" + render() + ")";
    }
}
