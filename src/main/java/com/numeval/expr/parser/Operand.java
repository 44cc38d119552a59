package com.numeval.expr.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Leaf operands of a flattened {@link Expression}. A parenthesized group is
 * itself an operand: {@link Expression} implements {@link OperandInterface}.
 */
public class Operand {

    public interface OperandInterface extends Evaler {
    }

    public static final class Constant implements OperandInterface {
        public final double value;

        public Constant(double value) {
            this.value = value;
        }

        @Override
        public double eval(EvalNamespace ns) {
            return value;
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    public static final class Variable implements OperandInterface {
        public final String name;

        public Variable(String name) {
            this.name = name;
        }

        @Override
        public double eval(EvalNamespace ns) {
            return ns.variable(name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class Unary implements OperandInterface {

        public enum Op {
            NEG("-"),
            POS("+"),
            NOT("!");

            final String symbol;

            Op(String symbol) { this.symbol = symbol; }
        }

        public final Op op;
        public final OperandInterface operand;

        public Unary(Op op, OperandInterface operand) {
            this.op = op;
            this.operand = operand;
        }

        @Override
        public double eval(EvalNamespace ns) {
            double v = ns.evalBubble(operand);
            switch (op) {
                case NEG: return -v;
                case POS: return v;
                case NOT: return BinaryOp.bool(v == 0.0);
                default:
                    throw new IllegalStateException("Unsupported unary operator: " + op);
            }
        }

        @Override
        public String toString() {
            return op.symbol + operand;
        }
    }

    public static final class Call implements OperandInterface {
        public final String name;
        public final List<Expression> args;

        public Call(String name, List<Expression> args) {
            this.name = name;
            this.args = (args == null)
                    ? Collections.emptyList()
                    : Collections.unmodifiableList(new ArrayList<>(args));
        }

        @Override
        public double eval(EvalNamespace ns) {
            List<Double> values = new ArrayList<>(args.size());
            for (int i = 0; i < args.size(); i++) {
                try {
                    values.add(ns.evalBubble(args.get(i)));
                } catch (EvalException e) {
                    throw e.pre(name + " arg " + i);
                }
            }
            return ns.call(name, values);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(name).append('(');
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(args.get(i).render());
            }
            return sb.append(')').toString();
        }
    }
}
