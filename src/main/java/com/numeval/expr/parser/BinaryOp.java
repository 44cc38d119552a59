package com.numeval.expr.parser;

/**
 * Binary operators of the flattened expression and their numeric semantics.
 *
 * Booleans are encoded as doubles: comparisons answer 1.0 or 0.0. The
 * logical operators are value-returning, not short-circuit: {@code x || d}
 * answers x when x is non-zero, otherwise d, which gives the default-value
 * idiom. Both operands are already resolved when these run.
 */
public enum BinaryOp {
    PLUS("+", Direction.RIGHT_TO_LEFT),
    MINUS("-", Direction.LEFT_TO_RIGHT),
    MUL("*", Direction.RIGHT_TO_LEFT),
    DIV("/", Direction.LEFT_TO_RIGHT),
    MOD("%", Direction.LEFT_TO_RIGHT),
    EXP("^", Direction.RIGHT_TO_LEFT),
    LT("<", Direction.LEFT_TO_RIGHT),
    LTE("<=", Direction.LEFT_TO_RIGHT),
    EQ("==", Direction.LEFT_TO_RIGHT),
    NE("!=", Direction.LEFT_TO_RIGHT),
    GTE(">=", Direction.LEFT_TO_RIGHT),
    GT(">", Direction.LEFT_TO_RIGHT),
    OR("||", Direction.LEFT_TO_RIGHT),
    AND("&&", Direction.LEFT_TO_RIGHT);

    /** Order in which same-operator runs are collapsed within one reduction pass. */
    public enum Direction {
        RIGHT_TO_LEFT,
        LEFT_TO_RIGHT
    }

    private final String symbol;
    private final Direction direction;

    BinaryOp(String symbol, Direction direction) {
        this.symbol = symbol;
        this.direction = direction;
    }

    public String symbol() { return symbol; }

    public Direction direction() { return direction; }

    public double apply(double left, double right) {
        switch (this) {
            case PLUS:  return left + right;
            case MINUS: return left - right;
            case MUL:   return left * right;
            case DIV:   return left / right;
            case MOD:   return left % right; // truncating, sign follows the dividend
            case EXP:   return Math.pow(left, right);
            case LT:    return bool(left < right);
            case LTE:   return bool(left <= right);
            case EQ:    return bool(left == right);
            case NE:    return bool(left != right);
            case GTE:   return bool(left >= right);
            case GT:    return bool(left > right);
            case OR:    return (left != 0.0) ? left : right;
            case AND:   return (left == 0.0) ? left : right;
            default:
                throw new IllegalStateException("Unsupported binary operator: " + this);
        }
    }

    public static double bool(boolean b) {
        return b ? 1.0 : 0.0;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
