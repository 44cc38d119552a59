package com.numeval.expr;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.numeval.debug.Debug;
import com.numeval.expr.parser.EvalException;
import com.numeval.expr.parser.EvalNamespace;
import com.numeval.expr.parser.Expression;
import com.numeval.expr.parser.Lexer;
import com.numeval.expr.parser.Parser;

/**
 * NumEval engine.
 *
 * - Infix numeric expressions: + - * / % ^, comparisons, value-returning && ||
 * - Unary - + !, parentheses, function calls
 * - Every value is a double; comparisons answer 1.0 / 0.0
 * - Variables are resolved lazily through an {@link EvalNamespace}
 * - Functions:
 *     - Built-ins (registered via registerFunction)
 *     - Host functions answered by the namespace resolver
 *
 * Usage:
 *   NumEval ne = new NumEval();
 *   double d = ne.eval("x * 2 + 1", Map.of("x", 3.0));
 */
public class NumEval {

    private static final String TAG = "numeval";

    /** Functional interface for built-in functions. */
    public interface BuiltinFunction {
        double call(List<Double> args);
    }

    private final Map<String, BuiltinFunction> functions = new HashMap<>();
    private int maxDepth = Parser.DEFAULT_MAX_DEPTH;

    public NumEval() {
        registerCoreBuiltins();
    }

    /** Maximum nesting of parentheses, unary operators and calls accepted by the parser. */
    public void setMaxDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("maxDepth must be >= 1, got " + depth);
        this.maxDepth = depth;
    }

    public int getMaxDepth() { return maxDepth; }

    public void registerFunction(String name, BuiltinFunction fn) { functions.put(name, fn); }

    public boolean hasFunction(String name) { return functions.containsKey(name); }

    /** Read-only view of the registered builtins. */
    public Map<String, BuiltinFunction> functions() { return Collections.unmodifiableMap(functions); }

    public Expression parse(String source) {
        if (source == null) throw new IllegalArgumentException("source must not be null");
        Lexer lexer = new Lexer(source);
        Parser parser = new Parser(lexer.tokenize(), maxDepth);
        return parser.parse();
    }

    public EvalNamespace newNamespace(EvalNamespace.Resolver resolver) {
        return new EvalNamespace(resolver, functions);
    }

    public double eval(String source) {
        return eval(source, Collections.emptyMap());
    }

    /**
     * Evaluate with a fixed set of variables; any other name is a resolution error.
     * The variables live in the namespace root scope, so {@code x()} is an
     * undefined function even when {@code x} is bound.
     */
    public double eval(String source, Map<String, Double> vars) {
        EvalNamespace ns = newNamespace((name, args) -> null);
        if (vars != null) {
            for (Map.Entry<String, Double> e : vars.entrySet()) {
                if (e.getValue() != null) ns.define(e.getKey(), e.getValue());
            }
        }
        return eval(parse(source), ns);
    }

    public double eval(Expression expr, EvalNamespace ns) {
        try {
            return expr.eval(ns);
        } catch (EvalException e) {
            if (Debug.get().isEnabled()) Debug.get().d(TAG, "eval failed [" + e.kind() + "]: " + e.getMessage());
            throw e;
        }
    }

    /** Names the expression asks the host for; builtins are excluded. */
    public Set<String> varNames(String source) {
        return parse(source).varNames(functions);
    }

    private void registerCoreBuiltins() {
        registerFunction("abs", args -> {
            requireArgCount("abs", args, 1);
            return Math.abs(args.get(0));
        });

        registerFunction("sqrt", args -> {
            requireArgCount("sqrt", args, 1);
            return Math.sqrt(args.get(0));
        });

        registerFunction("floor", args -> {
            requireArgCount("floor", args, 1);
            return Math.floor(args.get(0));
        });

        registerFunction("ceil", args -> {
            requireArgCount("ceil", args, 1);
            return Math.ceil(args.get(0));
        });

        registerFunction("round", args -> {
            requireArgCount("round", args, 1);
            return (double) Math.round(args.get(0));
        });

        registerFunction("min", args -> {
            if (args.isEmpty()) throw EvalException.resolution("min() expects at least 1 argument");
            double m = args.get(0);
            for (int i = 1; i < args.size(); i++) {
                double d = args.get(i);
                if (d < m) m = d;
            }
            return m;
        });

        registerFunction("max", args -> {
            if (args.isEmpty()) throw EvalException.resolution("max() expects at least 1 argument");
            double m = args.get(0);
            for (int i = 1; i < args.size(); i++) {
                double d = args.get(i);
                if (d > m) m = d;
            }
            return m;
        });
    }

    public static void requireArgCount(String name, List<Double> args, int expected) {
        if (args.size() != expected) {
            throw EvalException.resolution(name + "() expects " + expected + " arguments, got " + args.size());
        }
    }
}
