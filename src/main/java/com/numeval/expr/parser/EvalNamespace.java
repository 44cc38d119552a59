package com.numeval.expr.parser;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.numeval.debug.Debug;
import com.numeval.expr.NumEval.BuiltinFunction;

/**
 * Resolves names and nested expressions for one evaluation (or a series of
 * evaluations that share caches).
 *
 * Lookup order for a name: local scopes (innermost first), the name cache,
 * then the host {@link Resolver}. Host answers are cached until
 * {@link #clearCache()}. Nested sub-expression results are cached by node
 * identity so a parenthesized group that is bubbled more than once is
 * evaluated once.
 *
 * Not thread-safe. An evaluation owns its namespace for the duration of the
 * call.
 */
public class EvalNamespace {

    private static final String TAG = "numeval.ns";

    /**
     * Host callback. Called with an empty argument list for variables and with
     * the evaluated arguments for functions that are not builtins.
     * Returns null when the name is unknown.
     */
    public interface Resolver {
        Double resolve(String name, List<Double> args);
    }

    private final Resolver resolver;
    private final Map<String, BuiltinFunction> functions;
    private final boolean collecting;

    // LIFO of local scopes; the bottom one is the root scope
    private final Deque<Map<String, Double>> scopes = new ArrayDeque<>();
    private final Map<String, Double> nameCache = new HashMap<>();
    private final Map<Evaler, Double> bubbleCache = new IdentityHashMap<>();

    public EvalNamespace(Resolver resolver) {
        this(resolver, Collections.emptyMap());
    }

    public EvalNamespace(Resolver resolver, Map<String, BuiltinFunction> functions) {
        this(resolver, functions, false);
    }

    private EvalNamespace(Resolver resolver, Map<String, BuiltinFunction> functions, boolean collecting) {
        this.resolver = (resolver == null) ? (name, args) -> null : resolver;
        this.functions = (functions == null) ? Collections.emptyMap() : functions;
        this.collecting = collecting;
        scopes.push(new LinkedHashMap<>());
    }

    /**
     * A namespace for enumerating references: missing names and functions
     * answer NaN instead of raising a resolution error.
     */
    public static EvalNamespace collecting(Resolver recorder, Map<String, BuiltinFunction> functions) {
        return new EvalNamespace(recorder, functions, true);
    }

    public boolean isCollecting() { return collecting; }

    // -------------------------
    // Raw lookup
    // -------------------------

    /** Value of a name, or null when neither scopes, cache nor host know it. */
    public Double get(String name) {
        for (Map<String, Double> scope : scopes) {
            Double v = scope.get(name);
            if (v != null) return v;
        }

        Double cached = nameCache.get(name);
        if (cached != null) return cached;

        Double v = resolver.resolve(name, Collections.emptyList());
        if (v != null) nameCache.put(name, v);
        return v;
    }

    // -------------------------
    // Leaf resolution
    // -------------------------

    public double variable(String name) {
        Double v = get(name);
        if (v != null) return v;
        if (collecting) return Double.NaN;
        throw EvalException.resolution("Undefined variable: " + name);
    }

    public double call(String name, List<Double> args) {
        BuiltinFunction fn = functions.get(name);
        if (fn != null) {
            if (!collecting) return fn.call(args);
            try {
                return fn.call(args);
            } catch (EvalException e) {
                // NaN placeholders can make a builtin reject its arguments; keep collecting
                if (Debug.get().isEnabled()) Debug.get().t(TAG, "collecting past " + name + ": " + e.getMessage());
                return Double.NaN;
            }
        }

        Double v = resolver.resolve(name, args);
        if (v != null) return v;
        if (collecting) return Double.NaN;
        throw EvalException.resolution("Undefined function: " + name);
    }

    /**
     * Resolve one operand to a number. Nested expressions are evaluated
     * recursively through this namespace and their results cached.
     */
    public double evalBubble(Evaler operand) {
        if (!(operand instanceof Expression)) return operand.eval(this);

        Double cached = bubbleCache.get(operand);
        if (cached != null) {
            if (Debug.get().isEnabled()) Debug.get().t(TAG, "bubble cache hit: " + operand);
            return cached;
        }
        double v = operand.eval(this);
        bubbleCache.put(operand, v);
        return v;
    }

    // -------------------------
    // Scopes and caches
    // -------------------------

    public void define(String name, double value) {
        scopes.peek().put(name, value);
        bubbleCache.clear();
    }

    public void push() {
        scopes.push(new LinkedHashMap<>());
        bubbleCache.clear();
    }

    public void pop() {
        if (scopes.size() <= 1) throw EvalException.structural("Cannot pop the root scope");
        scopes.pop();
        bubbleCache.clear();
    }

    public int depth() { return scopes.size(); }

    public void clearCache() {
        nameCache.clear();
        bubbleCache.clear();
    }
}
