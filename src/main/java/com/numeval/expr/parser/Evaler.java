package com.numeval.expr.parser;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.numeval.expr.NumEval.BuiltinFunction;

/**
 * Anything that evaluates to a number against a namespace: constants,
 * variables, calls and whole expressions.
 */
public interface Evaler {

    double eval(EvalNamespace ns);

    /** Names this node asks the host for. Builtin-free variant of {@link #varNames(Map)}. */
    default Set<String> varNames() {
        return varNames(Collections.emptyMap());
    }

    /**
     * Runs a full evaluation against a recording namespace and returns every
     * name the namespace was asked to resolve, in first-reference order.
     *
     * The recording namespace never supplies a value. It substitutes NaN for
     * the missing value so evaluation reaches every operand position;
     * structural errors still propagate. Names answered by one of the given
     * builtins are not recorded.
     */
    default Set<String> varNames(Map<String, BuiltinFunction> functions) {
        Set<String> names = new LinkedHashSet<>();
        EvalNamespace ns = EvalNamespace.collecting((name, args) -> {
            names.add(name);
            return null;
        }, functions);
        eval(ns);
        return names;
    }
}
