package com.numeval.expr.plugins;

import java.util.List;

import com.numeval.expr.NumEval;

/**
 * NumEvalMathPlugin
 *
 * Extended math functions. Not built into the core engine so that a host
 * exposing only arithmetic keeps a small function surface.
 *
 * Usage:
 *   NumEvalMathPlugin.register(engine);
 *
 * Then in expressions:
 *   pow(2, 8) + log10(x)
 *   clamp(ratio, 0, 1)
 *   2 * pi() * r
 */
public final class NumEvalMathPlugin {

    private NumEvalMathPlugin() {}

    public static void register(NumEval engine) {

        engine.registerFunction("pow", args -> {
            NumEval.requireArgCount("pow", args, 2);
            return Math.pow(num(args, 0), num(args, 1));
        });

        engine.registerFunction("exp", args -> {
            NumEval.requireArgCount("exp", args, 1);
            return Math.exp(num(args, 0));
        });

        engine.registerFunction("log", args -> {
            NumEval.requireArgCount("log", args, 1);
            return Math.log(num(args, 0));
        });

        engine.registerFunction("log10", args -> {
            NumEval.requireArgCount("log10", args, 1);
            return Math.log10(num(args, 0));
        });

        engine.registerFunction("sin", args -> {
            NumEval.requireArgCount("sin", args, 1);
            return Math.sin(num(args, 0));
        });

        engine.registerFunction("cos", args -> {
            NumEval.requireArgCount("cos", args, 1);
            return Math.cos(num(args, 0));
        });

        engine.registerFunction("tan", args -> {
            NumEval.requireArgCount("tan", args, 1);
            return Math.tan(num(args, 0));
        });

        engine.registerFunction("clamp", args -> {
            NumEval.requireArgCount("clamp", args, 3);
            double v = num(args, 0);
            double lo = num(args, 1);
            double hi = num(args, 2);
            return Math.max(lo, Math.min(hi, v));
        });

        engine.registerFunction("sign", args -> {
            NumEval.requireArgCount("sign", args, 1);
            return Math.signum(num(args, 0));
        });

        // Constants as zero-argument functions
        engine.registerFunction("pi", args -> {
            NumEval.requireArgCount("pi", args, 0);
            return Math.PI;
        });

        engine.registerFunction("e", args -> {
            NumEval.requireArgCount("e", args, 0);
            return Math.E;
        });
    }

    private static double num(List<Double> args, int i) {
        return args.get(i);
    }
}
