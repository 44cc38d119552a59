package com.numeval.expr;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

import com.numeval.debug.Debug;
import com.numeval.expr.json.NumEvalJson;
import com.numeval.expr.parser.EvalException;
import com.numeval.expr.plugins.NumEvalMathPlugin;

public final class NumEvalCli {

    static final String USAGE =
            "Usage: NumEvalCli <expression> [--vars <json>] [--vars-file <path>] [--names] [--json] [--math] [--trace]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Exit codes: 0 ok, 1 evaluation error, 2 usage, 3 unreadable vars file. */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        String expression = null;
        String varsJson = null;
        Path varsFile = null;
        boolean names = false;
        boolean json = false;
        boolean math = false;
        boolean trace = false;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--vars":
                    if (++i >= args.length) return usage(err, "--vars needs a JSON object");
                    varsJson = args[i];
                    break;
                case "--vars-file":
                    if (++i >= args.length) return usage(err, "--vars-file needs a path");
                    varsFile = Path.of(args[i]);
                    break;
                case "--names": names = true; break;
                case "--json": json = true; break;
                case "--math": math = true; break;
                case "--trace": trace = true; break;
                default:
                    if (a.startsWith("--")) return usage(err, "Unknown option: " + a);
                    if (expression != null) return usage(err, "Only one expression is accepted");
                    expression = a;
            }
        }
        if (expression == null) return usage(err, "Missing expression");

        // Keep stdout a single JSON document under --json
        if (trace) Debug.get().setSink(Debug.printing(json ? err : out));

        if (varsFile != null) {
            try {
                varsJson = Files.readString(varsFile, StandardCharsets.UTF_8);
            } catch (IOException e) {
                err.println("Failed to read vars file: " + varsFile);
                e.printStackTrace(err);
                return 3;
            }
        }

        final NumEval engine = new NumEval();
        if (math) NumEvalMathPlugin.register(engine);

        try {
            if (names) {
                Set<String> found = engine.varNames(expression);
                if (json) out.println(NumEvalJson.write(NumEvalJson.names(found)));
                else for (String n : found) out.println(n);
                return 0;
            }

            Map<String, Double> vars = (varsJson == null)
                    ? Collections.emptyMap()
                    : NumEvalJson.readVariables(varsJson);
            double result = engine.eval(expression, vars);

            if (json) out.println(NumEvalJson.write(NumEvalJson.result(result)));
            else out.println(result);
            return 0;
        } catch (EvalException e) {
            if (json) out.println(NumEvalJson.write(NumEvalJson.error(e)));
            else err.println("Evaluation error [" + e.kind() + "]: " + e.getMessage());
            return 1;
        }
    }

    private static int usage(PrintStream err, String msg) {
        err.println(msg);
        err.println(USAGE);
        return 2;
    }

    private NumEvalCli() {}
}
