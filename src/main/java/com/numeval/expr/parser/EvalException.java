package com.numeval.expr.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * The single error type of the evaluator.
 *
 * Carries a detail message plus a breadcrumb chain of context notes. Lower
 * layers throw, upper layers call {@link #pre(String)} while the exception
 * travels up, so the final message reads outermost-first:
 *
 *   evalBubble(x): Undefined variable: x
 */
public class EvalException extends RuntimeException {

    public enum Kind {
        /** Source text could not be tokenized or parsed. */
        PARSE,
        /** Malformed flattened expression or namespace misuse; a builder defect. */
        STRUCTURAL,
        /** A name could not be resolved, or a function rejected its arguments. */
        RESOLUTION
    }

    private final Kind kind;
    private final String detail;
    private final Deque<String> context = new ArrayDeque<>();

    public EvalException(Kind kind, String detail) {
        this(kind, detail, null);
    }

    public EvalException(Kind kind, String detail, Throwable cause) {
        super(detail, cause);
        this.kind = kind;
        this.detail = detail;
    }

    public static EvalException parse(String detail) { return new EvalException(Kind.PARSE, detail); }
    public static EvalException structural(String detail) { return new EvalException(Kind.STRUCTURAL, detail); }
    public static EvalException resolution(String detail) { return new EvalException(Kind.RESOLUTION, detail); }

    /** Prepend a context note and hand the same exception back for rethrow. */
    public EvalException pre(String note) {
        context.addFirst(note);
        return this;
    }

    public Kind kind() { return kind; }

    public String detail() { return detail; }

    /** Context notes, outermost first. */
    public List<String> context() { return new ArrayList<>(context); }

    @Override
    public String getMessage() {
        if (context.isEmpty()) return detail;
        StringBuilder sb = new StringBuilder();
        for (String note : context) sb.append(note).append(": ");
        return sb.append(detail).toString();
    }
}
