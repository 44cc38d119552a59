package com.numeval.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for all NumEval components.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Safe default (no-op) if no sink installed
 * - Callers check isEnabled() before building trace messages, so the
 *   evaluation hot path does no string work while the no-op sink is active
 */
public final class Debug {

    // Sinks are declared before INSTANCE: the constructor reads NOOP.
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // intentionally empty
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef;

    private Debug() {
        sinkRef = new AtomicReference<>(NOOP);
    }

    public static Debug get() {
        return INSTANCE;
    }

    /** A sink writing "[LEVEL][tag] message" lines to the given stream. */
    public static DebugSink printing(PrintStream ps) {
        return (level, tag, message, error) -> {
            ps.println("[" + level + "][" + tag + "] " + message);
            if (error != null) error.printStackTrace(ps);
        };
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    public boolean isEnabled() {
        return sinkRef.get() != NOOP;
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }
}
