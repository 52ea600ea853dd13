package com.tinyscript.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for all TinyScript components.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Minimum level via setLevel(...); records below it never reach the sink
 * - Safe default (no-op sink, level TRACE) if nothing is configured
 */
public final class Debug {

    // Must be initialised before INSTANCE: the constructor reads it.
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // no sink installed
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);
    private volatile DebugLevel minLevel = DebugLevel.TRACE;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Installs a sink that prints every record to stdout (errors also get their stack trace). */
    public static void useSysOut() {
        INSTANCE.setSink(printing(System.out));
    }

    public static DebugSink printing(PrintStream out) {
        return (level, tag, message, error) -> {
            out.println("[" + level + "][" + tag + "] " + message);
            if (error != null) error.printStackTrace(out);
        };
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    /** Null resets to TRACE. */
    public void setLevel(DebugLevel level) {
        this.minLevel = (level == null) ? DebugLevel.TRACE : level;
    }

    public DebugLevel getLevel() {
        return minLevel;
    }

    /** True when a sink is installed and the level passes the threshold. Lets callers skip building messages. */
    public boolean isEnabled(DebugLevel level) {
        return sinkRef.get() != NOOP && level.compareTo(minLevel) >= 0;
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (level.compareTo(minLevel) < 0) return;
        sinkRef.get().log(level, tag, message, error);
    }
}
