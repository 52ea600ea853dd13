package com.tinyscript.debug;

/** Pluggable debug output target (stdout, test collector, host logger, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
