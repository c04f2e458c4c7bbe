package com.slidebind.debug;

/** Pluggable debug output target (stdout, file, host logger, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
