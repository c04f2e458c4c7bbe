package com.slidebind.template;

/**
 * Host hook for failures handled inside the binder. Reported failures are never
 * rethrown; processing moves on to the next shape.
 */
@FunctionalInterface
public interface ErrorReporter {
    void report(String kind, int slideIndex, String shapeName, String message, Throwable error);
}
