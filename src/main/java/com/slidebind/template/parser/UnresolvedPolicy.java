package com.slidebind.template.parser;

/** Rendering of a reference that resolves to nothing. */
public enum UnresolvedPolicy {
    /** Render an empty string. */
    EMPTY,
    /** Leave the original {@code ${...}} text in place. */
    LITERAL
}
