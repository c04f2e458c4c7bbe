package com.slidebind.template.layout;

/** Per-shape visibility: shapes start UNKNOWN and settle on VISIBLE or SUPPRESSED. */
public enum VisibilityState {
    UNKNOWN,
    VISIBLE,
    SUPPRESSED
}
