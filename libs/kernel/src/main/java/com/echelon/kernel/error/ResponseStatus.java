package com.echelon.kernel.error;

/**
 * Top-level outcome of a kernel request, as seen by the caller and recorded in the audit trail.
 */
public enum ResponseStatus {
    /** The action ran (or was replayed, or dry-run) successfully. */
    ALLOWED,
    /** The caller was refused: authentication, authorization or quota. */
    DENIED,
    /** The request was accepted but could not be completed. */
    ERROR
}
