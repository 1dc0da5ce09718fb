package com.unparen;

/**
 * What the surroundings of a parenthesized expression say about removing its
 * parentheses.
 */
public enum RemovalContext {
    /** The context guarantees the unwrapped expression parses the same way. */
    ALWAYS_REMOVABLE,
    /** Removing the parentheses is known to change meaning or to be illegal. */
    ALWAYS_UNSAFE,
    /** The decision falls through to precedence and association analysis. */
    INDETERMINATE
}
