package io.dynamojson.core;

/**
 * Wire tags of the store's attribute-value union.
 */
public enum AttributeType {
    S,
    N,
    B,
    BOOL,
    NULL,
    M,
    L,
    SS,
    NS,
    BS,
    /**
     * A variant this library does not recognize, for example one introduced by a newer store version.
     */
    UNKNOWN
}
