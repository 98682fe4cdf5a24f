package org.pragmatica.variation.selection;

/**
 * Which branches of a dimension the caller wants to see.
 */
public enum Status {
    /**
     * Show both branches.
     */
    BOTH,

    /**
     * Show the branch taken when the dimension is defined.
     */
    DEF,

    /**
     * Show the branch taken when the dimension is not defined.
     */
    NDEF
}
