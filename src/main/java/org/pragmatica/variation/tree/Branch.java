package org.pragmatica.variation.tree;

/**
 * One side of a choice.
 */
public enum Branch {
    THEN,
    ELSE
}
