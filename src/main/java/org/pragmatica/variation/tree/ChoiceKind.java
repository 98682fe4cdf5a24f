package org.pragmatica.variation.tree;

/**
 * Which concrete directive opened a choice.
 */
public enum ChoiceKind {
    /**
     * {@code #ifdef NAME} - the then-branch is taken when the dimension is defined.
     */
    POSITIVE,

    /**
     * {@code #ifndef NAME} - the then-branch is taken when the dimension is not defined.
     */
    CONTRAPOSITIVE
}
