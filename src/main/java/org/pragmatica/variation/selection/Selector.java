package org.pragmatica.variation.selection;

import java.util.Objects;

/**
 * Caller's choice of visible branches for one named dimension.
 */
public record Selector(String name, Status status) {

    public Selector {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
    }

    public static Selector both(String name) {
        return new Selector(name, Status.BOTH);
    }

    public static Selector defined(String name) {
        return new Selector(name, Status.DEF);
    }

    public static Selector undefined(String name) {
        return new Selector(name, Status.NDEF);
    }
}
