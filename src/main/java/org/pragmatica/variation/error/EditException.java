package org.pragmatica.variation.error;

/**
 * Thrown out of a structural edit that was refused. The tree handed to the edit is left as it was.
 */
public final class EditException extends RuntimeException {
    private final EditError error;

    public EditException(EditError error) {
        super(error.message());
        this.error = error;
    }

    public EditError error() {
        return error;
    }
}
