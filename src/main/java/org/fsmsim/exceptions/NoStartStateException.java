package org.fsmsim.exceptions;

public class NoStartStateException extends ValidationException {

    public NoStartStateException() {
        super("No start state set");
    }
}
