package org.stackpp.runtime.model;

/**
 * The kinds of error values the machine can produce.
 */
public enum ErrorKind {
    /** Produced by popping an empty stack. */
    STACK_EMPTY("StackEmpty");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return The name used in diagnostic renderings.
     */
    public String displayName() {
        return displayName;
    }
}
