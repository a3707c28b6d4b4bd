package org.stackpp.runtime;

/**
 * Thrown when the console behind a running program fails.
 * This is a host failure; errors of the language itself are values, not exceptions.
 */
public class ConsoleException extends RuntimeException {

    public ConsoleException(String message, Throwable cause) {
        super(message, cause);
    }
}
