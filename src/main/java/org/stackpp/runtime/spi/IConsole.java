package org.stackpp.runtime.spi;

/**
 * The input and output channel of a running program.
 * <p>
 * The {@code print} and {@code input} instructions go through this interface, so the
 * evaluator itself never touches the process streams. Implementations may block on
 * {@link #readLine()}.
 */
public interface IConsole {

    /**
     * Writes text without a trailing newline.
     *
     * @param text the text to write
     */
    void print(String text);

    /**
     * Reads one line of input, without its line terminator.
     *
     * @return the line, or {@code null} at end of input
     * @throws org.stackpp.runtime.ConsoleException if the underlying channel fails
     */
    String readLine();
}
