package org.stackpp.cli.repl;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.stackpp.runtime.ConsoleException;
import org.stackpp.runtime.spi.IConsole;

import java.io.IOError;
import java.io.PrintWriter;

/**
 * A console on a JLine {@link LineReader}, used while an interactive session is running.
 * {@code input} reads through the line editor with an empty prompt.
 */
public class LineReaderConsole implements IConsole {

    private final LineReader reader;
    private final PrintWriter out;

    public LineReaderConsole(LineReader reader, PrintWriter out) {
        this.reader = reader;
        this.out = out;
    }

    @Override
    public void print(String text) {
        out.print(text);
        out.flush();
    }

    /**
     * {@inheritDoc}
     * A {@link org.jline.reader.UserInterruptException} is not caught; it aborts the
     * running chunk.
     */
    @Override
    public String readLine() {
        try {
            return reader.readLine("");
        } catch (EndOfFileException e) {
            return null;
        } catch (IOError e) {
            throw new ConsoleException("Failed to read from the terminal", e);
        }
    }
}
