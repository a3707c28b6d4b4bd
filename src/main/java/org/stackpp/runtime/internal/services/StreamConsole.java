package org.stackpp.runtime.internal.services;

import org.stackpp.runtime.ConsoleException;
import org.stackpp.runtime.spi.IConsole;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * A console backed by plain streams, by default the process's standard input and output.
 */
public class StreamConsole implements IConsole {

    private final BufferedReader in;
    private final PrintStream out;

    /**
     * Creates a console on {@code System.in} and {@code System.out}.
     */
    public StreamConsole() {
        this(System.in, System.out);
    }

    /**
     * Creates a console on the given streams.
     * @param in The stream {@code input} reads from, decoded as UTF-8.
     * @param out The stream {@code print} writes to.
     */
    public StreamConsole(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public void print(String text) {
        out.print(text);
        out.flush();
    }

    @Override
    public String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new ConsoleException("Failed to read from standard input", e);
        }
    }
}
