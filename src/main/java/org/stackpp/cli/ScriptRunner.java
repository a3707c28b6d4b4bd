package org.stackpp.cli;

import org.stackpp.compiler.frontend.parser.Parser;
import org.stackpp.runtime.ConsoleException;
import org.stackpp.runtime.Evaluator;
import org.stackpp.runtime.model.Machine;
import org.stackpp.runtime.model.Value;
import org.stackpp.runtime.spi.IConsole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs a script file once, against a fresh machine.
 */
public class ScriptRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ScriptRunner.class);

    private final Evaluator evaluator;
    private Machine lastMachine;

    /**
     * @param console The console the script prints to and reads from.
     */
    public ScriptRunner(IConsole console) {
        this.evaluator = new Evaluator(console);
    }

    /**
     * Loads, parses and evaluates a script.
     *
     * @param script The path of the script, read as UTF-8.
     * @return The process exit code: 0 on success, 1 if the file cannot be read or the console fails.
     */
    public int run(Path script) {
        final String source;
        try {
            source = Files.readString(script, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.error("Failed to open the file {}: {}", script, e.toString());
            return 1;
        }

        List<Value> program = Parser.parse(source);
        LOG.debug("Parsed {} top-level values from {}", program.size(), script);

        lastMachine = new Machine();
        try {
            evaluator.evaluate(program, lastMachine);
        } catch (ConsoleException e) {
            LOG.error("Script {} aborted: {}", script, e.getMessage(), e);
            return 1;
        }
        return 0;
    }

    /**
     * Returns the machine of the most recent run, for inspection.
     * @return The machine, or {@code null} if nothing has run yet.
     */
    public Machine getLastMachine() {
        return lastMachine;
    }
}
