package org.stackpp.cli.repl;

import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import org.stackpp.cli.config.ReplOptions;
import org.stackpp.compiler.frontend.parser.Parser;
import org.stackpp.runtime.ConsoleException;
import org.stackpp.runtime.Evaluator;
import org.stackpp.runtime.model.Machine;
import org.stackpp.runtime.model.Value;
import org.stackpp.runtime.spi.IConsole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.util.List;

/**
 * The interactive session.
 * <p>
 * Lines are collected until an empty line is entered; the collected chunk is then parsed
 * and evaluated. One machine lives for the whole session, so the stack and the memory
 * carry over from chunk to chunk. Ctrl-C discards the chunk being typed, or abandons the
 * running chunk while it waits in {@code input}; a chunk that is computing, e.g. inside a
 * {@code while} loop, cannot be interrupted. Ctrl-D ends the session.
 */
public class ReplSession {

    private static final Logger LOG = LoggerFactory.getLogger(ReplSession.class);

    private final LineReader reader;
    private final PrintWriter out;
    private final ReplOptions options;
    private final Evaluator evaluator;
    private final Machine machine = new Machine();

    /**
     * @param reader  The line editor chunks are read from.
     * @param console The console running programs print to and read from.
     * @param out     Where the banner and the AST/Result echo go.
     * @param options The session settings.
     */
    public ReplSession(LineReader reader, IConsole console, PrintWriter out, ReplOptions options) {
        this.reader = reader;
        this.out = out;
        this.options = options;
        this.evaluator = new Evaluator(console);
    }

    /**
     * Runs the session until end of input.
     */
    public void run() {
        out.println(options.banner());
        out.flush();
        while (true) {
            final String chunk;
            try {
                chunk = readChunk();
            } catch (UserInterruptException e) {
                LOG.debug("Chunk discarded by user interrupt");
                continue;
            } catch (EndOfFileException e) {
                LOG.debug("End of input, leaving the session");
                return;
            }
            evaluateChunk(chunk);
        }
    }

    /**
     * Parses and evaluates one chunk against the session's machine.
     * @param chunk The source text.
     */
    void evaluateChunk(String chunk) {
        List<Value> program = Parser.parse(chunk);
        if (options.showAst()) {
            out.println("AST    : " + Value.describeAll(program));
            out.flush();
        }
        try {
            evaluator.evaluate(program, machine);
        } catch (UserInterruptException e) {
            LOG.debug("Evaluation interrupted by user");
        } catch (ConsoleException e) {
            LOG.error("Evaluation aborted: {}", e.getMessage(), e);
        }
        if (options.showResult()) {
            out.println("Result : " + machine.describe());
        }
        out.flush();
    }

    private String readChunk() {
        StringBuilder chunk = new StringBuilder();
        while (true) {
            String line = reader.readLine(options.prompt());
            if (line == null) {
                throw new EndOfFileException();
            }
            chunk.append(line).append('\n');
            if (line.isEmpty()) {
                return chunk.toString();
            }
        }
    }

    /**
     * @return The machine shared by all chunks of this session.
     */
    public Machine getMachine() {
        return machine;
    }
}
