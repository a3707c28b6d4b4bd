package org.stackpp.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.stackpp.cli.config.ConfigLoader;
import org.stackpp.cli.config.LoggingConfigurator;
import org.stackpp.cli.config.ReplOptions;
import org.stackpp.cli.repl.KeywordCompleter;
import org.stackpp.cli.repl.LineReaderConsole;
import org.stackpp.cli.repl.ReplSession;
import org.stackpp.runtime.internal.services.StreamConsole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.Callable;

@Command(
    name = "stackpp",
    mixinStandardHelpOptions = true,
    version = "Stack++ " + CommandLineInterface.VERSION,
    description = "A improved Stack machine programming language. "
            + "Runs the given script, or starts an interactive session when no script is given."
)
public class CommandLineInterface implements Callable<Integer> {

    public static final String VERSION = "0.2.0";

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Parameters(index = "0", arity = "0..1", paramLabel = "FILE", description = "Run the script file")
    private File file;

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Override
    public Integer call() throws IOException {
        final Config config;
        final ReplOptions options;
        try {
            config = ConfigLoader.load(configFile);
            options = ReplOptions.fromConfig(config);
        } catch (ConfigException e) {
            LOG.error("Failed to load or parse configuration: {}", e.getMessage());
            return 1;
        }
        LoggingConfigurator.configure(config);

        if (file != null) {
            return new ScriptRunner(new StreamConsole()).run(file.toPath());
        }
        runInteractiveShell(options);
        return 0;
    }

    private void runInteractiveShell(ReplOptions options) throws IOException {
        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .completer(new KeywordCompleter())
                    .option(LineReader.Option.DISABLE_EVENT_EXPANSION, true)
                    .build();
            ReplSession session = new ReplSession(
                    lineReader, new LineReaderConsole(lineReader, terminal.writer()), terminal.writer(), options);
            session.run();
        }
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("stackpp");
        System.exit(commandLine.execute(args));
    }
}
