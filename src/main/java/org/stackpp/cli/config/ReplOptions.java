package org.stackpp.cli.config;

import com.typesafe.config.Config;

/**
 * Settings of the interactive session, read from the {@code repl} section of the configuration.
 *
 * @param prompt     The prompt shown for every line of a chunk.
 * @param banner     The line printed once when the session starts.
 * @param showAst    Whether the parsed chunk is echoed before evaluation.
 * @param showResult Whether the machine state is echoed after evaluation.
 */
public record ReplOptions(String prompt, String banner, boolean showAst, boolean showResult) {

    private static final String REPL_CONFIG_PATH = "repl";

    /**
     * Reads the options from a loaded configuration.
     *
     * @param config The full configuration; must contain the {@code repl} section.
     * @return The options.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static ReplOptions fromConfig(final Config config) {
        final Config repl = config.getConfig(REPL_CONFIG_PATH);
        return new ReplOptions(
                repl.getString("prompt"),
                repl.getString("banner"),
                repl.getBoolean("show-ast"),
                repl.getBoolean("show-result"));
    }
}
