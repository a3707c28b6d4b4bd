package org.stackpp.cli;

import org.stackpp.runtime.model.Value;
import org.stackpp.testutils.RecordingConsole;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ScriptRunnerTest {

    @TempDir
    Path tempDir;

    private Path writeScript(String content) throws IOException {
        Path script = tempDir.resolve("script.spp");
        Files.writeString(script, content, StandardCharsets.UTF_8);
        return script;
    }

    @Test
    void runsScriptAgainstFreshMachine() throws IOException {
        Path script = writeScript("""
                0 "i" let
                {$i 3 less-than}
                {$i print $i 1 add "i" let}
                while
                "done" print
                """);
        RecordingConsole console = new RecordingConsole();
        ScriptRunner runner = new ScriptRunner(console);

        int exitCode = runner.run(script);

        assertThat(exitCode).isZero();
        assertThat(console.getOutput()).isEqualTo("012done");
        assertThat(runner.getLastMachine().load("i")).contains(Value.number(3));
    }

    @Test
    void readsInputFromConsole() throws IOException {
        Path script = writeScript("\"Hello, \" input concat print");
        RecordingConsole console = new RecordingConsole("World");

        assertThat(new ScriptRunner(console).run(script)).isZero();
        assertThat(console.getOutput()).isEqualTo("Hello, World");
    }

    @Test
    void eachRunStartsWithEmptyMachine() throws IOException {
        Path script = writeScript("1 2");
        ScriptRunner runner = new ScriptRunner(new RecordingConsole());

        runner.run(script);
        runner.run(script);

        assertThat(runner.getLastMachine().getStack()).containsExactly(Value.number(1), Value.number(2));
    }

    @Test
    void missingFileYieldsExitCodeOne() {
        ScriptRunner runner = new ScriptRunner(new RecordingConsole());

        assertThat(runner.run(tempDir.resolve("missing.spp"))).isEqualTo(1);
        assertThat(runner.getLastMachine()).isNull();
    }
}
