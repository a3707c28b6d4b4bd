package org.stackpp.cli.repl;

import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;
import org.stackpp.runtime.isa.Instruction;

import java.util.List;

/**
 * Completes instruction keywords in the interactive session.
 */
public class KeywordCompleter implements Completer {

    @Override
    public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
        String word = line.word();
        for (String keyword : Instruction.keywords().keySet()) {
            if (keyword.startsWith(word)) {
                candidates.add(new Candidate(keyword));
            }
        }
    }
}
