package org.stackpp.compiler.frontend.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The Tokenizer splits Stack++ source text into raw token strings.
 * <p>
 * Whitespace separates tokens at the top level. A brace-delimited block, including any
 * nested blocks, is kept together as one token, and so is a double-quoted string with
 * the whitespace inside it. Quotes inside a block and braces inside a string are
 * ordinary characters. A block or string still open at the end of the input is
 * dropped without an error.
 */
public class Tokenizer {

    private static final Logger LOG = LoggerFactory.getLogger(Tokenizer.class);

    /** The ideographic (full-width) space, treated like an ASCII space. */
    public static final char FULL_WIDTH_SPACE = '\u3000';

    private final String source;
    private final List<String> tokens = new ArrayList<>();
    private final StringBuilder current = new StringBuilder();
    private int depth = 0;
    private boolean inQuote = false;

    /**
     * Creates a new Tokenizer.
     * @param source The source code as a single string.
     */
    public Tokenizer(String source) {
        this.source = source;
    }

    /**
     * Convenience for {@code new Tokenizer(source).scanTokens()}.
     * @param source The source code.
     * @return The raw tokens in source order.
     */
    public static List<String> tokenize(String source) {
        return new Tokenizer(source).scanTokens();
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the raw tokens in source order.
     */
    public List<String> scanTokens() {
        for (int i = 0; i < source.length(); i++) {
            scanChar(source.charAt(i));
        }

        if (depth != 0 || inQuote) {
            LOG.debug("Dropping unterminated token at end of input (depth={}, inQuote={}): {}", depth, inQuote, current);
        } else if (current.length() > 0) {
            emit();
        }
        return tokens;
    }

    private void scanChar(char c) {
        switch (c) {
            case '{' -> {
                if (inQuote) {
                    current.append(c);
                } else {
                    depth++;
                    current.append(c);
                }
            }
            case '}' -> {
                if (inQuote) {
                    current.append(c);
                } else if (depth != 0) {
                    current.append(c);
                    depth--;
                    if (depth == 0) {
                        emit();
                    }
                }
                // A closing brace without an open block is discarded.
            }
            case '"' -> {
                if (depth != 0) {
                    current.append(c);
                } else if (inQuote) {
                    current.append(c);
                    inQuote = false;
                    emit();
                } else {
                    inQuote = true;
                    current.append(c);
                }
            }
            case ' ', '\n', '\t', '\r', FULL_WIDTH_SPACE -> {
                if (depth != 0 || inQuote) {
                    current.append(c);
                } else if (current.length() > 0) {
                    emit();
                }
            }
            default -> current.append(c);
        }
    }

    private void emit() {
        tokens.add(current.toString());
        current.setLength(0);
    }
}
