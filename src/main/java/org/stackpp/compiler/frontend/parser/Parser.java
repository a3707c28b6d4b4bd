package org.stackpp.compiler.frontend.parser;

import org.stackpp.compiler.frontend.lexer.Tokenizer;
import org.stackpp.runtime.isa.Instruction;
import org.stackpp.runtime.model.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * The Parser turns raw tokens into a program, i.e. a sequence of {@link Value}s.
 * <p>
 * Each token is classified in a fixed order: number literal, string literal, block,
 * variable reference, keyword. Block tokens are parsed recursively. A token that fits
 * none of these forms is dropped; parsing never fails.
 */
public final class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    /**
     * Decimal float literals: optional sign, digits with an optional fraction, or a bare
     * fraction, then an optional exponent. The words {@code inf}, {@code infinity} and
     * {@code nan} are accepted in any case.
     */
    private static final Pattern NUMBER = Pattern.compile(
            "[+-]?(?:(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?|(?i:inf|infinity|nan))");

    private Parser() {
        // Utility class
    }

    /**
     * Tokenizes and parses source text.
     * @param source The source code.
     * @return The parsed program.
     */
    public static List<Value> parse(String source) {
        return parse(Tokenizer.tokenize(source));
    }

    /**
     * Parses already tokenized source.
     * @param tokens The raw tokens, as produced by {@link Tokenizer}.
     * @return The parsed program.
     */
    public static List<Value> parse(List<String> tokens) {
        List<Value> program = new ArrayList<>(tokens.size());
        for (String raw : tokens) {
            Optional<Value> value = parseToken(trim(raw));
            if (value.isPresent()) {
                program.add(value.get());
            } else {
                LOG.debug("Ignoring unrecognized token: {}", raw);
            }
        }
        return program;
    }

    /**
     * Classifies a single token.
     * @param token The token text, already stripped of surrounding whitespace.
     * @return The value, or empty if the token is not part of the language.
     */
    static Optional<Value> parseToken(String token) {
        Optional<Double> number = parseNumber(token);
        if (number.isPresent()) {
            return Optional.of(Value.number(number.get()));
        }
        if (isWrapped(token, '"', '"')) {
            return Optional.of(Value.string(unwrap(token)));
        }
        if (isWrapped(token, '{', '}')) {
            return Optional.of(Value.block(parse(unwrap(token))));
        }
        if (token.startsWith("$")) {
            return Optional.of(Value.variable(token.substring(1)));
        }
        return Instruction.fromKeyword(token).map(Value::instruction);
    }

    /**
     * Parses a number literal.
     * @param token The token text.
     * @return The number, or empty if the token is not a number literal.
     */
    static Optional<Double> parseNumber(String token) {
        if (!NUMBER.matcher(token).matches()) {
            return Optional.empty();
        }
        boolean negative = token.startsWith("-");
        String unsigned = token.startsWith("+") || negative ? token.substring(1) : token;
        double parsed = switch (unsigned.toLowerCase(Locale.ROOT)) {
            case "inf", "infinity" -> negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            case "nan" -> Double.NaN;
            default -> Double.parseDouble(token);
        };
        return Optional.of(parsed);
    }

    /**
     * Removes leading and trailing characters with the Unicode {@code White_Space} property.
     * Unlike {@link String#strip()} this also covers the no-break spaces U+00A0, U+2007 and
     * U+202F and the next-line character U+0085, but not the separators U+001C to U+001F.
     */
    static String trim(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && isWhiteSpace(token.charAt(start))) {
            start++;
        }
        while (end > start && isWhiteSpace(token.charAt(end - 1))) {
            end--;
        }
        return token.substring(start, end);
    }

    private static boolean isWhiteSpace(char c) {
        return (c >= '\t' && c <= '\r')
                || c == ' '
                || c == '\u0085'
                || c == '\u00A0'
                || c == '\u1680'
                || (c >= '\u2000' && c <= '\u200A')
                || c == '\u2028'
                || c == '\u2029'
                || c == '\u202F'
                || c == '\u205F'
                || c == '\u3000';
    }

    private static boolean isWrapped(String token, char open, char close) {
        return token.length() >= 2 && token.charAt(0) == open && token.charAt(token.length() - 1) == close;
    }

    private static String unwrap(String token) {
        return token.substring(1, token.length() - 1);
    }
}
