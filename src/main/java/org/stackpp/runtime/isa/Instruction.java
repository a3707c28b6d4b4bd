package org.stackpp.runtime.isa;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed instruction set of the Stack++ machine.
 * Each constant carries the keyword that spells it in source text.
 */
public enum Instruction {
    ADD("add"),
    SUB("sub"),
    MUL("mul"),
    DIV("div"),
    MOD("mod"),
    POW("pow"),
    CONCAT("concat"),
    PRINT("print"),
    INPUT("input"),
    EQUAL("equal"),
    LESS_THAN("less-than"),
    GREATER_THAN("greater-than"),
    EVAL("eval"),
    WHEN("when"),
    IF_ELSE("if-else"),
    WHILE("while"),
    UNTIL("until"),
    LET("let"),
    POP("pop");

    private static final Map<String, Instruction> BY_KEYWORD;

    static {
        Map<String, Instruction> byKeyword = new LinkedHashMap<>();
        for (Instruction instruction : values()) {
            byKeyword.put(instruction.keyword, instruction);
        }
        BY_KEYWORD = Collections.unmodifiableMap(byKeyword);
    }

    private final String keyword;

    Instruction(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the source spelling of this instruction, e.g. {@code less-than}.
     * @return The keyword.
     */
    public String getKeyword() {
        return keyword;
    }

    /**
     * Looks up an instruction by its exact, case-sensitive keyword.
     * @param keyword The token text.
     * @return The instruction, or empty if the text is not a keyword.
     */
    public static Optional<Instruction> fromKeyword(String keyword) {
        return Optional.ofNullable(BY_KEYWORD.get(keyword));
    }

    /**
     * Returns all keywords in declaration order.
     * @return An unmodifiable map from keyword to instruction.
     */
    public static Map<String, Instruction> keywords() {
        return BY_KEYWORD;
    }

    /**
     * Returns the diagnostic name used when rendering values, e.g. {@code LessThan}.
     * @return The camel-cased name of the constant.
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder();
        for (String part : name().split("_")) {
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }
}
