package org.stackpp.runtime.model;

import org.stackpp.runtime.isa.Instruction;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A runtime value of the Stack++ machine.
 * <p>
 * The set of variants is closed. Values are immutable, so copying a value out of
 * memory is the same as sharing it. Every variant answers all four coercions; a
 * coercion never fails, it falls back to a neutral result instead:
 * <ul>
 *     <li>{@link #asNumber()}: the payload of a {@link NumberValue}, otherwise {@code 0.0}</li>
 *     <li>{@link #asString()}: the text of a {@link StringValue} or {@link VariableRef},
 *         the decimal text of a {@link NumberValue}, otherwise the empty string</li>
 *     <li>{@link #asBool()}: the payload of a {@link BoolValue}, otherwise {@code false}</li>
 *     <li>{@link #asBlock()}: the body of a {@link BlockValue}, otherwise a one-element
 *         sequence holding the value itself</li>
 * </ul>
 */
public sealed interface Value
        permits Value.NumberValue, Value.StringValue, Value.BoolValue, Value.VariableRef,
                Value.InstructionValue, Value.BlockValue, Value.ErrorValue {

    default double asNumber() {
        return 0.0;
    }

    default String asString() {
        return "";
    }

    default boolean asBool() {
        return false;
    }

    default List<Value> asBlock() {
        return List.of(this);
    }

    /**
     * Renders the value for diagnostics, e.g. {@code Number(7.0)} or {@code Block([...])}.
     * @return The diagnostic text.
     */
    String describe();

    static Value number(double value) {
        return new NumberValue(value);
    }

    static Value string(String value) {
        return new StringValue(value);
    }

    static Value bool(boolean value) {
        return new BoolValue(value);
    }

    static Value variable(String name) {
        return new VariableRef(name);
    }

    static Value instruction(Instruction instruction) {
        return new InstructionValue(instruction);
    }

    static Value block(List<Value> body) {
        return new BlockValue(body);
    }

    static Value stackEmpty() {
        return ErrorValue.STACK_EMPTY;
    }

    /**
     * Renders a sequence of values as {@code [a, b, c]}.
     * @param values The values to render.
     * @return The diagnostic text.
     */
    static String describeAll(List<? extends Value> values) {
        return values.stream().map(Value::describe).collect(Collectors.joining(", ", "[", "]"));
    }

    /**
     * A 64-bit floating point number.
     * @param value The number.
     */
    record NumberValue(double value) implements Value {
        @Override
        public double asNumber() {
            return value;
        }

        @Override
        public String asString() {
            return ValueText.formatNumber(value);
        }

        @Override
        public String describe() {
            return "Number(" + ValueText.formatNumberDebug(value) + ")";
        }
    }

    /**
     * A string literal. Strings cannot contain a double quote.
     * @param value The text.
     */
    record StringValue(String value) implements Value {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String asString() {
            return value;
        }

        @Override
        public String describe() {
            return "String(" + ValueText.quote(value) + ")";
        }
    }

    /**
     * A boolean, produced by the comparison instructions.
     * @param value The truth value.
     */
    record BoolValue(boolean value) implements Value {
        @Override
        public boolean asBool() {
            return value;
        }

        @Override
        public String describe() {
            return "Bool(" + value + ")";
        }
    }

    /**
     * An unresolved reference to a memory slot, written {@code $name} in source.
     * Evaluation replaces it with the bound value if there is one.
     * @param name The variable name without the sigil.
     */
    record VariableRef(String name) implements Value {
        public VariableRef {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String asString() {
            return name;
        }

        @Override
        public String describe() {
            return "Variable(" + ValueText.quote(name) + ")";
        }
    }

    /**
     * An instruction in a program. Instructions are executed, never pushed.
     * @param instruction The opcode.
     */
    record InstructionValue(Instruction instruction) implements Value {
        public InstructionValue {
            Objects.requireNonNull(instruction, "instruction");
        }

        @Override
        public String describe() {
            return "Instruction(" + instruction.displayName() + ")";
        }
    }

    /**
     * A deferred sequence of values, written {@code { ... }} in source.
     * @param body The parsed contents; copied into an unmodifiable list.
     */
    record BlockValue(List<Value> body) implements Value {
        public BlockValue {
            body = List.copyOf(body);
        }

        @Override
        public List<Value> asBlock() {
            return body;
        }

        @Override
        public String describe() {
            return "Block(" + describeAll(body) + ")";
        }
    }

    /**
     * An error that flows through the machine as an ordinary value.
     * @param kind The kind of error.
     */
    record ErrorValue(ErrorKind kind) implements Value {
        static final ErrorValue STACK_EMPTY = new ErrorValue(ErrorKind.STACK_EMPTY);

        public ErrorValue {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public String describe() {
            return "Error(" + kind.displayName() + ")";
        }
    }
}
