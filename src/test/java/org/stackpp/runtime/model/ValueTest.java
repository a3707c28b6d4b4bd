package org.stackpp.runtime.model;

import org.stackpp.runtime.isa.Instruction;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the coercions and diagnostic renderings of {@link Value}.
 */
@Tag("unit")
class ValueTest {

    private final Value number = Value.number(2.5);
    private final Value string = Value.string("text");
    private final Value bool = Value.bool(true);
    private final Value variable = Value.variable("x");
    private final Value instruction = Value.instruction(Instruction.ADD);
    private final Value block = Value.block(List.of(Value.number(1)));
    private final Value error = Value.stackEmpty();

    @Test
    void asNumberFallsBackToZero() {
        assertThat(number.asNumber()).isEqualTo(2.5);
        assertThat(Value.string("5").asNumber()).isZero();
        assertThat(bool.asNumber()).isZero();
        assertThat(variable.asNumber()).isZero();
        assertThat(block.asNumber()).isZero();
        assertThat(error.asNumber()).isZero();
    }

    @Test
    void asStringCoversStringsVariablesAndNumbers() {
        assertThat(string.asString()).isEqualTo("text");
        assertThat(variable.asString()).isEqualTo("x");
        assertThat(number.asString()).isEqualTo("2.5");
        assertThat(Value.number(7).asString()).isEqualTo("7");
        assertThat(bool.asString()).isEmpty();
        assertThat(instruction.asString()).isEmpty();
        assertThat(block.asString()).isEmpty();
        assertThat(error.asString()).isEmpty();
    }

    @Test
    void asBoolIsTrueOnlyForTrueBool() {
        assertThat(bool.asBool()).isTrue();
        assertThat(Value.bool(false).asBool()).isFalse();
        assertThat(Value.number(1).asBool()).isFalse();
        assertThat(Value.string("true").asBool()).isFalse();
        assertThat(error.asBool()).isFalse();
    }

    @Test
    void asBlockWrapsNonBlocks() {
        assertThat(block.asBlock()).containsExactly(Value.number(1));
        assertThat(number.asBlock()).containsExactly(number);
        assertThat(variable.asBlock()).containsExactly(variable);
        assertThat(error.asBlock()).containsExactly(error);
    }

    @Test
    void blockBodyIsImmutableCopy() {
        List<Value> body = new java.util.ArrayList<>(List.of(Value.number(1)));
        Value copy = Value.block(body);
        body.add(Value.number(2));

        assertThat(copy.asBlock()).containsExactly(Value.number(1));
    }

    @Test
    void describesEveryVariant() {
        assertThat(Value.number(7).describe()).isEqualTo("Number(7.0)");
        assertThat(Value.string("a\"b\n").describe()).isEqualTo("String(\"a\\\"b\\n\")");
        assertThat(Value.bool(false).describe()).isEqualTo("Bool(false)");
        assertThat(variable.describe()).isEqualTo("Variable(\"x\")");
        assertThat(instruction.describe()).isEqualTo("Instruction(Add)");
        assertThat(block.describe()).isEqualTo("Block([Number(1.0)])");
        assertThat(error.describe()).isEqualTo("Error(StackEmpty)");
    }

    @Test
    void stackEmptyErrorsAreEqual() {
        assertThat(Value.stackEmpty()).isEqualTo(new Value.ErrorValue(ErrorKind.STACK_EMPTY));
    }
}
