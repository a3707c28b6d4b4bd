package org.stackpp.runtime;

import org.stackpp.runtime.internal.services.StreamConsole;
import org.stackpp.runtime.isa.Instruction;
import org.stackpp.runtime.model.Machine;
import org.stackpp.runtime.model.Value;
import org.stackpp.runtime.spi.IConsole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.DoubleBinaryOperator;

/**
 * Executes programs against a {@link Machine}.
 * <p>
 * Values are processed strictly left to right. Literals and blocks are pushed,
 * variable references are resolved against memory, and instructions pop their
 * operands and push their results. Binary instructions pop the right operand first.
 * Control flow instructions evaluate nested blocks by re-entering
 * {@link #evaluate(List, Machine)} on the same machine, so there is no call scope:
 * every block sees and changes the one stack and the one memory.
 * <p>
 * Evaluation never fails on bad operands. Popping an empty stack yields a
 * {@code StackEmpty} error value, and every operand is coerced to the type the
 * instruction wants. Loops carry no iteration bound.
 */
public class Evaluator {

    private static final Logger LOG = LoggerFactory.getLogger(Evaluator.class);

    private final IConsole console;

    /**
     * Creates an evaluator that prints to standard output and reads standard input.
     */
    public Evaluator() {
        this(new StreamConsole());
    }

    /**
     * Creates an evaluator bound to a console.
     * @param console The channel used by {@code print} and {@code input}.
     */
    public Evaluator(IConsole console) {
        this.console = console;
    }

    /**
     * Evaluates a program, mutating the machine in place.
     *
     * @param program The values to execute, in order.
     * @param machine The machine to execute against.
     * @throws ConsoleException if the console fails while executing {@code input}.
     */
    public void evaluate(List<Value> program, Machine machine) {
        for (Value value : program) {
            if (value instanceof Value.InstructionValue op) {
                execute(op.instruction(), machine);
            } else if (value instanceof Value.VariableRef ref) {
                machine.push(machine.load(ref.name()).orElse(ref));
            } else {
                machine.push(value);
            }
        }
    }

    private void execute(Instruction instruction, Machine machine) {
        if (LOG.isTraceEnabled()) {
            LOG.trace("{} on stack of {}", instruction.getKeyword(), machine.stackSize());
        }
        Value result = switch (instruction) {
            case ADD -> arithmetic(machine, (l, r) -> l + r);
            case SUB -> arithmetic(machine, (l, r) -> l - r);
            case MUL -> arithmetic(machine, (l, r) -> l * r);
            case DIV -> arithmetic(machine, (l, r) -> l / r);
            case MOD -> arithmetic(machine, (l, r) -> l % r);
            case POW -> arithmetic(machine, Math::pow);
            case CONCAT -> {
                String right = pop(machine).asString();
                String left = pop(machine).asString();
                yield Value.string(left + right);
            }
            case PRINT -> {
                console.print(pop(machine).asString());
                yield null;
            }
            case INPUT -> Value.string(readInput());
            case EQUAL -> {
                String right = pop(machine).asString();
                String left = pop(machine).asString();
                yield Value.bool(left.equals(right));
            }
            case LESS_THAN -> {
                double right = pop(machine).asNumber();
                double left = pop(machine).asNumber();
                yield Value.bool(left < right);
            }
            case GREATER_THAN -> {
                double right = pop(machine).asNumber();
                double left = pop(machine).asNumber();
                yield Value.bool(left > right);
            }
            case EVAL -> {
                evaluate(pop(machine).asBlock(), machine);
                yield null;
            }
            case WHEN -> {
                List<Value> body = pop(machine).asBlock();
                if (pop(machine).asBool()) {
                    evaluate(body, machine);
                }
                yield null;
            }
            case IF_ELSE -> {
                List<Value> whenFalse = pop(machine).asBlock();
                List<Value> whenTrue = pop(machine).asBlock();
                evaluate(pop(machine).asBool() ? whenTrue : whenFalse, machine);
                yield null;
            }
            case WHILE -> {
                List<Value> body = pop(machine).asBlock();
                List<Value> condition = pop(machine).asBlock();
                loop(condition, body, true, machine);
                yield null;
            }
            case UNTIL -> {
                List<Value> body = pop(machine).asBlock();
                List<Value> condition = pop(machine).asBlock();
                loop(condition, body, false, machine);
                yield null;
            }
            case LET -> {
                String name = pop(machine).asString();
                machine.store(name, pop(machine));
                yield null;
            }
            case POP -> {
                machine.pop();
                yield null;
            }
        };
        if (result != null) {
            machine.push(result);
        }
    }

    private Value arithmetic(Machine machine, DoubleBinaryOperator operator) {
        double right = pop(machine).asNumber();
        double left = pop(machine).asNumber();
        return Value.number(operator.applyAsDouble(left, right));
    }

    /**
     * Runs {@code body} for as long as {@code condition} leaves {@code continueWhile} on
     * the stack. The condition is re-evaluated before every iteration.
     */
    private void loop(List<Value> condition, List<Value> body, boolean continueWhile, Machine machine) {
        long iterations = 0;
        while (true) {
            evaluate(condition, machine);
            if (pop(machine).asBool() != continueWhile) {
                break;
            }
            evaluate(body, machine);
            iterations++;
        }
        LOG.debug("{} loop finished after {} iterations", continueWhile ? "while" : "until", iterations);
    }

    private String readInput() {
        String line = console.readLine();
        if (line == null) {
            LOG.debug("input reached end of stream, pushing an empty string");
            return "";
        }
        return line;
    }

    private static Value pop(Machine machine) {
        if (machine.isStackEmpty()) {
            LOG.debug("Pop on empty stack yields StackEmpty");
        }
        return machine.pop();
    }
}
