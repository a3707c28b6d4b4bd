package org.stackpp.runtime.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The mutable state of a running Stack++ program: an operand stack and a flat memory
 * of named values.
 * <p>
 * A machine is created once per program run or interactive session and keeps its
 * state across evaluations. Memory is global and unscoped; binding a name again
 * replaces the old value. Instances are not thread-safe.
 */
public class Machine {

    private final Deque<Value> stack = new ArrayDeque<>();
    private final Map<String, Value> memory = new LinkedHashMap<>();

    /**
     * Pushes a value on top of the stack.
     * @param value The value to push.
     */
    public void push(Value value) {
        stack.push(value);
    }

    /**
     * Pops the top of the stack.
     * @return The popped value, or a {@code StackEmpty} error value if the stack is empty.
     */
    public Value pop() {
        Value value = stack.poll();
        return value != null ? value : Value.stackEmpty();
    }

    /**
     * Returns the top of the stack without removing it.
     * @return The top value, or empty if the stack is empty.
     */
    public Optional<Value> peek() {
        return Optional.ofNullable(stack.peek());
    }

    public boolean isStackEmpty() {
        return stack.isEmpty();
    }

    public int stackSize() {
        return stack.size();
    }

    /**
     * Returns a snapshot of the stack, bottom first.
     * @return An unmodifiable copy of the stack contents.
     */
    public List<Value> getStack() {
        List<Value> snapshot = new ArrayList<>(stack.size());
        Iterator<Value> it = stack.descendingIterator();
        while (it.hasNext()) {
            snapshot.add(it.next());
        }
        return Collections.unmodifiableList(snapshot);
    }

    /**
     * Binds a value to a name, overwriting any previous binding.
     * @param name The variable name.
     * @param value The value to store.
     */
    public void store(String name, Value value) {
        memory.put(name, value);
    }

    /**
     * Looks up a variable.
     * @param name The variable name.
     * @return The bound value, or empty if the name is unbound.
     */
    public Optional<Value> load(String name) {
        return Optional.ofNullable(memory.get(name));
    }

    /**
     * Returns a view of the memory in binding order.
     * @return An unmodifiable view of the memory.
     */
    public Map<String, Value> getMemory() {
        return Collections.unmodifiableMap(memory);
    }

    /**
     * Renders the machine for diagnostics, e.g. {@code Machine { stack: [Number(7.0)], memory: {} }}.
     * @return The diagnostic text.
     */
    public String describe() {
        String renderedMemory = memory.entrySet().stream()
                .map(e -> ValueText.quote(e.getKey())
                        + ": " + e.getValue().describe())
                .collect(Collectors.joining(", ", "{", "}"));
        return "Machine { stack: " + Value.describeAll(getStack()) + ", memory: " + renderedMemory + " }";
    }

    @Override
    public String toString() {
        return describe();
    }
}
