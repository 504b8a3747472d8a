package com.viffx.ShiftReduce.Parser;

import com.viffx.ShiftReduce.Symbols.Token;
import com.viffx.ShiftReduce.Utils.PersistentList;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Unmodifiable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * A snapshot of the parser state: the input still to be read (buffer), the partially reduced
 * symbols (stack) and the trace of everything done so far.
 * <p>
 * Configurations never change after construction. Every {@code with*} method returns a new
 * configuration that shares as much as possible with its parent:
 * <ul>
 *     <li>the buffer is the original input plus a read position,</li>
 *     <li>the stack and the trace are {@link PersistentList}s, newest element first.</li>
 * </ul>
 */
public final class Configuration {
    // ====== INSTANCE FIELDS ====== //
    private final List<Token> input;
    private final int position;
    private final PersistentList<Token> stack;
    private final PersistentList<String> trace;

    // ====== CONSTRUCTORS ====== //
    private Configuration(List<Token> input, int position, PersistentList<Token> stack, PersistentList<String> trace) {
        this.input = input;
        this.position = position;
        this.stack = stack;
        this.trace = trace;
    }

    /**
     * Returns the configuration every search starts from: all of {@code tokens} in the buffer,
     * an empty stack and an empty trace.
     */
    @NotNull
    @Contract("_ -> new")
    public static Configuration initial(@NotNull List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens cannot be null");
        return new Configuration(List.copyOf(tokens), 0, PersistentList.empty(), PersistentList.empty());
    }

    // ====== BUFFER ====== //
    public boolean bufferEmpty() {
        return position >= input.size();
    }

    public int bufferSize() {
        return input.size() - position;
    }

    /**
     * Returns the first token of the buffer.
     *
     * @throws NoSuchElementException if the buffer is empty
     */
    @NotNull
    public Token bufferHead() {
        if (bufferEmpty()) throw new NoSuchElementException("The buffer is empty");
        return input.get(position);
    }

    /**
     * Returns the remaining input, first token first.
     */
    @NotNull
    @Unmodifiable
    public List<Token> buffer() {
        return input.subList(position, input.size());
    }

    // ====== STACK ====== //
    public int stackSize() {
        return stack.size();
    }

    /**
     * Returns the stack element {@code depth} positions below the top, {@code 0} being the top.
     *
     * @throws IndexOutOfBoundsException if the stack is not that deep
     */
    @NotNull
    public Token peek(int depth) {
        return stack.get(depth);
    }

    /**
     * Returns the stack bottom to top, the way it is written in a derivation.
     */
    @NotNull
    @Unmodifiable
    public List<Token> stack() {
        return Collections.unmodifiableList(stack.toReversedList());
    }

    // ====== TRACE ====== //
    /**
     * Returns the trace in the order it was recorded, oldest entry first.
     */
    @NotNull
    @Unmodifiable
    public List<String> trace() {
        return Collections.unmodifiableList(trace.toReversedList());
    }

    /**
     * Returns the trace newest entry first, which is how an accepted derivation is reported.
     */
    @NotNull
    @Unmodifiable
    public List<String> derivation() {
        return Collections.unmodifiableList(trace.toList());
    }

    // ====== DERIVED CONFIGURATIONS ====== //
    /**
     * Drops the first buffer token.
     *
     * @throws NoSuchElementException if the buffer is empty
     */
    @NotNull
    @Contract(" -> new")
    public Configuration withBufferAdvanced() {
        if (bufferEmpty()) throw new NoSuchElementException("The buffer is empty");
        return new Configuration(input, position + 1, stack, trace);
    }

    @NotNull
    @Contract("_ -> new")
    public Configuration withPushed(@NotNull Token token) {
        return new Configuration(input, position, stack.push(token), trace);
    }

    /**
     * Pops {@code count} tokens off the top of the stack.
     *
     * @throws IndexOutOfBoundsException if the stack holds fewer than {@code count} tokens
     */
    @NotNull
    @Contract("_ -> new")
    public Configuration withPopped(int count) {
        return new Configuration(input, position, stack.drop(count), trace);
    }

    /**
     * Removes the token second from the top, keeping the top in place.
     *
     * @throws IndexOutOfBoundsException if the stack holds fewer than two tokens
     */
    @NotNull
    @Contract(" -> new")
    public Configuration withSecondRemoved() {
        if (stack.size() < 2) throw new IndexOutOfBoundsException("Index: 1, Size: " + stack.size());
        Token top = stack.peek();
        return new Configuration(input, position, stack.drop(2).push(top), trace);
    }

    @NotNull
    @Contract("_ -> new")
    public Configuration withTrace(@NotNull String entry) {
        return new Configuration(input, position, stack, trace.push(entry));
    }

    // ====== OBJECT ====== //
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Configuration that)) return false;
        return buffer().equals(that.buffer()) && stack.equals(that.stack) && trace.equals(that.trace);
    }

    @Override
    public int hashCode() {
        return Objects.hash(buffer(), stack, trace);
    }

    @Override
    public String toString() {
        return "Configuration{" +
                "buffer=" + symbols(buffer()) +
                ", stack=" + symbols(stack()) +
                ", trace=" + trace() +
                '}';
    }

    private static List<String> symbols(List<Token> tokens) {
        List<String> symbols = new ArrayList<>(tokens.size());
        for (Token token : tokens) symbols.add(token.label());
        return symbols;
    }
}
