package com.viffx.ShiftReduce.Symbols;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Unmodifiable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mints {@link Token}s with strictly increasing ids.
 * <p>
 * Every parsing system owns one factory, so ids restart at zero for each system instead of
 * being shared process-wide. The counter is atomic, which keeps ids unique even if branches
 * are explored from several threads.
 */
public final class TokenFactory {
    private final AtomicInteger counter;

    public TokenFactory() {
        this(0);
    }

    public TokenFactory(int firstId) {
        this.counter = new AtomicInteger(firstId);
    }

    @NotNull
    @Contract("_ -> new")
    public Token create(@NotNull String symbol) {
        return new Token(symbol, counter.getAndIncrement());
    }

    /**
     * Splits {@code input} on whitespace and mints one token per word, left to right.
     *
     * @param input the raw input sentence
     * @return the tokens in input order, empty if the input is blank
     */
    @NotNull
    @Unmodifiable
    public List<Token> tokenize(@NotNull String input) {
        String trimmed = input.strip();
        if (trimmed.isEmpty()) return List.of();

        List<Token> tokens = new ArrayList<>();
        for (String word : trimmed.split("\\s+")) {
            tokens.add(create(word));
        }
        return Collections.unmodifiableList(tokens);
    }

    /**
     * The id the next created token will receive.
     */
    public int peekNextId() {
        return counter.get();
    }
}
