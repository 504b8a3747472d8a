package com.viffx.ShiftReduce.Symbols;

import java.util.Objects;

/**
 * A word or grammar symbol as it sits in a buffer or on a stack.
 * <p>
 * The {@code id} is handed out by a {@link TokenFactory} in creation order and is only used to
 * label derivation traces. Grammar lookups always go through {@link #symbol()}.
 *
 * @param symbol the word or category this token stands for
 * @param id     creation-order identifier, unique within its factory
 */
public record Token(String symbol, int id) {
    public Token {
        Objects.requireNonNull(symbol, "symbol cannot be null");
    }

    /**
     * Returns the {@code id:symbol} form used in derivation traces.
     */
    public String label() {
        return id + ":" + symbol;
    }

    @Override
    public String toString() {
        return "Token{" +
                "symbol='" + symbol +
                "', id=" + id +
                '}';
    }
}
