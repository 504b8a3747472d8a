package com.viffx.ShiftReduce.Parser;

import com.viffx.ShiftReduce.Symbols.Token;

import java.util.List;

/**
 * An accepted parse.
 *
 * @param input the tokens the search started from
 * @param lines the trace of the accepting configuration, newest entry first
 * @param root  the single token left on the stack
 */
public record Derivation(List<Token> input, List<String> lines, Token root) {
    public Derivation {
        input = List.copyOf(input);
        lines = List.copyOf(lines);
    }

    public static Derivation of(List<Token> input, Configuration accepted) {
        return new Derivation(input, accepted.derivation(), accepted.stackSize() == 1 ? accepted.peek(0) : null);
    }

    /**
     * The input words joined by single spaces.
     */
    public String sentence() {
        StringBuilder builder = new StringBuilder();
        for (Token token : input) {
            if (builder.length() > 0) builder.append(' ');
            builder.append(token.symbol());
        }
        return builder.toString();
    }
}
