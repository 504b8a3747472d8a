package com.viffx.ShiftReduce.Parser;

import com.viffx.ShiftReduce.Symbols.Token;
import com.viffx.ShiftReduce.Symbols.TokenFactory;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * The capability set {@link DerivationSearch} drives. One implementation exists per grammar
 * formalism; the search never needs to know which one it runs.
 */
public interface ParsingSystem {

    /**
     * The factory that mints every token this system creates, input tokens included.
     */
    @NotNull
    TokenFactory tokens();

    @NotNull
    default List<Token> tokenize(@NotNull String input) {
        return tokens().tokenize(input);
    }

    @NotNull
    Configuration initialConfiguration(@NotNull List<Token> tokens);

    /**
     * Returns whether {@code configuration} is a complete parse.
     */
    boolean isAccepting(@NotNull Configuration configuration);

    /**
     * Returns every move the grammar allows from {@code configuration}, empty for a dead end.
     */
    @NotNull
    List<Transition> discoverTransitions(@NotNull Configuration configuration);

    /**
     * Applies {@code transition} to a copy of {@code configuration}; the argument is left as it was.
     *
     * @throws UnsupportedTransitionException if this system has no semantics for the transition
     */
    @NotNull
    Configuration applyTransition(@NotNull Configuration configuration, @NotNull Transition transition);
}
