package com.viffx.ShiftReduce.Parser;

import com.viffx.ShiftReduce.Grammar.CfgGrammar;
import com.viffx.ShiftReduce.Symbols.Token;
import com.viffx.ShiftReduce.Symbols.TokenFactory;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Shift-reduce parsing for a {@link CfgGrammar}.
 * <p>
 * A shift rewrites the next word to one of its lexical categories, a reduce replaces any run of
 * symbols at the top of the stack that forms the right hand side of a rule. Every token either
 * move creates gets a fresh id, and the trace records one {@code parent-child} edge per consumed
 * token, e.g. {@code 7:NP-5:Det}.
 */
public class CfgSystem implements ParsingSystem {
    private final CfgGrammar grammar;
    private final TokenFactory tokens;

    public CfgSystem(@NotNull CfgGrammar grammar) {
        this(grammar, new TokenFactory());
    }

    public CfgSystem(@NotNull CfgGrammar grammar, @NotNull TokenFactory tokens) {
        this.grammar = Objects.requireNonNull(grammar, "grammar cannot be null");
        this.tokens = Objects.requireNonNull(tokens, "tokens cannot be null");
    }

    public CfgGrammar grammar() {
        return grammar;
    }

    @NotNull
    @Override
    public TokenFactory tokens() {
        return tokens;
    }

    @NotNull
    @Override
    public Configuration initialConfiguration(@NotNull List<Token> tokens) {
        return Configuration.initial(tokens);
    }

    /**
     * Accepts when the whole input has been read and reduced to the start symbol alone.
     */
    @Override
    public boolean isAccepting(@NotNull Configuration configuration) {
        return configuration.stackSize() == 1
                && configuration.peek(0).symbol().equals(grammar.startSymbol())
                && configuration.bufferEmpty();
    }

    @NotNull
    @Override
    public List<Transition> discoverTransitions(@NotNull Configuration configuration) {
        List<Transition> transitions = new ArrayList<>();

        // shift the next word as each of its categories
        if (!configuration.bufferEmpty()) {
            String terminal = configuration.bufferHead().symbol();
            for (String lhs : grammar.lexicon(terminal)) {
                transitions.add(new Transition.Shift(lhs, terminal));
            }
        }

        // reduce every window that ends at the top of the stack, shortest first
        int depth = configuration.stackSize();
        if (depth > 0) {
            String[] symbols = new String[depth];
            for (int i = 0; i < depth; i++) {
                symbols[depth - 1 - i] = configuration.peek(i).symbol();
            }
            List<String> stack = Arrays.asList(symbols);
            for (int start = depth - 1; start >= 0; start--) {
                List<String> window = stack.subList(start, depth);
                for (String lhs : grammar.rules(window)) {
                    transitions.add(new Transition.Reduce(lhs, window));
                }
            }
        }

        return transitions;
    }

    @NotNull
    @Override
    public Configuration applyTransition(@NotNull Configuration configuration, @NotNull Transition transition) {
        if (transition instanceof Transition.Shift shift) {
            Token newToken = tokens.create(shift.target());
            Token oldToken = configuration.bufferHead();
            return configuration.withBufferAdvanced()
                    .withTrace(edge(newToken, oldToken))
                    .withPushed(newToken);
        }
        if (transition instanceof Transition.Reduce reduce) {
            int width = reduce.constituents().size();
            if (configuration.stackSize() < width) {
                throw new IllegalArgumentException("Cannot reduce " + width + " constituents from a stack of " + configuration.stackSize());
            }
            Token newToken = tokens.create(reduce.target());
            Configuration next = configuration;
            for (int i = 0; i < width; i++) {
                next = next.withTrace(edge(newToken, configuration.peek(i)));
            }
            return next.withPopped(width).withPushed(newToken);
        }
        throw new UnsupportedTransitionException(this, transition);
    }

    private static String edge(Token parent, Token child) {
        return parent.label() + "-" + child.label();
    }
}
