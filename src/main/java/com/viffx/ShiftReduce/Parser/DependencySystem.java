package com.viffx.ShiftReduce.Parser;

import com.viffx.ShiftReduce.Grammar.Dependency;
import com.viffx.ShiftReduce.Grammar.DependencyGrammar;
import com.viffx.ShiftReduce.Symbols.Token;
import com.viffx.ShiftReduce.Symbols.TokenFactory;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Arc-standard style parsing for a {@link DependencyGrammar}.
 * <p>
 * Words are shifted as they are, keeping the id they got when the input was tokenized. An arc
 * links the two top stack words and removes the dependent, leaving the head in place. Trace
 * entries read {@code LA: head-relation-dependent} or {@code RA: head-relation-dependent}.
 */
public class DependencySystem implements ParsingSystem {
    public static final String SHIFT_SOURCE = "";

    private final DependencyGrammar grammar;
    private final TokenFactory tokens;

    public DependencySystem(@NotNull DependencyGrammar grammar) {
        this(grammar, new TokenFactory());
    }

    public DependencySystem(@NotNull DependencyGrammar grammar, @NotNull TokenFactory tokens) {
        this.grammar = Objects.requireNonNull(grammar, "grammar cannot be null");
        this.tokens = Objects.requireNonNull(tokens, "tokens cannot be null");
    }

    public DependencyGrammar grammar() {
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
     * Accepts when the input is read and a single word, the root, is left on the stack.
     */
    @Override
    public boolean isAccepting(@NotNull Configuration configuration) {
        return configuration.stackSize() == 1 && configuration.bufferEmpty();
    }

    @NotNull
    @Override
    public List<Transition> discoverTransitions(@NotNull Configuration configuration) {
        List<Transition> transitions = new ArrayList<>();

        if (!configuration.bufferEmpty()) {
            transitions.add(new Transition.Shift(configuration.bufferHead().symbol(), SHIFT_SOURCE));
        }

        if (configuration.stackSize() > 1) {
            String second = configuration.peek(1).symbol();
            String top = configuration.peek(0).symbol();
            for (Dependency dependency : grammar.rules(second, top)) {
                switch (dependency.direction()) {
                    case LA -> transitions.add(new Transition.LeftArc(dependency.relation(), second, top));
                    case RA -> transitions.add(new Transition.RightArc(dependency.relation(), second, top));
                }
            }
        }

        return transitions;
    }

    @NotNull
    @Override
    public Configuration applyTransition(@NotNull Configuration configuration, @NotNull Transition transition) {
        if (transition instanceof Transition.Shift) {
            return configuration.withBufferAdvanced().withPushed(configuration.bufferHead());
        }
        if (transition instanceof Transition.LeftArc leftArc) {
            Token head = configuration.peek(0);
            Token dependent = configuration.peek(1);
            return configuration.withTrace("LA: " + head.label() + "-" + leftArc.target() + "-" + dependent.label())
                    .withSecondRemoved();
        }
        if (transition instanceof Transition.RightArc rightArc) {
            Token head = configuration.peek(1);
            Token dependent = configuration.peek(0);
            return configuration.withTrace("RA: " + head.label() + "-" + rightArc.target() + "-" + dependent.label())
                    .withPopped(1);
        }
        throw new UnsupportedTransitionException(this, transition);
    }
}
