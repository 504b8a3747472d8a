package com.viffx.ShiftReduce.Parser;

import com.viffx.ShiftReduce.Symbols.Token;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Exhaustive depth first exploration of every transition sequence a {@link ParsingSystem} allows.
 * <p>
 * Starting from a configuration, the search reports the configuration if it is accepting and
 * otherwise expands it with every discovered transition. A configuration without transitions is
 * a dead end and is dropped without a trace. Pending branches live on an explicit work list, so
 * deep inputs do not grow the call stack; they are pushed in reverse so they are explored in
 * discovery order.
 * <p>
 * The search holds no state between calls and can be reused for any number of systems.
 */
public final class DerivationSearch {
    private static final Logger logger = Logger.getLogger(DerivationSearch.class.getName());

    public static final long UNLIMITED = 0;

    private final long maxExpansions;

    public DerivationSearch() {
        this(UNLIMITED);
    }

    /**
     * @param maxExpansions how many configurations a single search may expand before it fails
     *                      with a {@link SearchLimitExceededException}, {@link #UNLIMITED} for no ceiling
     * @throws IllegalArgumentException if {@code maxExpansions} is negative
     */
    public DerivationSearch(long maxExpansions) {
        if (maxExpansions < 0) throw new IllegalArgumentException("maxExpansions cannot be negative: " + maxExpansions);
        this.maxExpansions = maxExpansions;
    }

    public long maxExpansions() {
        return maxExpansions;
    }

    // ====== PUBLIC API ====== //
    /**
     * Tokenizes {@code input} with the system's own factory and searches from its initial configuration.
     *
     * @return the number of derivations reported
     */
    public int parse(@NotNull ParsingSystem system, @NotNull String input, @NotNull DerivationListener listener) {
        Objects.requireNonNull(system, "system cannot be null");
        List<Token> tokens = system.tokenize(input);
        return search(system, system.initialConfiguration(tokens), listener);
    }

    /**
     * Same as {@link #parse(ParsingSystem, String, DerivationListener)}, collecting the derivations.
     */
    @NotNull
    public List<Derivation> parse(@NotNull ParsingSystem system, @NotNull String input) {
        List<Derivation> derivations = new ArrayList<>();
        parse(system, input, derivations::add);
        return derivations;
    }

    @NotNull
    public List<Derivation> collect(@NotNull ParsingSystem system, @NotNull Configuration start) {
        List<Derivation> derivations = new ArrayList<>();
        search(system, start, derivations::add);
        return derivations;
    }

    /**
     * Explores every branch reachable from {@code start} and hands each accepting configuration to
     * {@code listener} as soon as it is found.
     *
     * @return the number of derivations reported
     * @throws SearchLimitExceededException if the expansion ceiling is reached
     */
    public int search(@NotNull ParsingSystem system, @NotNull Configuration start, @NotNull DerivationListener listener) {
        Objects.requireNonNull(system, "system cannot be null");
        Objects.requireNonNull(start, "start cannot be null");
        Objects.requireNonNull(listener, "listener cannot be null");

        List<Token> input = start.buffer();
        Deque<Branch> pending = new ArrayDeque<>();
        pending.push(new Branch(start, null));

        long expansions = 0;
        long deadEnds = 0;
        int found = 0;
        while (!pending.isEmpty()) {
            if (maxExpansions != UNLIMITED && expansions >= maxExpansions) {
                throw new SearchLimitExceededException(maxExpansions, expansions, found);
            }
            Configuration configuration = pending.pop().resolve(system);
            expansions++;

            if (system.isAccepting(configuration)) {
                found++;
                listener.handleDerivation(Derivation.of(input, configuration));
                continue;
            }

            List<Transition> transitions = system.discoverTransitions(configuration);
            if (transitions.isEmpty()) {
                deadEnds++;
                continue;
            }
            for (int i = transitions.size() - 1; i >= 0; i--) {
                pending.push(new Branch(configuration, transitions.get(i)));
            }
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(system.getClass().getSimpleName() + " searched " + expansions + " configurations: "
                    + found + " derivations, " + deadEnds + " dead ends");
        }
        return found;
    }

    /**
     * A transition waiting to be applied. Applying it only when the branch is popped creates
     * tokens in the same order a recursive walk would.
     */
    private record Branch(Configuration parent, Transition via) {
        Configuration resolve(ParsingSystem system) {
            return via == null ? parent : system.applyTransition(parent, via);
        }
    }
}
