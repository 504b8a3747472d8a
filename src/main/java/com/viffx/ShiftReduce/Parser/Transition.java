package com.viffx.ShiftReduce.Parser;

import java.util.List;
import java.util.Objects;

/**
 * A move discovered for a {@link Configuration} but not yet applied to it.
 * <p>
 * Every variant carries a {@code target} symbol and a {@code source} pattern whose shape depends
 * on the kind of move:
 * <ul>
 *   <li>{@link Shift}: the consumed buffer terminal, or {@code ""} when the shifted token keeps its symbol.</li>
 *   <li>{@link Reduce}: the stack window being replaced, left to right.</li>
 *   <li>{@link LeftArc}, {@link RightArc}: the two top stack words, second from top first.</li>
 * </ul>
 */
public sealed interface Transition permits Transition.Shift, Transition.Reduce, Transition.LeftArc, Transition.RightArc {

    TransitionKind kind();

    /**
     * The symbol the move produces: a category for shifts and reduces, a relation for arcs.
     */
    String target();

    /**
     * Moves the first buffer token onto the stack.
     *
     * @param target the symbol of the token pushed onto the stack
     * @param source the terminal read from the buffer, {@code ""} if the token is moved unchanged
     */
    record Shift(String target, String source) implements Transition {
        public Shift {
            Objects.requireNonNull(target, "target cannot be null");
            Objects.requireNonNull(source, "source cannot be null");
        }

        @Override
        public TransitionKind kind() {
            return TransitionKind.SHIFT;
        }

        @Override
        public String toString() {
            return "SHIFT(" + (source.isEmpty() ? target : source + " -> " + target) + ")";
        }
    }

    /**
     * Replaces a run of stack symbols with a single new one.
     *
     * @param target       the left hand side the window reduces to
     * @param constituents the stack window, left to right
     */
    record Reduce(String target, List<String> constituents) implements Transition {
        public Reduce {
            Objects.requireNonNull(target, "target cannot be null");
            constituents = List.copyOf(constituents);
            if (constituents.isEmpty()) throw new IllegalArgumentException("A reduce needs at least one constituent");
        }

        @Override
        public TransitionKind kind() {
            return TransitionKind.REDUCE;
        }

        @Override
        public String toString() {
            return "REDUCE(" + String.join(" ", constituents) + " -> " + target + ")";
        }
    }

    /**
     * Draws an arc from the top of the stack to the element below it and removes that element.
     *
     * @param target    the relation of the arc
     * @param dependent the symbol second from the top
     * @param head      the symbol on top
     */
    record LeftArc(String target, String dependent, String head) implements Transition {
        public LeftArc {
            Objects.requireNonNull(target, "target cannot be null");
            Objects.requireNonNull(dependent, "dependent cannot be null");
            Objects.requireNonNull(head, "head cannot be null");
        }

        @Override
        public TransitionKind kind() {
            return TransitionKind.LEFT_ARC;
        }

        public List<String> source() {
            return List.of(dependent, head);
        }

        @Override
        public String toString() {
            return "LA(" + head + " -" + target + "-> " + dependent + ")";
        }
    }

    /**
     * Draws an arc from the element second from the top to the top and pops the top.
     *
     * @param target    the relation of the arc
     * @param head      the symbol second from the top
     * @param dependent the symbol on top
     */
    record RightArc(String target, String head, String dependent) implements Transition {
        public RightArc {
            Objects.requireNonNull(target, "target cannot be null");
            Objects.requireNonNull(head, "head cannot be null");
            Objects.requireNonNull(dependent, "dependent cannot be null");
        }

        @Override
        public TransitionKind kind() {
            return TransitionKind.RIGHT_ARC;
        }

        public List<String> source() {
            return List.of(head, dependent);
        }

        @Override
        public String toString() {
            return "RA(" + head + " -" + target + "-> " + dependent + ")";
        }
    }
}
