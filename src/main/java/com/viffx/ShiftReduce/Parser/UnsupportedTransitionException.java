package com.viffx.ShiftReduce.Parser;

/**
 * Thrown when a parsing system is asked to apply a transition kind it never discovers itself.
 * This is a broken contract between caller and system, not a parse failure.
 */
public class UnsupportedTransitionException extends IllegalStateException {
    private final transient Transition transition;

    public UnsupportedTransitionException(ParsingSystem system, Transition transition) {
        super(system.getClass().getSimpleName() + " cannot apply " + transition.kind() + " transition " + transition);
        this.transition = transition;
    }

    public Transition transition() {
        return transition;
    }
}
