package com.viffx.ShiftReduce.Grammar;

/**
 * Which of the two top stack elements is the head of a dependency.
 */
public enum ArcDirection {
    /** The top is the head, the element below it is the dependent. */
    LA,
    /** The element below the top is the head, the top is the dependent. */
    RA;

    /**
     * Returns the direction named {@code token}, or {@code null} if it is neither {@code LA} nor {@code RA}.
     */
    public static ArcDirection fromToken(String token) {
        for (ArcDirection direction : values()) {
            if (direction.name().equals(token)) return direction;
        }
        return null;
    }
}
