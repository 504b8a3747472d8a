package com.viffx.ShiftReduce.Parser;

/**
 * Receives accepted derivations while a {@link DerivationSearch} is still running.
 */
@FunctionalInterface
public interface DerivationListener {
    void handleDerivation(Derivation derivation);
}
