package com.viffx.ShiftReduce.Output;

import com.viffx.ShiftReduce.Parser.Derivation;
import com.viffx.ShiftReduce.Parser.DerivationListener;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Objects;

/**
 * Writes every derivation it receives as a block of lines:
 * <pre>
 *   Valid parse for the string: a a b b
 *   6:S-5:b
 *   ...
 *   (blank line)
 * </pre>
 * Trace lines come newest first. The writer is flushed after each block and never closed.
 */
public class DerivationPrinter implements DerivationListener {
    public static final String HEADER = "Valid parse for the string: ";

    private final Writer out;
    private int printed = 0;

    public DerivationPrinter(@NotNull Writer out) {
        this.out = Objects.requireNonNull(out, "out cannot be null");
    }

    /**
     * @throws UncheckedIOException if the underlying writer fails
     */
    @Override
    public void handleDerivation(Derivation derivation) {
        try {
            print(derivation);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write derivation " + (printed + 1), e);
        }
    }

    public void print(@NotNull Derivation derivation) throws IOException {
        StringBuilder builder = new StringBuilder();
        builder.append(HEADER).append(derivation.sentence()).append('\n');
        for (String line : derivation.lines()) {
            builder.append(line).append('\n');
        }
        builder.append('\n');

        out.write(builder.toString());
        out.flush();
        printed++;
    }

    public int printed() {
        return printed;
    }
}
