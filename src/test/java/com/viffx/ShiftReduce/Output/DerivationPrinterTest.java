package com.viffx.ShiftReduce.Output;

import com.viffx.ShiftReduce.Parser.Derivation;
import com.viffx.ShiftReduce.Symbols.Token;
import com.viffx.ShiftReduce.Symbols.TokenFactory;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DerivationPrinterTest {

    private static Derivation derivation(String sentence, String... lines) {
        List<Token> input = new TokenFactory().tokenize(sentence);
        return new Derivation(input, List.of(lines), input.get(0));
    }

    @Test
    public void prints_header_lines_and_a_blank_separator() {
        StringWriter out = new StringWriter();
        DerivationPrinter printer = new DerivationPrinter(out);

        printer.handleDerivation(derivation("a b", "3:S-2:b", "3:S-1:a"));

        assertEquals(String.join("\n",
                "Valid parse for the string: a b",
                "3:S-2:b",
                "3:S-1:a",
                "",
                ""), out.toString());
        assertEquals(1, printer.printed());
    }

    @Test
    public void consecutive_derivations_are_separated() {
        StringWriter out = new StringWriter();
        DerivationPrinter printer = new DerivationPrinter(out);

        printer.handleDerivation(derivation("x", "one"));
        printer.handleDerivation(derivation("x", "two"));

        assertEquals("Valid parse for the string: x\none\n\nValid parse for the string: x\ntwo\n\n", out.toString());
        assertEquals(2, printer.printed());
    }

    @Test
    public void write_failures_surface_unchecked() {
        Writer broken = new Writer() {
            @Override
            public void write(char[] buffer, int offset, int length) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void flush() {}

            @Override
            public void close() {}
        };
        DerivationPrinter printer = new DerivationPrinter(broken);

        UncheckedIOException e = assertThrows(UncheckedIOException.class,
                () -> printer.handleDerivation(derivation("x", "line")));
        assertEquals("disk full", e.getCause().getMessage());
        assertEquals(0, printer.printed());
    }
}
