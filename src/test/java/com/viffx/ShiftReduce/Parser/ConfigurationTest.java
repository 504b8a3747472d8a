package com.viffx.ShiftReduce.Parser;

import com.viffx.ShiftReduce.Symbols.Token;
import com.viffx.ShiftReduce.Symbols.TokenFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigurationTest {

    @Test
    public void initial_configuration_holds_the_whole_input() {
        List<Token> tokens = new TokenFactory().tokenize("a b c");

        Configuration configuration = Configuration.initial(tokens);

        assertEquals(tokens, configuration.buffer());
        assertEquals(3, configuration.bufferSize());
        assertEquals(0, configuration.stackSize());
        assertTrue(configuration.trace().isEmpty());
    }

    @Test
    public void derived_configurations_leave_the_parent_alone() {
        TokenFactory factory = new TokenFactory();
        Configuration parent = Configuration.initial(factory.tokenize("a b"));
        Configuration snapshot = Configuration.initial(parent.buffer());

        Configuration child = parent.withBufferAdvanced()
                .withPushed(factory.create("X"))
                .withTrace("step");

        assertEquals(snapshot, parent);
        assertEquals(1, child.bufferSize());
        assertEquals("X", child.peek(0).symbol());
        assertEquals(List.of("step"), child.trace());
    }

    @Test
    public void stack_reads_bottom_to_top() {
        TokenFactory factory = new TokenFactory();
        Token a = factory.create("a");
        Token b = factory.create("b");
        Token c = factory.create("c");

        Configuration configuration = Configuration.initial(List.of()).withPushed(a).withPushed(b).withPushed(c);

        assertEquals(List.of(a, b, c), configuration.stack());
        assertEquals(c, configuration.peek(0));
        assertEquals(b, configuration.peek(1));
        assertEquals(List.of(a, c), configuration.withSecondRemoved().stack());
        assertEquals(List.of(a), configuration.withPopped(2).stack());
    }

    @Test
    public void trace_and_derivation_are_mirror_images() {
        Configuration configuration = Configuration.initial(List.of())
                .withTrace("first")
                .withTrace("second")
                .withTrace("third");

        assertEquals(List.of("first", "second", "third"), configuration.trace());
        assertEquals(List.of("third", "second", "first"), configuration.derivation());
    }

    @Test
    public void illegal_moves_throw() {
        Configuration empty = Configuration.initial(List.of());

        assertThrows(NoSuchElementException.class, empty::bufferHead);
        assertThrows(NoSuchElementException.class, empty::withBufferAdvanced);
        assertThrows(IndexOutOfBoundsException.class, () -> empty.withPopped(1));
        assertThrows(IndexOutOfBoundsException.class, empty::withSecondRemoved);
    }
}
