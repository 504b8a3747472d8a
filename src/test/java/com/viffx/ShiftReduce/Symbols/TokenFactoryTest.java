package com.viffx.ShiftReduce.Symbols;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TokenFactoryTest {

    @Test
    public void ids_increase_in_creation_order() {
        TokenFactory factory = new TokenFactory();
        List<Token> created = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            created.add(factory.create(i % 2 == 0 ? "a" : "b"));
        }

        for (int i = 1; i < created.size(); i++) {
            assertTrue(created.get(i).id() > created.get(i - 1).id());
        }
        assertEquals(50, factory.peekNextId());
    }

    @Test
    public void tokenize_splits_on_any_whitespace() {
        TokenFactory factory = new TokenFactory(10);

        List<Token> tokens = factory.tokenize("  I saw\ther \n duck ");

        assertEquals(List.of("I", "saw", "her", "duck"), tokens.stream().map(Token::symbol).toList());
        assertEquals(10, tokens.get(0).id());
        assertEquals(13, tokens.get(3).id());
    }

    @Test
    public void tokenize_blank_input_is_empty() {
        TokenFactory factory = new TokenFactory();

        assertTrue(factory.tokenize("   ").isEmpty());
        assertEquals(0, factory.peekNextId());
    }

    @Test
    public void tokens_with_the_same_symbol_stay_distinct() {
        TokenFactory factory = new TokenFactory();
        Token first = factory.create("a");
        Token second = factory.create("a");

        assertNotEquals(first, second);
        assertEquals("0:a", first.label());
        assertEquals("1:a", second.label());
    }
}
