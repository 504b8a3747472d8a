package com.viffx.ShiftReduce.Grammar;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CfgGrammarTest {

    private static CfgGrammar read(String... lines) throws IOException {
        return CfgGrammar.load(new StringReader(String.join("\n", lines)), CfgGrammar.DEFAULT_START_SYMBOL);
    }

    @Test
    public void terminal_and_rule_lines_fill_their_tables() throws IOException {
        CfgGrammar grammar = read(
                "Det => the",
                "N => dog",
                "NP --> Det N"
        );

        assertEquals(List.of("Det"), grammar.lexicon("the"));
        assertEquals(List.of("N"), grammar.lexicon("dog"));
        assertEquals(List.of("NP"), grammar.rules(List.of("Det", "N")));
        assertEquals("S", grammar.startSymbol());
    }

    @Test
    public void repeated_keys_keep_every_candidate_in_order() throws IOException {
        CfgGrammar grammar = read(
                "Pro => her",
                "Det => her",
                "VP --> V NP",
                "S --> V NP"
        );

        assertEquals(List.of("Pro", "Det"), grammar.lexicon("her"));
        assertEquals(List.of("VP", "S"), grammar.rules(List.of("V", "NP")));
    }

    @Test
    public void malformed_lines_are_ignored() throws IOException {
        CfgGrammar grammar = read(
                "",
                "# comment line",
                "NP",
                "NP -->",
                "NP -> Det N",
                "Det => the extra fields",
                "   NP   -->   Det   N   "
        );

        assertEquals(List.of("Det"), grammar.lexicon("the"));
        assertEquals(List.of("NP"), grammar.rules(List.of("Det", "N")));
        assertEquals(1, grammar.lexicon().size());
        assertEquals(1, grammar.rules().size());
    }

    @Test
    public void unit_rules_are_kept() throws IOException {
        CfgGrammar grammar = read("NP --> Pro");

        assertEquals(List.of("NP"), grammar.rules(List.of("Pro")));
    }

    @Test
    public void misses_return_empty_lists() throws IOException {
        CfgGrammar grammar = read();

        assertTrue(grammar.lexicon("anything").isEmpty());
        assertTrue(grammar.rules(List.of("A", "B")).isEmpty());
    }

    @Test
    public void tables_cannot_be_modified() throws IOException {
        CfgGrammar grammar = read("Det => the", "NP --> Det N");

        assertThrows(UnsupportedOperationException.class, () -> grammar.lexicon("the").add("X"));
        assertThrows(UnsupportedOperationException.class, () -> grammar.rules().clear());
    }

    @Test
    public void builder_rejects_empty_right_hand_sides() {
        assertThrows(IllegalArgumentException.class, () -> CfgGrammar.builder().addRule("S", List.of()));
    }

    @Test
    public void load_reads_files_with_a_custom_start_symbol() throws IOException, URISyntaxException {
        Path path = Path.of(getClass().getResource("/grammars/isawherduck.txt").toURI());

        CfgGrammar grammar = CfgGrammar.load(path, StandardCharsets.UTF_8, "VP");

        assertEquals("VP", grammar.startSymbol());
        assertEquals(List.of("N", "V"), grammar.lexicon("duck"));
        assertEquals(List.of("VP"), grammar.rules(List.of("V", "S")));
    }
}
